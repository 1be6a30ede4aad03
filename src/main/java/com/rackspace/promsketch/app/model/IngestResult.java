/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.promsketch.app.model;

import lombok.Data;

/**
 * Outcome of ingesting a batch or part of one; only successful insertions count as ingested.
 */
@Data
public class IngestResult {
  public static final IngestResult EMPTY = new IngestResult(0, 0);

  final long ingested;
  final long failed;

  public IngestResult plus(IngestResult other) {
    return new IngestResult(ingested + other.ingested, failed + other.failed);
  }

  public static IngestResult failed(long count) {
    return new IngestResult(0, count);
  }
}
