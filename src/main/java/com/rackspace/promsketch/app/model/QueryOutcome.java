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

import java.util.List;
import lombok.Data;

@Data
public class QueryOutcome {

  public enum Status {
    RESULT,
    PENDING
  }

  final Status status;
  final CoverageState coverage;
  final List<SamplePoint> samples;
  final List<String> annotations;
  final String message;

  public boolean isPending() {
    return status == Status.PENDING;
  }

  public static QueryOutcome pending(CoverageState coverage, String message) {
    return new QueryOutcome(Status.PENDING, coverage, List.of(), List.of(), message);
  }

  public static QueryOutcome result(List<SamplePoint> samples, List<String> annotations) {
    return new QueryOutcome(Status.RESULT, CoverageState.COVERED, samples, annotations, null);
  }
}
