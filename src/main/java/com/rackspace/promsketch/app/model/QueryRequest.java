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

import com.rackspace.promsketch.app.sketch.SketchFunction;
import java.util.Map;
import lombok.Data;

/**
 * A resolved query: function, series selector and an absolute window in epoch milliseconds.
 */
@Data
public class QueryRequest {
  SketchFunction function;
  String metric;
  Map<String, String> labels;
  long mint;
  long maxt;
  Double argument;
}
