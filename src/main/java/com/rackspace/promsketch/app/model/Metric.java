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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;
import lombok.Data;

/**
 * One sample of an ingest batch. The field names are accepted either capitalized, as scrape
 * clients send them, or in lower case.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Metric {
  @JsonAlias("Name")
  String name;
  @JsonAlias("Labels")
  Map<String, String> labels;
  @JsonAlias("Value")
  Double value;
}
