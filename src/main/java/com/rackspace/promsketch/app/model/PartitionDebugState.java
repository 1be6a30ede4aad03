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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.Data;

@Data
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PartitionDebugState {
  public static final String STATUS_OK = "ok";
  public static final String STATUS_DEGRADED = "degraded";

  int port;
  int firstMachine;
  int lastMachine;
  String status;
  String error;
  Integer sketchCount;
  Integer seriesCount;
  Long ingestedTotal;
  Long failedTotal;
  Long lastInsertTime;
  List<MachineCoverage> machines;

  public static PartitionDebugState degraded(int port, int firstMachine, int lastMachine,
                                             String error) {
    return new PartitionDebugState()
        .setPort(port)
        .setFirstMachine(firstMachine)
        .setLastMachine(lastMachine)
        .setStatus(STATUS_DEGRADED)
        .setError(error);
  }
}
