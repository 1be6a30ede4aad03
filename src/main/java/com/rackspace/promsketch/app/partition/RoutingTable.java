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


package com.rackspace.promsketch.app.partition;

import com.rackspace.promsketch.app.config.AppProperties;
import com.rackspace.promsketch.app.utils.MachineIdUtils;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Maps machine identities to the partition owning them. Every lookup uses a single plan
 * snapshot, so the answer depends only on the plan current at the time of the call.
 */
@Component
public class RoutingTable {

  private final PartitionTable partitionTable;
  private final AppProperties appProperties;

  public RoutingTable(PartitionTable partitionTable, AppProperties appProperties) {
    this.partitionTable = partitionTable;
    this.appProperties = appProperties;
  }

  public Optional<PartitionAssignment> route(String machineId) {
    return partitionTable.getPlan()
        .route(MachineIdUtils.machineIndex(machineId, appProperties.getMachineIdPrefix()));
  }

  public Optional<PartitionAssignment> route(SeriesIdentity identity) {
    return route(identity.get(appProperties.getMachineIdLabel()));
  }

  public Optional<PartitionNode> nodeFor(SeriesIdentity identity) {
    return route(identity).flatMap(assignment -> partitionTable.getNode(assignment.getPort()));
  }
}
