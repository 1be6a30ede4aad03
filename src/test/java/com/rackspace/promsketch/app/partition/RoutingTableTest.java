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

import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.promsketch.app.config.AppProperties;
import com.rackspace.promsketch.app.config.SketchProperties;
import com.rackspace.promsketch.app.sketch.WindowedSketchEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RoutingTableTest {

  AppProperties appProperties = new AppProperties()
      .setMachinesPerPartition(200);
  PartitionTable partitionTable = new PartitionTable(appProperties, new SimpleMeterRegistry());
  RoutingTable routingTable = new RoutingTable(partitionTable, appProperties);

  private void provision(int partitions) {
    partitionTable.ensureCapacity(partitions, assignment -> new PartitionNode(
        assignment, new WindowedSketchEngine(), new SketchProperties(), appProperties));
  }

  @Test
  void routesByMachineIndexRange() {
    provision(2);

    assertThat(routingTable.route("machine_0")).get()
        .extracting(PartitionAssignment::getPort).isEqualTo(7100);
    assertThat(routingTable.route("machine_199")).get()
        .extracting(PartitionAssignment::getPort).isEqualTo(7100);
    assertThat(routingTable.route("machine_200")).get()
        .extracting(PartitionAssignment::getPort).isEqualTo(7101);
    assertThat(routingTable.route("machine_400")).isEmpty();
  }

  @Test
  void unparsableMachineMapsToFirstMachine() {
    provision(1);

    assertThat(routingTable.route("host-a")).get()
        .extracting(PartitionAssignment::getIndex).isEqualTo(0);
    assertThat(routingTable.route((String) null)).get()
        .extracting(PartitionAssignment::getIndex).isEqualTo(0);
  }

  @Test
  void neverRoutesToControlPort() {
    provision(5);

    for (int machine = 0; machine < 1000; machine++) {
      assertThat(routingTable.route("machine_" + machine)).get()
          .extracting(PartitionAssignment::getPort)
          .isNotEqualTo(appProperties.getControlPort());
    }
  }

  @Test
  void growthDoesNotMoveMachines() {
    provision(1);
    final PartitionAssignment before = routingTable.route("machine_150").orElseThrow();

    provision(4);

    assertThat(routingTable.route("machine_150")).contains(before);
  }

  @Test
  void resolvesNodeOfSeries() {
    provision(2);
    final SeriesIdentity identity =
        SeriesIdentity.of("__name__", "cpu", Map.of("machineid", "machine_250"));

    assertThat(routingTable.nodeFor(identity)).get()
        .extracting(PartitionNode::getPort).isEqualTo(7101);
  }
}
