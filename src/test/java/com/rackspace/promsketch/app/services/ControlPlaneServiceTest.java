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


package com.rackspace.promsketch.app.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.promsketch.app.config.AppProperties;
import com.rackspace.promsketch.app.config.SketchProperties;
import com.rackspace.promsketch.app.exceptions.ReservedAddressException;
import com.rackspace.promsketch.app.model.RegisterConfigRequest;
import com.rackspace.promsketch.app.model.RegisterConfigResponse;
import com.rackspace.promsketch.app.partition.PartitionListener;
import com.rackspace.promsketch.app.partition.PartitionListenerFactory;
import com.rackspace.promsketch.app.partition.PartitionNode;
import com.rackspace.promsketch.app.partition.PartitionTable;
import com.rackspace.promsketch.app.sketch.WindowedSketchEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class ControlPlaneServiceTest {

  AppProperties appProperties = new AppProperties()
      .setBasePort(9100)
      .setMachinesPerPartition(10)
      .setMaxPartitions(20);
  SketchProperties sketchProperties = new SketchProperties();
  PartitionTable partitionTable = new PartitionTable(appProperties, new SimpleMeterRegistry());
  FakeListenerFactory listenerFactory = new FakeListenerFactory();
  ControlPlaneService controlPlaneService = new ControlPlaneService(
      appProperties, sketchProperties, partitionTable, listenerFactory,
      new WindowedSketchEngine());

  @AfterEach
  void tearDown() {
    partitionTable.destroy();
  }

  private static RegisterConfigRequest request(long estimatedTimeseries) {
    return new RegisterConfigRequest().setEstimatedTimeseries(estimatedTimeseries);
  }

  @Test
  void provisionsPartitionsForCapacity() {
    final RegisterConfigResponse response = controlPlaneService.register(request(25));

    assertThat(response.getStatus()).isEqualTo("success");
    assertThat(response.getPartitions()).isEqualTo(3);
    assertThat(response.getMachinesPerPort()).isEqualTo(10);
    assertThat(response.getPortsActive()).containsExactly(9100, 9101, 9102);
    assertThat(response.getPortsProvisioned()).containsExactly(9100, 9101, 9102);
    assertThat(listenerFactory.started.get()).isEqualTo(3);
    assertThat(partitionTable.getNode(9102)).isPresent();
  }

  @Test
  void repeatedRegistrationIsIdempotent() {
    controlPlaneService.register(request(25));

    final RegisterConfigResponse again = controlPlaneService.register(request(25));
    final RegisterConfigResponse smaller = controlPlaneService.register(request(5));

    assertThat(again.getPortsProvisioned()).isEmpty();
    assertThat(again.getPortsActive()).containsExactly(9100, 9101, 9102);
    assertThat(smaller.getPortsProvisioned()).isEmpty();
    assertThat(smaller.getPartitions()).isEqualTo(3);
    assertThat(listenerFactory.started.get()).isEqualTo(3);
  }

  @Test
  void growsOnlyTheMissingPartitions() {
    controlPlaneService.register(request(25));

    final RegisterConfigResponse response = controlPlaneService.register(request(35));

    assertThat(response.getPortsProvisioned()).containsExactly(9103);
    assertThat(response.getPortsActive()).containsExactly(9100, 9101, 9102, 9103);
  }

  @Test
  void zeroCapacityProvisionsNothing() {
    final RegisterConfigResponse response = controlPlaneService.register(request(0));

    assertThat(response.getPartitions()).isZero();
    assertThat(response.getPortsActive()).isEmpty();
    assertThat(listenerFactory.started.get()).isZero();
  }

  @Test
  void hugeCapacityHintIsRejected() {
    assertThatThrownBy(() -> controlPlaneService.register(request(Long.MAX_VALUE)))
        .isInstanceOf(IllegalArgumentException.class);

    assertThat(partitionTable.getPlan().size()).isZero();
    assertThat(listenerFactory.started.get()).isZero();
  }

  @Test
  void concurrentRegistrationsConverge() throws Exception {
    final int threads = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    final CountDownLatch ready = new CountDownLatch(1);
    try {
      final List<Future<RegisterConfigResponse>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(executor.submit(() -> {
          ready.await();
          return controlPlaneService.register(request(50));
        }));
      }
      ready.countDown();

      int provisioned = 0;
      for (Future<RegisterConfigResponse> future : futures) {
        final RegisterConfigResponse response = future.get();
        assertThat(response.getPartitions()).isEqualTo(5);
        provisioned += response.getPortsProvisioned().size();
      }
      assertThat(provisioned).isEqualTo(5);
      assertThat(listenerFactory.started.get()).isEqualTo(5);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void mismatchedPartitionSizeIsRejected() {
    assertThatThrownBy(() -> controlPlaneService.register(request(25).setMachinesPerPort(50)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("machines_per_port 50");
    assertThat(partitionTable.getPlan().size()).isZero();
  }

  @Test
  void matchingOptionalFieldsAreAccepted() {
    final RegisterConfigResponse response = controlPlaneService.register(request(10)
        .setMachinesPerPort(10)
        .setStartPort(9100)
        .setNumTargets(10));

    assertThat(response.getPartitions()).isEqualTo(1);
  }

  @Test
  void mismatchedStartPortIsRejected() {
    assertThatThrownBy(() -> controlPlaneService.register(request(25).setStartPort(8000)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("start_port 8000");
  }

  @Test
  void capacityBeyondMaximumIsRejected() {
    assertThatThrownBy(() -> controlPlaneService.register(request(1000)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("more than the allowed 20");
    assertThat(listenerFactory.started.get()).isZero();
  }

  @Test
  void reservedPortStopsProvisioning() {
    appProperties.setReservedPorts(Set.of(9101));

    assertThatThrownBy(() -> controlPlaneService.register(request(25)))
        .isInstanceOf(ReservedAddressException.class);
    assertThat(partitionTable.getPlan().size()).isZero();
    assertThat(listenerFactory.started.get()).isZero();
  }

  @Test
  void failedBindingLeavesTableUnchanged() {
    listenerFactory.failOnPort = 9102;

    assertThatThrownBy(() -> controlPlaneService.register(request(25)))
        .isInstanceOf(IllegalStateException.class);

    assertThat(partitionTable.getPlan().size()).isZero();
    assertThat(partitionTable.getNodes()).isEmpty();
    assertThat(listenerFactory.closed.get()).isEqualTo(2);
  }

  @Test
  void eagerMetricsGetSketchesAtProvisioning() {
    sketchProperties.setEagerMetrics(List.of("cpu"));

    controlPlaneService.register(request(10));

    final PartitionNode node = partitionTable.getNode(9100).orElseThrow();
    assertThat(node.getSketchCount())
        .isEqualTo(10 * sketchProperties.getFunctions().size());
  }

  @Test
  void registerConfigRunsAsynchronously() {
    StepVerifier.create(controlPlaneService.registerConfig(request(15)))
        .assertNext(response -> assertThat(response.getPortsActive()).containsExactly(9100, 9101))
        .verifyComplete();
  }

  static class FakeListenerFactory implements PartitionListenerFactory {

    final AtomicInteger started = new AtomicInteger();
    final AtomicInteger closed = new AtomicInteger();
    volatile int failOnPort = -1;

    @Override
    public PartitionListener start(PartitionNode node) {
      if (node.getPort() == failOnPort) {
        throw new IllegalStateException("Unable to bind partition listener on port " + failOnPort);
      }
      started.incrementAndGet();
      return new PartitionListener() {
        @Override
        public int getPort() {
          return node.getPort();
        }

        @Override
        public void close() {
          closed.incrementAndGet();
        }
      };
    }
  }
}
