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

import com.rackspace.promsketch.app.config.AppProperties;
import com.rackspace.promsketch.app.config.SketchProperties;
import com.rackspace.promsketch.app.model.RegisterConfigRequest;
import com.rackspace.promsketch.app.model.RegisterConfigResponse;
import com.rackspace.promsketch.app.partition.PartitionAssignment;
import com.rackspace.promsketch.app.partition.PartitionListenerFactory;
import com.rackspace.promsketch.app.partition.PartitionNode;
import com.rackspace.promsketch.app.partition.PartitionPlan;
import com.rackspace.promsketch.app.partition.PartitionTable;
import com.rackspace.promsketch.app.partition.PartitionTable.Provisioning;
import com.rackspace.promsketch.app.sketch.SketchEngine;
import java.util.stream.Collectors;
import javax.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Turns capacity registrations into provisioned partitions.
 */
@Service
@Slf4j
public class ControlPlaneService {

  private final AppProperties appProperties;
  private final SketchProperties sketchProperties;
  private final PartitionTable partitionTable;
  private final PartitionListenerFactory listenerFactory;
  private final SketchEngine sketchEngine;

  @Autowired
  public ControlPlaneService(AppProperties appProperties,
                             SketchProperties sketchProperties,
                             PartitionTable partitionTable,
                             PartitionListenerFactory listenerFactory,
                             SketchEngine sketchEngine) {
    this.appProperties = appProperties;
    this.sketchProperties = sketchProperties;
    this.partitionTable = partitionTable;
    this.listenerFactory = listenerFactory;
    this.sketchEngine = sketchEngine;
  }

  @PostConstruct
  public void printConfigurations() {
    log.info("control-port: {}", appProperties.getControlPort());
    log.info("base-port: {}", appProperties.getBasePort());
    log.info("machines-per-partition: {}", appProperties.getMachinesPerPartition());
    log.info("reserved-ports: {}", appProperties.getReservedPorts());
    log.info("sketch functions: {}", sketchProperties.getFunctions());
  }

  /**
   * Registers a capacity hint. Partition table growth and listener binding block, so the work
   * runs on the bounded elastic scheduler.
   */
  public Mono<RegisterConfigResponse> registerConfig(RegisterConfigRequest request) {
    return Mono.fromCallable(() -> register(request))
        .subscribeOn(Schedulers.boundedElastic())
        .name("registerConfig")
        .metrics();
  }

  /**
   * Grows the partition table to cover the capacity hint. Registering an equal or smaller hint
   * again changes nothing.
   *
   * @throws IllegalArgumentException if the request conflicts with the configured partition
   * layout or needs more partitions than allowed
   */
  public RegisterConfigResponse register(RegisterConfigRequest request) {
    final int machinesPerPartition = appProperties.getMachinesPerPartition();
    if (request.getEstimatedTimeseries() == null || request.getEstimatedTimeseries() < 0) {
      throw new IllegalArgumentException("estimated_timeseries must be a non-negative number");
    }
    if (request.getMachinesPerPort() != null
        && request.getMachinesPerPort() != machinesPerPartition) {
      throw new IllegalArgumentException(String.format(
          "machines_per_port %d does not match the configured partition size %d",
          request.getMachinesPerPort(), machinesPerPartition));
    }
    if (request.getStartPort() != null && request.getStartPort() != appProperties.getBasePort()) {
      throw new IllegalArgumentException(String.format(
          "start_port %d does not match the configured base port %d",
          request.getStartPort(), appProperties.getBasePort()));
    }

    final int required = PartitionPlan.requiredPartitions(
        request.getEstimatedTimeseries(), machinesPerPartition);
    if (required > appProperties.getMaxPartitions()) {
      throw new IllegalArgumentException(String.format(
          "estimated_timeseries %d needs %d partitions, more than the allowed %d",
          request.getEstimatedTimeseries(), required, appProperties.getMaxPartitions()));
    }

    log.debug("Registering estimated_timeseries={} num_targets={} requiring {} partitions",
        request.getEstimatedTimeseries(), request.getNumTargets(), required);

    final Provisioning provisioning = partitionTable.ensureCapacity(required, this::provision);

    return new RegisterConfigResponse()
        .setStatus("success")
        .setPortsActive(provisioning.getPlan().getPorts())
        .setPortsProvisioned(provisioning.getAdded().stream()
            .map(PartitionAssignment::getPort)
            .collect(Collectors.toList()))
        .setPartitions(provisioning.getPlan().size())
        .setMachinesPerPort(machinesPerPartition);
  }

  private PartitionNode provision(PartitionAssignment assignment) {
    final PartitionNode node =
        new PartitionNode(assignment, sketchEngine, sketchProperties, appProperties);
    if (!sketchProperties.getEagerMetrics().isEmpty()) {
      node.createSketches(sketchProperties.getEagerMetrics());
    }
    node.attach(listenerFactory.start(node));
    log.info("Provisioned partition {} for machines [{}, {}] at {}",
        assignment.getIndex(), assignment.getFirstMachine(), assignment.getLastMachine(),
        assignment.getAddress());
    return node;
  }
}
