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
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

/**
 * The single authoritative record of provisioned partitions. Growth is serialized by a lock and
 * decided from the current partition count, so racing registrations converge on the same plan
 * and no partition is provisioned twice. Readers see immutable plan snapshots without locking.
 */
@Component
@Slf4j
public class PartitionTable implements DisposableBean {

  private final AppProperties appProperties;
  private final Lock provisioningLock = new ReentrantLock();
  private final Map<Integer, PartitionNode> nodes = new ConcurrentHashMap<>();
  private volatile PartitionPlan plan;

  public PartitionTable(AppProperties appProperties, MeterRegistry meterRegistry) {
    this.appProperties = appProperties;
    this.plan = PartitionPlan.empty(
        appProperties.getMachinesPerPartition(),
        appProperties.getBasePort(),
        appProperties.getAdvertisedHost()
    );
    Gauge.builder("promsketch.partitions", this, table -> table.getPlan().size())
        .description("Number of provisioned partitions")
        .register(meterRegistry);
  }

  public PartitionPlan getPlan() {
    return plan;
  }

  public Optional<PartitionNode> getNode(int port) {
    return Optional.ofNullable(nodes.get(port));
  }

  /**
   * @return the nodes of the current plan, in partition order
   */
  public List<PartitionNode> getNodes() {
    final List<PartitionNode> result = new ArrayList<>();
    for (PartitionAssignment assignment : plan.getAssignments()) {
      final PartitionNode node = nodes.get(assignment.getPort());
      if (node != null) {
        result.add(node);
      }
    }
    return result;
  }

  /**
   * Grows the table to at least <code>required</code> partitions, provisioning only the missing
   * ones. Nothing is published until every missing partition has been provisioned; if one
   * fails, the ones provisioned by this call are closed and the table is left unchanged.
   *
   * @param provisioner creates the node of a new assignment and returns it once it is serving
   * @throws com.rackspace.promsketch.app.exceptions.ReservedAddressException if a missing
   * partition would be assigned a reserved port
   */
  public Provisioning ensureCapacity(int required,
                                     Function<PartitionAssignment, PartitionNode> provisioner) {
    provisioningLock.lock();
    try {
      final PartitionPlan current = plan;
      if (required <= current.size()) {
        return new Provisioning(current, List.of());
      }

      final PartitionPlan extended = current.extendTo(required, appProperties::isReserved);
      final List<PartitionAssignment> added =
          extended.getAssignments().subList(current.size(), extended.size());

      final List<PartitionNode> started = new ArrayList<>();
      try {
        for (PartitionAssignment assignment : added) {
          started.add(provisioner.apply(assignment));
        }
      } catch (RuntimeException e) {
        log.warn("Provisioning partitions {}..{} failed, closing {} started",
            current.size(), required - 1, started.size(), e);
        started.forEach(PartitionNode::close);
        throw e;
      }

      // nodes become visible before the plan that routes to them
      started.forEach(node -> nodes.put(node.getPort(), node));
      plan = extended;

      log.info("Partition table grew from {} to {} partitions", current.size(), extended.size());
      return new Provisioning(extended, List.copyOf(added));
    } finally {
      provisioningLock.unlock();
    }
  }

  @Override
  public void destroy() {
    log.debug("Closing {} partition listeners", nodes.size());
    nodes.values().forEach(PartitionNode::close);
  }

  @Data
  public static class Provisioning {
    final PartitionPlan plan;
    final List<PartitionAssignment> added;
  }
}
