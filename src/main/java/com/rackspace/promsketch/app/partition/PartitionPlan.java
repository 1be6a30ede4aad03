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

import com.google.common.math.LongMath;
import com.google.common.primitives.Ints;
import com.rackspace.promsketch.app.exceptions.ReservedAddressException;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;

/**
 * Immutable assignment of contiguous machine ranges to partition listeners. Partition
 * <code>i</code> owns machines <code>[i * machinesPerPartition, (i + 1) * machinesPerPartition -
 * 1]</code> and listens on <code>basePort + i</code>. Plans only ever grow, so an assignment once
 * published never changes.
 */
public class PartitionPlan {

  private final int machinesPerPartition;
  private final int basePort;
  private final String host;
  private final List<PartitionAssignment> assignments;
  private final NavigableMap<Integer, PartitionAssignment> byFirstMachine;

  private PartitionPlan(int machinesPerPartition, int basePort, String host,
                        List<PartitionAssignment> assignments) {
    this.machinesPerPartition = machinesPerPartition;
    this.basePort = basePort;
    this.host = host;
    this.assignments = Collections.unmodifiableList(assignments);
    final TreeMap<Integer, PartitionAssignment> index = new TreeMap<>();
    assignments.forEach(assignment -> index.put(assignment.getFirstMachine(), assignment));
    this.byFirstMachine = Collections.unmodifiableNavigableMap(index);
  }

  public static PartitionPlan empty(int machinesPerPartition, int basePort, String host) {
    if (machinesPerPartition < 1) {
      throw new IllegalArgumentException(
          "machinesPerPartition must be positive, got " + machinesPerPartition);
    }
    return new PartitionPlan(machinesPerPartition, basePort, host, List.of());
  }

  /**
   * @return the number of partitions needed for the given number of series, rounded up
   * @throws IllegalArgumentException if that number does not fit in an int
   */
  public static int requiredPartitions(long estimatedSeries, int machinesPerPartition) {
    if (estimatedSeries <= 0) {
      return 0;
    }
    return Ints.checkedCast(
        LongMath.divide(estimatedSeries, machinesPerPartition, RoundingMode.CEILING));
  }

  /**
   * Returns a plan holding at least <code>partitions</code> partitions. Existing assignments are
   * carried over unchanged and this plan is returned as-is when it is already large enough.
   *
   * @param reserved identifies ports that must never be assigned
   * @throws ReservedAddressException if a new partition would be assigned a reserved or
   * out-of-range port, in which case no partition is added
   */
  public PartitionPlan extendTo(int partitions, IntPredicate reserved) {
    if (partitions <= assignments.size()) {
      return this;
    }
    final List<PartitionAssignment> extended = new ArrayList<>(assignments);
    for (int i = assignments.size(); i < partitions; i++) {
      final int port = basePort + i;
      if (port > 65535 || reserved.test(port)) {
        throw new ReservedAddressException(String.format(
            "Partition %d would be assigned port %d, which is reserved or out of range", i, port));
      }
      extended.add(new PartitionAssignment(
          i,
          i * machinesPerPartition,
          (i + 1) * machinesPerPartition - 1,
          host,
          port
      ));
    }
    return new PartitionPlan(machinesPerPartition, basePort, host, extended);
  }

  /**
   * Resolves the partition owning a machine. The result depends only on this plan.
   */
  public Optional<PartitionAssignment> route(int machineIndex) {
    final Map.Entry<Integer, PartitionAssignment> entry = byFirstMachine.floorEntry(machineIndex);
    if (entry == null || !entry.getValue().owns(machineIndex)) {
      return Optional.empty();
    }
    return Optional.of(entry.getValue());
  }

  public List<PartitionAssignment> getAssignments() {
    return assignments;
  }

  public List<Integer> getPorts() {
    return assignments.stream()
        .map(PartitionAssignment::getPort)
        .collect(Collectors.toList());
  }

  public int size() {
    return assignments.size();
  }

  public int getMachinesPerPartition() {
    return machinesPerPartition;
  }

  public int getBasePort() {
    return basePort;
  }
}
