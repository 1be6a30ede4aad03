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
import com.rackspace.promsketch.app.config.SketchProperties;
import com.rackspace.promsketch.app.model.IngestBatch;
import com.rackspace.promsketch.app.model.IngestResult;
import com.rackspace.promsketch.app.model.MachineCoverage;
import com.rackspace.promsketch.app.model.Metric;
import com.rackspace.promsketch.app.model.PartitionDebugState;
import com.rackspace.promsketch.app.sketch.SketchConfig;
import com.rackspace.promsketch.app.sketch.SketchEngine;
import com.rackspace.promsketch.app.sketch.SketchFunction;
import com.rackspace.promsketch.app.utils.MachineIdUtils;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Owns the sketch instances of the machines in one partition range and is the only component
 * that creates, updates or evaluates them.
 */
@Slf4j
public class PartitionNode {

  @Getter
  private final PartitionAssignment assignment;
  private final SketchEngine sketchEngine;
  private final SketchConfig sketchConfig;
  private final List<SketchFunction> functions;
  private final String metricNameLabel;
  private final String machineIdLabel;
  private final String machineIdPrefix;

  private final ConcurrentMap<SketchKey, SketchInstance> sketches = new ConcurrentHashMap<>();
  private final LongAdder ingestedTotal = new LongAdder();
  private final LongAdder failedTotal = new LongAdder();

  @Getter
  private volatile PartitionListener listener;

  public PartitionNode(PartitionAssignment assignment, SketchEngine sketchEngine,
                       SketchProperties sketchProperties, AppProperties appProperties) {
    this.assignment = assignment;
    this.sketchEngine = sketchEngine;
    this.sketchConfig = sketchProperties.toSketchConfig();
    this.functions = List.copyOf(sketchProperties.getFunctions());
    this.metricNameLabel = appProperties.getMetricNameLabel();
    this.machineIdLabel = appProperties.getMachineIdLabel();
    this.machineIdPrefix = appProperties.getMachineIdPrefix();
  }

  public int getPort() {
    return assignment.getPort();
  }

  public void attach(PartitionListener listener) {
    this.listener = listener;
  }

  void close() {
    final PartitionListener current = listener;
    if (current != null) {
      current.close();
    }
  }

  public SeriesIdentity identityOf(String metricName, Map<String, String> labels) {
    return SeriesIdentity.of(metricNameLabel, metricName, labels);
  }

  public int machineIndexOf(SeriesIdentity identity) {
    return MachineIdUtils.machineIndex(identity.get(machineIdLabel), machineIdPrefix);
  }

  /**
   * Inserts every sample of the batch. A sample that cannot be inserted is logged and counted
   * as failed without affecting the rest of the batch.
   */
  public IngestResult ingest(IngestBatch batch) {
    long ingested = 0;
    long failed = 0;
    for (Metric metric : batch.getMetrics()) {
      try {
        ingest(batch.getTimestamp(), metric);
        ingested++;
      } catch (RuntimeException e) {
        failed++;
        log.warn("Partition {} skipped sample {} at {}: {}",
            assignment.getPort(), metric, batch.getTimestamp(), e.getMessage());
      }
    }
    ingestedTotal.add(ingested);
    failedTotal.add(failed);
    log.trace("Partition {} ingested={} failed={}", assignment.getPort(), ingested, failed);
    return new IngestResult(ingested, failed);
  }

  /**
   * Inserts one sample into the sketch of every function of interest. All of those sketches are
   * resolved before the first insert, so a sketch that cannot be created leaves the others of
   * the series untouched.
   *
   * @throws IllegalArgumentException if the sample is malformed, belongs to a machine outside
   * this partition or is rejected by a sketch
   */
  public void ingest(long timestamp, Metric metric) {
    if (metric == null || !StringUtils.hasText(metric.getName())) {
      throw new IllegalArgumentException("Sample has no metric name");
    }
    if (metric.getValue() == null || !Double.isFinite(metric.getValue())) {
      throw new IllegalArgumentException("Sample value must be finite, got " + metric.getValue());
    }
    final SeriesIdentity identity = identityOf(metric.getName(), metric.getLabels());
    final int machine = machineIndexOf(identity);
    if (!assignment.owns(machine)) {
      throw new IllegalArgumentException(String.format(
          "Machine %d is outside the range [%d, %d] of this partition",
          machine, assignment.getFirstMachine(), assignment.getLastMachine()));
    }
    final List<SketchInstance> targets = new ArrayList<>(functions.size());
    for (SketchFunction function : functions) {
      targets.add(sketchFor(identity, function));
    }
    for (SketchInstance target : targets) {
      target.insert(timestamp, metric.getValue());
    }
  }

  private SketchInstance sketchFor(SeriesIdentity identity, SketchFunction function) {
    return sketches.computeIfAbsent(new SketchKey(identity, function),
        key -> new SketchInstance(identity, function,
            sketchEngine.newSketch(function, sketchConfig)));
  }

  /**
   * Creates, ahead of any ingest, the sketches of the given metrics for every machine of this
   * partition.
   */
  public void createSketches(Collection<String> metricNames) {
    for (String metricName : metricNames) {
      for (int machine = assignment.getFirstMachine(); machine <= assignment.getLastMachine();
          machine++) {
        final SeriesIdentity identity = identityOf(metricName,
            Map.of(machineIdLabel, MachineIdUtils.machineId(machine, machineIdPrefix)));
        functions.forEach(function -> sketchFor(identity, function));
      }
    }
    log.debug("Partition {} created sketches for {}", assignment.getPort(), metricNames);
  }

  /**
   * Finds the sketch able to answer the requested function for a series, preferring a sketch
   * kept for that exact function over another one of the same family.
   */
  public Optional<SketchInstance> findSketch(SeriesIdentity identity, SketchFunction requested) {
    final SketchInstance exact = sketches.get(new SketchKey(identity, requested));
    if (exact != null) {
      return Optional.of(exact);
    }
    return functions.stream()
        .filter(function -> function.getFamily() == requested.getFamily())
        .map(function -> sketches.get(new SketchKey(identity, function)))
        .filter(instance -> instance != null)
        .findFirst();
  }

  public long getIngestedTotal() {
    return ingestedTotal.sum();
  }

  public int getSketchCount() {
    return sketches.size();
  }

  public PartitionDebugState debugState() {
    final List<SketchInstance> instances = new ArrayList<>(sketches.values());
    final Map<String, List<SketchInstance>> byMachine = instances.stream()
        .collect(Collectors.groupingBy(
            instance -> String.valueOf(instance.getIdentity().get(machineIdLabel)),
            TreeMap::new,
            Collectors.toList()));

    final List<MachineCoverage> machines = new ArrayList<>();
    for (Entry<String, List<SketchInstance>> entry : byMachine.entrySet()) {
      machines.add(machineCoverage(entry.getKey(), entry.getValue()));
    }

    final long lastInsert = instances.stream()
        .mapToLong(SketchInstance::getLastInsertTime)
        .max()
        .orElse(0);

    return new PartitionDebugState()
        .setPort(assignment.getPort())
        .setFirstMachine(assignment.getFirstMachine())
        .setLastMachine(assignment.getLastMachine())
        .setStatus(PartitionDebugState.STATUS_OK)
        .setSketchCount(instances.size())
        .setSeriesCount((int) instances.stream().map(SketchInstance::getIdentity).distinct().count())
        .setIngestedTotal(ingestedTotal.sum())
        .setFailedTotal(failedTotal.sum())
        .setLastInsertTime(lastInsert > 0 ? lastInsert : null)
        .setMachines(machines);
  }

  private static MachineCoverage machineCoverage(String machine, List<SketchInstance> instances) {
    final List<CoverageInterval> observed = instances.stream()
        .map(SketchInstance::getCoverage)
        .filter(coverage -> !coverage.isEmpty())
        .collect(Collectors.toList());

    return new MachineCoverage()
        .setMachine(machine)
        .setSeries((int) instances.stream().map(SketchInstance::getIdentity).distinct().count())
        .setSketches(instances.size())
        .setMinTime(observed.stream()
            .map(CoverageInterval::getMinObservedTime)
            .min(Comparator.naturalOrder())
            .orElse(null))
        .setMaxTime(observed.stream()
            .map(CoverageInterval::getMaxObservedTime)
            .max(Comparator.naturalOrder())
            .orElse(null));
  }
}
