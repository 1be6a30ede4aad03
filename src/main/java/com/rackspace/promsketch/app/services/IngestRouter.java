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
import com.rackspace.promsketch.app.config.IngestProperties;
import com.rackspace.promsketch.app.model.IngestBatch;
import com.rackspace.promsketch.app.model.IngestResult;
import com.rackspace.promsketch.app.model.Metric;
import com.rackspace.promsketch.app.partition.PartitionNode;
import com.rackspace.promsketch.app.partition.PartitionTable;
import com.rackspace.promsketch.app.partition.RoutingTable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Runs partition inserts on the shared ingest scheduler, which caps concurrent inserts across
 * all partitions and queues the rest.
 */
@Service
@Slf4j
public class IngestRouter {

  private final RoutingTable routingTable;
  private final PartitionTable partitionTable;
  private final Scheduler ingestScheduler;
  private final IngestProperties ingestProperties;
  private final AppProperties appProperties;
  private final Counter ingestedCounter;
  private final Counter failedCounter;

  @Autowired
  public IngestRouter(RoutingTable routingTable,
                      PartitionTable partitionTable,
                      @Qualifier("ingestScheduler") Scheduler ingestScheduler,
                      IngestProperties ingestProperties,
                      AppProperties appProperties,
                      MeterRegistry meterRegistry) {
    this.routingTable = routingTable;
    this.partitionTable = partitionTable;
    this.ingestScheduler = ingestScheduler;
    this.ingestProperties = ingestProperties;
    this.appProperties = appProperties;
    this.ingestedCounter = meterRegistry.counter("promsketch.ingest", "outcome", "success");
    this.failedCounter = meterRegistry.counter("promsketch.ingest", "outcome", "failed");
  }

  /**
   * Splits a batch by owning partition and ingests each part into its node. Samples whose
   * machine is not covered by any partition count as failed.
   */
  public Mono<IngestResult> route(IngestBatch batch) {
    final Map<PartitionNode, List<Metric>> byNode = new LinkedHashMap<>();
    long unrouted = 0;
    for (Metric metric : batch.getMetrics()) {
      final Optional<PartitionNode> node = nodeFor(metric);
      if (node.isPresent()) {
        byNode.computeIfAbsent(node.get(), n -> new ArrayList<>()).add(metric);
      } else {
        unrouted++;
      }
    }
    if (unrouted > 0) {
      log.warn("{} samples of batch at {} have no owning partition", unrouted,
          batch.getTimestamp());
      failedCounter.increment(unrouted);
    }

    return Flux.fromIterable(byNode.entrySet())
        .flatMap(entry -> ingest(entry.getKey(),
            new IngestBatch()
                .setTimestamp(batch.getTimestamp())
                .setMetrics(entry.getValue())))
        .reduce(IngestResult.failed(unrouted), IngestResult::plus);
  }

  /**
   * Ingests a batch into one node. A batch that cannot be scheduled or does not complete
   * within the processing timeout is reported as entirely failed.
   */
  public Mono<IngestResult> ingest(PartitionNode node, IngestBatch batch) {
    final int size = batch.getMetrics().size();
    return Mono.fromCallable(() -> node.ingest(batch))
        .subscribeOn(ingestScheduler)
        .name("partitionIngest")
        .metrics()
        .timeout(ingestProperties.getProcessingTimeout())
        .onErrorResume(throwable -> {
          log.warn("Ingest of {} samples into partition {} failed", size, node.getPort(),
              throwable);
          return Mono.just(IngestResult.failed(size));
        })
        .doOnNext(result -> {
          ingestedCounter.increment(result.getIngested());
          failedCounter.increment(result.getFailed());
        });
  }

  private Optional<PartitionNode> nodeFor(Metric metric) {
    if (metric == null) {
      return Optional.empty();
    }
    final String machineId = metric.getLabels() == null ? null
        : metric.getLabels().get(appProperties.getMachineIdLabel());
    return routingTable.route(machineId)
        .flatMap(assignment -> partitionTable.getNode(assignment.getPort()));
  }
}
