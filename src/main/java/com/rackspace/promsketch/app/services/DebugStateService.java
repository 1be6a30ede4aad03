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

import com.rackspace.promsketch.app.config.QueryProperties;
import com.rackspace.promsketch.app.model.DebugStateReport;
import com.rackspace.promsketch.app.model.PartitionDebugState;
import com.rackspace.promsketch.app.partition.PartitionAssignment;
import com.rackspace.promsketch.app.partition.PartitionTable;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Gathers the debug state of every partition by asking each partition listener for it. A
 * partition that fails to answer in time is reported as degraded and never fails the report.
 */
@Service
@Slf4j
public class DebugStateService {

  private final PartitionTable partitionTable;
  private final QueryProperties queryProperties;
  private final WebClient webClient;

  @Autowired
  public DebugStateService(PartitionTable partitionTable,
                           QueryProperties queryProperties,
                           WebClient.Builder webClientBuilder) {
    this.partitionTable = partitionTable;
    this.queryProperties = queryProperties;
    this.webClient = webClientBuilder.build();
  }

  public Mono<DebugStateReport> debugState() {
    final List<PartitionAssignment> assignments = partitionTable.getPlan().getAssignments();
    return Flux.fromIterable(assignments)
        .flatMapSequential(this::fetch)
        .collectList()
        .map(states -> {
          final int degraded = (int) states.stream()
              .filter(state -> PartitionDebugState.STATUS_DEGRADED.equals(state.getStatus()))
              .count();
          return new DebugStateReport()
              .setStatus(degraded == 0 ? PartitionDebugState.STATUS_OK
                  : PartitionDebugState.STATUS_DEGRADED)
              .setGeneratedAt(System.currentTimeMillis())
              .setDegradedPartitions(degraded)
              .setPartitions(states);
        });
  }

  private Mono<PartitionDebugState> fetch(PartitionAssignment assignment) {
    return webClient.get()
        .uri("http://{host}:{port}/debug-state", assignment.getHost(), assignment.getPort())
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(PartitionDebugState.class)
        .timeout(queryProperties.getDebugTimeout())
        .onErrorResume(throwable -> {
          log.warn("Partition {} did not report its debug state: {}",
              assignment.getAddress(), throwable.toString());
          return Mono.just(PartitionDebugState.degraded(
              assignment.getPort(),
              assignment.getFirstMachine(),
              assignment.getLastMachine(),
              throwable.toString()
          ));
        });
  }
}
