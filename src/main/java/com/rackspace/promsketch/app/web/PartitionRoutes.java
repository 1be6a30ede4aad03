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


package com.rackspace.promsketch.app.web;

import com.rackspace.promsketch.app.model.IngestBatch;
import com.rackspace.promsketch.app.model.IngestResponse;
import com.rackspace.promsketch.app.partition.PartitionNode;
import com.rackspace.promsketch.app.services.IngestRouter;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Routes served by the listener of each partition.
 */
@Component
@Slf4j
public class PartitionRoutes {

  private final IngestRouter ingestRouter;

  @Autowired
  public PartitionRoutes(IngestRouter ingestRouter) {
    this.ingestRouter = ingestRouter;
  }

  public RouterFunction<ServerResponse> routerFor(PartitionNode node) {
    return RouterFunctions.route()
        .POST("/ingest", request -> ingest(node, request))
        .GET("/debug-state", request -> ServerResponse.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(node.debugState()))
        .GET("/health", request -> ServerResponse.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of(
                "status", "UP",
                "port", node.getPort(),
                "machines", node.getAssignment().getFirstMachine() + "-"
                    + node.getAssignment().getLastMachine()
            )))
        .build();
  }

  private Mono<ServerResponse> ingest(PartitionNode node, ServerRequest request) {
    return request.bodyToMono(IngestBatch.class)
        .switchIfEmpty(Mono.error(() -> new IllegalArgumentException("Request body is empty")))
        .doOnNext(PartitionRoutes::validate)
        .flatMap(batch -> ingestRouter.ingest(node, batch))
        .flatMap(result -> ServerResponse.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(IngestResponse.success(result)))
        .onErrorResume(PartitionRoutes::isMalformed, e -> {
          log.debug("Partition {} rejected ingest request: {}", node.getPort(), e.getMessage());
          return ServerResponse.badRequest()
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(Map.of("error", String.valueOf(e.getMessage())));
        });
  }

  private static void validate(IngestBatch batch) {
    if (batch.getTimestamp() == null) {
      throw new IllegalArgumentException("Batch has no timestamp");
    }
    if (batch.getMetrics() == null) {
      throw new IllegalArgumentException("Batch has no metrics");
    }
  }

  private static boolean isMalformed(Throwable e) {
    return e instanceof IllegalArgumentException
        || e instanceof DecodingException
        || e instanceof ServerWebInputException;
  }
}
