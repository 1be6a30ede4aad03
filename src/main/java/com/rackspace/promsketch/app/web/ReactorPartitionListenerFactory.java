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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.promsketch.app.config.AppProperties;
import com.rackspace.promsketch.app.partition.PartitionListener;
import com.rackspace.promsketch.app.partition.PartitionListenerFactory;
import com.rackspace.promsketch.app.partition.PartitionNode;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.http.server.reactive.HttpHandler;
import org.springframework.http.server.reactive.ReactorHttpHandlerAdapter;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.HandlerStrategies;
import org.springframework.web.reactive.function.server.RouterFunctions;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

/**
 * Binds one Reactor Netty server per partition, each on the port of its assignment.
 */
@Component
@Slf4j
public class ReactorPartitionListenerFactory implements PartitionListenerFactory {

  static final Duration BIND_TIMEOUT = Duration.ofSeconds(10);
  static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final PartitionRoutes partitionRoutes;
  private final AppProperties appProperties;
  private final HandlerStrategies handlerStrategies;

  @Autowired
  public ReactorPartitionListenerFactory(PartitionRoutes partitionRoutes,
                                         AppProperties appProperties,
                                         ObjectMapper objectMapper) {
    this.partitionRoutes = partitionRoutes;
    this.appProperties = appProperties;
    this.handlerStrategies = HandlerStrategies.builder()
        .codecs(configurer -> {
          configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
          configurer.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper));
        })
        .build();
  }

  @Override
  public PartitionListener start(PartitionNode node) {
    final HttpHandler httpHandler =
        RouterFunctions.toHttpHandler(partitionRoutes.routerFor(node), handlerStrategies);
    final DisposableServer server;
    try {
      server = HttpServer.create()
          .host(appProperties.getPartitionHost())
          .port(node.getPort())
          .handle(new ReactorHttpHandlerAdapter(httpHandler))
          .bindNow(BIND_TIMEOUT);
    } catch (RuntimeException e) {
      throw new IllegalStateException(
          "Unable to bind partition listener on port " + node.getPort(), e);
    }
    log.debug("Partition listener bound to {}", server.address());
    return new NettyPartitionListener(server);
  }

  static class NettyPartitionListener implements PartitionListener {

    private final DisposableServer server;

    NettyPartitionListener(DisposableServer server) {
      this.server = server;
    }

    @Override
    public int getPort() {
      return server.port();
    }

    @Override
    public void close() {
      try {
        server.disposeNow(SHUTDOWN_TIMEOUT);
      } catch (RuntimeException e) {
        log.warn("Partition listener on port {} did not shut down cleanly", server.port(), e);
      }
    }
  }
}
