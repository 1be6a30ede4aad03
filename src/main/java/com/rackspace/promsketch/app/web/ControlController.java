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

import com.rackspace.promsketch.app.model.DebugStateReport;
import com.rackspace.promsketch.app.model.IngestBatch;
import com.rackspace.promsketch.app.model.IngestResponse;
import com.rackspace.promsketch.app.model.RegisterConfigRequest;
import com.rackspace.promsketch.app.model.RegisterConfigResponse;
import com.rackspace.promsketch.app.services.ControlPlaneService;
import com.rackspace.promsketch.app.services.DebugStateService;
import com.rackspace.promsketch.app.services.IngestRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Control plane endpoints served on the control port.
 */
@RestController
@Slf4j
public class ControlController {

  private final ControlPlaneService controlPlaneService;
  private final DebugStateService debugStateService;
  private final IngestRouter ingestRouter;

  @Autowired
  public ControlController(ControlPlaneService controlPlaneService,
                           DebugStateService debugStateService,
                           IngestRouter ingestRouter) {
    this.controlPlaneService = controlPlaneService;
    this.debugStateService = debugStateService;
    this.ingestRouter = ingestRouter;
  }

  /**
   * Registers a capacity hint and returns once every partition it requires is listening.
   */
  @PostMapping("/register_config")
  public Mono<RegisterConfigResponse> registerConfig(
      @RequestBody @Validated RegisterConfigRequest request) {
    log.debug("Register config request {}", request);
    return controlPlaneService.registerConfig(request);
  }

  @GetMapping("/debug-state")
  public Mono<DebugStateReport> debugState() {
    return debugStateService.debugState();
  }

  /**
   * Ingests a batch for any machines, forwarding each sample to the partition owning it.
   */
  @PostMapping("/ingest")
  public Mono<IngestResponse> ingest(@RequestBody @Validated IngestBatch batch) {
    return ingestRouter.route(batch)
        .map(IngestResponse::success);
  }
}
