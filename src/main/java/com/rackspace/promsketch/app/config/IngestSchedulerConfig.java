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


package com.rackspace.promsketch.app.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class IngestSchedulerConfig {

  private final IngestProperties ingestProperties;

  @Autowired
  public IngestSchedulerConfig(IngestProperties ingestProperties) {
    this.ingestProperties = ingestProperties;
  }

  /**
   * Runs partition inserts for every partition. Its thread cap is the process-wide ceiling on
   * concurrent inserts and work beyond it waits in the scheduler's bounded queue.
   */
  @Bean(destroyMethod = "dispose")
  public Scheduler ingestScheduler() {
    return Schedulers.newBoundedElastic(
        ingestProperties.getMaxConcurrentInserts(),
        ingestProperties.getQueuedBatches(),
        "ingest"
    );
  }
}
