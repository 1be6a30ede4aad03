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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.rackspace.promsketch.app.config.AppProperties;
import com.rackspace.promsketch.app.partition.PartitionTable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ThroughputReporterTest {

  ScheduledExecutorService executor = mock(ScheduledExecutorService.class);

  @Test
  void schedulesAtConfiguredInterval() {
    final AppProperties appProperties = new AppProperties()
        .setThroughputInterval(Duration.ofSeconds(5));
    final ThroughputReporter reporter = new ThroughputReporter(
        new PartitionTable(appProperties, new SimpleMeterRegistry()), appProperties, executor);

    reporter.start();

    verify(executor).scheduleAtFixedRate(any(Runnable.class), eq(5000L), eq(5000L),
        eq(TimeUnit.MILLISECONDS));
  }

  @Test
  void zeroIntervalDisablesReporting() {
    final AppProperties appProperties = new AppProperties()
        .setThroughputInterval(Duration.ZERO);
    final ThroughputReporter reporter = new ThroughputReporter(
        new PartitionTable(appProperties, new SimpleMeterRegistry()), appProperties, executor);

    reporter.start();
    // reporting with no partitions must not fail either
    reporter.report();

    verifyNoInteractions(executor);
  }
}
