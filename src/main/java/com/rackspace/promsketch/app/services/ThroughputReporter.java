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
import com.rackspace.promsketch.app.partition.PartitionNode;
import com.rackspace.promsketch.app.partition.PartitionTable;
import java.util.Locale;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Periodically appends the samples/sec ingested by all partitions to the throughput log.
 */
@Service
@Slf4j
public class ThroughputReporter {

  private static final Logger throughputLog = LoggerFactory.getLogger("promsketch.throughput");

  private final PartitionTable partitionTable;
  private final AppProperties appProperties;
  private final ScheduledExecutorService executor;

  private long lastTotal;
  private long lastReportTime;

  @Autowired
  public ThroughputReporter(PartitionTable partitionTable,
                            AppProperties appProperties,
                            ScheduledExecutorService executor) {
    this.partitionTable = partitionTable;
    this.appProperties = appProperties;
    this.executor = executor;
  }

  @PostConstruct
  public void start() {
    final long interval = appProperties.getThroughputInterval().toMillis();
    if (interval <= 0) {
      log.info("Throughput reporting is disabled");
      return;
    }
    lastReportTime = System.currentTimeMillis();
    executor.scheduleAtFixedRate(this::report, interval, interval, TimeUnit.MILLISECONDS);
  }

  synchronized void report() {
    try {
      final long now = System.currentTimeMillis();
      final long total = partitionTable.getNodes().stream()
          .mapToLong(PartitionNode::getIngestedTotal)
          .sum();
      final double elapsedSeconds = Math.max(1, now - lastReportTime) / 1000.0;
      final double rate = (total - lastTotal) / elapsedSeconds;
      throughputLog.info("{},{},{}", now, String.format(Locale.ROOT, "%.2f", rate), total);
      lastTotal = total;
      lastReportTime = now;
    } catch (RuntimeException e) {
      // an exception would cancel the periodic task
      log.warn("Failed to report throughput", e);
    }
  }
}
