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

import com.rackspace.promsketch.app.config.configValidator.PartitionLayoutValidator;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("promsketch")
@Component
@Data
@Validated
@PartitionLayoutValidator
public class AppProperties {

  /**
   * The port of the control plane. It is always treated as reserved, in addition to
   * <code>reserved-ports</code>, and can never be assigned to a partition.
   */
  @Min(1)
  @Max(65535)
  int controlPort = 7000;

  /**
   * Partition <code>i</code> listens on <code>base-port + i</code>.
   */
  @Min(1)
  @Max(65535)
  int basePort = 7100;

  /**
   * The number of contiguous machine identifiers owned by each partition.
   */
  @Min(1)
  int machinesPerPartition = 200;

  /**
   * Upper bound on the number of partitions a single registration may require.
   */
  @Min(1)
  int maxPartitions = 1000;

  /**
   * Ports that must never be selected as a data destination.
   */
  @NotNull
  Set<Integer> reservedPorts = new HashSet<>(Set.of(7000));

  /**
   * Interface the partition listeners bind to.
   */
  @NotBlank
  String partitionHost = "0.0.0.0";

  /**
   * Host name written into partition addresses handed to ingesters and used for debug calls.
   */
  @NotBlank
  String advertisedHost = "localhost";

  /**
   * Label carrying the machine identity of a series, such as <code>machine_12</code>.
   */
  @NotBlank
  String machineIdLabel = "machineid";

  /**
   * Prefix stripped from a machine identity before reading its numeric index.
   */
  @NotNull
  String machineIdPrefix = "machine_";

  /**
   * Label under which the metric name is merged into a series identity.
   */
  @NotBlank
  String metricNameLabel = "__name__";

  /**
   * Interval of the samples/sec records appended to the throughput log.
   */
  @NotNull
  Duration throughputInterval = Duration.ofSeconds(5);

  public boolean isReserved(int port) {
    return port == controlPort || reservedPorts.contains(port);
  }
}
