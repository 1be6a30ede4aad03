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

import java.time.Duration;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("promsketch.query")
@Component
@Data
@Validated
public class QueryProperties {

  /**
   * A query whose coverage and evaluation does not complete within this time is answered as
   * pending.
   */
  @NotNull
  Duration coverageTimeout = Duration.ofSeconds(2);

  /**
   * Maximum size of the cache of parsed query expressions.
   */
  @Min(0)
  long expressionCacheSize = 10000;

  /**
   * Time allowed for each partition to answer a debug-state request before its section is
   * reported as degraded.
   */
  @NotNull
  Duration debugTimeout = Duration.ofSeconds(2);
}
