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

import com.rackspace.promsketch.app.sketch.SketchConfig;
import com.rackspace.promsketch.app.sketch.SketchFunction;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("promsketch.sketch")
@Component
@Data
@Validated
public class SketchProperties {

  /**
   * Aggregation functions maintained for every series. Each sketch also answers the other
   * functions of its family, so a query whose function shares no family with this list never
   * becomes covered.
   */
  @NotEmpty
  List<SketchFunction> functions = new ArrayList<>(List.of(
      SketchFunction.AVG_OVER_TIME,
      SketchFunction.QUANTILE_OVER_TIME,
      SketchFunction.ENTROPY_OVER_TIME
  ));

  /**
   * How far back, relative to the newest sample, a sketch retains state.
   */
  @NotNull
  Duration timeWindow = Duration.ofSeconds(60);

  /**
   * Maximum number of value samples a sketch retains across its window.
   */
  @Min(1)
  long itemWindow = 100000;

  /**
   * Frequency based functions (entropy, distinct, l1, l2) count two values as the same item
   * when they are equal after multiplying by this scale and rounding.
   */
  @Positive
  double valueScale = 10000;

  /**
   * Metrics whose sketches are created for every machine of a partition as soon as the
   * partition is provisioned, instead of on first ingest.
   */
  @NotNull
  List<String> eagerMetrics = new ArrayList<>();

  public SketchConfig toSketchConfig() {
    return new SketchConfig(timeWindow.toMillis(), itemWindow, valueScale);
  }
}
