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

package com.rackspace.promsketch.app.sketch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class WindowedSketchEngine implements SketchEngine {

  @Override
  public Sketch newSketch(SketchFunction function, SketchConfig config) {
    if (config.getTimeWindowMillis() <= 0 || config.getItemWindow() <= 0) {
      throw new IllegalArgumentException("Sketch windows must be positive: " + config);
    }
    log.trace("Creating sketch for function={} config={}", function, config);
    return new WindowedSketch(function, config);
  }
}
