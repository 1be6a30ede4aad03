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

/**
 * Creates the sketches the partitions insert into and evaluate. Swapping the bean swaps the
 * summary algorithms without touching routing or coverage tracking.
 */
public interface SketchEngine {

  /**
   * @throws IllegalArgumentException if this engine cannot summarize the given function
   */
  Sketch newSketch(SketchFunction function, SketchConfig config);
}
