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
 * One approximate summary of a single series for a single aggregation function.
 * <p>
 * Implementations are not required to be thread-safe: callers serialize inserts and must not
 * evaluate concurrently with an insert.
 * </p>
 */
public interface Sketch {

  /**
   * @param timestamp sample time in epoch milliseconds
   * @param value the sample value
   * @throws IllegalArgumentException if the sample cannot be summarized, such as a non-finite
   * value
   */
  void insert(long timestamp, double value);

  /**
   * @return true if the retained state of this sketch spans the whole of <code>[mint, maxt]</code>
   */
  boolean isCovered(long mint, long maxt);

  /**
   * Computes the aggregate over <code>[mint, maxt]</code>. Must not change the retained state.
   *
   * @param argument the numeric function argument, ignored by functions that take none
   * @param now the current wall-clock time in epoch milliseconds
   */
  Evaluation evaluate(SketchFunction function, double argument, long mint, long maxt, long now);
}
