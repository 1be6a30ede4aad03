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

package com.rackspace.promsketch.app.partition;

import lombok.Data;

/**
 * <code>[minObservedTime, maxObservedTime]</code> of the samples inserted into a sketch
 * instance. Instances are immutable; extending returns a new interval that never starts later
 * or ends earlier than this one.
 */
@Data
public class CoverageInterval {

  public static final CoverageInterval EMPTY =
      new CoverageInterval(Long.MAX_VALUE, Long.MIN_VALUE);

  final long minObservedTime;
  final long maxObservedTime;

  public boolean isEmpty() {
    return minObservedTime > maxObservedTime;
  }

  public CoverageInterval extend(long timestamp) {
    if (isEmpty()) {
      return new CoverageInterval(timestamp, timestamp);
    }
    if (timestamp >= minObservedTime && timestamp <= maxObservedTime) {
      return this;
    }
    return new CoverageInterval(
        Math.min(minObservedTime, timestamp), Math.max(maxObservedTime, timestamp));
  }

  /**
   * @return true if <code>[mint, maxt]</code> is a subset of this interval
   */
  public boolean spans(long mint, long maxt) {
    return !isEmpty() && minObservedTime <= mint && maxObservedTime >= maxt;
  }
}
