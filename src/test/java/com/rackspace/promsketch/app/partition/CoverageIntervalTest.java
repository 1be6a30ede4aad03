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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CoverageIntervalTest {

  @Test
  void emptyUntilFirstTimestamp() {
    assertThat(CoverageInterval.EMPTY.isEmpty()).isTrue();
    assertThat(CoverageInterval.EMPTY.spans(0, 0)).isFalse();

    final CoverageInterval first = CoverageInterval.EMPTY.extend(5000);
    assertThat(first.getMinObservedTime()).isEqualTo(5000);
    assertThat(first.getMaxObservedTime()).isEqualTo(5000);
  }

  @Test
  void onlyGrows() {
    final CoverageInterval interval = CoverageInterval.EMPTY
        .extend(5000)
        .extend(9000)
        .extend(7000)
        .extend(1000);

    assertThat(interval).isEqualTo(new CoverageInterval(1000, 9000));
    assertThat(interval.spans(1000, 9000)).isTrue();
    assertThat(interval.spans(999, 9000)).isFalse();
    assertThat(interval.spans(1000, 9001)).isFalse();
  }

  @Test
  void extendingWithinReturnsSameInterval() {
    final CoverageInterval interval = new CoverageInterval(1000, 9000);

    assertThat(interval.extend(4000)).isSameAs(interval);
  }
}
