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


package com.rackspace.promsketch.app.model;

import java.time.Duration;

/**
 * Units accepted in range selectors such as <code>[5m]</code>. A year is always 365 days.
 */
public enum RangeUnit {
  ms(Duration.ofMillis(1)),
  s(Duration.ofSeconds(1)),
  m(Duration.ofMinutes(1)),
  h(Duration.ofHours(1)),
  d(Duration.ofDays(1)),
  w(Duration.ofDays(7)),
  y(Duration.ofDays(365));

  final Duration value;

  RangeUnit(Duration value) {
    this.value = value;
  }

  public Duration getValue() {
    return value;
  }
}
