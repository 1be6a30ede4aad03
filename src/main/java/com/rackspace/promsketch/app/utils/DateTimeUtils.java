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


package com.rackspace.promsketch.app.utils;

import com.rackspace.promsketch.app.exceptions.QueryParseException;
import com.rackspace.promsketch.app.model.RangeUnit;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class DateTimeUtils {

  public static final String RANGE_PART_PATTERN = "([0-9]+)(ms|s|m|h|d|w|y)";
  public static final String EPOCH_MILLIS_PATTERN = "\\d{13,}";
  public static final String EPOCH_SECONDS_PATTERN = "\\d{1,12}(\\.\\d+)?";

  private static final Pattern RANGE_PART = Pattern.compile(RANGE_PART_PATTERN);
  private static final Pattern RANGE = Pattern.compile("(" + RANGE_PART_PATTERN + ")+");

  /**
   * Parses a range selector such as <code>5m</code> or <code>1h30m</code>.
   *
   * @throws QueryParseException if the range is malformed, zero or too long to express in
   * epoch milliseconds
   */
  public static Duration parseRange(String range) {
    if (range == null || !RANGE.matcher(range).matches()) {
      throw new QueryParseException("Invalid range: " + range);
    }
    Duration total = Duration.ZERO;
    final Matcher match = RANGE_PART.matcher(range);
    try {
      while (match.find()) {
        total = total.plus(RangeUnit.valueOf(match.group(2)).getValue()
            .multipliedBy(Long.parseLong(match.group(1))));
      }
      // the window is applied in milliseconds
      total.toMillis();
    } catch (ArithmeticException | NumberFormatException e) {
      throw new QueryParseException("Range is too large: " + range);
    }
    if (total.isZero()) {
      throw new QueryParseException("Range must be positive: " + range);
    }
    return total;
  }

  /**
   * Checks if the string time is valid Instant in UTC.
   */
  public static boolean isValidInstantInstance(String time) {
    try {
      Instant.parse(time);
      return true;
    } catch (DateTimeParseException dateTimeParseException) {
      return false;
    }
  }

  public static boolean isValidEpochMillis(String time) {
    return Pattern.matches(EPOCH_MILLIS_PATTERN, time);
  }

  /**
   * Checks if the time is valid epoch seconds, optionally with a fraction.
   */
  public static boolean isValidEpochSeconds(String time) {
    return Pattern.matches(EPOCH_SECONDS_PATTERN, time);
  }

  /**
   * Gets the epoch milliseconds of an evaluation time given as RFC 3339, epoch milliseconds or
   * epoch seconds.
   *
   * @throws QueryParseException if the time matches none of these formats or lies outside the
   * range of epoch milliseconds
   */
  public static long parseEpochMillis(String time) {
    try {
      if (isValidInstantInstance(time)) {
        return Instant.parse(time).toEpochMilli();
      } else if (isValidEpochMillis(time)) {
        return Long.parseLong(time);
      } else if (isValidEpochSeconds(time)) {
        return new BigDecimal(time).movePointRight(3).setScale(0, RoundingMode.DOWN)
            .longValueExact();
      }
    } catch (ArithmeticException | NumberFormatException e) {
      throw new QueryParseException("Time is out of range: " + time);
    }
    throw new QueryParseException("Invalid time: " + time);
  }
}
