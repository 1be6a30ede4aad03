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

import com.fasterxml.jackson.annotation.JsonValue;
import com.rackspace.promsketch.app.exceptions.InvalidQueryArgumentException;
import com.rackspace.promsketch.app.exceptions.UnknownFunctionException;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The windowed aggregation functions a sketch can answer, named the way they appear in query
 * expressions.
 */
public enum SketchFunction {
  AVG_OVER_TIME("avg_over_time", Family.MOMENTS),
  COUNT_OVER_TIME("count_over_time", Family.MOMENTS),
  SUM_OVER_TIME("sum_over_time", Family.MOMENTS),
  SUM2_OVER_TIME("sum2_over_time", Family.MOMENTS),
  STDDEV_OVER_TIME("stddev_over_time", Family.MOMENTS),
  STDVAR_OVER_TIME("stdvar_over_time", Family.MOMENTS),
  MIN_OVER_TIME("min_over_time", Family.ORDER),
  MAX_OVER_TIME("max_over_time", Family.ORDER),
  QUANTILE_OVER_TIME("quantile_over_time", Family.ORDER),
  ENTROPY_OVER_TIME("entropy_over_time", Family.FREQUENCY),
  DISTINCT_OVER_TIME("distinct_over_time", Family.FREQUENCY),
  L1_OVER_TIME("l1_over_time", Family.FREQUENCY),
  L2_OVER_TIME("l2_over_time", Family.FREQUENCY);

  public enum Family {
    MOMENTS,
    ORDER,
    FREQUENCY
  }

  private static final Map<String, SketchFunction> BY_NAME = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(SketchFunction::getFunctionName, Function.identity()));

  private final String functionName;
  private final Family family;

  SketchFunction(String functionName, Family family) {
    this.functionName = functionName;
    this.family = family;
  }

  @JsonValue
  public String getFunctionName() {
    return functionName;
  }

  public Family getFamily() {
    return family;
  }

  public boolean requiresArgument() {
    return this == QUANTILE_OVER_TIME;
  }

  /**
   * Checks the numeric argument of this function before any evaluation takes place.
   *
   * @param argument the argument given with the query, may be null
   * @throws InvalidQueryArgumentException if the argument is missing or out of range
   */
  public void validateArgument(Double argument) {
    if (!requiresArgument()) {
      return;
    }
    if (argument == null) {
      throw new InvalidQueryArgumentException(functionName + " requires a numeric argument");
    }
    if (argument.isNaN() || argument < 0 || argument > 1) {
      throw new InvalidQueryArgumentException(
          String.format("%s rank must lie in [0, 1], got %s", functionName, argument));
    }
  }

  public static SketchFunction fromName(String name) {
    final SketchFunction function = name == null ? null : BY_NAME.get(name.trim());
    if (function == null) {
      throw new UnknownFunctionException("Unknown aggregation function: " + name);
    }
    return function;
  }

  @Override
  public String toString() {
    return functionName;
  }
}
