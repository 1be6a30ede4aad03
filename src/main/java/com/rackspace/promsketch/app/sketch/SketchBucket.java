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

import com.datadoghq.sketch.ddsketch.DDSketch;
import com.datadoghq.sketch.ddsketch.DDSketches;
import com.rackspace.promsketch.app.sketch.SketchFunction.Family;
import java.util.Arrays;
import org.apache.datasketches.frequencies.LongsSketch;
import org.apache.datasketches.hll.HllSketch;
import org.apache.datasketches.hll.Union;

/**
 * A fixed time slice of a {@link WindowedSketch}. Moments are always kept exactly. Values of the
 * ORDER family go into a DDSketch and scaled values of the FREQUENCY family go into an HLL sketch
 * and a frequent-items sketch.
 * <p>
 * Raw samples are also kept until the bucket holds more than its capacity, so a window edge
 * falling inside the bucket can still be applied sample by sample.
 * </p>
 */
class SketchBucket {

  static final double RELATIVE_ACCURACY = 0.01;
  static final int MAX_BINS = 2048;
  static final int HLL_LG_K = 12;
  static final int FREQUENT_ITEMS_MAP_SIZE = 1024;

  private static final int INITIAL_SLOTS = 16;

  final long start;
  final int capacity;

  long[] timestamps;
  double[] values;
  int retained;

  long minTime = Long.MAX_VALUE;
  long maxTime = Long.MIN_VALUE;
  long count;
  double sum;
  double sumSquares;
  double min = Double.POSITIVE_INFINITY;
  double max = Double.NEGATIVE_INFINITY;

  final DDSketch quantiles;
  final HllSketch distinct;
  final LongsSketch frequencies;

  SketchBucket(long start, int capacity, Family family) {
    this.start = start;
    this.capacity = capacity;
    final int slots = Math.min(capacity, INITIAL_SLOTS);
    timestamps = new long[slots];
    values = new double[slots];

    quantiles = family == Family.ORDER ? newQuantileSketch() : null;
    distinct = family == Family.FREQUENCY ? new HllSketch(HLL_LG_K) : null;
    frequencies = family == Family.FREQUENCY ? newFrequencySketch() : null;
  }

  static DDSketch newQuantileSketch() {
    return DDSketches.collapsingLowestDense(RELATIVE_ACCURACY, MAX_BINS);
  }

  static Union newDistinctUnion() {
    return new Union(HLL_LG_K);
  }

  static LongsSketch newFrequencySketch() {
    return new LongsSketch(FREQUENT_ITEMS_MAP_SIZE);
  }

  /**
   * @param item the value scaled and rounded to the item it counts as for frequency functions
   */
  void add(long timestamp, double value, long item) {
    count++;
    sum += value;
    sumSquares += value * value;
    min = Math.min(min, value);
    max = Math.max(max, value);
    minTime = Math.min(minTime, timestamp);
    maxTime = Math.max(maxTime, timestamp);

    if (quantiles != null) {
      quantiles.accept(value);
    }
    if (distinct != null) {
      distinct.update(item);
      frequencies.update(item);
    }

    if (timestamps == null) {
      return;
    }
    if (retained == capacity) {
      // past capacity only the summaries remain
      timestamps = null;
      values = null;
      return;
    }
    if (retained == values.length) {
      final int grown = Math.min(capacity, values.length * 2);
      timestamps = Arrays.copyOf(timestamps, grown);
      values = Arrays.copyOf(values, grown);
    }
    timestamps[retained] = timestamp;
    values[retained] = value;
    retained++;
  }

  /**
   * @return true while every inserted sample is still retained
   */
  boolean isExact() {
    return timestamps != null;
  }

  boolean overlaps(long mint, long maxt) {
    return count > 0 && minTime <= maxt && maxTime >= mint;
  }

  boolean isWithin(long mint, long maxt) {
    return count > 0 && minTime >= mint && maxTime <= maxt;
  }
}
