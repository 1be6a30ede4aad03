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
import com.rackspace.promsketch.app.model.SamplePoint;
import com.rackspace.promsketch.app.sketch.SketchFunction.Family;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.apache.datasketches.frequencies.ErrorType;
import org.apache.datasketches.frequencies.LongsSketch;
import org.apache.datasketches.frequencies.LongsSketch.Row;
import org.apache.datasketches.hll.Union;

/**
 * Sliding-window summary made of time buckets. Buckets lying wholly inside a query window are
 * merged sketch by sketch. A bucket cut by a window edge is filtered sample by sample while it
 * still retains its raw samples and is merged whole after that, which is reported in the
 * annotations.
 * <p>
 * State older than the time window, measured back from the newest inserted sample, is
 * discarded as new samples arrive.
 * </p>
 */
class WindowedSketch implements Sketch {

  static final int BUCKETS_PER_WINDOW = 16;

  private final SketchFunction function;
  private final SketchConfig config;
  private final long bucketWidth;
  private final int bucketCapacity;
  private final NavigableMap<Long, SketchBucket> buckets = new TreeMap<>();
  private long newest = Long.MIN_VALUE;

  WindowedSketch(SketchFunction function, SketchConfig config) {
    this.function = function;
    this.config = config;
    this.bucketWidth = Math.max(1, config.getTimeWindowMillis() / BUCKETS_PER_WINDOW);
    this.bucketCapacity = (int) Math.min(Integer.MAX_VALUE,
        Math.max(1, config.getItemWindow() / BUCKETS_PER_WINDOW));
  }

  @Override
  public void insert(long timestamp, double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("Sample value must be finite, got " + value);
    }
    if (newest != Long.MIN_VALUE && timestamp < newest - config.getTimeWindowMillis()) {
      throw new IllegalArgumentException(String.format(
          "Sample at %d is older than the retained window ending at %d", timestamp, newest));
    }

    final long start = Math.floorDiv(timestamp, bucketWidth) * bucketWidth;
    buckets.computeIfAbsent(start, s -> new SketchBucket(s, bucketCapacity, function.getFamily()))
        .add(timestamp, value, item(value));

    if (timestamp > newest) {
      newest = timestamp;
      // drop buckets that end at or before the start of the window
      buckets.headMap(newest - config.getTimeWindowMillis() - bucketWidth, true).clear();
    }
  }

  @Override
  public boolean isCovered(long mint, long maxt) {
    if (buckets.isEmpty()) {
      return false;
    }
    return buckets.firstEntry().getValue().minTime <= mint && newest >= maxt;
  }

  @Override
  public Evaluation evaluate(SketchFunction requested, double argument, long mint, long maxt,
                             long now) {
    if (requested.getFamily() != function.getFamily()) {
      throw new IllegalArgumentException(String.format(
          "Sketch created for %s cannot answer %s", function, requested));
    }

    final Accumulator acc = new Accumulator(function.getFamily());
    for (SketchBucket bucket : buckets.values()) {
      if (!bucket.overlaps(mint, maxt)) {
        continue;
      }
      if (bucket.isWithin(mint, maxt)) {
        acc.addBucket(bucket);
      } else if (bucket.isExact()) {
        for (int i = 0; i < bucket.retained; i++) {
          final long ts = bucket.timestamps[i];
          if (ts >= mint && ts <= maxt) {
            acc.addValue(bucket.values[i], item(bucket.values[i]));
          }
        }
      } else {
        acc.addBucket(bucket);
        acc.straddlingBuckets++;
      }
    }

    final List<String> annotations = new ArrayList<>();
    if (acc.straddlingBuckets > 0) {
      annotations.add(String.format(
          "%d bucket(s) crossing the window edge were counted whole", acc.straddlingBuckets));
    }
    if (acc.frequencies != null && acc.frequencies.getMaximumError() > 0) {
      annotations.add(String.format("item frequencies may be off by up to %d",
          acc.frequencies.getMaximumError()));
    }
    if (maxt > now) {
      annotations.add("window ends after the evaluation time");
    }

    final double value = acc.count == 0 ? Double.NaN : compute(requested, argument, acc);
    return new Evaluation(List.of(new SamplePoint(value, maxt)), annotations);
  }

  private long item(double value) {
    return Math.round(value * config.getValueScale());
  }

  private static double compute(SketchFunction requested, double argument, Accumulator acc) {
    switch (requested) {
      case AVG_OVER_TIME:
        return acc.sum / acc.count;
      case COUNT_OVER_TIME:
        return acc.count;
      case SUM_OVER_TIME:
        return acc.sum;
      case SUM2_OVER_TIME:
        return acc.sumSquares;
      case STDVAR_OVER_TIME:
        return variance(acc);
      case STDDEV_OVER_TIME:
        return Math.sqrt(variance(acc));
      case MIN_OVER_TIME:
        return acc.min;
      case MAX_OVER_TIME:
        return acc.max;
      case QUANTILE_OVER_TIME:
        // the sketch may round past the observed extremes
        return Math.max(acc.min, Math.min(acc.max, acc.quantiles.getValueAtQuantile(argument)));
      case ENTROPY_OVER_TIME:
        return entropy(acc.frequencies);
      case DISTINCT_OVER_TIME:
        return acc.distinct.getEstimate();
      case L1_OVER_TIME:
        return acc.frequencies.getStreamLength();
      case L2_OVER_TIME:
        return l2(acc.frequencies);
      default:
        throw new IllegalArgumentException("Unsupported function " + requested);
    }
  }

  private static double variance(Accumulator acc) {
    final double mean = acc.sum / acc.count;
    return Math.max(0, acc.sumSquares / acc.count - mean * mean);
  }

  private static double entropy(LongsSketch frequencies) {
    final Row[] rows = frequencies.getFrequentItems(ErrorType.NO_FALSE_NEGATIVES);
    double total = 0;
    for (Row row : rows) {
      total += row.getEstimate();
    }
    double entropy = 0;
    for (Row row : rows) {
      final double p = row.getEstimate() / total;
      entropy -= p * Math.log(p) / Math.log(2);
    }
    return entropy;
  }

  private static double l2(LongsSketch frequencies) {
    double sumSquares = 0;
    for (Row row : frequencies.getFrequentItems(ErrorType.NO_FALSE_NEGATIVES)) {
      final double estimate = row.getEstimate();
      sumSquares += estimate * estimate;
    }
    return Math.sqrt(sumSquares);
  }

  private static class Accumulator {
    long count;
    double sum;
    double sumSquares;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    int straddlingBuckets;

    final DDSketch quantiles;
    final Union distinct;
    LongsSketch frequencies;

    Accumulator(Family family) {
      quantiles = family == Family.ORDER ? SketchBucket.newQuantileSketch() : null;
      distinct = family == Family.FREQUENCY ? SketchBucket.newDistinctUnion() : null;
      frequencies = family == Family.FREQUENCY ? SketchBucket.newFrequencySketch() : null;
    }

    void addValue(double value, long item) {
      count++;
      sum += value;
      sumSquares += value * value;
      min = Math.min(min, value);
      max = Math.max(max, value);
      if (quantiles != null) {
        quantiles.accept(value);
      }
      if (distinct != null) {
        distinct.update(item);
        frequencies.update(item);
      }
    }

    void addBucket(SketchBucket bucket) {
      count += bucket.count;
      sum += bucket.sum;
      sumSquares += bucket.sumSquares;
      min = Math.min(min, bucket.min);
      max = Math.max(max, bucket.max);
      if (quantiles != null) {
        quantiles.mergeWith(bucket.quantiles);
      }
      if (distinct != null) {
        distinct.update(bucket.distinct);
        frequencies = frequencies.merge(bucket.frequencies);
      }
    }
  }
}
