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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.Assertions.withinPercentage;

import com.rackspace.promsketch.app.model.SamplePoint;
import org.junit.jupiter.api.Test;

class WindowedSketchTest {

  static final SketchConfig CONFIG = new SketchConfig(10_000, 1000, 10000);

  private static WindowedSketch sketchWithNineSamples(SketchFunction function) {
    final WindowedSketch sketch = new WindowedSketch(function, CONFIG);
    for (int i = 1; i <= 9; i++) {
      sketch.insert(i * 1000L, i);
    }
    return sketch;
  }

  @Test
  void coveredOnlyWithinInsertedSpan() {
    final WindowedSketch sketch = sketchWithNineSamples(SketchFunction.AVG_OVER_TIME);

    assertThat(sketch.isCovered(1000, 9000)).isTrue();
    assertThat(sketch.isCovered(2000, 5000)).isTrue();
    assertThat(sketch.isCovered(500, 9000)).isFalse();
    assertThat(sketch.isCovered(1000, 9500)).isFalse();
  }

  @Test
  void emptySketchIsNeverCovered() {
    final WindowedSketch sketch =
        new WindowedSketch(SketchFunction.AVG_OVER_TIME, CONFIG);

    assertThat(sketch.isCovered(0, 0)).isFalse();
  }

  @Test
  void momentsOverWindow() {
    final WindowedSketch sketch = sketchWithNineSamples(SketchFunction.AVG_OVER_TIME);

    assertThat(value(sketch.evaluate(SketchFunction.AVG_OVER_TIME, 0, 1000, 9000, 9000)))
        .isEqualTo(5.0);
    assertThat(value(sketch.evaluate(SketchFunction.SUM_OVER_TIME, 0, 1000, 9000, 9000)))
        .isEqualTo(45.0);
    assertThat(value(sketch.evaluate(SketchFunction.COUNT_OVER_TIME, 0, 3000, 5000, 9000)))
        .isEqualTo(3.0);
    assertThat(value(sketch.evaluate(SketchFunction.STDVAR_OVER_TIME, 0, 1000, 9000, 9000)))
        .isCloseTo(60.0 / 9, within(1e-9));
  }

  @Test
  void evaluationIsStampedWithWindowEnd() {
    final WindowedSketch sketch = sketchWithNineSamples(SketchFunction.AVG_OVER_TIME);

    final Evaluation evaluation =
        sketch.evaluate(SketchFunction.AVG_OVER_TIME, 0, 1000, 9000, 9000);

    assertThat(evaluation.getSamples()).hasSize(1);
    assertThat(evaluation.getSamples().get(0).getTimestamp()).isEqualTo(9000);
    assertThat(evaluation.getAnnotations()).isEmpty();
  }

  @Test
  void quantileWithinRelativeAccuracy() {
    final WindowedSketch sketch =
        sketchWithNineSamples(SketchFunction.QUANTILE_OVER_TIME);

    assertThat(value(sketch.evaluate(SketchFunction.QUANTILE_OVER_TIME, 0.5, 1000, 9000, 9000)))
        .isCloseTo(5.0, withinPercentage(2));
    assertThat(value(sketch.evaluate(SketchFunction.QUANTILE_OVER_TIME, 0.9, 1000, 9000, 9000)))
        .isCloseTo(8.0, withinPercentage(2));
    assertThat(value(sketch.evaluate(SketchFunction.QUANTILE_OVER_TIME, 1.0, 1000, 9000, 9000)))
        .isLessThanOrEqualTo(9.0);
    assertThat(value(sketch.evaluate(SketchFunction.MAX_OVER_TIME, 0, 1000, 9000, 9000)))
        .isEqualTo(9.0);
  }

  @Test
  void quantileAndDistinctOverManySamples() {
    final WindowedSketch order =
        new WindowedSketch(SketchFunction.QUANTILE_OVER_TIME, CONFIG);
    final WindowedSketch frequency =
        new WindowedSketch(SketchFunction.DISTINCT_OVER_TIME, CONFIG);
    for (int i = 1; i <= 10_000; i++) {
      order.insert(i, i);
      frequency.insert(i, i);
    }

    assertThat(value(order.evaluate(SketchFunction.QUANTILE_OVER_TIME, 0.99, 1, 10_000, 10_000)))
        .isCloseTo(9900.0, withinPercentage(2));
    assertThat(value(order.evaluate(SketchFunction.MIN_OVER_TIME, 0, 1, 10_000, 10_000)))
        .isEqualTo(1.0);
    assertThat(value(frequency.evaluate(SketchFunction.DISTINCT_OVER_TIME, 0, 1, 10_000, 10_000)))
        .isCloseTo(10_000.0, withinPercentage(5));
    assertThat(value(frequency.evaluate(SketchFunction.L1_OVER_TIME, 0, 1, 10_000, 10_000)))
        .isEqualTo(10_000.0);
  }

  @Test
  void entropyOfFrequencies() {
    final WindowedSketch sketch =
        new WindowedSketch(SketchFunction.ENTROPY_OVER_TIME, CONFIG);
    sketch.insert(1000, 1.0);
    sketch.insert(2000, 2.0);
    sketch.insert(3000, 1.0);
    sketch.insert(4000, 2.0);

    assertThat(value(sketch.evaluate(SketchFunction.ENTROPY_OVER_TIME, 0, 1000, 4000, 4000)))
        .isCloseTo(1.0, within(1e-9));
    assertThat(value(sketch.evaluate(SketchFunction.DISTINCT_OVER_TIME, 0, 1000, 4000, 4000)))
        .isCloseTo(2.0, within(0.01));
    assertThat(value(sketch.evaluate(SketchFunction.L2_OVER_TIME, 0, 1000, 4000, 4000)))
        .isCloseTo(Math.sqrt(8), within(1e-9));
  }

  @Test
  void emptyWindowYieldsNaN() {
    final WindowedSketch sketch = sketchWithNineSamples(SketchFunction.AVG_OVER_TIME);

    final SamplePoint point = sketch.evaluate(SketchFunction.AVG_OVER_TIME, 0, 9500, 9800, 9800)
        .getSamples().get(0);

    assertThat(point.isSentinel()).isTrue();
  }

  @Test
  void windowEdgeInsideBucketFiltersRetainedSamples() {
    final WindowedSketch sketch =
        new WindowedSketch(SketchFunction.AVG_OVER_TIME, CONFIG);
    for (int i = 0; i < 10; i++) {
      sketch.insert(1000 + i, i);
    }

    final Evaluation evaluation =
        sketch.evaluate(SketchFunction.COUNT_OVER_TIME, 0, 1000, 1004, 1009);

    assertThat(value(evaluation)).isEqualTo(5.0);
    assertThat(evaluation.getAnnotations()).isEmpty();
  }

  @Test
  void fullBucketCrossingWindowEdgeIsCountedWhole() {
    final WindowedSketch sketch = new WindowedSketch(
        SketchFunction.AVG_OVER_TIME, new SketchConfig(10_000, 16, 10000));
    for (int i = 0; i < 5; i++) {
      sketch.insert(1000 + i, 2.0 * (i + 1));
    }

    final Evaluation inside =
        sketch.evaluate(SketchFunction.AVG_OVER_TIME, 0, 1000, 1004, 1004);
    final Evaluation crossing =
        sketch.evaluate(SketchFunction.AVG_OVER_TIME, 0, 1000, 1002, 1004);

    assertThat(value(inside)).isEqualTo(6.0);
    assertThat(inside.getAnnotations()).isEmpty();
    assertThat(value(crossing)).isEqualTo(6.0);
    assertThat(crossing.getAnnotations())
        .anySatisfy(annotation -> assertThat(annotation).contains("counted whole"));
  }

  @Test
  void annotatesWindowEndingInTheFuture() {
    final WindowedSketch sketch = sketchWithNineSamples(SketchFunction.AVG_OVER_TIME);

    final Evaluation evaluation =
        sketch.evaluate(SketchFunction.AVG_OVER_TIME, 0, 1000, 9000, 5000);

    assertThat(evaluation.getAnnotations()).contains("window ends after the evaluation time");
  }

  @Test
  void rejectsNonFiniteValues() {
    final WindowedSketch sketch =
        new WindowedSketch(SketchFunction.AVG_OVER_TIME, CONFIG);

    assertThatThrownBy(() -> sketch.insert(1000, Double.NaN))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> sketch.insert(1000, Double.POSITIVE_INFINITY))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(sketch.isCovered(1000, 1000)).isFalse();
  }

  @Test
  void rejectsSamplesOlderThanWindow() {
    final WindowedSketch sketch =
        new WindowedSketch(SketchFunction.AVG_OVER_TIME, CONFIG);
    sketch.insert(20_000, 1);

    assertThatThrownBy(() -> sketch.insert(5_000, 1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void evictsStateOutsideWindow() {
    final WindowedSketch sketch =
        new WindowedSketch(SketchFunction.AVG_OVER_TIME, CONFIG);
    sketch.insert(1000, 1);
    sketch.insert(30_000, 1);

    assertThat(sketch.isCovered(1000, 30_000)).isFalse();
    assertThat(sketch.isCovered(30_000, 30_000)).isTrue();
  }

  @Test
  void rejectsFunctionOfAnotherFamily() {
    final WindowedSketch sketch = sketchWithNineSamples(SketchFunction.AVG_OVER_TIME);

    assertThatThrownBy(() ->
        sketch.evaluate(SketchFunction.QUANTILE_OVER_TIME, 0.5, 1000, 9000, 9000))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static double value(Evaluation evaluation) {
    return evaluation.getSamples().get(0).getValue();
  }
}
