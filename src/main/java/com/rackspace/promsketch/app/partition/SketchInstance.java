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

import com.rackspace.promsketch.app.model.CoverageState;
import com.rackspace.promsketch.app.sketch.Evaluation;
import com.rackspace.promsketch.app.sketch.Sketch;
import com.rackspace.promsketch.app.sketch.SketchFunction;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.Getter;

/**
 * The sketch of one series for one configured function, along with the time range it has
 * observed. Inserts are serialized per instance and evaluations never run concurrently with an
 * insert. The coverage interval can be read without taking the lock.
 */
public class SketchInstance {

  @Getter
  private final SeriesIdentity identity;
  @Getter
  private final SketchFunction function;
  private final Sketch sketch;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private volatile CoverageInterval coverage = CoverageInterval.EMPTY;
  @Getter
  private volatile long lastInsertTime;

  public SketchInstance(SeriesIdentity identity, SketchFunction function, Sketch sketch) {
    this.identity = identity;
    this.function = function;
    this.sketch = sketch;
  }

  /**
   * @throws IllegalArgumentException if the sketch rejects the sample, in which case the
   * coverage interval is left unchanged
   */
  public void insert(long timestamp, double value) {
    lock.writeLock().lock();
    try {
      sketch.insert(timestamp, value);
      coverage = coverage.extend(timestamp);
      lastInsertTime = System.currentTimeMillis();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public CoverageInterval getCoverage() {
    return coverage;
  }

  public CoverageState coverageState(long mint, long maxt) {
    final CoverageInterval observed = coverage;
    if (observed.isEmpty()) {
      return CoverageState.UNCOVERED;
    }
    if (!observed.spans(mint, maxt)) {
      return CoverageState.PARTIAL;
    }
    lock.readLock().lock();
    try {
      // the sketch may have evicted the start of the window since it was observed
      return sketch.isCovered(mint, maxt) ? CoverageState.COVERED : CoverageState.PARTIAL;
    } finally {
      lock.readLock().unlock();
    }
  }

  public Evaluation evaluate(SketchFunction requested, double argument, long mint, long maxt,
                             long now) {
    lock.readLock().lock();
    try {
      return sketch.evaluate(requested, argument, mint, maxt, now);
    } finally {
      lock.readLock().unlock();
    }
  }
}
