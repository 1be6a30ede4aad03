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


package com.rackspace.promsketch.app.services;

import com.rackspace.promsketch.app.config.AppProperties;
import com.rackspace.promsketch.app.config.QueryProperties;
import com.rackspace.promsketch.app.exceptions.InvalidQueryArgumentException;
import com.rackspace.promsketch.app.model.CoverageState;
import com.rackspace.promsketch.app.model.QueryExpression;
import com.rackspace.promsketch.app.model.QueryOutcome;
import com.rackspace.promsketch.app.model.QueryRequest;
import com.rackspace.promsketch.app.model.SamplePoint;
import com.rackspace.promsketch.app.partition.CoverageInterval;
import com.rackspace.promsketch.app.partition.RoutingTable;
import com.rackspace.promsketch.app.partition.SeriesIdentity;
import com.rackspace.promsketch.app.partition.SketchInstance;
import com.rackspace.promsketch.app.sketch.Evaluation;
import com.rackspace.promsketch.app.sketch.SketchFunction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringEscapeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Answers windowed aggregation queries from the sketch owning the series, but only once that
 * sketch has observed the whole requested window. Anything short of that is reported as pending
 * so the caller can retry later.
 */
@Service
@Slf4j
public class QueryEvaluator {

  public static final String PENDING_MESSAGE = "Sketch data not yet available. Try again later.";
  static final String TIMEOUT_MESSAGE = "Coverage check did not complete in time. Try again later.";

  private static final Logger aggregationLog = LoggerFactory.getLogger("promsketch.aggregation");
  private static final Logger coverageLog = LoggerFactory.getLogger("promsketch.coverage");

  private final RoutingTable routingTable;
  private final AppProperties appProperties;
  private final QueryProperties queryProperties;
  private final Counter resultCounter;
  private final Counter pendingCounter;
  private final Counter rejectedCounter;

  @Autowired
  public QueryEvaluator(RoutingTable routingTable,
                        AppProperties appProperties,
                        QueryProperties queryProperties,
                        MeterRegistry meterRegistry) {
    this.routingTable = routingTable;
    this.appProperties = appProperties;
    this.queryProperties = queryProperties;
    this.resultCounter = meterRegistry.counter("promsketch.query", "outcome", "result");
    this.pendingCounter = meterRegistry.counter("promsketch.query", "outcome", "pending");
    this.rejectedCounter = meterRegistry.counter("promsketch.query", "outcome", "rejected");
  }

  /**
   * Evaluates a parsed expression. When no evaluation time is given the window ends at the
   * newest sample observed for the series.
   *
   * @param evaluationTime epoch milliseconds the window ends at, may be null
   */
  public Mono<QueryOutcome> query(QueryExpression expression, Long evaluationTime) {
    return Mono.fromCallable(() -> toRequest(expression, evaluationTime))
        .doOnError(IllegalArgumentException.class, e -> rejectedCounter.increment())
        .flatMap(request -> request
            .map(resolved -> query(resolved))
            .orElseGet(() -> Mono.just(pending(CoverageState.UNCOVERED))));
  }

  /**
   * Evaluates a query over an explicit window.
   *
   * @throws IllegalArgumentException through the returned mono when the function is unknown,
   * its argument is invalid or the window is inverted
   */
  public Mono<QueryOutcome> query(QueryRequest request) {
    return Mono.fromCallable(() -> evaluate(request))
        .subscribeOn(Schedulers.parallel())
        .timeout(queryProperties.getCoverageTimeout(),
            Mono.fromSupplier(() -> {
              log.debug("Coverage check for {} timed out", request);
              return pending(CoverageState.UNCOVERED, TIMEOUT_MESSAGE);
            }))
        .doOnNext(outcome -> {
          if (outcome.isPending()) {
            pendingCounter.increment();
          } else {
            resultCounter.increment();
          }
        })
        .doOnError(IllegalArgumentException.class, e -> rejectedCounter.increment());
  }

  private Optional<QueryRequest> toRequest(QueryExpression expression, Long evaluationTime) {
    final SketchFunction function = SketchFunction.fromName(expression.getFunctionName());
    if (expression.getArgument() != null && !function.requiresArgument()) {
      throw new InvalidQueryArgumentException(function + " does not take an argument");
    }
    function.validateArgument(expression.getArgument());

    long maxt;
    if (evaluationTime != null) {
      maxt = evaluationTime;
    } else {
      final SeriesIdentity identity = identityOf(expression.getMetric(), expression.getLabels());
      final CoverageInterval observed = findSketch(identity, function)
          .map(SketchInstance::getCoverage)
          .orElse(CoverageInterval.EMPTY);
      if (observed.isEmpty()) {
        log.trace("No samples observed yet for {}", identity);
        pendingCounter.increment();
        return Optional.empty();
      }
      maxt = observed.getMaxObservedTime();
    }

    return Optional.of(new QueryRequest()
        .setFunction(function)
        .setMetric(expression.getMetric())
        .setLabels(expression.getLabels())
        .setMint(windowStart(maxt, expression))
        .setMaxt(maxt)
        .setArgument(expression.getArgument()));
  }

  private static long windowStart(long maxt, QueryExpression expression) {
    try {
      return Math.subtractExact(maxt, expression.getWindow().toMillis());
    } catch (ArithmeticException e) {
      throw new InvalidQueryArgumentException(String.format(
          "Window of %s ending at %d is out of range", expression.getWindow(), maxt));
    }
  }

  QueryOutcome evaluate(QueryRequest request) {
    final SketchFunction function = request.getFunction();
    if (function == null) {
      throw new InvalidQueryArgumentException("Query names no aggregation function");
    }
    function.validateArgument(request.getArgument());
    if (request.getMint() > request.getMaxt()) {
      throw new InvalidQueryArgumentException(String.format(
          "Window start %d is after its end %d", request.getMint(), request.getMaxt()));
    }

    final long started = System.nanoTime();
    final SeriesIdentity identity = identityOf(request.getMetric(), request.getLabels());
    final Optional<SketchInstance> sketch = findSketch(identity, function);
    final CoverageState state = sketch
        .map(instance -> instance.coverageState(request.getMint(), request.getMaxt()))
        .orElse(CoverageState.UNCOVERED);
    logCoverage(request, identity, sketch.map(SketchInstance::getCoverage)
        .orElse(CoverageInterval.EMPTY), state);

    if (state != CoverageState.COVERED) {
      return pending(state);
    }

    final double argument = request.getArgument() == null ? 0 : request.getArgument();
    final Evaluation evaluation = sketch.get().evaluate(function, argument,
        request.getMint(), request.getMaxt(), System.currentTimeMillis());
    final List<SamplePoint> samples = evaluation.getSamples().stream()
        .filter(sample -> !sample.isSentinel())
        .collect(Collectors.toList());

    logAggregation(request, identity, samples.size(), (System.nanoTime() - started) / 1e6);
    return QueryOutcome.result(samples, evaluation.getAnnotations());
  }

  private SeriesIdentity identityOf(String metric, Map<String, String> labels) {
    return SeriesIdentity.of(appProperties.getMetricNameLabel(), metric, labels);
  }

  private Optional<SketchInstance> findSketch(SeriesIdentity identity, SketchFunction function) {
    return routingTable.nodeFor(identity)
        .flatMap(node -> node.findSketch(identity, function));
  }

  private static QueryOutcome pending(CoverageState state) {
    return pending(state, PENDING_MESSAGE);
  }

  private static QueryOutcome pending(CoverageState state, String message) {
    return QueryOutcome.pending(state, message);
  }

  private void logCoverage(QueryRequest request, SeriesIdentity identity,
                           CoverageInterval observed, CoverageState state) {
    coverageLog.info("{},{},{},{},{},{},{},{}",
        System.currentTimeMillis(),
        request.getFunction(),
        StringEscapeUtils.escapeCsv(identity.toString()),
        request.getMint(),
        request.getMaxt(),
        observed.isEmpty() ? "" : observed.getMinObservedTime(),
        observed.isEmpty() ? "" : observed.getMaxObservedTime(),
        state);
  }

  private void logAggregation(QueryRequest request, SeriesIdentity identity, int resultCount,
                              double latencyMs) {
    aggregationLog.info("{},{},{},{},{},{},{}",
        System.currentTimeMillis(),
        request.getFunction(),
        StringEscapeUtils.escapeCsv(identity.toString()),
        request.getMint(),
        request.getMaxt(),
        resultCount,
        String.format(Locale.ROOT, "%.3f", latencyMs));
  }
}
