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


package com.rackspace.promsketch.app.web;

import com.rackspace.promsketch.app.model.QueryExpression;
import com.rackspace.promsketch.app.model.QueryOutcome;
import com.rackspace.promsketch.app.model.QueryRequest;
import com.rackspace.promsketch.app.model.QueryResponse;
import com.rackspace.promsketch.app.services.QueryEvaluator;
import com.rackspace.promsketch.app.services.QueryExpressionParser;
import com.rackspace.promsketch.app.sketch.SketchFunction;
import com.rackspace.promsketch.app.utils.DateTimeUtils;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Query endpoints. A covered query answers 200 with its samples, an uncovered one answers 202
 * with a pending status and the caller is expected to retry.
 */
@RestController
@Slf4j
public class QueryController {

  static final String LABEL_PARAM_PREFIX = "label_";

  private final QueryExpressionParser queryExpressionParser;
  private final QueryEvaluator queryEvaluator;

  @Autowired
  public QueryController(QueryExpressionParser queryExpressionParser,
                         QueryEvaluator queryEvaluator) {
    this.queryExpressionParser = queryExpressionParser;
    this.queryEvaluator = queryEvaluator;
  }

  /**
   * @param q expression such as <code>quantile_over_time(0.9, cpu{machineid="machine_3"}[5m])</code>
   * @param time optional evaluation time; the window otherwise ends at the newest sample of the
   * series
   */
  @GetMapping("/parse")
  public Mono<ResponseEntity<QueryResponse>> parse(@RequestParam String q,
                                                   @RequestParam(required = false) String time) {
    return timed(() -> {
      final QueryExpression expression = queryExpressionParser.parse(q);
      final Long evaluationTime = time == null ? null : DateTimeUtils.parseEpochMillis(time);
      return queryEvaluator.query(expression, evaluationTime);
    });
  }

  /**
   * Explicit window form, with label filters given as <code>label_&lt;name&gt;=&lt;value&gt;</code>
   * parameters.
   */
  @GetMapping("/query")
  public Mono<ResponseEntity<QueryResponse>> query(
      @RequestParam String func,
      @RequestParam String metric,
      @RequestParam long mint,
      @RequestParam long maxt,
      @RequestParam(required = false) Double args,
      @RequestParam MultiValueMap<String, String> allParams) {
    return timed(() -> {
      final QueryRequest request = new QueryRequest()
          .setFunction(SketchFunction.fromName(func))
          .setMetric(metric)
          .setLabels(labelParams(allParams))
          .setMint(mint)
          .setMaxt(maxt)
          .setArgument(args);
      return queryEvaluator.query(request);
    });
  }

  private static Map<String, String> labelParams(MultiValueMap<String, String> allParams) {
    final Map<String, String> labels = new HashMap<>();
    allParams.forEach((name, values) -> {
      if (name.startsWith(LABEL_PARAM_PREFIX) && !values.isEmpty()) {
        labels.put(name.substring(LABEL_PARAM_PREFIX.length()), values.get(0));
      }
    });
    return labels;
  }

  private static Mono<ResponseEntity<QueryResponse>> timed(Supplier<Mono<QueryOutcome>> query) {
    return Mono.defer(() -> {
      final long started = System.nanoTime();
      return query.get()
          .map(outcome -> toResponse(outcome, (System.nanoTime() - started) / 1e6));
    });
  }

  private static ResponseEntity<QueryResponse> toResponse(QueryOutcome outcome,
                                                          double latencyMs) {
    if (outcome.isPending()) {
      return ResponseEntity.status(HttpStatus.ACCEPTED)
          .body(new QueryResponse()
              .setStatus(QueryResponse.STATUS_PENDING)
              .setMessage(outcome.getMessage())
              .setQueryLatencyMs(latencyMs));
    }
    return ResponseEntity.ok(new QueryResponse()
        .setStatus(QueryResponse.STATUS_SUCCESS)
        .setData(outcome.getSamples())
        .setAnnotations(outcome.getAnnotations().isEmpty() ? null : outcome.getAnnotations())
        .setQueryLatencyMs(latencyMs));
  }
}
