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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.rackspace.promsketch.app.exceptions.QueryParseException;
import com.rackspace.promsketch.app.model.QueryExpression;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QueryExpressionParserTest {

  QueryExpressionParser parser = new QueryExpressionParser(Caffeine.newBuilder().build());

  @Test
  void functionWithArgument() {
    final QueryExpression expression = parser.parse(
        "quantile_over_time(0.9, cpu_usage{machineid=\"machine_3\", core=\"1\"}[5m])");

    assertThat(expression).isEqualTo(new QueryExpression(
        "quantile_over_time",
        0.9,
        "cpu_usage",
        Map.of("machineid", "machine_3", "core", "1"),
        Duration.ofMinutes(5)
    ));
  }

  @Test
  void functionWithoutArgumentOrLabels() {
    final QueryExpression expression = parser.parse("avg_over_time(node:cpu[10s])");

    assertThat(expression.getFunctionName()).isEqualTo("avg_over_time");
    assertThat(expression.getArgument()).isNull();
    assertThat(expression.getMetric()).isEqualTo("node:cpu");
    assertThat(expression.getLabels()).isEmpty();
    assertThat(expression.getWindow()).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  void toleratesWhitespaceAndTrailingComma() {
    final QueryExpression expression = parser.parse(
        "  entropy_over_time ( cpu { machineid = \"machine_1\" , } [ 1h30m ] )  ");

    assertThat(expression.getLabels()).containsExactly(Map.entry("machineid", "machine_1"));
    assertThat(expression.getWindow()).isEqualTo(Duration.ofMinutes(90));
  }

  @Test
  void unescapesLabelValues() {
    final QueryExpression expression =
        parser.parse("avg_over_time(cpu{path=\"a\\\"b\",dir=\"c,d\"}[1m])");

    assertThat(expression.getLabels()).containsExactly(
        Map.entry("path", "a\"b"),
        Map.entry("dir", "c,d"));
  }

  @Test
  void cachesParsedExpressions() {
    final String query = "avg_over_time(cpu[1m])";

    assertThat(parser.parse(query)).isSameAs(parser.parse(query));
  }

  @Nested
  class malformed {

    @Test
    void empty() {
      assertThatThrownBy(() -> parser.parse(" "))
          .isInstanceOf(QueryParseException.class);
      assertThatThrownBy(() -> parser.parse(null))
          .isInstanceOf(QueryParseException.class);
    }

    @Test
    void missingRange() {
      assertThatThrownBy(() -> parser.parse("avg_over_time(cpu)"))
          .isInstanceOf(QueryParseException.class)
          .hasMessageContaining("Malformed query expression");
    }

    @Test
    void rangeWithoutUnit() {
      assertThatThrownBy(() -> parser.parse("avg_over_time(cpu[5])"))
          .isInstanceOf(QueryParseException.class);
    }

    @Test
    void unquotedLabelValue() {
      assertThatThrownBy(() -> parser.parse("avg_over_time(cpu{machineid=machine_1}[5m])"))
          .isInstanceOf(QueryParseException.class);
    }

    @Test
    void labelsWithoutSeparator() {
      assertThatThrownBy(() -> parser.parse("avg_over_time(cpu{a=\"1\" b=\"2\"}[5m])"))
          .isInstanceOf(QueryParseException.class);
    }

    @Test
    void duplicateLabel() {
      assertThatThrownBy(() -> parser.parse("avg_over_time(cpu{a=\"1\",a=\"2\"}[5m])"))
          .isInstanceOf(QueryParseException.class)
          .hasMessageContaining("more than once");
    }

    @Test
    void notAFunctionCall() {
      assertThatThrownBy(() -> parser.parse("cpu{a=\"1\"}[5m]"))
          .isInstanceOf(QueryParseException.class);
    }
  }
}
