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

import com.github.benmanes.caffeine.cache.Cache;
import com.rackspace.promsketch.app.exceptions.QueryParseException;
import com.rackspace.promsketch.app.model.QueryExpression;
import com.rackspace.promsketch.app.utils.DateTimeUtils;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Parses expressions of the form <code>func([argument,] metric{label="value",...}[range])</code>.
 * Successfully parsed expressions are cached by their text.
 */
@Service
@Slf4j
public class QueryExpressionParser {

  private static final String NUMBER = "[-+]?(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)(?:[eE][-+]?[0-9]+)?";

  private static final Pattern EXPRESSION = Pattern.compile(
      "\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\(\\s*"
          + "(?:(" + NUMBER + ")\\s*,\\s*)?"
          + "([a-zA-Z_:][a-zA-Z0-9_:]*)\\s*"
          + "(?:\\{(.*)\\})?\\s*"
          + "\\[\\s*([0-9a-z]+)\\s*\\]\\s*\\)\\s*");

  private static final Pattern LABEL_MATCHER = Pattern.compile(
      "\\G\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*=\\s*\"((?:[^\"\\\\]|\\\\.)*)\"\\s*(?:,|$)");

  private final Cache<String, QueryExpression> queryExpressionCache;

  @Autowired
  public QueryExpressionParser(Cache<String, QueryExpression> queryExpressionCache) {
    this.queryExpressionCache = queryExpressionCache;
  }

  /**
   * @throws QueryParseException if the expression is malformed
   */
  public QueryExpression parse(String query) {
    if (query == null || query.isBlank()) {
      throw new QueryParseException("Query expression is empty");
    }
    return queryExpressionCache.get(query, QueryExpressionParser::parseExpression);
  }

  static QueryExpression parseExpression(String query) {
    final Matcher match = EXPRESSION.matcher(query);
    if (!match.matches()) {
      throw new QueryParseException("Malformed query expression: " + query);
    }
    final String argument = match.group(2);
    final QueryExpression expression = new QueryExpression(
        match.group(1),
        argument == null ? null : Double.valueOf(argument),
        match.group(3),
        parseLabels(match.group(4)),
        DateTimeUtils.parseRange(match.group(5))
    );
    log.trace("Parsed {} into {}", query, expression);
    return expression;
  }

  private static Map<String, String> parseLabels(String labels) {
    if (labels == null || labels.isBlank()) {
      return Map.of();
    }
    final Map<String, String> result = new LinkedHashMap<>();
    final Matcher match = LABEL_MATCHER.matcher(labels);
    int end = 0;
    while (end < labels.length() && match.find()) {
      final String key = match.group(1);
      if (result.put(key, unescape(match.group(2))) != null) {
        throw new QueryParseException("Label " + key + " appears more than once");
      }
      end = match.end();
    }
    if (!labels.substring(end).isBlank()) {
      throw new QueryParseException("Malformed label matchers: {" + labels + "}");
    }
    return Collections.unmodifiableMap(result);
  }

  private static String unescape(String value) {
    return value.replace("\\\"", "\"").replace("\\\\", "\\");
  }
}
