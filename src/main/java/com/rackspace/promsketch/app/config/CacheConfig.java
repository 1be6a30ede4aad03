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


package com.rackspace.promsketch.app.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.rackspace.promsketch.app.model.QueryExpression;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

  private final MeterRegistry meterRegistry;
  private final QueryProperties queryProperties;

  @Autowired
  public CacheConfig(MeterRegistry meterRegistry, QueryProperties queryProperties) {
    this.meterRegistry = meterRegistry;
    this.queryProperties = queryProperties;
  }

  @Bean
  public Cache<String, QueryExpression> queryExpressionCache() {
    final Cache<String, QueryExpression> cache = Caffeine
        .newBuilder()
        .maximumSize(queryProperties.getExpressionCacheSize())
        .recordStats()
        .build();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "queryExpressionCache");
    return cache;
  }
}
