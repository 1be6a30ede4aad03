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

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import org.springframework.util.StringUtils;

/**
 * The label set identifying one series, metric name included. Labels are kept sorted by key so
 * that equality, hashing and rendering do not depend on the order labels arrived in.
 */
@SuppressWarnings("UnstableApiUsage") // due to guava
@EqualsAndHashCode(of = "labels")
public final class SeriesIdentity {

  private static final Charset CHARSET = StandardCharsets.UTF_8;

  private final ImmutableSortedMap<String, String> labels;
  private final String fingerprint;

  private SeriesIdentity(ImmutableSortedMap<String, String> labels) {
    this.labels = labels;
    this.fingerprint = computeFingerprint(labels);
  }

  /**
   * Builds the identity of a sample by merging the metric name into its labels. Labels with an
   * empty key or value are dropped and the metric name wins over a label using the same key.
   */
  public static SeriesIdentity of(String metricNameLabel, String metricName,
                                  Map<String, String> labels) {
    final ImmutableSortedMap.Builder<String, String> builder = ImmutableSortedMap.naturalOrder();
    if (labels != null) {
      labels.forEach((key, value) -> {
        if (StringUtils.hasText(key) && StringUtils.hasText(value)
            && !key.equals(metricNameLabel)) {
          builder.put(key, value);
        }
      });
    }
    builder.put(metricNameLabel, metricName);
    return new SeriesIdentity(builder.build());
  }

  public Map<String, String> getLabels() {
    return labels;
  }

  public String get(String label) {
    return labels.get(label);
  }

  /**
   * A short, stable key for the series, used in debug logs.
   */
  public String getFingerprint() {
    return fingerprint;
  }

  private static String computeFingerprint(Map<String, String> labels) {
    final Hasher hasher = Hashing.murmur3_128().newHasher();
    labels.forEach((key, value) -> hasher.putString(key, CHARSET).putString(value, CHARSET));
    final HashCode hashCode = hasher.hash();
    // 128 bits encode to 22 base64 characters plus two padding characters
    return Base64.getUrlEncoder().encodeToString(hashCode.asBytes()).substring(0, 22);
  }

  @Override
  public String toString() {
    return labels.entrySet().stream()
        .map(entry -> entry.getKey() + "=\"" + entry.getValue() + "\"")
        .collect(Collectors.joining(",", "{", "}"));
  }
}
