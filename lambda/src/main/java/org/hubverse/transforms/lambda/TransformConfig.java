/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.hubverse.transforms.lambda;

import org.hubverse.transforms.ModelOutputHandler;
import org.hubverse.transforms.storage.S3Settings;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

import java.util.Map;
import java.util.Set;

/**
 * Configuration of the model-output transform function.
 *
 * <h3>Environment variables</h3>
 * <pre>{@code
 * ORIGIN_PREFIX=raw                   # first key segment of raw uploads
 * SKIP_KEY_MARKERS=metadata           # keys containing any of these are skipped
 * ALLOWED_EXTENSIONS=csv,parquet      # other extensions are skipped
 * DEFAULT_REGION=us-east-1            # falls back to AWS_REGION
 * AWS_ENDPOINT_OVERRIDE=http://...    # optional, for S3-compatible services
 * S3_REQUEST_TIMEOUT_MS=10000
 * S3_CONNECT_TIMEOUT_MS=10000
 * }</pre>
 */
public class TransformConfig {
  public static final String ORIGIN_PREFIX = "ORIGIN_PREFIX";
  public static final String SKIP_KEY_MARKERS = "SKIP_KEY_MARKERS";
  public static final String ALLOWED_EXTENSIONS = "ALLOWED_EXTENSIONS";
  public static final String DEFAULT_REGION = "DEFAULT_REGION";
  public static final String AWS_REGION = "AWS_REGION";
  public static final String AWS_ENDPOINT_OVERRIDE = "AWS_ENDPOINT_OVERRIDE";
  public static final String S3_REQUEST_TIMEOUT_MS = "S3_REQUEST_TIMEOUT_MS";
  public static final String S3_CONNECT_TIMEOUT_MS = "S3_CONNECT_TIMEOUT_MS";

  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private final String originPrefix;
  private final Set<String> skipKeyMarkers;
  private final Set<String> allowedExtensions;
  private final String defaultRegion;
  private final String endpoint;
  private final int requestTimeoutMillis;
  private final int connectTimeoutMillis;

  private TransformConfig(Builder builder) {
    this.originPrefix = builder.originPrefix;
    this.skipKeyMarkers = builder.skipKeyMarkers;
    this.allowedExtensions = builder.allowedExtensions;
    this.defaultRegion = builder.defaultRegion;
    this.endpoint = builder.endpoint;
    this.requestTimeoutMillis = builder.requestTimeoutMillis;
    this.connectTimeoutMillis = builder.connectTimeoutMillis;
  }

  public String getOriginPrefix() {
    return originPrefix;
  }

  public Set<String> getSkipKeyMarkers() {
    return skipKeyMarkers;
  }

  public Set<String> getAllowedExtensions() {
    return allowedExtensions;
  }

  public String getDefaultRegion() {
    return defaultRegion;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public int getRequestTimeoutMillis() {
    return requestTimeoutMillis;
  }

  public int getConnectTimeoutMillis() {
    return connectTimeoutMillis;
  }

  /** S3 client settings for the core module. */
  public S3Settings toS3Settings() {
    return S3Settings.builder()
        .defaultRegion(defaultRegion)
        .endpoint(endpoint)
        .requestTimeoutMillis(requestTimeoutMillis)
        .connectTimeoutMillis(connectTimeoutMillis)
        .build();
  }

  public static TransformConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads the configuration from environment variables. Unset or blank
   * variables keep their defaults.
   *
   * @throws IllegalArgumentException if a timeout is not a positive integer
   */
  public static TransformConfig fromEnvironment(Map<String, String> env) {
    Builder builder = new Builder();
    if (isSet(env, ORIGIN_PREFIX)) {
      builder.originPrefix(env.get(ORIGIN_PREFIX).trim());
    }
    if (env.containsKey(SKIP_KEY_MARKERS)) {
      // An empty value disables marker skipping
      builder.skipKeyMarkers(LIST_SPLITTER.splitToList(env.get(SKIP_KEY_MARKERS)));
    }
    if (isSet(env, ALLOWED_EXTENSIONS)) {
      builder.allowedExtensions(LIST_SPLITTER.splitToList(env.get(ALLOWED_EXTENSIONS)));
    }
    if (isSet(env, DEFAULT_REGION)) {
      builder.defaultRegion(env.get(DEFAULT_REGION).trim());
    } else if (isSet(env, AWS_REGION)) {
      builder.defaultRegion(env.get(AWS_REGION).trim());
    }
    if (isSet(env, AWS_ENDPOINT_OVERRIDE)) {
      builder.endpoint(env.get(AWS_ENDPOINT_OVERRIDE).trim());
    }
    if (isSet(env, S3_REQUEST_TIMEOUT_MS)) {
      builder.requestTimeoutMillis(parseMillis(env, S3_REQUEST_TIMEOUT_MS));
    }
    if (isSet(env, S3_CONNECT_TIMEOUT_MS)) {
      builder.connectTimeoutMillis(parseMillis(env, S3_CONNECT_TIMEOUT_MS));
    }
    return builder.build();
  }

  private static boolean isSet(Map<String, String> env, String name) {
    String value = env.get(name);
    return value != null && !value.trim().isEmpty();
  }

  private static int parseMillis(Map<String, String> env, String name) {
    String value = env.get(name).trim();
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private String originPrefix = ModelOutputHandler.DEFAULT_ORIGIN_PREFIX;
    private Set<String> skipKeyMarkers = ImmutableSet.of("metadata");
    private Set<String> allowedExtensions = ImmutableSet.of("csv", "parquet");
    private String defaultRegion = S3Settings.DEFAULT_REGION;
    private String endpoint;
    private int requestTimeoutMillis = S3Settings.DEFAULT_TIMEOUT_MILLIS;
    private int connectTimeoutMillis = S3Settings.DEFAULT_TIMEOUT_MILLIS;

    public Builder originPrefix(String originPrefix) {
      this.originPrefix = originPrefix;
      return this;
    }

    public Builder skipKeyMarkers(Iterable<String> skipKeyMarkers) {
      this.skipKeyMarkers = ImmutableSet.copyOf(skipKeyMarkers);
      return this;
    }

    public Builder allowedExtensions(Iterable<String> allowedExtensions) {
      this.allowedExtensions = ImmutableSet.copyOf(allowedExtensions);
      return this;
    }

    public Builder defaultRegion(String defaultRegion) {
      this.defaultRegion = defaultRegion;
      return this;
    }

    public Builder endpoint(String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder requestTimeoutMillis(int requestTimeoutMillis) {
      this.requestTimeoutMillis = requestTimeoutMillis;
      return this;
    }

    public Builder connectTimeoutMillis(int connectTimeoutMillis) {
      this.connectTimeoutMillis = connectTimeoutMillis;
      return this;
    }

    public TransformConfig build() {
      if (originPrefix == null || originPrefix.isEmpty()) {
        throw new IllegalArgumentException("TransformConfig requires 'originPrefix'");
      }
      if (allowedExtensions.isEmpty()) {
        throw new IllegalArgumentException("TransformConfig requires at least one allowed extension");
      }
      if (requestTimeoutMillis <= 0 || connectTimeoutMillis <= 0) {
        throw new IllegalArgumentException("TransformConfig timeouts must be positive");
      }
      return new TransformConfig(this);
    }
  }
}
