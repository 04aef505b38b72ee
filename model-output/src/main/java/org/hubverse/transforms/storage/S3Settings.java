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
package org.hubverse.transforms.storage;

/**
 * Client settings for {@link S3StorageProvider}.
 *
 * <p>Timeouts default to ten seconds; the region is only a fallback, used
 * when a bucket's own region cannot be resolved.
 */
public class S3Settings {
  public static final String DEFAULT_REGION = "us-east-1";
  public static final int DEFAULT_TIMEOUT_MILLIS = 10_000;

  private final String defaultRegion;
  private final String endpoint;
  private final int requestTimeoutMillis;
  private final int connectTimeoutMillis;

  private S3Settings(Builder builder) {
    this.defaultRegion = builder.defaultRegion;
    this.endpoint = builder.endpoint;
    this.requestTimeoutMillis = builder.requestTimeoutMillis;
    this.connectTimeoutMillis = builder.connectTimeoutMillis;
  }

  public String getDefaultRegion() {
    return defaultRegion;
  }

  /** Custom endpoint for S3-compatible services (MinIO etc.), or null for AWS. */
  public String getEndpoint() {
    return endpoint;
  }

  public int getRequestTimeoutMillis() {
    return requestTimeoutMillis;
  }

  public int getConnectTimeoutMillis() {
    return connectTimeoutMillis;
  }

  public static S3Settings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private String defaultRegion = DEFAULT_REGION;
    private String endpoint;
    private int requestTimeoutMillis = DEFAULT_TIMEOUT_MILLIS;
    private int connectTimeoutMillis = DEFAULT_TIMEOUT_MILLIS;

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

    public S3Settings build() {
      if (defaultRegion == null || defaultRegion.isEmpty()) {
        throw new IllegalArgumentException("S3Settings requires 'defaultRegion'");
      }
      if (requestTimeoutMillis <= 0 || connectTimeoutMillis <= 0) {
        throw new IllegalArgumentException("S3Settings timeouts must be positive");
      }
      return new S3Settings(this);
    }
  }
}
