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

import org.hubverse.transforms.BackendUnavailableException;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.SdkClientException;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.HeadBucketRequest;
import com.amazonaws.services.s3.model.HeadBucketResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up the AWS region a bucket lives in, so that the storage client talks
 * to the bucket's own regional endpoint.
 */
public class BucketRegionResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(BucketRegionResolver.class);

  private final AmazonS3 regionClient;

  public BucketRegionResolver(AmazonS3 regionClient) {
    this.regionClient = regionClient;
  }

  /**
   * Creates a resolver whose client can reach buckets in any region.
   */
  public static BucketRegionResolver create(S3Settings settings) {
    ClientConfiguration clientConfig = new ClientConfiguration()
        .withRequestTimeout(settings.getRequestTimeoutMillis())
        .withConnectionTimeout(settings.getConnectTimeoutMillis());
    AmazonS3 client = AmazonS3ClientBuilder.standard()
        .withClientConfiguration(clientConfig)
        .withCredentials(new DefaultAWSCredentialsProviderChain())
        .withRegion(settings.getDefaultRegion())
        .withForceGlobalBucketAccessEnabled(true)
        .build();
    return new BucketRegionResolver(client);
  }

  /**
   * Resolves the bucket's region.
   *
   * @param bucket Bucket name
   * @return the region name, e.g. {@code us-east-2}
   * @throws BackendUnavailableException if S3 cannot be reached or does not
   *     report a region
   */
  public String resolve(String bucket) {
    HeadBucketResult result;
    try {
      result = regionClient.headBucket(new HeadBucketRequest(bucket));
    } catch (SdkClientException | IllegalArgumentException e) {
      throw new BackendUnavailableException("Unable to resolve region of bucket " + bucket, e);
    }
    String region = result.getBucketRegion();
    if (region == null || region.isEmpty()) {
      throw new BackendUnavailableException("S3 reported no region for bucket " + bucket, null);
    }
    return region;
  }

  /**
   * Resolves the bucket's region, falling back to {@code defaultRegion} when
   * resolution fails. Never throws.
   */
  public String resolveOrDefault(String bucket, String defaultRegion) {
    try {
      String region = resolve(bucket);
      LOGGER.info("Resolved region {} for bucket {}", region, bucket);
      return region;
    } catch (BackendUnavailableException e) {
      LOGGER.warn("{}; using default region {}", e.getMessage(), defaultRegion);
      return defaultRegion;
    }
  }

  /** Releases the lookup client's connections. */
  public void shutdown() {
    regionClient.shutdown();
  }
}
