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

import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AbstractAmazonS3;
import com.amazonaws.services.s3.model.AmazonS3Exception;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.HeadBucketRequest;
import com.amazonaws.services.s3.model.HeadBucketResult;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.amazonaws.services.s3.model.PutObjectResult;
import com.amazonaws.services.s3.model.S3Object;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory stand-in for the S3 operations used by {@link S3StorageProvider}
 * and {@link BucketRegionResolver}. Records every ranged GET.
 */
public class InMemoryS3 extends AbstractAmazonS3 {
  private final Map<String, byte[]> objects = new HashMap<>();
  private final Map<String, String> contentTypes = new HashMap<>();
  private final Map<String, String> bucketRegions = new HashMap<>();
  private final List<long[]> rangeRequests = new ArrayList<>();
  private boolean shutdown;

  public void putBytes(String bucket, String key, byte[] content, String contentType) {
    objects.put(bucket + "/" + key, content);
    contentTypes.put(bucket + "/" + key, contentType);
  }

  public byte[] getBytes(String bucket, String key) {
    return objects.get(bucket + "/" + key);
  }

  public void setBucketRegion(String bucket, String region) {
    bucketRegions.put(bucket, region);
  }

  public List<long[]> getRangeRequests() {
    return rangeRequests;
  }

  public boolean isShutdown() {
    return shutdown;
  }

  private byte[] require(String bucket, String key) {
    byte[] content = objects.get(bucket + "/" + key);
    if (content == null) {
      AmazonS3Exception e = new AmazonS3Exception("Not Found");
      e.setStatusCode(404);
      e.setErrorCode("NoSuchKey");
      throw e;
    }
    return content;
  }

  @Override public ObjectMetadata getObjectMetadata(String bucket, String key) {
    byte[] content = require(bucket, key);
    ObjectMetadata metadata = new ObjectMetadata();
    metadata.setContentLength(content.length);
    metadata.setContentType(contentTypes.get(bucket + "/" + key));
    metadata.setLastModified(new Date());
    return metadata;
  }

  @Override public S3Object getObject(GetObjectRequest request) {
    byte[] content = require(request.getBucketName(), request.getKey());
    long[] range = request.getRange();
    if (range != null) {
      rangeRequests.add(range.clone());
      content = Arrays.copyOfRange(content, (int) range[0],
          (int) Math.min(range[1] + 1, content.length));
    }
    S3Object object = new S3Object();
    object.setBucketName(request.getBucketName());
    object.setKey(request.getKey());
    object.setObjectContent(new ByteArrayInputStream(content));
    return object;
  }

  @Override public S3Object getObject(String bucket, String key) {
    return getObject(new GetObjectRequest(bucket, key));
  }

  @Override public PutObjectResult putObject(PutObjectRequest request) {
    byte[] content;
    try {
      content = Files.readAllBytes(request.getFile().toPath());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    String contentType = request.getMetadata() != null
        ? request.getMetadata().getContentType()
        : null;
    putBytes(request.getBucketName(), request.getKey(), content, contentType);
    return new PutObjectResult();
  }

  @Override public boolean doesObjectExist(String bucket, String key) {
    return objects.containsKey(bucket + "/" + key);
  }

  @Override public HeadBucketResult headBucket(HeadBucketRequest request) {
    String region = bucketRegions.get(request.getBucketName());
    if (region == null) {
      throw new SdkClientException("Unable to reach bucket " + request.getBucketName());
    }
    return new HeadBucketResult().withBucketRegion(region);
  }

  @Override public void shutdown() {
    shutdown = true;
  }
}
