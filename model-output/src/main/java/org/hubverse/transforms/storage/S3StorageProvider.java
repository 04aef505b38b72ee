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

import com.amazonaws.ClientConfiguration;
import com.amazonaws.SdkClientException;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Storage provider implementation for Amazon S3.
 *
 * <p>Random access uses ranged GET requests. Writes are staged in a local
 * temporary file and uploaded with a single PUT when the stream is closed.
 */
public class S3StorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(S3StorageProvider.class);

  private static final String S3_SCHEME = "s3://";

  private final AmazonS3 s3Client;

  public S3StorageProvider(AmazonS3 s3Client) {
    this.s3Client = s3Client;
  }

  /**
   * Creates a provider talking to the bucket's own region. If the region
   * cannot be resolved, the settings' default region is used instead.
   *
   * @param bucket Bucket the provider will work against
   * @param settings Client settings
   * @return the provider
   */
  public static S3StorageProvider forBucket(String bucket, S3Settings settings) {
    if (settings.getEndpoint() != null) {
      // S3-compatible services are addressed by endpoint, not region
      return new S3StorageProvider(buildClient(settings.getDefaultRegion(), settings));
    }
    return forBucket(bucket, settings, BucketRegionResolver.create(settings));
  }

  /**
   * Resolves the bucket's region with {@code resolver}, then shuts the
   * resolver down.
   */
  static S3StorageProvider forBucket(String bucket, S3Settings settings,
      BucketRegionResolver resolver) {
    String region;
    try {
      region = resolver.resolveOrDefault(bucket, settings.getDefaultRegion());
    } finally {
      resolver.shutdown();
    }
    return new S3StorageProvider(buildClient(region, settings));
  }

  static AmazonS3 buildClient(String region, S3Settings settings) {
    ClientConfiguration clientConfig = new ClientConfiguration()
        .withRequestTimeout(settings.getRequestTimeoutMillis())
        .withConnectionTimeout(settings.getConnectTimeoutMillis());

    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
        .withClientConfiguration(clientConfig)
        .withCredentials(new DefaultAWSCredentialsProviderChain());

    if (settings.getEndpoint() != null) {
      builder.withEndpointConfiguration(new EndpointConfiguration(settings.getEndpoint(), region));
      // Enable path-style access for S3-compatible services like MinIO
      builder.withPathStyleAccessEnabled(true);
    } else {
      builder.withRegion(region);
    }
    LOGGER.debug("Building S3 client for region {} (endpoint: {})", region,
        settings.getEndpoint() != null ? settings.getEndpoint() : "default");
    return builder.build();
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    S3Address address = S3Address.parse(path);
    try {
      return s3Client.getObject(address.bucket, address.key).getObjectContent();
    } catch (SdkClientException e) {
      throw new IOException("Failed to read S3 object: " + path, e);
    }
  }

  @Override public RandomAccessSource openRandomAccess(String path) throws IOException {
    S3Address address = S3Address.parse(path);
    long length;
    try {
      length = s3Client.getObjectMetadata(address.bucket, address.key).getContentLength();
    } catch (SdkClientException e) {
      throw new IOException("Failed to read S3 object metadata: " + path, e);
    }
    return new RangeRequestSource(address, length);
  }

  @Override public OutputStream openOutputStream(String path) throws IOException {
    S3Address address = S3Address.parse(path);
    Path staging = Files.createTempFile("s3-upload-", ".tmp");
    return new StagedUploadStream(address, staging);
  }

  @Override public FileMetadata getMetadata(String path) throws IOException {
    S3Address address = S3Address.parse(path);
    ObjectMetadata metadata;
    try {
      metadata = s3Client.getObjectMetadata(address.bucket, address.key);
    } catch (SdkClientException e) {
      throw new IOException("Failed to read S3 object metadata: " + path, e);
    }
    return new FileMetadata(
        path,
        metadata.getContentLength(),
        metadata.getLastModified() != null ? metadata.getLastModified().getTime() : 0L,
        metadata.getContentType(),
        metadata.getETag());
  }

  @Override public boolean exists(String path) throws IOException {
    S3Address address = S3Address.parse(path);
    try {
      return s3Client.doesObjectExist(address.bucket, address.key);
    } catch (SdkClientException e) {
      throw new IOException("Failed to check S3 object: " + path, e);
    }
  }

  @Override public String getStorageType() {
    return "s3";
  }

  /**
   * Reads byte ranges of one object with ranged GET requests.
   */
  private class RangeRequestSource implements RandomAccessSource {
    private final S3Address address;
    private final long length;

    RangeRequestSource(S3Address address, long length) {
      this.address = address;
      this.length = length;
    }

    @Override public long length() {
      return length;
    }

    @Override public void readFully(long position, byte[] buffer, int offset, int count)
        throws IOException {
      if (count == 0) {
        return;
      }
      if (position + count > length) {
        throw new EOFException("Read of " + count + " bytes at " + position
            + " runs past end of " + address + " (" + length + " bytes)");
      }
      GetObjectRequest request = new GetObjectRequest(address.bucket, address.key)
          .withRange(position, position + count - 1);
      try (S3Object object = s3Client.getObject(request);
           S3ObjectInputStream in = object.getObjectContent()) {
        int read = 0;
        while (read < count) {
          int n = in.read(buffer, offset + read, count - read);
          if (n < 0) {
            throw new EOFException("Unexpected end of " + address + " at "
                + (position + read));
          }
          read += n;
        }
      } catch (SdkClientException e) {
        throw new IOException("Failed to read range of S3 object: " + address, e);
      }
    }

    @Override public void close() {
      // Each range request closes its own connection
    }
  }

  /**
   * Buffers written bytes in a temporary file and uploads them on close.
   */
  private class StagedUploadStream extends FilterOutputStream {
    private final S3Address address;
    private final Path staging;
    private boolean closed;

    StagedUploadStream(S3Address address, Path staging) throws IOException {
      super(new BufferedOutputStream(Files.newOutputStream(staging)));
      this.address = address;
      this.staging = staging;
    }

    @Override public void write(byte[] b, int off, int len) throws IOException {
      out.write(b, off, len);
    }

    @Override public void close() throws IOException {
      if (closed) {
        return;
      }
      closed = true;
      try {
        super.close();
        ObjectMetadata metadata = new ObjectMetadata();
        metadata.setContentType(ContentTypes.guess(address.key));
        PutObjectRequest request =
            new PutObjectRequest(address.bucket, address.key, staging.toFile())
                .withMetadata(metadata);
        s3Client.putObject(request);
        LOGGER.debug("Uploaded {} bytes to {}", Files.size(staging), address);
      } catch (SdkClientException e) {
        throw new IOException("Failed to write file to S3: " + address, e);
      } finally {
        Files.deleteIfExists(staging);
      }
    }
  }

  /**
   * Bucket and key parsed from a {@code bucket/key} address. A leading
   * {@code s3://} is accepted.
   */
  static final class S3Address {
    final String bucket;
    final String key;

    private S3Address(String bucket, String key) {
      this.bucket = bucket;
      this.key = key;
    }

    static S3Address parse(String path) throws IOException {
      String address = path.startsWith(S3_SCHEME) ? path.substring(S3_SCHEME.length()) : path;
      int slash = address.indexOf('/');
      if (slash <= 0 || slash == address.length() - 1) {
        throw new IOException("Invalid S3 address, expected bucket/key: " + path);
      }
      return new S3Address(address.substring(0, slash), address.substring(slash + 1));
    }

    @Override public String toString() {
      return S3_SCHEME + bucket + "/" + key;
    }
  }
}
