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

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Bucket and object key of the first record of an S3 event notification.
 *
 * <p>S3 URL-encodes object keys in notifications (spaces arrive as
 * {@code +}); {@link #getKey()} returns the decoded key.
 */
public final class S3ObjectEvent {
  private final String eventName;
  private final String bucket;
  private final String key;

  public S3ObjectEvent(String eventName, String bucket, String key) {
    this.eventName = eventName;
    this.bucket = Objects.requireNonNull(bucket, "bucket");
    this.key = Objects.requireNonNull(key, "key");
  }

  /**
   * Extracts the first record of an S3 event notification.
   *
   * @param event Notification parsed with Jackson's tree model
   * @return the record's bucket and decoded key
   * @throws IllegalArgumentException if the event has no records, or the
   *     first record has no bucket name or object key
   */
  public static S3ObjectEvent fromJson(JsonNode event) {
    if (event == null || event.isNull()) {
      throw new IllegalArgumentException("S3 event is empty");
    }
    JsonNode records = event.get("Records");
    if (records == null || !records.isArray() || records.isEmpty()) {
      throw new IllegalArgumentException("No Records found in S3 event");
    }
    JsonNode record = records.get(0);
    JsonNode s3 = record.path("s3");
    String bucket = requireText(s3.path("bucket").path("name"), "s3.bucket.name");
    String rawKey = requireText(s3.path("object").path("key"), "s3.object.key");
    JsonNode eventName = record.get("eventName");
    return new S3ObjectEvent(eventName != null ? eventName.asText() : null,
        bucket, decodeKey(rawKey));
  }

  /** Decodes a key as S3 encodes it in notifications. */
  static String decodeKey(String rawKey) {
    return URLDecoder.decode(rawKey, StandardCharsets.UTF_8);
  }

  private static String requireText(JsonNode node, String field) {
    if (node.isMissingNode() || node.isNull() || !node.isValueNode()
        || node.asText().isEmpty()) {
      throw new IllegalArgumentException("S3 event record is missing " + field);
    }
    return node.asText();
  }

  /** Event type, e.g. {@code ObjectCreated:Put}; may be null. */
  public String getEventName() {
    return eventName;
  }

  public String getBucket() {
    return bucket;
  }

  public String getKey() {
    return key;
  }

  @Override public String toString() {
    return "S3ObjectEvent{eventName=" + eventName + ", bucket=" + bucket + ", key=" + key + "}";
  }
}
