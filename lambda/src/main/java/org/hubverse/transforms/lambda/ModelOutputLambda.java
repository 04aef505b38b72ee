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
import org.hubverse.transforms.TransformResult;
import org.hubverse.transforms.storage.StorageProvider;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Lambda entry point, triggered by S3 object-created notifications.
 *
 * <p>Transforms the first object of the event into Parquet and responds with
 * <pre>{@code {"key": "<written key>", "content_type": "<content type>"}}</pre>
 * or with JSON {@code null} when the object is skipped.
 */
public class ModelOutputLambda implements RequestStreamHandler {
  private static final Logger LOGGER = LoggerFactory.getLogger(ModelOutputLambda.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Creates the handler for one uploaded object. */
  public interface HandlerFactory {
    ModelOutputHandler create(String bucket, String key, TransformConfig config);
  }

  private final TransformConfig config;
  private final HandlerFactory handlerFactory;

  /** Used by the Lambda runtime; reads configuration from the environment. */
  public ModelOutputLambda() {
    this(TransformConfig.fromEnvironment(),
        (bucket, key, config) -> ModelOutputHandler.fromS3(bucket, key,
            config.getOriginPrefix(), config.toS3Settings()));
  }

  public ModelOutputLambda(TransformConfig config, HandlerFactory handlerFactory) {
    this.config = config;
    this.handlerFactory = handlerFactory;
  }

  @Override public void handleRequest(InputStream input, OutputStream output, Context context)
      throws IOException {
    JsonNode event = MAPPER.readTree(input);
    JsonNode response = handle(event, context);
    MAPPER.writeValue(output, response);
  }

  /**
   * Processes a parsed S3 event.
   *
   * @return the response document, or a JSON null node if the object was skipped
   * @throws IOException if the object cannot be read or written
   */
  public JsonNode handle(JsonNode event, Context context) throws IOException {
    S3ObjectEvent objectEvent = S3ObjectEvent.fromJson(event);
    String bucket = objectEvent.getBucket();
    String key = objectEvent.getKey();
    LOGGER.info("Received {} for {} in {} (request {})", objectEvent.getEventName(), key, bucket,
        context != null ? context.getAwsRequestId() : "local");

    String skipReason = ObjectKeyFilter.fromConfig(config).skipReason(key);
    if (skipReason != null) {
      LOGGER.info("Skipping {}: {}", key, skipReason);
      return NullNode.getInstance();
    }

    try {
      ModelOutputHandler handler = handlerFactory.create(bucket, key, config);
      LOGGER.info("{}", handler);
      TransformResult result = handler.transform();

      StorageProvider provider = handler.getStorageProvider();
      String contentType = provider.getMetadata(result.getAddress()).getContentType();
      LOGGER.info("Wrote {} with content type {}", result.getAddress(), contentType);

      ObjectNode response = MAPPER.createObjectNode();
      response.put("key", result.getPath());
      response.put("content_type", contentType);
      return response;
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Error transforming object {} from bucket {}", key, bucket, e);
      throw e;
    }
  }
}
