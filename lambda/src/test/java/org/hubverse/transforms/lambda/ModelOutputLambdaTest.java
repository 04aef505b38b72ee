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

import org.hubverse.transforms.FilenameFormatException;
import org.hubverse.transforms.ModelOutputHandler;
import org.hubverse.transforms.format.ModelOutputTable;
import org.hubverse.transforms.format.ParquetTableReader;
import org.hubverse.transforms.storage.LocalFileStorageProvider;
import org.hubverse.transforms.storage.StorageProviderInputFile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ModelOutputLambda against local storage.
 */
@Tag("integration")
public class ModelOutputLambdaTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String PLANETS_CSV =
      "location,value\nearth,11.11\nvulcan,22.22\nseti alpha,33.33\n";

  @TempDir
  Path tempDir;

  private LocalFileStorageProvider storageProvider;
  private ModelOutputLambda lambda;

  @BeforeEach
  void setUp() {
    storageProvider = new LocalFileStorageProvider(tempDir);
    lambda = new ModelOutputLambda(TransformConfig.builder().build(),
        (bucket, key, config) ->
            new ModelOutputHandler(bucket, key, config.getOriginPrefix(), storageProvider));
  }

  private void putFile(String address, String content) throws IOException {
    Path file = tempDir.resolve(address);
    Files.createDirectories(file.getParent());
    Files.write(file, content.getBytes(StandardCharsets.UTF_8));
  }

  private String invoke(String bucket, String key) throws IOException {
    ByteArrayOutputStream output = new ByteArrayOutputStream();
    lambda.handleRequest(
        new ByteArrayInputStream(
            S3ObjectEventTest.notification(bucket, key).getBytes(StandardCharsets.UTF_8)),
        output, null);
    return new String(output.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test void testTransformsUploadedCsv() throws IOException {
    putFile("hub-bucket/raw/prefix1/prefix2/2420-01-01-teamA-model1.csv", PLANETS_CSV);

    JsonNode response = MAPPER.readTree(
        invoke("hub-bucket", "raw/prefix1/prefix2/2420-01-01-teamA-model1.csv"));

    assertEquals("prefix1/prefix2/2420-01-01-teamA-model1.parquet", response.get("key").asText());
    assertEquals("application/x-parquet", response.get("content_type").asText());

    ModelOutputTable written = new ParquetTableReader().read(new StorageProviderInputFile(
        storageProvider, "hub-bucket/prefix1/prefix2/2420-01-01-teamA-model1.parquet"));
    assertEquals(Arrays.asList("location", "value", "round_id", "team", "model"),
        written.getColumnNames());
    assertEquals(3, written.getNumRows());
  }

  @Test void testEncodedKey() throws IOException {
    putFile("hub-bucket/raw/my folder/2420-01-01-teamA-model1.csv", PLANETS_CSV);

    JsonNode response = MAPPER.readTree(
        invoke("hub-bucket", "raw/my+folder/2420-01-01-teamA-model1.csv"));

    assertEquals("my folder/2420-01-01-teamA-model1.parquet", response.get("key").asText());
    assertTrue(Files.exists(tempDir.resolve("hub-bucket/my folder/2420-01-01-teamA-model1.parquet")));
  }

  @Test void testSkippedKeyRespondsWithNull() throws IOException {
    ModelOutputLambda failing = new ModelOutputLambda(TransformConfig.builder().build(),
        (bucket, key, config) -> {
          throw new AssertionError("skipped keys must not be transformed");
        });
    ByteArrayOutputStream output = new ByteArrayOutputStream();
    failing.handleRequest(new ByteArrayInputStream(
        S3ObjectEventTest.notification("hub-bucket", "raw/model-metadata/teamA-model1.yml")
            .getBytes(StandardCharsets.UTF_8)), output, null);

    assertEquals("null", new String(output.toByteArray(), StandardCharsets.UTF_8));
    assertEquals("null", invoke("hub-bucket", "raw/prefix1/notes.txt"));
  }

  @Test void testInvalidFileNameIsRethrown() {
    assertThrows(FilenameFormatException.class,
        () -> invoke("hub-bucket", "raw/2420-01-01-janeways-addiction-voyager1.csv"));
  }

  @Test void testMissingObjectIsRethrown() {
    assertThrows(NoSuchFileException.class,
        () -> invoke("hub-bucket", "raw/2420-01-01-teamA-model1.csv"));
  }

  @Test void testMalformedEvent() {
    assertThrows(IllegalArgumentException.class, () -> lambda.handleRequest(
        new ByteArrayInputStream("{\"Records\": []}".getBytes(StandardCharsets.UTF_8)),
        new ByteArrayOutputStream(), null));
  }

  @Test void testHandleParsedEvent() throws IOException {
    putFile("hub-bucket/raw/2420-01-01-team-model.csv", PLANETS_CSV);

    JsonNode response = lambda.handle(MAPPER.readTree(
        S3ObjectEventTest.notification("hub-bucket", "raw/2420-01-01-team-model.csv")), null);

    assertEquals("./2420-01-01-team-model.parquet", response.get("key").asText());
  }
}
