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
package org.hubverse.transforms;

import org.hubverse.transforms.format.CsvTableReader;
import org.hubverse.transforms.format.FileFormat;
import org.hubverse.transforms.format.ModelOutputTable;
import org.hubverse.transforms.format.ParquetTableReader;
import org.hubverse.transforms.format.ParquetTableWriter;
import org.hubverse.transforms.storage.S3Settings;
import org.hubverse.transforms.storage.S3StorageProvider;
import org.hubverse.transforms.storage.StorageProvider;
import org.hubverse.transforms.storage.StorageProviderInputFile;
import org.hubverse.transforms.storage.StorageProviderOutputFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Transforms one raw model-output file: reads it, appends the round id, team
 * and model parsed from its name as columns, and writes the result as
 * Parquet next to the raw file's path with the origin prefix removed.
 *
 * <p>For example, {@code raw/prefix1/prefix2/2420-01-01-teamA-model1.csv}
 * with origin prefix {@code raw} is written to
 * {@code prefix1/prefix2/2420-01-01-teamA-model1.parquet} in the same bucket.
 *
 * <p>A handler is built for a single file and is not reused. Validation
 * happens in the constructor; I/O happens only in the read and write steps.
 */
public class ModelOutputHandler {
  public static final String DEFAULT_ORIGIN_PREFIX = "raw";

  public static final String ROUND_ID_COLUMN = "round_id";
  public static final String TEAM_COLUMN = "team";
  public static final String MODEL_COLUMN = "model";

  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(ModelOutputHandler.class);

  private final ModelOutputLocation location;
  private final ModelOutputFileName fileNameParts;
  private final String originPrefix;
  private final StorageProvider storageProvider;
  private final Logger logger;

  /**
   * Creates a handler for a file reachable through {@code storageProvider}.
   *
   * @param storageLocation Bucket or other container holding the file
   * @param filePath Object path of the raw file, starting with the origin prefix
   * @param originPrefix First path segment of raw uploads, e.g. {@code raw}
   * @param storageProvider Provider used to read and write the file
   * @throws PathPrefixException if the path does not start with the origin prefix
   * @throws UnsupportedFileTypeException if the file is not CSV or Parquet
   * @throws FilenameFormatException if the name is not {@code round_id-team-model}
   */
  public ModelOutputHandler(String storageLocation, String filePath, String originPrefix,
      StorageProvider storageProvider) {
    this(storageLocation, filePath, originPrefix, storageProvider, DEFAULT_LOGGER);
  }

  public ModelOutputHandler(String storageLocation, String filePath, String originPrefix,
      StorageProvider storageProvider, Logger logger) {
    this.storageProvider = Objects.requireNonNull(storageProvider, "storageProvider");
    this.logger = Objects.requireNonNull(logger, "logger");
    this.originPrefix = originPrefix;

    this.location = ModelOutputLocation.parse(storageLocation, filePath, originPrefix);
    logger.info("Parsed file path: {}", location);

    this.fileNameParts = ModelOutputFileName.parse(location.getFileName());
    logger.info("Parsed model-output filename: {}", fileNameParts);
  }

  /**
   * Creates a handler for an object in S3, with a storage client bound to the
   * bucket's region.
   *
   * @param bucket Bucket holding the object
   * @param key Decoded object key
   * @param originPrefix First path segment of raw uploads
   * @param settings S3 client settings
   */
  public static ModelOutputHandler fromS3(String bucket, String key, String originPrefix,
      S3Settings settings) {
    // Validate before building a client
    ModelOutputFileName.parse(ModelOutputLocation.parse(bucket, key, originPrefix).getFileName());
    return new ModelOutputHandler(bucket, key, originPrefix,
        S3StorageProvider.forBucket(bucket, settings));
  }

  /**
   * Reads the raw file. CSV is streamed; Parquet is read with random access
   * because its metadata sits in a footer at the end of the file.
   *
   * @return the file's content
   * @throws IOException if the file cannot be read or parsed
   */
  public ModelOutputTable readTable() throws IOException {
    String address = location.getSourceAddress();
    logger.info("Reading file: {}", address);

    FileFormat format = location.getFileFormat();
    switch (format) {
    case CSV:
      try (InputStream in = storageProvider.openInputStream(address)) {
        return new CsvTableReader().read(in);
      }
    case PARQUET:
      return new ParquetTableReader().read(
          new StorageProviderInputFile(storageProvider, address));
    default:
      throw new UnsupportedOperationException("Unsupported file type: " + format);
    }
  }

  /**
   * Returns a copy of {@code table} with {@code round_id}, {@code team} and
   * {@code model} columns appended, each holding this file's value in every
   * row. The argument is not modified.
   */
  public ModelOutputTable addColumns(ModelOutputTable table) {
    logger.info("Adding columns to table with {} rows", table.getNumRows());
    return table
        .withConstantColumn(ROUND_ID_COLUMN, fileNameParts.getRoundId())
        .withConstantColumn(TEAM_COLUMN, fileNameParts.getTeam())
        .withConstantColumn(MODEL_COLUMN, fileNameParts.getModel());
  }

  /**
   * Writes {@code table} as Parquet to the destination path in the same
   * container, whatever the raw file's format was.
   *
   * @return where the file was written
   * @throws IOException if the file cannot be written
   */
  public TransformResult writeTable(ModelOutputTable table) throws IOException {
    TransformResult result =
        new TransformResult(location.getStorageLocation(), location.getTransformedPath());
    new ParquetTableWriter().write(table,
        new StorageProviderOutputFile(storageProvider, result.getAddress()));
    logger.info("Finished writing parquet file: {}", result.getAddress());
    return result;
  }

  /**
   * Reads, augments and writes the file. Failures propagate unchanged; a
   * failed write may leave a partial or missing destination object.
   *
   * @return where the transformed file was written
   * @throws IOException if reading or writing fails
   */
  public TransformResult transform() throws IOException {
    ModelOutputTable table = readTable();
    ModelOutputTable augmented = addColumns(table);
    return writeTable(augmented);
  }

  public String getStorageLocation() {
    return location.getStorageLocation();
  }

  public String getFilePath() {
    return location.getFilePath();
  }

  public String getFileName() {
    return location.getFileName();
  }

  public FileFormat getFileFormat() {
    return location.getFileFormat();
  }

  public String getDestinationPath() {
    return location.getDestinationPath();
  }

  public String getOriginPrefix() {
    return originPrefix;
  }

  public String getRoundId() {
    return fileNameParts.getRoundId();
  }

  public String getTeam() {
    return fileNameParts.getTeam();
  }

  public String getModel() {
    return fileNameParts.getModel();
  }

  public StorageProvider getStorageProvider() {
    return storageProvider;
  }

  @Override public String toString() {
    return "Handle model-output data transforms for " + location.getFilePath()
        + " in " + location.getStorageLocation() + ".";
  }
}
