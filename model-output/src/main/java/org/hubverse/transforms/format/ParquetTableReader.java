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
package org.hubverse.transforms.format;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.metadata.FileMetaData;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.Type;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a Parquet model-output file into a {@link ModelOutputTable}, keeping
 * the file's own schema.
 */
public class ParquetTableReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetTableReader.class);

  /** Footer key under which Avro-aware writers store the Avro schema. */
  static final String AVRO_SCHEMA_KEY = "parquet.avro.schema";

  private final Configuration conf;

  public ParquetTableReader() {
    this.conf = new Configuration();
    // Legacy INT96 timestamps are carried through as 12-byte fixed values
    conf.setBoolean("parquet.avro.readInt96AsFixed", true);
  }

  /**
   * Reads every row of the file.
   *
   * @param inputFile Random-access Parquet input
   * @return the table
   * @throws IOException if the file cannot be read, or has column names
   *     that are not valid record field names
   */
  public ModelOutputTable read(InputFile inputFile) throws IOException {
    FileMetaData metaData = readFooter(inputFile);
    List<String> invalidNames = new ArrayList<>();
    collectInvalidNames(metaData.getSchema(), "", invalidNames);
    if (!invalidNames.isEmpty()) {
      throw new IOException("Parquet file " + inputFile
          + " has column names that are not valid field names: " + invalidNames);
    }

    List<GenericRecord> records = new ArrayList<>();
    Schema schema = null;
    try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(inputFile)
        .withDataModel(GenericData.get())
        .withConf(conf)
        .build()) {
      GenericRecord record;
      while ((record = reader.read()) != null) {
        if (schema == null) {
          schema = record.getSchema();
        }
        records.add(record);
      }
    }

    if (schema == null) {
      schema = footerSchema(metaData);
    }
    LOGGER.info("Read Parquet table with {} columns and {} rows",
        schema.getFields().size(), records.size());
    return ModelOutputTable.of(schema, records);
  }

  private static FileMetaData readFooter(InputFile inputFile) throws IOException {
    try (ParquetFileReader fileReader = ParquetFileReader.open(inputFile)) {
      return fileReader.getFooter().getFileMetaData();
    }
  }

  /** Names must start with a letter or underscore, then letters, digits or underscores. */
  private static void collectInvalidNames(GroupType group, String parentPath,
      List<String> invalidNames) {
    for (Type field : group.getFields()) {
      String path = parentPath + field.getName();
      if (!AvroNames.isValid(field.getName())) {
        invalidNames.add(path);
      }
      if (!field.isPrimitive()) {
        collectInvalidNames(field.asGroupType(), path + ".", invalidNames);
      }
    }
  }

  /**
   * Derives the Avro schema from the footer; used for files without rows.
   */
  private Schema footerSchema(FileMetaData metaData) {
    String avroSchema = metaData.getKeyValueMetaData().get(AVRO_SCHEMA_KEY);
    if (avroSchema != null) {
      return new Schema.Parser().parse(avroSchema);
    }
    return new AvroSchemaConverter(conf).convert(metaData.getSchema());
  }
}
