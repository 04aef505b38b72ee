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

import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.OutputFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Writes a {@link ModelOutputTable} as a Parquet file.
 */
public class ParquetTableWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetTableWriter.class);

  private final CompressionCodecName compressionCodec;

  public ParquetTableWriter() {
    this(CompressionCodecName.SNAPPY);
  }

  public ParquetTableWriter(CompressionCodecName compressionCodec) {
    this.compressionCodec = compressionCodec;
  }

  /**
   * Writes all rows, replacing any existing file.
   *
   * @param table Table to write
   * @param outputFile Destination
   * @throws IOException if the file cannot be written
   */
  public void write(ModelOutputTable table, OutputFile outputFile) throws IOException {
    try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
        .<GenericRecord>builder(outputFile)
        .withSchema(table.getSchema())
        .withDataModel(GenericData.get())
        .withConf(new Configuration())
        .withCompressionCodec(compressionCodec)
        .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
        .build()) {
      for (GenericRecord row : table.getRows()) {
        writer.write(row);
      }
    }
    LOGGER.debug("Wrote {} rows to {}", table.getNumRows(), outputFile);
  }
}
