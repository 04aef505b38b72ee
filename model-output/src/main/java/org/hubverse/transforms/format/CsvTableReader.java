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

import org.hubverse.transforms.util.NullEquivalents;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a CSV model-output file into a {@link ModelOutputTable}.
 *
 * <p>The first row holds the column names. Each column's type is inferred
 * from its values, trying long, boolean, date and double before falling back
 * to string. Cells matching a null equivalent are nulls in non-string
 * columns and are kept verbatim in string columns; a column with no values
 * at all becomes an all-null string column.
 */
public class CsvTableReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(CsvTableReader.class);

  static final String RECORD_NAME = "model_output";

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final Set<String> nullEquivalents;

  public CsvTableReader() {
    this(NullEquivalents.DEFAULT_NULL_EQUIVALENTS);
  }

  public CsvTableReader(Set<String> nullEquivalents) {
    this.nullEquivalents = nullEquivalents;
  }

  /**
   * Reads the whole stream. The stream is read sequentially and is not
   * closed.
   *
   * @param in CSV content, UTF-8 encoded
   * @return the table
   * @throws IOException if the content cannot be read or is not a valid table
   */
  public ModelOutputTable read(InputStream in) throws IOException {
    CSVReader csvReader = new CSVReaderBuilder(
        new InputStreamReader(in, StandardCharsets.UTF_8)).build();

    String[] header = readNext(csvReader);
    if (header == null) {
      throw new IOException("CSV file is empty; expected a header row");
    }
    if (header.length > 0 && !header[0].isEmpty() && header[0].charAt(0) == BYTE_ORDER_MARK) {
      header[0] = header[0].substring(1);
    }
    List<String> columnNames = columnNames(header);

    List<String[]> cells = new ArrayList<>();
    String[] row;
    while ((row = readNext(csvReader)) != null) {
      if (row.length == 1 && row[0].isEmpty()) {
        continue; // blank line
      }
      if (row.length != header.length) {
        throw new IOException("CSV row " + (cells.size() + 1) + " has " + row.length
            + " columns, expected " + header.length);
      }
      cells.add(row);
    }

    List<CsvColumnType> types = new ArrayList<>(header.length);
    List<Schema.Field> fields = new ArrayList<>(header.length);
    for (int column = 0; column < header.length; column++) {
      CsvColumnType type = inferType(cells, column);
      types.add(type);
      Schema fieldSchema = type == null
          ? CsvColumnType.STRING.nullableSchema()
          : type.nullableSchema();
      fields.add(
          new Schema.Field(columnNames.get(column), fieldSchema, null,
          Schema.Field.NULL_DEFAULT_VALUE));
    }
    Schema schema = Schema.createRecord(RECORD_NAME, null, null, false, fields);
    LOGGER.debug("Inferred CSV schema: {}", schema);

    List<GenericRecord> records = new ArrayList<>(cells.size());
    for (String[] values : cells) {
      GenericData.Record record = new GenericData.Record(schema);
      for (int column = 0; column < values.length; column++) {
        record.put(column, convert(types.get(column), values[column]));
      }
      records.add(record);
    }

    LOGGER.info("Read CSV table with {} columns and {} rows", header.length, records.size());
    return ModelOutputTable.of(schema, records);
  }

  private List<String> columnNames(String[] header) throws IOException {
    List<String> names = new ArrayList<>(header.length);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < header.length; i++) {
      String name = AvroNames.sanitize(header[i], i);
      if (!name.equals(header[i])) {
        LOGGER.warn("CSV column '{}' is not a valid column name, renamed to '{}'",
            header[i], name);
      }
      if (!seen.add(name)) {
        throw new IOException("Duplicate CSV column name: " + name);
      }
      names.add(name);
    }
    return names;
  }

  /**
   * Returns the narrowest type accepting every non-null cell of the column,
   * or null when the column holds no values at all.
   */
  private CsvColumnType inferType(List<String[]> cells, int column) {
    boolean anyValue = false;
    for (String[] row : cells) {
      if (!isNull(row[column])) {
        anyValue = true;
        break;
      }
    }
    if (!anyValue) {
      return null;
    }

    for (CsvColumnType candidate : CsvColumnType.values()) {
      boolean acceptsAll = true;
      for (String[] row : cells) {
        String value = row[column];
        if (!isNull(value) && !candidate.accepts(value)) {
          acceptsAll = false;
          break;
        }
      }
      if (acceptsAll) {
        return candidate;
      }
    }
    return CsvColumnType.STRING;
  }

  private Object convert(CsvColumnType type, String value) {
    if (type == null) {
      return null;
    }
    if (type == CsvColumnType.STRING) {
      return value;
    }
    return isNull(value) ? null : type.convert(value);
  }

  private boolean isNull(String value) {
    return NullEquivalents.isNullRepresentation(value, nullEquivalents);
  }

  private static String[] readNext(CSVReader csvReader) throws IOException {
    try {
      return csvReader.readNext();
    } catch (CsvValidationException e) {
      throw new IOException("Invalid CSV content at line " + e.getLineNumber(), e);
    }
  }
}
