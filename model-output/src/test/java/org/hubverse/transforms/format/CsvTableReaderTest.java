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

import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;

import com.google.common.collect.ImmutableSet;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CsvTableReader.
 */
@Tag("unit")
public class CsvTableReaderTest {

  private static ModelOutputTable read(String csv) throws IOException {
    return new CsvTableReader().read(
        new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));
  }

  private static Schema.Type columnType(ModelOutputTable table, String column) {
    Schema schema = table.getSchema().getField(column).schema();
    assertEquals(Schema.Type.UNION, schema.getType());
    return schema.getTypes().get(1).getType();
  }

  @Test void testReadsModelOutput() throws IOException {
    ModelOutputTable table = read("location,value\nearth,11.11\nvulcan,22.22\nseti alpha,33.33\n");

    assertEquals(Arrays.asList("location", "value"), table.getColumnNames());
    assertEquals(3, table.getNumRows());
    assertEquals(Schema.Type.STRING, columnType(table, "location"));
    assertEquals(Schema.Type.DOUBLE, columnType(table, "value"));
    assertEquals(Arrays.<Object>asList("earth", "vulcan", "seti alpha"),
        table.getColumn("location"));
    assertEquals(Arrays.<Object>asList(11.11, 22.22, 33.33), table.getColumn("value"));
  }

  @Test void testInfersColumnTypes() throws IOException {
    ModelOutputTable table = read("horizon,flag,target_end_date,quantile,output_type\n"
        + "1,true,2420-01-08,0.025,quantile\n"
        + "2,False,2420-01-15,0.5,quantile\n"
        + "007,TRUE,2420-01-22,1,quantile\n");

    assertEquals(Schema.Type.LONG, columnType(table, "horizon"));
    assertEquals(Arrays.<Object>asList(1L, 2L, 7L), table.getColumn("horizon"));

    assertEquals(Schema.Type.BOOLEAN, columnType(table, "flag"));
    assertEquals(Arrays.<Object>asList(true, false, true), table.getColumn("flag"));

    Schema dateSchema = table.getSchema().getField("target_end_date").schema().getTypes().get(1);
    assertEquals(Schema.Type.INT, dateSchema.getType());
    assertEquals(LogicalTypes.date(), dateSchema.getLogicalType());
    assertEquals((int) LocalDate.of(2420, 1, 8).toEpochDay(),
        table.getColumn("target_end_date").get(0));

    // A column mixing integers and decimals is read as double
    assertEquals(Schema.Type.DOUBLE, columnType(table, "quantile"));
    assertEquals(Arrays.<Object>asList(0.025, 0.5, 1.0), table.getColumn("quantile"));

    assertEquals(Schema.Type.STRING, columnType(table, "output_type"));
  }

  @Test void testNullEquivalents() throws IOException {
    ModelOutputTable table = read("value,label\n1.5,NA\nNA,b\n,c\n");

    assertEquals(Schema.Type.DOUBLE, columnType(table, "value"));
    assertEquals(Arrays.<Object>asList(1.5, null, null), table.getColumn("value"));
    // String columns keep null markers verbatim
    assertEquals(Schema.Type.STRING, columnType(table, "label"));
    assertEquals(Arrays.<Object>asList("NA", "b", "c"), table.getColumn("label"));
  }

  @Test void testAllNullColumn() throws IOException {
    ModelOutputTable table = read("id,notes\n1,\n2,NA\n");

    assertEquals(Schema.Type.STRING, columnType(table, "notes"));
    assertEquals(Arrays.asList(null, null), table.getColumn("notes"));
  }

  @Test void testCustomNullEquivalents() throws IOException {
    ModelOutputTable table = new CsvTableReader(ImmutableSet.of("missing")).read(
        new ByteArrayInputStream("value\n2\nmissing\n".getBytes(StandardCharsets.UTF_8)));

    assertEquals(Schema.Type.LONG, columnType(table, "value"));
    assertEquals(Arrays.<Object>asList(2L, null), table.getColumn("value"));
  }

  @Test void testQuotedFieldsAndBlankLines() throws IOException {
    ModelOutputTable table = read("location,value\n\"seti, alpha\",1\n\nearth,2\n");

    assertEquals(2, table.getNumRows());
    assertEquals(Arrays.<Object>asList("seti, alpha", "earth"), table.getColumn("location"));
  }

  @Test void testByteOrderMarkIsStripped() throws IOException {
    ModelOutputTable table = read("\uFEFFlocation,value\nearth,1\n");
    assertEquals(Arrays.asList("location", "value"), table.getColumnNames());
  }

  @Test void testHeaderOnly() throws IOException {
    ModelOutputTable table = read("location,value\n");

    assertEquals(0, table.getNumRows());
    assertEquals(Schema.Type.STRING, columnType(table, "value"));
  }

  @Test void testInvalidHeadersAreSanitized() throws IOException {
    ModelOutputTable table = read("horizon (days),1st,\n1,2,3\n");
    assertEquals(Arrays.asList("horizon__days_", "_1st", "column_2"), table.getColumnNames());
  }

  @Test void testDuplicateHeadersRejected() {
    assertThrows(IOException.class, () -> read("a-b,a_b\n1,2\n"));
  }

  @Test void testRaggedRowRejected() {
    IOException e = assertThrows(IOException.class, () -> read("a,b\n1,2\n3\n"));
    assertTrue(e.getMessage().contains("row 2"));
  }

  @Test void testEmptyFileRejected() {
    assertThrows(IOException.class, () -> read(""));
  }

  @Test void testValidAvroNames() {
    assertTrue(AvroNames.isValid("round_id"));
    assertEquals("round_id", AvroNames.sanitize("round_id", 0));
    assertEquals("a_b", AvroNames.sanitize("a.b", 0));
    assertEquals("column_3", AvroNames.sanitize("", 3));
  }
}
