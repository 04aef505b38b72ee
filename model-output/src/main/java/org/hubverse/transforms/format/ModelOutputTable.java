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

import org.hubverse.transforms.ModelOutputException;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-memory model-output table: an ordered Avro record schema describing the
 * columns, and one {@link GenericRecord} per row.
 *
 * <p>Tables are immutable. {@link #withConstantColumn(String, String)} returns
 * a new table and leaves this one untouched.
 */
public final class ModelOutputTable {
  private final Schema schema;
  private final ImmutableList<GenericRecord> rows;

  private ModelOutputTable(Schema schema, ImmutableList<GenericRecord> rows) {
    this.schema = schema;
    this.rows = rows;
  }

  /**
   * Creates a table.
   *
   * @param schema Avro record schema; its fields are the columns, in order
   * @param rows Rows conforming to {@code schema}
   * @return the table
   */
  public static ModelOutputTable of(Schema schema, List<GenericRecord> rows) {
    Objects.requireNonNull(schema, "schema");
    if (schema.getType() != Schema.Type.RECORD) {
      throw new IllegalArgumentException("Table schema must be a record, got " + schema.getType());
    }
    return new ModelOutputTable(schema, ImmutableList.copyOf(rows));
  }

  public Schema getSchema() {
    return schema;
  }

  public List<GenericRecord> getRows() {
    return rows;
  }

  public int getNumRows() {
    return rows.size();
  }

  public int getNumColumns() {
    return schema.getFields().size();
  }

  public List<String> getColumnNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Schema.Field field : schema.getFields()) {
      names.add(field.name());
    }
    return names.build();
  }

  public boolean hasColumn(String name) {
    return schema.getField(name) != null;
  }

  /**
   * Returns the values of one column, top to bottom. Null cells are
   * returned as null.
   *
   * @throws IllegalArgumentException if there is no such column
   */
  public List<Object> getColumn(String name) {
    Schema.Field field = schema.getField(name);
    if (field == null) {
      throw new IllegalArgumentException("No column named '" + name + "'");
    }
    List<Object> values = new ArrayList<>(rows.size());
    for (GenericRecord row : rows) {
      values.add(row.get(field.pos()));
    }
    return values;
  }

  /**
   * Returns a copy of this table with a string column appended after the
   * existing columns, holding {@code value} in every row.
   *
   * @param name Name of the new column
   * @param value Value repeated in every row
   * @return the augmented table
   * @throws ModelOutputException if a column with that name already exists
   */
  public ModelOutputTable withConstantColumn(String name, String value) {
    if (hasColumn(name)) {
      throw new ModelOutputException("Table already has a column named '" + name + "'");
    }

    List<Schema.Field> fields = new ArrayList<>(schema.getFields().size() + 1);
    for (Schema.Field field : schema.getFields()) {
      fields.add(new Schema.Field(field, field.schema()));
    }
    Schema nullableString = Schema.createUnion(
        Schema.create(Schema.Type.NULL), Schema.create(Schema.Type.STRING));
    fields.add(new Schema.Field(name, nullableString, null, Schema.Field.NULL_DEFAULT_VALUE));

    Schema augmented = Schema.createRecord(schema.getName(), schema.getDoc(),
        schema.getNamespace(), schema.isError(), fields);
    augmented.addAllProps(schema);

    int position = fields.size() - 1;
    ImmutableList.Builder<GenericRecord> augmentedRows = ImmutableList.builder();
    for (GenericRecord row : rows) {
      GenericData.Record copy = new GenericData.Record(augmented);
      for (int i = 0; i < position; i++) {
        copy.put(i, row.get(i));
      }
      copy.put(position, value);
      augmentedRows.add(copy);
    }
    return new ModelOutputTable(augmented, augmentedRows.build());
  }

  @Override public String toString() {
    return "ModelOutputTable{columns=" + getColumnNames() + ", rows=" + rows.size() + "}";
  }
}
