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

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Column types inferred for CSV input, declared in the order they are tried.
 * A column takes the first type that accepts every non-null cell.
 */
enum CsvColumnType {
  LONG {
    @Override boolean accepts(String value) {
      if (!INTEGER.matcher(value).matches()) {
        return false;
      }
      try {
        Long.parseLong(value.startsWith("+") ? value.substring(1) : value);
        return true;
      } catch (NumberFormatException e) {
        return false; // out of range
      }
    }

    @Override Object convert(String value) {
      return Long.parseLong(value.startsWith("+") ? value.substring(1) : value);
    }

    @Override Schema valueSchema() {
      return Schema.create(Schema.Type.LONG);
    }
  },

  BOOLEAN {
    @Override boolean accepts(String value) {
      return TRUE_VALUES.matcher(value).matches() || FALSE_VALUES.matcher(value).matches();
    }

    @Override Object convert(String value) {
      return TRUE_VALUES.matcher(value).matches();
    }

    @Override Schema valueSchema() {
      return Schema.create(Schema.Type.BOOLEAN);
    }
  },

  DATE {
    @Override boolean accepts(String value) {
      if (!ISO_DATE.matcher(value).matches()) {
        return false;
      }
      try {
        LocalDate.parse(value);
        return true;
      } catch (DateTimeParseException e) {
        return false;
      }
    }

    /** Days since the epoch, the Avro {@code date} representation. */
    @Override Object convert(String value) {
      return (int) LocalDate.parse(value).toEpochDay();
    }

    @Override Schema valueSchema() {
      return LogicalTypes.date().addToSchema(Schema.create(Schema.Type.INT));
    }
  },

  DOUBLE {
    @Override boolean accepts(String value) {
      return DECIMAL.matcher(value).matches()
          || SPECIAL_DOUBLES.matcher(value.toLowerCase(Locale.ROOT)).matches();
    }

    @Override Object convert(String value) {
      String lower = value.toLowerCase(Locale.ROOT);
      if (lower.endsWith("inf") || lower.endsWith("infinity")) {
        return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
      }
      if (lower.endsWith("nan")) {
        return Double.NaN;
      }
      return Double.parseDouble(value);
    }

    @Override Schema valueSchema() {
      return Schema.create(Schema.Type.DOUBLE);
    }
  },

  STRING {
    @Override boolean accepts(String value) {
      return true;
    }

    @Override Object convert(String value) {
      return value;
    }

    @Override Schema valueSchema() {
      return Schema.create(Schema.Type.STRING);
    }
  };

  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  private static final Pattern SPECIAL_DOUBLES = Pattern.compile("[+-]?(inf|infinity|nan)");
  private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
  private static final Pattern TRUE_VALUES = Pattern.compile("true|True|TRUE");
  private static final Pattern FALSE_VALUES = Pattern.compile("false|False|FALSE");

  abstract boolean accepts(String value);

  abstract Object convert(String value);

  abstract Schema valueSchema();

  /** Nullable form of {@link #valueSchema()}, as written to the table schema. */
  Schema nullableSchema() {
    return Schema.createUnion(Schema.create(Schema.Type.NULL), valueSchema());
  }
}
