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

import java.util.regex.Pattern;

/**
 * Maps arbitrary column headers onto valid Avro field names.
 */
final class AvroNames {
  private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern INVALID_CHARACTER = Pattern.compile("[^A-Za-z0-9_]");

  private AvroNames() {
  }

  static boolean isValid(String name) {
    return VALID_NAME.matcher(name).matches();
  }

  /**
   * Returns {@code header} unchanged when it is a valid Avro name; otherwise
   * replaces each illegal character with {@code '_'} and prefixes names that
   * start with a digit.
   *
   * @param header Raw header text
   * @param index Zero-based column index, used to name blank headers
   */
  static String sanitize(String header, int index) {
    if (isValid(header)) {
      return header;
    }
    if (header.isEmpty()) {
      return "column_" + index;
    }
    String name = INVALID_CHARACTER.matcher(header).replaceAll("_");
    if (Character.isDigit(name.charAt(0))) {
      name = "_" + name;
    }
    return name;
  }
}
