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

import java.util.Locale;

/**
 * Tabular encodings a model-output file may arrive in.
 */
public enum FileFormat {
  /** Delimited text, read sequentially. */
  CSV(".csv"),
  /** Footer-indexed columnar binary, read with random access. */
  PARQUET(".parquet");

  private final String extension;

  FileFormat(String extension) {
    this.extension = extension;
  }

  /**
   * Returns the file extension including the leading dot.
   */
  public String getExtension() {
    return extension;
  }

  /**
   * Looks up the format for an extension such as {@code ".csv"}.
   *
   * @param extension Extension with leading dot; matched case-sensitively
   * @return the format, or null if the extension is not supported
   */
  public static FileFormat fromExtension(String extension) {
    for (FileFormat format : values()) {
      if (format.extension.equals(extension)) {
        return format;
      }
    }
    return null;
  }

  @Override public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
