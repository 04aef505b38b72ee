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
package org.hubverse.transforms.storage;

import java.util.Locale;

/**
 * Guesses content types from file extensions.
 */
public final class ContentTypes {
  public static final String PARQUET = "application/x-parquet";
  public static final String CSV = "text/csv";
  public static final String DEFAULT = "application/octet-stream";

  private ContentTypes() {
  }

  /**
   * Guess content type based on file extension.
   */
  public static String guess(String path) {
    String lowercasePath = path.toLowerCase(Locale.ROOT);
    if (lowercasePath.endsWith(".parquet")) {
      return PARQUET;
    } else if (lowercasePath.endsWith(".csv")) {
      return CSV;
    } else if (lowercasePath.endsWith(".json")) {
      return "application/json";
    } else if (lowercasePath.endsWith(".txt")) {
      return "text/plain";
    }
    return DEFAULT;
  }
}
