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
package org.hubverse.transforms.lambda;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * Decides which uploaded objects are transformed. An object is skipped when
 * its key contains one of the skip markers, or when its extension is not in
 * the allow-list. Extensions are matched case-sensitively.
 */
public class ObjectKeyFilter {
  private final Set<String> skipMarkers;
  private final Set<String> allowedExtensions;

  public ObjectKeyFilter(Set<String> skipMarkers, Set<String> allowedExtensions) {
    this.skipMarkers = ImmutableSet.copyOf(skipMarkers);
    ImmutableSet.Builder<String> extensions = ImmutableSet.builder();
    for (String extension : allowedExtensions) {
      extensions.add(normalizeExtension(extension));
    }
    this.allowedExtensions = extensions.build();
  }

  public static ObjectKeyFilter fromConfig(TransformConfig config) {
    return new ObjectKeyFilter(config.getSkipKeyMarkers(), config.getAllowedExtensions());
  }

  /** Returns the reason {@code key} is skipped, or null if it is accepted. */
  public String skipReason(String key) {
    for (String marker : skipMarkers) {
      if (key.contains(marker)) {
        return "key contains '" + marker + "'";
      }
    }
    String extension = extensionOf(key);
    if (!allowedExtensions.contains(extension)) {
      return extension.isEmpty()
          ? "key has no file extension"
          : "extension '" + extension + "' is not one of " + allowedExtensions;
    }
    return null;
  }

  public boolean accepts(String key) {
    return skipReason(key) == null;
  }

  public Set<String> getSkipMarkers() {
    return skipMarkers;
  }

  public Set<String> getAllowedExtensions() {
    return allowedExtensions;
  }

  private static String extensionOf(String key) {
    String name = key.substring(key.lastIndexOf('/') + 1);
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(dot + 1) : "";
  }

  private static String normalizeExtension(String extension) {
    String trimmed = extension.trim();
    return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
  }
}
