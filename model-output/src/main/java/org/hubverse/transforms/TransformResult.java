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
package org.hubverse.transforms;

import java.util.Objects;

/**
 * Location of a transformed model-output file.
 */
public final class TransformResult {
  private final String storageLocation;
  private final String path;

  public TransformResult(String storageLocation, String path) {
    this.storageLocation = Objects.requireNonNull(storageLocation, "storageLocation");
    this.path = Objects.requireNonNull(path, "path");
  }

  /** Bucket or other container the file was written to. */
  public String getStorageLocation() {
    return storageLocation;
  }

  /** Object path of the written file within its container. */
  public String getPath() {
    return path;
  }

  /** Address of the written file in {@code container/path} form. */
  public String getAddress() {
    return storageLocation + "/" + path;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransformResult)) {
      return false;
    }
    TransformResult that = (TransformResult) o;
    return storageLocation.equals(that.storageLocation) && path.equals(that.path);
  }

  @Override public int hashCode() {
    return Objects.hash(storageLocation, path);
  }

  @Override public String toString() {
    return "(" + storageLocation + ", " + path + ")";
  }
}
