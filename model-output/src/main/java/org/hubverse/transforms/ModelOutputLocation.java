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

import org.hubverse.transforms.format.FileFormat;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import java.util.List;
import java.util.Objects;

/**
 * Where a raw model-output file lives and where its transformed copy goes.
 *
 * <p>The object path must begin with the origin prefix (the top-level
 * directory that receives raw uploads). The destination path is the file's
 * parent directory with that prefix removed, or {@code "."} when the file
 * sits directly under the origin. Repeated separators inside the path are
 * collapsed when deriving the destination.
 */
public final class ModelOutputLocation {
  static final String CURRENT_DIRECTORY = ".";

  private static final Splitter PATH_SPLITTER = Splitter.on('/').omitEmptyStrings();
  private static final Joiner PATH_JOINER = Joiner.on('/');

  private final String storageLocation;
  private final String filePath;
  private final String fileName;
  private final FileFormat fileFormat;
  private final String destinationPath;

  private ModelOutputLocation(String storageLocation, String filePath, String fileName,
      FileFormat fileFormat, String destinationPath) {
    this.storageLocation = storageLocation;
    this.filePath = filePath;
    this.fileName = fileName;
    this.fileFormat = fileFormat;
    this.destinationPath = destinationPath;
  }

  /**
   * Validates and decomposes an object path.
   *
   * @param storageLocation Bucket or other container holding the file
   * @param filePath Object path within the container, e.g.
   *     {@code raw/prefix1/2420-01-01-team-model.csv}
   * @param originPrefix First path segment expected on raw uploads
   * @return the decomposed location
   * @throws PathPrefixException if the path does not start with the origin prefix
   * @throws UnsupportedFileTypeException if the extension is not a supported format
   */
  public static ModelOutputLocation parse(String storageLocation, String filePath,
      String originPrefix) {
    Objects.requireNonNull(storageLocation, "storageLocation");
    Objects.requireNonNull(filePath, "filePath");
    Objects.requireNonNull(originPrefix, "originPrefix");

    List<String> segments = PATH_SPLITTER.splitToList(filePath);
    // Keys are relative; an absolute path never starts with the origin
    if (filePath.startsWith("/") || segments.isEmpty() || !segments.get(0).equals(originPrefix)) {
      throw new PathPrefixException(filePath, originPrefix);
    }

    String name = segments.get(segments.size() - 1);
    String extension = extensionOf(name);
    FileFormat format = FileFormat.fromExtension(extension);
    if (segments.size() < 2 || format == null) {
      throw new UnsupportedFileTypeException(extension);
    }

    List<String> destinationSegments = segments.subList(1, segments.size() - 1);
    String destinationPath = destinationSegments.isEmpty()
        ? CURRENT_DIRECTORY
        : PATH_JOINER.join(destinationSegments);

    return new ModelOutputLocation(storageLocation, filePath,
        name.substring(0, name.length() - extension.length()), format, destinationPath);
  }

  /**
   * Returns the extension of a file name including the dot, or an empty
   * string. Dot-files such as {@code .csv} have no extension.
   */
  static String extensionOf(String name) {
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return "";
    }
    return name.substring(dot);
  }

  public String getStorageLocation() {
    return storageLocation;
  }

  public String getFilePath() {
    return filePath;
  }

  /** Base name without directory or extension. */
  public String getFileName() {
    return fileName;
  }

  public FileFormat getFileFormat() {
    return fileFormat;
  }

  public String getDestinationPath() {
    return destinationPath;
  }

  /** Address of the source file in {@code container/path} form. */
  public String getSourceAddress() {
    return storageLocation + "/" + filePath;
  }

  /** Object path of the transformed file. */
  public String getTransformedPath() {
    return destinationPath + "/" + fileName + FileFormat.PARQUET.getExtension();
  }

  @Override public String toString() {
    return "{storage_location=" + storageLocation
        + ", file_path=" + filePath
        + ", file_name=" + fileName
        + ", file_type=" + fileFormat.getExtension()
        + ", destination_path=" + destinationPath + "}";
  }
}
