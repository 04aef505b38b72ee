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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Storage provider interface for abstracting file access across different storage systems.
 * Implementations can provide access to local files, S3, etc.
 *
 * <p>Every path is an address of the form {@code container/path}, for example
 * {@code my-bucket/raw/team1/2420-01-01-team1-model1.csv}. The first segment
 * names the container (an S3 bucket, or a directory under a local root).
 */
public interface StorageProvider {

  /**
   * Opens an input stream for reading file content sequentially.
   *
   * @param path The file address
   * @return Input stream for the file
   * @throws IOException If an I/O error occurs
   */
  InputStream openInputStream(String path) throws IOException;

  /**
   * Opens a file for positional reads. Columnar formats need this to read the
   * footer before the data pages.
   *
   * @param path The file address
   * @return Random-access source for the file
   * @throws IOException If an I/O error occurs
   */
  RandomAccessSource openRandomAccess(String path) throws IOException;

  /**
   * Opens an output stream that creates the file, or overwrites it if it
   * exists. The file is complete once the stream has been closed.
   *
   * @param path The file address
   * @return Output stream for the file
   * @throws IOException If an I/O error occurs
   */
  OutputStream openOutputStream(String path) throws IOException;

  /**
   * Gets metadata for a single file.
   *
   * @param path The file address
   * @return File metadata
   * @throws IOException If an I/O error occurs
   */
  FileMetadata getMetadata(String path) throws IOException;

  /**
   * Checks if a path exists.
   *
   * @param path The path to check
   * @return true if the path exists
   * @throws IOException If an I/O error occurs
   */
  boolean exists(String path) throws IOException;

  /**
   * Gets the storage type identifier.
   *
   * @return Storage type (e.g., "local", "s3")
   */
  String getStorageType();

  /**
   * File content addressed by byte offset.
   */
  interface RandomAccessSource extends Closeable {

    /**
     * Returns the total length of the file in bytes.
     */
    long length() throws IOException;

    /**
     * Reads exactly {@code length} bytes starting at {@code position}.
     *
     * @throws java.io.EOFException if the file ends before {@code length} bytes were read
     * @throws IOException If an I/O error occurs
     */
    void readFully(long position, byte[] buffer, int offset, int length) throws IOException;
  }

  /**
   * File metadata containing detailed information about a file.
   */
  class FileMetadata {
    private final String path;
    private final long size;
    private final long lastModified;
    private final String contentType;
    private final String etag;

    public FileMetadata(String path, long size, long lastModified,
                        String contentType, String etag) {
      this.path = path;
      this.size = size;
      this.lastModified = lastModified;
      this.contentType = contentType;
      this.etag = etag;
    }

    public String getPath() {
      return path;
    }

    public long getSize() {
      return size;
    }

    public long getLastModified() {
      return lastModified;
    }

    public String getContentType() {
      return contentType;
    }

    public String getEtag() {
      return etag;
    }
  }
}
