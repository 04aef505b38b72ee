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

import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Parquet OutputFile implementation that writes through a StorageProvider.
 * Every create call truncates: object stores have no append or exclusive-create.
 */
public class StorageProviderOutputFile implements OutputFile {
  private final StorageProvider storageProvider;
  private final String path;

  public StorageProviderOutputFile(StorageProvider storageProvider, String path) {
    this.storageProvider = storageProvider;
    this.path = path;
  }

  @Override public PositionOutputStream create(long blockSizeHint) throws IOException {
    return createOrOverwrite(blockSizeHint);
  }

  @Override public PositionOutputStream createOrOverwrite(long blockSizeHint) throws IOException {
    return new CountingPositionOutputStream(storageProvider.openOutputStream(path));
  }

  @Override public boolean supportsBlockSize() {
    return false;
  }

  @Override public long defaultBlockSize() {
    return 0;
  }

  @Override public String toString() {
    return path;
  }

  /**
   * Tracks the write position, which Parquet records in the footer.
   */
  private static class CountingPositionOutputStream extends PositionOutputStream {
    private final OutputStream out;
    private long position;

    CountingPositionOutputStream(OutputStream out) {
      this.out = out;
    }

    @Override public long getPos() {
      return position;
    }

    @Override public void write(int b) throws IOException {
      out.write(b);
      position++;
    }

    @Override public void write(byte[] b, int off, int len) throws IOException {
      out.write(b, off, len);
      position += len;
    }

    @Override public void flush() throws IOException {
      out.flush();
    }

    @Override public void close() throws IOException {
      out.close();
    }
  }
}
