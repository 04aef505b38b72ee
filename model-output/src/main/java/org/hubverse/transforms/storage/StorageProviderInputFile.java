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

import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Parquet InputFile implementation that uses StorageProvider to access files.
 * This enables Parquet to read from S3 and other storage systems via StorageProvider.
 */
public class StorageProviderInputFile implements InputFile {
  private static final Logger LOGGER = LoggerFactory.getLogger(StorageProviderInputFile.class);

  /** Reads smaller than this are served from a block cache. */
  static final int BLOCK_SIZE = 64 * 1024;

  private final StorageProvider storageProvider;
  private final String path;
  private Long cachedLength;

  public StorageProviderInputFile(StorageProvider storageProvider, String path) {
    this.storageProvider = storageProvider;
    this.path = path;
  }

  @Override public long getLength() throws IOException {
    if (cachedLength == null) {
      LOGGER.debug("Getting file length for: {}", path);
      try (StorageProvider.RandomAccessSource source = storageProvider.openRandomAccess(path)) {
        cachedLength = source.length();
      }
    }
    return cachedLength;
  }

  @Override public SeekableInputStream newStream() throws IOException {
    LOGGER.debug("Opening stream for: {}", path);
    return new StorageProviderSeekableInputStream(storageProvider.openRandomAccess(path));
  }

  @Override public String toString() {
    return path;
  }

  /**
   * SeekableInputStream implementation over a random-access source.
   * Parquet requires seekable streams to read file metadata and data pages.
   */
  static class StorageProviderSeekableInputStream extends SeekableInputStream {
    private final StorageProvider.RandomAccessSource source;
    private final long length;
    private final byte[] block = new byte[BLOCK_SIZE];
    private long blockStart = -1;
    private int blockLength;
    private long position;

    StorageProviderSeekableInputStream(StorageProvider.RandomAccessSource source)
        throws IOException {
      this.source = source;
      this.length = source.length();
    }

    @Override public long getPos() {
      return position;
    }

    @Override public void seek(long newPos) {
      if (newPos < 0 || newPos > length) {
        throw new IllegalArgumentException("Invalid seek position: " + newPos);
      }
      position = newPos;
    }

    @Override public long skip(long n) {
      long skipped = Math.max(0, Math.min(n, length - position));
      position += skipped;
      return skipped;
    }

    @Override public int available() {
      return (int) Math.min(Integer.MAX_VALUE, length - position);
    }

    @Override public void readFully(byte[] bytes) throws IOException {
      readFully(bytes, 0, bytes.length);
    }

    @Override public void readFully(byte[] bytes, int start, int len) throws IOException {
      if (position + len > length) {
        throw new EOFException("End of stream reached");
      }
      copy(bytes, start, len);
    }

    @Override public int read(ByteBuffer buf) throws IOException {
      if (position >= length) {
        return -1;
      }
      int len = (int) Math.min(buf.remaining(), length - position);
      transfer(buf, len);
      return len;
    }

    @Override public void readFully(ByteBuffer buf) throws IOException {
      int len = buf.remaining();
      if (position + len > length) {
        throw new EOFException("End of stream reached");
      }
      transfer(buf, len);
    }

    @Override public int read() throws IOException {
      if (position >= length) {
        return -1;
      }
      fillBlock(position);
      int value = block[(int) (position - blockStart)] & 0xFF;
      position++;
      return value;
    }

    @Override public int read(byte[] b, int off, int len) throws IOException {
      if (len == 0) {
        return 0;
      }
      if (position >= length) {
        return -1;
      }
      int actualLen = (int) Math.min(len, length - position);
      copy(b, off, actualLen);
      return actualLen;
    }

    @Override public void close() throws IOException {
      source.close();
    }

    private void transfer(ByteBuffer buf, int len) throws IOException {
      if (buf.hasArray()) {
        copy(buf.array(), buf.arrayOffset() + buf.position(), len);
        buf.position(buf.position() + len);
      } else {
        byte[] bytes = new byte[len];
        copy(bytes, 0, len);
        buf.put(bytes);
      }
    }

    /** Copies {@code len} bytes at the current position and advances it. */
    private void copy(byte[] target, int offset, int len) throws IOException {
      if (len >= BLOCK_SIZE) {
        source.readFully(position, target, offset, len);
        position += len;
        return;
      }
      int copied = 0;
      while (copied < len) {
        fillBlock(position);
        int inBlock = (int) (position - blockStart);
        int n = Math.min(len - copied, blockLength - inBlock);
        System.arraycopy(block, inBlock, target, offset + copied, n);
        copied += n;
        position += n;
      }
    }

    private void fillBlock(long pos) throws IOException {
      if (blockStart >= 0 && pos >= blockStart && pos < blockStart + blockLength) {
        return;
      }
      blockLength = (int) Math.min(BLOCK_SIZE, length - pos);
      source.readFully(pos, block, 0, blockLength);
      blockStart = pos;
    }
  }
}
