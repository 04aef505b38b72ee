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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Storage provider implementation for the local file system.
 *
 * <p>Addresses resolve against a root directory, so a container is a
 * sub-directory of the root. Used for local runs and tests.
 */
public class LocalFileStorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileStorageProvider.class);

  private final Path root;

  public LocalFileStorageProvider(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  /**
   * Resolves an address against the root, rejecting addresses that escape it.
   */
  Path resolve(String path) throws IOException {
    Path resolved = root.resolve(path).normalize();
    if (!resolved.startsWith(root)) {
      throw new IOException("Path escapes storage root: " + path);
    }
    return resolved;
  }

  @Override public InputStream openInputStream(String path) throws IOException {
    return Files.newInputStream(resolve(path));
  }

  @Override public RandomAccessSource openRandomAccess(String path) throws IOException {
    return new FileChannelSource(FileChannel.open(resolve(path), StandardOpenOption.READ));
  }

  @Override public OutputStream openOutputStream(String path) throws IOException {
    Path file = resolve(path);
    Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    LOGGER.debug("Opening local file for write: {}", file);
    return Files.newOutputStream(file);
  }

  @Override public FileMetadata getMetadata(String path) throws IOException {
    Path file = resolve(path);
    return new FileMetadata(
        path,
        Files.size(file),
        Files.getLastModifiedTime(file).toMillis(),
        ContentTypes.guess(path),
        null);
  }

  @Override public boolean exists(String path) throws IOException {
    return Files.exists(resolve(path));
  }

  @Override public String getStorageType() {
    return "local";
  }

  /**
   * Positional reads over a file channel.
   */
  private static class FileChannelSource implements RandomAccessSource {
    private final FileChannel channel;

    FileChannelSource(FileChannel channel) {
      this.channel = channel;
    }

    @Override public long length() throws IOException {
      return channel.size();
    }

    @Override public void readFully(long position, byte[] buffer, int offset, int length)
        throws IOException {
      ByteBuffer target = ByteBuffer.wrap(buffer, offset, length);
      long next = position;
      while (target.hasRemaining()) {
        int read = channel.read(target, next);
        if (read < 0) {
          throw new EOFException("End of file reached at position " + next);
        }
        next += read;
      }
    }

    @Override public void close() throws IOException {
      channel.close();
    }
  }
}
