/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.columndb.engine;

import com.columndb.GlobalConfiguration;
import com.columndb.exception.ErrorCode;
import com.columndb.exception.StorageException;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * Reads a fixed width column file through {@link FileChannel} positioned reads: record <i>i</i> starts at {@code i * width}.
 * Every instance owns its channel, so concurrent scans open one reader each.
 */
public class FixedWidthColumnReader implements AutoCloseable {
  private final ColumnFile       columnFile;
  private final int              width;
  private final RandomAccessFile raf;
  private final FileChannel      channel;

  /**
   * Receives the records of a sequential scan. The record occupies {@code width} bytes of {@code buffer} from {@code offset}.
   */
  public interface RecordVisitor {
    void visit(int index, byte[] buffer, int offset);
  }

  FixedWidthColumnReader(final ColumnFile columnFile) {
    this.columnFile = columnFile;
    this.width = columnFile.getDefinition().getFixedSize();
    if (width < 1)
      throw new StorageException(ErrorCode.INTERNAL_ERROR, "Column '" + columnFile.getName() + "' is not fixed width");
    try {
      columnFile.create();
      this.raf = new RandomAccessFile(columnFile.getFile(), "r");
      this.channel = raf.getChannel();
    } catch (final IOException e) {
      throw new StorageException("Cannot open column file '" + columnFile + "'", e);
    }
  }

  /**
   * Reads and decodes the record at {@code index}.
   *
   * @throws StorageException with {@link ErrorCode#SHORT_READ} if the file holds less than {@code width} bytes at the position
   */
  public Object read(final int index) {
    return columnFile.getCodec().decode(readRaw(index), columnFile.getDefinition().getEncoding());
  }

  public byte[] readRaw(final int index) {
    final ByteBuffer buffer = ByteBuffer.allocate(width);
    final long position = (long) index * width;
    try {
      while (buffer.hasRemaining()) {
        if (channel.read(buffer, position + buffer.position()) < 0)
          break;
      }
    } catch (final IOException e) {
      throw new StorageException("Error on reading record " + index + " of column file '" + columnFile + "'", e).addContext("index", index);
    }

    if (buffer.hasRemaining())
      throw shortRead(index, buffer.position());

    return buffer.array();
  }

  /**
   * Visits every record in index order reading the file in chunks of {@link GlobalConfiguration#READ_BUFFER_SIZE} bytes.
   *
   * @throws StorageException with {@link ErrorCode#SHORT_READ} if the file ends with a truncated record, after visiting the
   *                          complete ones
   */
  public void scan(final RecordVisitor visitor) {
    final int configured = GlobalConfiguration.READ_BUFFER_SIZE.getValueAsInteger();
    final int chunkSize = Math.max(width, configured - (configured % width));
    final ByteBuffer buffer = ByteBuffer.allocate(chunkSize);
    final byte[] array = buffer.array();

    long position = 0;
    int index = 0;
    try {
      while (true) {
        buffer.clear();
        int read;
        while (buffer.hasRemaining() && (read = channel.read(buffer, position + buffer.position())) > -1) {
          if (read == 0)
            break;
        }

        final int available = buffer.position();
        if (available == 0)
          return;

        final int complete = available - (available % width);
        for (int offset = 0; offset < complete; offset += width)
          visitor.visit(index++, array, offset);

        if (complete < available)
          throw shortRead(index, available - complete);

        position += available;
        if (available < chunkSize)
          return;
      }
    } catch (final IOException e) {
      throw new StorageException("Error on scanning column file '" + columnFile + "'", e).addContext("index", index);
    }
  }

  public long getRecordCount() {
    try {
      return channel.size() / width;
    } catch (final IOException e) {
      throw new StorageException("Cannot read the size of column file '" + columnFile + "'", e);
    }
  }

  public int getWidth() {
    return width;
  }

  public ColumnFile getColumnFile() {
    return columnFile;
  }

  @Override
  public void close() {
    try {
      raf.close();
    } catch (final IOException e) {
      throw new StorageException("Error on closing column file '" + columnFile + "'", e);
    }
  }

  private StorageException shortRead(final int index, final int bytesRead) {
    return (StorageException) new StorageException(ErrorCode.SHORT_READ,
        "Short read on record " + index + " of column '" + columnFile.getName() + "': " + bytesRead + " of " + width + " bytes").addContext(
        "file", columnFile.getFile().getAbsolutePath()).addContext("index", index).addContext("bytesRead", bytesRead);
  }
}
