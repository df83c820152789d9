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

import com.columndb.engine.codec.ColumnEncoding;
import com.columndb.exception.StorageException;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Appends encoded records at the end of a column file. Not thread safe: ingestion is single threaded.
 */
public class ColumnWriter implements AutoCloseable {
  private static final byte NEW_LINE = '\n';

  private final ColumnFile     columnFile;
  private final ColumnEncoding encoding;
  private final OutputStream   out;
  private       long           written;

  ColumnWriter(final ColumnFile columnFile) {
    this.columnFile = columnFile;
    this.encoding = columnFile.getDefinition().getEncoding();
    columnFile.create();
    try {
      this.out = new BufferedOutputStream(new FileOutputStream(columnFile.getFile(), true));
    } catch (final IOException e) {
      throw new StorageException("Cannot open column file '" + columnFile + "' for writing", e);
    }
  }

  /**
   * Appends one typed value, null is written as the sentinel of the encoding.
   */
  public void append(final Object value) {
    final byte[] record;
    if (encoding.isFixedWidth())
      record = columnFile.getCodec().encode(value, encoding);
    else
      record = columnFile.getCodec().encodeLine(value, encoding).getBytes(StandardCharsets.UTF_8);

    try {
      out.write(record);
      if (!encoding.isFixedWidth())
        out.write(NEW_LINE);
      ++written;
    } catch (final IOException e) {
      throw new StorageException("Error on appending to column file '" + columnFile + "'", e).addContext("records", written);
    }
  }

  public long getWritten() {
    return written;
  }

  public void flush() {
    try {
      out.flush();
    } catch (final IOException e) {
      throw new StorageException("Error on flushing column file '" + columnFile + "'", e);
    }
  }

  @Override
  public void close() {
    try {
      out.close();
    } catch (final IOException e) {
      throw new StorageException("Error on closing column file '" + columnFile + "'", e);
    }
  }
}
