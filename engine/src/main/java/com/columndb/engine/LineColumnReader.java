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

import com.columndb.exception.ErrorCode;
import com.columndb.exception.SchemaException;
import com.columndb.exception.StorageException;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Forward-only cursor over a line encoded column file. Records can only be reached in ascending index order.
 */
public class LineColumnReader implements AutoCloseable {
  private final ColumnFile     columnFile;
  private final BufferedReader reader;
  private       int            nextIndex = 0;

  LineColumnReader(final ColumnFile columnFile) {
    this.columnFile = columnFile;
    try {
      columnFile.create();
      this.reader = new BufferedReader(new InputStreamReader(new FileInputStream(columnFile.getFile()), StandardCharsets.UTF_8));
    } catch (final IOException e) {
      throw new StorageException("Cannot open column file '" + columnFile + "'", e);
    }
  }

  /**
   * Returns the raw next line, or null at the end of the file.
   */
  public String nextLine() {
    try {
      final String line = reader.readLine();
      if (line != null)
        ++nextIndex;
      return line;
    } catch (final IOException e) {
      throw new StorageException("Error on reading column file '" + columnFile + "'", e).addContext("index", nextIndex);
    }
  }

  /**
   * Moves the cursor so that the next line read is the record at {@code index}.
   *
   * @throws SchemaException  with {@link ErrorCode#INVALID_CANDIDATES} if the cursor is already past {@code index}
   * @throws StorageException with {@link ErrorCode#OUT_OF_BOUNDS} if the file ends before {@code index}
   */
  public void skipTo(final int index) {
    if (index < nextIndex)
      throw (SchemaException) new SchemaException(ErrorCode.INVALID_CANDIDATES,
          "Cannot move back to record " + index + " of line encoded column '" + columnFile.getName() + "'").addContext("index", index)
          .addContext("position", nextIndex);

    while (nextIndex < index)
      if (nextLine() == null)
        throw outOfBounds(index);
  }

  /**
   * Reads and decodes the record at {@code index}, which must not precede the cursor.
   */
  public Object read(final int index) {
    skipTo(index);
    final String line = nextLine();
    if (line == null)
      throw outOfBounds(index);
    return columnFile.getCodec().decodeLine(line, columnFile.getDefinition().getEncoding());
  }

  public int getNextIndex() {
    return nextIndex;
  }

  public ColumnFile getColumnFile() {
    return columnFile;
  }

  @Override
  public void close() {
    try {
      reader.close();
    } catch (final IOException e) {
      throw new StorageException("Error on closing column file '" + columnFile + "'", e);
    }
  }

  private StorageException outOfBounds(final int index) {
    return (StorageException) new StorageException(ErrorCode.OUT_OF_BOUNDS,
        "Record " + index + " is past the end of column '" + columnFile.getName() + "' (" + nextIndex + " records)").addContext("file",
        columnFile.getFile().getAbsolutePath()).addContext("index", index).addContext("records", nextIndex);
  }
}
