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

import com.columndb.engine.codec.TypeCodec;
import com.columndb.exception.StorageException;
import com.columndb.log.LogManager;
import com.columndb.schema.ColumnDefinition;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.logging.Level;

/**
 * Append-only file holding all the values of one column, one record per row. Position <i>i</i> of every column file of a store
 * is the same logical row.
 * <p>
 * File name: {@code <storeDirectory>/<columnName>.store}.
 */
public class ColumnFile {
  public static final String FILE_EXT = ".store";

  private final File             file;
  private final ColumnDefinition definition;
  private final TypeCodec        codec;

  public ColumnFile(final File storeDirectory, final ColumnDefinition definition, final TypeCodec codec) {
    this.file = new File(storeDirectory, definition.getName() + FILE_EXT);
    this.definition = definition;
    this.codec = codec;
  }

  /**
   * Creates the empty file if it does not exist yet.
   */
  public void create() {
    try {
      final File parent = file.getParentFile();
      if (parent != null)
        Files.createDirectories(parent.toPath());
      if (file.createNewFile())
        LogManager.instance().log(this, Level.FINE, "Created column file '%s'", null, file);
    } catch (final IOException e) {
      throw new StorageException("Cannot create column file '" + file + "'", e).addContext("file", file.getAbsolutePath());
    }
  }

  public ColumnWriter openWriter() {
    return new ColumnWriter(this);
  }

  public FixedWidthColumnReader openFixedReader() {
    return new FixedWidthColumnReader(this);
  }

  public LineColumnReader openLineReader() {
    return new LineColumnReader(this);
  }

  /**
   * Returns the number of records: file length / width for fixed width columns, the number of lines for line encoded columns.
   */
  public long getRecordCount() {
    if (!file.exists())
      return 0;

    if (definition.isFixedWidth())
      return file.length() / definition.getFixedSize();

    try (final LineColumnReader reader = openLineReader()) {
      long count = 0;
      while (reader.nextLine() != null)
        ++count;
      return count;
    }
  }

  public boolean exists() {
    return file.exists();
  }

  public void delete() {
    try {
      Files.deleteIfExists(file.toPath());
    } catch (final IOException e) {
      throw new StorageException("Cannot delete column file '" + file + "'", e).addContext("file", file.getAbsolutePath());
    }
  }

  public File getFile() {
    return file;
  }

  public String getName() {
    return definition.getName();
  }

  public ColumnDefinition getDefinition() {
    return definition;
  }

  public TypeCodec getCodec() {
    return codec;
  }

  @Override
  public String toString() {
    return file.getPath();
  }
}
