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
package com.columndb.store;

import com.columndb.engine.ColumnFile;
import com.columndb.engine.ColumnWriter;
import com.columndb.engine.FixedWidthColumnReader;
import com.columndb.engine.LineColumnReader;
import com.columndb.engine.codec.TypeCodec;
import com.columndb.engine.scan.ColumnScanner;
import com.columndb.engine.scan.ExtremeScanner;
import com.columndb.engine.scan.ScanResult;
import com.columndb.exception.ErrorCode;
import com.columndb.exception.SerializationException;
import com.columndb.exception.StorageException;
import com.columndb.log.LogManager;
import com.columndb.schema.ColumnDefinition;
import com.columndb.schema.ColumnSchema;
import com.columndb.utility.FileUtils;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.logging.Level;

/**
 * Disk store keeping one {@link ColumnFile} per column under {@code <baseDirectory>/<name>}. Existing column files are opened
 * and appended to.
 */
public class DiskColumnStore extends AbstractColumnStore {
  private final File                    directory;
  private final Map<String, ColumnFile> files = new LinkedHashMap<>();

  public DiskColumnStore(final String name, final File baseDirectory, final ColumnSchema schema, final TypeCodec codec) {
    super(name, schema, codec);
    try {
      FileUtils.checkValidName(name);
      for (final ColumnDefinition column : schema.getColumns())
        FileUtils.checkValidName(column.getName());
    } catch (final IOException e) {
      throw new StorageException(ErrorCode.CONFIGURATION_ERROR, e.getMessage(), e);
    }

    this.directory = new File(baseDirectory, name);
    for (final ColumnDefinition column : schema.getColumns()) {
      final ColumnFile file = new ColumnFile(directory, column, codec);
      file.create();
      files.put(column.getName(), file);
    }

    LogManager.instance().log(this, Level.FINE, "Opened store '%s' in '%s' with columns %s", null, name, directory, schema);
  }

  public File getDirectory() {
    return directory;
  }

  public ColumnFile getColumnFile(final String column) {
    return files.get(schema.getColumn(column).getName());
  }

  @Override
  public long getRecordCount() {
    checkIsOpen();
    long count = 0;
    for (final ColumnFile file : files.values())
      count = Math.max(count, file.getRecordCount());
    return count;
  }

  @Override
  protected void appendColumn(final ColumnDefinition column, final List<Object> values) {
    try (final ColumnWriter writer = files.get(column.getName()).openWriter()) {
      for (final Object value : values) {
        try {
          writer.append(value);
        } catch (final SerializationException e) {
          LogManager.instance().log(this, Level.WARNING, "Cannot encode value '%s' in column '%s' of store '%s', storing null: %s", null, value,
              column.getName(), name, e.getMessage());
          writer.append(null);
        }
      }
    }
  }

  @Override
  protected ScanResult filterColumn(final ColumnDefinition column, final Predicate<Object> predicate) {
    return new ColumnScanner(files.get(column.getName())).scan(predicate);
  }

  @Override
  protected ScanResult filterColumn(final ColumnDefinition column, final Predicate<Object> predicate, final int[] candidates) {
    return new ColumnScanner(files.get(column.getName())).scan(predicate, candidates);
  }

  @Override
  protected ScanResult maxOfColumn(final ColumnDefinition column, final int[] candidates) {
    return new ExtremeScanner(files.get(column.getName())).getMax(candidates);
  }

  @Override
  protected ScanResult minOfColumn(final ColumnDefinition column, final int[] candidates) {
    return new ExtremeScanner(files.get(column.getName())).getMin(candidates);
  }

  @Override
  protected Object readValue(final ColumnDefinition column, final int index) {
    final ColumnFile file = files.get(column.getName());
    if (column.isFixedWidth()) {
      try (final FixedWidthColumnReader reader = file.openFixedReader()) {
        return reader.read(index);
      }
    }
    try (final LineColumnReader reader = file.openLineReader()) {
      return reader.read(index);
    }
  }

  @Override
  protected List<Object> readHead(final ColumnDefinition column, final int rows) {
    final ColumnFile file = files.get(column.getName());
    final List<Object> values = new ArrayList<>(rows);
    if (column.isFixedWidth()) {
      try (final FixedWidthColumnReader reader = file.openFixedReader()) {
        final long available = Math.min(rows, reader.getRecordCount());
        for (int i = 0; i < available; i++)
          values.add(reader.read(i));
      }
    } else {
      try (final LineColumnReader reader = file.openLineReader()) {
        String line;
        while (values.size() < rows && (line = reader.nextLine()) != null)
          values.add(codec.decodeLine(line, column.getEncoding()));
      }
    }
    return Collections.unmodifiableList(values);
  }
}
