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

import com.columndb.engine.codec.TypeCodec;
import com.columndb.engine.scan.ScanResult;
import com.columndb.exception.ColumnDBException;
import com.columndb.exception.ErrorCode;
import com.columndb.exception.ImportException;
import com.columndb.exception.SchemaException;
import com.columndb.exception.SerializationException;
import com.columndb.exception.StorageException;
import com.columndb.log.LogManager;
import com.columndb.schema.ColumnDefinition;
import com.columndb.schema.ColumnSchema;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Level;

/**
 * Validation, parsing and diagnostics shared by the store implementations. Subclasses only deal with their storage.
 */
public abstract class AbstractColumnStore implements ColumnStore {
  private static final DateTimeFormatter HEAD_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  protected final String       name;
  protected final ColumnSchema schema;
  protected final TypeCodec    codec;
  private volatile boolean      open = true;

  protected AbstractColumnStore(final String name, final ColumnSchema schema, final TypeCodec codec) {
    this.name = name;
    this.schema = schema;
    this.codec = codec;
  }

  protected abstract void appendColumn(ColumnDefinition column, List<Object> values);

  protected abstract ScanResult filterColumn(ColumnDefinition column, Predicate<Object> predicate);

  protected abstract ScanResult filterColumn(ColumnDefinition column, Predicate<Object> predicate, int[] candidates);

  protected abstract ScanResult maxOfColumn(ColumnDefinition column, int[] candidates);

  protected abstract ScanResult minOfColumn(ColumnDefinition column, int[] candidates);

  protected abstract Object readValue(ColumnDefinition column, int index);

  protected abstract List<Object> readHead(ColumnDefinition column, int rows);

  @Override
  public String getName() {
    return name;
  }

  @Override
  public ColumnSchema getSchema() {
    return schema;
  }

  public TypeCodec getCodec() {
    return codec;
  }

  @Override
  public boolean store(final String column, final String value) {
    checkIsOpen();
    if (!schema.existsColumn(column)) {
      LogManager.instance().log(this, Level.WARNING, "Cannot store value in unknown column '%s' of store '%s'", null, column, name);
      return false;
    }
    final ColumnDefinition definition = schema.getColumn(column);
    appendColumn(definition, Collections.singletonList(parse(definition, value)));
    return true;
  }

  @Override
  public long storeAll(final Map<String, List<String>> values) {
    checkIsOpen();
    final int rows;
    try {
      rows = validateBatch(values);
    } catch (final ImportException e) {
      LogManager.instance().log(this, Level.WARNING, "Batch rejected by store '%s': %s", null, name, e.getMessage());
      return 0;
    }

    if (rows == 0)
      return 0;

    for (final ColumnDefinition definition : schema.getColumns()) {
      final List<String> texts = values.get(definition.getName());
      final List<Object> parsed = new ArrayList<>(rows);
      for (final String text : texts)
        parsed.add(parse(definition, text));
      appendColumn(definition, parsed);
    }

    LogManager.instance().log(this, Level.FINE, "Stored %d rows in store '%s'", null, rows, name);
    return rows;
  }

  @Override
  public ScanResult filter(final String column, final Predicate<Object> predicate) {
    checkIsOpen();
    final ColumnDefinition definition = resolve(column);
    if (definition == null)
      return invalidColumn("filter", column);
    return report("filter", column, filterColumn(definition, predicate));
  }

  @Override
  public ScanResult filter(final String column, final Predicate<Object> predicate, final int[] candidates) {
    checkIsOpen();
    final ColumnDefinition definition = resolve(column);
    if (definition == null)
      return invalidColumn("filter", column);
    return report("filter", column, filterColumn(definition, predicate, candidates));
  }

  @Override
  public ScanResult getMax(final String column, final int[] candidates) {
    checkIsOpen();
    final ColumnDefinition definition = resolve(column);
    if (definition == null)
      return invalidColumn("getMax", column);
    return report("getMax", column, maxOfColumn(definition, candidates));
  }

  @Override
  public ScanResult getMin(final String column, final int[] candidates) {
    checkIsOpen();
    final ColumnDefinition definition = resolve(column);
    if (definition == null)
      return invalidColumn("getMin", column);
    return report("getMin", column, minOfColumn(definition, candidates));
  }

  /**
   * {@inheritDoc}
   *
   * @throws StorageException if the record cannot be read
   */
  @Override
  public Optional<Object> getValue(final String column, final int index) {
    checkIsOpen();
    final ColumnDefinition definition = resolve(column);
    if (definition == null) {
      invalidColumn("getValue", column);
      return Optional.empty();
    }
    if (index < 0) {
      LogManager.instance().log(this, Level.WARNING, "Negative index %d requested from column '%s' of store '%s'", null, index, column, name);
      return Optional.empty();
    }
    return Optional.ofNullable(readValue(definition, index));
  }

  @Override
  public String head(final int rows) {
    checkIsOpen();
    final List<ColumnDefinition> columns = new ArrayList<>(schema.getColumns());
    final List<List<Object>> values = new ArrayList<>(columns.size());
    int available = Integer.MAX_VALUE;
    for (final ColumnDefinition column : columns) {
      final List<Object> head = readHead(column, Math.max(0, rows));
      values.add(head);
      available = Math.min(available, head.size());
    }

    final StringBuilder buffer = new StringBuilder();
    for (int c = 0; c < columns.size(); c++) {
      if (c > 0)
        buffer.append('\t');
      buffer.append(columns.get(c).getName());
    }
    buffer.append('\n');

    for (int r = 0; r < available; r++) {
      for (int c = 0; c < columns.size(); c++) {
        if (c > 0)
          buffer.append('\t');
        buffer.append(format(values.get(c).get(r)));
      }
      buffer.append('\n');
    }
    return buffer.toString();
  }

  @Override
  public void close() {
    open = false;
  }

  public boolean isOpen() {
    return open;
  }

  @Override
  public String toString() {
    return name;
  }

  protected void checkIsOpen() {
    if (!open)
      throw new StorageException(ErrorCode.STORE_IS_CLOSED, "Store '" + name + "' is closed");
  }

  /**
   * Parses one textual value. Malformed values are logged and stored as null.
   */
  protected Object parse(final ColumnDefinition column, final String text) {
    try {
      return codec.parse(text, column.getType());
    } catch (final SerializationException e) {
      LogManager.instance().log(this, Level.WARNING, "Malformed value '%s' for column '%s' of store '%s', storing null", null, text,
          column.getName(), name);
      return null;
    }
  }

  /**
   * Returns the number of rows of the batch.
   *
   * @throws ImportException if the column set differs from the schema or the columns have different sizes
   */
  protected int validateBatch(final Map<String, List<String>> values) {
    if (values == null)
      throw new ImportException("Batch is null");

    if (!values.keySet().equals(schema.getColumnNames()))
      throw (ImportException) new ImportException(
          "Batch columns " + values.keySet() + " do not match the schema " + schema.getColumnNames()).addContext("store", name);

    int rows = -1;
    for (final Map.Entry<String, List<String>> entry : values.entrySet()) {
      final List<String> column = entry.getValue();
      if (column == null)
        throw new ImportException("Column '" + entry.getKey() + "' of the batch is null");
      if (rows == -1)
        rows = column.size();
      else if (rows != column.size())
        throw (ImportException) new ImportException(
            "Column '" + entry.getKey() + "' has " + column.size() + " values instead of " + rows).addContext("store", name);
    }
    return Math.max(rows, 0);
  }

  private ColumnDefinition resolve(final String column) {
    return schema.existsColumn(column) ? schema.getColumn(column) : null;
  }

  private ScanResult invalidColumn(final String operation, final String column) {
    final ColumnDBException error = new SchemaException(ErrorCode.INVALID_COLUMN,
        "Column '" + column + "' is not registered with store '" + name + "'").addContext("operation", operation);
    return report(operation, column, ScanResult.failed(error));
  }

  protected ScanResult report(final String operation, final String column, final ScanResult result) {
    final ColumnDBException error = result.getError();
    if (error != null)
      LogManager.instance().log(this, Level.WARNING, "%s on column '%s' of store '%s' %s: %s", null, operation, column, name,
          error.getErrorCode().isValidationError() ? "rejected" : "stopped after " + result.size() + " matches", error.getMessage());
    return result;
  }

  private String format(final Object value) {
    if (value == null)
      return "null";
    if (value instanceof Instant instant)
      return HEAD_TIME_FORMAT.format(LocalDateTime.ofInstant(instant, codec.getZoneOffset()));
    return value.toString();
  }
}
