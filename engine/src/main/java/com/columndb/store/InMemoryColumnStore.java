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

import com.columndb.engine.codec.Int32Codec;
import com.columndb.engine.codec.TypeCodec;
import com.columndb.engine.scan.ExtremeTracker;
import com.columndb.engine.scan.ScanResult;
import com.columndb.exception.ErrorCode;
import com.columndb.exception.SchemaException;
import com.columndb.exception.StorageException;
import com.columndb.schema.ColumnDefinition;
import com.columndb.schema.ColumnSchema;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Store keeping every column in a list. Values go through the same parsing as the disk stores, and NaN or
 * {@code Integer.MIN_VALUE} are kept as null since the disk stores read them back as null. Nulls, ties and float widening
 * therefore behave the same way; candidates can be in any order.
 */
public class InMemoryColumnStore extends AbstractColumnStore {
  private final Map<String, List<Object>> columns = new HashMap<>();

  public InMemoryColumnStore(final String name, final ColumnSchema schema, final TypeCodec codec) {
    super(name, schema, codec);
    for (final ColumnDefinition column : schema.getColumns())
      columns.put(column.getName(), new ArrayList<>());
  }

  @Override
  public long getRecordCount() {
    checkIsOpen();
    long count = 0;
    for (final List<Object> values : columns.values())
      count = Math.max(count, values.size());
    return count;
  }

  @Override
  protected void appendColumn(final ColumnDefinition column, final List<Object> values) {
    final List<Object> target = columns.get(column.getName());
    for (final Object value : values)
      target.add(isNullSentinel(value) ? null : value);
  }

  @Override
  protected ScanResult filterColumn(final ColumnDefinition column, final Predicate<Object> predicate) {
    final List<Object> values = columns.get(column.getName());
    final IntArrayList matches = new IntArrayList();
    for (int i = 0; i < values.size(); i++) {
      final Object value = values.get(i);
      if (value != null && predicate.test(value))
        matches.add(i);
    }
    return ScanResult.complete(matches);
  }

  @Override
  protected ScanResult filterColumn(final ColumnDefinition column, final Predicate<Object> predicate, final int[] candidates) {
    if (candidates == null || candidates.length == 0)
      return ScanResult.empty();

    final SchemaException invalid = checkCandidates(column, candidates);
    if (invalid != null)
      return ScanResult.failed(invalid);

    final List<Object> values = columns.get(column.getName());
    final IntArrayList matches = new IntArrayList();
    for (final int index : candidates) {
      if (index >= values.size())
        return ScanResult.partial(matches, outOfBounds(column, index, values.size()));
      final Object value = values.get(index);
      if (value != null && predicate.test(value))
        matches.add(index);
    }
    return ScanResult.complete(matches);
  }

  @Override
  protected ScanResult maxOfColumn(final ColumnDefinition column, final int[] candidates) {
    return extremes(column, candidates, true);
  }

  @Override
  protected ScanResult minOfColumn(final ColumnDefinition column, final int[] candidates) {
    return extremes(column, candidates, false);
  }

  @Override
  protected Object readValue(final ColumnDefinition column, final int index) {
    final List<Object> values = columns.get(column.getName());
    if (index >= values.size())
      throw outOfBounds(column, index, values.size());
    return values.get(index);
  }

  @Override
  protected List<Object> readHead(final ColumnDefinition column, final int rows) {
    final List<Object> values = columns.get(column.getName());
    return Collections.unmodifiableList(new ArrayList<>(values.subList(0, Math.min(rows, values.size()))));
  }

  private ScanResult extremes(final ColumnDefinition column, final int[] candidates, final boolean max) {
    if (!column.getType().isNumeric())
      return ScanResult.failed(
          new SchemaException(ErrorCode.INVALID_OPERATION, "Cannot compute extremes on column '" + column.getName() + "' of type " + column.getType()));

    if (candidates == null || candidates.length == 0)
      return ScanResult.empty();

    final SchemaException invalid = checkCandidates(column, candidates);
    if (invalid != null)
      return ScanResult.failed(invalid);

    final List<Object> values = columns.get(column.getName());
    final ExtremeTracker tracker = new ExtremeTracker();
    for (final int index : candidates) {
      if (index >= values.size())
        return ScanResult.partial(max ? tracker.getMaxIndexes() : tracker.getMinIndexes(), outOfBounds(column, index, values.size()));
      final Object value = values.get(index);
      if (value != null)
        tracker.accept(index, ((Number) value).floatValue());
    }
    return ScanResult.complete(max ? tracker.getMaxIndexes() : tracker.getMinIndexes());
  }

  /**
   * Values the fixed width disk encodings write as their null sentinel and read back as null.
   */
  private static boolean isNullSentinel(final Object value) {
    if (value instanceof Float f)
      return f.isNaN();
    if (value instanceof Integer i)
      return i == Int32Codec.NULL_VALUE;
    return false;
  }

  private static SchemaException checkCandidates(final ColumnDefinition column, final int[] candidates) {
    for (final int index : candidates)
      if (index < 0)
        return (SchemaException) new SchemaException(ErrorCode.INVALID_CANDIDATES,
            "Negative candidate index " + index + " for column '" + column.getName() + "'").addContext("index", index);
    return null;
  }

  private static StorageException outOfBounds(final ColumnDefinition column, final int index, final int size) {
    return (StorageException) new StorageException(ErrorCode.OUT_OF_BOUNDS,
        "Record " + index + " is past the end of column '" + column.getName() + "' (" + size + " records)").addContext("index", index);
  }
}
