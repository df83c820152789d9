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
package com.columndb.engine.scan;

import com.columndb.engine.ColumnFile;
import com.columndb.engine.FixedWidthColumnReader;
import com.columndb.engine.LineColumnReader;
import com.columndb.exception.ColumnDBException;
import com.columndb.exception.ErrorCode;
import com.columndb.exception.SchemaException;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;

import java.util.function.Predicate;

/**
 * Predicate scans over one column file. Null values never reach the predicate. Errors never escape: they are attached to the
 * returned {@link ScanResult} together with the indices matched before them.
 */
public class ColumnScanner {
  private final ColumnFile columnFile;

  /**
   * Tests a raw fixed width record without decoding it.
   */
  public interface RecordPredicate {
    boolean test(byte[] buffer, int offset);
  }

  public ColumnScanner(final ColumnFile columnFile) {
    this.columnFile = columnFile;
  }

  /**
   * Evaluates the predicate over every non-null record in index order.
   */
  public ScanResult scan(final Predicate<Object> predicate) {
    final IntArrayList matches = new IntArrayList();
    try {
      if (columnFile.getDefinition().isFixedWidth()) {
        try (final FixedWidthColumnReader reader = columnFile.openFixedReader()) {
          reader.scan((index, buffer, offset) -> {
            final Object value = columnFile.getCodec().decode(buffer, offset, columnFile.getDefinition().getEncoding());
            if (value != null && predicate.test(value))
              matches.add(index);
          });
        }
      } else {
        try (final LineColumnReader reader = columnFile.openLineReader()) {
          int index = 0;
          String line;
          while ((line = reader.nextLine()) != null) {
            final Object value = columnFile.getCodec().decodeLine(line, columnFile.getDefinition().getEncoding());
            if (value != null && predicate.test(value))
              matches.add(index);
            ++index;
          }
        }
      }
    } catch (final ColumnDBException e) {
      return ScanResult.partial(matches, e);
    }
    return ScanResult.complete(matches);
  }

  /**
   * Evaluates the predicate over the candidates only, returning the matching ones in candidate order.
   */
  public ScanResult scan(final Predicate<Object> predicate, final int[] candidates) {
    if (candidates == null || candidates.length == 0)
      return ScanResult.empty();

    try {
      CandidateReader.validate(columnFile, candidates);
    } catch (final SchemaException e) {
      return ScanResult.failed(e);
    }

    final IntArrayList matches = new IntArrayList();
    try (final CandidateReader reader = new CandidateReader(columnFile)) {
      for (final int index : candidates) {
        final Object value = reader.read(index);
        if (value != null && predicate.test(value))
          matches.add(index);
      }
    } catch (final ColumnDBException e) {
      return ScanResult.partial(matches, e);
    }
    return ScanResult.complete(matches);
  }

  /**
   * Full scan of a fixed width column testing the raw records.
   */
  public ScanResult scanRecords(final RecordPredicate predicate) {
    checkFixedWidth();
    final IntArrayList matches = new IntArrayList();
    try (final FixedWidthColumnReader reader = columnFile.openFixedReader()) {
      reader.scan((index, buffer, offset) -> {
        if (predicate.test(buffer, offset))
          matches.add(index);
      });
    } catch (final ColumnDBException e) {
      return ScanResult.partial(matches, e);
    }
    return ScanResult.complete(matches);
  }

  /**
   * Restricted scan of a fixed width column testing the raw records of the candidates.
   */
  public ScanResult scanRecords(final RecordPredicate predicate, final int[] candidates) {
    checkFixedWidth();
    if (candidates == null || candidates.length == 0)
      return ScanResult.empty();

    try {
      CandidateReader.validate(columnFile, candidates);
    } catch (final SchemaException e) {
      return ScanResult.failed(e);
    }

    final IntArrayList matches = new IntArrayList();
    try (final FixedWidthColumnReader reader = columnFile.openFixedReader()) {
      for (final int index : candidates)
        if (predicate.test(reader.readRaw(index), 0))
          matches.add(index);
    } catch (final ColumnDBException e) {
      return ScanResult.partial(matches, e);
    }
    return ScanResult.complete(matches);
  }

  public ColumnFile getColumnFile() {
    return columnFile;
  }

  private void checkFixedWidth() {
    if (!columnFile.getDefinition().isFixedWidth())
      throw new SchemaException(ErrorCode.INVALID_OPERATION, "Column '" + columnFile.getName() + "' is not fixed width");
  }
}
