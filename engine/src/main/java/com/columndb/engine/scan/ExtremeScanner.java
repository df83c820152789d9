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
import com.columndb.exception.ColumnDBException;
import com.columndb.exception.ErrorCode;
import com.columndb.exception.SchemaException;
import com.columndb.schema.ColumnType;

/**
 * Single pass max/min scan over the candidates of a numeric column. Nulls are skipped and integers are widened to float before
 * the comparison.
 */
public class ExtremeScanner {
  private final ColumnFile columnFile;

  public ExtremeScanner(final ColumnFile columnFile) {
    this.columnFile = columnFile;
  }

  public ExtremeScanResult scan(final int[] candidates) {
    final ColumnType type = columnFile.getDefinition().getType();
    if (!type.isNumeric())
      return ExtremeScanResult.failed(
          new SchemaException(ErrorCode.INVALID_OPERATION, "Cannot compute extremes on column '" + columnFile.getName() + "' of type " + type));

    final ExtremeTracker tracker = new ExtremeTracker();
    if (candidates == null || candidates.length == 0)
      return new ExtremeScanResult(tracker, null);

    try {
      CandidateReader.validate(columnFile, candidates);
    } catch (final SchemaException e) {
      return ExtremeScanResult.failed(e);
    }

    try (final CandidateReader reader = new CandidateReader(columnFile)) {
      for (final int index : candidates) {
        final Object value = reader.read(index);
        if (value != null)
          tracker.accept(index, ((Number) value).floatValue());
      }
    } catch (final ColumnDBException e) {
      return new ExtremeScanResult(tracker, e);
    }
    return new ExtremeScanResult(tracker, null);
  }

  public ScanResult getMax(final int[] candidates) {
    return scan(candidates).max();
  }

  public ScanResult getMin(final int[] candidates) {
    return scan(candidates).min();
  }
}
