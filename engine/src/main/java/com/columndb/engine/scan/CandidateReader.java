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
import com.columndb.exception.ErrorCode;
import com.columndb.exception.SchemaException;

/**
 * Reads the values of a candidate index list from one column file, picking the access path of the column encoding: direct
 * positioned reads for fixed width columns, a single forward cursor for line encoded columns.
 */
final class CandidateReader implements AutoCloseable {
  private final FixedWidthColumnReader fixedReader;
  private final LineColumnReader       lineReader;

  CandidateReader(final ColumnFile columnFile) {
    if (columnFile.getDefinition().isFixedWidth()) {
      this.fixedReader = columnFile.openFixedReader();
      this.lineReader = null;
    } else {
      this.fixedReader = null;
      this.lineReader = columnFile.openLineReader();
    }
  }

  /**
   * Checks the candidates before any read: negative indices are always rejected, line encoded columns also need strictly
   * ascending indices.
   *
   * @throws SchemaException with {@link ErrorCode#INVALID_CANDIDATES}
   */
  static void validate(final ColumnFile columnFile, final int[] candidates) {
    final boolean ascending = !columnFile.getDefinition().isFixedWidth();
    for (int i = 0; i < candidates.length; i++) {
      if (candidates[i] < 0)
        throw (SchemaException) new SchemaException(ErrorCode.INVALID_CANDIDATES,
            "Negative candidate index " + candidates[i] + " for column '" + columnFile.getName() + "'").addContext("position", i);
      if (ascending && i > 0 && candidates[i] <= candidates[i - 1])
        throw (SchemaException) new SchemaException(ErrorCode.INVALID_CANDIDATES,
            "Candidate indexes for line encoded column '" + columnFile.getName() + "' must be strictly ascending").addContext("position", i)
            .addContext("index", candidates[i]).addContext("previous", candidates[i - 1]);
    }
  }

  Object read(final int index) {
    return fixedReader != null ? fixedReader.read(index) : lineReader.read(index);
  }

  @Override
  public void close() {
    if (fixedReader != null)
      fixedReader.close();
    else
      lineReader.close();
  }
}
