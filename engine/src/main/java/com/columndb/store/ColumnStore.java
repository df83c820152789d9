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

import com.columndb.engine.scan.ScanResult;
import com.columndb.schema.ColumnSchema;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A columnar store: every column of the schema holds the same number of records and position <i>i</i> of every column is the
 * same logical row.
 * <p>
 * Validation errors (unknown column, non numeric column, bad candidates) are detected before touching storage: the operation
 * returns an empty {@link ScanResult} with the error attached and logs it at WARNING level. I/O errors stop the current scan
 * only and return the indices matched so far with the error attached.
 */
public interface ColumnStore extends AutoCloseable {

  String getName();

  ColumnSchema getSchema();

  /**
   * Parses and appends one value to one column.
   *
   * @return false if the column is not part of the schema
   */
  boolean store(String column, String value);

  /**
   * Appends a batch of rows given column by column. The column set must be equal to the schema and every list must have the same
   * size, otherwise nothing is written.
   *
   * @return the number of rows appended
   */
  long storeAll(Map<String, List<String>> values);

  /**
   * Returns the indices of every non-null record of the column matching the predicate, in ascending order.
   */
  ScanResult filter(String column, Predicate<Object> predicate);

  /**
   * Returns the candidates whose non-null record matches the predicate.
   */
  ScanResult filter(String column, Predicate<Object> predicate, int[] candidates);

  /**
   * Returns every candidate holding the maximum non-null value of a numeric column.
   */
  ScanResult getMax(String column, int[] candidates);

  /**
   * Returns every candidate holding the minimum non-null value of a numeric column.
   */
  ScanResult getMin(String column, int[] candidates);

  /**
   * Returns the value at {@code index}, empty if it is null or the column is unknown.
   */
  Optional<Object> getValue(String column, int index);

  long getRecordCount();

  /**
   * Renders the first {@code rows} records of every column, one row per line.
   */
  String head(int rows);

  @Override
  void close();
}
