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

import com.columndb.exception.ColumnDBException;
import org.eclipse.collections.api.list.primitive.IntList;

import java.util.Arrays;

/**
 * Indices produced by a scan, in the order they were matched. When the scan was rejected or stopped by an error, the error is
 * attached and the indices are the ones matched before it.
 */
public final class ScanResult {
  private static final int[] EMPTY = new int[0];

  private final int[]              indexes;
  private final ColumnDBException error;

  private ScanResult(final int[] indexes, final ColumnDBException error) {
    this.indexes = indexes;
    this.error = error;
  }

  public static ScanResult complete(final IntList indexes) {
    return new ScanResult(indexes.toArray(), null);
  }

  public static ScanResult partial(final IntList indexes, final ColumnDBException error) {
    return new ScanResult(indexes.toArray(), error);
  }

  public static ScanResult empty() {
    return new ScanResult(EMPTY, null);
  }

  public static ScanResult failed(final ColumnDBException error) {
    return new ScanResult(EMPTY, error);
  }

  /**
   * Returns a copy of the matched indices.
   */
  public int[] getIndexes() {
    return indexes.clone();
  }

  public int size() {
    return indexes.length;
  }

  public boolean isEmpty() {
    return indexes.length == 0;
  }

  /**
   * Returns the error that rejected or stopped the scan, null if the scan completed.
   */
  public ColumnDBException getError() {
    return error;
  }

  public boolean isComplete() {
    return error == null;
  }

  @Override
  public String toString() {
    return "ScanResult{indexes=" + Arrays.toString(indexes) + (error != null ? ", error=" + error : "") + "}";
  }
}
