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
package com.columndb.query;

import com.columndb.exception.ColumnDBException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of an extreme values query: the records ordered by month and category, plus the months whose computation failed. A
 * failed month contributes no records.
 */
public final class ExtremeValuesResult {
  private final int                              year;
  private final String                           station;
  private final List<ExtremeValue>               values;
  private final Map<Integer, ColumnDBException> failedMonths;
  private final ColumnDBException               error;

  public ExtremeValuesResult(final int year, final String station, final List<ExtremeValue> values,
      final Map<Integer, ColumnDBException> failedMonths, final ColumnDBException error) {
    this.year = year;
    this.station = station;
    this.values = Collections.unmodifiableList(values);
    this.failedMonths = Collections.unmodifiableMap(new TreeMap<>(failedMonths));
    this.error = error;
  }

  public static ExtremeValuesResult failed(final int year, final String station, final ColumnDBException error) {
    return new ExtremeValuesResult(year, station, List.of(), Map.of(), error);
  }

  public int getYear() {
    return year;
  }

  public String getStation() {
    return station;
  }

  public List<ExtremeValue> getValues() {
    return values;
  }

  /**
   * Returns the failure of every month that could not be computed, keyed by month number (1-12).
   */
  public Map<Integer, ColumnDBException> getFailedMonths() {
    return failedMonths;
  }

  /**
   * Returns the error that prevented the whole query from running, null otherwise.
   */
  public ColumnDBException getError() {
    return error;
  }

  public boolean isComplete() {
    return error == null && failedMonths.isEmpty();
  }

  @Override
  public String toString() {
    return "ExtremeValuesResult{year=" + year + ", station=" + station + ", values=" + values.size() + ", failedMonths="
        + failedMonths.keySet() + (error != null ? ", error=" + error : "") + "}";
  }
}
