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

import com.columndb.GlobalConfiguration;
import com.columndb.engine.scan.ScanResult;
import com.columndb.exception.ColumnDBException;
import com.columndb.exception.QueryException;
import com.columndb.log.LogManager;
import com.columndb.store.ColumnStore;
import com.columndb.store.WeatherColumns;
import org.eclipse.collections.impl.set.mutable.primitive.IntHashSet;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

/**
 * Monthly extreme readings computed only through the {@link ColumnStore} operations, on the calling thread. Works with any
 * store holding the weather columns and returns the same records, in the same order, as {@link SharedScanCoordinator}.
 */
public class GenericExtremeValuesQuery {
  private final ZoneOffset offset;

  public GenericExtremeValuesQuery() {
    this(ZoneOffset.of(GlobalConfiguration.TIME_ZONE_OFFSET.getValueAsString()));
  }

  public GenericExtremeValuesQuery(final ZoneOffset offset) {
    this.offset = offset;
  }

  public ExtremeValuesResult execute(final ColumnStore store, final int year, final String station) {
    final long beginTime = System.nanoTime();

    final YearMonthRange yearRange = YearMonthRange.ofYear(year, offset);
    final ScanResult inYear = store.filter(WeatherColumns.TIMESTAMP, value -> yearRange.contains(((Instant) value).getEpochSecond()));
    if (!inYear.isComplete())
      return ExtremeValuesResult.failed(year, station, inYear.getError());

    final ScanResult atStation = store.filter(WeatherColumns.STATION, value -> value.equals(station), inYear.getIndexes());
    if (!atStation.isComplete())
      return ExtremeValuesResult.failed(year, station, atStation.getError());

    final int[] candidates = atStation.getIndexes();
    final List<ExtremeValue> values = new ArrayList<>();
    final Map<Integer, ColumnDBException> failedMonths = new LinkedHashMap<>();
    for (int month = 1; month <= 12; month++) {
      try {
        values.addAll(executeMonth(store, year, month, station, candidates));
      } catch (final ColumnDBException e) {
        final QueryException error = new QueryException("Month " + month + " of the extreme values query on store '" + store.getName() + "' failed",
            e);
        error.addContext("month", month);
        failedMonths.put(month, error);
        LogManager.instance().log(this, Level.WARNING, "Month %d of extreme values %d/%s on store '%s' failed", e, month, year, station,
            store.getName());
      }
    }

    LogManager.instance().log(this, Level.FINE, "Extreme values %d/%s on store '%s': %d candidates, %d records in %dms", null, year, station,
        store.getName(), candidates.length, values.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - beginTime));

    return new ExtremeValuesResult(year, station, values, failedMonths, null);
  }

  private List<ExtremeValue> executeMonth(final ColumnStore store, final int year, final int month, final String station,
      final int[] candidates) {
    final List<ExtremeValue> values = new ArrayList<>();
    if (candidates.length == 0)
      return values;

    final YearMonthRange monthRange = YearMonthRange.ofMonth(year, month, offset);
    final int[] inMonth = checked(
        store.filter(WeatherColumns.TIMESTAMP, value -> monthRange.contains(((Instant) value).getEpochSecond()), candidates)).getIndexes();

    addDistinctDays(store, values, WeatherColumns.HUMIDITY, checked(store.getMax(WeatherColumns.HUMIDITY, inMonth)), ExtremeCategory.MAX_HUMIDITY,
        station);
    addDistinctDays(store, values, WeatherColumns.HUMIDITY, checked(store.getMin(WeatherColumns.HUMIDITY, inMonth)), ExtremeCategory.MIN_HUMIDITY,
        station);
    addDistinctDays(store, values, WeatherColumns.TEMPERATURE, checked(store.getMax(WeatherColumns.TEMPERATURE, inMonth)),
        ExtremeCategory.MAX_TEMPERATURE, station);
    addDistinctDays(store, values, WeatherColumns.TEMPERATURE, checked(store.getMin(WeatherColumns.TEMPERATURE, inMonth)),
        ExtremeCategory.MIN_TEMPERATURE, station);
    return values;
  }

  private void addDistinctDays(final ColumnStore store, final List<ExtremeValue> values, final String column, final ScanResult ties,
      final ExtremeCategory category, final String station) {
    final IntHashSet days = new IntHashSet();
    for (final int index : ties.getIndexes()) {
      final Instant time = (Instant) store.getValue(WeatherColumns.TIMESTAMP, index).orElseThrow();
      final LocalDate date = LocalDate.ofInstant(time, offset);
      if (days.add((int) date.toEpochDay())) {
        final Number value = (Number) store.getValue(column, index).orElseThrow();
        values.add(new ExtremeValue(date, station, category, value.floatValue()));
      }
    }
  }

  private static ScanResult checked(final ScanResult result) {
    if (!result.isComplete())
      throw result.getError();
    return result;
  }
}
