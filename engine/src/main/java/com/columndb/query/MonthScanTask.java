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

import com.columndb.engine.ColumnFile;
import com.columndb.engine.FixedWidthColumnReader;
import com.columndb.engine.codec.EpochSecondsCodec;
import com.columndb.engine.scan.ExtremeScanResult;
import com.columndb.engine.scan.ExtremeScanner;
import com.columndb.engine.scan.ScanResult;
import com.columndb.exception.ColumnDBException;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.eclipse.collections.impl.map.mutable.primitive.IntLongHashMap;
import org.eclipse.collections.impl.set.mutable.primitive.IntHashSet;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Computes the extreme readings of one month. Every task opens its own readers and accumulates its records locally.
 */
final class MonthScanTask implements Supplier<List<ExtremeValue>> {
  private final ColumnFile     timestamp;
  private final ColumnFile     temperature;
  private final ColumnFile     humidity;
  private final ZoneOffset     offset;
  private final String         station;
  private final YearMonthRange range;
  private final int[]          candidates;

  MonthScanTask(final ColumnFile timestamp, final ColumnFile temperature, final ColumnFile humidity, final ZoneOffset offset,
      final String station, final int year, final int month, final int[] candidates) {
    this.timestamp = timestamp;
    this.temperature = temperature;
    this.humidity = humidity;
    this.offset = offset;
    this.station = station;
    this.range = YearMonthRange.ofMonth(year, month, offset);
    this.candidates = candidates;
  }

  @Override
  public List<ExtremeValue> get() {
    final IntLongHashMap secondsByIndex = new IntLongHashMap();
    final IntArrayList monthIndexes = new IntArrayList();
    try (final FixedWidthColumnReader reader = timestamp.openFixedReader()) {
      for (final int index : candidates) {
        final long seconds = EpochSecondsCodec.decodeRaw(reader.readRaw(index), 0);
        if (seconds != EpochSecondsCodec.NULL_VALUE && range.contains(seconds)) {
          monthIndexes.add(index);
          secondsByIndex.put(index, seconds);
        }
      }
    }

    final List<ExtremeValue> values = new ArrayList<>();
    if (monthIndexes.isEmpty())
      return values;

    final int[] month = monthIndexes.toArray();
    final ExtremeScanResult humidityExtremes = checked(new ExtremeScanner(humidity).scan(month));
    final ExtremeScanResult temperatureExtremes = checked(new ExtremeScanner(temperature).scan(month));

    addDistinctDays(values, humidityExtremes.max(), ExtremeCategory.MAX_HUMIDITY, humidityExtremes.getMaxValue(), secondsByIndex);
    addDistinctDays(values, humidityExtremes.min(), ExtremeCategory.MIN_HUMIDITY, humidityExtremes.getMinValue(), secondsByIndex);
    addDistinctDays(values, temperatureExtremes.max(), ExtremeCategory.MAX_TEMPERATURE, temperatureExtremes.getMaxValue(), secondsByIndex);
    addDistinctDays(values, temperatureExtremes.min(), ExtremeCategory.MIN_TEMPERATURE, temperatureExtremes.getMinValue(), secondsByIndex);
    return values;
  }

  /**
   * Keeps the first index of every day, ties are in ascending index order.
   */
  private void addDistinctDays(final List<ExtremeValue> values, final ScanResult ties, final ExtremeCategory category, final float value,
      final IntLongHashMap secondsByIndex) {
    final IntHashSet days = new IntHashSet();
    for (final int index : ties.getIndexes()) {
      final LocalDate date = LocalDate.ofInstant(Instant.ofEpochSecond(secondsByIndex.get(index)), offset);
      if (days.add((int) date.toEpochDay()))
        values.add(new ExtremeValue(date, station, category, value));
    }
  }

  private static ExtremeScanResult checked(final ExtremeScanResult result) {
    final ColumnDBException error = result.getError();
    if (error != null)
      throw error;
    return result;
  }
}
