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

import com.columndb.engine.codec.StationDictionary;
import com.columndb.engine.codec.TypeCodec;
import com.columndb.store.ColumnStore;
import com.columndb.store.WeatherColumns;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small weather data set shared by the extreme values tests, with its expected 2010 Changi result.
 */
final class WeatherReadings {
  static final TypeCodec CODEC = new TypeCodec(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"), ZoneOffset.ofHours(8), StationDictionary.DEFAULT);

  private static final String[][] ROWS = { //
      { "0", "2010-01-05 10:00", "Changi", "30", "80" },//
      { "1", "2010-01-05 14:00", "Changi", "30", "85" },//
      { "2", "2010-01-06 10:00", "Changi", "25", "60" },//
      { "3", "2010-01-07 10:00", "Paya Lebar", "35", "99" },//
      { "4", "2010-02-01 00:00", "Changi", "28", "70" },//
      { "5", "2009-12-31 23:00", "Changi", "40", "" },//
      { "6", "2010-02-03 12:00", "Changi", "28", "70" },//
      { "7", "M", "Changi", "50", "10" },//
      { "8", "2010-12-31 23:59", "Changi", "20", "75" } };

  private WeatherReadings() {
  }

  static void load(final ColumnStore store) {
    final String[] columns = { WeatherColumns.ID, WeatherColumns.TIMESTAMP, WeatherColumns.STATION, WeatherColumns.TEMPERATURE,
        WeatherColumns.HUMIDITY };
    final Map<String, List<String>> batch = new LinkedHashMap<>();
    for (int c = 0; c < columns.length; c++) {
      final List<String> values = new ArrayList<>();
      for (final String[] row : ROWS)
        values.add(row[c]);
      batch.put(columns[c], values);
    }
    store.storeAll(batch);
  }

  static List<ExtremeValue> january() {
    return List.of(//
        value("2010-01-05", ExtremeCategory.MAX_HUMIDITY, 85),//
        value("2010-01-06", ExtremeCategory.MIN_HUMIDITY, 60),//
        value("2010-01-05", ExtremeCategory.MAX_TEMPERATURE, 30),//
        value("2010-01-06", ExtremeCategory.MIN_TEMPERATURE, 25));
  }

  static List<ExtremeValue> february() {
    return List.of(//
        value("2010-02-01", ExtremeCategory.MAX_HUMIDITY, 70),//
        value("2010-02-03", ExtremeCategory.MAX_HUMIDITY, 70),//
        value("2010-02-01", ExtremeCategory.MIN_HUMIDITY, 70),//
        value("2010-02-03", ExtremeCategory.MIN_HUMIDITY, 70),//
        value("2010-02-01", ExtremeCategory.MAX_TEMPERATURE, 28),//
        value("2010-02-03", ExtremeCategory.MAX_TEMPERATURE, 28),//
        value("2010-02-01", ExtremeCategory.MIN_TEMPERATURE, 28),//
        value("2010-02-03", ExtremeCategory.MIN_TEMPERATURE, 28));
  }

  static List<ExtremeValue> december() {
    return List.of(//
        value("2010-12-31", ExtremeCategory.MAX_HUMIDITY, 75),//
        value("2010-12-31", ExtremeCategory.MIN_HUMIDITY, 75),//
        value("2010-12-31", ExtremeCategory.MAX_TEMPERATURE, 20),//
        value("2010-12-31", ExtremeCategory.MIN_TEMPERATURE, 20));
  }

  static List<ExtremeValue> changi2010() {
    final List<ExtremeValue> values = new ArrayList<>(january());
    values.addAll(february());
    values.addAll(december());
    return values;
  }

  private static ExtremeValue value(final String date, final ExtremeCategory category, final float value) {
    return new ExtremeValue(LocalDate.parse(date), "Changi", category, value);
  }
}
