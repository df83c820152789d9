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

import com.columndb.exception.QueryException;
import com.columndb.store.ColumnStore;
import com.columndb.store.ColumnStoreFactory;
import com.columndb.store.EnhancedDiskColumnStore;
import com.columndb.store.StoreType;
import com.columndb.store.WeatherColumns;
import com.columndb.utility.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.File;
import java.io.RandomAccessFile;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class GenericExtremeValuesQueryTest {
  private static final File DIRECTORY = new File("target/stores/GenericExtremeValuesQueryTest");

  private final ColumnStoreFactory         factory = new ColumnStoreFactory(DIRECTORY, WeatherReadings.CODEC);
  private final GenericExtremeValuesQuery query   = new GenericExtremeValuesQuery(ZoneOffset.ofHours(8));

  @BeforeEach
  void setUp() {
    FileUtils.deleteRecursively(DIRECTORY);
  }

  @AfterEach
  void tearDown() {
    FileUtils.deleteRecursively(DIRECTORY);
  }

  @ParameterizedTest
  @EnumSource(StoreType.class)
  void testSameResultOnEveryStore(final StoreType type) {
    try (final ColumnStore store = factory.create(type, WeatherColumns.SCHEMA)) {
      WeatherReadings.load(store);

      final ExtremeValuesResult result = query.execute(store, 2010, "Changi");
      assertThat(result.isComplete()).isTrue();
      assertThat(result.getValues()).containsExactlyElementsOf(WeatherReadings.changi2010());
    }
  }

  @Test
  void testMatchesSharedScan() {
    try (final EnhancedDiskColumnStore store = (EnhancedDiskColumnStore) factory.create(StoreType.ENHANCED_DISK, WeatherColumns.SCHEMA)) {
      WeatherReadings.load(store);

      for (final String station : new String[] { "Changi", "Paya Lebar" })
        for (final int year : new int[] { 2009, 2010, 2011 })
          assertThat(query.execute(store, year, station).getValues()).containsExactlyElementsOf(store.getExtremeValues(year, station).getValues());
    }
  }

  @Test
  void testUnknownStationFindsNothing() {
    try (final ColumnStore store = factory.create(StoreType.MEMORY, WeatherColumns.SCHEMA)) {
      WeatherReadings.load(store);

      final ExtremeValuesResult result = query.execute(store, 2010, "Tengah");
      assertThat(result.isComplete()).isTrue();
      assertThat(result.getValues()).isEmpty();
    }
  }

  @Test
  void testFailedMonth() throws Exception {
    try (final ColumnStore store = factory.create(StoreType.DISK, WeatherColumns.SCHEMA)) {
      WeatherReadings.load(store);
      try (final RandomAccessFile file = new RandomAccessFile(new File(factory.getStoreDirectory(StoreType.DISK), "Humidity.store"), "rw")) {
        file.setLength(file.length() - 2);
      }

      final ExtremeValuesResult result = query.execute(store, 2010, "Changi");
      assertThat(result.getError()).isNull();
      assertThat(result.getFailedMonths()).containsOnlyKeys(12);
      assertThat(result.getFailedMonths().get(12)).isInstanceOf(QueryException.class);
      assertThat(result.getValues()).hasSize(12);
    }
  }
}
