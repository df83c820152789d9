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
package com.columndb.importer;

import com.columndb.engine.codec.StationDictionary;
import com.columndb.engine.codec.TypeCodec;
import com.columndb.exception.ImportException;
import com.columndb.store.ColumnStore;
import com.columndb.store.InMemoryColumnStore;
import com.columndb.store.WeatherColumns;
import com.columndb.utility.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CSVLoaderTest {
  private static final File DIRECTORY = new File("target/stores/CSVLoaderTest");

  private ColumnStore store;

  @BeforeEach
  void setUp() {
    FileUtils.deleteRecursively(DIRECTORY);
    store = new InMemoryColumnStore("memory", WeatherColumns.SCHEMA,
        new TypeCodec(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"), ZoneOffset.ofHours(8), StationDictionary.DEFAULT));
  }

  @AfterEach
  void tearDown() {
    store.close();
    FileUtils.deleteRecursively(DIRECTORY);
  }

  @Test
  void testLoadWithReorderedHeader() throws IOException {
    final File file = csv("Station,id,Timestamp,Humidity,Temperature\n"//
        + "Changi,0,2010-01-01 08:00,80.5,29.1\n"//
        + "Paya Lebar,1,2010-01-01 09:00,81,M\n");

    assertThat(new CSVLoader(",", 10).load(file, store)).isEqualTo(2);
    assertThat(store.getRecordCount()).isEqualTo(2);
    assertThat(store.getValue(WeatherColumns.STATION, 1)).contains("Paya Lebar");
    assertThat(store.getValue(WeatherColumns.TEMPERATURE, 0)).contains(29.1f);
    assertThat(store.getValue(WeatherColumns.TEMPERATURE, 1)).isEmpty();
    assertThat(store.getValue(WeatherColumns.HUMIDITY, 0)).contains(80.5f);
    assertThat(store.getValue(WeatherColumns.TIMESTAMP, 0)).contains(Instant.parse("2010-01-01T00:00:00Z"));
  }

  @Test
  void testShortAndLongRows() throws IOException {
    final File file = csv("id,Timestamp,Station,Temperature,Humidity\n"//
        + "0,2010-01-01 08:00,Changi\n"//
        + "1,2010-01-01 09:00,Changi,30,70,extra,values\n"//
        + "2,,Changi,31,71\n");

    assertThat(new CSVLoader(",", 10).load(file, store)).isEqualTo(3);
    assertThat(store.getValue(WeatherColumns.TEMPERATURE, 0)).isEmpty();
    assertThat(store.getValue(WeatherColumns.HUMIDITY, 0)).isEmpty();
    assertThat(store.getValue(WeatherColumns.HUMIDITY, 1)).contains(70f);
    assertThat(store.getValue(WeatherColumns.TIMESTAMP, 2)).isEmpty();
    assertThat(store.getValue(WeatherColumns.ID, 2)).contains(2);
  }

  @Test
  void testBatches() throws IOException {
    final StringBuilder content = new StringBuilder("id,Timestamp,Station,Temperature,Humidity\n");
    for (int i = 0; i < 5; i++)
      content.append(i).append(",2010-01-01 08:00,Changi,").append(20 + i).append(",80\n");

    assertThat(new CSVLoader(",", 2).load(csv(content.toString()), store)).isEqualTo(5);
    assertThat(store.getMax(WeatherColumns.TEMPERATURE, new int[] { 0, 1, 2, 3, 4 }).getIndexes()).containsExactly(4);
  }

  @Test
  void testOtherDelimiter() throws IOException {
    final File file = csv("id;Timestamp;Station;Temperature;Humidity\n0;2010-01-01 08:00;Changi;20,5;80\n");
    assertThat(new CSVLoader(";", 10).load(file, store)).isEqualTo(1);
    assertThat(store.getValue(WeatherColumns.TEMPERATURE, 0)).isEmpty();
  }

  @Test
  void testHeaderMismatch() throws IOException {
    final File missing = csv("id,Timestamp,Station,Temperature\n0,2010-01-01 08:00,Changi,20\n");
    assertThatThrownBy(() -> new CSVLoader(",", 10).load(missing, store)).isInstanceOf(ImportException.class);

    final File duplicated = csv("id,Timestamp,Station,Temperature,Humidity,id\n0,2010-01-01 08:00,Changi,20,80,0\n");
    assertThatThrownBy(() -> new CSVLoader(",", 10).load(duplicated, store)).isInstanceOf(ImportException.class);

    assertThat(store.getRecordCount()).isZero();
  }

  @Test
  void testMissingFile() {
    assertThatThrownBy(() -> new CSVLoader().load(new File(DIRECTORY, "missing.csv"), store)).isInstanceOf(ImportException.class);
  }

  @Test
  void testInvalidSettings() {
    assertThatThrownBy(() -> new CSVLoader(",,", 10)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new CSVLoader(",", 0)).isInstanceOf(IllegalArgumentException.class);
  }

  private static File csv(final String content) throws IOException {
    Files.createDirectories(DIRECTORY.toPath());
    final File file = File.createTempFile("weather", ".csv", DIRECTORY);
    Files.writeString(file.toPath(), content, StandardCharsets.UTF_8);
    return file;
  }
}
