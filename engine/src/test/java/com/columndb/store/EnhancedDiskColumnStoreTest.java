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

import com.columndb.exception.SchemaException;
import com.columndb.schema.ColumnSchema;
import com.columndb.schema.ColumnType;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnhancedDiskColumnStoreTest extends AbstractColumnStoreTest {
  @Override
  protected ColumnStore createStore(final File baseDirectory) {
    return new EnhancedDiskColumnStore(StoreType.ENHANCED_DISK.getStoreName(), baseDirectory, WeatherColumns.SCHEMA, codec);
  }

  @Test
  void testFixedWidthTimestampAndStation() throws Exception {
    store.storeAll(rows(row("1", "2010-01-01 08:00", "Changi", "20.5", "80"), row("2", "M", "Paya Lebar", "21", "81"),
        row("3", "2010-01-01 09:00", "M", "22", "82")));

    final File storeDirectory = new File(directory, "enhanced_disk");
    assertThat(new File(storeDirectory, "Station.store")).hasBinaryContent(new byte[] { 'C', 'P', 'M' });

    final ByteBuffer timestamps = ByteBuffer.wrap(Files.readAllBytes(new File(storeDirectory, "Timestamp.store").toPath()))
        .order(ByteOrder.LITTLE_ENDIAN);
    assertThat(timestamps.capacity()).isEqualTo(24);
    assertThat(timestamps.getLong(0)).isEqualTo(1262304000L);
    assertThat(timestamps.getLong(8)).isZero();
    assertThat(timestamps.getLong(16)).isEqualTo(1262307600L);
  }

  @Test
  void testUnknownStationIsStoredAsNull() {
    store.storeAll(rows(row("1", "2010-01-01 08:00", "Tengah", "20.5", "80")));
    assertThat(store.getRecordCount()).isEqualTo(1);
    assertThat(store.getValue(WeatherColumns.STATION, 0)).isEmpty();
  }

  @Test
  void testSchemaIsSpecialized() {
    assertThat(store.getSchema().getColumn(WeatherColumns.TIMESTAMP).getFixedSize()).isEqualTo(8);
    assertThat(store.getSchema().getColumn(WeatherColumns.STATION).getFixedSize()).isEqualTo(1);
    assertThat(store.getSchema().getColumn(WeatherColumns.ID).getFixedSize()).isEqualTo(4);
  }

  @Test
  void testRequiredColumns() {
    final ColumnSchema noHumidity = ColumnSchema.builder().add(WeatherColumns.TIMESTAMP, ColumnType.TIME).add(WeatherColumns.STATION, ColumnType.STRING)
        .add(WeatherColumns.TEMPERATURE, ColumnType.FLOAT).build();
    assertThatThrownBy(() -> new EnhancedDiskColumnStore("broken", directory, noHumidity, codec)).isInstanceOf(SchemaException.class);

    final ColumnSchema textTemperature = ColumnSchema.builder().add(WeatherColumns.TIMESTAMP, ColumnType.TIME)
        .add(WeatherColumns.STATION, ColumnType.STRING).add(WeatherColumns.TEMPERATURE, ColumnType.STRING)
        .add(WeatherColumns.HUMIDITY, ColumnType.FLOAT).build();
    assertThatThrownBy(() -> new EnhancedDiskColumnStore("broken", directory, textTemperature, codec)).isInstanceOf(SchemaException.class);
  }
}
