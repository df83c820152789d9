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

import com.columndb.engine.codec.ColumnEncoding;
import com.columndb.engine.codec.TypeCodec;
import com.columndb.engine.scan.ScanResult;
import com.columndb.exception.ErrorCode;
import com.columndb.exception.SchemaException;
import com.columndb.query.ExtremeValuesResult;
import com.columndb.query.SharedScanCoordinator;
import com.columndb.schema.ColumnDefinition;
import com.columndb.schema.ColumnSchema;
import com.columndb.schema.ColumnType;

import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Disk store for the weather data set. {@code Timestamp} is stored as 8 bytes epoch seconds and {@code Station} as a 1 byte code,
 * so both can be scanned without decoding, and the monthly extreme readings are computed by a {@link SharedScanCoordinator}.
 * Every other operation behaves as in {@link DiskColumnStore}.
 */
public class EnhancedDiskColumnStore implements ColumnStore {
  private final DiskColumnStore       disk;
  private final SharedScanCoordinator coordinator;

  public EnhancedDiskColumnStore(final String name, final File baseDirectory, final ColumnSchema schema, final TypeCodec codec) {
    checkColumn(schema, WeatherColumns.TIMESTAMP, ColumnType.TIME);
    checkColumn(schema, WeatherColumns.STATION, ColumnType.STRING);
    checkColumn(schema, WeatherColumns.TEMPERATURE, ColumnType.FLOAT);
    checkColumn(schema, WeatherColumns.HUMIDITY, ColumnType.FLOAT);

    this.disk = new DiskColumnStore(name, baseDirectory, specialize(schema), codec);
    this.coordinator = new SharedScanCoordinator(name, disk.getColumnFile(WeatherColumns.TIMESTAMP), disk.getColumnFile(WeatherColumns.STATION),
        disk.getColumnFile(WeatherColumns.TEMPERATURE), disk.getColumnFile(WeatherColumns.HUMIDITY));
  }

  /**
   * Returns the schema with the fixed width encodings of the {@code Timestamp} and {@code Station} columns.
   */
  public static ColumnSchema specialize(final ColumnSchema schema) {
    return schema.withEncoding(WeatherColumns.TIMESTAMP, ColumnEncoding.EPOCH_SECONDS_64)
        .withEncoding(WeatherColumns.STATION, ColumnEncoding.STATION_CODE_8);
  }

  /**
   * Returns the extreme humidity and temperature readings of every month of the year for the station, ordered by month and then
   * by max humidity, min humidity, max temperature, min temperature. Readings of the same day in the same category are reported
   * once, for the first row.
   */
  public ExtremeValuesResult getExtremeValues(final int year, final String station) {
    disk.checkIsOpen();
    return coordinator.getExtremeValues(year, station);
  }

  public File getDirectory() {
    return disk.getDirectory();
  }

  @Override
  public String getName() {
    return disk.getName();
  }

  @Override
  public ColumnSchema getSchema() {
    return disk.getSchema();
  }

  @Override
  public boolean store(final String column, final String value) {
    return disk.store(column, value);
  }

  @Override
  public long storeAll(final Map<String, List<String>> values) {
    return disk.storeAll(values);
  }

  @Override
  public ScanResult filter(final String column, final Predicate<Object> predicate) {
    return disk.filter(column, predicate);
  }

  @Override
  public ScanResult filter(final String column, final Predicate<Object> predicate, final int[] candidates) {
    return disk.filter(column, predicate, candidates);
  }

  @Override
  public ScanResult getMax(final String column, final int[] candidates) {
    return disk.getMax(column, candidates);
  }

  @Override
  public ScanResult getMin(final String column, final int[] candidates) {
    return disk.getMin(column, candidates);
  }

  @Override
  public Optional<Object> getValue(final String column, final int index) {
    return disk.getValue(column, index);
  }

  @Override
  public long getRecordCount() {
    return disk.getRecordCount();
  }

  @Override
  public String head(final int rows) {
    return disk.head(rows);
  }

  @Override
  public void close() {
    try {
      coordinator.close();
    } finally {
      disk.close();
    }
  }

  @Override
  public String toString() {
    return disk.toString();
  }

  private static void checkColumn(final ColumnSchema schema, final String name, final ColumnType type) {
    if (!schema.existsColumn(name))
      throw new SchemaException(ErrorCode.INVALID_COLUMN, "Column '" + name + "' is required by the enhanced disk store");
    final ColumnDefinition column = schema.getColumn(name);
    if (column.getType() != type)
      throw new SchemaException(ErrorCode.INVALID_COLUMN,
          "Column '" + name + "' must be of type " + type + " instead of " + column.getType());
  }
}
