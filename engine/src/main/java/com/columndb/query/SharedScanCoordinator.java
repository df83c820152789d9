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
import com.columndb.engine.ColumnFile;
import com.columndb.engine.codec.ColumnEncoding;
import com.columndb.engine.codec.EpochSecondsCodec;
import com.columndb.engine.scan.ColumnScanner;
import com.columndb.engine.scan.ScanResult;
import com.columndb.exception.ColumnDBException;
import com.columndb.exception.ErrorCode;
import com.columndb.exception.QueryException;
import com.columndb.exception.SchemaException;
import com.columndb.log.LogManager;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

/**
 * Computes, for a year and a station, the extreme humidity and temperature readings of every month. The year and station filters
 * run on the calling thread over the raw fixed width records, then one task per month runs on a bounded pool. Tasks share no
 * mutable state: their records are appended in month order once every task completed.
 */
public class SharedScanCoordinator implements AutoCloseable {
  public static final int MONTHS = 12;

  private final String          storeName;
  private final ColumnFile      timestamp;
  private final ColumnFile      station;
  private final ColumnFile      temperature;
  private final ColumnFile      humidity;
  private final ZoneOffset      offset;
  private final ExecutorService executor;

  public SharedScanCoordinator(final String storeName, final ColumnFile timestamp, final ColumnFile station, final ColumnFile temperature,
      final ColumnFile humidity) {
    this(storeName, timestamp, station, temperature, humidity, GlobalConfiguration.SHARED_SCAN_THREADS.getValueAsInteger());
  }

  public SharedScanCoordinator(final String storeName, final ColumnFile timestamp, final ColumnFile station, final ColumnFile temperature,
      final ColumnFile humidity, final int threads) {
    checkEncoding(timestamp, ColumnEncoding.EPOCH_SECONDS_64);
    checkEncoding(station, ColumnEncoding.STATION_CODE_8);
    checkNumeric(temperature);
    checkNumeric(humidity);

    this.storeName = storeName;
    this.timestamp = timestamp;
    this.station = station;
    this.temperature = temperature;
    this.humidity = humidity;
    this.offset = timestamp.getCodec().getZoneOffset();

    final AtomicInteger threadCounter = new AtomicInteger(0);
    this.executor = Executors.newFixedThreadPool(Math.min(MONTHS, Math.max(1, threads)), r -> {
      final Thread t = new Thread(r, "ColumnDB-SharedScan-" + storeName + "-" + threadCounter.getAndIncrement());
      t.setDaemon(true);
      return t;
    });
  }

  public ExtremeValuesResult getExtremeValues(final int year, final String stationName) {
    final Byte code = station.getCodec().getStations().getCode(stationName);
    if (code == null) {
      final SchemaException error = (SchemaException) new SchemaException(ErrorCode.INVALID_OPERATION,
          "Unknown station '" + stationName + "'").addContext("store", storeName);
      LogManager.instance().log(this, Level.WARNING, "Shared scan on store '%s' skipped: %s", null, storeName, error.getMessage());
      return ExtremeValuesResult.failed(year, stationName, error);
    }

    final long beginTime = System.nanoTime();

    final ScanResult inYear = filterYear(year);
    if (!inYear.isComplete())
      return abort(year, stationName, "year filter", inYear.getError());

    final ScanResult atStation = filterStation(code, inYear.getIndexes());
    if (!atStation.isComplete())
      return abort(year, stationName, "station filter", atStation.getError());

    final int[] candidates = atStation.getIndexes();

    @SuppressWarnings("unchecked")
    final CompletableFuture<List<ExtremeValue>>[] futures = new CompletableFuture[MONTHS];
    for (int m = 0; m < MONTHS; m++)
      futures[m] = CompletableFuture.supplyAsync(
          new MonthScanTask(timestamp, temperature, humidity, offset, stationName, year, m + 1, candidates), executor);

    // BARRIER: FAILURES ARE COLLECTED PER MONTH BELOW
    CompletableFuture.allOf(futures).handle((ignored, error) -> null).join();

    final List<ExtremeValue> values = new ArrayList<>();
    final Map<Integer, ColumnDBException> failedMonths = new LinkedHashMap<>();
    for (int m = 0; m < MONTHS; m++) {
      try {
        values.addAll(futures[m].join());
      } catch (final CompletionException e) {
        final ColumnDBException error = toQueryException(m + 1, e.getCause());
        failedMonths.put(m + 1, error);
        LogManager.instance().log(this, Level.WARNING, "Month %d of shared scan %d/%s on store '%s' failed", error, m + 1, year, stationName,
            storeName);
      }
    }

    LogManager.instance().log(this, Level.FINE, "Shared scan %d/%s on store '%s': %d candidates, %d records in %dms", null, year, stationName,
        storeName, candidates.length, values.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - beginTime));

    return new ExtremeValuesResult(year, stationName, values, failedMonths, null);
  }

  /**
   * Returns the rows whose non-null timestamp falls in the calendar year at the configured offset.
   */
  public ScanResult filterYear(final int year) {
    final YearMonthRange range = YearMonthRange.ofYear(year, offset);
    return new ColumnScanner(timestamp).scanRecords((buffer, position) -> {
      final long seconds = EpochSecondsCodec.decodeRaw(buffer, position);
      return seconds != EpochSecondsCodec.NULL_VALUE && range.contains(seconds);
    });
  }

  /**
   * Returns the candidates whose station byte equals {@code code}.
   */
  public ScanResult filterStation(final byte code, final int[] candidates) {
    return new ColumnScanner(station).scanRecords((buffer, position) -> buffer[position] == code, candidates);
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS))
        executor.shutdownNow();
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private ExtremeValuesResult abort(final int year, final String stationName, final String phase, final ColumnDBException error) {
    LogManager.instance().log(this, Level.WARNING, "Shared scan %d/%s on store '%s' stopped by the %s", error, year, stationName, storeName,
        phase);
    return ExtremeValuesResult.failed(year, stationName, error);
  }

  private ColumnDBException toQueryException(final int month, final Throwable cause) {
    final QueryException error = new QueryException("Month " + month + " of the shared scan on store '" + storeName + "' failed", cause);
    error.addContext("month", month);
    if (cause instanceof ColumnDBException columnDBException)
      error.addContext("cause", columnDBException.getErrorCode().name());
    return error;
  }

  private static void checkEncoding(final ColumnFile file, final ColumnEncoding expected) {
    if (file.getDefinition().getEncoding() != expected)
      throw new SchemaException(ErrorCode.INVALID_COLUMN,
          "Column '" + file.getName() + "' must use encoding " + expected + " instead of " + file.getDefinition().getEncoding());
  }

  private static void checkNumeric(final ColumnFile file) {
    if (!file.getDefinition().getType().isNumeric() || !file.getDefinition().isFixedWidth())
      throw new SchemaException(ErrorCode.INVALID_COLUMN, "Column '" + file.getName() + "' must be a fixed width numeric column");
  }
}
