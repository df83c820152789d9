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
package com.columndb.console;

import com.columndb.GlobalConfiguration;
import com.columndb.exception.ColumnDBException;
import com.columndb.exporter.ExtremeValueCSVWriter;
import com.columndb.importer.CSVLoader;
import com.columndb.log.LogManager;
import com.columndb.query.ExtremeValuesResult;
import com.columndb.query.GenericExtremeValuesQuery;
import com.columndb.store.ColumnStore;
import com.columndb.store.ColumnStoreFactory;
import com.columndb.store.EnhancedDiskColumnStore;
import com.columndb.store.StoreType;
import com.columndb.store.WeatherColumns;
import com.columndb.utility.FileUtils;

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

/**
 * Loads the weather CSV file into every store kind, computes the monthly extreme readings for the requested years and station,
 * prints the time taken by every store and appends the readings to {@code ScanResult.csv} in the store directory.
 * <p>
 * Usage: {@code ColumnStoreRunner <csvFile> [-station <name>] [-store <type>] [-D<setting>=<value>] [year...]}
 */
public class ColumnStoreRunner {
  public static final String RESULT_FILE_NAME = "ScanResult.csv";

  private final ColumnStoreFactory        factory;
  private final CSVLoader                 loader;
  private final GenericExtremeValuesQuery genericQuery;
  private final ExtremeValueCSVWriter     writer = new ExtremeValueCSVWriter();
  private final PrintStream               out;

  public ColumnStoreRunner(final ColumnStoreFactory factory, final CSVLoader loader, final PrintStream out) {
    this.factory = factory;
    this.loader = loader;
    this.genericQuery = new GenericExtremeValuesQuery(factory.getCodec().getZoneOffset());
    this.out = out;
  }

  public static void main(final String[] args) {
    File csvFile = null;
    String station = "Changi";
    final List<StoreType> storeTypes = new ArrayList<>();
    final List<Integer> years = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      final String value = args[i].trim();
      if (value.startsWith("-D")) {
        // SETTING
        final String[] parts = value.substring(2).split("=", 2);
        System.setProperty(parts[0], parts.length > 1 ? parts[1] : "");
        final GlobalConfiguration cfg = GlobalConfiguration.findByKey(parts[0]);
        if (cfg != null)
          cfg.setValue(parts.length > 1 ? parts[1] : "");
      } else if (value.equals("-station") && i < args.length - 1)
        station = args[++i];
      else if (value.equals("-store") && i < args.length - 1)
        storeTypes.add(StoreType.fromName(args[++i]));
      else if (csvFile == null)
        csvFile = new File(value);
      else
        years.add(Integer.parseInt(value));
    }

    if (csvFile == null) {
      System.err.println("Usage: ColumnStoreRunner <csvFile> [-station <name>] [-store <type>] [-D<setting>=<value>] [year...]");
      System.exit(1);
    }

    if (years.isEmpty()) {
      years.add(2010);
      years.add(2019);
    }
    if (storeTypes.isEmpty())
      storeTypes.addAll(List.of(StoreType.values()));

    new ColumnStoreRunner(new ColumnStoreFactory(), new CSVLoader(), System.out).run(csvFile, storeTypes, years, station);
  }

  /**
   * Runs the whole workload on every store type. A failing store is reported and does not stop the others.
   *
   * @return the number of stores that completed the workload
   */
  public int run(final File csvFile, final List<StoreType> storeTypes, final List<Integer> years, final String station) {
    int completed = 0;
    out.println("------Time Taken------");
    for (final StoreType type : storeTypes) {
      final File storeDirectory = factory.getStoreDirectory(type);
      FileUtils.deleteRecursively(storeDirectory);

      try (final ColumnStore store = factory.create(type, WeatherColumns.SCHEMA)) {
        loader.load(csvFile, store);

        final long beginTime = System.currentTimeMillis();
        final List<ExtremeValuesResult> results = new ArrayList<>(years.size());
        for (final int year : years)
          results.add(getExtremeValues(store, year, station));
        out.println(store.getName() + ": " + (System.currentTimeMillis() - beginTime) + "ms");

        final File resultFile = new File(storeDirectory, RESULT_FILE_NAME);
        for (final ExtremeValuesResult result : results) {
          if (!result.isComplete())
            LogManager.instance().log(this, Level.WARNING, "Extreme values of %d/%s on store '%s' are incomplete: %s", null, result.getYear(),
                result.getStation(), store.getName(), result);
          writer.append(resultFile, result.getValues());
        }
        ++completed;
      } catch (final ColumnDBException e) {
        LogManager.instance().log(this, Level.SEVERE, "Error on running store '%s': %s", e, type.getStoreName(), e.toJSON());
      }
    }
    return completed;
  }

  /**
   * Uses the shared scan of the enhanced disk store, the generic query for any other store.
   */
  public ExtremeValuesResult getExtremeValues(final ColumnStore store, final int year, final String station) {
    if (store instanceof EnhancedDiskColumnStore enhanced)
      return enhanced.getExtremeValues(year, station);
    return genericQuery.execute(store, year, station);
  }
}
