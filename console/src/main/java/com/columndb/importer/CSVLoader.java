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

import com.columndb.GlobalConfiguration;
import com.columndb.engine.codec.TypeCodec;
import com.columndb.exception.ImportException;
import com.columndb.log.LogManager;
import com.columndb.store.ColumnStore;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;

/**
 * Loads a CSV file into a store. The first line is the header and must contain exactly the columns of the store schema, in any
 * order. Short rows are padded with the null token and long rows are truncated. Rows are handed to
 * {@link ColumnStore#storeAll(Map)} in batches.
 */
public class CSVLoader {
  public static final int DEFAULT_BATCH_SIZE = 10_000;

  private final String delimiter;
  private final int    batchSize;

  public CSVLoader() {
    this(GlobalConfiguration.CSV_DELIMITER.getValueAsString(), DEFAULT_BATCH_SIZE);
  }

  public CSVLoader(final String delimiter, final int batchSize) {
    if (delimiter == null || delimiter.length() != 1)
      throw new IllegalArgumentException("CSV delimiter must be one character, found '" + delimiter + "'");
    if (batchSize < 1)
      throw new IllegalArgumentException("Batch size must be positive");
    this.delimiter = delimiter;
    this.batchSize = batchSize;
  }

  /**
   * @return the number of rows stored
   *
   * @throws ImportException if the file cannot be read or its header does not match the store schema
   */
  public long load(final File file, final ColumnStore store) {
    final CsvParserSettings settings = new CsvParserSettings();
    settings.getFormat().setDelimiter(delimiter.charAt(0));
    settings.getFormat().setLineSeparator("\n");
    settings.setMaxCharsPerColumn(-1);
    final CsvParser csvParser = new CsvParser(settings);

    LogManager.instance().log(this, Level.INFO, "Started loading '%s' into store '%s'", null, file, store.getName());

    final long beginTime = System.currentTimeMillis();
    long stored = 0;
    long parsed = 0;
    boolean started = false;

    try (final InputStreamReader inputFileReader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
      csvParser.beginParsing(inputFileReader);
      started = true;

      final String[] header = csvParser.parseNext();
      if (header == null)
        throw new ImportException("CSV file '" + file + "' has no header");

      final List<String> columns = new ArrayList<>(header.length);
      for (final String column : header)
        columns.add(column != null ? column.trim() : "");

      final Set<String> incoming = new HashSet<>(columns);
      if (incoming.size() != columns.size() || !incoming.equals(store.getSchema().getColumnNames()))
        throw (ImportException) new ImportException(
            "Header " + columns + " of CSV file '" + file + "' does not match the columns " + store.getSchema().getColumnNames() + " of store '"
                + store.getName() + "'").addContext("file", file.getAbsolutePath());

      Map<String, List<String>> batch = newBatch(columns);
      String[] row;
      while ((row = csvParser.parseNext()) != null) {
        ++parsed;
        for (int i = 0; i < columns.size(); i++) {
          final String value = i < row.length ? row[i] : TypeCodec.NULL_TOKEN;
          batch.get(columns.get(i)).add(value != null ? value : "");
        }

        if (batch.get(columns.get(0)).size() >= batchSize) {
          stored += store.storeAll(batch);
          batch = newBatch(columns);
        }
      }

      if (!batch.get(columns.get(0)).isEmpty())
        stored += store.storeAll(batch);

    } catch (final IOException e) {
      throw new ImportException("Error on loading CSV file '" + file + "'", e);
    } finally {
      if (started)
        csvParser.stopParsing();
    }

    LogManager.instance().log(this, Level.INFO, "Loading of '%s' into store '%s' completed in %dms: parsed %d rows, stored %d rows", null, file,
        store.getName(), System.currentTimeMillis() - beginTime, parsed, stored);
    return stored;
  }

  public String getDelimiter() {
    return delimiter;
  }

  private static Map<String, List<String>> newBatch(final List<String> columns) {
    final Map<String, List<String>> batch = new LinkedHashMap<>();
    for (final String column : columns)
      batch.put(column, new ArrayList<>());
    return batch;
  }
}
