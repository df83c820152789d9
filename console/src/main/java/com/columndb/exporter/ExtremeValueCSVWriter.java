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
package com.columndb.exporter;

import com.columndb.exception.StorageException;
import com.columndb.query.ExtremeValue;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Appends extreme readings to a CSV file, one row per reading. The header is written only when the file is created.
 */
public class ExtremeValueCSVWriter {
  public static final String[]          HEADER      = { "Date", "Station", "Category", "Value" };
  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

  public void append(final File file, final List<ExtremeValue> values) {
    final boolean newFile = !file.exists() || file.length() == 0;
    try {
      final File parent = file.getAbsoluteFile().getParentFile();
      if (parent != null)
        Files.createDirectories(parent.toPath());
    } catch (final IOException e) {
      throw new StorageException("Cannot create the directory of '" + file + "'", e);
    }

    final CsvWriterSettings settings = new CsvWriterSettings();
    settings.getFormat().setLineSeparator("\n");

    try {
      final CsvWriter writer = new CsvWriter(new OutputStreamWriter(new FileOutputStream(file, true), StandardCharsets.UTF_8), settings);
      try {
        if (newFile)
          writer.writeHeaders(HEADER);
        for (final ExtremeValue value : values)
          writer.writeRow(DATE_FORMAT.format(value.date()), value.stationName(), value.category().getLabel(), Float.toString(value.value()));
      } finally {
        writer.close();
      }
    } catch (final IOException e) {
      throw new StorageException("Error on writing extreme values to '" + file + "'", e);
    }
  }
}
