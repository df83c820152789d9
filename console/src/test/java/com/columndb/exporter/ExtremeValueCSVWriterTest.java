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

import com.columndb.query.ExtremeCategory;
import com.columndb.query.ExtremeValue;
import com.columndb.utility.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExtremeValueCSVWriterTest {
  private static final File DIRECTORY = new File("target/stores/ExtremeValueCSVWriterTest");

  @BeforeEach
  void setUp() {
    FileUtils.deleteRecursively(DIRECTORY);
  }

  @AfterEach
  void tearDown() {
    FileUtils.deleteRecursively(DIRECTORY);
  }

  @Test
  void testHeaderIsWrittenOnce() throws IOException {
    final File file = new File(DIRECTORY, "disk/ScanResult.csv");
    final ExtremeValueCSVWriter writer = new ExtremeValueCSVWriter();

    writer.append(file, List.of(new ExtremeValue(LocalDate.of(2010, 1, 5), "Changi", ExtremeCategory.MAX_TEMPERATURE, 30.5f)));
    writer.append(file, List.of(new ExtremeValue(LocalDate.of(2019, 12, 31), "Changi", ExtremeCategory.MIN_HUMIDITY, 60f),
        new ExtremeValue(LocalDate.of(2019, 12, 31), "Paya Lebar", ExtremeCategory.MAX_HUMIDITY, 99f)));

    assertThat(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8)).containsExactly(//
        "Date,Station,Category,Value",//
        "2010-01-05,Changi,Max Temperature,30.5",//
        "2019-12-31,Changi,Min Humidity,60.0",//
        "2019-12-31,Paya Lebar,Max Humidity,99.0");
  }

  @Test
  void testNothingToAppend() throws IOException {
    final File file = new File(DIRECTORY, "ScanResult.csv");
    new ExtremeValueCSVWriter().append(file, List.of());
    new ExtremeValueCSVWriter().append(file, List.of());

    assertThat(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8)).containsExactly("Date,Station,Category,Value");
  }
}
