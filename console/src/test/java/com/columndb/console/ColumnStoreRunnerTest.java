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

import com.columndb.engine.codec.StationDictionary;
import com.columndb.engine.codec.TypeCodec;
import com.columndb.importer.CSVLoader;
import com.columndb.store.ColumnStoreFactory;
import com.columndb.store.StoreType;
import com.columndb.utility.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnStoreRunnerTest {
  private static final File DIRECTORY = new File("target/stores/ColumnStoreRunnerTest");

  private final ByteArrayOutputStream output  = new ByteArrayOutputStream();
  private final ColumnStoreFactory    factory = new ColumnStoreFactory(DIRECTORY,
      new TypeCodec(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"), ZoneOffset.ofHours(8), StationDictionary.DEFAULT));
  private       ColumnStoreRunner     runner;

  @BeforeEach
  void setUp() {
    FileUtils.deleteRecursively(DIRECTORY);
    runner = new ColumnStoreRunner(factory, new CSVLoader(",", 3), new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  @AfterEach
  void tearDown() {
    FileUtils.deleteRecursively(DIRECTORY);
  }

  @Test
  void testEveryStoreWritesTheSameResult() throws IOException {
    final File csv = weatherFile();

    assertThat(runner.run(csv, List.of(StoreType.values()), List.of(2010, 2019), "Changi")).isEqualTo(3);

    final List<String> memory = Files.readAllLines(resultFile(StoreType.MEMORY).toPath(), StandardCharsets.UTF_8);
    assertThat(memory).containsExactly(//
        "Date,Station,Category,Value",//
        "2010-01-05,Changi,Max Humidity,85.0",//
        "2010-01-06,Changi,Min Humidity,60.0",//
        "2010-01-05,Changi,Max Temperature,30.0",//
        "2010-01-06,Changi,Min Temperature,25.0",//
        "2019-03-01,Changi,Max Humidity,90.0",//
        "2019-03-01,Changi,Min Humidity,90.0",//
        "2019-03-01,Changi,Max Temperature,33.3",//
        "2019-03-01,Changi,Min Temperature,33.3");

    assertThat(Files.readAllLines(resultFile(StoreType.DISK).toPath(), StandardCharsets.UTF_8)).isEqualTo(memory);
    assertThat(Files.readAllLines(resultFile(StoreType.ENHANCED_DISK).toPath(), StandardCharsets.UTF_8)).isEqualTo(memory);

    final String printed = output.toString(StandardCharsets.UTF_8);
    assertThat(printed).startsWith("------Time Taken------");
    assertThat(printed).contains("memory: ").contains("disk: ").contains("enhanced_disk: ");
  }

  @Test
  void testRerunReplacesPreviousResult() throws IOException {
    final File csv = weatherFile();
    runner.run(csv, List.of(StoreType.ENHANCED_DISK), List.of(2010), "Changi");
    runner.run(csv, List.of(StoreType.ENHANCED_DISK), List.of(2010), "Changi");

    assertThat(Files.readAllLines(resultFile(StoreType.ENHANCED_DISK).toPath(), StandardCharsets.UTF_8)).hasSize(5);
  }

  @Test
  void testFailingStoreDoesNotStopTheOthers() throws IOException {
    final File csv = new File(DIRECTORY, "bad.csv");
    Files.createDirectories(DIRECTORY.toPath());
    Files.writeString(csv.toPath(), "id,Timestamp,Station\n0,2010-01-01 08:00,Changi\n", StandardCharsets.UTF_8);

    assertThat(runner.run(csv, List.of(StoreType.MEMORY, StoreType.DISK), List.of(2010), "Changi")).isZero();
    assertThat(output.toString(StandardCharsets.UTF_8)).startsWith("------Time Taken------");
  }

  private File resultFile(final StoreType type) {
    return new File(factory.getStoreDirectory(type), ColumnStoreRunner.RESULT_FILE_NAME);
  }

  private static File weatherFile() throws IOException {
    Files.createDirectories(DIRECTORY.toPath());
    final File file = new File(DIRECTORY, "weather.csv");
    Files.writeString(file.toPath(), "id,Timestamp,Station,Temperature,Humidity\n"//
        + "0,2010-01-05 10:00,Changi,30,80\n"//
        + "1,2010-01-05 14:00,Changi,30,85\n"//
        + "2,2010-01-06 10:00,Changi,25,60\n"//
        + "3,2010-01-07 10:00,Paya Lebar,35,99\n"//
        + "4,2019-03-01 09:00,Changi,33.3,90\n"//
        + "5,M,Changi,50,10\n"//
        + "6,2019-03-02 09:00,Changi,M,M\n", StandardCharsets.UTF_8);
    return file;
  }
}
