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
package com.columndb.utility;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileUtilsTest {
  @Test
  void testSizes() {
    assertThat(FileUtils.getSizeAsNumber("10240")).isEqualTo(10240);
    assertThat(FileUtils.getSizeAsNumber("10KB")).isEqualTo(10240);
    assertThat(FileUtils.getSizeAsNumber("1MB")).isEqualTo(FileUtils.MEGABYTE);
    assertThat(FileUtils.getSizeAsString(2048)).isEqualTo("2.00KB");
    assertThatThrownBy(() -> FileUtils.getSizeAsNumber("lots")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testValidNames() throws IOException {
    FileUtils.checkValidName("Temperature");
    assertThatThrownBy(() -> FileUtils.checkValidName("../etc")).isInstanceOf(IOException.class);
    assertThatThrownBy(() -> FileUtils.checkValidName("a/b")).isInstanceOf(IOException.class);
    assertThatThrownBy(() -> FileUtils.checkValidName("")).isInstanceOf(IOException.class);
  }

  @Test
  void testDeleteRecursively() throws IOException {
    final File root = new File("target/stores/FileUtilsTest");
    final File nested = new File(root, "a/b");
    Files.createDirectories(nested.toPath());
    Files.writeString(new File(nested, "c.store").toPath(), "x");

    FileUtils.deleteRecursively(root);
    assertThat(root).doesNotExist();
  }
}
