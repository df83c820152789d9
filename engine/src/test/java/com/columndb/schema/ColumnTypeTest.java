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
package com.columndb.schema;

import com.columndb.engine.codec.ColumnEncoding;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnTypeTest {
  @Test
  void testDefaultEncodings() {
    assertThat(ColumnType.STRING.getDefaultEncoding()).isEqualTo(ColumnEncoding.TEXT_LINE);
    assertThat(ColumnType.INTEGER.getDefaultEncoding()).isEqualTo(ColumnEncoding.INT32);
    assertThat(ColumnType.FLOAT.getDefaultEncoding()).isEqualTo(ColumnEncoding.FLOAT32);
    assertThat(ColumnType.TIME.getDefaultEncoding()).isEqualTo(ColumnEncoding.EPOCH_SECONDS_TEXT);

    for (final ColumnType type : ColumnType.values()) {
      final ColumnDefinition column = new ColumnDefinition("c", type);
      assertThat(column.getEncoding().getType()).isEqualTo(type);
    }
  }

  @Test
  void testEveryEncodingBelongsToItsType() {
    for (final ColumnEncoding encoding : ColumnEncoding.values()) {
      assertThat(encoding.getType()).isNotNull();
      assertThat(new ColumnDefinition("c", encoding.getType(), encoding).getEncoding()).isEqualTo(encoding);
    }
  }

  @Test
  void testTypeLoadedBeforeEncoding() throws Exception {
    try (final URLClassLoader loader = isolatedLoader()) {
      final Class<?> typeClass = Class.forName(ColumnType.class.getName(), true, loader);
      final Object integer = typeClass.getField("INTEGER").get(null);
      final Object encoding = typeClass.getMethod("getDefaultEncoding").invoke(integer);

      assertThat(encoding).hasToString("INT32");
      assertThat(encoding.getClass().getMethod("getType").invoke(encoding)).isSameAs(integer);
    }
  }

  @Test
  void testEncodingLoadedBeforeType() throws Exception {
    try (final URLClassLoader loader = isolatedLoader()) {
      final Class<?> encodingClass = Class.forName(ColumnEncoding.class.getName(), true, loader);
      final Object int32 = encodingClass.getField("INT32").get(null);
      final Object type = encodingClass.getMethod("getType").invoke(int32);

      assertThat(type).hasToString("INTEGER");
      assertThat(type.getClass().getMethod("getDefaultEncoding").invoke(type)).isSameAs(int32);
    }
  }

  /**
   * Loads the engine classes again, so the two enums are initialized in the order the test picks.
   */
  private static URLClassLoader isolatedLoader() {
    final URL classes = ColumnType.class.getProtectionDomain().getCodeSource().getLocation();
    return new URLClassLoader(new URL[] { classes }, ClassLoader.getPlatformClassLoader());
  }
}
