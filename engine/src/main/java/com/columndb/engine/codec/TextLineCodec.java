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
package com.columndb.engine.codec;

/**
 * One value per line. The token {@value #NULL_TOKEN} (and an empty line) stands for null.
 */
public final class TextLineCodec {
  public static final String NULL_TOKEN = "M";

  private TextLineCodec() {
  }

  /**
   * @throws IllegalArgumentException if the value contains a line break
   */
  public static String encode(final String value) {
    if (value == null)
      return NULL_TOKEN;
    if (value.indexOf('\n') > -1 || value.indexOf('\r') > -1)
      throw new IllegalArgumentException("Value contains a line break");
    return value;
  }

  public static String decode(final String line) {
    return line == null || line.isEmpty() || NULL_TOKEN.equals(line) ? null : line;
  }
}
