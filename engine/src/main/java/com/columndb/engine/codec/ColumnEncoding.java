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

import com.columndb.schema.ColumnType;

/**
 * Physical encodings of a column file. Fixed width encodings store one little-endian record of {@link #getWidth()} bytes per row,
 * line encodings store one textual value per line.
 */
public enum ColumnEncoding {
  TEXT_LINE(0, -1, ColumnType.STRING),
  EPOCH_SECONDS_TEXT(1, -1, ColumnType.TIME),
  EPOCH_SECONDS_64(2, 8, ColumnType.TIME),
  INT32(3, 4, ColumnType.INTEGER),
  FLOAT32(4, 4, ColumnType.FLOAT),
  STATION_CODE_8(5, 1, ColumnType.STRING);

  private final int        code;
  private final int        width;
  private final ColumnType type;

  ColumnEncoding(final int code, final int width, final ColumnType type) {
    this.code = code;
    this.width = width;
    this.type = type;
  }

  public int getCode() {
    return code;
  }

  /**
   * Returns the record size in bytes, -1 for line encodings.
   */
  public int getWidth() {
    return width;
  }

  public ColumnType getType() {
    return type;
  }

  public boolean isFixedWidth() {
    return width > 0;
  }

  public static ColumnEncoding fromCode(final int code) {
    for (final ColumnEncoding encoding : values())
      if (encoding.code == code)
        return encoding;
    throw new IllegalArgumentException("Unknown encoding code: " + code);
  }
}
