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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;

/**
 * Time values as seconds since the epoch, either as a 8 bytes little-endian long (0 is null) or as decimal text.
 */
public final class EpochSecondsCodec {
  public static final int  WIDTH      = 8;
  public static final long NULL_VALUE = 0L;

  private EpochSecondsCodec() {
  }

  public static byte[] encode(final Instant value) {
    return ByteBuffer.allocate(WIDTH).order(ByteOrder.LITTLE_ENDIAN).putLong(value != null ? value.getEpochSecond() : NULL_VALUE).array();
  }

  public static long decodeRaw(final byte[] buffer, final int offset) {
    return ByteBuffer.wrap(buffer, offset, WIDTH).order(ByteOrder.LITTLE_ENDIAN).getLong();
  }

  public static Instant decode(final byte[] buffer, final int offset) {
    final long seconds = decodeRaw(buffer, offset);
    return seconds == NULL_VALUE ? null : Instant.ofEpochSecond(seconds);
  }

  public static String encodeText(final Instant value) {
    return Long.toString(value.getEpochSecond());
  }

  /**
   * @throws NumberFormatException if the text is not a decimal number
   */
  public static Instant decodeText(final String text) {
    return Instant.ofEpochSecond(Long.parseLong(text));
  }

  /**
   * Tells if the text is an optionally signed run of decimal digits.
   */
  public static boolean isEpochSeconds(final String text) {
    final int length = text.length();
    if (length == 0)
      return false;
    final int start = text.charAt(0) == '-' || text.charAt(0) == '+' ? 1 : 0;
    if (start == length)
      return false;
    for (int i = start; i < length; i++) {
      final char c = text.charAt(i);
      if (c < '0' || c > '9')
        return false;
    }
    return true;
  }
}
