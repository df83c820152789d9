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

/**
 * 4 bytes little-endian IEEE-754 float. Null is written as the canonical quiet NaN and any NaN is read back as null.
 */
public final class Float32Codec {
  public static final int WIDTH         = 4;
  public static final int NULL_RAW_BITS = 0x7fc00000;

  private Float32Codec() {
  }

  public static byte[] encode(final Float value) {
    final int bits = value != null ? Float.floatToRawIntBits(value) : NULL_RAW_BITS;
    return ByteBuffer.allocate(WIDTH).order(ByteOrder.LITTLE_ENDIAN).putInt(bits).array();
  }

  public static Float decode(final byte[] buffer, final int offset) {
    final float value = ByteBuffer.wrap(buffer, offset, WIDTH).order(ByteOrder.LITTLE_ENDIAN).getFloat();
    return Float.isNaN(value) ? null : value;
  }
}
