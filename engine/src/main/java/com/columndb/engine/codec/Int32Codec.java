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
 * 4 bytes little-endian signed integer. {@link Integer#MIN_VALUE} is reserved for null.
 */
public final class Int32Codec {
  public static final int WIDTH      = 4;
  public static final int NULL_VALUE = Integer.MIN_VALUE;

  private Int32Codec() {
  }

  public static byte[] encode(final Integer value) {
    return ByteBuffer.allocate(WIDTH).order(ByteOrder.LITTLE_ENDIAN).putInt(value != null ? value : NULL_VALUE).array();
  }

  public static Integer decode(final byte[] buffer, final int offset) {
    final int value = ByteBuffer.wrap(buffer, offset, WIDTH).order(ByteOrder.LITTLE_ENDIAN).getInt();
    return value == NULL_VALUE ? null : value;
  }
}
