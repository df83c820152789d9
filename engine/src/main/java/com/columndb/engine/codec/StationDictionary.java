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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps station names to the single byte stored by the {@link ColumnEncoding#STATION_CODE_8} encoding. The byte {@code 'M'} is
 * reserved for null.
 */
public final class StationDictionary {
  public static final byte              NULL_CODE = 'M';
  public static final StationDictionary DEFAULT   = new StationDictionary(Map.of("Changi", (byte) 'C', "Paya Lebar", (byte) 'P'));

  private final Map<String, Byte> codes;
  private final Map<Byte, String> names;

  public StationDictionary(final Map<String, Byte> codes) {
    final Map<String, Byte> byName = new LinkedHashMap<>();
    final Map<Byte, String> byCode = new LinkedHashMap<>();
    for (final Map.Entry<String, Byte> entry : codes.entrySet()) {
      if (entry.getValue() == NULL_CODE)
        throw new IllegalArgumentException("Code '" + (char) NULL_CODE + "' is reserved for null");
      if (byCode.put(entry.getValue(), entry.getKey()) != null)
        throw new IllegalArgumentException("Code '" + (char) entry.getValue().byteValue() + "' is used by more than one station");
      byName.put(entry.getKey(), entry.getValue());
    }
    this.codes = Collections.unmodifiableMap(byName);
    this.names = Collections.unmodifiableMap(byCode);
  }

  /**
   * Returns the code of the station, or null if the station is unknown.
   */
  public Byte getCode(final String stationName) {
    return stationName != null ? codes.get(stationName) : null;
  }

  /**
   * Returns the station name of the code, or null if the code is not in the dictionary.
   */
  public String getName(final byte code) {
    return names.get(code);
  }

  public Map<String, Byte> getCodes() {
    return codes;
  }
}
