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

import com.columndb.GlobalConfiguration;
import com.columndb.exception.SerializationException;
import com.columndb.schema.ColumnType;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Converts textual input to typed values and typed values to and from the physical encodings of the column files.
 * <p>
 * Every encoding reserves a null sentinel, so a genuine value equal to the sentinel (NaN, {@link Integer#MIN_VALUE}, epoch 0 in
 * {@link ColumnEncoding#EPOCH_SECONDS_64}, the string {@value TextLineCodec#NULL_TOKEN}) reads back as null.
 *
 * @see ColumnEncoding
 */
public class TypeCodec {
  public static final String NULL_TOKEN = TextLineCodec.NULL_TOKEN;

  private final DateTimeFormatter dateTimeFormatter;
  private final ZoneOffset        zoneOffset;
  private final StationDictionary stations;

  public TypeCodec(final DateTimeFormatter dateTimeFormatter, final ZoneOffset zoneOffset, final StationDictionary stations) {
    this.dateTimeFormatter = dateTimeFormatter;
    this.zoneOffset = zoneOffset;
    this.stations = stations;
  }

  /**
   * Creates a codec with the date-time format and offset of the global configuration and the default station dictionary.
   */
  public static TypeCodec fromConfiguration() {
    return new TypeCodec(DateTimeFormatter.ofPattern(GlobalConfiguration.DATE_TIME_FORMAT.getValueAsString()),
        ZoneOffset.of(GlobalConfiguration.TIME_ZONE_OFFSET.getValueAsString()), StationDictionary.DEFAULT);
  }

  public ZoneOffset getZoneOffset() {
    return zoneOffset;
  }

  public StationDictionary getStations() {
    return stations;
  }

  /**
   * Parses a textual value. Empty text and the null token return null.
   *
   * @throws SerializationException if the text is not a valid value of the type
   */
  public Object parse(final String text, final ColumnType type) {
    if (text == null || text.isEmpty() || NULL_TOKEN.equals(text))
      return null;

    try {
      return switch (type) {
        case STRING -> text;
        case INTEGER -> Integer.parseInt(text.trim());
        case FLOAT -> Float.parseFloat(text.trim());
        case TIME -> parseTime(text.trim());
      };
    } catch (final NumberFormatException | DateTimeException e) {
      throw new SerializationException("Cannot parse '" + text + "' as " + type, e);
    }
  }

  /**
   * Encodes a value, or the sentinel for null, as a fixed width record.
   *
   * @throws SerializationException if the value cannot be represented by the encoding
   */
  public byte[] encode(final Object value, final ColumnEncoding encoding) {
    return switch (encoding) {
      case INT32 -> Int32Codec.encode(cast(value, Integer.class, encoding));
      case FLOAT32 -> Float32Codec.encode(cast(value, Float.class, encoding));
      case EPOCH_SECONDS_64 -> EpochSecondsCodec.encode(cast(value, Instant.class, encoding));
      case STATION_CODE_8 -> new byte[] { encodeStation(cast(value, String.class, encoding)) };
      default -> throw new SerializationException("Encoding " + encoding + " is not fixed width");
    };
  }

  /**
   * Encodes a value, or the null token for null, as one line of a line encoded column.
   *
   * @throws SerializationException if the value cannot be represented by the encoding
   */
  public String encodeLine(final Object value, final ColumnEncoding encoding) {
    return switch (encoding) {
      case TEXT_LINE -> {
        try {
          yield TextLineCodec.encode(cast(value, String.class, encoding));
        } catch (final IllegalArgumentException e) {
          throw new SerializationException("Cannot store a multi-line string in a line encoded column", e);
        }
      }
      case EPOCH_SECONDS_TEXT -> {
        final Instant instant = cast(value, Instant.class, encoding);
        yield instant != null ? EpochSecondsCodec.encodeText(instant) : NULL_TOKEN;
      }
      default -> throw new SerializationException("Encoding " + encoding + " is not line encoded");
    };
  }

  public Object decode(final byte[] record, final ColumnEncoding encoding) {
    return decode(record, 0, encoding);
  }

  /**
   * Decodes the fixed width record starting at {@code offset}. Sentinels return null.
   */
  public Object decode(final byte[] buffer, final int offset, final ColumnEncoding encoding) {
    return switch (encoding) {
      case INT32 -> Int32Codec.decode(buffer, offset);
      case FLOAT32 -> Float32Codec.decode(buffer, offset);
      case EPOCH_SECONDS_64 -> EpochSecondsCodec.decode(buffer, offset);
      case STATION_CODE_8 -> decodeStation(buffer[offset]);
      default -> throw new SerializationException("Encoding " + encoding + " is not fixed width");
    };
  }

  /**
   * Decodes one line of a line encoded column. The null token returns null.
   */
  public Object decodeLine(final String line, final ColumnEncoding encoding) {
    final String text = TextLineCodec.decode(line);
    if (text == null)
      return null;

    return switch (encoding) {
      case TEXT_LINE -> text;
      case EPOCH_SECONDS_TEXT -> {
        try {
          yield EpochSecondsCodec.decodeText(text);
        } catch (final NumberFormatException e) {
          throw new SerializationException("Corrupted time value '" + text + "'", e);
        }
      }
      default -> throw new SerializationException("Encoding " + encoding + " is not line encoded");
    };
  }

  public byte encodeStation(final String stationName) {
    if (stationName == null)
      return StationDictionary.NULL_CODE;
    final Byte code = stations.getCode(stationName);
    if (code == null)
      throw new SerializationException("Unknown station '" + stationName + "'");
    return code;
  }

  public String decodeStation(final byte code) {
    if (code == StationDictionary.NULL_CODE)
      return null;
    final String name = stations.getName(code);
    if (name == null)
      throw new SerializationException("Unknown station code " + code);
    return name;
  }

  private Instant parseTime(final String text) {
    if (EpochSecondsCodec.isEpochSeconds(text))
      return Instant.ofEpochSecond(Long.parseLong(text));
    return LocalDateTime.parse(text, dateTimeFormatter).toInstant(zoneOffset);
  }

  private static <T> T cast(final Object value, final Class<T> expected, final ColumnEncoding encoding) {
    if (value == null || expected.isInstance(value))
      return expected.cast(value);
    throw new SerializationException(
        "Value '" + value + "' of class " + value.getClass().getSimpleName() + " cannot be stored with encoding " + encoding);
  }
}
