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
package com.columndb.store;

import com.columndb.schema.ColumnSchema;
import com.columndb.schema.ColumnType;

/**
 * Column names of the weather data set and its schema.
 */
public final class WeatherColumns {
  public static final String ID          = "id";
  public static final String TIMESTAMP   = "Timestamp";
  public static final String STATION     = "Station";
  public static final String TEMPERATURE = "Temperature";
  public static final String HUMIDITY    = "Humidity";

  public static final ColumnSchema SCHEMA = ColumnSchema.builder()//
      .add(ID, ColumnType.INTEGER)//
      .add(TIMESTAMP, ColumnType.TIME)//
      .add(STATION, ColumnType.STRING)//
      .add(TEMPERATURE, ColumnType.FLOAT)//
      .add(HUMIDITY, ColumnType.FLOAT)//
      .build();

  private WeatherColumns() {
  }
}
