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

/**
 * Logical data types a column can hold.
 */
public enum ColumnType {
  STRING, INTEGER, FLOAT, TIME;

  /**
   * Returns the physical encoding used by the generic disk store for this type.
   */
  public ColumnEncoding getDefaultEncoding() {
    // RESOLVED ON CALL: ColumnEncoding REFERS TO THIS ENUM IN ITS CONSTANTS
    return switch (this) {
      case STRING -> ColumnEncoding.TEXT_LINE;
      case INTEGER -> ColumnEncoding.INT32;
      case FLOAT -> ColumnEncoding.FLOAT32;
      case TIME -> ColumnEncoding.EPOCH_SECONDS_TEXT;
    };
  }

  /**
   * Tells if the type takes part in extremum scans. Integers are compared after widening to float.
   */
  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }
}
