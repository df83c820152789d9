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
import com.columndb.exception.SchemaException;

import java.util.Objects;

/**
 * Defines a column of a store: its name, its logical type and the encoding of its file.
 */
public final class ColumnDefinition {
  private final String         name;
  private final ColumnType     type;
  private final ColumnEncoding encoding;

  public ColumnDefinition(final String name, final ColumnType type) {
    this(name, type, type.getDefaultEncoding());
  }

  public ColumnDefinition(final String name, final ColumnType type, final ColumnEncoding encoding) {
    if (name == null || name.isEmpty())
      throw new SchemaException("Column name cannot be empty");
    if (type == null)
      throw new SchemaException("Column '" + name + "' has no type");
    if (encoding == null || encoding.getType() != type)
      throw new SchemaException("Encoding " + encoding + " cannot store values of type " + type + " for column '" + name + "'");

    this.name = name;
    this.type = type;
    this.encoding = encoding;
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public ColumnEncoding getEncoding() {
    return encoding;
  }

  /**
   * Returns the fixed byte size of one record of this column. Line encoded columns return -1.
   */
  public int getFixedSize() {
    return encoding.getWidth();
  }

  public boolean isFixedWidth() {
    return encoding.isFixedWidth();
  }

  public ColumnDefinition withEncoding(final ColumnEncoding newEncoding) {
    return new ColumnDefinition(name, type, newEncoding);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof ColumnDefinition))
      return false;
    final ColumnDefinition that = (ColumnDefinition) o;
    return name.equals(that.name) && type == that.type && encoding == that.encoding;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, encoding);
  }

  @Override
  public String toString() {
    return name + " " + type + " (" + encoding + ")";
  }
}
