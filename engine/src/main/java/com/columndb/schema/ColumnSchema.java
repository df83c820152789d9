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
import com.columndb.exception.ErrorCode;
import com.columndb.exception.SchemaException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered and immutable set of column definitions, fixed when a store is created.
 */
public final class ColumnSchema {
  private final Map<String, ColumnDefinition> columns;

  private ColumnSchema(final Map<String, ColumnDefinition> columns) {
    this.columns = Collections.unmodifiableMap(columns);
  }

  public static ColumnSchema of(final ColumnDefinition... definitions) {
    final Builder builder = builder();
    for (final ColumnDefinition d : definitions)
      builder.add(d);
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public ColumnDefinition getColumn(final String name) {
    final ColumnDefinition column = name != null ? columns.get(name) : null;
    if (column == null)
      throw new SchemaException(ErrorCode.INVALID_COLUMN, "Column '" + name + "' is not defined in schema " + columns.keySet());
    return column;
  }

  public boolean existsColumn(final String name) {
    return name != null && columns.containsKey(name);
  }

  public Collection<ColumnDefinition> getColumns() {
    return columns.values();
  }

  public Set<String> getColumnNames() {
    return columns.keySet();
  }

  public int size() {
    return columns.size();
  }

  /**
   * Returns a copy of this schema where the column {@code name} uses {@code encoding}.
   */
  public ColumnSchema withEncoding(final String name, final ColumnEncoding encoding) {
    final Map<String, ColumnDefinition> copy = new LinkedHashMap<>(columns);
    copy.put(name, getColumn(name).withEncoding(encoding));
    return new ColumnSchema(copy);
  }

  @Override
  public boolean equals(final Object o) {
    return this == o || (o instanceof ColumnSchema && new ArrayList<>(columns.values()).equals(
        new ArrayList<>(((ColumnSchema) o).columns.values())));
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return columns.values().toString();
  }

  public static final class Builder {
    private final Map<String, ColumnDefinition> columns = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder add(final String name, final ColumnType type) {
      return add(new ColumnDefinition(name, type));
    }

    public Builder add(final ColumnDefinition definition) {
      if (columns.putIfAbsent(definition.getName(), definition) != null)
        throw new SchemaException("Column '" + definition.getName() + "' is defined twice");
      return this;
    }

    public ColumnSchema build() {
      if (columns.isEmpty())
        throw new SchemaException("A schema needs at least one column");
      return new ColumnSchema(new LinkedHashMap<>(columns));
    }
  }
}
