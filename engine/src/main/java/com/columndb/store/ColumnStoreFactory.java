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

import com.columndb.GlobalConfiguration;
import com.columndb.engine.codec.TypeCodec;
import com.columndb.schema.ColumnSchema;

import java.io.File;

/**
 * Creates stores under a common base directory.
 */
public class ColumnStoreFactory {
  private final File      baseDirectory;
  private final TypeCodec codec;

  public ColumnStoreFactory() {
    this(new File(GlobalConfiguration.STORE_DIRECTORY.getValueAsString()), TypeCodec.fromConfiguration());
  }

  public ColumnStoreFactory(final File baseDirectory, final TypeCodec codec) {
    this.baseDirectory = baseDirectory;
    this.codec = codec;
  }

  /**
   * Creates a store of the type set in {@link GlobalConfiguration#STORE_TYPE}.
   */
  public ColumnStore create(final ColumnSchema schema) {
    return create(StoreType.fromName(GlobalConfiguration.STORE_TYPE.getValueAsString()), schema);
  }

  public ColumnStore create(final StoreType type, final ColumnSchema schema) {
    return switch (type) {
      case MEMORY -> new InMemoryColumnStore(type.getStoreName(), schema, codec);
      case DISK -> new DiskColumnStore(type.getStoreName(), baseDirectory, schema, codec);
      case ENHANCED_DISK -> new EnhancedDiskColumnStore(type.getStoreName(), baseDirectory, schema, codec);
    };
  }

  /**
   * Returns the directory used by the stores of the type. In memory stores do not write there.
   */
  public File getStoreDirectory(final StoreType type) {
    return new File(baseDirectory, type.getStoreName());
  }

  public File getBaseDirectory() {
    return baseDirectory;
  }

  public TypeCodec getCodec() {
    return codec;
  }
}
