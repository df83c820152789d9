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

import com.columndb.exception.ConfigurationException;

import java.util.Locale;

/**
 * Available store implementations. The name is also the name of the store directory.
 */
public enum StoreType {
  MEMORY("memory"), DISK("disk"), ENHANCED_DISK("enhanced_disk");

  private final String storeName;

  StoreType(final String storeName) {
    this.storeName = storeName;
  }

  public String getStoreName() {
    return storeName;
  }

  public static StoreType fromName(final String name) {
    if (name != null)
      for (final StoreType type : values())
        if (type.storeName.equals(name.trim().toLowerCase(Locale.ENGLISH)) || type.name().equalsIgnoreCase(name.trim()))
          return type;
    throw new ConfigurationException("Unknown store type '" + name + "'. Available types are 'memory', 'disk' and 'enhanced_disk'");
  }
}
