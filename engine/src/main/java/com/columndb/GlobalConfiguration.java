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
package com.columndb;

import com.columndb.exception.ConfigurationException;
import com.columndb.log.LogManager;
import com.columndb.utility.Callable;
import com.columndb.utility.FileUtils;
import org.json.JSONObject;

import java.io.PrintStream;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and environment
 * variables.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("columndb.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false, new Callable<Object, Object>() {
    @Override
    public Object call(final Object value) {
      if (Boolean.TRUE.equals(value))
        dumpConfiguration(System.out);
      return value;
    }
  }),

  // STORAGE
  STORE_DIRECTORY("columndb.storeDirectory", "Base directory where every store creates its own sub directory of column files", String.class,
      "./stores"),

  STORE_TYPE("columndb.storeType", "Default store implementation between 'memory', 'disk' and 'enhanced_disk'", String.class, "enhanced_disk"),

  READ_BUFFER_SIZE("columndb.readBufferSize",
      "Size in bytes of the buffer used by sequential scans of fixed width columns. It is rounded down to a multiple of 8 bytes", Integer.class,
      10240, new Callable<Object, Object>() {
    @Override
    public Object call(final Object value) {
      final int size = ((Number) value).intValue();
      return Math.max(8, size - (size % 8));
    }
  }),

  // FORMAT
  DATE_TIME_FORMAT("columndb.dateTimeFormat", "Pattern used to parse local date-time values of time columns", String.class, "yyyy-MM-dd HH:mm"),

  TIME_ZONE_OFFSET("columndb.timeZoneOffset", "Fixed offset applied to local date-times and to year/month boundaries", String.class, "+08:00",
      new Callable<Object, Object>() {
        @Override
        public Object call(final Object value) {
          try {
            ZoneOffset.of(value.toString());
          } catch (final Exception e) {
            throw new ConfigurationException("Invalid time zone offset '" + value + "'", e);
          }
          return value;
        }
      }),

  CSV_DELIMITER("columndb.csv.delimiter", "Field delimiter used when loading CSV files", String.class, ","),

  // QUERY
  SHARED_SCAN_THREADS("columndb.sharedScanThreads", "Number of worker threads used by the shared scan. Values are kept between 1 and 12",
      Integer.class, 12, new Callable<Object, Object>() {
    @Override
    public Object call(final Object value) {
      return Math.min(12, Math.max(1, ((Number) value).intValue()));
    }
  }),
  ;

  /**
   * Place holder for the "undefined" value of setting.
   */
  private final Object nullValue = new Object();

  private final       String                   key;
  private final       Object                   defValue;
  private final       Class<?>                 type;
  private final       Callable<Object, Object> callback;
  private volatile    Object                   value  = nullValue;
  private final       String                   description;
  public final static String                   PREFIX = "columndb.";

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue) {
    this(iKey, iDescription, iType, iDefValue, null);
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue,
      final Callable<Object, Object> callback) {
    this.key = iKey;
    this.description = iDescription;
    this.defValue = iDefValue;
    this.type = iType;
    this.callback = callback;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = nullValue;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.println("COLUMNDB configuration:");

    for (GlobalConfiguration v : values()) {
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject json = new JSONObject(input);
    final JSONObject cfg = json.getJSONObject("configuration");
    for (String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = findByKey(GlobalConfiguration.PREFIX + k);
      if (cfgEntry != null)
        cfgEntry.setValue(cfg.get(k));
    }
  }

  public static String toJSON() {
    final JSONObject json = new JSONObject();

    final JSONObject cfg = new JSONObject();
    json.put("configuration", cfg);

    for (GlobalConfiguration k : values())
      cfg.put(k.key.substring(PREFIX.length()), (Object) k.getValue());

    return json.toString();
  }

  /**
   * Find the GlobalConfiguration instance by the key. Key is case insensitive.
   *
   * @param iKey Key to find. It's case insensitive.
   *
   * @return GlobalConfiguration instance if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String iKey) {
    for (GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(iKey))
        return v;
    }
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the string
   * representation of configuration values
   */
  public static void setConfiguration(final Map<String, Object> iConfig) {
    for (Map.Entry<String, Object> config : iConfig.entrySet()) {
      for (GlobalConfiguration v : values()) {
        if (v.getKey().equals(config.getKey()) || v.name().equals(config.getKey())) {
          v.setValue(config.getValue());
          break;
        }
      }
    }
  }

  /**
   * Assign configuration values by reading system properties.
   */
  private static void readConfiguration() {
    String prop;

    for (GlobalConfiguration config : values()) {
      prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null) {
        try {
          config.setValue(prop);
        } catch (final RuntimeException e) {
          LogManager.instance().log(config, Level.SEVERE, "Invalid value for setting %s=%s, using default %s", e, config.key, prop, config.defValue);
        }
      }
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != nullValue && value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != nullValue;
  }

  /**
   * Sets a new value, converted to the declared type of the setting.
   *
   * @throws ConfigurationException if the value cannot be converted or is rejected by the setting
   */
  public void setValue(final Object iValue) {
    if (iValue == null)
      return;

    final Object converted;
    try {
      if (type == Boolean.class)
        converted = Boolean.parseBoolean(iValue.toString());
      else if (type == Integer.class)
        converted = iValue instanceof Number number ? number.intValue() : (int) FileUtils.getSizeAsNumber(iValue.toString());
      else if (type == Long.class)
        converted = iValue instanceof Number number ? number.longValue() : FileUtils.getSizeAsNumber(iValue.toString());
      else if (type == String.class)
        converted = iValue.toString();
      else
        converted = iValue;
    } catch (final IllegalArgumentException e) {
      throw new ConfigurationException("Invalid value '" + iValue + "' for setting " + key, e);
    }

    value = callback != null ? callback.call(converted) : converted;
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger() {
    final Object v = getValue();
    return (int) (v instanceof Number ? ((Number) v).intValue() : FileUtils.getSizeAsNumber(v.toString()));
  }

  public long getValueAsLong() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).longValue() : FileUtils.getSizeAsNumber(v.toString());
  }

  public String getKey() {
    return key;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }

  public Object getDefValue() {
    return defValue;
  }
}
