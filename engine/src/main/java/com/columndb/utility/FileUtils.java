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
package com.columndb.utility;

import com.columndb.log.LogManager;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Level;

public class FileUtils {
  public static final int  KILOBYTE = 1024;
  public static final int  MEGABYTE = 1048576;
  public static final int  GIGABYTE = 1073741824;
  public static final long TERABYTE = 1099511627776L;

  public static long getSizeAsNumber(final Object iSize) {
    if (iSize == null)
      throw new IllegalArgumentException("Size is null");

    if (iSize instanceof Number number)
      return number.longValue();

    String size = iSize.toString().trim();

    boolean number = true;
    for (int i = size.length() - 1; i >= 0; --i) {
      final char c = size.charAt(i);
      if (!Character.isDigit(c)) {
        if (i > 0 || (c != '-' && c != '+'))
          number = false;
        break;
      }
    }

    if (number)
      return string2number(size).longValue();

    size = size.toUpperCase(Locale.ENGLISH);
    int pos = size.indexOf("KB");
    if (pos > -1)
      return (long) (string2number(size.substring(0, pos)).floatValue() * KILOBYTE);

    pos = size.indexOf("MB");
    if (pos > -1)
      return (long) (string2number(size.substring(0, pos)).floatValue() * MEGABYTE);

    pos = size.indexOf("GB");
    if (pos > -1)
      return (long) (string2number(size.substring(0, pos)).floatValue() * GIGABYTE);

    pos = size.indexOf('B');
    if (pos > -1)
      return (long) string2number(size.substring(0, pos)).floatValue();

    throw new IllegalArgumentException("Size " + size + " has a unrecognizable format");
  }

  public static Number string2number(final String iText) {
    if (iText.indexOf('.') > -1)
      return Double.parseDouble(iText);
    else
      return Long.parseLong(iText);
  }

  public static String getSizeAsString(final long iSize) {
    final long[] dividers = { TERABYTE, GIGABYTE, MEGABYTE, KILOBYTE };
    final String[] units = { "TB", "GB", "MB", "KB" };
    for (int i = 0; i < dividers.length; i++) {
      if (iSize > dividers[i])
        return String.format(Locale.ENGLISH, "%2.2f%s", (float) iSize / dividers[i], units[i]);
    }
    return iSize + "b";
  }

  /**
   * Rejects names that would escape the store directory once used as a file name.
   */
  public static void checkValidName(final String iFileName) throws IOException {
    if (iFileName == null || iFileName.isEmpty() || iFileName.contains("..") || iFileName.contains("/") || iFileName.contains(File.separator))
      throw new IOException("Invalid file name '" + iFileName + "'");
  }

  public static void deleteRecursively(final File rootFile) {
    for (int attempt = 0; attempt < 3; attempt++) {
      try {
        if (rootFile.exists()) {
          if (rootFile.isDirectory()) {
            final File[] files = rootFile.listFiles();
            if (files != null) {
              for (final File f : files) {
                if (f.isFile())
                  Files.delete(Path.of(f.getAbsolutePath()));
                else
                  deleteRecursively(f);
              }
            }
          }

          Files.delete(Path.of(rootFile.getAbsolutePath()));
        }

        break;

      } catch (final IOException e) {
        LogManager.instance().log(rootFile, Level.WARNING, "Cannot delete directory '%s'", e, rootFile);
      }
    }
  }
}
