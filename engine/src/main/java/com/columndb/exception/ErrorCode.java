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
package com.columndb.exception;

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for ColumnDB exceptions.
 * Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - Store errors (lifecycle, configuration)</li>
 *   <li>3xxx - Query errors (shared scans)</li>
 *   <li>5xxx - Storage errors (I/O, short reads, encoding)</li>
 *   <li>7xxx - Schema errors (columns, operations, candidates)</li>
 *   <li>10xxx - Import errors</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see ColumnDBException
 */
public enum ErrorCode {

  // ========== Store Errors (1xxx) ==========
  /** Store configuration error */
  CONFIGURATION_ERROR(1001, "Configuration error"),

  /** Operation attempted on a closed store */
  STORE_IS_CLOSED(1002, "Store is closed"),

  // ========== Query Errors (3xxx) ==========
  /** One of the concurrent month tasks of a shared scan failed */
  SHARED_SCAN_ERROR(3001, "Shared scan error"),

  // ========== Storage Errors (5xxx) ==========
  /** File system I/O operation failed */
  IO_ERROR(5001, "I/O error"),

  /** Fewer bytes than the fixed record width were available at the expected offset */
  SHORT_READ(5002, "Short read"),

  /** A sequential skip reached the end of the column file before the requested record */
  OUT_OF_BOUNDS(5003, "Index out of bounds"),

  /** A textual value cannot be parsed or encoded as the column's declared type */
  MALFORMED_VALUE(5004, "Malformed value"),

  // ========== Schema Errors (7xxx) ==========
  /** Referenced column is not registered with the store */
  INVALID_COLUMN(7001, "Invalid column"),

  /** Operation not supported by the column type */
  INVALID_OPERATION(7002, "Invalid operation"),

  /** Candidate index list violates the access pattern of the column */
  INVALID_CANDIDATES(7003, "Invalid candidate indexes"),

  // ========== Import Errors (10xxx) ==========
  /** Ingestion payload does not match the registered schema */
  MALFORMED_INPUT(10001, "Malformed input"),

  // ========== General Errors (99xxx) ==========
  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  // Static map for efficient O(1) error code lookup
  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  /**
   * Returns the numeric error code.
   *
   * @return the error code (e.g., 5002, 7001, etc.)
   */
  public int getCode() {
    return code;
  }

  /**
   * Returns the default human-readable error message.
   *
   * @return the default error message
   */
  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   *
   * @return the error category name
   */
  public String getCategory() {
    final int category = code / 1000;
    return switch (category) {
      case 1 -> "Store";
      case 3 -> "Query";
      case 5 -> "Storage";
      case 7 -> "Schema";
      case 10 -> "Import";
      case 99 -> "Internal";
      default -> "Unknown";
    };
  }

  /**
   * Tells if the code reports a caller mistake detected before touching storage.
   */
  public boolean isValidationError() {
    return this == INVALID_COLUMN || this == INVALID_OPERATION || this == INVALID_CANDIDATES || this == MALFORMED_INPUT;
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @param code the numeric error code to look up
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}
