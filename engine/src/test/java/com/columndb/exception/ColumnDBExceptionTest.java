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

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnDBExceptionTest {
  @Test
  void testDefaultCodes() {
    assertThat(new StorageException("x").getErrorCode()).isEqualTo(ErrorCode.IO_ERROR);
    assertThat(new QueryException("x").getErrorCode()).isEqualTo(ErrorCode.SHARED_SCAN_ERROR);
    assertThat(new ImportException("x").getErrorCode()).isEqualTo(ErrorCode.MALFORMED_INPUT);
    assertThat(new ColumnDBException("x").getErrorCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
    assertThat(new ColumnDBException(null, "x").getErrorCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
  }

  @Test
  void testCategories() {
    assertThat(ErrorCode.SHORT_READ.getCategory()).isEqualTo("Storage");
    assertThat(ErrorCode.INVALID_CANDIDATES.getCategory()).isEqualTo("Schema");
    assertThat(ErrorCode.MALFORMED_INPUT.getCategory()).isEqualTo("Import");
    assertThat(ErrorCode.STORE_IS_CLOSED.getCategory()).isEqualTo("Store");

    assertThat(ErrorCode.INVALID_COLUMN.isValidationError()).isTrue();
    assertThat(ErrorCode.SHORT_READ.isValidationError()).isFalse();

    assertThat(ErrorCode.fromCode(5003)).isEqualTo(ErrorCode.OUT_OF_BOUNDS);
    assertThat(ErrorCode.fromCode(42)).isEqualTo(ErrorCode.INTERNAL_ERROR);
  }

  @Test
  void testContextAndJSON() {
    final ColumnDBException e = new StorageException(ErrorCode.SHORT_READ, "Short read", new IOException("eof")).addContext("file", "a.store")
        .addContext("index", 7).addContext("missing", null);

    assertThat(e.getContext()).containsEntry("file", "a.store").containsEntry("index", 7);

    final JSONObject json = new JSONObject(e.toJSON());
    assertThat(json.getInt("errorCode")).isEqualTo(5002);
    assertThat(json.getString("errorName")).isEqualTo("SHORT_READ");
    assertThat(json.getString("category")).isEqualTo("Storage");
    assertThat(json.getJSONObject("context").getInt("index")).isEqualTo(7);
    assertThat(json.getJSONObject("context").isNull("missing")).isTrue();
    assertThat(json.getString("cause")).isEqualTo("eof");

    assertThat(e).hasToString("StorageException [Storage-5002]: Short read");
  }
}
