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

import com.columndb.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.io.File;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryColumnStoreTest extends AbstractColumnStoreTest {
  @Override
  protected ColumnStore createStore(final File baseDirectory) {
    return new InMemoryColumnStore(StoreType.MEMORY.getStoreName(), WeatherColumns.SCHEMA, codec);
  }

  @Test
  void testCandidatesInAnyOrder() {
    store.storeAll(rows(row("0", "2010-01-05 10:00", "Changi", "20", "80"), row("1", "2010-01-05 11:00", "Paya Lebar", "21", "81"),
        row("2", "2010-01-05 12:00", "Changi", "21", "82")));

    assertThat(store.filter(WeatherColumns.STATION, "Changi"::equals, new int[] { 2, 1, 0 }).getIndexes()).containsExactly(2, 0);
    assertThat(store.getMax(WeatherColumns.TEMPERATURE, new int[] { 2, 0, 1 }).getIndexes()).containsExactly(2, 1);
  }

  @Test
  void testNothingIsWrittenToDisk() {
    store.storeAll(rows(row("0", "2010-01-05 10:00", "Changi", "20", "80")));
    assertThat(new File(directory, StoreType.MEMORY.getStoreName())).doesNotExist();
    assertThat(store.getName()).isEqualTo("memory");
  }

  @Test
  void testValuePastTheEnd() {
    store.storeAll(rows(row("0", "2010-01-05 10:00", "Changi", "20", "80")));
    final var result = store.filter(WeatherColumns.STATION, value -> true, new int[] { 0, 3 });
    assertThat(result.getIndexes()).containsExactly(0);
    assertThat(result.getError().getErrorCode()).isEqualTo(ErrorCode.OUT_OF_BOUNDS);
  }
}
