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
package com.columndb.query;

import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Inclusive epoch-second bounds of a calendar year or month at a fixed offset.
 */
final class YearMonthRange {
  final long from;
  final long to;

  private YearMonthRange(final long from, final long to) {
    this.from = from;
    this.to = to;
  }

  static YearMonthRange ofYear(final int year, final ZoneOffset offset) {
    final LocalDate first = LocalDate.of(year, 1, 1);
    return new YearMonthRange(first.atStartOfDay().toEpochSecond(offset), first.plusYears(1).atStartOfDay().toEpochSecond(offset) - 1);
  }

  static YearMonthRange ofMonth(final int year, final int month, final ZoneOffset offset) {
    final LocalDate first = LocalDate.of(year, month, 1);
    return new YearMonthRange(first.atStartOfDay().toEpochSecond(offset), first.plusMonths(1).atStartOfDay().toEpochSecond(offset) - 1);
  }

  boolean contains(final long epochSecond) {
    return epochSecond >= from && epochSecond <= to;
  }
}
