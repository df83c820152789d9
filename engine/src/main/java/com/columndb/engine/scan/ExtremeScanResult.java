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
package com.columndb.engine.scan;

import com.columndb.exception.ColumnDBException;

/**
 * Max and min ties of one extremum pass. {@link #max()} and {@link #min()} project one side as a {@link ScanResult} sharing the
 * error of the pass.
 */
public final class ExtremeScanResult {
  private final ScanResult       max;
  private final ScanResult       min;
  private final float            maxValue;
  private final float            minValue;
  private final ColumnDBException error;

  ExtremeScanResult(final ExtremeTracker tracker, final ColumnDBException error) {
    this.max = error == null ? ScanResult.complete(tracker.getMaxIndexes()) : ScanResult.partial(tracker.getMaxIndexes(), error);
    this.min = error == null ? ScanResult.complete(tracker.getMinIndexes()) : ScanResult.partial(tracker.getMinIndexes(), error);
    this.maxValue = tracker.getMaxValue();
    this.minValue = tracker.getMinValue();
    this.error = error;
  }

  static ExtremeScanResult failed(final ColumnDBException error) {
    return new ExtremeScanResult(new ExtremeTracker(), error);
  }

  public ScanResult max() {
    return max;
  }

  public ScanResult min() {
    return min;
  }

  /**
   * Returns the maximum value, {@link Float#NEGATIVE_INFINITY} if no value was seen.
   */
  public float getMaxValue() {
    return maxValue;
  }

  /**
   * Returns the minimum value, {@link Float#POSITIVE_INFINITY} if no value was seen.
   */
  public float getMinValue() {
    return minValue;
  }

  public ColumnDBException getError() {
    return error;
  }

  public boolean isComplete() {
    return error == null;
  }
}
