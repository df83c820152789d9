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

import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;

/**
 * Tracks the maximum and the minimum of a stream of values together with every index holding them. A value equal to the current
 * extreme is appended to its ties, a strictly better one replaces them.
 */
public final class ExtremeTracker {
  private       float        maxValue   = Float.NEGATIVE_INFINITY;
  private       float        minValue   = Float.POSITIVE_INFINITY;
  private final IntArrayList maxIndexes = new IntArrayList();
  private final IntArrayList minIndexes = new IntArrayList();

  public void accept(final int index, final float value) {
    if (value > maxValue) {
      maxValue = value;
      maxIndexes.clear();
      maxIndexes.add(index);
    } else if (value == maxValue)
      maxIndexes.add(index);

    if (value < minValue) {
      minValue = value;
      minIndexes.clear();
      minIndexes.add(index);
    } else if (value == minValue)
      minIndexes.add(index);
  }

  public boolean isEmpty() {
    return maxIndexes.isEmpty();
  }

  public float getMaxValue() {
    return maxValue;
  }

  public float getMinValue() {
    return minValue;
  }

  public IntArrayList getMaxIndexes() {
    return maxIndexes;
  }

  public IntArrayList getMinIndexes() {
    return minIndexes;
  }
}
