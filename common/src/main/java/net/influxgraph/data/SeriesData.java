// This file is part of influxgraph.
// Copyright (C) 2026  The influxgraph Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.influxgraph.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The aligned values of one series: one slot per step of the
 * {@link TimeRange} with an explicit null where there was no data.
 */
public class SeriesData {

  /** The slots. */
  private final Double[] values;

  /**
   * Ctor taking ownership of the array.
   * @param values A non-null array, entries may be null.
   */
  public SeriesData(final Double[] values) {
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    this.values = values;
  }

  /**
   * @param range A non-null range.
   * @return A series of nulls with one slot per step.
   */
  public static SeriesData empty(final TimeRange range) {
    return new SeriesData(new Double[range.steps()]);
  }

  /** @return The number of slots. */
  public int size() {
    return values.length;
  }

  /**
   * @param index A slot index.
   * @return The value or null if there was no data.
   * @throws ArrayIndexOutOfBoundsException if the index was out of bounds.
   */
  public Double get(final int index) {
    return values[index];
  }

  /** @return The number of non-null slots. */
  public int nonNullCount() {
    int count = 0;
    for (final Double value : values) {
      if (value != null) {
        count++;
      }
    }
    return count;
  }

  /** @return An unmodifiable list view of the slots, entries may be null. */
  public List<Double> asList() {
    return Collections.unmodifiableList(Arrays.asList(values));
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SeriesData)) {
      return false;
    }
    return Arrays.equals(values, ((SeriesData) o).values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }
}
