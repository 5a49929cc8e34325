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
package net.influxgraph.reader;

import java.util.Arrays;
import java.util.List;

import net.influxgraph.aggregation.Aggregator;
import net.influxgraph.aggregation.Aggregators;
import net.influxgraph.data.DataPoint;
import net.influxgraph.data.SeriesData;
import net.influxgraph.data.TimeRange;

/**
 * Aligns raw points onto a {@link TimeRange}. Points in the same slot are
 * reduced with the series' aggregator, slots without points stay null.
 */
public final class Resampler {

  private Resampler() {
    // static helpers only
  }

  /**
   * Resamples the points.
   * @param range A non-null range.
   * @param points Points in time order, may be null or empty. Points
   * outside of the range and null or non-finite values are skipped.
   * @param aggregator A non-null aggregator.
   * @return The aligned data, always {@link TimeRange#steps()} long.
   */
  public static SeriesData resample(final TimeRange range,
                                    final List<DataPoint> points,
                                    final Aggregator aggregator) {
    if (range == null || aggregator == null) {
      throw new IllegalArgumentException("Range and aggregator cannot be "
          + "null.");
    }
    final int steps = range.steps();
    final Double[] values = new Double[steps];
    if (points == null || points.isEmpty()) {
      return new SeriesData(values);
    }

    final double[][] slots = new double[steps][];
    final int[] counts = new int[steps];
    for (final DataPoint point : points) {
      final Double value = point.value();
      if (value == null || value.isNaN() || value.isInfinite()) {
        continue;
      }
      final int idx = range.index(point.timestamp());
      if (idx < 0) {
        continue;
      }
      double[] slot = slots[idx];
      if (slot == null) {
        slot = new double[2];
        slots[idx] = slot;
      } else if (counts[idx] == slot.length) {
        slot = Arrays.copyOf(slot, slot.length * 2);
        slots[idx] = slot;
      }
      slot[counts[idx]++] = value;
    }

    for (int i = 0; i < steps; i++) {
      if (counts[i] == 0) {
        continue;
      }
      final double result = aggregator.runDouble(
          Aggregators.doubles(slots[i], counts[i]));
      if (!Double.isNaN(result)) {
        values[i] = result;
      }
    }
    return new SeriesData(values);
  }
}
