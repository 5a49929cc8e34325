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

import java.util.Map;
import java.util.Map.Entry;

import com.google.common.collect.ImmutableSortedMap;

/**
 * The result of a batched fetch: one shared {@link TimeRange} and the
 * aligned data keyed by path, sorted by path.
 */
public class MultiFetchResult {

  private final TimeRange range;
  private final Map<String, SeriesData> series;

  /**
   * Default ctor.
   * @param range A non-null range.
   * @param series A non-null map of path to data, copied.
   * @throws IllegalArgumentException if a series length did not match the
   * range.
   */
  public MultiFetchResult(final TimeRange range,
                          final Map<String, SeriesData> series) {
    if (range == null || series == null) {
      throw new IllegalArgumentException("Range and series cannot be null.");
    }
    for (final Entry<String, SeriesData> entry : series.entrySet()) {
      if (entry.getValue().size() != range.steps()) {
        throw new IllegalArgumentException("Data length for "
            + entry.getKey() + " does not match the " + range.steps()
            + " steps of " + range);
      }
    }
    this.range = range;
    this.series = ImmutableSortedMap.copyOf(series);
  }

  /** @return The shared time range. */
  public TimeRange timeRange() {
    return range;
  }

  /** @return The immutable map of path to data. */
  public Map<String, SeriesData> series() {
    return series;
  }

  /**
   * @param path A path.
   * @return The data or null if the path was not part of the fetch.
   */
  public SeriesData get(final String path) {
    return series.get(path);
  }

  @Override
  public String toString() {
    return "MultiFetchResult{range=" + range + ", series=" + series + "}";
  }
}
