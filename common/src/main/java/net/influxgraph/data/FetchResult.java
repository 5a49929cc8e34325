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

/**
 * The result of fetching a single series.
 */
public class FetchResult {

  private final TimeRange range;
  private final SeriesData data;

  /**
   * Default ctor.
   * @param range A non-null range.
   * @param data Non-null data with one slot per step of the range.
   * @throws IllegalArgumentException if the data length did not match the
   * range.
   */
  public FetchResult(final TimeRange range, final SeriesData data) {
    if (range == null || data == null) {
      throw new IllegalArgumentException("Range and data cannot be null.");
    }
    if (data.size() != range.steps()) {
      throw new IllegalArgumentException("Data length " + data.size()
          + " does not match the " + range.steps() + " steps of " + range);
    }
    this.range = range;
    this.data = data;
  }

  /** @return The time range. */
  public TimeRange timeRange() {
    return range;
  }

  /** @return The aligned data. */
  public SeriesData data() {
    return data;
  }

  @Override
  public String toString() {
    return "FetchResult{range=" + range + ", data=" + data + "}";
  }
}
