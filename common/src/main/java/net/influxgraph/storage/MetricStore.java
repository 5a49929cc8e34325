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
package net.influxgraph.storage;

import java.util.List;
import java.util.Map;
import java.util.Set;

import net.influxgraph.data.DataPoint;

/**
 * The read side of the flat, tag based time series store the finder sits
 * on. The store knows nothing about the dotted hierarchy; it answers regular
 * expression queries over series identifiers.
 * <p>
 * Implementations must be safe for concurrent use by multiple in flight
 * queries and must release any connection on every exit path. Failures are
 * reported as {@link net.influxgraph.exceptions.QueryExecutionException}s.
 */
public interface MetricStore {

  /**
   * Returns the distinct series identifiers the store knows about.
   *
   * @param regex An optional Java compatible regular expression the
   * identifiers must contain a match for. Null or empty returns every series.
   * @return A non-null, possibly empty set.
   * @throws net.influxgraph.exceptions.QueryExecutionException if the store
   * could not be queried.
   */
  public Set<String> seriesNames(final String regex);

  /**
   * Returns the raw points of every series whose identifier contains a
   * match for the regex, with timestamps in {@code [start, end]}.
   *
   * @param regex A non-null and non-empty regular expression.
   * @param start The inclusive start epoch in seconds.
   * @param end The inclusive end epoch in seconds.
   * @return A non-null map of series identifier to points in time order.
   * Series without points in range may be absent.
   * @throws IllegalArgumentException if the regex was null or empty or
   * end was before start.
   * @throws net.influxgraph.exceptions.QueryExecutionException if the store
   * could not be queried.
   */
  public Map<String, List<DataPoint>> readPoints(final String regex,
                                                 final long start,
                                                 final long end);
}
