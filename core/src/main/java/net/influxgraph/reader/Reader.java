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

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

import net.influxgraph.aggregation.Aggregator;
import net.influxgraph.data.DataPoint;
import net.influxgraph.data.FetchResult;
import net.influxgraph.data.SeriesData;
import net.influxgraph.data.TimeRange;
import net.influxgraph.exceptions.FetchException;
import net.influxgraph.query.PatternCompiler;
import net.influxgraph.storage.MetricStore;
import net.influxgraph.utils.DateTime;

/**
 * Fetches exactly one series and aligns it on the step picked by the
 * {@link StepPolicy}. A series that was never written, or has no points in
 * the window, comes back as a full length run of nulls.
 */
public class Reader {
  private static final Logger LOG = LoggerFactory.getLogger(Reader.class);

  /** The store to read from. */
  private final MetricStore store;

  /** The series path. */
  private final String path;

  /** How points in one step are reduced. */
  private final Aggregator aggregator;

  /** The grid source. */
  private final StepPolicy step_policy;

  /**
   * Default ctor. Use {@link ReaderFactory#newReader(String)}.
   * @param store A non-null store.
   * @param path A non-null and non-empty series path.
   * @param aggregator A non-null aggregator.
   * @param step_policy A non-null step policy.
   * @throws IllegalArgumentException if an argument was null or empty.
   */
  public Reader(final MetricStore store,
                final String path,
                final Aggregator aggregator,
                final StepPolicy step_policy) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    if (aggregator == null) {
      throw new IllegalArgumentException("Aggregator cannot be null.");
    }
    if (step_policy == null) {
      throw new IllegalArgumentException("Step policy cannot be null.");
    }
    this.store = store;
    this.path = path;
    this.aggregator = aggregator;
    this.step_policy = step_policy;
  }

  /**
   * Fetches the series for the window.
   * @param start The inclusive start epoch in seconds.
   * @param end The inclusive end epoch in seconds.
   * @return The grid and one value or null per step.
   * @throws IllegalArgumentException if end was before start or the window
   * held too many steps to align on.
   * @throws FetchException if the store failed.
   */
  public FetchResult fetch(final long start, final long end) {
    if (end < start) {
      throw new IllegalArgumentException("End " + end
          + " cannot be before the start " + start);
    }
    final TimeRange range = step_policy.timeRange(start, end);
    final String regex = "^" + PatternCompiler.escape(path) + "$";
    final long begin = DateTime.nanoTime();
    final Map<String, List<DataPoint>> points;
    try {
      points = store.readPoints(regex, start, end);
    } catch (RuntimeException e) {
      LOG.error("Failed to fetch " + path + " for " + range, e);
      throw FetchException.wrap("Failed to fetch " + path, e);
    }
    final List<DataPoint> series = points == null ? null : points.get(path);
    final SeriesData data = Resampler.resample(range, series, aggregator);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Fetched " + (series == null ? 0 : series.size())
          + " points for " + path + " over " + range + " with "
          + aggregator.name() + " in "
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), begin) + "ms");
    }
    return new FetchResult(range, data);
  }

  /** @return The series path. */
  public String path() {
    return path;
  }

  /** @return The aggregator. */
  public Aggregator aggregator() {
    return aggregator;
  }

  @Override
  public String toString() {
    return "Reader{" + path + ", " + aggregator.name() + "}";
  }
}
