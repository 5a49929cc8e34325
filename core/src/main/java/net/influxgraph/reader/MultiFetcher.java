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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Maps;

import net.influxgraph.data.DataPoint;
import net.influxgraph.data.MultiFetchResult;
import net.influxgraph.data.SeriesData;
import net.influxgraph.data.TimeRange;
import net.influxgraph.exceptions.FetchException;
import net.influxgraph.query.PatternCompiler;
import net.influxgraph.storage.MetricStore;
import net.influxgraph.utils.DateTime;

/**
 * Fetches many series with a single store query. The response is split
 * per series and each one is aligned with its own reader's aggregator on
 * one shared {@link TimeRange}.
 * <p>
 * A store failure fails the whole batch, there are no partial results.
 */
public class MultiFetcher {
  private static final Logger LOG = LoggerFactory.getLogger(
      MultiFetcher.class);

  private final MetricStore store;
  private final StepPolicy step_policy;

  /**
   * Default ctor.
   * @param store A non-null store.
   * @param step_policy A non-null step policy.
   * @throws IllegalArgumentException if an argument was null.
   */
  public MultiFetcher(final MetricStore store, final StepPolicy step_policy) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (step_policy == null) {
      throw new IllegalArgumentException("Step policy cannot be null.");
    }
    this.store = store;
    this.step_policy = step_policy;
  }

  /**
   * Fetches every reader's series for the window.
   * @param readers A non-null collection of readers. When two readers share
   * a path the first one's aggregator is used.
   * @param start The inclusive start epoch in seconds.
   * @param end The inclusive end epoch in seconds.
   * @return The shared grid and one entry per distinct reader path, sorted
   * by path. Series without data are all nulls.
   * @throws IllegalArgumentException if the readers were null, end was
   * before start or the window held too many steps to align on.
   * @throws FetchException if the store failed.
   */
  public MultiFetchResult fetch(final Collection<Reader> readers,
                                final long start,
                                final long end) {
    if (readers == null) {
      throw new IllegalArgumentException("Readers cannot be null.");
    }
    if (end < start) {
      throw new IllegalArgumentException("End " + end
          + " cannot be before the start " + start);
    }
    final TimeRange range = step_policy.timeRange(start, end);
    final Map<String, Reader> by_path = Maps.newTreeMap();
    for (final Reader reader : readers) {
      if (reader == null) {
        throw new IllegalArgumentException("Readers cannot contain nulls.");
      }
      by_path.putIfAbsent(reader.path(), reader);
    }
    if (by_path.isEmpty()) {
      return new MultiFetchResult(range, Maps.<String, SeriesData>newHashMap());
    }

    final String regex = regex(by_path.keySet());
    final long begin = DateTime.nanoTime();
    final Map<String, List<DataPoint>> points;
    try {
      points = store.readPoints(regex, start, end);
    } catch (RuntimeException e) {
      LOG.error("Failed to fetch " + by_path.size() + " series for " + range,
          e);
      throw FetchException.wrap("Failed to fetch " + by_path.size()
          + " series", e);
    }

    final Map<String, SeriesData> series = Maps.newTreeMap();
    int fetched = 0;
    for (final Entry<String, Reader> entry : by_path.entrySet()) {
      final List<DataPoint> raw = points == null ? null :
        points.get(entry.getKey());
      if (raw != null) {
        fetched += raw.size();
      }
      series.put(entry.getKey(), Resampler.resample(range, raw,
          entry.getValue().aggregator()));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Fetched " + fetched + " points for " + series.size()
          + " series over " + range + " in "
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), begin) + "ms");
    }
    return new MultiFetchResult(range, series);
  }

  /**
   * @param paths Sorted, distinct paths.
   * @return An anchored alternation matching exactly the paths.
   */
  static String regex(final Collection<String> paths) {
    final StringBuilder buf = new StringBuilder("^(?:");
    boolean first = true;
    for (final String path : paths) {
      if (!first) {
        buf.append('|');
      }
      buf.append(PatternCompiler.escape(path));
      first = false;
    }
    return buf.append(")$").toString();
  }
}
