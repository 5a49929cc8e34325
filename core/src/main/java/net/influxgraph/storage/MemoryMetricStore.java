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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.stumbleupon.async.Deferred;

import net.influxgraph.configuration.Configuration;
import net.influxgraph.core.BaseFinderPlugin;
import net.influxgraph.data.DataPoint;
import net.influxgraph.exceptions.QueryExecutionException;

/**
 * An in-process store keeping points on the heap. Behaves like the InfluxDB
 * store: a point with the same series, tags and timestamp as an earlier one
 * replaces it, and series regular expressions are searched, not anchored.
 * Used for unit tests and when embedding the finder without a database.
 */
public class MemoryMetricStore extends BaseFinderPlugin
    implements MetricStore, WritableMetricStore {
  private static final Logger LOG = LoggerFactory.getLogger(
      MemoryMetricStore.class);

  public static final String TYPE = "MemoryMetricStore";

  /** Series name to timestamp to points at that time. */
  private final ConcurrentMap<String, NavigableMap<Long, List<DataPoint>>>
      database;

  /** Default ctor. */
  public MemoryMetricStore() {
    database = Maps.newConcurrentMap();
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public Deferred<Object> initialize(final Configuration config,
                                     final String id) {
    final Deferred<Object> deferred = super.initialize(config,
        Strings.isNullOrEmpty(id) ? TYPE : id);
    LOG.info("Initialized in memory metric store " + this.id);
    return deferred;
  }

  @Override
  public Deferred<Object> shutdown() {
    database.clear();
    return super.shutdown();
  }

  @Override
  public String version() {
    return "1.0.0";
  }

  @Override
  public void write(final List<DataPoint> points) {
    if (points == null) {
      throw new IllegalArgumentException("Points cannot be null.");
    }
    int written = 0;
    for (final DataPoint point : points) {
      if (point.value() == null) {
        continue;
      }
      final NavigableMap<Long, List<DataPoint>> series =
          database.computeIfAbsent(point.series(),
              k -> new TreeMap<Long, List<DataPoint>>());
      synchronized (series) {
        final List<DataPoint> at = series.computeIfAbsent(point.timestamp(),
            k -> Lists.newArrayListWithCapacity(1));
        final Iterator<DataPoint> iterator = at.iterator();
        while (iterator.hasNext()) {
          if (iterator.next().tags().equals(point.tags())) {
            iterator.remove();
          }
        }
        at.add(point);
      }
      written++;
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Wrote " + written + " of " + points.size() + " points.");
    }
  }

  @Override
  public Set<String> seriesNames(final String regex) {
    final Pattern pattern = compile(regex, true);
    final Set<String> names = Sets.newHashSet();
    for (final String name : database.keySet()) {
      if (pattern == null || pattern.matcher(name).find()) {
        names.add(name);
      }
    }
    return names;
  }

  @Override
  public Map<String, List<DataPoint>> readPoints(final String regex,
                                                 final long start,
                                                 final long end) {
    if (end < start) {
      throw new IllegalArgumentException("End " + end
          + " cannot be before the start " + start);
    }
    final Pattern pattern = compile(regex, false);
    final Map<String, List<DataPoint>> results = Maps.newHashMap();
    for (final Entry<String, NavigableMap<Long, List<DataPoint>>> entry :
        database.entrySet()) {
      if (!pattern.matcher(entry.getKey()).find()) {
        continue;
      }
      final List<DataPoint> points = Lists.newArrayList();
      final NavigableMap<Long, List<DataPoint>> series = entry.getValue();
      synchronized (series) {
        for (final List<DataPoint> at :
            series.subMap(start, true, end, true).values()) {
          points.addAll(at);
        }
      }
      if (!points.isEmpty()) {
        results.put(entry.getKey(), Collections.unmodifiableList(points));
      }
    }
    return results;
  }

  /** @return The number of series stored. */
  public int seriesCount() {
    return database.size();
  }

  private static Pattern compile(final String regex,
                                 final boolean optional) {
    if (Strings.isNullOrEmpty(regex)) {
      if (optional) {
        return null;
      }
      throw new IllegalArgumentException("Regex cannot be null or empty.");
    }
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new QueryExecutionException("Invalid series expression: "
          + regex, 400, e);
    }
  }
}
