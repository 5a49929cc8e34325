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
package net.influxgraph.finder;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.influxgraph.aggregation.AggregationResolver;
import net.influxgraph.catalog.SeriesCatalog;
import net.influxgraph.configuration.Configuration;
import net.influxgraph.data.FetchResult;
import net.influxgraph.data.MultiFetchResult;
import net.influxgraph.query.PatternCompiler;
import net.influxgraph.query.Query;
import net.influxgraph.reader.MultiFetcher;
import net.influxgraph.reader.Reader;
import net.influxgraph.reader.ReaderFactory;
import net.influxgraph.reader.StepPolicy;
import net.influxgraph.storage.MetricStore;
import net.influxgraph.tree.LeafNode;
import net.influxgraph.tree.Node;

/**
 * The entry point for a hierarchical metrics browser: glob compilation,
 * branch and node discovery, single and batched fetches over a flat
 * {@link MetricStore}.
 * <p>
 * Built once with the process configuration. Calls hold no shared mutable
 * state and may run concurrently.
 */
public class InfluxFinder {
  private static final Logger LOG = LoggerFactory.getLogger(
      InfluxFinder.class);

  public static final String LOG_LEVEL_KEY = "influxgraph.log.level";

  private final MetricStore store;
  private final AggregationResolver resolver;
  private final StepPolicy step_policy;
  private final ReaderFactory readers;
  private final SeriesCatalog catalog;
  private final MultiFetcher fetcher;

  /**
   * Default ctor. Registers and reads the finder's configuration.
   * @param config A non-null configuration.
   * @param store A non-null, initialized store.
   * @throws IllegalArgumentException if an argument was null.
   * @throws net.influxgraph.configuration.ConfigurationException if the
   * configuration was invalid.
   */
  public InfluxFinder(final Configuration config, final MetricStore store) {
    if (config == null) {
      throw new IllegalArgumentException("Configuration cannot be null.");
    }
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    registerConfigs(config);
    LogLevels.apply(config.getString(LOG_LEVEL_KEY));

    this.store = store;
    resolver = AggregationResolver.fromConfig(config);
    step_policy = StepPolicy.fromConfig(config);
    readers = new ReaderFactory(store, resolver, step_policy);
    catalog = new SeriesCatalog(store, readers);
    fetcher = new MultiFetcher(store, step_policy);
    LOG.info("Initialized finder over " + store.getClass().getSimpleName()
        + " with default step " + step_policy.defaultStep() + "s");
  }

  /**
   * Registers the finder's keys if they are not already present.
   * @param config A non-null config.
   */
  public static void registerConfigs(final Configuration config) {
    if (!config.hasProperty(LOG_LEVEL_KEY)) {
      config.register(LOG_LEVEL_KEY, "INFO", "The level of the "
          + LogLevels.BASE_LOGGER + " logger, one of TRACE, DEBUG, INFO, "
          + "WARN or ERROR.");
    }
    StepPolicy.registerConfigs(config);
    AggregationResolver.registerConfigs(config);
  }

  /**
   * Compiles the query's glob with the template.
   * @param template A template with one "{0}", e.g. "^{0}$".
   * @param query A non-null query.
   * @return The compiled pattern.
   * @throws net.influxgraph.exceptions.PatternException if the glob was
   * malformed.
   */
  public Pattern compileRegex(final String template, final Query query) {
    return PatternCompiler.compile(template, query);
  }

  /**
   * @param query A non-null query.
   * @return The sorted, distinct branch names matching the query.
   * @throws net.influxgraph.exceptions.CatalogException if the store failed.
   */
  public List<String> getBranches(final Query query) {
    return catalog.getBranches(query);
  }

  /**
   * @param query A non-null query.
   * @return The branches and leaves matching the query sorted by path.
   * @throws net.influxgraph.exceptions.CatalogException if the store failed.
   */
  public List<Node> findNodes(final Query query) {
    return catalog.findNodes(query);
  }

  /**
   * @param path A non-null and non-empty path. The series need not exist.
   * @return A reader bound to the path.
   */
  public Reader newReader(final String path) {
    return readers.newReader(path);
  }

  /**
   * Fetches a single path.
   * @param path A non-null and non-empty path.
   * @param start The inclusive start epoch in seconds.
   * @param end The inclusive end epoch in seconds.
   * @return The grid and the aligned data.
   * @throws IllegalArgumentException if end was before start or the window
   * held too many steps to align on.
   * @throws net.influxgraph.exceptions.FetchException if the store failed.
   */
  public FetchResult fetch(final String path,
                           final long start,
                           final long end) {
    return readers.newReader(path).fetch(start, end);
  }

  /**
   * Fetches every leaf with one store query.
   * @param nodes A non-null collection of leaf nodes.
   * @param start The inclusive start epoch in seconds.
   * @param end The inclusive end epoch in seconds.
   * @return The shared grid and one entry per leaf path.
   * @throws IllegalArgumentException if a node was null or a branch, end
   * was before start or the window held too many steps to align on.
   * @throws net.influxgraph.exceptions.FetchException if the store failed.
   */
  public MultiFetchResult fetchMulti(final Collection<? extends Node> nodes,
                                     final long start,
                                     final long end) {
    if (nodes == null) {
      throw new IllegalArgumentException("Nodes cannot be null.");
    }
    final List<Reader> bound = Lists.newArrayListWithCapacity(nodes.size());
    for (final Node node : nodes) {
      if (node == null || !node.isLeaf()) {
        throw new IllegalArgumentException("Only leaf nodes can be fetched: "
            + node);
      }
      bound.add(((LeafNode) node).reader());
    }
    return fetcher.fetch(bound, start, end);
  }

  /**
   * Fetches the readers' series with one store query.
   * @param readers A non-null collection of readers.
   * @param start The inclusive start epoch in seconds.
   * @param end The inclusive end epoch in seconds.
   * @return The shared grid and one entry per reader path.
   * @throws IllegalArgumentException if end was before start or the window
   * held too many steps to align on.
   * @throws net.influxgraph.exceptions.FetchException if the store failed.
   */
  public MultiFetchResult fetchReaders(final Collection<Reader> readers,
                                       final long start,
                                       final long end) {
    return fetcher.fetch(readers, start, end);
  }

  /** @return The aggregation resolver. */
  public AggregationResolver aggregationResolver() {
    return resolver;
  }

  /** @return The step policy. */
  public StepPolicy stepPolicy() {
    return step_policy;
  }

  /** @return The store. */
  public MetricStore store() {
    return store;
  }
}
