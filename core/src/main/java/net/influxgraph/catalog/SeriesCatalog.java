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
package net.influxgraph.catalog;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.influxgraph.exceptions.CatalogException;
import net.influxgraph.query.PatternCompiler;
import net.influxgraph.query.Query;
import net.influxgraph.reader.ReaderFactory;
import net.influxgraph.storage.MetricStore;
import net.influxgraph.tree.BranchNode;
import net.influxgraph.tree.LeafNode;
import net.influxgraph.tree.Node;
import net.influxgraph.utils.DateTime;

/**
 * Rebuilds the dotted hierarchy from the store's flat series names on
 * every query. The store is asked for the names starting with the literal
 * prefix of the glob, then every segment prefix of every name is tested
 * against the compiled glob. A matching prefix with deeper segments is a
 * branch, a matching full name is a leaf. When a path is both a series and
 * the parent of other series it is returned as a branch.
 * <p>
 * Nothing is cached between queries.
 */
public class SeriesCatalog {
  private static final Logger LOG = LoggerFactory.getLogger(
      SeriesCatalog.class);

  private final MetricStore store;
  private final ReaderFactory readers;

  /**
   * Default ctor.
   * @param store A non-null store.
   * @param readers A non-null factory for leaf readers.
   * @throws IllegalArgumentException if an argument was null.
   */
  public SeriesCatalog(final MetricStore store, final ReaderFactory readers) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (readers == null) {
      throw new IllegalArgumentException("Reader factory cannot be null.");
    }
    this.store = store;
    this.readers = readers;
  }

  /**
   * Returns the distinct names of the branches the query matches.
   * @param query A non-null query.
   * @return A sorted, possibly empty list of branch names.
   * @throws IllegalArgumentException if the query was null.
   * @throws net.influxgraph.exceptions.PatternException if the glob was
   * malformed.
   * @throws CatalogException if the store failed.
   */
  public List<String> getBranches(final Query query) {
    final Set<String> names = new TreeSet<String>();
    for (final Map.Entry<String, Boolean> entry : scan(query).entrySet()) {
      if (entry.getValue()) {
        final String path = entry.getKey();
        names.add(path.substring(path.lastIndexOf('.') + 1));
      }
    }
    return ImmutableList.copyOf(names);
  }

  /**
   * Returns the nodes the query matches, sorted by path.
   * @param query A non-null query.
   * @return A possibly empty list of branches and leaves.
   * @throws IllegalArgumentException if the query was null.
   * @throws net.influxgraph.exceptions.PatternException if the glob was
   * malformed.
   * @throws CatalogException if the store failed.
   */
  public List<Node> findNodes(final Query query) {
    final Map<String, Boolean> matches = scan(query);
    final List<Node> nodes = Lists.newArrayListWithCapacity(matches.size());
    for (final Map.Entry<String, Boolean> entry : matches.entrySet()) {
      if (entry.getValue()) {
        nodes.add(new BranchNode(entry.getKey()));
      } else {
        nodes.add(new LeafNode(entry.getKey(),
            readers.newReader(entry.getKey())));
      }
    }
    return nodes;
  }

  /**
   * Matches every segment prefix of the candidate names.
   * @param query A non-null query.
   * @return Matching paths sorted, mapped to true for branches.
   */
  Map<String, Boolean> scan(final Query query) {
    if (query == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    final Pattern matcher = PatternCompiler.compile(
        PatternCompiler.FULL_MATCH, query);
    final String prefix = PatternCompiler.literalPrefix(query.pattern());
    final String regex = prefix.isEmpty() ? null :
      "^" + PatternCompiler.escape(prefix);

    final long start = DateTime.nanoTime();
    final Set<String> names;
    try {
      names = store.seriesNames(regex);
    } catch (RuntimeException e) {
      LOG.error("Failed to list series for " + query, e);
      throw CatalogException.wrap("Failed to list series for "
          + query.pattern(), e);
    }

    final Map<String, Boolean> matches = new TreeMap<String, Boolean>();
    if (names != null) {
      for (final String name : names) {
        int idx = name.indexOf('.');
        while (idx >= 0) {
          final String path = name.substring(0, idx);
          if (matcher.matcher(path).matches()) {
            matches.put(path, true);
          }
          idx = name.indexOf('.', idx + 1);
        }
        if (!matches.containsKey(name) && matcher.matcher(name).matches()) {
          matches.put(name, false);
        }
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Matched " + matches.size() + " paths for " + query
          + " from " + (names == null ? 0 : names.size()) + " series in "
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
    }
    return matches;
  }
}
