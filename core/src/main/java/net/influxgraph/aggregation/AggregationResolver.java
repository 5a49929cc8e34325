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
package net.influxgraph.aggregation;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.influxgraph.configuration.Configuration;
import net.influxgraph.configuration.ConfigurationEntrySchema;
import net.influxgraph.configuration.ConfigurationException;

/**
 * Picks the aggregation function of a metric path.
 * <ol>
 * <li>The first configured {@link AggregationRule} finding a match in the
 * path wins.</li>
 * <li>Otherwise the last segment of the path is looked up in the suffix
 * table, e.g. "servers.web01.requests.sum" resolves to "sum".</li>
 * <li>Otherwise {@link Aggregators#DEFAULT}.</li>
 * </ol>
 * Instances are immutable and safe to share between requests.
 */
public class AggregationResolver {
  private static final Logger LOG = LoggerFactory.getLogger(
      AggregationResolver.class);

  public static final String RULES_KEY = "influxgraph.aggregation.rules";
  public static final String DEFAULTS_KEY = "influxgraph.aggregation.defaults";

  /** The built in suffix table. */
  public static final Map<String, String> DEFAULT_AGGREGATIONS =
      ImmutableMap.of(
          "min", "min",
          "max", "max",
          "last", "last",
          "sum", "sum");

  /** Rules in priority order. */
  private final List<AggregationRule> rules;

  /** Suffix to function name. */
  private final Map<String, String> suffixes;

  /** Ctor with no rules and the built in suffix table. */
  public AggregationResolver() {
    this(Collections.<AggregationRule>emptyList(),
        Collections.<String, String>emptyMap());
  }

  /**
   * Default ctor.
   * @param rules A list of rules in priority order, may be null.
   * @param defaults Suffix table entries overriding or extending
   * {@link #DEFAULT_AGGREGATIONS}, may be null.
   * @throws ConfigurationException if a suffix maps to an unknown function.
   */
  public AggregationResolver(final List<AggregationRule> rules,
                             final Map<String, String> defaults) {
    this.rules = rules == null ? ImmutableList.<AggregationRule>of() :
      ImmutableList.copyOf(rules);
    final Map<String, String> table = Maps.newHashMap(DEFAULT_AGGREGATIONS);
    if (defaults != null) {
      for (final Entry<String, String> entry : defaults.entrySet()) {
        if (!Aggregators.exists(entry.getValue())) {
          throw new ConfigurationException("Unknown aggregation function '"
              + entry.getValue() + "' for suffix " + entry.getKey()
              + ". Must be one of " + Aggregators.set());
        }
        table.put(entry.getKey(), entry.getValue().toLowerCase());
      }
    }
    suffixes = ImmutableMap.copyOf(table);
  }

  /**
   * Registers the aggregation keys if they are not already present.
   * @param config A non-null config.
   */
  public static void registerConfigs(final Configuration config) {
    if (!config.hasProperty(RULES_KEY)) {
      config.register(ConfigurationEntrySchema.newBuilder()
          .setKey(RULES_KEY)
          .setType(Object.class)
          .isNullable()
          .setDescription("An ordered list of {pattern, function} maps. The "
              + "first regular expression found in a path picks its "
              + "aggregation function."));
    }
    if (!config.hasProperty(DEFAULTS_KEY)) {
      config.register(ConfigurationEntrySchema.newBuilder()
          .setKey(DEFAULTS_KEY)
          .setType(Object.class)
          .isNullable()
          .setDescription("A map of last path segment to aggregation "
              + "function overriding or extending the built in table "
              + DEFAULT_AGGREGATIONS));
    }
  }

  /**
   * Builds a resolver from the configuration, registering the keys first.
   * @param config A non-null config.
   * @return The resolver.
   * @throws ConfigurationException if the rules or defaults were invalid.
   */
  public static AggregationResolver fromConfig(final Configuration config) {
    registerConfigs(config);
    final List<AggregationRule> rules = config.getTyped(RULES_KEY,
        new TypeReference<List<AggregationRule>>() { });
    final Map<String, String> defaults = config.getTyped(DEFAULTS_KEY,
        new TypeReference<Map<String, String>>() { });
    final AggregationResolver resolver = new AggregationResolver(rules,
        defaults);
    LOG.info("Loaded " + resolver.rules.size() + " aggregation rules and "
        + resolver.suffixes.size() + " suffix defaults.");
    return resolver;
  }

  /**
   * @param path A non-null path.
   * @return The name of the aggregation function for the path.
   */
  public String resolve(final String path) {
    return resolve(path, rules, suffixes);
  }

  /**
   * @param path A non-null path.
   * @return The aggregator for the path.
   */
  public Aggregator aggregator(final String path) {
    return Aggregators.get(resolve(path));
  }

  /**
   * Resolves without any state.
   * @param path A non-null path.
   * @param rules Rules in priority order.
   * @param suffixes The complete suffix table.
   * @return The name of the aggregation function.
   * @throws IllegalArgumentException if the path was null.
   */
  public static String resolve(final String path,
                               final List<AggregationRule> rules,
                               final Map<String, String> suffixes) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    for (final AggregationRule rule : rules) {
      if (rule.matches(path)) {
        return rule.function();
      }
    }
    final int idx = path.lastIndexOf('.');
    final String suffix = idx < 0 ? path : path.substring(idx + 1);
    final String function = suffixes.get(suffix);
    if (function != null) {
      return function;
    }
    return Aggregators.DEFAULT;
  }

  /** @return The rules in priority order. */
  public List<AggregationRule> rules() {
    return rules;
  }

  /** @return The complete suffix table. */
  public Map<String, String> suffixes() {
    return suffixes;
  }
}
