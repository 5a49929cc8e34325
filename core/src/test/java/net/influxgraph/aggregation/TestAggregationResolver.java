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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.influxgraph.configuration.ConfigurationException;
import net.influxgraph.configuration.UnitTestConfiguration;

public class TestAggregationResolver {

  @Test
  public void defaultTable() throws Exception {
    final AggregationResolver resolver = new AggregationResolver();
    assertEquals("min", resolver.resolve("integration_test.agg_path.min"));
    assertEquals("max", resolver.resolve("integration_test.agg_path.max"));
    assertEquals("last", resolver.resolve("integration_test.agg_path.last"));
    assertEquals("sum", resolver.resolve("integration_test.agg_path.sum"));
    assertEquals("mean", resolver.resolve("integration_test.leaf_node1"));
    // only the last segment counts
    assertEquals("mean", resolver.resolve("sum.foo"));
    assertEquals("mean", resolver.resolve("foo.summary"));
    assertEquals("sum", resolver.resolve("sum"));
  }

  @Test
  public void rulesFirstMatchWins() throws Exception {
    final AggregationResolver resolver = new AggregationResolver(
        ImmutableList.of(
            new AggregationRule("\\.counters\\.", "sum"),
            new AggregationRule("^servers\\.", "max"),
            new AggregationRule("latency", "median")),
        null);
    assertEquals("sum", resolver.resolve("servers.web01.counters.requests"));
    assertEquals("max", resolver.resolve("servers.web01.cpu"));
    // rules beat the suffix table
    assertEquals("max", resolver.resolve("servers.web01.cpu.min"));
    // unanchored search
    assertEquals("median", resolver.resolve("app.http_latency_ms"));
    assertEquals("min", resolver.resolve("app.cpu.min"));
    assertEquals("mean", resolver.resolve("app.cpu"));
  }

  @Test
  public void defaultsOverrideAndExtend() throws Exception {
    final AggregationResolver resolver = new AggregationResolver(null,
        ImmutableMap.of("min", "mean", "count", "SUM"));
    assertEquals("mean", resolver.resolve("a.min"));
    assertEquals("sum", resolver.resolve("a.count"));
    assertEquals("max", resolver.resolve("a.max"));
    assertEquals(5, resolver.suffixes().size());

    try {
      new AggregationResolver(null, ImmutableMap.of("p99", "p99"));
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  @Test
  public void deterministic() throws Exception {
    final List<AggregationRule> rules = ImmutableList.of(
        new AggregationRule("foo", "last"));
    final Map<String, String> table = AggregationResolver.DEFAULT_AGGREGATIONS;
    final String first = AggregationResolver.resolve("a.foo.sum", rules, table);
    for (int i = 0; i < 10; i++) {
      assertEquals(first, AggregationResolver.resolve("a.foo.sum", rules,
          table));
    }
    assertEquals("last", first);
  }

  @Test
  public void aggregator() throws Exception {
    final AggregationResolver resolver = new AggregationResolver();
    assertSame(Aggregators.SUM, resolver.aggregator("a.b.sum"));
    assertSame(Aggregators.MEAN, resolver.aggregator("a.b"));
  }

  @Test
  public void badRules() throws Exception {
    try {
      new AggregationRule("foo", "p99");
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    try {
      new AggregationRule("(unclosed", "sum");
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    try {
      new AggregationRule("", "sum");
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    try {
      AggregationResolver.resolve(null, ImmutableList.<AggregationRule>of(),
          AggregationResolver.DEFAULT_AGGREGATIONS);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void fromConfig() throws Exception {
    final UnitTestConfiguration config = UnitTestConfiguration.getConfiguration(
        ImmutableMap.of(
            AggregationResolver.RULES_KEY, ImmutableList.of(
                ImmutableMap.of("pattern", "\\.requests$", "function", "sum")),
            AggregationResolver.DEFAULTS_KEY, "{\"avg\": \"mean\"}"));
    final AggregationResolver resolver = AggregationResolver.fromConfig(config);
    assertEquals(1, resolver.rules().size());
    assertEquals("sum", resolver.resolve("web.requests"));
    assertEquals("mean", resolver.resolve("web.latency.avg"));
    assertEquals("min", resolver.resolve("web.latency.min"));
  }

  @Test
  public void fromConfigEmpty() throws Exception {
    final AggregationResolver resolver = AggregationResolver.fromConfig(
        UnitTestConfiguration.getConfiguration());
    assertEquals(0, resolver.rules().size());
    assertEquals(AggregationResolver.DEFAULT_AGGREGATIONS,
        resolver.suffixes());
  }

  @Test
  public void fromConfigBadFunction() throws Exception {
    final UnitTestConfiguration config = UnitTestConfiguration.getConfiguration(
        ImmutableMap.of(AggregationResolver.RULES_KEY,
            "[{\"pattern\": \"foo\", \"function\": \"nosuchfunction\"}]"));
    try {
      AggregationResolver.fromConfig(config);
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }
}
