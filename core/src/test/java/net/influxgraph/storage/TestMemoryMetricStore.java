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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.influxgraph.configuration.UnitTestConfiguration;
import net.influxgraph.data.DataPoint;
import net.influxgraph.exceptions.QueryExecutionException;

public class TestMemoryMetricStore {

  private MemoryMetricStore store;

  @Before
  public void before() throws Exception {
    store = new MemoryMetricStore();
    assertNull(store.initialize(UnitTestConfiguration.getConfiguration(), null)
        .join());
    store.write(Lists.newArrayList(
        new DataPoint("sys.cpu.user", 1000, 1.0),
        new DataPoint("sys.cpu.user", 1060, 2.0),
        new DataPoint("sys.cpu.system", 1000, 3.0),
        new DataPoint("sys.mem", 1000, 4.0)));
  }

  @Test
  public void lifecycle() throws Exception {
    assertEquals(MemoryMetricStore.TYPE, store.id());
    assertEquals(MemoryMetricStore.TYPE, store.type());
    assertEquals(3, store.seriesCount());
    assertNull(store.shutdown().join());
    assertEquals(0, store.seriesCount());
  }

  @Test
  public void seriesNames() throws Exception {
    assertEquals(ImmutableSet.of("sys.cpu.user", "sys.cpu.system", "sys.mem"),
        store.seriesNames(null));
    assertEquals(ImmutableSet.of("sys.cpu.user", "sys.cpu.system"),
        store.seriesNames("^sys\\.cpu"));
    // searched, not anchored
    assertEquals(ImmutableSet.of("sys.cpu.user"), store.seriesNames("user"));
    assertTrue(store.seriesNames("^nope").isEmpty());
  }

  @Test
  public void readPoints() throws Exception {
    Map<String, List<DataPoint>> points = store.readPoints(
        "^sys\\.cpu\\.user$", 0, 2000);
    assertEquals(1, points.size());
    assertEquals(2, points.get("sys.cpu.user").size());
    assertEquals(1000, points.get("sys.cpu.user").get(0).timestamp());

    // inclusive bounds
    points = store.readPoints("^sys\\.cpu\\.user$", 1060, 1060);
    assertEquals(1, points.get("sys.cpu.user").size());

    // series without points in the window are omitted
    points = store.readPoints("^sys\\.", 1030, 2000);
    assertEquals(ImmutableSet.of("sys.cpu.user"), points.keySet());
  }

  @Test
  public void writeReplaces() throws Exception {
    store.write(Lists.newArrayList(
        new DataPoint("sys.mem", 1000, 42.0),
        new DataPoint("sys.mem", ImmutableMap.of("host", "web01"), 1000, 5.0),
        new DataPoint("sys.mem", 1060, null)));
    final List<DataPoint> points = store.readPoints("^sys\\.mem$", 0, 2000)
        .get("sys.mem");
    assertEquals(2, points.size());
    assertEquals(42.0, points.get(0).value(), 0.0001);
    assertEquals(5.0, points.get(1).value(), 0.0001);
  }

  @Test
  public void invalid() throws Exception {
    try {
      store.seriesNames("sys.[cpu");
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
    }
    try {
      store.readPoints(null, 0, 10);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      store.readPoints("a", 10, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      store.write(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    assertFalse(store.seriesNames(null).contains("sys.cpu"));
  }
}
