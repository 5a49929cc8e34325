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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.NoSuchElementException;

import org.junit.Test;

public final class TestAggregators {

  private static final double[] VALUES = new double[] {
      4, Double.NaN, 1, 3, 2 };

  private static double run(final Aggregator agg, final double... values) {
    return agg.runDouble(Aggregators.doubles(values, values.length));
  }

  @Test
  public void knownValues() {
    assertEquals(2.5, run(Aggregators.MEAN, VALUES), 0.0001);
    assertEquals(10, run(Aggregators.SUM, VALUES), 0.0001);
    assertEquals(1, run(Aggregators.MIN, VALUES), 0.0001);
    assertEquals(4, run(Aggregators.MAX, VALUES), 0.0001);
    assertEquals(4, run(Aggregators.FIRST, VALUES), 0.0001);
    assertEquals(2, run(Aggregators.LAST, VALUES), 0.0001);
    assertEquals(4, run(Aggregators.COUNT, VALUES), 0.0001);
    // upper median
    assertEquals(3, run(Aggregators.MEDIAN, VALUES), 0.0001);
    assertEquals(2, run(Aggregators.MEDIAN, 3, 1, 2), 0.0001);
  }

  @Test
  public void negativesAndZeros() {
    assertEquals(-5, run(Aggregators.MIN, 0, -5, -1), 0.0001);
    assertEquals(0, run(Aggregators.MAX, 0, -5, -1), 0.0001);
    assertEquals(0, run(Aggregators.SUM, 0, 0), 0.0001);
  }

  @Test
  public void allNaN() {
    assertTrue(Double.isNaN(run(Aggregators.MEAN, Double.NaN)));
    assertTrue(Double.isNaN(run(Aggregators.SUM, Double.NaN)));
    assertTrue(Double.isNaN(run(Aggregators.MIN, Double.NaN)));
    assertTrue(Double.isNaN(run(Aggregators.MAX, Double.NaN)));
    assertTrue(Double.isNaN(run(Aggregators.FIRST, Double.NaN)));
    assertTrue(Double.isNaN(run(Aggregators.LAST, Double.NaN)));
    assertTrue(Double.isNaN(run(Aggregators.MEDIAN, Double.NaN)));
    assertEquals(0, run(Aggregators.COUNT, Double.NaN), 0.0001);
  }

  @Test
  public void get() {
    assertSame(Aggregators.MEAN, Aggregators.get("mean"));
    assertSame(Aggregators.MEAN, Aggregators.get("avg"));
    assertSame(Aggregators.SUM, Aggregators.get("SUM"));
    assertEquals("median", Aggregators.get("median").name());
    assertTrue(Aggregators.exists("last"));
    assertFalse(Aggregators.exists("p99"));
    assertFalse(Aggregators.exists(null));

    try {
      Aggregators.get("p99");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      Aggregators.get(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void doubles() {
    final Aggregator.Doubles doubles = Aggregators.doubles(
        new double[] { 1, 2, 3 }, 2);
    assertEquals(1, doubles.nextDoubleValue(), 0.0001);
    assertEquals(2, doubles.nextDoubleValue(), 0.0001);
    assertFalse(doubles.hasNextValue());
    try {
      doubles.nextDoubleValue();
      fail("Expected NoSuchElementException");
    } catch (NoSuchElementException e) { }

    try {
      Aggregators.doubles(new double[1], 2);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
