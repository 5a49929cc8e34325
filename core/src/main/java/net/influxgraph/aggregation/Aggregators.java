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

import java.util.Arrays;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

/**
 * Utility class that provides the aggregators a path can resolve to.
 */
public final class Aggregators {

  /** Aggregator that averages the values. */
  public static final Aggregator MEAN = new Mean("mean");

  /** Aggregator that sums up the values. */
  public static final Aggregator SUM = new Sum("sum");

  /** Aggregator that returns the minimum value. */
  public static final Aggregator MIN = new Min("min");

  /** Aggregator that returns the maximum value. */
  public static final Aggregator MAX = new Max("max");

  /** Aggregator that returns the earliest value in the step. */
  public static final Aggregator FIRST = new First("first");

  /** Aggregator that returns the latest value in the step. */
  public static final Aggregator LAST = new Last("last");

  /** Aggregator that returns the number of values in the step. */
  public static final Aggregator COUNT = new Count("count");

  /** Aggregator that returns the upper median of the values. */
  public static final Aggregator MEDIAN = new Median("median");

  /** The fallback when nothing else resolves. */
  public static final String DEFAULT = "mean";

  /** Maps an aggregator name to its instance. */
  private static final Map<String, Aggregator> aggregators =
      ImmutableMap.<String, Aggregator>builder()
        .put("mean", MEAN)
        .put("avg", MEAN)
        .put("sum", SUM)
        .put("min", MIN)
        .put("max", MAX)
        .put("first", FIRST)
        .put("last", LAST)
        .put("count", COUNT)
        .put("median", MEDIAN)
        .build();

  private Aggregators() {
    // Can't create instances of this utility class.
  }

  /**
   * Returns the set of the names that can be used with {@link #get get}.
   */
  public static Set<String> set() {
    return aggregators.keySet();
  }

  /**
   * @param name A name, may be null.
   * @return True if {@link #get(String)} would return an aggregator.
   */
  public static boolean exists(final String name) {
    return name != null && aggregators.containsKey(name.toLowerCase());
  }

  /**
   * Returns the aggregator corresponding to the given name. Case
   * insensitive.
   * @param name The name of the aggregator to get.
   * @throws IllegalArgumentException if the given name doesn't exist.
   * @see #set
   */
  public static Aggregator get(final String name) {
    final Aggregator agg = name == null ? null :
      aggregators.get(name.toLowerCase());
    if (agg != null) {
      return agg;
    }
    throw new IllegalArgumentException("No such aggregator: " + name);
  }

  /**
   * Wraps the first {@code length} entries of the array in a sequence.
   * @param values A non-null array.
   * @param length How many entries to expose.
   * @return A sequence over the entries.
   */
  public static Aggregator.Doubles doubles(final double[] values,
                                           final int length) {
    return new ArrayDoubles(values, length);
  }

  /** Base holding the name. */
  private abstract static class BaseAggregator implements Aggregator {
    private final String name;

    BaseAggregator(final String name) {
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  private static final class Mean extends BaseAggregator {
    Mean(final String name) {
      super(name);
    }

    @Override
    public double runDouble(final Doubles values) {
      double result = 0.;
      int n = 0;
      while (values.hasNextValue()) {
        final double val = values.nextDoubleValue();
        if (!Double.isNaN(val)) {
          result += val;
          n++;
        }
      }
      return (0 == n) ? Double.NaN : result / n;
    }
  }

  private static final class Sum extends BaseAggregator {
    Sum(final String name) {
      super(name);
    }

    @Override
    public double runDouble(final Doubles values) {
      double result = 0.;
      long n = 0L;

      while (values.hasNextValue()) {
        final double val = values.nextDoubleValue();
        if (!Double.isNaN(val)) {
          result += val;
          ++n;
        }
      }

      return (0L == n) ? Double.NaN : result;
    }
  }

  private static final class Min extends BaseAggregator {
    Min(final String name) {
      super(name);
    }

    @Override
    public double runDouble(final Doubles values) {
      double min = Double.POSITIVE_INFINITY;
      boolean found = false;
      while (values.hasNextValue()) {
        final double val = values.nextDoubleValue();
        if (!Double.isNaN(val) && val <= min) {
          min = val;
          found = true;
        }
      }
      return found ? min : Double.NaN;
    }
  }

  private static final class Max extends BaseAggregator {
    Max(final String name) {
      super(name);
    }

    @Override
    public double runDouble(final Doubles values) {
      double max = Double.NEGATIVE_INFINITY;
      boolean found = false;
      while (values.hasNextValue()) {
        final double val = values.nextDoubleValue();
        if (!Double.isNaN(val) && val >= max) {
          max = val;
          found = true;
        }
      }
      return found ? max : Double.NaN;
    }
  }

  private static final class First extends BaseAggregator {
    First(final String name) {
      super(name);
    }

    @Override
    public double runDouble(final Doubles values) {
      while (values.hasNextValue()) {
        final double val = values.nextDoubleValue();
        if (!Double.isNaN(val)) {
          return val;
        }
      }
      return Double.NaN;
    }
  }

  private static final class Last extends BaseAggregator {
    Last(final String name) {
      super(name);
    }

    @Override
    public double runDouble(final Doubles values) {
      double last = Double.NaN;
      while (values.hasNextValue()) {
        final double val = values.nextDoubleValue();
        if (!Double.isNaN(val)) {
          last = val;
        }
      }
      return last;
    }
  }

  private static final class Count extends BaseAggregator {
    Count(final String name) {
      super(name);
    }

    @Override
    public double runDouble(final Doubles values) {
      int count = 0;
      while (values.hasNextValue()) {
        if (!Double.isNaN(values.nextDoubleValue())) {
          count++;
        }
      }
      return count;
    }
  }

  private static final class Median extends BaseAggregator {
    Median(final String name) {
      super(name);
    }

    @Override
    public double runDouble(final Doubles values) {
      double[] collection = new double[8];
      int n = 0;
      while (values.hasNextValue()) {
        final double val = values.nextDoubleValue();
        if (!Double.isNaN(val)) {
          if (n == collection.length) {
            collection = Arrays.copyOf(collection, n * 2);
          }
          collection[n++] = val;
        }
      }
      if (n == 0) {
        // in this case we may have had lots of NaNs so just drop em.
        return Double.NaN;
      }
      Arrays.sort(collection, 0, n);
      return collection[n / 2];
    }
  }

  /** A sequence over part of an array. */
  private static final class ArrayDoubles implements Aggregator.Doubles {
    private final double[] values;
    private final int length;
    private int idx;

    ArrayDoubles(final double[] values, final int length) {
      if (length > values.length) {
        throw new IllegalArgumentException("Length " + length
            + " exceeds the array size " + values.length);
      }
      this.values = values;
      this.length = length;
    }

    @Override
    public boolean hasNextValue() {
      return idx < length;
    }

    @Override
    public double nextDoubleValue() {
      if (idx >= length) {
        throw new NoSuchElementException("No more values");
      }
      return values[idx++];
    }
  }
}
