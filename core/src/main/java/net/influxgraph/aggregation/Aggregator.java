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

import java.util.NoSuchElementException;

/**
 * A function reducing the raw values that fall into one output step to a
 * single value.
 * <p>
 * All aggregators must be stateless. All they can do is run through a
 * sequence of {@link Doubles Doubles} and return an aggregated value.
 */
public interface Aggregator {

  /**
   * A sequence of {@code double}s.
   * <p>
   * This interface is semantically equivalent to
   * {@code Iterator<double>}.
   */
  public interface Doubles {

    /**
     * Returns {@code true} if this sequence has more values.
     * {@code false} otherwise.
     */
    boolean hasNextValue();

    /**
     * Returns the next {@code double} value in this sequence.
     * @throws NoSuchElementException if calling {@link #hasNextValue} returns
     * {@code false}.
     */
    double nextDoubleValue();

  }

  /** @return The name the aggregator is configured with, e.g. "sum". */
  String name();

  /**
   * Aggregates a sequence of {@code double}s.
   * @param values The sequence to aggregate.
   * @return The aggregated value, NaN if there was nothing to aggregate.
   */
  double runDouble(Doubles values);

}
