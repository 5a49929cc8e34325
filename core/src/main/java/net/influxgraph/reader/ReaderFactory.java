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

import net.influxgraph.aggregation.AggregationResolver;
import net.influxgraph.storage.MetricStore;

/**
 * Binds readers to a store, resolving the aggregator of each path.
 */
public class ReaderFactory {

  private final MetricStore store;
  private final AggregationResolver resolver;
  private final StepPolicy step_policy;

  /**
   * Default ctor.
   * @param store A non-null store.
   * @param resolver A non-null aggregation resolver.
   * @param step_policy A non-null step policy.
   * @throws IllegalArgumentException if an argument was null.
   */
  public ReaderFactory(final MetricStore store,
                       final AggregationResolver resolver,
                       final StepPolicy step_policy) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (resolver == null) {
      throw new IllegalArgumentException("Resolver cannot be null.");
    }
    if (step_policy == null) {
      throw new IllegalArgumentException("Step policy cannot be null.");
    }
    this.store = store;
    this.resolver = resolver;
    this.step_policy = step_policy;
  }

  /**
   * @param path A non-null and non-empty path.
   * @return A reader for the path. The series need not exist.
   */
  public Reader newReader(final String path) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    return new Reader(store, path, resolver.aggregator(path), step_policy);
  }

  /** @return The store readers are bound to. */
  public MetricStore store() {
    return store;
  }

  /** @return The step policy. */
  public StepPolicy stepPolicy() {
    return step_policy;
  }
}
