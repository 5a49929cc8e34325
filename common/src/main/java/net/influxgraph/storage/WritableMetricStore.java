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

import java.util.List;

import net.influxgraph.data.DataPoint;

/**
 * A store that accepts points. Only used to seed stores for tests and
 * embedding, the finder itself never writes.
 */
public interface WritableMetricStore {

  /**
   * Writes the points.
   * @param points A non-null list of points. Points with null values are
   * skipped.
   * @throws net.influxgraph.exceptions.QueryExecutionException if the write
   * failed.
   */
  public void write(final List<DataPoint> points);
}
