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
package net.influxgraph.query;

import com.google.common.base.Strings;

/**
 * A glob pattern over dotted metric paths as sent by the browser, e.g.
 * "servers.web*.cpu.{user,system}". Immutable and created per request.
 */
public class Query {

  /** The raw pattern. */
  private final String pattern;

  /**
   * Default ctor.
   * @param pattern A non-null and non-empty pattern.
   * @throws IllegalArgumentException if the pattern was null or empty.
   */
  public Query(final String pattern) {
    if (Strings.isNullOrEmpty(pattern)) {
      throw new IllegalArgumentException("Pattern cannot be null or empty.");
    }
    this.pattern = pattern;
  }

  /** @return The raw glob pattern. */
  public String pattern() {
    return pattern;
  }

  /** @return True if the pattern has glob metacharacters. */
  public boolean hasWildcards() {
    return PatternCompiler.literalPrefix(pattern).length() < pattern.length();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Query)) {
      return false;
    }
    return pattern.equals(((Query) o).pattern);
  }

  @Override
  public int hashCode() {
    return pattern.hashCode();
  }

  @Override
  public String toString() {
    return "Query{" + pattern + "}";
  }
}
