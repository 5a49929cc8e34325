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

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

import net.influxgraph.configuration.ConfigurationException;

/**
 * Routes every path the regular expression finds a match in to the named
 * aggregation function. Rules are evaluated in configuration order.
 */
public class AggregationRule {

  /** The compiled expression. */
  private final Pattern pattern;

  /** The function name, lower case. */
  private final String function;

  /**
   * Default ctor, also used when deserializing the rule list from the
   * configuration.
   * @param pattern A non-null and non-empty Java regular expression.
   * @param function The name of a known aggregation function.
   * @throws ConfigurationException if the pattern was missing or invalid or
   * the function is not known.
   */
  @JsonCreator
  public AggregationRule(@JsonProperty("pattern") final String pattern,
                         @JsonProperty("function") final String function) {
    if (Strings.isNullOrEmpty(pattern)) {
      throw new ConfigurationException("Aggregation rule pattern cannot be "
          + "null or empty.");
    }
    if (!Aggregators.exists(function)) {
      throw new ConfigurationException("Unknown aggregation function '"
          + function + "' for rule " + pattern + ". Must be one of "
          + Aggregators.set());
    }
    try {
      this.pattern = Pattern.compile(pattern);
    } catch (PatternSyntaxException e) {
      throw new ConfigurationException("Invalid aggregation rule pattern: "
          + pattern, e);
    }
    this.function = function.toLowerCase();
  }

  /**
   * @param path A non-null path.
   * @return True if the pattern finds a match anywhere in the path.
   */
  public boolean matches(final String path) {
    return pattern.matcher(path).find();
  }

  /** @return The expression. */
  public String pattern() {
    return pattern.pattern();
  }

  /** @return The function name. */
  public String function() {
    return function;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("pattern", pattern.pattern())
        .add("function", function)
        .toString();
  }
}
