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

import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableSortedMap;

import net.influxgraph.configuration.Configuration;
import net.influxgraph.configuration.ConfigurationEntrySchema;
import net.influxgraph.configuration.ConfigurationException;
import net.influxgraph.data.TimeRange;

/**
 * Picks the step of the grid a request is aligned on. With a deltas table
 * the first entry whose range covers {@code end - start} gives the step,
 * so wide windows get coarser steps. Otherwise the configured default.
 */
public class StepPolicy {
  private static final Logger LOG = LoggerFactory.getLogger(StepPolicy.class);

  public static final String STEP_KEY = "influxgraph.step";
  public static final String DELTAS_KEY = "influxgraph.deltas";

  /** The default step in seconds. */
  public static final int DEFAULT_STEP = 60;

  /** The step when no delta applies. */
  private final long step;

  /** Range in seconds to step in seconds, ascending. */
  private final NavigableMap<Long, Long> deltas;

  /**
   * Ctor with a fixed step.
   * @param step The step in seconds.
   * @throws ConfigurationException if the step was not positive.
   */
  public StepPolicy(final long step) {
    this(step, null);
  }

  /**
   * Default ctor.
   * @param step The default step in seconds.
   * @param deltas An optional map of range seconds to step seconds.
   * @throws ConfigurationException if a step or range was not positive.
   */
  public StepPolicy(final long step, final Map<Long, Long> deltas) {
    if (step <= 0) {
      throw new ConfigurationException("Step must be greater than zero: "
          + step);
    }
    this.step = step;
    if (deltas == null) {
      this.deltas = ImmutableSortedMap.of();
    } else {
      for (final Entry<Long, Long> entry : deltas.entrySet()) {
        if (entry.getKey() == null || entry.getKey() <= 0
            || entry.getValue() == null || entry.getValue() <= 0) {
          throw new ConfigurationException("Invalid delta entry "
              + entry.getKey() + "=" + entry.getValue()
              + ", ranges and steps must be greater than zero.");
        }
      }
      this.deltas = ImmutableSortedMap.copyOf(deltas);
    }
  }

  /**
   * Registers the step keys if they are not already present.
   * @param config A non-null config.
   */
  public static void registerConfigs(final Configuration config) {
    if (!config.hasProperty(STEP_KEY)) {
      config.register(STEP_KEY, DEFAULT_STEP, "The step in seconds between "
          + "the slots of returned series when no delta applies.");
    }
    if (!config.hasProperty(DELTAS_KEY)) {
      config.register(ConfigurationEntrySchema.newBuilder()
          .setKey(DELTAS_KEY)
          .setType(Object.class)
          .isNullable()
          .setDescription("A map of query range in seconds to step in "
              + "seconds. The smallest range at or above the query range "
              + "picks the step."));
    }
  }

  /**
   * Builds the policy from the configuration, registering the keys first.
   * @param config A non-null config.
   * @return The policy.
   * @throws ConfigurationException if the values were invalid.
   */
  public static StepPolicy fromConfig(final Configuration config) {
    registerConfigs(config);
    final Map<Long, Long> deltas = config.getTyped(DELTAS_KEY,
        new TypeReference<Map<Long, Long>>() { });
    final StepPolicy policy = new StepPolicy(config.getInt(STEP_KEY), deltas);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Step policy: default " + policy.step + "s, deltas "
          + policy.deltas);
    }
    return policy;
  }

  /**
   * @param start The start epoch in seconds.
   * @param end The end epoch in seconds.
   * @return The step in seconds for the window.
   * @throws IllegalArgumentException if end was before start or the window
   * overflowed a long.
   */
  public long step(final long start, final long end) {
    if (end < start) {
      throw new IllegalArgumentException("End " + end
          + " cannot be before the start " + start);
    }
    final long span = end - start;
    if (span < 0) {
      throw new IllegalArgumentException("The window from " + start
          + " to " + end + " is too wide");
    }
    final Entry<Long, Long> entry = deltas.ceilingEntry(span);
    return entry == null ? step : entry.getValue();
  }

  /**
   * @param start The start epoch in seconds.
   * @param end The end epoch in seconds.
   * @return The grid for the window.
   * @throws IllegalArgumentException if end was before start or the window
   * holds too many steps to align on.
   */
  public TimeRange timeRange(final long start, final long end) {
    return new TimeRange(start, end, step(start, end));
  }

  /** @return The default step in seconds. */
  public long defaultStep() {
    return step;
  }
}
