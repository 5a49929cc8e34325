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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.influxgraph.configuration.ConfigurationException;
import net.influxgraph.configuration.UnitTestConfiguration;
import net.influxgraph.data.TimeRange;

public class TestStepPolicy {

  @Test
  public void fixedStep() throws Exception {
    final StepPolicy policy = new StepPolicy(60);
    assertEquals(60, policy.step(0, 86400 * 30));
    assertEquals(60, policy.defaultStep());
    assertEquals(new TimeRange(1000, 2000, 60), policy.timeRange(1000, 2000));
  }

  @Test
  public void deltas() throws Exception {
    final StepPolicy policy = new StepPolicy(10, ImmutableMap.of(
        3600L, 30L,
        86400L, 300L));
    assertEquals(30, policy.step(0, 1800));
    assertEquals(30, policy.step(0, 3600));
    assertEquals(300, policy.step(0, 3601));
    assertEquals(300, policy.step(0, 86400));
    // past the widest range the default applies
    assertEquals(10, policy.step(0, 86401));
  }

  @Test
  public void invalid() throws Exception {
    try {
      new StepPolicy(0);
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    try {
      new StepPolicy(60, ImmutableMap.of(3600L, -1L));
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    try {
      new StepPolicy(60).step(10, 5);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void windowTooWide() throws Exception {
    final StepPolicy policy = new StepPolicy(60,
        ImmutableMap.of(3600L, 30L));
    try {
      policy.timeRange(0, Long.MAX_VALUE);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    // end - start overflows a long
    try {
      policy.step(Long.MIN_VALUE, Long.MAX_VALUE);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      policy.timeRange(-10, Long.MAX_VALUE);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    // a year still fits
    assertEquals(525601, policy.timeRange(0, 86400 * 365).steps());
  }

  @Test
  public void fromConfigDefaults() throws Exception {
    final StepPolicy policy = StepPolicy.fromConfig(
        UnitTestConfiguration.getConfiguration());
    assertEquals(StepPolicy.DEFAULT_STEP, policy.defaultStep());
    assertEquals(60, policy.step(0, 86400 * 365));
  }

  @Test
  public void fromConfig() throws Exception {
    final StepPolicy policy = StepPolicy.fromConfig(
        UnitTestConfiguration.getConfiguration(ImmutableMap.of(
            StepPolicy.STEP_KEY, "15",
            StepPolicy.DELTAS_KEY, "{\"3600\": 60, \"86400\": 900}")));
    assertEquals(15, policy.defaultStep());
    assertEquals(60, policy.step(0, 600));
    assertEquals(900, policy.step(0, 7200));
    assertEquals(15, policy.step(0, 86400 * 2));
  }
}
