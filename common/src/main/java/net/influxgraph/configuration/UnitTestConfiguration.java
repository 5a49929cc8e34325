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
package net.influxgraph.configuration;

import java.util.Collections;
import java.util.Map;

import net.influxgraph.configuration.provider.MapProvider;

/**
 * A helper for use with unit testing configuration consumers. Only a
 * {@link MapProvider} is given so tests never pick up the environment of
 * the machine running them.
 */
public class UnitTestConfiguration extends Configuration {

  /** The source name of the settings map. */
  public static final String SOURCE = "UnitTest";

  /**
   * Ctor with the settings to serve.
   * @param settings A non-null map of settings, values must not be null.
   */
  public UnitTestConfiguration(final Map<String, ?> settings) {
    super(new MapProvider(SOURCE, settings));
  }

  /** @return A configuration without settings, only defaults apply. */
  public static UnitTestConfiguration getConfiguration() {
    return new UnitTestConfiguration(Collections.<String, Object>emptyMap());
  }

  /**
   * @param settings A non-null map of key values to load.
   * @return A non-null config.
   */
  public static UnitTestConfiguration getConfiguration(
      final Map<String, ?> settings) {
    return new UnitTestConfiguration(settings);
  }

  /**
   * Allows a unit test to inject a value after registration. It still
   * requires that the key be registered.
   *
   * @param key A non-null and non-empty key.
   * @param value A value to inject.
   * @throws IllegalArgumentException if the key was not registered.
   */
  public void override(final String key, final Object value) {
    final ConfigurationEntry entry = merged_config.get(key);
    if (entry == null) {
      throw new IllegalArgumentException("Register this config first!");
    }
    entry.setValue(coerce(entry.schema(), value), SOURCE);
  }
}
