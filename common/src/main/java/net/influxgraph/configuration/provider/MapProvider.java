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
package net.influxgraph.configuration.provider;

import java.io.IOException;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Serves values from a fixed map. Handy when embedding the finder in a host
 * that already parsed its own configuration, and for unit tests.
 */
public class MapProvider implements Provider {

  /** The values. */
  private final Map<String, ?> settings;

  /** The name reported as the source. */
  private final String source;

  /**
   * Default ctor.
   * @param source A non-null name for logging.
   * @param settings A non-null map of settings, copied.
   */
  public MapProvider(final String source, final Map<String, ?> settings) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null.");
    }
    this.source = source == null ? getClass().getSimpleName() : source;
    this.settings = ImmutableMap.copyOf(settings);
  }

  @Override
  public Object getSetting(final String key) {
    return settings.get(key);
  }

  @Override
  public String source() {
    return source;
  }

  @Override
  public void close() throws IOException {
    // no-op
  }

}
