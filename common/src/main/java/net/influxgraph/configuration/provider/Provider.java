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

import java.io.Closeable;

import net.influxgraph.configuration.Configuration;

/**
 * A source of configuration values consulted by the {@link Configuration}
 * when a schema is registered. Providers are read once; the values they
 * return are fixed for the life of the configuration.
 */
public interface Provider extends Closeable {

  /**
   * Called by the {@link Configuration} class to load the value for the
   * given key when a schema is registered via
   * {@link Configuration#register(net.influxgraph.configuration.ConfigurationEntrySchema)}.
   * @param key A non-null and non-empty key.
   * @return The raw value if the provider had data for the key, null if
   * it did not.
   */
  public Object getSetting(final String key);

  /**
   * The name of this provider.
   * @return A non-null string.
   */
  public String source();

}
