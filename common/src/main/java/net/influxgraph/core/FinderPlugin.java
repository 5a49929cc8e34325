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
package net.influxgraph.core;

import com.stumbleupon.async.Deferred;

import net.influxgraph.configuration.Configuration;

/**
 * A component loaded by the finder at start-up, e.g. a metric store.
 */
public interface FinderPlugin {

  /**
   * The unique build time name of the plugin, e.g. "MetricStore".
   *
   * @return A non-null string.
   */
  public String type();

  /**
   * An unique runtime Id for the plugin given at load time. If the plugin
   * is a default, the value will be "Default".
   *
   * @return A non-null string ID.
   */
  public String id();

  /**
   * Called to initialize the plugin asynchronously. Implementations register
   * their configuration keys and open any IO they need.
   * <p>
   * <b>Note:</b> Implementations should throw exceptions if they can't start
   * up properly. Use IllegalArgumentException or ConfigurationException for
   * configuration issues. If it can't startup for another reason, return an
   * Exception in the deferred.
   *
   * @param config The non-null configuration.
   * @param id The ID of the object. If null we assume "Default".
   * @return A non-null deferred resolving to a {@code null} on successful
   * init or an exception on failure.
   */
  public Deferred<Object> initialize(final Configuration config,
                                     final String id);

  /**
   * Called to gracefully shutdown the plugin. Implementations should close
   * any IO they have open and release resources.
   *
   * @return A non-null deferred resolving to a {@code null} on successful
   * shutdown or an exception on failure.
   */
  public Deferred<Object> shutdown();

  /**
   * @return The version of this plugin in the format MAJOR.MINOR.MAINT,
   * e.g. 1.0.0.
   */
  public String version();
}
