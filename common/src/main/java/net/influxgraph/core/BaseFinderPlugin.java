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

import com.google.common.base.Strings;
import com.stumbleupon.async.Deferred;

import net.influxgraph.configuration.Configuration;

/**
 * The base class used for finder plugins of all types.
 */
public abstract class BaseFinderPlugin implements FinderPlugin {

  /** The default ID when none is given. */
  public static final String DEFAULT_ID = "Default";

  /** The configuration given at init. */
  protected Configuration config;

  /** The ID of this instance. */
  protected String id;

  /**
   * Ctor without any arguments is required for instantiating plugins.
   */
  protected BaseFinderPlugin() { }

  @Override
  public String id() {
    return id;
  }

  @Override
  public Deferred<Object> initialize(final Configuration config,
                                     final String id) {
    if (config == null) {
      throw new IllegalArgumentException("Configuration cannot be null.");
    }
    this.config = config;
    this.id = Strings.isNullOrEmpty(id) ? DEFAULT_ID : id;
    return Deferred.fromResult(null);
  }

  @Override
  public Deferred<Object> shutdown() {
    return Deferred.fromResult(null);
  }

  @Override
  public abstract String version();
}
