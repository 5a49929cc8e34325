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

import com.google.common.annotations.VisibleForTesting;

/**
 * Pulls values from the environment under which the JVM was launched. The
 * key is looked up verbatim first, then in the shell friendly form where
 * dots become underscores and letters are upper cased, e.g. "influxdb.host"
 * is read from "INFLUXDB_HOST".
 */
public class EnvironmentProvider implements Provider {
  public static final String SOURCE = EnvironmentProvider.class.getSimpleName();

  /** The environment to read from. */
  private final Map<String, String> environment;

  /** Default ctor reading the process environment. */
  public EnvironmentProvider() {
    this(System.getenv());
  }

  @VisibleForTesting
  EnvironmentProvider(final Map<String, String> environment) {
    if (environment == null) {
      throw new IllegalArgumentException("Environment cannot be null.");
    }
    this.environment = environment;
  }

  @Override
  public Object getSetting(final String key) {
    final String value = environment.get(key);
    if (value != null) {
      return value;
    }
    return environment.get(toVariableName(key));
  }

  @Override
  public String source() {
    return SOURCE;
  }

  @Override
  public void close() throws IOException {
    // no-op
  }

  /**
   * Converts a dotted key into an environment variable name.
   * @param key A non-null key.
   * @return The upper case, underscore separated name.
   */
  static String toVariableName(final String key) {
    return key.replace('.', '_').replace('-', '_').toUpperCase();
  }
}
