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

import com.google.common.base.MoreObjects;

/**
 * A registered schema along with the value resolved from the providers and
 * the name of the provider that supplied it.
 */
public class ConfigurationEntry {

  /** The schema. */
  private final ConfigurationEntrySchema schema;

  /** The resolved value, may be null. */
  private volatile Object value;

  /** Where the value came from, "default" when no provider had it. */
  private volatile String source;

  /**
   * Package private ctor.
   * @param schema A non-null schema.
   * @param value The resolved value.
   * @param source The non-null source.
   */
  ConfigurationEntry(final ConfigurationEntrySchema schema,
                     final Object value,
                     final String source) {
    this.schema = schema;
    this.value = value;
    this.source = source;
  }

  /** @return The schema. */
  public ConfigurationEntrySchema schema() {
    return schema;
  }

  /** @return The resolved value, may be null. */
  public Object getValue() {
    return value;
  }

  /** @return The source of the value. */
  public String source() {
    return source;
  }

  /**
   * Replaces the value. Only used by unit tests.
   * @param value The new value.
   * @param source The source.
   */
  void setValue(final Object value, final String source) {
    this.value = value;
    this.source = source;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", schema.getKey())
        .add("value", schema.isSecret() ? "********" : value)
        .add("source", source)
        .toString();
  }
}
