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
import com.google.common.base.Strings;

/**
 * The definition of a configuration entry: the key, the Java type values
 * are converted to, a default and a description for operators. Once the
 * schema is registered with the {@link Configuration} the providers are
 * consulted and the value is fixed.
 * <p>
 * Values of schemas marked {@link #isSecret()} are never logged or
 * returned from {@link Configuration#toString()}.
 */
public class ConfigurationEntrySchema {

  /** The key, dotted for nested files, e.g. "influxdb.host". */
  protected final String key;

  /** The type to convert values to. */
  protected final Class<?> type;

  /** The default, may be null. */
  protected final Object default_value;

  /** A helpful description. */
  protected final String description;

  /** Whether or not null values are allowed. */
  protected final boolean nullable;

  /** Whether or not to obfuscate the value. */
  protected final boolean secret;

  /**
   * Protected ctor used by the builder.
   * @param builder A non-null builder.
   * @throws IllegalArgumentException if the key, type or description was
   * missing or a primitive type had a null default.
   */
  protected ConfigurationEntrySchema(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (builder.type == null) {
      throw new IllegalArgumentException("Type cannot be null for: "
          + builder.key);
    }
    if (Strings.isNullOrEmpty(builder.description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty. Help the users!");
    }
    if (builder.type.isPrimitive() && builder.default_value == null) {
      throw new IllegalArgumentException("Primitive type " + builder.type
          + " requires a default value for: " + builder.key);
    }
    key = builder.key;
    type = builder.type;
    default_value = builder.default_value;
    description = builder.description;
    nullable = builder.nullable;
    secret = builder.secret;
  }

  /** @return The non-null key. */
  public String getKey() {
    return key;
  }

  /** @return The non-null type. */
  public Class<?> getType() {
    return type;
  }

  /** @return The default value, may be null. */
  public Object getDefaultValue() {
    return default_value;
  }

  /** @return The non-null description. */
  public String getDescription() {
    return description;
  }

  /** @return Whether or not the value may be null. */
  public boolean isNullable() {
    return nullable;
  }

  /** @return Whether or not the value should be hidden. */
  public boolean isSecret() {
    return secret;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("type", type.getSimpleName())
        .add("default", secret ? "********" : default_value)
        .add("nullable", nullable)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String key;
    private Class<?> type;
    private Object default_value;
    private String description;
    private boolean nullable;
    private boolean secret;

    public Builder setKey(final String key) {
      this.key = key;
      return this;
    }

    public Builder setType(final Class<?> type) {
      this.type = type;
      return this;
    }

    public Builder setDefaultValue(final Object default_value) {
      this.default_value = default_value;
      return this;
    }

    public Builder setDescription(final String description) {
      this.description = description;
      return this;
    }

    public Builder isNullable() {
      nullable = true;
      return this;
    }

    public Builder notNullable() {
      nullable = false;
      return this;
    }

    public Builder isSecret() {
      secret = true;
      return this;
    }

    public ConfigurationEntrySchema build() {
      return new ConfigurationEntrySchema(this);
    }
  }
}
