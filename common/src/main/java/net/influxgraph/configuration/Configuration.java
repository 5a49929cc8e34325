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

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.primitives.Primitives;

import net.influxgraph.configuration.provider.EnvironmentProvider;
import net.influxgraph.configuration.provider.Provider;
import net.influxgraph.configuration.provider.SystemPropertiesProvider;
import net.influxgraph.configuration.provider.YamlJsonFileProvider;
import net.influxgraph.utils.JSON;

/**
 * The configuration for the finder and its store. Built once at start-up
 * from an ordered list of {@link Provider}s and handed to every component
 * constructor.
 * <p>
 * Components call one of the {@code register()} methods with the schema of
 * each key they read. On registration the providers are consulted from the
 * most significant (last) to the least significant (first) and the first
 * non-null value wins, falling back to the schema default. The value is
 * converted to the schema type once and never changes afterwards.
 * <p>
 * Reading a key that was never registered throws a
 * {@link ConfigurationException}.
 */
public class Configuration implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(
      Configuration.class);

  /** Source name used when no provider had a value. */
  public static final String DEFAULT_SOURCE = "default";

  /** Mapper used for type conversions. */
  public static final ObjectMapper OBJECT_MAPPER = JSON.getMapper();

  /** The providers, least to most significant. */
  protected final List<Provider> providers;

  /** The registered entries. */
  protected final Map<String, ConfigurationEntry> merged_config;

  /**
   * Ctor reading environment variables overridden by system properties.
   */
  public Configuration() {
    this(new EnvironmentProvider(), new SystemPropertiesProvider());
  }

  /**
   * Ctor with an explicit list of providers.
   * @param providers The providers ordered from least to most significant.
   * @throws IllegalArgumentException if a provider was null.
   */
  public Configuration(final Provider... providers) {
    if (providers == null) {
      throw new IllegalArgumentException("Providers cannot be null.");
    }
    for (final Provider provider : providers) {
      if (provider == null) {
        throw new IllegalArgumentException("Providers cannot contain nulls.");
      }
    }
    this.providers = ImmutableList.copyOf(providers);
    merged_config = Maps.newConcurrentMap();
    if (LOG.isDebugEnabled()) {
      final StringBuilder buf = new StringBuilder();
      for (final Provider provider : this.providers) {
        if (buf.length() > 0) {
          buf.append(", ");
        }
        buf.append(provider.source());
      }
      LOG.debug("Loaded configuration providers [" + buf + "]");
    }
  }

  /**
   * Builds a configuration from the given YAML or JSON file overridden by
   * environment variables and then system properties.
   * @param file_name A non-null file name.
   * @return A non-null configuration.
   * @throws ConfigurationException if the file could not be parsed.
   */
  public static Configuration fromFile(final String file_name) {
    return new Configuration(
        new YamlJsonFileProvider(file_name),
        new EnvironmentProvider(),
        new SystemPropertiesProvider());
  }

  /**
   * Helper to register a schema builder.
   * See {@link #register(ConfigurationEntrySchema)}
   * @param builder A non-null builder.
   */
  public void register(final ConfigurationEntrySchema.Builder builder) {
    if (builder == null) {
      throw new IllegalArgumentException("Builder cannot be null.");
    }
    register(builder.build());
  }

  /**
   * Registers the schema and resolves its value from the providers.
   *
   * @param schema A non-null schema fully configured.
   * @throws IllegalArgumentException if the given schema was null.
   * @throws ConfigurationException if the schema was already registered or
   * the value could not be converted to the schema type.
   */
  public void register(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }

    Object value = null;
    String source = DEFAULT_SOURCE;
    for (int i = providers.size() - 1; i >= 0; i--) {
      final Object setting = providers.get(i).getSetting(schema.getKey());
      if (setting != null) {
        value = setting;
        source = providers.get(i).source();
        break;
      }
    }
    if (value == null) {
      value = schema.getDefaultValue();
    }
    if (value == null && !schema.isNullable()) {
      throw new ConfigurationException("Null value not allowed for key: "
          + schema.getKey());
    }

    final ConfigurationEntry entry = new ConfigurationEntry(schema,
        coerce(schema, value), source);
    final ConfigurationEntry extant = merged_config.putIfAbsent(
        schema.getKey(), entry);
    if (extant != null) {
      throw new ConfigurationException("Schema already exists for "
          + "key: " + schema.getKey());
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered " + entry);
    }
  }

  /**
   * Registers a nullable {@link String} schema.
   *
   * @param key A non-null and non-empty key.
   * @param default_value A default value, may be null.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was
   * null or empty.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final String default_value,
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setDefaultValue(default_value)
        .setType(String.class)
        .isNullable()
        .setDescription(description));
  }

  /**
   * Registers an {@code int} schema.
   *
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was
   * null or empty.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final int default_value,
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setDefaultValue(default_value)
        .setType(int.class)
        .notNullable()
        .setDescription(description));
  }

  /**
   * Registers a {@code long} schema.
   *
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was
   * null or empty.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final long default_value,
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setDefaultValue(default_value)
        .setType(long.class)
        .notNullable()
        .setDescription(description));
  }

  /**
   * Registers a {@code boolean} schema.
   *
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was
   * null or empty.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final String key,
                       final boolean default_value,
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setDefaultValue(default_value)
        .setType(boolean.class)
        .notNullable()
        .setDescription(description));
  }

  /**
   * Returns the given config value cast to the given type (if possible).
   *
   * @param key The non-null and non-empty config key entry.
   * @param type A non-null class to cast to.
   * @return The value found, may be null if set to null for non-primitive
   * types.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key was not registered or the
   * value could not be converted.
   */
  @SuppressWarnings("unchecked")
  public <T> T getTyped(final String key, final Class<T> type) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    final Object value = entry(key).getValue();
    if (value == null) {
      if (type.isPrimitive()) {
        throw new ConfigurationException("Cannot cast null to a "
            + "primitive type: " + type);
      }
      return null;
    }

    final Class<?> wrapped = Primitives.wrap(type);
    if (wrapped.isInstance(value)) {
      return (T) value;
    }
    try {
      return (T) OBJECT_MAPPER.convertValue(value, wrapped);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unable to convert the value for key "
          + key + " to " + type, e);
    }
  }

  /**
   * Returns the given config value converted with Jackson. Use this for
   * lists, maps and POJOs. String values, e.g. from environment variables,
   * are parsed as JSON first.
   *
   * @param key The non-null and non-empty config key entry.
   * @param type A non-null type reference.
   * @return The value found, may be null.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key was not registered or the
   * value could not be converted.
   */
  public <T> T getTyped(final String key, final TypeReference<T> type) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    Object value = entry(key).getValue();
    if (value == null) {
      return null;
    }
    try {
      if (value instanceof String) {
        value = OBJECT_MAPPER.readTree((String) value);
      }
      return OBJECT_MAPPER.convertValue(value, type);
    } catch (IOException | IllegalArgumentException e) {
      throw new ConfigurationException("Unable to convert the value for key "
          + key + " to " + type.getType(), e);
    }
  }

  /**
   * Returns the value, if found, as a string.
   *
   * @param key The non-null and non-empty config key entry.
   * @return A String if the entry had a value, null if it was set to null.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config.
   */
  public String getString(final String key) {
    final Object value = entry(key).getValue();
    return value == null ? null : value.toString();
  }

  /**
   * Returns the value as an integer when possible.
   *
   * @param key A non-null and non-empty key.
   * @return An integer value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config or the value was null.
   */
  public int getInt(final String key) {
    final Integer value = getTyped(key, Integer.class);
    if (value == null) {
      throw new ConfigurationException("Null value for key: " + key);
    }
    return value;
  }

  /**
   * Returns the value as a long integer when possible.
   *
   * @param key A non-null and non-empty key.
   * @return A long integer value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config or the value was null.
   */
  public long getLong(final String key) {
    final Long value = getTyped(key, Long.class);
    if (value == null) {
      throw new ConfigurationException("Null value for key: " + key);
    }
    return value;
  }

  /**
   * Checks to see if the value of the key is true or false. Nulls count
   * as false and only the values in the set [true, 1, yes] count as
   * true (cast to lower case in string form).
   *
   * @param key A non-null and non-empty key.
   * @return A boolean value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config.
   */
  public boolean getBoolean(final String key) {
    return parseBoolean(entry(key).getValue());
  }

  /**
   * Determines if the given key has been registered.
   *
   * @param key A non-null and no-empty key.
   * @return True if the key was registered, false if not and calls
   * to read methods would throw an exception.
   * @throws IllegalArgumentException if the key was null or empty.
   */
  public boolean hasProperty(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return merged_config.containsKey(key);
  }

  /**
   * @param key A non-null and non-empty key.
   * @return The name of the provider that supplied the value or
   * {@link #DEFAULT_SOURCE}.
   * @throws ConfigurationException if the key was not registered.
   */
  public String getSource(final String key) {
    return entry(key).source();
  }

  /** @return The providers, least to most significant. */
  public List<Provider> providers() {
    return providers;
  }

  @Override
  public void close() throws IOException {
    IOException first = null;
    for (final Provider provider : providers) {
      try {
        provider.close();
      } catch (IOException e) {
        LOG.error("Failed to close provider: " + provider.source(), e);
        if (first == null) {
          first = e;
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }

  @Override
  public String toString() {
    final Map<String, Object> sorted = new TreeMap<String, Object>();
    for (final ConfigurationEntry entry : merged_config.values()) {
      sorted.put(entry.schema().getKey(),
          entry.schema().isSecret() && entry.getValue() != null ?
              "********" : entry.getValue());
    }
    return "Configuration" + Collections.unmodifiableMap(sorted);
  }

  /**
   * Finds the entry or throws.
   * @param key The key.
   * @return The non-null entry.
   */
  protected ConfigurationEntry entry(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final ConfigurationEntry entry = merged_config.get(key);
    if (entry == null) {
      throw new ConfigurationException("No registration found for key: " + key);
    }
    return entry;
  }

  /**
   * Converts raw provider values (often strings) to the schema type.
   * Complex types are left as is for {@link #getTyped(String, TypeReference)}.
   * @param schema The non-null schema.
   * @param value The value, may be null.
   * @return The converted value.
   * @throws ConfigurationException if conversion failed.
   */
  static Object coerce(final ConfigurationEntrySchema schema,
                       final Object value) {
    if (value == null) {
      return null;
    }
    final Class<?> type = Primitives.wrap(schema.getType());
    if (type.isInstance(value)) {
      return value;
    }
    if (type == Boolean.class) {
      return parseBoolean(value);
    }
    if (type == String.class) {
      return value.toString();
    }
    if (type == Integer.class || type == Long.class) {
      try {
        final long parsed = value instanceof Number ?
            ((Number) value).longValue() :
            Long.parseLong(value.toString().trim());
        if (type == Long.class) {
          return parsed;
        }
        if (parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
          throw new ConfigurationException("Value " + value + " for key "
              + schema.getKey() + " does not fit in an integer.");
        }
        return (int) parsed;
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Value " + value + " for key "
            + schema.getKey() + " is not a number.", e);
      }
    }
    if (type == Object.class) {
      return value;
    }
    try {
      return OBJECT_MAPPER.convertValue(value, type);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unable to convert the value for key "
          + schema.getKey() + " to " + type, e);
    }
  }

  /**
   * Nulls count as false and only [true, 1, yes] count as true.
   * @param value The value.
   * @return The boolean.
   */
  static boolean parseBoolean(final Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    final String bool = value.toString().toLowerCase().trim();
    return bool.equals("true") || bool.equals("1") || bool.equals("yes");
  }
}
