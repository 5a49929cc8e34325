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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.google.common.collect.Maps;
import com.google.common.io.Files;

import net.influxgraph.configuration.ConfigurationException;
import net.influxgraph.utils.JSON;

/**
 * Handles parsing of JSON or YAML formatted files. Supports dotted paths
 * as long as each sub-path is an object, so
 * <pre>
 * influxdb:
 *   host: tsdb01
 * </pre>
 * answers the key "influxdb.host". Lists and maps are returned as
 * {@link JsonNode}s for the configuration to convert.
 * <p>
 * A missing file is logged and treated as empty. A file that can't be
 * parsed fails with a {@link ConfigurationException}.
 */
public class YamlJsonFileProvider implements Provider {
  private static final Logger LOG = LoggerFactory.getLogger(
      YamlJsonFileProvider.class);

  /** The file name. */
  protected final String file_name;

  /** The cache of entries resolved so far. */
  protected final Map<String, Object> cache;

  /** The parsed root, null if the file was missing. */
  protected final JsonNode root;

  /**
   * Default ctor.
   * @param file_name The non-null path to a ".yaml", ".yml" or ".json" file.
   * @throws IllegalArgumentException if the file name was null or empty.
   * @throws ConfigurationException if the file existed but could not be
   * parsed.
   */
  public YamlJsonFileProvider(final String file_name) {
    if (file_name == null || file_name.trim().isEmpty()) {
      throw new IllegalArgumentException("File name cannot be null or empty.");
    }
    this.file_name = file_name;
    cache = Maps.newConcurrentMap();
    root = load();
  }

  @Override
  public Object getSetting(final String key) {
    if (root == null) {
      return null;
    }
    Object value = cache.get(key);
    if (value != null) {
      return value;
    }

    // try the literal key first, e.g. a top level "influxdb.host" entry
    final JsonNode literal = root.get(key);
    if (literal != null) {
      value = convert(literal);
    } else {
      final String[] path = key.split("\\.");
      if (path.length < 2) {
        return null;
      }
      value = recursiveGet(path, 0, root);
    }
    if (value != null) {
      cache.put(key, value);
    }
    return value;
  }

  @Override
  public String source() {
    return file_name;
  }

  @Override
  public void close() throws IOException {
    // no-op
  }

  /**
   * Walks down the objects following the path.
   * @param path The split key.
   * @param idx The current depth.
   * @param node The current node.
   * @return The value when found, null if not.
   */
  Object recursiveGet(final String[] path, final int idx, final JsonNode node) {
    if (idx >= path.length) {
      return convert(node);
    }
    if (node.getNodeType() != JsonNodeType.OBJECT) {
      return null;
    }
    final JsonNode child = node.get(path[idx]);
    if (child == null || child.isNull()) {
      return null;
    }
    return recursiveGet(path, idx + 1, child);
  }

  /**
   * Converts scalars to Java types and leaves containers as nodes.
   * @param node A non-null node.
   * @return The value, null for null nodes.
   */
  static Object convert(final JsonNode node) {
    switch (node.getNodeType()) {
    case STRING:
      return node.asText();
    case BOOLEAN:
      return node.asBoolean();
    case NULL:
      return null;
    case NUMBER:
      if (node.isIntegralNumber()) {
        return node.asLong();
      }
      return node.asDouble();
    default:
      return node;
    }
  }

  /**
   * Reads and parses the file.
   * @return The root object or null if the file was missing.
   */
  private JsonNode load() {
    final File file = new File(file_name);
    if (!file.exists()) {
      LOG.warn("No file found at: " + file_name);
      return null;
    }

    try (final InputStream stream = Files.asByteSource(file).openStream()) {
      final JsonNode node = file_name.toLowerCase().endsWith(".json") ?
          JSON.getMapper().readTree(stream) :
          JSON.getYamlMapper().readTree(stream);
      if (node == null || node.isMissingNode() || node.isNull()) {
        LOG.warn("The file was empty: " + file_name);
        return null;
      }
      if (!node.isObject()) {
        throw new ConfigurationException("The file must contain an object/map "
            + "of key values: " + file_name + ". Type: " + node.getNodeType());
      }
      if (LOG.isDebugEnabled()) {
        final Iterator<Entry<String, JsonNode>> iterator = node.fields();
        final StringBuilder buf = new StringBuilder();
        while (iterator.hasNext()) {
          if (buf.length() > 0) {
            buf.append(", ");
          }
          buf.append(iterator.next().getKey());
        }
        LOG.debug("Loaded top level keys [" + buf + "] from " + file_name);
      }
      return node;
    } catch (IOException e) {
      throw new ConfigurationException("Failed to open or parse config file: "
          + file_name, e);
    }
  }
}
