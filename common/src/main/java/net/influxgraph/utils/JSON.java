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
package net.influxgraph.utils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Static initialization and configuration of the Jackson mappers shared
 * throughout the project. The mappers are thread safe and fairly costly to
 * build so the Jackson docs recommend one per application.
 * <p>
 * For streaming access use the mappers directly via {@link #getMapper()} or
 * {@link #getYamlMapper()}.
 */
public final class JSON {
  /** Jackson de/serializer initialized, configured and shared. */
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  /** The YAML flavor for configuration files. */
  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory());
  static {
    // InfluxDB may return NaN and Infinity literals.
    JSON_MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    JSON_MAPPER.configure(
        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    YAML_MAPPER.configure(
        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private JSON() {
    // static helpers only
  }

  /**
   * Parses the string into a tree.
   * @param json A non-null and non-empty JSON string.
   * @return The root node.
   * @throws IllegalArgumentException if the string was null, empty or not
   * valid JSON.
   */
  public static JsonNode parseToTree(final String json) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    try {
      return JSON_MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
  }

  /** @return The shared JSON mapper. */
  public static ObjectMapper getMapper() {
    return JSON_MAPPER;
  }

  /** @return The shared YAML mapper. */
  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }
}
