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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.io.Files;

import net.influxgraph.configuration.Configuration;
import net.influxgraph.configuration.ConfigurationEntrySchema;
import net.influxgraph.configuration.ConfigurationException;

public class TestYamlJsonFileProvider {

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void yamlNested() throws Exception {
    final File file = write("config.yaml",
          "influxdb:\n"
        + "  host: tsdb01\n"
        + "  port: 8087\n"
        + "  ssl: true\n"
        + "influxgraph:\n"
        + "  step: 10.5\n"
        + "  aggregation:\n"
        + "    rules:\n"
        + "      - pattern: \\.count$\n"
        + "        function: sum\n");
    try (final YamlJsonFileProvider provider =
        new YamlJsonFileProvider(file.getAbsolutePath())) {
      assertEquals(file.getAbsolutePath(), provider.source());
      assertEquals("tsdb01", provider.getSetting("influxdb.host"));
      assertEquals(8087L, provider.getSetting("influxdb.port"));
      assertEquals(true, provider.getSetting("influxdb.ssl"));
      assertEquals(10.5, (Double) provider.getSetting("influxgraph.step"),
          0.0001);

      final Object rules = provider.getSetting("influxgraph.aggregation.rules");
      assertTrue(rules instanceof JsonNode);
      assertTrue(((JsonNode) rules).isArray());
      assertEquals("sum", ((JsonNode) rules).get(0).get("function").asText());

      assertTrue(provider.getSetting("influxdb") instanceof JsonNode);
      assertNull(provider.getSetting("influxdb.nosuchkey"));
      assertNull(provider.getSetting("influxdb.host.deeper"));
      assertNull(provider.getSetting("nosuchkey"));

      // cached
      assertTrue(provider.cache.containsKey("influxdb.host"));
    }
  }

  @Test
  public void configurationFromFile() throws Exception {
    final File file = write("finder.yaml",
          "unittest:\n"
        + "  fromfile:\n"
        + "    port: 8087\n"
        + "    rules:\n"
        + "      - pattern: \\.count$\n"
        + "        function: sum\n");
    try (final Configuration config = Configuration.fromFile(
        file.getAbsolutePath())) {
      config.register("unittest.fromfile.port", 8086, "A port.");
      config.register("unittest.fromfile.host", "localhost", "A host.");
      config.register(ConfigurationEntrySchema.newBuilder()
          .setKey("unittest.fromfile.rules")
          .setType(Object.class)
          .isNullable()
          .setDescription("Some rules."));
      assertEquals(8087, config.getInt("unittest.fromfile.port"));
      assertEquals(file.getAbsolutePath(),
          config.getSource("unittest.fromfile.port"));
      assertEquals("localhost", config.getString("unittest.fromfile.host"));
      assertEquals(Configuration.DEFAULT_SOURCE,
          config.getSource("unittest.fromfile.host"));

      final List<Map<String, String>> rules = config.getTyped(
          "unittest.fromfile.rules",
          new TypeReference<List<Map<String, String>>>() { });
      assertEquals(1, rules.size());
      assertEquals("\\.count$", rules.get(0).get("pattern"));
      assertEquals("sum", rules.get(0).get("function"));
    }
  }

  @Test
  public void jsonDottedKeys() throws Exception {
    final File file = write("config.json",
        "{\"influxdb.host\":\"flat\",\"influxdb\":{\"db\":\"metrics\"}}");
    try (final YamlJsonFileProvider provider =
        new YamlJsonFileProvider(file.getAbsolutePath())) {
      assertEquals("flat", provider.getSetting("influxdb.host"));
      assertEquals("metrics", provider.getSetting("influxdb.db"));
    }
  }

  @Test
  public void missingFile() throws Exception {
    final String name = new File(folder.getRoot(), "nope.yaml")
        .getAbsolutePath();
    try (final YamlJsonFileProvider provider =
        new YamlJsonFileProvider(name)) {
      assertNull(provider.getSetting("influxdb.host"));
    }
  }

  @Test
  public void emptyFile() throws Exception {
    final File file = write("empty.json", "");
    try (final YamlJsonFileProvider provider =
        new YamlJsonFileProvider(file.getAbsolutePath())) {
      assertNull(provider.getSetting("influxdb.host"));
    }
  }

  @Test
  public void notAnObject() throws Exception {
    final File file = write("array.json", "[1, 2]");
    try {
      new YamlJsonFileProvider(file.getAbsolutePath());
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  @Test
  public void malformed() throws Exception {
    final File file = write("bad.json", "{\"influxdb\": ");
    try {
      new YamlJsonFileProvider(file.getAbsolutePath());
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  @Test
  public void ctorNullOrEmpty() throws Exception {
    try {
      new YamlJsonFileProvider(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new YamlJsonFileProvider(" ");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  private File write(final String name, final String content)
      throws Exception {
    final File file = folder.newFile(name);
    Files.asCharSink(file, StandardCharsets.UTF_8).write(content);
    return file;
  }
}
