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
package net.influxgraph.storage.influx;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import net.influxgraph.data.DataPoint;

public class TestInfluxQL {

  @Test
  public void showMeasurements() throws Exception {
    assertEquals("SHOW MEASUREMENTS", InfluxQL.showMeasurements(null));
    assertEquals("SHOW MEASUREMENTS", InfluxQL.showMeasurements(""));
    assertEquals("SHOW MEASUREMENTS WITH MEASUREMENT =~ /^a\\.b/",
        InfluxQL.showMeasurements("^a\\.b"));
  }

  @Test
  public void selectValues() throws Exception {
    assertEquals("SELECT value FROM /^(?:a\\.b|a\\.c)$/ WHERE "
        + "time >= 1000s AND time <= 2000s",
        InfluxQL.selectValues("^(?:a\\.b|a\\.c)$", 1000, 2000));
  }

  @Test
  public void regexLiteral() throws Exception {
    assertEquals("/^a\\/b$/", InfluxQL.regexLiteral("^a/b$"));
    // already escaped slashes are kept
    assertEquals("/^a\\/b$/", InfluxQL.regexLiteral("^a\\/b$"));
    assertEquals("/a\\.b/", InfluxQL.regexLiteral("a\\.b"));
  }

  @Test
  public void appendLine() throws Exception {
    StringBuilder buf = new StringBuilder();
    InfluxQL.appendLine(buf, new DataPoint("sys.cpu.user", 1000, 42.5));
    assertEquals("sys.cpu.user value=42.5 1000", buf.toString());

    buf = new StringBuilder();
    InfluxQL.appendLine(buf, new DataPoint("my series,x",
        ImmutableMap.of("zone", "us east", "host", "web=01"), 1000, 1.0));
    assertEquals("my\\ series\\,x,host=web\\=01,zone=us\\ east value=1.0 1000",
        buf.toString());
  }
}
