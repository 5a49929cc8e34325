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
package net.influxgraph.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.influxgraph.aggregation.Aggregators;
import net.influxgraph.reader.Reader;
import net.influxgraph.reader.StepPolicy;
import net.influxgraph.storage.MemoryMetricStore;

public class TestNode {

  @Test
  public void branch() throws Exception {
    final BranchNode node = new BranchNode("servers.web01");
    assertEquals("servers.web01", node.path());
    assertEquals("web01", node.name());
    assertFalse(node.isLeaf());

    final BranchNode root = new BranchNode("servers");
    assertEquals("servers", root.name());

    try {
      new BranchNode("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new BranchNode(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void leaf() throws Exception {
    final Reader reader = new Reader(new MemoryMetricStore(), "a.b.cpu",
        Aggregators.MEAN, new StepPolicy(60));
    final LeafNode node = new LeafNode("a.b.cpu", reader);
    assertEquals("cpu", node.name());
    assertTrue(node.isLeaf());
    assertSame(reader, node.reader());

    try {
      new LeafNode("a.b.mem", reader);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new LeafNode("a.b.cpu", null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void equalsAndOrder() throws Exception {
    assertEquals(new BranchNode("a.b"), new BranchNode("a.b"));
    assertNotEquals(new BranchNode("a.b"), new BranchNode("a.c"));
    assertTrue(new BranchNode("a.b").compareTo(new BranchNode("a.c")) < 0);
    final Reader reader = new Reader(new MemoryMetricStore(), "a.b",
        Aggregators.MEAN, new StepPolicy(60));
    assertNotEquals(new BranchNode("a.b"), new LeafNode("a.b", reader));
  }
}
