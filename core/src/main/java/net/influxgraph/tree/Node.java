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

import com.google.common.base.Strings;

/**
 * A node of the metric tree rebuilt from the flat series names: a
 * {@link BranchNode} with descendants or a fetchable {@link LeafNode}.
 * Nodes are created per query and never change.
 */
public abstract class Node implements Comparable<Node> {

  /** The full dotted path. */
  protected final String path;

  /** The last segment of the path. */
  protected final String name;

  /**
   * Default ctor.
   * @param path A non-null and non-empty path.
   * @throws IllegalArgumentException if the path was null or empty.
   */
  protected Node(final String path) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    this.path = path;
    name = path.substring(path.lastIndexOf('.') + 1);
  }

  /** @return The full dotted path. */
  public String path() {
    return path;
  }

  /** @return The last segment of the path. */
  public String name() {
    return name;
  }

  /** @return True if the node can be fetched. */
  public abstract boolean isLeaf();

  @Override
  public int compareTo(final Node other) {
    return path.compareTo(other.path);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return path.equals(((Node) o).path);
  }

  @Override
  public int hashCode() {
    return path.hashCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + path + "}";
  }
}
