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

import net.influxgraph.reader.Reader;

/**
 * A stored series, bound to the {@link Reader} that fetches it.
 */
public class LeafNode extends Node {

  /** The reader for this series. */
  private final Reader reader;

  /**
   * Default ctor.
   * @param path A non-null and non-empty path.
   * @param reader A non-null reader bound to the same path.
   * @throws IllegalArgumentException if the reader was null or bound to
   * another path.
   */
  public LeafNode(final String path, final Reader reader) {
    super(path);
    if (reader == null) {
      throw new IllegalArgumentException("Reader cannot be null.");
    }
    if (!path.equals(reader.path())) {
      throw new IllegalArgumentException("Reader for " + reader.path()
          + " cannot be bound to " + path);
    }
    this.reader = reader;
  }

  /** @return The reader. */
  public Reader reader() {
    return reader;
  }

  @Override
  public boolean isLeaf() {
    return true;
  }
}
