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

/**
 * A path with at least one stored series below it. Not fetchable.
 */
public class BranchNode extends Node {

  /**
   * Default ctor.
   * @param path A non-null and non-empty path.
   */
  public BranchNode(final String path) {
    super(path);
  }

  @Override
  public boolean isLeaf() {
    return false;
  }
}
