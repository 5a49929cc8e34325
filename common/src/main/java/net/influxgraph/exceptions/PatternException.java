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
package net.influxgraph.exceptions;

/**
 * A malformed glob pattern. Raised while compiling and passed to the caller
 * untouched.
 */
public class PatternException extends IllegalArgumentException {
  private static final long serialVersionUID = 7850316237906421135L;

  /** The offending pattern. */
  private final String pattern;

  /** Index of the offending character, -1 if not applicable. */
  private final int index;

  /**
   * Default ctor.
   * @param msg A non-null message.
   * @param pattern The pattern that failed.
   * @param index The index of the offending character or -1.
   */
  public PatternException(final String msg,
                          final String pattern,
                          final int index) {
    super(msg + (index >= 0 ? " at index " + index : "")
        + " in pattern: " + pattern);
    this.pattern = pattern;
    this.index = index;
  }

  /** @return The offending pattern. */
  public String getPattern() {
    return pattern;
  }

  /** @return The index of the offending character or -1. */
  public int getIndex() {
    return index;
  }
}
