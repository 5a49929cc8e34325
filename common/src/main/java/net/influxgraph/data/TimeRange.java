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
package net.influxgraph.data;

/**
 * The grid every returned series is aligned on: {@code start} and
 * {@code end} in epoch seconds, both inclusive, and the {@code step} between
 * slots in seconds. There are {@code ((end - start) / step) + 1} slots.
 */
public class TimeRange {

  private final long start;
  private final long end;
  private final long step;

  /**
   * Default ctor.
   * @param start The start epoch in seconds.
   * @param end The end epoch in seconds, at or after start.
   * @param step The step in seconds, greater than zero.
   * @throws IllegalArgumentException if end was before start, the step
   * was not positive or the range would hold more than
   * {@link Integer#MAX_VALUE} slots.
   */
  public TimeRange(final long start, final long end, final long step) {
    if (end < start) {
      throw new IllegalArgumentException("End " + end
          + " cannot be before the start " + start);
    }
    if (step <= 0) {
      throw new IllegalArgumentException("Step must be greater than zero: "
          + step);
    }
    final long span = end - start;
    if (span < 0 || span / step >= Integer.MAX_VALUE) {
      throw new IllegalArgumentException("The window from " + start
          + " to " + end + " is too wide for a step of " + step + "s");
    }
    this.start = start;
    this.end = end;
    this.step = step;
  }

  /** @return The start epoch in seconds. */
  public long start() {
    return start;
  }

  /** @return The end epoch in seconds. */
  public long end() {
    return end;
  }

  /** @return The step in seconds. */
  public long step() {
    return step;
  }

  /** @return The number of slots. */
  public int steps() {
    return (int) (((end - start) / step) + 1);
  }

  /**
   * @param timestamp A timestamp in epoch seconds.
   * @return The slot index for the timestamp or -1 if it is outside the
   * range.
   */
  public int index(final long timestamp) {
    if (timestamp < start || timestamp > end) {
      return -1;
    }
    return (int) ((timestamp - start) / step);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeRange)) {
      return false;
    }
    final TimeRange other = (TimeRange) o;
    return start == other.start && end == other.end && step == other.step;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(start) * 31 * 31
        + Long.hashCode(end) * 31
        + Long.hashCode(step);
  }

  @Override
  public String toString() {
    return "(" + start + ", " + end + ", " + step + ")";
  }
}
