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

import java.util.Collections;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * A single raw sample as stored: the series identifier, optional tags, the
 * timestamp in epoch seconds and the value. A null value is a sample the
 * store returned without a usable number.
 */
public class DataPoint {

  /** The series identifier, e.g. "sys.cpu.user". */
  private final String series;

  /** Tags, may be empty. */
  private final Map<String, String> tags;

  /** Unix epoch seconds. */
  private final long timestamp;

  /** The value, may be null. */
  private final Double value;

  /**
   * Ctor without tags.
   * @param series A non-null and non-empty series identifier.
   * @param timestamp The epoch timestamp in seconds.
   * @param value The value, may be null.
   * @throws IllegalArgumentException if the series was null or empty.
   */
  public DataPoint(final String series,
                   final long timestamp,
                   final Double value) {
    this(series, Collections.<String, String>emptyMap(), timestamp, value);
  }

  /**
   * Full ctor.
   * @param series A non-null and non-empty series identifier.
   * @param tags A map of tags, may be null or empty.
   * @param timestamp The epoch timestamp in seconds.
   * @param value The value, may be null.
   * @throws IllegalArgumentException if the series was null or empty.
   */
  public DataPoint(final String series,
                   final Map<String, String> tags,
                   final long timestamp,
                   final Double value) {
    if (Strings.isNullOrEmpty(series)) {
      throw new IllegalArgumentException("Series cannot be null or empty.");
    }
    this.series = series;
    this.tags = tags == null ? Collections.<String, String>emptyMap() :
      ImmutableMap.copyOf(tags);
    this.timestamp = timestamp;
    this.value = value;
  }

  /** @return The series identifier. */
  public String series() {
    return series;
  }

  /** @return The immutable tags, possibly empty. */
  public Map<String, String> tags() {
    return tags;
  }

  /** @return The timestamp in epoch seconds. */
  public long timestamp() {
    return timestamp;
  }

  /** @return The value, may be null. */
  public Double value() {
    return value;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DataPoint)) {
      return false;
    }
    final DataPoint other = (DataPoint) o;
    return timestamp == other.timestamp
        && series.equals(other.series)
        && tags.equals(other.tags)
        && Objects.equal(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(series, tags, timestamp, value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("series", series)
        .add("tags", tags)
        .add("timestamp", timestamp)
        .add("value", value)
        .toString();
  }
}
