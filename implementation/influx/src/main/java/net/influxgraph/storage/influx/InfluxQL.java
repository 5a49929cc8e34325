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

import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import com.google.common.base.Strings;

import net.influxgraph.data.DataPoint;

/**
 * Builds the InfluxQL statements and line protocol records the store
 * sends. Series are stored as measurements with a single "value" field.
 */
public final class InfluxQL {

  /** The field holding the point value. */
  public static final String VALUE_FIELD = "value";

  private InfluxQL() {
    // static helpers only
  }

  /**
   * @param regex An optional regular expression, searched against the
   * measurement names.
   * @return The statement listing the measurements.
   */
  public static String showMeasurements(final String regex) {
    if (Strings.isNullOrEmpty(regex)) {
      return "SHOW MEASUREMENTS";
    }
    return "SHOW MEASUREMENTS WITH MEASUREMENT =~ " + regexLiteral(regex);
  }

  /**
   * @param regex A non-null regular expression selecting measurements.
   * @param start The inclusive start epoch in seconds.
   * @param end The inclusive end epoch in seconds.
   * @return The statement selecting the values in the window.
   */
  public static String selectValues(final String regex,
                                    final long start,
                                    final long end) {
    return new StringBuilder()
        .append("SELECT ")
        .append(VALUE_FIELD)
        .append(" FROM ")
        .append(regexLiteral(regex))
        .append(" WHERE time >= ")
        .append(start)
        .append("s AND time <= ")
        .append(end)
        .append('s')
        .toString();
  }

  /**
   * Wraps the expression in slashes, escaping the slashes it contains.
   * @param regex A non-null regular expression.
   * @return The InfluxQL regex literal.
   */
  public static String regexLiteral(final String regex) {
    final StringBuilder buf = new StringBuilder(regex.length() + 4);
    buf.append('/');
    for (int i = 0; i < regex.length(); i++) {
      final char c = regex.charAt(i);
      if (c == '\\' && i + 1 < regex.length()) {
        // keep escape pairs intact so "\/" isn't escaped twice
        buf.append(c).append(regex.charAt(++i));
        continue;
      }
      if (c == '/') {
        buf.append('\\');
      }
      buf.append(c);
    }
    return buf.append('/').toString();
  }

  /**
   * Appends one line protocol record for the point. Tags are written in
   * key order.
   * @param buf A non-null buffer.
   * @param point A point with a finite, non-null value.
   */
  public static void appendLine(final StringBuilder buf,
                                final DataPoint point) {
    escape(buf, point.series(), false);
    if (!point.tags().isEmpty()) {
      final Map<String, String> sorted =
          new TreeMap<String, String>(point.tags());
      for (final Entry<String, String> tag : sorted.entrySet()) {
        buf.append(',');
        escape(buf, tag.getKey(), true);
        buf.append('=');
        escape(buf, tag.getValue(), true);
      }
    }
    buf.append(' ')
       .append(VALUE_FIELD)
       .append('=')
       .append(point.value().doubleValue())
       .append(' ')
       .append(point.timestamp());
  }

  /**
   * Escapes commas and spaces, and for tags equals signs as well.
   */
  static void escape(final StringBuilder buf,
                     final String value,
                     final boolean tag) {
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (c == ',' || c == ' ' || (tag && c == '=')) {
        buf.append('\\');
      }
      buf.append(c);
    }
  }
}
