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
package net.influxgraph.finder;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import net.influxgraph.configuration.ConfigurationException;

/**
 * Applies the configured verbosity to the project's loggers. SLF4J doesn't
 * provide any API to set the level of the underlying logging library so we
 * reach into Logback.
 */
final class LogLevels {
  private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(
      LogLevels.class);

  /** The logger all project classes inherit from. */
  static final String BASE_LOGGER = "net.influxgraph";

  private LogLevels() {
    // static helpers only
  }

  /**
   * Sets the level of the {@link #BASE_LOGGER}.
   * @param level A level name, e.g. "debug". Case insensitive.
   * @return True if applied, false if the binding was not Logback.
   * @throws ConfigurationException if the level was not valid.
   */
  static boolean apply(final String level) {
    final Level parsed = level == null ? null :
      Level.toLevel(level.trim(), null);
    if (parsed == null) {
      throw new ConfigurationException("Invalid log level: " + level);
    }
    final org.slf4j.Logger logger = LoggerFactory.getLogger(BASE_LOGGER);
    if (!(logger instanceof Logger)) {
      LOG.warn("Unable to set the log level to " + parsed + " as the SLF4J "
          + "binding is " + logger.getClass().getName() + ", not Logback.");
      return false;
    }
    ((Logger) logger).setLevel(parsed);
    LOG.info("Set the log level of " + BASE_LOGGER + " to " + parsed);
    return true;
  }
}
