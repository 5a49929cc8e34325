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

import java.util.Collections;
import java.util.List;

/**
 * Base exception for failures while looking up series or fetching their
 * points. Carries a status code so the hosting browser can map it to its
 * own error reporting.
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = -5371902873049122486L;

  /** A status code associated with the exception. The code value depends
   * on the remote source, e.g. an HTTP status. 0 if unknown. */
  protected final int status_code;

  /** An optional list of exceptions thrown. */
  protected final List<Exception> exceptions;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    this(msg, status_code, (Exception) null);
  }

  /**
   * Ctor that sets a descriptive message, status code and the cause.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param e The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final Exception e) {
    super(msg, e);
    this.status_code = status_code;
    exceptions = null;
  }

  /**
   * Ctor that takes a descriptive message, status_code and optional list
   * of exceptions that triggered this.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param exceptions An optional list of exceptions. May be null or empty.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final List<Exception> exceptions) {
    super(msg);
    this.status_code = status_code;
    this.exceptions = exceptions;
  }

  /** @return An optional status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }

  /** @return A list of exceptions that triggered this or an empty list. */
  public List<Exception> getExceptions() {
    return exceptions == null ? Collections.<Exception>emptyList() :
      Collections.<Exception>unmodifiableList(exceptions);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass().getName())
        .append(": ")
        .append(getMessage());
    if (status_code != 0) {
      buf.append(" status=")
         .append(status_code);
    }
    if (exceptions != null) {
      buf.append(" subExceptions[");
      for (int i = 0; i < exceptions.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        buf.append(exceptions.get(i).toString());
      }
      buf.append("]");
    }
    return buf.toString();
  }
}
