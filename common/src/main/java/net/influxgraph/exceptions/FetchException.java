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
 * Thrown when points could not be fetched from the store. A batched fetch
 * fails as a whole, there are never partial results alongside this.
 */
public class FetchException extends QueryExecutionException {
  private static final long serialVersionUID = -1688437390712208364L;

  /**
   * Ctor wrapping the store failure.
   * @param msg A non-null message.
   * @param status_code The status code of the cause, 0 if unknown.
   * @param e The cause.
   */
  public FetchException(final String msg,
                        final int status_code,
                        final Exception e) {
    super(msg, status_code, e);
  }

  /**
   * Wraps the store failure, keeping its status code when it has one.
   * @param msg A non-null message.
   * @param e The non-null cause.
   * @return The exception.
   */
  public static FetchException wrap(final String msg, final Exception e) {
    return new FetchException(msg, e instanceof QueryExecutionException ?
        ((QueryExecutionException) e).getStatusCode() : 0, e);
  }
}
