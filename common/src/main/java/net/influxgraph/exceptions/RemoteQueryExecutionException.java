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
 * A failure reported by, or while talking to, the metric store: transport
 * errors, non-success HTTP codes and error payloads.
 */
public class RemoteQueryExecutionException extends QueryExecutionException {
  private static final long serialVersionUID = 4469201551097420987L;

  /** A description of the remote service that threw the exception. */
  private final String remote_endpoint;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this exception.
   * @param status_code An optional status code reflecting the error state.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code) {
    this(msg, remote_endpoint, status_code, null);
  }

  /**
   * Ctor setting a message, status code and exception.
   * @param msg A non-null message to be given.
   * @param remote_endpoint A description of the remote that threw this exception.
   * @param status_code An optional status code reflecting the error state.
   * @param e The original exception that caused this to be thrown.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code,
                                       final Exception e) {
    super(msg, status_code, e);
    this.remote_endpoint = remote_endpoint;
  }

  /** @return The remote endpoint. */
  public String getRemoteEndpoint() {
    return remote_endpoint;
  }

  @Override
  public String toString() {
    return super.toString() + " remote=" + remote_endpoint;
  }
}
