// This file is part of TrackWindow.
// Copyright (C) 2019  The TrackWindow Authors.
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
package net.trackwindow.exceptions;

/**
 * Thrown or returned by a query engine when a query could not be executed.
 *
 * @since 1.0
 */
public class QueryExecutionException extends RuntimeException {
  /** Serial for this exception. Auto generated. */
  private static final long serialVersionUID = -4203358131297485537L;

  /** The query that failed, may be null. */
  private final String query;

  public QueryExecutionException(final String msg, final String query) {
    super(msg);
    this.query = query;
  }

  public QueryExecutionException(final String msg, final String query,
                                 final Throwable cause) {
    super(msg, cause);
    this.query = query;
  }

  /** @return The query that failed, may be null. */
  public String getQuery() {
    return query;
  }
}
