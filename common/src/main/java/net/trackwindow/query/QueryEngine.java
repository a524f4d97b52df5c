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
package net.trackwindow.query;

import com.stumbleupon.async.Deferred;

/**
 * The backing store the track types query. Its dialect and table layout are
 * up to the implementation.
 *
 * @since 1.0
 */
public interface QueryEngine {

  /**
   * Executes a query asynchronously.
   * @param query The non-null query text.
   * @return A deferred resolving to the rows or an exception, usually a
   * {@link net.trackwindow.exceptions.QueryExecutionException}, if the query
   * failed.
   */
  public Deferred<QueryRows> execute(final String query);

}
