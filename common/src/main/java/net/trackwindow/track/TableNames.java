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
package net.trackwindow.track;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;

/**
 * Helpers to derive store identifiers from track IDs. Track IDs can be UUIDs
 * but '-' and friends aren't legal in table names.
 *
 * @since 1.0
 */
public final class TableNames {

  /** Characters allowed in an identifier of the backing store. */
  private static final CharMatcher LEGAL = CharMatcher.inRange('a', 'z')
      .or(CharMatcher.inRange('A', 'Z'))
      .or(CharMatcher.inRange('0', '9'))
      .or(CharMatcher.is('_'))
      .precomputed();

  private TableNames() { }

  /**
   * @param track_id A non-null, non-empty track ID.
   * @return The ID with every illegal character replaced by an underscore.
   */
  public static String sanitize(final String track_id) {
    if (Strings.isNullOrEmpty(track_id)) {
      throw new IllegalArgumentException("Track ID cannot be null or empty.");
    }
    return LEGAL.negate().replaceFrom(track_id, '_');
  }

  /**
   * @param prefix A non-null, non-empty table prefix.
   * @param track_id The track ID.
   * @return A table name unique to the track.
   */
  public static String tableName(final String prefix, final String track_id) {
    if (Strings.isNullOrEmpty(prefix)) {
      throw new IllegalArgumentException("Prefix cannot be null or empty.");
    }
    return prefix + "_" + sanitize(track_id);
  }

  /**
   * @param namespace An optional namespace.
   * @param table The table name.
   * @return The table prefixed with the namespace if one was given.
   */
  public static String namespaceTable(final String namespace,
                                      final String table) {
    if (Strings.isNullOrEmpty(namespace)) {
      return table;
    }
    return namespace + "_" + table;
  }
}
