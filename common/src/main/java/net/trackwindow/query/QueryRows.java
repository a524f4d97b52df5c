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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * A materialized query result: named columns and rows of values.
 *
 * @since 1.0
 */
public class QueryRows {
  /** An empty result without columns. */
  public static final QueryRows EMPTY = new QueryRows(
      Collections.<String>emptyList(), Collections.<Object[]>emptyList());

  private final List<String> columns;
  private final List<Object[]> rows;

  /**
   * Default ctor.
   * @param columns The non-null column names.
   * @param rows The non-null rows, each as wide as the column list.
   * @throws IllegalArgumentException if a row has the wrong width.
   */
  public QueryRows(final List<String> columns, final List<Object[]> rows) {
    if (columns == null) {
      throw new IllegalArgumentException("Columns cannot be null.");
    }
    if (rows == null) {
      throw new IllegalArgumentException("Rows cannot be null.");
    }
    for (final Object[] row : rows) {
      if (row == null || row.length != columns.size()) {
        throw new IllegalArgumentException("Row " + Arrays.toString(row)
            + " does not match the columns " + columns + ".");
      }
    }
    this.columns = ImmutableList.copyOf(columns);
    this.rows = Lists.newArrayList(rows);
  }

  /** @return The column names. */
  public List<String> columns() {
    return columns;
  }

  /** @return The number of rows. */
  public int size() {
    return rows.size();
  }

  /**
   * @param row A row index.
   * @param column A column name.
   * @return The raw value, may be null.
   */
  public Object get(final int row, final String column) {
    final int idx = columns.indexOf(column);
    if (idx < 0) {
      throw new IllegalArgumentException("No such column: " + column);
    }
    return rows.get(row)[idx];
  }

  public long getLong(final int row, final String column) {
    final Object value = get(row, column);
    if (value == null) {
      throw new IllegalStateException("Null value for " + column
          + " at row " + row);
    }
    return ((Number) value).longValue();
  }

  public double getDouble(final int row, final String column) {
    final Object value = get(row, column);
    if (value == null) {
      return Double.NaN;
    }
    return ((Number) value).doubleValue();
  }

  public String getString(final int row, final String column) {
    final Object value = get(row, column);
    return value == null ? null : value.toString();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("columns=")
        .append(columns)
        .append(", rows=")
        .append(rows.size())
        .toString();
  }
}
