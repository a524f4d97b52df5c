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
package net.trackwindow.data;

import com.google.common.base.Objects;

/**
 * An immutable span of trace time in nanoseconds, start inclusive. Used both
 * for the span the host wants visualized and the span of a whole trace.
 *
 * @since 1.0
 */
public final class ViewWindow {
  private final long start;
  private final long end;

  /**
   * Default ctor.
   * @param start The start timestamp in nanoseconds.
   * @param end The end timestamp in nanoseconds, must be >= start.
   * @throws IllegalArgumentException if the end is before the start.
   */
  public ViewWindow(final long start, final long end) {
    if (end < start) {
      throw new IllegalArgumentException("End [" + end
          + "] cannot be before start [" + start + "].");
    }
    this.start = start;
    this.end = end;
  }

  /** @return The start timestamp in nanoseconds. */
  public long start() {
    return start;
  }

  /** @return The end timestamp in nanoseconds. */
  public long end() {
    return end;
  }

  /** @return The width of the window in nanoseconds. */
  public long duration() {
    return end - start;
  }

  /**
   * @param other_start A start timestamp.
   * @param other_end An end timestamp.
   * @return True if [other_start, other_end] lies within this window.
   */
  public boolean contains(final long other_start, final long other_end) {
    return other_start >= start && other_end <= end;
  }

  /**
   * @return A window padded by one duration on each side. Used to fetch more
   * than is visible so small pans don't need a new query.
   */
  public ViewWindow expand() {
    final long duration = duration();
    return new ViewWindow(start - duration, end + duration);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ViewWindow)) {
      return false;
    }
    final ViewWindow other = (ViewWindow) o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(start, end);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("start=")
        .append(start)
        .append(", end=")
        .append(end)
        .toString();
  }
}
