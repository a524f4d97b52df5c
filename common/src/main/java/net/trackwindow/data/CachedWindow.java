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

/**
 * The result of one window fetch for a track: the span and resolution that
 * were requested, how many rows came back and the track specific payload.
 * Instances are immutable and replaced wholesale on every successful fetch.
 *
 * @param <P> The type of payload the track type produces.
 *
 * @since 1.0
 */
public final class CachedWindow<P> {
  private final long start;
  private final long end;
  private final long resolution;
  private final int row_count;
  private final P payload;

  protected CachedWindow(final Builder<P> builder) {
    if (builder.end < builder.start) {
      throw new IllegalArgumentException("End [" + builder.end
          + "] cannot be before start [" + builder.start + "].");
    }
    if (builder.resolution <= 0) {
      throw new IllegalArgumentException("Resolution must be positive.");
    }
    if (builder.rowCount < 0) {
      throw new IllegalArgumentException("Row count cannot be negative.");
    }
    start = builder.start;
    end = builder.end;
    resolution = builder.resolution;
    row_count = builder.rowCount;
    payload = builder.payload;
  }

  /** @return The start of the fetched span in nanoseconds. */
  public long start() {
    return start;
  }

  /** @return The end of the fetched span in nanoseconds. */
  public long end() {
    return end;
  }

  /** @return The resolution the data was fetched at, ns per pixel. */
  public long resolution() {
    return resolution;
  }

  /** @return The number of rows returned for the window. */
  public int rowCount() {
    return row_count;
  }

  /** @return The track specific payload, may be null. */
  public P payload() {
    return payload;
  }

  /**
   * @param limit The row limit the fetch was capped at.
   * @return True if the fetch hit the limit, i.e. more data exists than
   * was returned.
   */
  public boolean isSaturated(final int limit) {
    return row_count == limit;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append(", resolution=")
        .append(resolution)
        .append(", rowCount=")
        .append(row_count)
        .toString();
  }

  public static <P> Builder<P> newBuilder() {
    return new Builder<P>();
  }

  public static class Builder<P> {
    private long start;
    private long end;
    private long resolution;
    private int rowCount;
    private P payload;

    public Builder<P> setStart(final long start) {
      this.start = start;
      return this;
    }

    public Builder<P> setEnd(final long end) {
      this.end = end;
      return this;
    }

    public Builder<P> setResolution(final long resolution) {
      this.resolution = resolution;
      return this;
    }

    public Builder<P> setRowCount(final int row_count) {
      rowCount = row_count;
      return this;
    }

    public Builder<P> setPayload(final P payload) {
      this.payload = payload;
      return this;
    }

    public CachedWindow<P> build() {
      return new CachedWindow<P>(this);
    }
  }
}
