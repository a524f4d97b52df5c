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

import com.google.common.base.Objects;

/**
 * Whether a track should materialize a pre-aggregated table and, if so,
 * the smallest bucket width (in ns) that table must serve.
 *
 * @since 1.0
 */
public final class CacheSizingResult {

  public static enum Kind {
    /** The source table is small enough to query directly. */
    NO_CACHE,

    /** A bucketed cache serving requests at or above the bucket width. */
    BUCKET_WIDTH,

    /** Too few resolution levels in the trace for a cache to pay off. */
    ALL_RESOLUTIONS
  }

  /** Caching isn't worthwhile. */
  public static final CacheSizingResult NO_CACHE =
      new CacheSizingResult(Kind.NO_CACHE, 0);

  /** Bucket width is the maximum duration, covering every resolution level. */
  public static final CacheSizingResult ALL_RESOLUTIONS =
      new CacheSizingResult(Kind.ALL_RESOLUTIONS, Long.MAX_VALUE);

  private final Kind kind;
  private final long bucket_width;

  private CacheSizingResult(final Kind kind, final long bucket_width) {
    this.kind = kind;
    this.bucket_width = bucket_width;
  }

  /**
   * @param bucket_width The smallest bucket width the cache serves, in ns.
   * @return A bucketed result.
   * @throws IllegalArgumentException if the width is not positive.
   */
  public static CacheSizingResult bucketWidth(final long bucket_width) {
    if (bucket_width <= 0) {
      throw new IllegalArgumentException("Bucket width must be positive.");
    }
    return new CacheSizingResult(Kind.BUCKET_WIDTH, bucket_width);
  }

  public Kind kind() {
    return kind;
  }

  /**
   * @return True if a cache table should be materialized. Only a bucketed
   * result does; {@link #ALL_RESOLUTIONS} never serves a query from a cache.
   */
  public boolean shouldCache() {
    return kind == Kind.BUCKET_WIDTH;
  }

  /**
   * @return The bucket width in ns, {@link Long#MAX_VALUE} for
   * {@link #ALL_RESOLUTIONS} and 0 for {@link #NO_CACHE}.
   */
  public long bucketWidth() {
    return bucket_width;
  }

  /**
   * @param requested_bucket The bucket width a query wants, in ns.
   * @return True if the cache table can answer it. Zooming in past the
   * cached width means falling back to the raw table. Since the width of
   * {@link #ALL_RESOLUTIONS} is the maximum duration, that sentinel never
   * routes a query to a cache table.
   */
  public boolean usableAt(final long requested_bucket) {
    return kind != Kind.NO_CACHE && requested_bucket >= bucket_width;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CacheSizingResult)) {
      return false;
    }
    final CacheSizingResult other = (CacheSizingResult) o;
    return kind == other.kind && bucket_width == other.bucket_width;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, bucket_width);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("kind=")
        .append(kind)
        .append(", bucketWidth=")
        .append(bucket_width)
        .toString();
  }
}
