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

import java.math.RoundingMode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.math.LongMath;

import net.trackwindow.utils.Config;

/**
 * Decides whether a track should cache a pre-quantized copy of its data and
 * at what bucket width.
 * <p>
 * For large traces, going through the raw table in the most zoomed-out
 * states means iterating and sorting millions of rows for the quantization.
 * Instead we cache a pre-quantized table used when zoomed out and fall back
 * to the raw table when zoomed in, where the narrower window bounds the
 * amount of data naturally.
 * <p>
 * The bucket is computed by approximating the bucket size used when totally
 * zoomed out and going a fixed number of resolution levels down from there,
 * so the cache serves more than the single most zoomed out state. Moving
 * down a level halves the bucket, matching resolution normalization.
 * <p>
 * All math is on longs so the bucket is deterministic across platforms.
 *
 * @since 1.0
 */
public class CacheSizer {
  private static final Logger LOG = LoggerFactory.getLogger(CacheSizer.class);

  private final long min_rows_to_cache;
  private final long viewport_pixels;
  private final int levels_covered;

  /**
   * Default ctor.
   * @param min_rows_to_cache Tables with fewer rows are never cached.
   * @param viewport_pixels The worst case viewport width in pixels.
   * @param levels_covered How many resolution levels below the outermost one
   * the cache must serve.
   */
  public CacheSizer(final long min_rows_to_cache,
                    final long viewport_pixels,
                    final int levels_covered) {
    if (min_rows_to_cache < 0) {
      throw new IllegalArgumentException("Min rows cannot be negative.");
    }
    if (viewport_pixels <= 0) {
      throw new IllegalArgumentException("Viewport pixels must be positive.");
    }
    if (levels_covered < 0 || levels_covered > 62) {
      throw new IllegalArgumentException("Levels covered must be in [0, 62].");
    }
    this.min_rows_to_cache = min_rows_to_cache;
    this.viewport_pixels = viewport_pixels;
    this.levels_covered = levels_covered;
  }

  /**
   * Reads the thresholds from the config.
   * @param config A non-null config.
   */
  public CacheSizer(final Config config) {
    this(config.getLong(Config.CACHE_MIN_ROWS_KEY),
         config.getLong(Config.CACHE_VIEWPORT_PIXELS_KEY),
         config.getInt(Config.CACHE_LEVELS_COVERED_KEY));
  }

  /**
   * @param row_count The number of rows in the source table.
   * @param trace_duration The duration of the whole trace in ns.
   * @return {@link CacheSizingResult#NO_CACHE} for small tables,
   * {@link CacheSizingResult#ALL_RESOLUTIONS} if the trace has fewer
   * resolution levels than we want to cover, else the smallest bucket width
   * the cache needs to serve.
   */
  public CacheSizingResult sizeCache(final long row_count,
                                     final long trace_duration) {
    if (trace_duration < 0) {
      throw new IllegalArgumentException("Trace duration cannot be negative.");
    }
    if (row_count < min_rows_to_cache) {
      return CacheSizingResult.NO_CACHE;
    }

    final long outermost_bucket = bitCeil(trace_duration / viewport_pixels);
    final int outermost_level = LongMath.log2(outermost_bucket,
        RoundingMode.UNNECESSARY);

    // not enough levels in the trace for the table to be used much
    if (outermost_level < levels_covered) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Outermost level " + outermost_level + " is below "
            + levels_covered + " levels for duration " + trace_duration);
      }
      return CacheSizingResult.ALL_RESOLUTIONS;
    }

    // moving down N levels is splitting the bucket into 2^N sub-intervals
    final long cached_bucket = outermost_bucket >>> levels_covered;
    if (LOG.isDebugEnabled()) {
      LOG.debug("Caching " + row_count + " rows with bucket " + cached_bucket
          + " (outermost " + outermost_bucket + ")");
    }
    return CacheSizingResult.bucketWidth(cached_bucket);
  }

  /**
   * @param value A non-negative value.
   * @return The smallest power of two >= value, 1 for 0.
   */
  static long bitCeil(final long value) {
    if (value <= 1) {
      return 1;
    }
    return LongMath.ceilingPowerOfTwo(value);
  }
}
