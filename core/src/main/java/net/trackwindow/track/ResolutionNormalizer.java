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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.math.LongMath;

import net.trackwindow.utils.Config;

/**
 * Makes sure the resolution driving a fetch is a power of two, substituting
 * a default otherwise.
 *
 * @since 1.0
 */
public class ResolutionNormalizer {
  private static final Logger LOG = LoggerFactory.getLogger(
      ResolutionNormalizer.class);

  private final long default_resolution;

  /**
   * Default ctor.
   * @param default_resolution The fallback, must be a power of two.
   * @throws IllegalArgumentException if the default is not a power of two.
   */
  public ResolutionNormalizer(final long default_resolution) {
    if (!isValid(default_resolution)) {
      throw new IllegalArgumentException("Default resolution ["
          + default_resolution + "] must be a positive power of two.");
    }
    this.default_resolution = default_resolution;
  }

  /**
   * Reads the default from {@link Config#DEFAULT_RESOLUTION_KEY}.
   * @param config A non-null config.
   */
  public ResolutionNormalizer(final Config config) {
    this(config.getLong(Config.DEFAULT_RESOLUTION_KEY));
  }

  /**
   * @param resolution A candidate resolution.
   * @return The resolution if it is a power of two, the default otherwise.
   */
  public long normalize(final long resolution) {
    if (isValid(resolution)) {
      return resolution;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Resolution " + resolution + " is not a power of 2, using "
          + default_resolution);
    }
    return default_resolution;
  }

  /** @return The fallback resolution. */
  public long defaultResolution() {
    return default_resolution;
  }

  /**
   * @param resolution A candidate resolution.
   * @return True if exactly one bit is set.
   */
  public static boolean isValid(final long resolution) {
    return LongMath.isPowerOfTwo(resolution);
  }
}
