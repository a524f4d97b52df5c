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

import com.stumbleupon.async.Deferred;

import net.trackwindow.data.CachedWindow;

/**
 * The track type specific window fetch. Invoked when the cached window no
 * longer satisfies the view.
 *
 * @param <P> The payload type of the track.
 *
 * @since 1.0
 */
public interface BoundsFetcher<P> {

  /**
   * Fetches data for the given span.
   * @param start The start of the span in nanoseconds.
   * @param end The end of the span in nanoseconds.
   * @param resolution A power of two resolution in ns per pixel.
   * @return A deferred resolving to the window or an exception.
   */
  public Deferred<CachedWindow<P>> onBoundsChange(final long start,
                                                  final long end,
                                                  final long resolution);

}
