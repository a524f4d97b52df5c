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

import net.trackwindow.data.CachedWindow;
import net.trackwindow.data.ViewWindow;

/**
 * Decides whether the cached window of a track still satisfies the view.
 *
 * @since 1.0
 */
public final class WindowFit {

  private WindowFit() { }

  /**
   * @param cached The cached window, null if nothing was fetched yet.
   * @param view The visible span.
   * @param resolution The requested resolution. Compared as is against the
   * already normalized cached resolution.
   * @param reload_pending Whether the host issued a reload not handled yet.
   * @param limit The row count at which a window is saturated.
   * @return True if a fetch is needed.
   */
  public static boolean needsFetch(final CachedWindow<?> cached,
                                   final ViewWindow view,
                                   final long resolution,
                                   final boolean reload_pending,
                                   final int limit) {
    if (cached == null) {
      return true;
    }
    if (reload_pending) {
      return true;
    }

    // At the limit only request more data if the view has moved. We fetch
    // more than the visible window so add the view's duration to find the
    // start of the previous view. Resolution changes alone are ignored here.
    if (cached.isSaturated(limit)) {
      final long previous_view_start = cached.start() + view.duration();
      return view.start() != previous_view_start;
    }

    final boolean in_range = view.start() >= cached.start()
        && view.end() <= cached.end();
    return !in_range || cached.resolution() != resolution;
  }
}
