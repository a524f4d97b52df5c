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

/**
 * An optional asynchronous setup or reload step of a track type.
 *
 * @since 1.0
 */
public interface LifecycleHook {

  /** A hook that completes immediately. */
  public static final LifecycleHook NOOP = new LifecycleHook() {
    @Override
    public Deferred<Object> run() {
      return Deferred.fromResult(null);
    }
  };

  /** @return A deferred resolving when the work is done or to an exception. */
  public Deferred<Object> run();

}
