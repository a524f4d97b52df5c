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

/**
 * Creates the capabilities of one kind of track, e.g. counters or slices.
 * Registered with a {@link TrackControllerRegistry} under its kind.
 *
 * @param <P> The payload type of the track kind.
 *
 * @since 1.0
 */
public interface TrackControllerFactory<P> {

  /** @return The unique kind this factory serves. */
  public String kind();

  /**
   * @param context The non-null context of the new track.
   * @return The capabilities for a controller of the track.
   */
  public TrackCapabilities<P> newCapabilities(final TrackContext context);

}
