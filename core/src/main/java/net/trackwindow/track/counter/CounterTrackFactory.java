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
package net.trackwindow.track.counter;

import net.trackwindow.track.TrackCapabilities;
import net.trackwindow.track.TrackContext;
import net.trackwindow.track.TrackControllerFactory;

/**
 * Builds {@link CounterTrack}s for tracks of kind {@value #KIND}.
 *
 * @since 1.0
 */
public class CounterTrackFactory implements TrackControllerFactory<CounterData> {
  public static final String KIND = "counter";

  @Override
  public String kind() {
    return KIND;
  }

  @Override
  public TrackCapabilities<CounterData> newCapabilities(
      final TrackContext context) {
    return new CounterTrack(context).capabilities();
  }
}
