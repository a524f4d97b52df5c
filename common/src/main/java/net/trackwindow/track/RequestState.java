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
 * The state of a track's window requests. Exactly one per controller.
 *
 * @since 1.0
 */
public enum RequestState {
  /** Nothing outstanding. */
  IDLE,

  /** A hook and/or fetch is outstanding. */
  IN_FLIGHT,

  /** A fetch is outstanding and another tick asked for data meanwhile. */
  IN_FLIGHT_WITH_QUEUED_RETRY
}
