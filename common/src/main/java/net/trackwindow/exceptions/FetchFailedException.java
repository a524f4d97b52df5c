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
package net.trackwindow.exceptions;

/**
 * Raised when the window fetch of a track failed.
 *
 * @since 1.0
 */
public class FetchFailedException extends TrackControllerException {
  /** Serial for this exception. Auto generated. */
  private static final long serialVersionUID = -1851148846720013373L;

  public FetchFailedException(final String msg, final String track_id, final Throwable cause) {
    super(msg, track_id, cause);
  }
}
