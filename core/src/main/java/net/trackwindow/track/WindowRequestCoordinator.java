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

/**
 * The request state machine of a single track. Guarantees at most one fetch
 * in flight and remembers at most one follow up request, as a flag rather
 * than a queue, since the follow up re-reads the latest view anyway.
 * <p>
 * Not thread safe; driven from the control thread only.
 *
 * @since 1.0
 */
public class WindowRequestCoordinator {
  private static final Logger LOG = LoggerFactory.getLogger(
      WindowRequestCoordinator.class);

  /** What the caller should do after a tick. */
  public static enum TickAction {
    /** Start a fetch now. */
    START,

    /** A fetch is outstanding, a retry was queued. */
    QUEUED,

    /** Nothing to do. */
    NONE
  }

  private final String track_id;
  private RequestState state;

  /**
   * Default ctor.
   * @param track_id The track ID, used for logging.
   */
  public WindowRequestCoordinator(final String track_id) {
    this.track_id = track_id;
    state = RequestState.IDLE;
  }

  /** @return The current state. */
  public RequestState state() {
    return state;
  }

  /**
   * Handles a scheduling tick.
   * @param needs_fetch Whether the cached window no longer satisfies the view.
   * @return What to do.
   */
  public TickAction onTick(final boolean needs_fetch) {
    if (!needs_fetch) {
      return TickAction.NONE;
    }
    switch (state) {
    case IDLE:
      transition(RequestState.IN_FLIGHT);
      return TickAction.START;
    case IN_FLIGHT:
      transition(RequestState.IN_FLIGHT_WITH_QUEUED_RETRY);
      return TickAction.QUEUED;
    default:
      // already queued
      return TickAction.NONE;
    }
  }

  /**
   * Handles completion of the outstanding fetch, successful or not.
   * @return True if a retry was queued and the caller must re-evaluate.
   * @throws IllegalStateException if nothing was in flight.
   */
  public boolean onFetchCompleted() {
    switch (state) {
    case IN_FLIGHT:
      transition(RequestState.IDLE);
      return false;
    case IN_FLIGHT_WITH_QUEUED_RETRY:
      transition(RequestState.IDLE);
      return true;
    default:
      throw new IllegalStateException("No fetch in flight for track "
          + track_id);
    }
  }

  private void transition(final RequestState next) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Track " + track_id + ": " + state + " -> " + next);
    }
    state = next;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("trackId=")
        .append(track_id)
        .append(", state=")
        .append(state)
        .toString();
  }
}
