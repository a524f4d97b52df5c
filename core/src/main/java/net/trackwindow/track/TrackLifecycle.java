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
 * Bookkeeping for the one time setup and the reload requests of a track.
 * Only mutated on success so failed hooks are tried again on a later tick.
 *
 * @since 1.0
 */
public class TrackLifecycle {

  /** Which hook, if any, has to run before the next fetch. */
  public static enum Hook {
    SETUP,
    RELOAD,
    NONE
  }

  private boolean setup_done;
  private long last_reload_handled;

  /** @return Whether setup completed successfully. */
  public boolean setupDone() {
    return setup_done;
  }

  /** @return The last reload version handled successfully, 0 if none. */
  public long lastReloadHandled() {
    return last_reload_handled;
  }

  /**
   * @param reload_version The host's current reload request version.
   * @return True if the version is newer than the last one handled.
   */
  public boolean shouldReload(final long reload_version) {
    return reload_version > 0 && last_reload_handled < reload_version;
  }

  /**
   * Setup takes precedence; a pending reload is picked up on the next fetch
   * after setup.
   * @param reload_version The host's current reload request version.
   * @return The hook to run before the next fetch.
   */
  public Hook nextHook(final long reload_version) {
    if (!setup_done) {
      return Hook.SETUP;
    }
    if (shouldReload(reload_version)) {
      return Hook.RELOAD;
    }
    return Hook.NONE;
  }

  /** Call once setup completed successfully. */
  public void markSetupDone() {
    setup_done = true;
  }

  /**
   * Call once a reload completed successfully.
   * @param reload_version The version observed when the reload started.
   */
  public void markReloadHandled(final long reload_version) {
    if (reload_version > last_reload_handled) {
      last_reload_handled = reload_version;
    }
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("setupDone=")
        .append(setup_done)
        .append(", lastReloadHandled=")
        .append(last_reload_handled)
        .toString();
  }
}
