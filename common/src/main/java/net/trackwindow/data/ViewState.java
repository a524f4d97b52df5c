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
package net.trackwindow.data;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * An immutable snapshot of what the host wants to show on one scheduling
 * tick. The host builds a new one per tick and threads it through the
 * controllers; controllers never read global state.
 *
 * @since 1.0
 */
public final class ViewState {
  private final ViewWindow visible_window;
  private final long resolution;
  private final Set<String> visible_tracks;
  private final long reload_version;
  private final ViewWindow trace_span;
  private final Map<String, TrackState> tracks;

  protected ViewState(final Builder builder) {
    if (builder.resolution < 0) {
      throw new IllegalArgumentException("Resolution cannot be negative.");
    }
    if (builder.reloadVersion < 0) {
      throw new IllegalArgumentException("Reload version cannot be negative.");
    }
    visible_window = builder.visibleWindow;
    resolution = builder.resolution;
    visible_tracks = ImmutableSet.copyOf(builder.visibleTracks);
    reload_version = builder.reloadVersion;
    trace_span = builder.traceSpan;
    tracks = ImmutableMap.copyOf(builder.tracks);
  }

  /** @return The visible span, null if nothing is loaded yet. */
  public ViewWindow visibleWindow() {
    return visible_window;
  }

  /** @return The requested resolution, ns per pixel, not normalized. */
  public long resolution() {
    return resolution;
  }

  /** @return The IDs of the tracks currently on screen. */
  public Set<String> visibleTracks() {
    return visible_tracks;
  }

  /**
   * @param track_id A track ID.
   * @return True if the track is on screen.
   */
  public boolean isVisible(final String track_id) {
    return visible_tracks.contains(track_id);
  }

  /** @return The latest reload request version, 0 if none was issued. */
  public long reloadVersion() {
    return reload_version;
  }

  /** @return The span of the whole trace, null if not known yet. */
  public ViewWindow traceSpan() {
    return trace_span;
  }

  /** @return Configured tracks keyed on ID, in the order they were added. */
  public Map<String, TrackState> tracks() {
    return tracks;
  }

  /**
   * @param track_id A track ID.
   * @return The config for the track or null if the track is unknown.
   */
  public TrackState trackState(final String track_id) {
    return tracks.get(track_id);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("visibleWindow=")
        .append(visible_window)
        .append(", resolution=")
        .append(resolution)
        .append(", visibleTracks=")
        .append(visible_tracks)
        .append(", reloadVersion=")
        .append(reload_version)
        .append(", traceSpan=")
        .append(trace_span)
        .append(", tracks=")
        .append(tracks.keySet())
        .toString();
  }

  /**
   * @return A builder seeded with this snapshot, handy for hosts that derive
   * the next tick's state from the previous one.
   */
  public Builder toBuilder() {
    return newBuilder()
        .setVisibleWindow(visible_window)
        .setResolution(resolution)
        .setVisibleTracks(visible_tracks)
        .setReloadVersion(reload_version)
        .setTraceSpan(trace_span)
        .setTracks(tracks.values());
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private ViewWindow visibleWindow;
    private long resolution;
    private Set<String> visibleTracks = Sets.newHashSet();
    private long reloadVersion;
    private ViewWindow traceSpan;
    private Map<String, TrackState> tracks = Maps.newLinkedHashMap();

    public Builder setVisibleWindow(final ViewWindow visible_window) {
      visibleWindow = visible_window;
      return this;
    }

    public Builder setResolution(final long resolution) {
      this.resolution = resolution;
      return this;
    }

    public Builder setVisibleTracks(final Collection<String> visible_tracks) {
      visibleTracks = Sets.newHashSet(visible_tracks);
      return this;
    }

    public Builder addVisibleTrack(final String track_id) {
      visibleTracks.add(track_id);
      return this;
    }

    public Builder setReloadVersion(final long reload_version) {
      reloadVersion = reload_version;
      return this;
    }

    public Builder setTraceSpan(final ViewWindow trace_span) {
      traceSpan = trace_span;
      return this;
    }

    public Builder setTracks(final Collection<TrackState> tracks) {
      this.tracks = Maps.newLinkedHashMap();
      for (final TrackState track : tracks) {
        this.tracks.put(track.getId(), track);
      }
      return this;
    }

    public Builder addTrack(final TrackState track) {
      tracks.put(track.getId(), track);
      return this;
    }

    public ViewState build() {
      return new ViewState(this);
    }
  }
}
