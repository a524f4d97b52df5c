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

import com.google.common.base.Strings;
import com.stumbleupon.async.Deferred;

import net.trackwindow.data.TrackState;
import net.trackwindow.data.ViewState;
import net.trackwindow.data.ViewWindow;
import net.trackwindow.query.QueryEngine;
import net.trackwindow.query.QueryRows;
import net.trackwindow.utils.Config;

/**
 * What a concrete track type can reach from its hooks and fetches: the
 * engine, the config, identifiers derived from the track ID and the view
 * state most recently handed to the track's controller.
 *
 * @since 1.0
 */
public class TrackContext {
  private final String track_id;
  private final QueryEngine engine;
  private final Config config;
  private final CacheSizer cache_sizer;
  private ViewState view_state;

  protected TrackContext(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.trackId)) {
      throw new IllegalArgumentException("Track ID cannot be null or empty.");
    }
    if (builder.engine == null) {
      throw new IllegalArgumentException("Query engine cannot be null.");
    }
    if (builder.config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    track_id = builder.trackId;
    engine = builder.engine;
    config = builder.config;
    cache_sizer = new CacheSizer(config);
  }

  public String trackId() {
    return track_id;
  }

  public QueryEngine engine() {
    return engine;
  }

  public Config config() {
    return config;
  }

  /** @return The latest view state seen, null before the first tick. */
  public ViewState viewState() {
    return view_state;
  }

  void updateViewState(final ViewState view_state) {
    this.view_state = view_state;
  }

  /**
   * @return The config of this track from the latest view state.
   * @throws IllegalStateException if there is no view state or the track
   * isn't in it.
   */
  public TrackState trackState() {
    if (view_state == null) {
      throw new IllegalStateException("No view state yet for track "
          + track_id);
    }
    final TrackState state = view_state.trackState(track_id);
    if (state == null) {
      throw new IllegalStateException("No track state for " + track_id);
    }
    return state;
  }

  /**
   * @param query The query text.
   * @return The deferred rows from the engine.
   */
  public Deferred<QueryRows> query(final String query) {
    return engine.execute(query);
  }

  /**
   * @param prefix A table prefix.
   * @return A valid table name with the given prefix, unique to this track.
   */
  public String tableName(final String prefix) {
    return TableNames.tableName(prefix, track_id);
  }

  /**
   * @param table A table name.
   * @return The table prefixed with the track's namespace, if configured.
   */
  public String namespaceTable(final String table) {
    return TableNames.namespaceTable(trackState().getNamespace(), table);
  }

  /**
   * @param resolution A resolution in ns per pixel.
   * @return True if the track should summarize rather than return raw rows.
   */
  public boolean shouldSummarize(final long resolution) {
    return resolution >= config.getLong(Config.SUMMARIZE_MIN_RESOLUTION_KEY);
  }

  /**
   * Sizes a pre-quantized cache for this track against the trace span of the
   * latest view state. Track types call this from their setup hook.
   * @param row_count The number of rows in the track's source table.
   * @return The sizing result.
   * @throws IllegalStateException if the trace span isn't known yet.
   */
  public CacheSizingResult calcCachedBucketSize(final long row_count) {
    final ViewWindow trace_span = view_state == null ? null
        : view_state.traceSpan();
    if (trace_span == null) {
      throw new IllegalStateException("Trace span unknown for track "
          + track_id);
    }
    return cache_sizer.sizeCache(row_count, trace_span.duration());
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String trackId;
    private QueryEngine engine;
    private Config config;

    public Builder setTrackId(final String track_id) {
      trackId = track_id;
      return this;
    }

    public Builder setEngine(final QueryEngine engine) {
      this.engine = engine;
      return this;
    }

    public Builder setConfig(final Config config) {
      this.config = config;
      return this;
    }

    public TrackContext build() {
      return new TrackContext(this);
    }
  }
}
