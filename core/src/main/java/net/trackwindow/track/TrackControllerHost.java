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

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Maps;

import net.trackwindow.data.TrackState;
import net.trackwindow.data.ViewState;
import net.trackwindow.exceptions.SetupFailedException;
import net.trackwindow.query.QueryEngine;
import net.trackwindow.utils.Config;

/**
 * Owns the controllers of all configured tracks. On every tick it reads one
 * snapshot from the view state store, creates controllers for new tracks,
 * drops those of removed tracks and runs each controller with the snapshot
 * in the order the snapshot lists the tracks.
 * <p>
 * A dropped controller is shut down. If its request is still outstanding
 * it drains before a track with the same ID gets a new controller, so a
 * track never has two requests in flight.
 *
 * @since 1.0
 */
public class TrackControllerHost {
  private static final Logger LOG = LoggerFactory.getLogger(
      TrackControllerHost.class);

  private final ViewStateStore store;
  private final TrackControllerRegistry registry;
  private final QueryEngine engine;
  private final Config config;
  private final TrackDataSink sink;
  private final TrackFailureListener failure_listener;

  /** Controllers keyed on track ID. */
  private final Map<String, TrackController<?>> controllers;

  /** Shut down controllers whose last request hasn't completed yet. */
  private final Map<String, TrackController<?>> draining;

  /** Track ID to the unregistered kind we already warned about. */
  private final Map<String, String> unknown_kinds;

  protected TrackControllerHost(final Builder builder) {
    if (builder.store == null) {
      throw new IllegalArgumentException("View state store cannot be null.");
    }
    if (builder.registry == null) {
      throw new IllegalArgumentException("Registry cannot be null.");
    }
    if (builder.engine == null) {
      throw new IllegalArgumentException("Query engine cannot be null.");
    }
    if (builder.config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (builder.sink == null) {
      throw new IllegalArgumentException("Sink cannot be null.");
    }
    if (builder.failureListener == null) {
      throw new IllegalArgumentException("Failure listener cannot be null.");
    }
    store = builder.store;
    registry = builder.registry;
    engine = builder.engine;
    config = builder.config;
    sink = builder.sink;
    failure_listener = builder.failureListener;
    controllers = Maps.newHashMap();
    draining = Maps.newHashMap();
    unknown_kinds = Maps.newHashMap();
  }

  /** Runs one scheduling tick for every track. */
  public void tick() {
    final ViewState state = store.current();
    if (state == null) {
      throw new IllegalStateException("View state store returned null.");
    }

    Iterator<Entry<String, TrackController<?>>> iterator =
        controllers.entrySet().iterator();
    while (iterator.hasNext()) {
      final Entry<String, TrackController<?>> entry = iterator.next();
      if (state.trackState(entry.getKey()) == null) {
        final TrackController<?> controller = entry.getValue();
        controller.shutdown();
        iterator.remove();
        if (controller.requestState() != RequestState.IDLE) {
          draining.put(entry.getKey(), controller);
        }
        if (LOG.isDebugEnabled()) {
          LOG.debug("Dropped controller for removed track " + entry.getKey());
        }
      }
    }

    iterator = draining.entrySet().iterator();
    while (iterator.hasNext()) {
      if (iterator.next().getValue().requestState() == RequestState.IDLE) {
        iterator.remove();
      }
    }
    unknown_kinds.keySet().retainAll(state.tracks().keySet());

    for (final TrackState track : state.tracks().values()) {
      TrackController<?> controller = controllers.get(track.getId());
      if (controller == null) {
        if (draining.containsKey(track.getId())) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Waiting for the previous controller of track "
                + track.getId() + " to drain.");
          }
          continue;
        }
        controller = newController(track);
        if (controller == null) {
          continue;
        }
        controllers.put(track.getId(), controller);
      }
      controller.run(state);
    }
  }

  /**
   * @param track_id A track ID.
   * @return The controller or null if the track has none.
   */
  public TrackController<?> controller(final String track_id) {
    return controllers.get(track_id);
  }

  /**
   * @param track_id A track ID.
   * @return True if a dropped controller of the track still has a request
   * outstanding.
   */
  public boolean isDraining(final String track_id) {
    return draining.containsKey(track_id);
  }

  /** @return The live controllers keyed on track ID. */
  public Map<String, TrackController<?>> controllers() {
    return Collections.unmodifiableMap(controllers);
  }

  private TrackController<?> newController(final TrackState track) {
    final TrackControllerFactory<?> factory = registry.get(track.getKind());
    if (factory == null) {
      if (!track.getKind().equals(unknown_kinds.get(track.getId()))) {
        LOG.warn("No track controller factory for kind [" + track.getKind()
            + "] of track " + track.getId());
        unknown_kinds.put(track.getId(), track.getKind());
      }
      return null;
    }
    unknown_kinds.remove(track.getId());
    final TrackContext context = TrackContext.newBuilder()
        .setTrackId(track.getId())
        .setEngine(engine)
        .setConfig(config)
        .build();
    try {
      return build(factory, context);
    } catch (RuntimeException e) {
      final SetupFailedException ex = new SetupFailedException(
          "Unable to create controller for track " + track.getId(),
          track.getId(), e);
      LOG.error("Failed to instantiate controller for track " + track.getId(), e);
      failure_listener.onFailure(track.getId(), ex);
      return null;
    }
  }

  private <P> TrackController<P> build(final TrackControllerFactory<P> factory,
                                       final TrackContext context) {
    return new TrackController<P>(context, factory.newCapabilities(context),
        sink, failure_listener);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private ViewStateStore store;
    private TrackControllerRegistry registry;
    private QueryEngine engine;
    private Config config;
    private TrackDataSink sink;
    private TrackFailureListener failureListener;

    public Builder setStore(final ViewStateStore store) {
      this.store = store;
      return this;
    }

    public Builder setRegistry(final TrackControllerRegistry registry) {
      this.registry = registry;
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

    public Builder setSink(final TrackDataSink sink) {
      this.sink = sink;
      return this;
    }

    public Builder setFailureListener(
        final TrackFailureListener failure_listener) {
      failureListener = failure_listener;
      return this;
    }

    public TrackControllerHost build() {
      return new TrackControllerHost(this);
    }
  }
}
