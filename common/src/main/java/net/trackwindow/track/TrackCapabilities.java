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
 * What a concrete track type plugs into a controller: the required window
 * fetch and the optional setup and reload hooks. Hooks that aren't set
 * default to {@link LifecycleHook#NOOP}.
 *
 * @param <P> The payload type of the track.
 *
 * @since 1.0
 */
public final class TrackCapabilities<P> {
  private final BoundsFetcher<P> fetcher;
  private final LifecycleHook setup;
  private final LifecycleHook reload;

  protected TrackCapabilities(final Builder<P> builder) {
    if (builder.fetcher == null) {
      throw new IllegalArgumentException("Bounds fetcher cannot be null.");
    }
    fetcher = builder.fetcher;
    setup = builder.setup == null ? LifecycleHook.NOOP : builder.setup;
    reload = builder.reload == null ? LifecycleHook.NOOP : builder.reload;
  }

  public BoundsFetcher<P> fetcher() {
    return fetcher;
  }

  public LifecycleHook setup() {
    return setup;
  }

  public LifecycleHook reload() {
    return reload;
  }

  public static <P> Builder<P> newBuilder() {
    return new Builder<P>();
  }

  public static class Builder<P> {
    private BoundsFetcher<P> fetcher;
    private LifecycleHook setup;
    private LifecycleHook reload;

    public Builder<P> setFetcher(final BoundsFetcher<P> fetcher) {
      this.fetcher = fetcher;
      return this;
    }

    public Builder<P> setSetup(final LifecycleHook setup) {
      this.setup = setup;
      return this;
    }

    public Builder<P> setReload(final LifecycleHook reload) {
      this.reload = reload;
      return this;
    }

    public TrackCapabilities<P> build() {
      return new TrackCapabilities<P>(this);
    }
  }
}
