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

import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.trackwindow.data.CachedWindow;
import net.trackwindow.data.ViewState;
import net.trackwindow.data.ViewWindow;
import net.trackwindow.exceptions.FetchFailedException;
import net.trackwindow.exceptions.ReloadFailedException;
import net.trackwindow.exceptions.SetupFailedException;
import net.trackwindow.exceptions.TrackControllerException;
import net.trackwindow.track.TrackLifecycle.Hook;
import net.trackwindow.utils.Config;

/**
 * Keeps the data window of one track in line with the view. The host calls
 * {@link #run(ViewState)} once per scheduling tick. When the cached window
 * no longer satisfies the view the controller runs the track's setup or
 * reload hook if due, fetches the visible span padded by one span width on
 * each side and publishes the result.
 * <p>
 * At most one hook or fetch is outstanding per controller. A tick that wants
 * data meanwhile queues a single retry that runs against the latest view
 * state once the outstanding fetch completes, successfully or not.
 * <p>
 * Failures are reported to the {@link TrackFailureListener} and never thrown
 * from {@link #run(ViewState)}. A failed fetch keeps the previous window.
 * <p>
 * Once {@link #shutdown()} is called the controller ignores ticks. An
 * outstanding request is left to complete but its result is dropped and a
 * queued retry is discarded.
 * <p>
 * Not thread safe. Ticks and deferred completions must be delivered on the
 * control thread.
 *
 * @param <P> The payload type of the track.
 *
 * @since 1.0
 */
public class TrackController<P> {
  private static final Logger LOG = LoggerFactory.getLogger(
      TrackController.class);

  private final TrackContext context;
  private final TrackCapabilities<P> capabilities;
  private final TrackDataSink sink;
  private final TrackFailureListener failure_listener;
  private final WindowRequestCoordinator coordinator;
  private final TrackLifecycle lifecycle;
  private final ResolutionNormalizer normalizer;
  private final int limit;

  /** The last successfully fetched window. */
  private CachedWindow<P> data;

  /** The latest snapshot handed to run(), replayed by queued retries. */
  private ViewState latest_state;

  /** Set once the host dropped the track. */
  private boolean shut_down;

  /**
   * Default ctor.
   * @param context The non-null track context.
   * @param capabilities The non-null track type hooks.
   * @param sink The non-null sink for fetched windows.
   * @param failure_listener The non-null failure listener.
   */
  public TrackController(final TrackContext context,
                         final TrackCapabilities<P> capabilities,
                         final TrackDataSink sink,
                         final TrackFailureListener failure_listener) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    if (capabilities == null) {
      throw new IllegalArgumentException("Capabilities cannot be null.");
    }
    if (sink == null) {
      throw new IllegalArgumentException("Sink cannot be null.");
    }
    if (failure_listener == null) {
      throw new IllegalArgumentException("Failure listener cannot be null.");
    }
    this.context = context;
    this.capabilities = capabilities;
    this.sink = sink;
    this.failure_listener = failure_listener;
    coordinator = new WindowRequestCoordinator(context.trackId());
    lifecycle = new TrackLifecycle();
    normalizer = new ResolutionNormalizer(context.config());
    limit = context.config().getInt(Config.WINDOW_LIMIT_KEY);
  }

  /** @return The track ID. */
  public String trackId() {
    return context.trackId();
  }

  /** @return The context handed to the track type. */
  public TrackContext context() {
    return context;
  }

  /** @return The last published window, null if none yet. */
  public CachedWindow<P> data() {
    return data;
  }

  /** @return The request state. */
  public RequestState requestState() {
    return coordinator.state();
  }

  /** @return The setup and reload bookkeeping. */
  public TrackLifecycle lifecycle() {
    return lifecycle;
  }

  /**
   * Stops the controller. Safe to call more than once.
   */
  public void shutdown() {
    if (shut_down) {
      return;
    }
    shut_down = true;
    if (LOG.isDebugEnabled()) {
      LOG.debug("Shut down controller for track " + context.trackId()
          + " in state " + coordinator.state());
    }
  }

  /** @return Whether {@link #shutdown()} was called. */
  public boolean isShutdown() {
    return shut_down;
  }

  /**
   * Evaluates one scheduling tick.
   * @param state The non-null view state of this tick.
   */
  public void run(final ViewState state) {
    if (state == null) {
      throw new IllegalArgumentException("View state cannot be null.");
    }
    if (shut_down) {
      return;
    }
    latest_state = state;
    context.updateViewState(state);

    final ViewWindow visible = state.visibleWindow();
    if (visible == null || !state.isVisible(context.trackId())) {
      return;
    }

    final boolean needs_fetch = WindowFit.needsFetch(data, visible,
        state.resolution(), lifecycle.shouldReload(state.reloadVersion()),
        limit);
    switch (coordinator.onTick(needs_fetch)) {
    case START:
      startRequest(state);
      break;
    case QUEUED:
      if (LOG.isDebugEnabled()) {
        LOG.debug("Queued a retry for track " + context.trackId());
      }
      break;
    default:
      break;
    }
  }

  /**
   * Kicks off the hook, fetch and publish chain. The cleanup callback at the
   * end runs on success and failure alike.
   */
  private void startRequest(final ViewState state) {
    final long reload_version = state.reloadVersion();
    final Hook hook = lifecycle.nextHook(reload_version);
    final Deferred<Object> hook_deferred;
    switch (hook) {
    case SETUP:
      hook_deferred = invoke(capabilities.setup());
      break;
    case RELOAD:
      hook_deferred = invoke(capabilities.reload());
      break;
    default:
      hook_deferred = Deferred.fromResult(null);
    }

    hook_deferred
        .addCallbacks(new HookCB(hook, reload_version), new HookErrorCB(hook))
        .addCallbackDeferring(new FetchCB(state))
        .addCallbacks(new PublishCB(), new ErrorCB())
        .addBoth(new CompleteCB());
  }

  /** Converts a synchronous throw into a failed deferred. */
  private Deferred<Object> invoke(final LifecycleHook hook) {
    try {
      final Deferred<Object> deferred = hook.run();
      if (deferred == null) {
        return Deferred.fromResult(null);
      }
      return deferred;
    } catch (Exception e) {
      return Deferred.fromError(e);
    }
  }

  /** Records a successful hook. */
  class HookCB implements Callback<Object, Object> {
    private final Hook hook;
    private final long reload_version;

    HookCB(final Hook hook, final long reload_version) {
      this.hook = hook;
      this.reload_version = reload_version;
    }

    @Override
    public Object call(final Object ignored) throws Exception {
      switch (hook) {
      case SETUP:
        lifecycle.markSetupDone();
        if (LOG.isDebugEnabled()) {
          LOG.debug("Setup done for track " + context.trackId());
        }
        break;
      case RELOAD:
        lifecycle.markReloadHandled(reload_version);
        if (LOG.isDebugEnabled()) {
          LOG.debug("Reload " + reload_version + " handled for track "
              + context.trackId());
        }
        break;
      default:
        break;
      }
      return null;
    }
  }

  /** Wraps a hook failure so the fetch is skipped. */
  class HookErrorCB implements Callback<Object, Exception> {
    private final Hook hook;

    HookErrorCB(final Hook hook) {
      this.hook = hook;
    }

    @Override
    public Object call(final Exception e) throws Exception {
      if (hook == Hook.RELOAD) {
        return new ReloadFailedException("Reload failed for track "
            + context.trackId(), context.trackId(), e);
      }
      return new SetupFailedException("Setup failed for track "
          + context.trackId(), context.trackId(), e);
    }
  }

  /** Normalizes the resolution and calls the track's fetch. */
  class FetchCB implements Callback<Deferred<CachedWindow<P>>, Object> {
    private final ViewState state;

    FetchCB(final ViewState state) {
      this.state = state;
    }

    @Override
    public Deferred<CachedWindow<P>> call(final Object ignored)
        throws Exception {
      if (shut_down) {
        return Deferred.fromResult(null);
      }
      final long resolution = normalizer.normalize(state.resolution());
      final ViewWindow window = state.visibleWindow().expand();
      if (LOG.isDebugEnabled()) {
        LOG.debug("Fetching track " + context.trackId() + " " + window
            + " at resolution " + resolution);
      }

      Deferred<CachedWindow<P>> fetch;
      try {
        fetch = capabilities.fetcher().onBoundsChange(window.start(),
            window.end(), resolution);
        if (fetch == null) {
          fetch = Deferred.fromError(new IllegalStateException(
              "Fetcher returned a null deferred."));
        }
      } catch (Exception e) {
        fetch = Deferred.fromError(e);
      }
      return fetch.addErrback(new FetchErrorCB());
    }
  }

  /** Wraps a fetch failure. */
  class FetchErrorCB implements Callback<Object, Exception> {
    @Override
    public Object call(final Exception e) throws Exception {
      return new FetchFailedException("Fetch failed for track "
          + context.trackId(), context.trackId(), e);
    }
  }

  /** Stores and publishes a fetched window. */
  class PublishCB implements Callback<Object, CachedWindow<P>> {
    @Override
    public Object call(final CachedWindow<P> window) throws Exception {
      if (shut_down) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Dropping window for shut down track " + context.trackId());
        }
        return null;
      }
      if (window == null) {
        failed(new FetchFailedException("Fetch returned no window for track "
            + context.trackId(), context.trackId(),
            new IllegalStateException("Null window.")));
        return null;
      }
      data = window;
      sink.publish(context.trackId(), window);
      return null;
    }
  }

  /** Reports a failure to the host instead of propagating it. */
  class ErrorCB implements Callback<Object, Exception> {
    @Override
    public Object call(final Exception e) throws Exception {
      if (e instanceof TrackControllerException) {
        failed((TrackControllerException) e);
      } else {
        failed(new FetchFailedException("Unexpected failure for track "
            + context.trackId(), context.trackId(), e));
      }
      return null;
    }
  }

  /** Returns the state machine to idle and runs a queued retry. */
  class CompleteCB implements Callback<Object, Object> {
    @Override
    public Object call(final Object ignored) throws Exception {
      if (coordinator.onFetchCompleted() && !shut_down) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Running queued retry for track " + context.trackId());
        }
        run(latest_state);
      }
      return null;
    }
  }

  private void failed(final TrackControllerException e) {
    if (shut_down) {
      LOG.warn("Request failed for shut down track " + context.trackId(), e);
      return;
    }
    LOG.error("Request failed for track " + context.trackId(), e);
    try {
      failure_listener.onFailure(context.trackId(), e);
    } catch (RuntimeException ex) {
      LOG.error("Failure listener threw for track " + context.trackId(), ex);
    }
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("trackId=")
        .append(context.trackId())
        .append(", state=")
        .append(coordinator.state())
        .append(", lifecycle={")
        .append(lifecycle)
        .append("}, data={")
        .append(data)
        .append("}")
        .toString();
  }
}
