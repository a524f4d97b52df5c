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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;

import net.trackwindow.data.CachedWindow;
import net.trackwindow.data.TrackState;
import net.trackwindow.data.ViewState;
import net.trackwindow.data.ViewWindow;
import net.trackwindow.exceptions.SetupFailedException;
import net.trackwindow.exceptions.TrackControllerException;
import net.trackwindow.query.QueryEngine;
import net.trackwindow.utils.Config;

public class TestTrackControllerHost {
  private ViewStateStore store;
  private TrackControllerRegistry registry;
  private TrackDataSink sink;
  private TrackFailureListener listener;
  private FakeFactory slices;
  private TrackControllerHost host;
  private PendingFactory pending;
  private ListAppender<ILoggingEvent> appender;

  @Before
  public void before() throws Exception {
    store = mock(ViewStateStore.class);
    sink = mock(TrackDataSink.class);
    listener = mock(TrackFailureListener.class);
    slices = new FakeFactory("slices");
    pending = new PendingFactory();
    registry = new TrackControllerRegistry();
    registry.register(slices);
    registry.register(pending);
    host = TrackControllerHost.newBuilder()
        .setStore(store)
        .setRegistry(registry)
        .setEngine(mock(QueryEngine.class))
        .setConfig(new Config(false))
        .setSink(sink)
        .setFailureListener(listener)
        .build();
  }

  @After
  public void after() throws Exception {
    if (appender != null) {
      hostLogger().detachAppender(appender);
    }
  }

  @Test
  public void createsAndRunsControllers() throws Exception {
    when(store.current()).thenReturn(state(1000, 1100, "t1", "t2"));
    host.tick();

    assertEquals(2, host.controllers().size());
    assertNotNull(host.controller("t1"));
    assertNotNull(host.controller("t2"));
    assertEquals(2, slices.created);
    assertEquals(Lists.newArrayList("t1", "t2"), slices.fetched);
    verify(sink, times(1)).publish(eq("t1"), any(CachedWindow.class));
    verify(sink, times(1)).publish(eq("t2"), any(CachedWindow.class));

    // same view, nothing to do and no new controllers
    final TrackController<?> t1 = host.controller("t1");
    host.tick();
    assertSame(t1, host.controller("t1"));
    assertEquals(2, slices.created);
    assertEquals(2, slices.fetched.size());

    when(store.current()).thenReturn(state(5000, 5100, "t1", "t2"));
    host.tick();
    assertEquals(4, slices.fetched.size());
  }

  @Test
  public void removedTracksAreDropped() throws Exception {
    when(store.current()).thenReturn(state(1000, 1100, "t1", "t2"));
    host.tick();
    when(store.current()).thenReturn(state(1000, 1100, "t2"));
    host.tick();

    assertNull(host.controller("t1"));
    assertNotNull(host.controller("t2"));
    assertEquals(1, host.controllers().size());

    // coming back starts from scratch
    when(store.current()).thenReturn(state(1000, 1100, "t1", "t2"));
    host.tick();
    assertEquals(3, slices.created);
    assertEquals(3, slices.fetched.size());
  }

  @Test
  public void unknownKindIsSkipped() throws Exception {
    when(store.current()).thenReturn(ViewState.newBuilder()
        .setVisibleWindow(new ViewWindow(1000, 1100))
        .setResolution(1024)
        .addVisibleTrack("t1")
        .addVisibleTrack("t9")
        .addTrack(track("t1", "slices"))
        .addTrack(track("t9", "flamegraph"))
        .build());
    host.tick();

    assertNotNull(host.controller("t1"));
    assertNull(host.controller("t9"));
    verify(listener, never()).onFailure(any(String.class),
        any(TrackControllerException.class));
  }

  @Test
  public void factoryFailureIsReported() throws Exception {
    slices.fail = true;
    when(store.current()).thenReturn(state(1000, 1100, "t1"));
    host.tick();

    assertTrue(host.controllers().isEmpty());
    verify(listener, times(1)).onFailure(eq("t1"),
        any(SetupFailedException.class));

    slices.fail = false;
    host.tick();
    assertNotNull(host.controller("t1"));
    assertEquals(1, slices.fetched.size());
  }

  @Test
  public void hiddenTracksKeepTheirController() throws Exception {
    when(store.current()).thenReturn(ViewState.newBuilder()
        .setVisibleWindow(new ViewWindow(1000, 1100))
        .setResolution(1024)
        .addTrack(track("t1", "slices"))
        .build());
    host.tick();
    assertNotNull(host.controller("t1"));
    assertTrue(slices.fetched.isEmpty());
  }

  @Test
  public void runsInSnapshotOrder() throws Exception {
    when(store.current()).thenReturn(state(1000, 1100, "t1", "t2"));
    host.tick();
    when(store.current()).thenReturn(state(5000, 5100, "t2", "t1"));
    host.tick();
    assertEquals(Lists.newArrayList("t1", "t2", "t2", "t1"), slices.fetched);
  }

  @Test
  public void removedMidFetchDropsResultAndRetry() throws Exception {
    when(store.current()).thenReturn(pendingState(1000, "p1"));
    host.tick();
    when(store.current()).thenReturn(pendingState(5000, "p1"));
    host.tick();
    final TrackController<?> old = host.controller("p1");
    assertEquals(RequestState.IN_FLIGHT_WITH_QUEUED_RETRY, old.requestState());

    when(store.current()).thenReturn(pendingState(5000));
    host.tick();
    assertNull(host.controller("p1"));
    assertTrue(old.isShutdown());
    assertTrue(host.isDraining("p1"));

    pending.complete(0);
    assertEquals(RequestState.IDLE, old.requestState());
    assertNull(old.data());
    assertEquals(1, pending.starts.size());
    verify(sink, never()).publish(any(String.class), any(CachedWindow.class));

    host.tick();
    assertFalse(host.isDraining("p1"));
    assertEquals(1, pending.starts.size());
  }

  @Test
  public void readdedMidFetchWaitsForDrain() throws Exception {
    when(store.current()).thenReturn(pendingState(1000, "p1"));
    host.tick();
    when(store.current()).thenReturn(pendingState(1000));
    host.tick();

    when(store.current()).thenReturn(pendingState(9000, "p1"));
    host.tick();
    host.tick();
    assertNull(host.controller("p1"));
    assertEquals(1, pending.starts.size());

    pending.complete(0);
    assertEquals(1, pending.starts.size());
    host.tick();
    assertNotNull(host.controller("p1"));
    assertEquals(2, pending.starts.size());
    assertEquals(8900, (long) pending.starts.get(1));
    assertEquals(1, pending.max_outstanding);

    pending.complete(1);
    verify(sink, times(1)).publish(eq("p1"), any(CachedWindow.class));
    assertEquals(8900, host.controller("p1").data().start());
  }

  @Test
  public void readdedAfterDrainStartsFresh() throws Exception {
    when(store.current()).thenReturn(pendingState(1000, "p1"));
    host.tick();
    when(store.current()).thenReturn(pendingState(5000, "p1"));
    host.tick();
    when(store.current()).thenReturn(pendingState(5000));
    host.tick();
    pending.complete(0);

    when(store.current()).thenReturn(pendingState(9000, "p1"));
    host.tick();
    assertEquals(2, pending.starts.size());
    assertEquals(8900, (long) pending.starts.get(1));
    assertEquals(1, pending.outstanding);
    assertEquals(1, pending.max_outstanding);
  }

  @Test
  public void unknownKindWarnsOnce() throws Exception {
    appender = new ListAppender<ILoggingEvent>();
    appender.start();
    hostLogger().addAppender(appender);

    final ViewState state = ViewState.newBuilder()
        .setVisibleWindow(new ViewWindow(1000, 1100))
        .setResolution(1024)
        .addVisibleTrack("t9")
        .addTrack(track("t9", "flamegraph"))
        .build();
    when(store.current()).thenReturn(state);
    host.tick();
    host.tick();
    host.tick();
    assertEquals(1, warnings());

    // registering the kind later picks the track up
    final FakeFactory flamegraph = new FakeFactory("flamegraph");
    registry.register(flamegraph);
    host.tick();
    assertNotNull(host.controller("t9"));
    assertEquals(1, flamegraph.created);

    // warned again once the track has left and come back
    registry = new TrackControllerRegistry();
    host = TrackControllerHost.newBuilder()
        .setStore(store)
        .setRegistry(registry)
        .setEngine(mock(QueryEngine.class))
        .setConfig(new Config(false))
        .setSink(sink)
        .setFailureListener(listener)
        .build();
    host.tick();
    when(store.current()).thenReturn(ViewState.newBuilder().build());
    host.tick();
    when(store.current()).thenReturn(state);
    host.tick();
    host.tick();
    assertEquals(3, warnings());
  }

  @Test(expected = IllegalStateException.class)
  public void nullStateFromStore() throws Exception {
    host.tick();
  }

  @Test
  public void builderRequiresEverything() throws Exception {
    try {
      TrackControllerHost.newBuilder()
          .setRegistry(registry)
          .setEngine(mock(QueryEngine.class))
          .setConfig(new Config(false))
          .setSink(sink)
          .setFailureListener(listener)
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      TrackControllerHost.newBuilder()
          .setStore(store)
          .setRegistry(registry)
          .setEngine(mock(QueryEngine.class))
          .setConfig(new Config(false))
          .setSink(sink)
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  private int warnings() {
    int count = 0;
    for (final ILoggingEvent event : appender.list) {
      if (event.getLevel() == Level.WARN) {
        count++;
      }
    }
    return count;
  }

  private static Logger hostLogger() {
    return (Logger) LoggerFactory.getLogger(TrackControllerHost.class);
  }

  private static ViewState pendingState(final long start,
                                        final String... ids) {
    final ViewState.Builder builder = ViewState.newBuilder()
        .setVisibleWindow(new ViewWindow(start, start + 100))
        .setResolution(1024)
        .setTraceSpan(new ViewWindow(0, 1000000));
    for (final String id : ids) {
      builder.addVisibleTrack(id).addTrack(track(id, PendingFactory.KIND));
    }
    return builder.build();
  }

  private static ViewState state(final long start,
                                 final long end,
                                 final String... ids) {
    final ViewState.Builder builder = ViewState.newBuilder()
        .setVisibleWindow(new ViewWindow(start, end))
        .setResolution(1024)
        .setTraceSpan(new ViewWindow(0, 1000000));
    for (final String id : ids) {
      builder.addVisibleTrack(id).addTrack(track(id, "slices"));
    }
    return builder.build();
  }

  private static TrackState track(final String id, final String kind) {
    return TrackState.newBuilder()
        .setId(id)
        .setKind(kind)
        .build();
  }

  /** Builds tracks whose fetches complete immediately. */
  static class FakeFactory implements TrackControllerFactory<String> {
    final String kind;
    final List<String> fetched = Lists.newArrayList();
    int created;
    boolean fail;

    FakeFactory(final String kind) {
      this.kind = kind;
    }

    @Override
    public String kind() {
      return kind;
    }

    @Override
    public TrackCapabilities<String> newCapabilities(
        final TrackContext context) {
      if (fail) {
        throw new IllegalStateException("Boo!");
      }
      created++;
      return TrackCapabilities.<String>newBuilder()
          .setFetcher(new BoundsFetcher<String>() {
            @Override
            public Deferred<CachedWindow<String>> onBoundsChange(
                final long start, final long end, final long resolution) {
              fetched.add(context.trackId());
              return Deferred.fromResult(CachedWindow.<String>newBuilder()
                  .setStart(start)
                  .setEnd(end)
                  .setResolution(resolution)
                  .setRowCount(1)
                  .setPayload(context.trackId())
                  .build());
            }
          })
          .build();
    }
  }

  /** Hands out fetches the test completes by index. */
  static class PendingFactory implements TrackControllerFactory<String> {
    static final String KIND = "pending";
    final List<Long> starts = Lists.newArrayList();
    final List<Deferred<CachedWindow<String>>> deferreds = Lists.newArrayList();
    final List<long[]> bounds = Lists.newArrayList();
    int outstanding;
    int max_outstanding;

    @Override
    public String kind() {
      return KIND;
    }

    @Override
    public TrackCapabilities<String> newCapabilities(
        final TrackContext context) {
      return TrackCapabilities.<String>newBuilder()
          .setFetcher(new BoundsFetcher<String>() {
            @Override
            public Deferred<CachedWindow<String>> onBoundsChange(
                final long start, final long end, final long resolution) {
              starts.add(start);
              bounds.add(new long[] { start, end, resolution });
              final Deferred<CachedWindow<String>> deferred =
                  new Deferred<CachedWindow<String>>();
              deferreds.add(deferred);
              outstanding++;
              max_outstanding = Math.max(max_outstanding, outstanding);
              return deferred;
            }
          })
          .build();
    }

    void complete(final int index) {
      final long[] call = bounds.get(index);
      outstanding--;
      deferreds.get(index).callback(CachedWindow.<String>newBuilder()
          .setStart(call[0])
          .setEnd(call[1])
          .setResolution(call[2])
          .setRowCount(1)
          .setPayload("fetch-" + index)
          .build());
    }
  }
}
