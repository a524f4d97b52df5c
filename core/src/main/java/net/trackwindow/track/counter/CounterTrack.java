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
package net.trackwindow.track.counter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import net.trackwindow.data.CachedWindow;
import net.trackwindow.query.QueryRows;
import net.trackwindow.track.BoundsFetcher;
import net.trackwindow.track.CacheSizingResult;
import net.trackwindow.track.LifecycleHook;
import net.trackwindow.track.TrackCapabilities;
import net.trackwindow.track.TrackContext;
import net.trackwindow.utils.Config;

/**
 * A counter track: a series of (timestamp, value) rows. On setup it counts
 * its rows and, for large tables, materializes a table quantized at the
 * bucket width picked by the cache sizing heuristic. Zoomed out fetches read
 * that table, zoomed in fetches read the raw rows.
 *
 * @since 1.0
 */
public class CounterTrack implements BoundsFetcher<CounterData> {
  private static final Logger LOG = LoggerFactory.getLogger(CounterTrack.class);

  /** Param naming the raw counter table. */
  public static final String TABLE_PARAM = "table";

  /** Param naming the counter in the raw table, defaults to the track ID. */
  public static final String COUNTER_ID_PARAM = "counter_id";

  public static final String DEFAULT_TABLE = "counter";
  public static final String CACHE_TABLE_PREFIX = "counter_cache";

  public static final String TS_COLUMN = "ts";
  public static final String VALUE_COLUMN = "value";
  public static final String COUNT_COLUMN = "cnt";

  private final TrackContext context;
  private final int limit;

  /** Set on setup. */
  private CacheSizingResult cache = CacheSizingResult.NO_CACHE;

  public CounterTrack(final TrackContext context) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    this.context = context;
    limit = context.config().getInt(Config.WINDOW_LIMIT_KEY);
  }

  /** @return The hooks to hand to a controller. */
  public TrackCapabilities<CounterData> capabilities() {
    return TrackCapabilities.<CounterData>newBuilder()
        .setFetcher(this)
        .setSetup(new LifecycleHook() {
          @Override
          public Deferred<Object> run() {
            return onSetup();
          }
        })
        .setReload(new LifecycleHook() {
          @Override
          public Deferred<Object> run() {
            return onReload();
          }
        })
        .build();
  }

  public TrackContext context() {
    return context;
  }

  /** @return The cache decision made during setup. */
  public CacheSizingResult cache() {
    return cache;
  }

  /** @return The namespaced raw table. */
  public String rawTable() {
    final String table = context.trackState().getParams().get(TABLE_PARAM);
    return context.namespaceTable(Strings.isNullOrEmpty(table)
        ? DEFAULT_TABLE : table);
  }

  /** @return The namespaced cache table unique to this track. */
  public String cacheTable() {
    return context.namespaceTable(context.tableName(CACHE_TABLE_PREFIX));
  }

  /**
   * Counts the rows and creates the cache table if worthwhile.
   * @return A deferred resolving once setup is done.
   */
  public Deferred<Object> onSetup() {
    final String count_query = "SELECT COUNT(*) AS " + COUNT_COLUMN
        + " FROM " + rawTable() + " WHERE " + counterFilter();

    class CountCB implements Callback<Deferred<Object>, QueryRows> {
      @Override
      public Deferred<Object> call(final QueryRows rows) throws Exception {
        final long count = rows.size() > 0 ? rows.getLong(0, COUNT_COLUMN) : 0;
        cache = context.calcCachedBucketSize(count);
        if (!cache.shouldCache()) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Not caching track " + context.trackId() + " with "
                + count + " rows: " + cache);
          }
          return Deferred.fromResult(null);
        }
        return createCacheTable(cache.bucketWidth());
      }
    }

    return context.query(count_query).addCallbackDeferring(new CountCB());
  }

  /**
   * Drops the cache table and runs setup again.
   * @return A deferred resolving once the cache is rebuilt.
   */
  public Deferred<Object> onReload() {
    class DroppedCB implements Callback<Deferred<Object>, QueryRows> {
      @Override
      public Deferred<Object> call(final QueryRows ignored) throws Exception {
        cache = CacheSizingResult.NO_CACHE;
        return onSetup();
      }
    }

    return context.query("DROP TABLE IF EXISTS " + cacheTable())
        .addCallbackDeferring(new DroppedCB());
  }

  @Override
  public Deferred<CachedWindow<CounterData>> onBoundsChange(
      final long start, final long end, final long resolution) {
    final boolean use_cache = cache.usableAt(resolution);
    final String table = use_cache ? cacheTable() : rawTable();
    final String filter = use_cache ? "" : counterFilter() + " AND ";

    final String query;
    if (use_cache || context.shouldSummarize(resolution)) {
      query = "SELECT (" + TS_COLUMN + " / " + resolution + ") * " + resolution
          + " AS " + TS_COLUMN + ", AVG(" + VALUE_COLUMN + ") AS " + VALUE_COLUMN
          + " FROM " + table
          + " WHERE " + filter + TS_COLUMN + " >= " + start
          + " AND " + TS_COLUMN + " <= " + end
          + " GROUP BY 1 ORDER BY 1 LIMIT " + limit;
    } else {
      query = "SELECT " + TS_COLUMN + ", " + VALUE_COLUMN
          + " FROM " + table
          + " WHERE " + filter + TS_COLUMN + " >= " + start
          + " AND " + TS_COLUMN + " <= " + end
          + " ORDER BY " + TS_COLUMN + " LIMIT " + limit;
    }

    class RowsCB implements Callback<CachedWindow<CounterData>, QueryRows> {
      @Override
      public CachedWindow<CounterData> call(final QueryRows rows)
          throws Exception {
        final long[] timestamps = new long[rows.size()];
        final double[] values = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
          timestamps[i] = rows.getLong(i, TS_COLUMN);
          values[i] = rows.getDouble(i, VALUE_COLUMN);
        }
        return CachedWindow.<CounterData>newBuilder()
            .setStart(start)
            .setEnd(end)
            .setResolution(resolution)
            .setRowCount(rows.size())
            .setPayload(new CounterData(timestamps, values, use_cache))
            .build();
      }
    }

    return context.query(query).addCallback(new RowsCB());
  }

  private Deferred<Object> createCacheTable(final long bucket) {
    final String table = cacheTable();
    final String create = "CREATE TABLE " + table + " AS SELECT ("
        + TS_COLUMN + " / " + bucket + ") * " + bucket + " AS " + TS_COLUMN
        + ", AVG(" + VALUE_COLUMN + ") AS " + VALUE_COLUMN
        + " FROM " + rawTable()
        + " WHERE " + counterFilter()
        + " GROUP BY 1";

    class CreatedCB implements Callback<Object, QueryRows> {
      @Override
      public Object call(final QueryRows ignored) throws Exception {
        LOG.info("Created cache table " + table + " with bucket " + bucket
            + " for track " + context.trackId());
        return null;
      }
    }

    return context.query(create).addCallback(new CreatedCB());
  }

  private String counterFilter() {
    String counter_id = context.trackState().getParams().get(COUNTER_ID_PARAM);
    if (Strings.isNullOrEmpty(counter_id)) {
      counter_id = context.trackId();
    }
    return "track_id = '" + counter_id.replace("'", "''") + "'";
  }
}
