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

/**
 * Timestamps and values of a counter window, parallel arrays.
 *
 * @since 1.0
 */
public class CounterData {
  private final long[] timestamps;
  private final double[] values;
  private final boolean from_cache;

  public CounterData(final long[] timestamps,
                     final double[] values,
                     final boolean from_cache) {
    if (timestamps == null || values == null) {
      throw new IllegalArgumentException("Arrays cannot be null.");
    }
    if (timestamps.length != values.length) {
      throw new IllegalArgumentException("Timestamp and value counts differ: "
          + timestamps.length + " vs " + values.length);
    }
    this.timestamps = timestamps;
    this.values = values;
    this.from_cache = from_cache;
  }

  public long[] timestamps() {
    return timestamps;
  }

  public double[] values() {
    return values;
  }

  /** @return Whether the data was read from the pre-quantized cache table. */
  public boolean fromCache() {
    return from_cache;
  }

  public int size() {
    return timestamps.length;
  }
}
