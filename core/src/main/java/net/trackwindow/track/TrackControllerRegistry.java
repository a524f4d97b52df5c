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
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;

/**
 * Maps track kinds to the factories that build their controllers.
 *
 * @since 1.0
 */
public class TrackControllerRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(
      TrackControllerRegistry.class);

  private final Map<String, TrackControllerFactory<?>> factories =
      Maps.newHashMap();

  /**
   * @param factory A non-null factory with a unique kind.
   * @throws IllegalArgumentException if the kind is empty or already taken.
   */
  public void register(final TrackControllerFactory<?> factory) {
    if (factory == null) {
      throw new IllegalArgumentException("Factory cannot be null.");
    }
    if (Strings.isNullOrEmpty(factory.kind())) {
      throw new IllegalArgumentException("Factory kind cannot be null or empty.");
    }
    if (factories.containsKey(factory.kind())) {
      throw new IllegalArgumentException("A factory is already registered "
          + "for kind: " + factory.kind());
    }
    factories.put(factory.kind(), factory);
    LOG.info("Registered track controller factory for kind: " + factory.kind());
  }

  /**
   * @param kind A track kind.
   * @return The factory or null if the kind is unknown.
   */
  public TrackControllerFactory<?> get(final String kind) {
    return factories.get(kind);
  }

  /** @return Whether a factory is registered for the kind. */
  public boolean has(final String kind) {
    return factories.containsKey(kind);
  }

  /** @return The registered kinds. */
  public Set<String> kinds() {
    return Collections.unmodifiableSet(factories.keySet());
  }
}
