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

import java.util.Collections;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * Per-track configuration as held by the host's view state: the track id,
 * the kind of controller that serves it, an optional namespace used to
 * prefix store identifiers and free-form parameters for the track type.
 *
 * @since 1.0
 */
@JsonDeserialize(builder = TrackState.Builder.class)
public class TrackState {
  private final String id;
  private final String kind;
  private final String namespace;
  private final Map<String, String> params;

  protected TrackState(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.id)) {
      throw new IllegalArgumentException("Track ID cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(builder.kind)) {
      throw new IllegalArgumentException("Kind cannot be null or empty.");
    }
    id = builder.id;
    kind = builder.kind;
    namespace = Strings.emptyToNull(builder.namespace);
    params = builder.params == null ? Collections.<String, String>emptyMap()
        : ImmutableMap.copyOf(builder.params);
  }

  /** @return The opaque, stable track identifier. */
  public String getId() {
    return id;
  }

  /** @return The controller kind for this track. */
  public String getKind() {
    return kind;
  }

  /** @return The namespace for store identifiers, null if not set. */
  public String getNamespace() {
    return namespace;
  }

  /** @return Whether a namespace is configured. */
  public boolean hasNamespace() {
    return namespace != null;
  }

  /** @return Track type specific parameters, never null. */
  public Map<String, String> getParams() {
    return params;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("id=")
        .append(id)
        .append(", kind=")
        .append(kind)
        .append(", namespace=")
        .append(namespace)
        .append(", params=")
        .append(params)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "set")
  public static class Builder {
    @JsonProperty
    private String id;
    @JsonProperty
    private String kind;
    @JsonProperty
    private String namespace;
    @JsonProperty
    private Map<String, String> params;

    public Builder setId(final String id) {
      this.id = id;
      return this;
    }

    public Builder setKind(final String kind) {
      this.kind = kind;
      return this;
    }

    public Builder setNamespace(final String namespace) {
      this.namespace = namespace;
      return this;
    }

    public Builder setParams(final Map<String, String> params) {
      this.params = params;
      return this;
    }

    public TrackState build() {
      return new TrackState(this);
    }
  }
}
