/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.raindrop.core.wrapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call tracing options for a wrapped provider call.
 */
public class CallOptions {

  private static final CallOptions NONE = builder().build();

  private final String traceId;
  private final String userId;
  private final String conversationId;
  private final Map<String, Object> properties;

  private CallOptions(Builder builder) {
    this.traceId = builder.traceId;
    this.userId = builder.userId;
    this.conversationId = builder.conversationId;
    this.properties = Map.copyOf(builder.properties);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options with every field unset.
   *
   * @return empty options
   */
  public static CallOptions none() {
    return NONE;
  }

  /**
   * Returns the caller-supplied trace id.
   *
   * @return the trace id, or null to generate one
   */
  public String getTraceId() {
    return traceId;
  }

  /**
   * Returns the user id for this call.
   *
   * @return the user id, or null to use the identified user
   */
  public String getUserId() {
    return userId;
  }

  public String getConversationId() {
    return conversationId;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  /**
   * Builder for CallOptions.
   */
  public static class Builder {
    private String traceId;
    private String userId;
    private String conversationId;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    public Builder traceId(String traceId) {
      this.traceId = traceId;
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder conversationId(String conversationId) {
      this.conversationId = conversationId;
      return this;
    }

    public Builder property(String key, Object value) {
      if (key != null && value != null) {
        this.properties.put(key, value);
      }
      return this;
    }

    public Builder properties(Map<String, ?> properties) {
      if (properties != null) {
        properties.forEach(this::property);
      }
      return this;
    }

    public CallOptions build() {
      return new CallOptions(this);
    }
  }
}
