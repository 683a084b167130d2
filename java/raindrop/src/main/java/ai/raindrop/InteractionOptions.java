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
package ai.raindrop;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for scoped interactions and workflows.
 */
public class InteractionOptions {

  private final String userId;
  private final String event;
  private final String input;
  private final String conversationId;
  private final Map<String, Object> properties;

  private InteractionOptions(Builder builder) {
    this.userId = builder.userId;
    this.event = builder.event;
    this.input = builder.input;
    this.conversationId = builder.conversationId;
    this.properties = builder.properties;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getUserId() {
    return userId;
  }

  public String getEvent() {
    return event;
  }

  public String getInput() {
    return input;
  }

  public String getConversationId() {
    return conversationId;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  /**
   * Builder for InteractionOptions.
   */
  public static class Builder {
    private String userId;
    private String event;
    private String input;
    private String conversationId;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder event(String event) {
      this.event = event;
      return this;
    }

    public Builder input(String input) {
      this.input = input;
      return this;
    }

    public Builder conversationId(String conversationId) {
      this.conversationId = conversationId;
      return this;
    }

    public Builder property(String key, Object value) {
      this.properties.put(key, value);
      return this;
    }

    public Builder properties(Map<String, ?> properties) {
      if (properties != null) {
        this.properties.putAll(properties);
      }
      return this;
    }

    public InteractionOptions build() {
      return new InteractionOptions(this);
    }
  }
}
