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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.raindrop.core.model.Attachment;

/**
 * Options for {@link Raindrop#begin(BeginOptions)}.
 */
public class BeginOptions {

  private final String eventId;
  private final String userId;
  private final String event;
  private final String input;
  private final String model;
  private final String conversationId;
  private final Map<String, Object> properties;
  private final List<Attachment> attachments;

  private BeginOptions(Builder builder) {
    this.eventId = builder.eventId;
    this.userId = builder.userId;
    this.event = builder.event;
    this.input = builder.input;
    this.model = builder.model;
    this.conversationId = builder.conversationId;
    this.properties = builder.properties;
    this.attachments = builder.attachments;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the caller-supplied interaction id.
   *
   * @return the id, or null to generate one
   */
  public String getEventId() {
    return eventId;
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

  public String getModel() {
    return model;
  }

  public String getConversationId() {
    return conversationId;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  public List<Attachment> getAttachments() {
    return attachments;
  }

  /**
   * Builder for BeginOptions.
   */
  public static class Builder {
    private String eventId;
    private String userId;
    private String event;
    private String input;
    private String model;
    private String conversationId;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<Attachment> attachments = new ArrayList<>();

    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

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

    public Builder model(String model) {
      this.model = model;
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

    public Builder attachment(Attachment attachment) {
      if (attachment != null) {
        this.attachments.add(attachment);
      }
      return this;
    }

    public BeginOptions build() {
      return new BeginOptions(this);
    }
  }
}
