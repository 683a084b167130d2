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
package ai.raindrop.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for a custom signal linked to a prior trace or interaction, such as
 * an edit of the model's answer or a detected hallucination.
 */
public class SignalOptions {

  private final String eventId;
  private final String name;
  private final SignalType type;
  private final Sentiment sentiment;
  private final String comment;
  private final String after;
  private final String attachmentId;
  private final Map<String, Object> properties;

  private SignalOptions(Builder builder) {
    this.eventId = builder.eventId;
    this.name = builder.name;
    this.type = builder.type;
    this.sentiment = builder.sentiment;
    this.comment = builder.comment;
    this.after = builder.after;
    this.attachmentId = builder.attachmentId;
    this.properties = new LinkedHashMap<>(builder.properties);
  }

  /**
   * Creates a new builder.
   *
   * @param eventId
   *            the trace or interaction id the signal refers to
   * @param name
   *            the signal name
   * @return a new builder
   */
  public static Builder builder(String eventId, String name) {
    return new Builder(eventId, name);
  }

  public String getEventId() {
    return eventId;
  }

  public String getName() {
    return name;
  }

  public SignalType getType() {
    return type;
  }

  /**
   * Returns the sentiment, defaulting to negative.
   *
   * @return the sentiment
   */
  public Sentiment getSentiment() {
    return sentiment != null ? sentiment : Sentiment.NEGATIVE;
  }

  public String getComment() {
    return comment;
  }

  /**
   * Returns the corrected content for edit signals.
   *
   * @return the corrected content, or null
   */
  public String getAfter() {
    return after;
  }

  public String getAttachmentId() {
    return attachmentId;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  /**
   * Builder for SignalOptions.
   */
  public static class Builder {
    private final String eventId;
    private final String name;
    private SignalType type = SignalType.DEFAULT;
    private Sentiment sentiment;
    private String comment;
    private String after;
    private String attachmentId;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    private Builder(String eventId, String name) {
      this.eventId = eventId;
      this.name = name;
    }

    public Builder type(SignalType type) {
      this.type = type != null ? type : SignalType.DEFAULT;
      return this;
    }

    public Builder sentiment(Sentiment sentiment) {
      this.sentiment = sentiment;
      return this;
    }

    public Builder comment(String comment) {
      this.comment = comment;
      return this;
    }

    public Builder after(String after) {
      this.after = after;
      return this;
    }

    public Builder attachmentId(String attachmentId) {
      this.attachmentId = attachmentId;
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

    public SignalOptions build() {
      if (eventId == null || eventId.isEmpty()) {
        throw new IllegalStateException("eventId is required");
      }
      if (name == null || name.isEmpty()) {
        throw new IllegalStateException("name is required");
      }
      return new SignalOptions(this);
    }
  }
}
