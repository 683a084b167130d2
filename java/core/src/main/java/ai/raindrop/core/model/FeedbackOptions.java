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
 * Options for feedback on a trace or interaction. Either a score or a
 * thumbs-up/thumbs-down type decides the sentiment; a score wins when both are
 * present.
 */
public class FeedbackOptions {

  private final FeedbackType type;
  private final Double score;
  private final String comment;
  private final SignalType signalType;
  private final String attachmentId;
  private final String timestamp;
  private final Map<String, Object> properties;

  private FeedbackOptions(Builder builder) {
    this.type = builder.type;
    this.score = builder.score;
    this.comment = builder.comment;
    this.signalType = builder.signalType;
    this.attachmentId = builder.attachmentId;
    this.timestamp = builder.timestamp;
    this.properties = new LinkedHashMap<>(builder.properties);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public FeedbackType getType() {
    return type;
  }

  public Double getScore() {
    return score;
  }

  public String getComment() {
    return comment;
  }

  public SignalType getSignalType() {
    return signalType;
  }

  public String getAttachmentId() {
    return attachmentId;
  }

  /**
   * Returns the caller-supplied ISO-8601 timestamp.
   *
   * @return the timestamp, or null to use the send time
   */
  public String getTimestamp() {
    return timestamp;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  /**
   * Returns the sentiment implied by the score, or by the type when no score
   * is given.
   *
   * @return the sentiment
   */
  public Sentiment getSentiment() {
    if (score != null) {
      return Sentiment.fromScore(score);
    }
    return type == FeedbackType.THUMBS_UP ? Sentiment.POSITIVE : Sentiment.NEGATIVE;
  }

  /**
   * Returns the signal name: positive or negative for scored feedback,
   * otherwise the feedback type.
   *
   * @return the signal name
   */
  public String getSignalName() {
    if (score != null) {
      return score >= 0.5 ? "positive" : "negative";
    }
    return type != null ? type.getValue() : "negative";
  }

  /**
   * Builder for FeedbackOptions.
   */
  public static class Builder {
    private FeedbackType type;
    private Double score;
    private String comment;
    private SignalType signalType = SignalType.FEEDBACK;
    private String attachmentId;
    private String timestamp;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    public Builder type(FeedbackType type) {
      this.type = type;
      return this;
    }

    public Builder score(double score) {
      this.score = score;
      return this;
    }

    public Builder comment(String comment) {
      this.comment = comment;
      return this;
    }

    public Builder signalType(SignalType signalType) {
      this.signalType = signalType != null ? signalType : SignalType.FEEDBACK;
      return this;
    }

    public Builder attachmentId(String attachmentId) {
      this.attachmentId = attachmentId;
      return this;
    }

    public Builder timestamp(String timestamp) {
      this.timestamp = timestamp;
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

    public FeedbackOptions build() {
      return new FeedbackOptions(this);
    }
  }
}
