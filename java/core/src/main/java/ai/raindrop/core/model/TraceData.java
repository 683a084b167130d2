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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TraceData is a standalone traced call with no parent interaction. It is
 * delivered directly to the transport and carries provider identity, model,
 * token usage and tool calls in addition to the span fields.
 */
public class TraceData {

  private final String traceId;
  private final String provider;
  private final String model;
  private final long startTime;
  private Object input;
  private Object output;
  private Long endTime;
  private Long latencyMs;
  private TokenUsage tokens;
  private List<ToolCall> toolCalls;
  private String userId;
  private String conversationId;
  private String error;
  private Map<String, Object> properties;

  private TraceData(Builder builder) {
    this.traceId = builder.traceId;
    this.provider = builder.provider;
    this.model = builder.model;
    this.startTime = builder.startTime;
    this.input = builder.input;
    this.output = builder.error != null ? null : builder.output;
    this.endTime = builder.endTime != null ? Math.max(builder.endTime, builder.startTime) : null;
    this.latencyMs = this.endTime != null ? this.endTime - builder.startTime : null;
    this.tokens = builder.tokens;
    this.toolCalls = builder.toolCalls;
    this.userId = builder.userId;
    this.conversationId = builder.conversationId;
    this.error = builder.error;
    this.properties = builder.properties;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Converts a finished span that has no parent interaction into a trace. The
   * provider is reported as {@code unknown} and the model as
   * {@code tool:<name>}.
   *
   * @param span
   *            the finished span
   * @return the trace
   */
  public static TraceData fromStandaloneSpan(SpanData span) {
    return builder().traceId(span.getSpanId()).provider("unknown").model("tool:" + span.getName())
        .input(span.getInput()).output(span.getOutput()).startTime(span.getStartTime()).endTime(span.getEndTime())
        .error(span.getError()).properties(span.getProperties()).build();
  }

  public String getTraceId() {
    return traceId;
  }

  public String getProvider() {
    return provider;
  }

  public String getModel() {
    return model;
  }

  public long getStartTime() {
    return startTime;
  }

  public Long getEndTime() {
    return endTime;
  }

  public Long getLatencyMs() {
    return latencyMs;
  }

  public Object getInput() {
    return input;
  }

  public void setInput(Object input) {
    this.input = input;
  }

  public Object getOutput() {
    return output;
  }

  public void setOutput(Object output) {
    this.output = output;
  }

  public TokenUsage getTokens() {
    return tokens;
  }

  public void setTokens(TokenUsage tokens) {
    this.tokens = tokens;
  }

  public List<ToolCall> getToolCalls() {
    return toolCalls;
  }

  public void setToolCalls(List<ToolCall> toolCalls) {
    this.toolCalls = toolCalls != null ? toolCalls : new ArrayList<>();
  }

  public String getUserId() {
    return userId;
  }

  public void setUserId(String userId) {
    this.userId = userId;
  }

  public String getConversationId() {
    return conversationId;
  }

  public void setConversationId(String conversationId) {
    this.conversationId = conversationId;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  public void setProperties(Map<String, Object> properties) {
    this.properties = properties != null ? properties : new LinkedHashMap<>();
  }

  @Override
  public String toString() {
    return "TraceData{traceId='" + traceId + "', provider='" + provider + "', model='" + model + "', latencyMs="
        + latencyMs + ", error='" + error + "'}";
  }

  /**
   * Builder for TraceData.
   */
  public static class Builder {
    private String traceId;
    private String provider = "unknown";
    private String model = "unknown";
    private long startTime = System.currentTimeMillis();
    private Object input;
    private Object output;
    private Long endTime;
    private TokenUsage tokens;
    private List<ToolCall> toolCalls = new ArrayList<>();
    private String userId;
    private String conversationId;
    private String error;
    private Map<String, Object> properties = new LinkedHashMap<>();

    public Builder traceId(String traceId) {
      this.traceId = traceId;
      return this;
    }

    public Builder provider(String provider) {
      this.provider = provider;
      return this;
    }

    public Builder model(String model) {
      this.model = model;
      return this;
    }

    public Builder startTime(long startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder endTime(Long endTime) {
      this.endTime = endTime;
      return this;
    }

    public Builder input(Object input) {
      this.input = input;
      return this;
    }

    public Builder output(Object output) {
      this.output = output;
      return this;
    }

    public Builder tokens(TokenUsage tokens) {
      this.tokens = tokens;
      return this;
    }

    public Builder toolCalls(List<ToolCall> toolCalls) {
      this.toolCalls = toolCalls != null ? new ArrayList<>(toolCalls) : new ArrayList<>();
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

    public Builder error(String error) {
      this.error = error;
      return this;
    }

    public Builder properties(Map<String, ?> properties) {
      this.properties = properties != null ? new LinkedHashMap<>(properties) : new LinkedHashMap<>();
      return this;
    }

    public TraceData build() {
      if (traceId == null || traceId.isEmpty()) {
        throw new IllegalStateException("traceId is required");
      }
      return new TraceData(this);
    }
  }
}
