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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.raindrop.core.model.TokenUsage;
import ai.raindrop.core.model.ToolCall;

/**
 * Collects output text, token usage and tool calls while a stream is consumed.
 */
public class StreamAccumulator {

  private final StringBuilder text = new StringBuilder();
  private final List<ToolCall> toolCalls = new ArrayList<>();
  private final Map<String, Object> properties = new LinkedHashMap<>();
  private TokenUsage tokens;
  private String model;

  public StreamAccumulator appendText(String delta) {
    if (delta != null) {
      text.append(delta);
    }
    return this;
  }

  public StreamAccumulator addToolCall(ToolCall toolCall) {
    if (toolCall != null) {
      toolCalls.add(toolCall);
    }
    return this;
  }

  public StreamAccumulator setTokens(TokenUsage tokens) {
    this.tokens = tokens;
    return this;
  }

  /**
   * Overrides the requested model with the one reported by the stream.
   *
   * @param model
   *            the model id
   * @return this accumulator
   */
  public StreamAccumulator setModel(String model) {
    this.model = model;
    return this;
  }

  public StreamAccumulator putProperty(String key, Object value) {
    properties.put(key, value);
    return this;
  }

  public String getText() {
    return text.toString();
  }

  public List<ToolCall> getToolCalls() {
    return toolCalls;
  }

  public TokenUsage getTokens() {
    return tokens;
  }

  public String getModel() {
    return model;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }
}
