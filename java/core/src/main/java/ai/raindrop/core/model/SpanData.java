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
 * SpanData records one nested operation, a tool call or an AI call, inside an
 * interaction. A span without a parent is delivered on its own as a trace.
 *
 * <p>
 * Times are epoch milliseconds. Once {@link #finish(long, Object, String)} has
 * run the end time is never before the start time and the latency is their
 * difference. Plugins may still rewrite input, output, error and properties
 * before the span is stored or sent.
 */
public class SpanData {

  private final String spanId;
  private final String name;
  private final SpanKind kind;
  private final long startTime;
  private String parentId;
  private Long endTime;
  private Long latencyMs;
  private Object input;
  private Object output;
  private String error;
  private Map<String, Object> properties;

  /**
   * Creates a new unfinished span.
   *
   * @param spanId
   *            the span id
   * @param name
   *            the operation name
   * @param kind
   *            tool or ai
   * @param startTime
   *            start time in epoch milliseconds
   */
  public SpanData(String spanId, String name, SpanKind kind, long startTime) {
    this.spanId = spanId;
    this.name = name;
    this.kind = kind != null ? kind : SpanKind.TOOL;
    this.startTime = startTime;
    this.properties = new LinkedHashMap<>();
  }

  /**
   * Finalizes the span. Has no effect if the span is already finished.
   *
   * @param endTime
   *            end time in epoch milliseconds, clamped to the start time
   * @param output
   *            the output, dropped when an error is given
   * @param error
   *            the error message, or null on success
   * @return true if this call finished the span
   */
  public synchronized boolean finish(long endTime, Object output, String error) {
    if (this.endTime != null) {
      return false;
    }
    long end = Math.max(endTime, startTime);
    this.endTime = end;
    this.latencyMs = end - startTime;
    if (error != null) {
      this.error = error;
      this.output = null;
    } else if (output != null) {
      this.output = output;
    }
    return true;
  }

  public synchronized boolean isFinished() {
    return endTime != null;
  }

  public String getSpanId() {
    return spanId;
  }

  public String getName() {
    return name;
  }

  public SpanKind getKind() {
    return kind;
  }

  public long getStartTime() {
    return startTime;
  }

  public synchronized Long getEndTime() {
    return endTime;
  }

  public synchronized Long getLatencyMs() {
    return latencyMs;
  }

  public String getParentId() {
    return parentId;
  }

  /**
   * Sets the parent interaction id. Called when the span is appended to an
   * interaction.
   *
   * @param parentId
   *            the interaction id
   */
  public void setParentId(String parentId) {
    this.parentId = parentId;
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

  /**
   * Adds properties to the span.
   *
   * @param properties
   *            the properties to merge, may be null
   * @return this span
   */
  public SpanData putProperties(Map<String, ?> properties) {
    if (properties != null) {
      this.properties.putAll(properties);
    }
    return this;
  }

  @Override
  public String toString() {
    return "SpanData{spanId='" + spanId + "', name='" + name + "', kind=" + kind + ", parentId='" + parentId
        + "', latencyMs=" + latencyMs + ", error='" + error + "'}";
  }
}
