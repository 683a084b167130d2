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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * InteractionContext holds the state of one logical user-facing event and the
 * spans recorded inside it.
 *
 * <p>
 * The id never changes. Spans appended to the interaction get the interaction
 * id as their parent id. Finishing is a one-way transition: once
 * {@link #markFinished()} has returned true no further spans are accepted and
 * later calls return false.
 *
 * <p>
 * Caller threads, provider wrappers and plugins all mutate the same instance,
 * so the span list, properties and attachments are synchronized collections.
 */
public class InteractionContext {

  private final String interactionId;
  private final long startTime;
  private final List<SpanData> spans = new ArrayList<>();
  private final Map<String, Object> properties = Collections.synchronizedMap(new LinkedHashMap<>());
  private final List<Attachment> attachments = Collections.synchronizedList(new ArrayList<>());
  private volatile String userId;
  private volatile String conversationId;
  private volatile String input;
  private volatile String output;
  private volatile String model;
  private volatile String event;
  private boolean finished;

  /**
   * Creates a new InteractionContext.
   *
   * @param interactionId
   *            the interaction id
   * @param startTime
   *            start time in epoch milliseconds
   */
  public InteractionContext(String interactionId, long startTime) {
    if (interactionId == null || interactionId.isEmpty()) {
      throw new IllegalArgumentException("interactionId is required");
    }
    this.interactionId = interactionId;
    this.startTime = startTime;
    this.event = "interaction";
  }

  public String getInteractionId() {
    return interactionId;
  }

  public long getStartTime() {
    return startTime;
  }

  /**
   * Appends a finished span. The span's parent id is set to this interaction's
   * id.
   *
   * @param span
   *            the span to append
   * @return true if the span was appended, false if the interaction already
   *         finished
   */
  public synchronized boolean appendSpan(SpanData span) {
    if (finished) {
      return false;
    }
    span.setParentId(interactionId);
    spans.add(span);
    return true;
  }

  /**
   * Returns a snapshot of the spans appended so far, in append order.
   *
   * @return the spans
   */
  public synchronized List<SpanData> getSpans() {
    return new ArrayList<>(spans);
  }

  /**
   * Marks the interaction finished.
   *
   * @return true on the first call, false on every later call
   */
  public synchronized boolean markFinished() {
    if (finished) {
      return false;
    }
    finished = true;
    return true;
  }

  public synchronized boolean isFinished() {
    return finished;
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

  public String getInput() {
    return input;
  }

  public void setInput(String input) {
    this.input = input;
  }

  public String getOutput() {
    return output;
  }

  public void setOutput(String output) {
    this.output = output;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public String getEvent() {
    return event;
  }

  public void setEvent(String event) {
    this.event = event != null ? event : "interaction";
  }

  /**
   * Returns the live property map. Mutations are visible to the payload
   * formatter.
   *
   * @return the properties
   */
  public Map<String, Object> getProperties() {
    return properties;
  }

  /**
   * Returns the live attachment list.
   *
   * @return the attachments
   */
  public List<Attachment> getAttachments() {
    return attachments;
  }

  @Override
  public String toString() {
    return "InteractionContext{interactionId='" + interactionId + "', event='" + event + "', userId='" + userId
        + "'}";
  }
}
