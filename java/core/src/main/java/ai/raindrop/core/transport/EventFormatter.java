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
package ai.raindrop.core.transport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.raindrop.core.JsonUtils;
import ai.raindrop.core.model.Attachment;
import ai.raindrop.core.model.FeedbackOptions;
import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SignalOptions;
import ai.raindrop.core.model.SpanData;
import ai.raindrop.core.model.ToolCall;
import ai.raindrop.core.model.TraceData;
import ai.raindrop.core.model.UserTraits;

/**
 * EventFormatter turns model objects into the JSON payloads accepted by the
 * Raindrop API. Null fields are omitted and non-string input and output are
 * serialized to JSON strings.
 */
public final class EventFormatter {

  public static final String LIBRARY_NAME = "raindrop-java";
  public static final String LIBRARY_VERSION = "0.1.0";
  public static final String TRACE_EVENT = "ai_interaction";

  private EventFormatter() {
    // Utility class
  }

  /**
   * Formats a standalone trace for the events endpoint.
   *
   * @param trace
   *            the trace
   * @return the payload
   */
  public static ObjectNode formatTrace(TraceData trace) {
    ObjectNode data = newObject();
    putIfNotNull(data, "event_id", trace.getTraceId());
    putIfNotNull(data, "user_id", trace.getUserId());
    data.put("event", TRACE_EVENT);
    data.put("timestamp", isoTimestamp(trace.getStartTime()));

    ObjectNode properties = data.putObject("properties");
    properties.set("$context", context());
    putIfNotNull(properties, "provider", trace.getProvider());
    putIfNotNull(properties, "conversation_id", trace.getConversationId());
    putIfNotNull(properties, "latency_ms", trace.getLatencyMs());
    if (trace.getTokens() != null) {
      putIfNotNull(properties, "input_tokens", trace.getTokens().getInput());
      putIfNotNull(properties, "output_tokens", trace.getTokens().getOutput());
      putIfNotNull(properties, "total_tokens", trace.getTokens().getTotal());
    }
    putIfNotNull(properties, "error", trace.getError());
    putAll(properties, trace.getProperties());

    ObjectNode aiData = data.putObject("ai_data");
    putIfNotNull(aiData, "model", trace.getModel());
    putIfNotNull(aiData, "input", JsonUtils.toApiString(trace.getInput()));
    putIfNotNull(aiData, "output", JsonUtils.toApiString(trace.getOutput()));
    putIfNotNull(aiData, "convo_id", trace.getConversationId());

    List<ToolCall> toolCalls = trace.getToolCalls();
    if (toolCalls != null && !toolCalls.isEmpty()) {
      ArrayNode attachments = data.putArray("attachments");
      for (ToolCall toolCall : toolCalls) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("arguments", toolCall.getArguments());
        value.put("result", toolCall.getResult());
        attachments.add(codeAttachment("tool:" + toolCall.getName(), value));
      }
    }
    return data;
  }

  /**
   * Formats a finished interaction for the events endpoint. Caller attachments
   * come first, followed by one attachment per span.
   *
   * @param interaction
   *            the interaction
   * @param endTime
   *            finish time in epoch milliseconds
   * @param error
   *            the error message, or null on success
   * @return the payload
   */
  public static ObjectNode formatInteraction(InteractionContext interaction, long endTime, String error) {
    List<SpanData> spans = interaction.getSpans();

    ObjectNode data = newObject();
    data.put("event_id", interaction.getInteractionId());
    putIfNotNull(data, "user_id", interaction.getUserId());
    putIfNotNull(data, "event", interaction.getEvent());
    data.put("timestamp", isoTimestamp(interaction.getStartTime()));

    ObjectNode properties = data.putObject("properties");
    properties.set("$context", context());
    properties.put("latency_ms", Math.max(0L, endTime - interaction.getStartTime()));
    properties.put("span_count", spans.size());
    putIfNotNull(properties, "error", error);
    Map<String, Object> callerProperties = interaction.getProperties();
    synchronized (callerProperties) {
      putAll(properties, callerProperties);
    }

    ObjectNode aiData = data.putObject("ai_data");
    putIfNotNull(aiData, "input", interaction.getInput());
    putIfNotNull(aiData, "output", interaction.getOutput());
    putIfNotNull(aiData, "model", interaction.getModel());
    putIfNotNull(aiData, "convo_id", interaction.getConversationId());

    List<ObjectNode> attachments = new ArrayList<>();
    List<Attachment> callerAttachments = interaction.getAttachments();
    synchronized (callerAttachments) {
      for (Attachment attachment : callerAttachments) {
        attachments.add(formatAttachment(attachment));
      }
    }
    for (SpanData span : spans) {
      Map<String, Object> value = new LinkedHashMap<>();
      value.put("spanId", span.getSpanId());
      value.put("input", span.getInput());
      value.put("output", span.getOutput());
      value.put("latencyMs", span.getLatencyMs());
      value.put("error", span.getError());
      value.put("properties", span.getProperties());
      attachments.add(codeAttachment(span.getKind().getValue() + ":" + span.getName(), value));
    }
    if (!attachments.isEmpty()) {
      data.putArray("attachments").addAll(attachments);
    }
    return data;
  }

  /**
   * Formats user feedback for the signals endpoint.
   *
   * @param traceId
   *            the trace or interaction the feedback refers to
   * @param feedback
   *            the feedback
   * @return the payload
   */
  public static ObjectNode formatFeedback(String traceId, FeedbackOptions feedback) {
    ObjectNode data = newObject();
    data.put("event_id", traceId);
    data.put("signal_name", feedback.getSignalName());
    data.put("sentiment", feedback.getSentiment().name());
    data.put("signal_type", feedback.getSignalType().getValue());
    data.put("timestamp", feedback.getTimestamp() != null ? feedback.getTimestamp() : Instant.now().toString());

    ObjectNode properties = data.putObject("properties");
    putIfNotNull(properties, "score", feedback.getScore());
    putIfNotNull(properties, "comment", feedback.getComment());
    putAll(properties, feedback.getProperties());

    putIfNotNull(data, "attachment_id", feedback.getAttachmentId());
    return data;
  }

  /**
   * Formats a custom signal for the signals endpoint.
   *
   * @param signal
   *            the signal
   * @return the payload
   */
  public static ObjectNode formatSignal(SignalOptions signal) {
    ObjectNode data = newObject();
    data.put("event_id", signal.getEventId());
    data.put("signal_name", signal.getName());
    data.put("signal_type", signal.getType().getValue());
    data.put("sentiment", signal.getSentiment().name());
    data.put("timestamp", Instant.now().toString());

    ObjectNode properties = data.putObject("properties");
    putIfNotNull(properties, "comment", emptyToNull(signal.getComment()));
    putIfNotNull(properties, "after", emptyToNull(signal.getAfter()));
    putAll(properties, signal.getProperties());

    putIfNotNull(data, "attachment_id", signal.getAttachmentId());
    return data;
  }

  /**
   * Formats a user identification for the identify endpoint.
   *
   * @param userId
   *            the user id
   * @param traits
   *            the user traits
   * @return the payload
   */
  public static ObjectNode formatIdentify(String userId, UserTraits traits) {
    ObjectNode data = newObject();
    data.put("user_id", userId);
    data.set("traits", JsonUtils.toSafeNode(traits != null ? traits.toMap() : Map.of()));
    return data;
  }

  /**
   * Returns the library metadata attached to trace and interaction payloads.
   *
   * @return the {@code $context} object
   */
  public static ObjectNode context() {
    ObjectNode context = newObject();
    ObjectNode library = context.putObject("library");
    library.put("name", LIBRARY_NAME);
    library.put("version", LIBRARY_VERSION);
    context.putObject("metadata").put("javaVersion", System.getProperty("java.version", "unknown"));
    return context;
  }

  static String isoTimestamp(long epochMillis) {
    return Instant.ofEpochMilli(epochMillis).toString();
  }

  private static ObjectNode formatAttachment(Attachment attachment) {
    ObjectNode node = newObject();
    putIfNotNull(node, "attachment_id", attachment.getAttachmentId());
    node.put("type", attachment.getType());
    putIfNotNull(node, "name", attachment.getName());
    node.put("value", attachment.getValue());
    node.put("role", attachment.getRole());
    putIfNotNull(node, "language", attachment.getLanguage());
    return node;
  }

  private static ObjectNode codeAttachment(String name, Map<String, Object> value) {
    ObjectNode node = newObject();
    node.put("type", "code");
    node.put("name", name);
    node.put("value", JsonUtils.toApiString(value));
    node.put("role", "output");
    node.put("language", "json");
    return node;
  }

  private static void putAll(ObjectNode target, Map<String, ?> values) {
    if (values == null) {
      return;
    }
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      putIfNotNull(target, entry.getKey(), entry.getValue());
    }
  }

  private static void putIfNotNull(ObjectNode target, String key, Object value) {
    if (value == null || key == null) {
      return;
    }
    JsonNode node = JsonUtils.toSafeNode(value);
    if (!node.isNull()) {
      target.set(key, node);
    }
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  private static ObjectNode newObject() {
    return JsonUtils.getObjectMapper().createObjectNode();
  }
}
