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
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SpanData;
import ai.raindrop.core.model.SpanKind;
import ai.raindrop.core.model.TokenUsage;
import ai.raindrop.core.model.ToolCall;
import ai.raindrop.core.model.TraceData;

/**
 * Records one provider call from start to finish. The trace id, start time and
 * active interaction are captured when the call starts. On finish the call
 * becomes an AI span of that interaction, or a standalone trace when no
 * interaction was active. A recorder finishes at most once.
 */
final class ProviderCallRecorder {

  private static final Logger logger = LoggerFactory.getLogger(ProviderCallRecorder.class);

  private final WrapperContext context;
  private final String traceId;
  private final String provider;
  private final String model;
  private final Object input;
  private final String userId;
  private final String conversationId;
  private final Map<String, Object> properties;
  private final InteractionContext interaction;
  private final long startTime;
  private final AtomicBoolean finished = new AtomicBoolean(false);

  private ProviderCallRecorder(WrapperContext context, String provider, String model, Object input,
      CallOptions options) {
    this.context = context;
    this.traceId = options.getTraceId() != null ? options.getTraceId() : context.generateTraceId();
    this.provider = provider != null ? provider : "unknown";
    this.model = model != null ? model : "unknown";
    this.input = input;
    this.userId = options.getUserId() != null ? options.getUserId() : context.getCurrentUserId();
    this.conversationId = options.getConversationId();
    this.properties = options.getProperties();
    this.interaction = context.getCurrentInteraction();
    this.startTime = System.currentTimeMillis();
  }

  static ProviderCallRecorder start(WrapperContext context, String provider, String model, Object input,
      CallOptions options) {
    ProviderCallRecorder recorder = new ProviderCallRecorder(context, provider, model, input,
        options != null ? options : CallOptions.none());
    if (context.isDebug()) {
      logger.info("{} call started: {}", recorder.provider, recorder.traceId);
    }
    return recorder;
  }

  String getTraceId() {
    return traceId;
  }

  boolean isFinished() {
    return finished.get();
  }

  /**
   * Finishes the call.
   *
   * @param output
   *            the output, ignored when an error is given
   * @param responseModel
   *            the model reported by the response, or null
   * @param tokens
   *            the token usage, or null
   * @param toolCalls
   *            the tool calls, may be empty
   * @param extra
   *            provider specific properties
   * @param error
   *            the error message, or null on success
   * @return true if this call finished the recorder
   */
  boolean finish(Object output, String responseModel, TokenUsage tokens, List<ToolCall> toolCalls,
      Map<String, Object> extra, String error) {
    if (!finished.compareAndSet(false, true)) {
      return false;
    }
    long endTime = System.currentTimeMillis();
    String effectiveModel = responseModel != null ? responseModel : model;
    Map<String, Object> props = new LinkedHashMap<>(properties);
    if (extra != null) {
      props.putAll(extra);
    }

    if (interaction != null && !interaction.isFinished()) {
      SpanData span = new SpanData(traceId, provider + ":" + effectiveModel, SpanKind.AI, startTime);
      span.setInput(input);
      if (tokens != null) {
        putIfNotNull(props, "input_tokens", tokens.getInput());
        putIfNotNull(props, "output_tokens", tokens.getOutput());
        putIfNotNull(props, "total_tokens", tokens.getTotal());
      }
      if (toolCalls != null && !toolCalls.isEmpty()) {
        props.put("tool_calls", toolCalls);
      }
      span.putProperties(props);
      span.finish(endTime, output, error);
      context.completeSpan(span, interaction);
    } else {
      TraceData trace = TraceData.builder().traceId(traceId).provider(provider).model(effectiveModel).input(input)
          .output(output).startTime(startTime).endTime(endTime).tokens(tokens).toolCalls(toolCalls)
          .userId(userId).conversationId(conversationId).error(error).properties(props).build();
      context.sendTrace(trace);
    }
    return true;
  }

  private static void putIfNotNull(Map<String, Object> target, String key, Object value) {
    if (value != null) {
      target.put(key, value);
    }
  }
}
