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
package ai.raindrop.plugins.otel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.raindrop.core.JsonUtils;
import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SpanData;
import ai.raindrop.core.model.TokenUsage;
import ai.raindrop.core.model.ToolCall;
import ai.raindrop.core.model.TraceData;
import ai.raindrop.core.plugin.RaindropPlugin;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

/**
 * Exports interactions, spans and traces as OpenTelemetry spans.
 *
 * <p>
 * An interaction becomes a span named {@code interaction:<event>} that is
 * started when the interaction begins and ended when it finishes. Spans of
 * that interaction become its children, named {@code <kind>:<name>}.
 * Standalone traces become root spans named {@code ai:<provider>:<model>}.
 * Attributes are prefixed with the configured prefix, {@code raindrop} by
 * default.
 *
 * <p>
 * The plugin only creates spans; exporting them is left to the tracer provider
 * the host application configures.
 */
public class OtelExportPlugin implements RaindropPlugin {

  private static final Logger logger = LoggerFactory.getLogger(OtelExportPlugin.class);

  public static final String NAME = "otel-export";

  private final OtelPluginOptions options;
  private final String prefix;
  private final Map<String, Span> activeSpans = new ConcurrentHashMap<>();
  private volatile Tracer tracer;

  public OtelExportPlugin() {
    this(OtelPluginOptions.builder().build());
  }

  public OtelExportPlugin(OtelPluginOptions options) {
    this.options = options;
    this.prefix = options.getAttributePrefix();
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public void onInteractionStart(InteractionContext interaction) {
    String event = interaction.getEvent() != null ? interaction.getEvent() : "default";
    Span span = getTracer().spanBuilder("interaction:" + event).setSpanKind(SpanKind.INTERNAL)
        .setStartTimestamp(interaction.getStartTime(), TimeUnit.MILLISECONDS).startSpan();

    span.setAttribute(attr("interaction_id"), interaction.getInteractionId());
    span.setAttribute(attr("type"), "interaction");
    if (options.isIncludeContent() && interaction.getInput() != null) {
      span.setAttribute(attr("input"), interaction.getInput());
    }
    setCommonAttributes(span, interaction.getUserId(), interaction.getConversationId(), interaction.getModel(),
        null, null, null);

    activeSpans.put(interaction.getInteractionId(), span);
  }

  @Override
  public void onInteractionEnd(InteractionContext interaction) {
    Span span = activeSpans.remove(interaction.getInteractionId());
    if (span == null) {
      return;
    }
    if (options.isIncludeContent() && interaction.getOutput() != null) {
      span.setAttribute(attr("output"), interaction.getOutput());
    }
    long endTime = Math.max(System.currentTimeMillis(), interaction.getStartTime());
    span.setAttribute(attr("latency_ms"), endTime - interaction.getStartTime());
    span.setAttribute(attr("span_count"), (long) interaction.getSpans().size());
    span.setStatus(StatusCode.OK);
    span.end(endTime, TimeUnit.MILLISECONDS);
  }

  @Override
  public void onSpan(SpanData spanData) {
    SpanBuilder builder = getTracer().spanBuilder(spanData.getKind().getValue() + ":" + spanData.getName())
        .setSpanKind(SpanKind.INTERNAL).setStartTimestamp(spanData.getStartTime(), TimeUnit.MILLISECONDS);
    Span parent = spanData.getParentId() != null ? activeSpans.get(spanData.getParentId()) : null;
    if (parent != null) {
      builder.setParent(Context.root().with(parent));
    } else {
      builder.setNoParent();
    }
    Span span = builder.startSpan();

    span.setAttribute(attr("span_id"), spanData.getSpanId());
    span.setAttribute(attr("type"), spanData.getKind().getValue());
    span.setAttribute(attr("name"), spanData.getName());
    if (spanData.getParentId() != null) {
      span.setAttribute(attr("parent_id"), spanData.getParentId());
    }
    if (options.isIncludeContent()) {
      setContent(span, "input", spanData.getInput());
      setContent(span, "output", spanData.getOutput());
    }
    setCommonAttributes(span, null, null, null, null, spanData.getLatencyMs(), spanData.getError());
    if (spanData.getError() == null) {
      span.setStatus(StatusCode.OK);
    }

    Long endTime = spanData.getEndTime();
    span.end(endTime != null ? endTime : spanData.getStartTime(), TimeUnit.MILLISECONDS);
  }

  @Override
  public void onTrace(TraceData trace) {
    Span span = getTracer().spanBuilder("ai:" + trace.getProvider() + ":" + trace.getModel())
        .setSpanKind(SpanKind.CLIENT).setNoParent().setStartTimestamp(trace.getStartTime(), TimeUnit.MILLISECONDS)
        .startSpan();

    span.setAttribute(attr("trace_id"), trace.getTraceId());
    span.setAttribute(attr("type"), "ai");
    if (options.isIncludeContent()) {
      setContent(span, "input", trace.getInput());
      setContent(span, "output", trace.getOutput());
    }

    TokenUsage tokens = trace.getTokens();
    if (tokens != null) {
      setPositive(span, "tokens.input", tokens.getInput());
      setPositive(span, "tokens.output", tokens.getOutput());
      setPositive(span, "tokens.total", tokens.getTotal());
    }

    List<ToolCall> toolCalls = trace.getToolCalls();
    if (toolCalls != null && !toolCalls.isEmpty()) {
      List<String> names = new ArrayList<>();
      for (ToolCall toolCall : toolCalls) {
        names.add(toolCall.getName());
      }
      span.setAttribute(attr("tool_calls_count"), (long) toolCalls.size());
      span.setAttribute(attr("tool_calls"), names.toString());
    }

    setCommonAttributes(span, trace.getUserId(), trace.getConversationId(), trace.getModel(), trace.getProvider(),
        trace.getLatencyMs(), trace.getError());
    if (trace.getError() == null) {
      span.setStatus(StatusCode.OK);
    }

    Long endTime = trace.getEndTime();
    span.end(endTime != null ? endTime : trace.getStartTime(), TimeUnit.MILLISECONDS);
  }

  /**
   * Drops interaction spans that never finished. Span export is flushed by the
   * tracer provider, not by this plugin.
   *
   * @return a completed future
   */
  @Override
  public CompletableFuture<Void> shutdown() {
    if (!activeSpans.isEmpty()) {
      logger.debug("Discarding {} unfinished interaction spans", activeSpans.size());
    }
    activeSpans.clear();
    return CompletableFuture.completedFuture(null);
  }

  /**
   * Returns the number of interactions whose span is still open.
   *
   * @return the open interaction count
   */
  public int getActiveSpanCount() {
    return activeSpans.size();
  }

  private Tracer getTracer() {
    Tracer current = tracer;
    if (current == null) {
      current = options.getOpenTelemetry().getTracer(options.getTracerName());
      tracer = current;
    }
    return current;
  }

  private void setCommonAttributes(Span span, String userId, String conversationId, String model, String provider,
      Long latencyMs, String error) {
    span.setAttribute(attr("service"), options.getServiceName());
    setIfPresent(span, "user_id", userId);
    setIfPresent(span, "conversation_id", conversationId);
    setIfPresent(span, "model", model);
    setIfPresent(span, "provider", provider);
    if (latencyMs != null && latencyMs > 0) {
      span.setAttribute(attr("latency_ms"), latencyMs);
    }
    if (error != null && !error.isEmpty()) {
      span.setAttribute(attr("error"), error);
      span.setStatus(StatusCode.ERROR, error);
    }
  }

  private void setContent(Span span, String key, Object value) {
    String text = JsonUtils.toApiString(value);
    if (text != null && !text.isEmpty()) {
      span.setAttribute(attr(key), text);
    }
  }

  private void setIfPresent(Span span, String key, String value) {
    if (value != null && !value.isEmpty()) {
      span.setAttribute(attr(key), value);
    }
  }

  private void setPositive(Span span, String key, Integer value) {
    if (value != null && value > 0) {
      span.setAttribute(attr(key), value.longValue());
    }
  }

  private String attr(String name) {
    return prefix + "." + name;
  }
}
