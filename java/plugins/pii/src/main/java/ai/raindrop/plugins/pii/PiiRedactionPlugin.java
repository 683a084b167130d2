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
package ai.raindrop.plugins.pii;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.raindrop.core.model.Attachment;
import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SpanData;
import ai.raindrop.core.model.ToolCall;
import ai.raindrop.core.model.TraceData;
import ai.raindrop.core.plugin.PluginHook;
import ai.raindrop.core.plugin.RaindropPlugin;

/**
 * Redacts PII from interactions, spans and traces before they are sent. Place
 * it first in the plugin list so that later plugins only see redacted data.
 */
public class PiiRedactionPlugin implements RaindropPlugin {

  private static final Logger logger = LoggerFactory.getLogger(PiiRedactionPlugin.class);

  public static final String NAME = "pii-redaction";

  private final PiiRedactor redactor;

  public PiiRedactionPlugin() {
    this(PiiPluginOptions.builder().build());
  }

  public PiiRedactionPlugin(PiiPluginOptions options) {
    this.redactor = new PiiRedactor(options);
    logger.debug("PII redaction enabled for {}", options.getPatterns());
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public boolean supports(PluginHook hook) {
    return hook == PluginHook.INTERACTION_END || hook == PluginHook.SPAN || hook == PluginHook.TRACE;
  }

  @Override
  public void onInteractionEnd(InteractionContext interaction) {
    interaction.setInput(redactor.redact(interaction.getInput()));
    interaction.setOutput(redactor.redact(interaction.getOutput()));

    Map<String, Object> properties = interaction.getProperties();
    synchronized (properties) {
      for (Map.Entry<String, Object> entry : properties.entrySet()) {
        entry.setValue(redactor.redactObject(entry.getValue()));
      }
    }

    List<Attachment> attachments = interaction.getAttachments();
    synchronized (attachments) {
      for (Attachment attachment : attachments) {
        attachment.setValue(redactor.redact(attachment.getValue()));
        if (attachment.getName() != null) {
          attachment.setName(redactor.redact(attachment.getName()));
        }
      }
    }

    // Spans were redacted in onSpan; this covers spans appended by other routes.
    for (SpanData span : interaction.getSpans()) {
      onSpan(span);
    }
  }

  @Override
  public void onSpan(SpanData span) {
    span.setInput(redactor.redactObject(span.getInput()));
    span.setOutput(redactor.redactObject(span.getOutput()));
    span.setError(redactor.redact(span.getError()));
    span.setProperties(redactor.redactProperties(span.getProperties()));
  }

  @Override
  public void onTrace(TraceData trace) {
    trace.setInput(redactor.redactObject(trace.getInput()));
    trace.setOutput(redactor.redactObject(trace.getOutput()));
    if (trace.getToolCalls() != null) {
      for (ToolCall toolCall : trace.getToolCalls()) {
        toolCall.setArguments(redactor.redactObject(toolCall.getArguments()));
        toolCall.setResult(redactor.redactObject(toolCall.getResult()));
      }
    }
    trace.setError(redactor.redact(trace.getError()));
    trace.setProperties(redactor.redactProperties(trace.getProperties()));
  }

  public PiiRedactor getRedactor() {
    return redactor;
  }
}
