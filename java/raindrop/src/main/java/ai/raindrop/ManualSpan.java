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
package ai.raindrop;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import ai.raindrop.core.TelemetryRecorder;
import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SpanData;

/**
 * A span started and ended explicitly, for work whose start and end happen in
 * different places. The span belongs to the interaction that was current when
 * it started.
 *
 * <pre>{@code
 * ManualSpan span = raindrop.startSpan("process_document", SpanKind.TOOL, null);
 * span.recordInput(Map.of("doc_id", "123"));
 * try {
 * 	span.recordOutput(process(docId));
 * 	span.end();
 * } catch (RuntimeException e) {
 * 	span.end(e.getMessage());
 * }
 * }</pre>
 */
public class ManualSpan {

  private final SpanData span;
  private final InteractionContext interaction;
  private final TelemetryRecorder recorder;
  private final AtomicBoolean ended = new AtomicBoolean(false);

  ManualSpan(SpanData span, InteractionContext interaction, TelemetryRecorder recorder) {
    this.span = span;
    this.interaction = interaction;
    this.recorder = recorder;
  }

  public String getId() {
    return span.getSpanId();
  }

  public ManualSpan recordInput(Object input) {
    span.setInput(input);
    return this;
  }

  public ManualSpan recordOutput(Object output) {
    span.setOutput(output);
    return this;
  }

  public ManualSpan setProperties(Map<String, ?> properties) {
    span.putProperties(properties);
    return this;
  }

  public boolean isEnded() {
    return ended.get();
  }

  public void end() {
    end(null);
  }

  /**
   * Ends the span and records it. Later calls have no effect.
   *
   * @param error
   *            the error message, or null on success
   */
  public void end(String error) {
    if (!ended.compareAndSet(false, true)) {
      return;
    }
    span.finish(System.currentTimeMillis(), span.getOutput(), error);
    recorder.completeSpan(span, interaction);
  }
}
