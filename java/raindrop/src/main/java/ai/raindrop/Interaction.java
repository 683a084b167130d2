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

import java.util.List;
import java.util.Map;

import ai.raindrop.core.TelemetryRecorder;
import ai.raindrop.core.context.CurrentInteraction;
import ai.raindrop.core.model.Attachment;
import ai.raindrop.core.model.InteractionContext;

/**
 * Handle for a manually managed interaction, returned by
 * {@link Raindrop#begin(BeginOptions)} and
 * {@link Raindrop#resumeInteraction(String)}.
 *
 * <p>
 * The interaction is current on the thread that began or resumed it until it
 * is finished. Finishing is idempotent: only the first call sends the
 * interaction.
 *
 * <pre>{@code
 * Interaction interaction = raindrop.begin(BeginOptions.builder().event("webhook_handler").build());
 * // ... work across functions and threads ...
 * interaction.finish(FinishOptions.output("Final response"));
 * }</pre>
 */
public class Interaction implements AutoCloseable {

  private final InteractionContext context;
  private final TelemetryRecorder recorder;
  private final CurrentInteraction.Scope scope;

  Interaction(InteractionContext context, TelemetryRecorder recorder, CurrentInteraction.Scope scope) {
    this.context = context;
    this.recorder = recorder;
    this.scope = scope;
  }

  /**
   * Returns the interaction id, which is also the event id feedback refers to.
   *
   * @return the id
   */
  public String getId() {
    return context.getInteractionId();
  }

  public String getOutput() {
    return context.getOutput();
  }

  public Interaction setOutput(String output) {
    context.setOutput(output);
    return this;
  }

  public Interaction setInput(String input) {
    context.setInput(input);
    return this;
  }

  public Interaction setProperty(String key, Object value) {
    context.getProperties().put(key, value);
    return this;
  }

  public Interaction setProperties(Map<String, ?> properties) {
    if (properties != null) {
      context.getProperties().putAll(properties);
    }
    return this;
  }

  public Interaction addAttachments(List<Attachment> attachments) {
    if (attachments != null) {
      context.getAttachments().addAll(attachments);
    }
    return this;
  }

  public boolean isFinished() {
    return context.isFinished();
  }

  /**
   * Returns the underlying interaction state.
   *
   * @return the context
   */
  public InteractionContext getContext() {
    return context;
  }

  public void finish() {
    finish(null);
  }

  /**
   * Finishes the interaction and queues it for delivery. Has no effect if the
   * interaction already finished.
   *
   * @param options
   *            output, properties and attachments to merge, may be null
   */
  public void finish(FinishOptions options) {
    if (context.isFinished()) {
      return;
    }
    releaseCurrent();
    recorder.finishInteraction(context, null, options == null ? null : finished -> {
      if (options.getOutput() != null) {
        finished.setOutput(options.getOutput());
      }
      finished.getProperties().putAll(options.getProperties());
      finished.getAttachments().addAll(options.getAttachments());
    });
  }

  /**
   * Finishes the interaction, see {@link #finish()}.
   */
  @Override
  public void close() {
    finish();
  }

  private void releaseCurrent() {
    if (scope != null && scope.isOwnedByCurrentThread() && CurrentInteraction.get() == context) {
      scope.close();
    } else {
      CurrentInteraction.clearIfCurrent(context);
    }
  }

  @Override
  public String toString() {
    return "Interaction{id='" + getId() + "', finished=" + isFinished() + "}";
  }
}
