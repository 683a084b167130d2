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
package ai.raindrop.core.plugin;

import java.util.concurrent.CompletableFuture;

import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SpanData;
import ai.raindrop.core.model.TraceData;

/**
 * RaindropPlugin is the interface implemented by observers that inspect,
 * mutate or export telemetry before it leaves the process.
 *
 * <p>
 * The four data hooks run synchronously on the caller's thread, in
 * registration order, and receive the live object about to be sent. Changes
 * made by one plugin are seen by the next one and by the transport. An
 * exception thrown by a hook is logged and skipped.
 *
 * <p>
 * {@link #flush()} and {@link #shutdown()} may complete asynchronously. The
 * pipeline waits for them, with a timeout, before flushing or closing the
 * transport.
 *
 * <p>
 * Every hook has a no-op default. {@link #supports(PluginHook)} lets a plugin
 * opt out of hooks explicitly so the pipeline can skip them.
 */
public interface RaindropPlugin {

  /**
   * Returns the plugin name, used in diagnostics.
   *
   * @return the plugin name
   */
  String getName();

  /**
   * Returns whether the plugin implements the given hook.
   *
   * @param hook
   *            the hook
   * @return true if the hook should be invoked
   */
  default boolean supports(PluginHook hook) {
    return true;
  }

  /**
   * Called when an interaction begins.
   *
   * @param interaction
   *            the interaction
   */
  default void onInteractionStart(InteractionContext interaction) {
  }

  /**
   * Called when an interaction ends, before it is sent.
   *
   * @param interaction
   *            the interaction, including its spans
   */
  default void onInteractionEnd(InteractionContext interaction) {
  }

  /**
   * Called when a span completes, before it is stored in its interaction or
   * sent on its own.
   *
   * @param span
   *            the finished span
   */
  default void onSpan(SpanData span) {
  }

  /**
   * Called when a standalone trace is about to be sent.
   *
   * @param trace
   *            the trace
   */
  default void onTrace(TraceData trace) {
  }

  /**
   * Exports any data the plugin buffers.
   *
   * @return a future completing when the export is done
   */
  default CompletableFuture<Void> flush() {
    return CompletableFuture.completedFuture(null);
  }

  /**
   * Releases plugin resources.
   *
   * @return a future completing when the plugin is shut down
   */
  default CompletableFuture<Void> shutdown() {
    return CompletableFuture.completedFuture(null);
  }
}
