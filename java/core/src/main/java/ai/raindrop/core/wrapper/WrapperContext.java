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

import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SpanData;
import ai.raindrop.core.model.TraceData;

/**
 * The services a provider wrapper needs from the telemetry pipeline.
 */
public interface WrapperContext {

  /**
   * Generates a new trace id.
   *
   * @return the trace id
   */
  String generateTraceId();

  /**
   * Returns the user id set by the last identify call.
   *
   * @return the user id, or null
   */
  String getCurrentUserId();

  /**
   * Returns the interaction active on the calling thread.
   *
   * @return the active, unfinished interaction, or null
   */
  InteractionContext getCurrentInteraction();

  /**
   * Runs span plugins and stores the span in the interaction, or sends it as a
   * standalone trace when there is no live interaction to hold it.
   *
   * @param span
   *            the finished span
   * @param interaction
   *            the interaction captured when the span started, or null
   */
  void completeSpan(SpanData span, InteractionContext interaction);

  /**
   * Runs trace plugins and queues the trace for delivery.
   *
   * @param trace
   *            the trace
   */
  void sendTrace(TraceData trace);

  boolean isDebug();
}
