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

import java.util.List;
import java.util.Map;

import ai.raindrop.core.model.TokenUsage;
import ai.raindrop.core.model.ToolCall;

/**
 * Extracts telemetry from a provider's request and response types. One
 * adapter exists per provider SDK; the tracing itself is done by
 * {@link TracedClient}.
 *
 * @param <Q>
 *            request type
 * @param <R>
 *            response type
 */
public interface ProviderAdapter<Q, R> {

  /**
   * Returns the provider name, such as {@code openai} or {@code anthropic}.
   *
   * @return the provider name
   */
  String getProvider();

  /**
   * Returns the model requested.
   *
   * @param request
   *            the request
   * @return the model id, or null if unknown
   */
  String getModel(Q request);

  /**
   * Returns the request input to record, typically the prompt or messages.
   *
   * @param request
   *            the request
   * @return the input
   */
  Object getInput(Q request);

  /**
   * Returns the output text of a response.
   *
   * @param response
   *            the response
   * @return the output text
   */
  Object getOutput(R response);

  /**
   * Returns the model reported by the response, when it differs from the
   * requested one.
   *
   * @param response
   *            the response
   * @return the model id, or null to keep the requested one
   */
  default String getResponseModel(R response) {
    return null;
  }

  default TokenUsage getTokens(R response) {
    return null;
  }

  default List<ToolCall> getToolCalls(R response) {
    return List.of();
  }

  /**
   * Returns provider specific properties, such as the stop reason.
   *
   * @param response
   *            the response
   * @return the properties
   */
  default Map<String, Object> getResponseProperties(R response) {
    return Map.of();
  }
}
