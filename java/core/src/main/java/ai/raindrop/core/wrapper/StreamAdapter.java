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

/**
 * Extracts telemetry from a provider's streaming request and chunk types.
 *
 * @param <Q>
 *            request type
 * @param <C>
 *            chunk type
 */
public interface StreamAdapter<Q, C> {

  String getProvider();

  String getModel(Q request);

  Object getInput(Q request);

  /**
   * Folds one chunk into the accumulator: appends text deltas, records token
   * usage and tool calls.
   *
   * @param accumulator
   *            the accumulator for this stream
   * @param chunk
   *            the chunk
   */
  void accumulate(StreamAccumulator accumulator, C chunk);
}
