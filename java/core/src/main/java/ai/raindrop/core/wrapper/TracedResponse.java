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
 * A provider response together with the trace id it was recorded under. The
 * trace id is what feedback and signals refer to.
 *
 * @param <R>
 *            response type
 */
public final class TracedResponse<R> {

  private final String traceId;
  private final R response;

  public TracedResponse(String traceId, R response) {
    this.traceId = traceId;
    this.response = response;
  }

  public String getTraceId() {
    return traceId;
  }

  public R getResponse() {
    return response;
  }
}
