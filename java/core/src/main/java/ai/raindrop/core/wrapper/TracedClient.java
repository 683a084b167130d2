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

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A provider client whose calls are traced. Every call, successful or not, is
 * recorded as a span of the active interaction or as a standalone trace.
 *
 * @param <Q>
 *            request type
 * @param <R>
 *            response type
 */
public class TracedClient<Q, R> {

  private static final Logger logger = LoggerFactory.getLogger(TracedClient.class);

  private final WrapperContext context;
  private final ProviderAdapter<Q, R> adapter;
  private final ProviderCall<Q, R> delegate;

  /**
   * Creates a new TracedClient.
   *
   * @param context
   *            the telemetry pipeline
   * @param adapter
   *            extracts telemetry from requests and responses
   * @param delegate
   *            the underlying provider call
   */
  public TracedClient(WrapperContext context, ProviderAdapter<Q, R> adapter, ProviderCall<Q, R> delegate) {
    this.context = context;
    this.adapter = adapter;
    this.delegate = delegate;
  }

  public TracedResponse<R> call(Q request) throws Exception {
    return call(request, CallOptions.none());
  }

  /**
   * Performs the call and records it.
   *
   * @param request
   *            the provider request
   * @param options
   *            per-call tracing options
   * @return the response and its trace id
   * @throws Exception
   *             whatever the provider call throws, after the failure is
   *             recorded
   */
  public TracedResponse<R> call(Q request, CallOptions options) throws Exception {
    ProviderCallRecorder recorder = ProviderCallRecorder.start(context, extract(adapter::getProvider, "provider"),
        extract(() -> adapter.getModel(request), "model"), extract(() -> adapter.getInput(request), "input"),
        options);
    R response;
    try {
      response = delegate.call(request);
    } catch (Exception | Error e) {
      recorder.finish(null, null, null, null, null, errorMessage(e));
      throw e;
    }
    recorder.finish(extract(() -> adapter.getOutput(response), "output"),
        extract(() -> adapter.getResponseModel(response), "response model"),
        extract(() -> adapter.getTokens(response), "token usage"),
        extract(() -> adapter.getToolCalls(response), "tool calls"),
        extract(() -> adapter.getResponseProperties(response), "response properties"), null);
    return new TracedResponse<>(recorder.getTraceId(), response);
  }

  /**
   * Runs one adapter extraction. A failing adapter yields null so that the
   * provider call still completes and is still recorded.
   *
   * @param extraction
   *            the adapter call
   * @param what
   *            what is being extracted, for the log line
   * @return the extracted value, or null if the adapter threw
   */
  static <T> T extract(Supplier<T> extraction, String what) {
    try {
      return extraction.get();
    } catch (RuntimeException e) {
      logger.debug("Failed to extract {} from provider call: {}", what, e.getMessage());
      return null;
    }
  }

  static String errorMessage(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
  }
}
