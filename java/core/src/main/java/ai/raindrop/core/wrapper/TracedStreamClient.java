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
 * A streaming provider client whose streams are traced. Recording is deferred
 * until the returned stream is exhausted, fails, or is closed.
 *
 * @param <Q>
 *            request type
 * @param <C>
 *            chunk type
 */
public class TracedStreamClient<Q, C> {

  private final WrapperContext context;
  private final StreamAdapter<Q, C> adapter;
  private final StreamingProviderCall<Q, C> delegate;

  public TracedStreamClient(WrapperContext context, StreamAdapter<Q, C> adapter,
      StreamingProviderCall<Q, C> delegate) {
    this.context = context;
    this.adapter = adapter;
    this.delegate = delegate;
  }

  public TracedStream<C> stream(Q request) throws Exception {
    return stream(request, CallOptions.none());
  }

  /**
   * Opens the stream. A failure to open is recorded immediately.
   *
   * @param request
   *            the provider request
   * @param options
   *            per-call tracing options
   * @return the traced stream
   * @throws Exception
   *             whatever opening the provider stream throws
   */
  public TracedStream<C> stream(Q request, CallOptions options) throws Exception {
    ProviderCallRecorder recorder = ProviderCallRecorder.start(context,
        TracedClient.extract(adapter::getProvider, "provider"),
        TracedClient.extract(() -> adapter.getModel(request), "model"),
        TracedClient.extract(() -> adapter.getInput(request), "input"), options);
    try {
      return new TracedStream<>(delegate.call(request), adapter::accumulate, recorder);
    } catch (Exception | Error e) {
      recorder.finish(null, null, null, null, null, TracedClient.errorMessage(e));
      throw e;
    }
  }
}
