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

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An iterator over provider chunks that records the call once the stream ends.
 *
 * <p>
 * The call is recorded on exhaustion, on the first exception thrown by the
 * underlying iterator, or on {@link #close()} before exhaustion. On error the
 * text collected so far is kept as the {@code partial_output} property.
 *
 * @param <C>
 *            chunk type
 */
public class TracedStream<C> implements Iterator<C>, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(TracedStream.class);

  static final String CLOSED_EARLY = "Stream closed before completion";

  private final Iterator<C> delegate;
  private final BiConsumer<StreamAccumulator, C> chunkAdapter;
  private final ProviderCallRecorder recorder;
  private final StreamAccumulator accumulator = new StreamAccumulator();

  TracedStream(Iterator<C> delegate, BiConsumer<StreamAccumulator, C> chunkAdapter, ProviderCallRecorder recorder) {
    this.delegate = delegate;
    this.chunkAdapter = chunkAdapter;
    this.recorder = recorder;
  }

  public String getTraceId() {
    return recorder.getTraceId();
  }

  @Override
  public boolean hasNext() {
    if (recorder.isFinished()) {
      return false;
    }
    boolean hasNext;
    try {
      hasNext = delegate.hasNext();
    } catch (RuntimeException | Error e) {
      fail(e);
      throw e;
    }
    if (!hasNext) {
      succeed();
    }
    return hasNext;
  }

  @Override
  public C next() {
    if (recorder.isFinished()) {
      throw new NoSuchElementException();
    }
    C chunk;
    try {
      chunk = delegate.next();
    } catch (NoSuchElementException e) {
      succeed();
      throw e;
    } catch (RuntimeException | Error e) {
      fail(e);
      throw e;
    }
    try {
      chunkAdapter.accept(accumulator, chunk);
    } catch (RuntimeException e) {
      logger.debug("Failed to extract telemetry from chunk: {}", e.getMessage());
    }
    return chunk;
  }

  /**
   * Ends the stream. If it was not consumed to the end, the call is recorded as
   * failed. Closes the underlying iterator when it is closeable.
   */
  @Override
  public void close() {
    if (!recorder.isFinished()) {
      finish(CLOSED_EARLY);
    }
    if (delegate instanceof AutoCloseable) {
      try {
        ((AutoCloseable) delegate).close();
      } catch (Exception e) {
        logger.debug("Error closing provider stream", e);
      }
    }
  }

  private void succeed() {
    finish(null);
  }

  private void fail(Throwable error) {
    finish(TracedClient.errorMessage(error));
  }

  private void finish(String error) {
    Map<String, Object> extra = new LinkedHashMap<>(accumulator.getProperties());
    String text = accumulator.getText();
    if (error != null && !text.isEmpty()) {
      extra.put("partial_output", text);
    }
    recorder.finish(error == null ? text : null, accumulator.getModel(), accumulator.getTokens(),
        accumulator.getToolCalls(), extra, error);
  }
}
