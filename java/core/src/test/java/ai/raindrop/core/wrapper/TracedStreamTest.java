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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import ai.raindrop.core.model.TokenUsage;
import ai.raindrop.core.model.TraceData;

/**
 * Unit tests for TracedStream and TracedStreamClient.
 */
class TracedStreamTest {

  private WrapperContext context;
  private final FakeChat.StreamingAdapter adapter = new FakeChat.StreamingAdapter();
  private final FakeChat.Request request = new FakeChat.Request("gpt-4o", "Tell me a story");

  @BeforeEach
  void setUp() {
    context = mock(WrapperContext.class);
    when(context.generateTraceId()).thenReturn("trace_stream");
  }

  private TracedStreamClient<FakeChat.Request, FakeChat.Chunk> client(List<FakeChat.Chunk> chunks) {
    return new TracedStreamClient<>(context, adapter, r -> chunks.iterator());
  }

  private TraceData capturedTrace() {
    ArgumentCaptor<TraceData> captor = ArgumentCaptor.forClass(TraceData.class);
    verify(context).sendTrace(captor.capture());
    return captor.getValue();
  }

  @Test
  void testExhaustedStreamRecordsAccumulatedOutput() throws Exception {
    List<FakeChat.Chunk> chunks = List.of(new FakeChat.Chunk("Once ", null), new FakeChat.Chunk("upon ", null),
        new FakeChat.Chunk("a time", TokenUsage.of(5, 3)));

    List<String> seen = new ArrayList<>();
    try (TracedStream<FakeChat.Chunk> stream = client(chunks).stream(request)) {
      assertEquals("trace_stream", stream.getTraceId());
      while (stream.hasNext()) {
        seen.add(stream.next().delta);
      }
    }

    assertEquals(List.of("Once ", "upon ", "a time"), seen);
    TraceData trace = capturedTrace();
    assertEquals("Once upon a time", trace.getOutput());
    assertEquals(8, trace.getTokens().getTotal());
    assertNull(trace.getError());
  }

  @Test
  void testNothingRecordedUntilStreamEnds() throws Exception {
    TracedStream<FakeChat.Chunk> stream = client(List.of(new FakeChat.Chunk("a", null), new FakeChat.Chunk("b", null)))
        .stream(request);

    stream.next();

    verify(context, never()).sendTrace(any());
    stream.close();
  }

  @Test
  void testEarlyCloseRecordsError() throws Exception {
    TracedStream<FakeChat.Chunk> stream = client(List.of(new FakeChat.Chunk("partial", null),
        new FakeChat.Chunk(" rest", null))).stream(request);

    stream.next();
    stream.close();
    stream.close();

    TraceData trace = capturedTrace();
    assertEquals(TracedStream.CLOSED_EARLY, trace.getError());
    assertNull(trace.getOutput());
    assertEquals("partial", trace.getProperties().get("partial_output"));
    assertFalse(stream.hasNext());
  }

  @Test
  void testIteratorFailureRecordsErrorAndRethrows() throws Exception {
    Iterator<FakeChat.Chunk> failing = new Iterator<FakeChat.Chunk>() {
      private int served;

      @Override
      public boolean hasNext() {
        if (served == 1) {
          throw new IllegalStateException("connection dropped");
        }
        return true;
      }

      @Override
      public FakeChat.Chunk next() {
        served++;
        return new FakeChat.Chunk("half", null);
      }
    };
    TracedStreamClient<FakeChat.Request, FakeChat.Chunk> client = new TracedStreamClient<>(context, adapter,
        r -> failing);

    TracedStream<FakeChat.Chunk> stream = client.stream(request);
    assertTrue(stream.hasNext());
    stream.next();
    assertThrows(IllegalStateException.class, stream::hasNext);

    TraceData trace = capturedTrace();
    assertEquals("connection dropped", trace.getError());
    assertEquals("half", trace.getProperties().get("partial_output"));
  }

  @Test
  void testFailureToOpenIsRecorded() {
    TracedStreamClient<FakeChat.Request, FakeChat.Chunk> client = new TracedStreamClient<>(context, adapter, r -> {
      throw new IllegalArgumentException("bad request");
    });

    assertThrows(IllegalArgumentException.class, () -> client.stream(request));

    assertEquals("bad request", capturedTrace().getError());
  }

  @Test
  void testNextAfterCompletionThrows() throws Exception {
    TracedStream<FakeChat.Chunk> stream = client(List.of(new FakeChat.Chunk("x", null))).stream(request);
    stream.next();
    assertFalse(stream.hasNext());

    assertThrows(NoSuchElementException.class, stream::next);
    verify(context, times(1)).sendTrace(any());
  }

  @Test
  @SuppressWarnings("unchecked")
  void testBrokenChunkAdapterDoesNotBreakStream() throws Exception {
    StreamAdapter<FakeChat.Request, FakeChat.Chunk> broken = mock(StreamAdapter.class);
    when(broken.getProvider()).thenReturn("fake");
    doThrow(new IllegalStateException("unexpected chunk")).when(broken).accumulate(any(), any());
    TracedStreamClient<FakeChat.Request, FakeChat.Chunk> client = new TracedStreamClient<>(context, broken,
        r -> List.of(new FakeChat.Chunk("a", null)).iterator());

    TracedStream<FakeChat.Chunk> stream = client.stream(request);
    assertEquals("a", stream.next().delta);
    assertFalse(stream.hasNext());

    assertNull(capturedTrace().getError());
  }

  @Test
  void testFailingRequestExtractionStillOpensStream() throws Exception {
    FakeChat.StreamingAdapter brokenModel = new FakeChat.StreamingAdapter() {
      @Override
      public String getModel(FakeChat.Request request) {
        throw new IllegalStateException("no model");
      }
    };
    TracedStreamClient<FakeChat.Request, FakeChat.Chunk> client = new TracedStreamClient<>(context, brokenModel,
        r -> List.of(new FakeChat.Chunk("hi", null)).iterator());

    try (TracedStream<FakeChat.Chunk> stream = client.stream(request)) {
      while (stream.hasNext()) {
        stream.next();
      }
    }

    TraceData trace = capturedTrace();
    assertEquals("unknown", trace.getModel());
    assertEquals("hi", trace.getOutput());
  }
}
