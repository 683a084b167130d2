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
package ai.raindrop.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.JsonNode;

import ai.raindrop.core.context.CurrentInteraction;
import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SpanData;
import ai.raindrop.core.model.SpanKind;
import ai.raindrop.core.model.TraceData;
import ai.raindrop.core.plugin.PluginPipeline;
import ai.raindrop.core.plugin.RaindropPlugin;
import ai.raindrop.core.transport.RecordingEventSender;
import ai.raindrop.core.transport.Transport;
import ai.raindrop.core.transport.TransportConfig;

/**
 * Unit tests for TelemetryRecorder.
 */
class TelemetryRecorderTest {

  private RecordingEventSender sender;
  private RaindropPlugin plugin;
  private TelemetryRecorder recorder;

  @BeforeEach
  void setUp() {
    sender = new RecordingEventSender();
    plugin = mock(RaindropPlugin.class);
    when(plugin.getName()).thenReturn("recording");
    when(plugin.supports(any())).thenReturn(true);
    when(plugin.flush()).thenReturn(CompletableFuture.completedFuture(null));
    when(plugin.shutdown()).thenReturn(CompletableFuture.completedFuture(null));
    Transport transport = new Transport(
        TransportConfig.builder().apiKey("k").flushInterval(Duration.ofHours(1)).build(), sender);
    recorder = new TelemetryRecorder(transport, new PluginPipeline(List.of(plugin), false, Duration.ofSeconds(1)),
        false);
  }

  @AfterEach
  void tearDown() {
    recorder.close();
    CurrentInteraction.clearIfCurrent(CurrentInteraction.get());
  }

  @Test
  void testTraceIdsArePrefixedAndUnique() {
    String first = recorder.generateTraceId();
    String second = recorder.generateTraceId();

    assertTrue(first.startsWith("trace_"));
    assertNotEquals(first, second);
  }

  @Test
  void testStartInteractionRegistersAndNotifiesPlugins() {
    InteractionContext interaction = new InteractionContext("int-1", System.currentTimeMillis());

    recorder.startInteraction(interaction);

    assertSame(interaction, recorder.lookupActive("int-1"));
    verify(plugin).onInteractionStart(interaction);
  }

  @Test
  void testSpanInsideInteractionIsAppended() {
    InteractionContext interaction = new InteractionContext("int-1", System.currentTimeMillis());
    recorder.startInteraction(interaction);
    SpanData span = new SpanData("span-1", "lookup", SpanKind.TOOL, interaction.getStartTime());
    span.finish(interaction.getStartTime() + 5, "ok", null);

    recorder.completeSpan(span, interaction);

    ArgumentCaptor<SpanData> captor = ArgumentCaptor.forClass(SpanData.class);
    verify(plugin).onSpan(captor.capture());
    assertEquals("int-1", captor.getValue().getParentId());
    assertEquals(1, interaction.getSpans().size());
    assertEquals(0, recorder.getTransport().getQueueSize());
  }

  @Test
  void testStandaloneSpanBecomesTrace() {
    recorder.setCurrentUserId("user-7");
    SpanData span = new SpanData("span-9", "lookup", SpanKind.TOOL, 1000L);
    span.finish(1010L, "ok", null);

    recorder.completeSpan(span, null);
    recorder.flush();

    assertEquals("span-9", recorder.getLastTraceId());
    JsonNode event = sender.getRequests("/events/track").get(0).json().get(0);
    assertEquals("span-9", event.get("event_id").asText());
    assertEquals("user-7", event.get("user_id").asText());
    assertEquals("tool:lookup", event.get("ai_data").get("model").asText());
    verify(plugin, never()).onTrace(any());
  }

  @Test
  void testSpanForFinishedInteractionBecomesTrace() {
    InteractionContext interaction = new InteractionContext("int-1", System.currentTimeMillis());
    recorder.startInteraction(interaction);
    recorder.finishInteraction(interaction, null);
    SpanData late = new SpanData("span-late", "lookup", SpanKind.TOOL, System.currentTimeMillis());
    late.finish(System.currentTimeMillis(), "ok", null);

    recorder.completeSpan(late, interaction);

    assertTrue(interaction.getSpans().isEmpty());
    assertEquals("span-late", recorder.getLastTraceId());
    assertEquals(2, recorder.getTransport().getQueueSize());
  }

  @Test
  void testFinishInteractionSendsOnce() {
    InteractionContext interaction = new InteractionContext("int-1", System.currentTimeMillis());
    recorder.startInteraction(interaction);

    assertTrue(recorder.finishInteraction(interaction, "failed"));
    assertFalse(recorder.finishInteraction(interaction, null));
    recorder.flush();

    verify(plugin, times(1)).onInteractionEnd(interaction);
    assertFalse(recorder.getRegistry().isActive("int-1"));
    assertEquals("int-1", recorder.getLastTraceId());
    JsonNode batch = sender.getRequests("/events/track").get(0).json();
    assertEquals(1, batch.size());
    assertEquals("failed", batch.get(0).get("properties").get("error").asText());
  }

  @Test
  void testSendTraceNotifiesPlugins() {
    TraceData trace = TraceData.builder().traceId("trace_1").provider("openai").model("gpt-4o").build();

    recorder.sendTrace(trace);

    verify(plugin).onTrace(trace);
    assertEquals("trace_1", recorder.getLastTraceId());
    assertEquals(1, recorder.getTransport().getQueueSize());
  }

  @Test
  void testCurrentInteractionIgnoresFinished() {
    InteractionContext interaction = new InteractionContext("int-1", System.currentTimeMillis());
    CurrentInteraction.makeCurrent(interaction);
    assertSame(interaction, recorder.getCurrentInteraction());

    interaction.markFinished();

    assertNull(recorder.getCurrentInteraction());
  }

  @Test
  void testCloseIsIdempotent() {
    recorder.sendTrace(TraceData.builder().traceId("trace_1").build());

    recorder.close();
    recorder.close();

    assertTrue(recorder.isClosed());
    assertTrue(recorder.getTransport().isClosed());
    assertTrue(recorder.getPlugins().isShutdown());
    verify(plugin, times(1)).shutdown();
    assertEquals(1, sender.getRequests().size());
  }

  @Test
  void testFinalChangesAppliedOnlyByWinningFinish() {
    InteractionContext interaction = new InteractionContext("int-5", System.currentTimeMillis());
    recorder.startInteraction(interaction);

    assertTrue(recorder.finishInteraction(interaction, null, finished -> finished.setOutput("first")));
    assertFalse(recorder.finishInteraction(interaction, null, finished -> finished.setOutput("second")));
    recorder.flush();

    ArgumentCaptor<InteractionContext> captor = ArgumentCaptor.forClass(InteractionContext.class);
    verify(plugin).onInteractionEnd(captor.capture());
    assertEquals("first", captor.getValue().getOutput());
    JsonNode event = sender.getRequests("/events/track").get(0).json().get(0);
    assertEquals("first", event.get("ai_data").get("output").asText());
  }

  @Test
  void testFailingSpanPluginDoesNotStopStandaloneDelivery() {
    RaindropPlugin failing = stubbedPlugin("failing");
    doThrow(new IllegalStateException("boom")).when(failing).onSpan(any());
    TelemetryRecorder twoPlugins = recorderWith(failing, plugin);
    SpanData span = new SpanData("span-3", "lookup", SpanKind.TOOL, 1000L);
    span.finish(1010L, "ok", null);

    twoPlugins.completeSpan(span, null);
    twoPlugins.flush();

    verify(failing).onSpan(span);
    verify(plugin).onSpan(span);
    JsonNode event = sender.getRequests("/events/track").get(0).json().get(0);
    assertEquals("span-3", event.get("event_id").asText());
    twoPlugins.close();
  }

  @Test
  void testFailingSpanPluginDoesNotStopInteractionDelivery() {
    RaindropPlugin failing = stubbedPlugin("failing");
    doThrow(new IllegalStateException("boom")).when(failing).onSpan(any());
    TelemetryRecorder twoPlugins = recorderWith(failing, plugin);
    InteractionContext interaction = new InteractionContext("int-4", System.currentTimeMillis());
    interaction.setEvent("checkout");
    twoPlugins.startInteraction(interaction);
    SpanData span = new SpanData("span-4", "lookup_price", SpanKind.TOOL, interaction.getStartTime());
    span.finish(interaction.getStartTime() + 2, "9.99", null);

    twoPlugins.completeSpan(span, interaction);
    twoPlugins.finishInteraction(interaction, null);
    twoPlugins.flush();

    verify(plugin).onSpan(span);
    JsonNode event = sender.getRequests("/events/track").get(0).json().get(0);
    assertEquals("int-4", event.get("event_id").asText());
    assertEquals("tool:lookup_price", event.get("attachments").get(0).get("name").asText());
    twoPlugins.close();
  }

  private RaindropPlugin stubbedPlugin(String name) {
    RaindropPlugin stub = mock(RaindropPlugin.class);
    when(stub.getName()).thenReturn(name);
    when(stub.supports(any())).thenReturn(true);
    when(stub.flush()).thenReturn(CompletableFuture.completedFuture(null));
    when(stub.shutdown()).thenReturn(CompletableFuture.completedFuture(null));
    return stub;
  }

  private TelemetryRecorder recorderWith(RaindropPlugin... plugins) {
    Transport transport = new Transport(
        TransportConfig.builder().apiKey("k").flushInterval(Duration.ofHours(1)).build(), sender);
    return new TelemetryRecorder(transport, new PluginPipeline(List.of(plugins), false, Duration.ofSeconds(1)),
        false);
  }
}
