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
package ai.raindrop;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import ai.raindrop.core.InteractionNotFoundException;
import ai.raindrop.core.JsonUtils;
import ai.raindrop.core.context.CurrentInteraction;
import ai.raindrop.core.model.Attachment;
import ai.raindrop.core.model.FeedbackOptions;
import ai.raindrop.core.model.FeedbackType;
import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SignalOptions;
import ai.raindrop.core.model.UserTraits;
import ai.raindrop.core.plugin.RaindropPlugin;
import ai.raindrop.core.transport.EventSender;
import ai.raindrop.core.wrapper.ProviderAdapter;
import ai.raindrop.core.wrapper.TracedClient;
import ai.raindrop.core.wrapper.TracedResponse;
import ai.raindrop.plugins.pii.PiiRedactionPlugin;

/**
 * End-to-end tests for the Raindrop facade with an in-memory sender.
 */
class RaindropTest {

  private CapturingSender sender;
  private Raindrop raindrop;

  @BeforeEach
  void setUp() {
    sender = new CapturingSender();
    raindrop = new Raindrop(options().build());
  }

  @AfterEach
  void tearDown() {
    raindrop.close();
    CurrentInteraction.clearIfCurrent(CurrentInteraction.get());
  }

  private RaindropOptions.Builder options() {
    return RaindropOptions.builder().apiKey("test-key").disabled(false).debug(false)
        .flushInterval(Duration.ofHours(1)).registerShutdownHook(false).eventSender(sender);
  }

  private static final ProviderAdapter<String, String> ECHO = new ProviderAdapter<String, String>() {
    @Override
    public String getProvider() {
      return "echo";
    }

    @Override
    public String getModel(String request) {
      return "echo-1";
    }

    @Override
    public Object getInput(String request) {
      return request;
    }

    @Override
    public Object getOutput(String response) {
      return response;
    }
  };

  private TracedClient<String, String> echoClient() {
    return raindrop.wrap(ECHO, request -> "echo: " + request);
  }

  private List<JsonNode> events(String path) {
    raindrop.flush();
    List<JsonNode> events = new ArrayList<>();
    for (String[] request : sender.requests) {
      if (request[0].equals(path)) {
        JsonNode body = JsonUtils.parseJson(request[1]);
        if (body.isArray()) {
          body.forEach(events::add);
        } else {
          events.add(body);
        }
      }
    }
    return events;
  }

  @Test
  void testStandaloneCallIsSentAsTrace() throws Exception {
    TracedResponse<String> response = echoClient().call("hello");

    assertEquals("echo: hello", response.getResponse());
    assertEquals(response.getTraceId(), raindrop.getLastTraceId());
    List<JsonNode> events = events("/events/track");
    assertEquals(1, events.size());
    JsonNode event = events.get(0);
    assertEquals("ai_interaction", event.get("event").asText());
    assertEquals(response.getTraceId(), event.get("event_id").asText());
    assertEquals("echo-1", event.get("ai_data").get("model").asText());
    assertEquals("echo: hello", event.get("ai_data").get("output").asText());
  }

  @Test
  void testInteractionCollectsToolAndModelSpans() throws Exception {
    Function<String, Integer> lookup = raindrop.wrapTool("lookup_order", orderId -> 42);
    Interaction interaction = raindrop.begin(BeginOptions.builder().event("support_chat").userId("user-1")
        .input("Where is my order?").property("channel", "web").build());

    lookup.apply("order-7");
    echoClient().call("summarize order 42");
    interaction.finish(FinishOptions.builder().output("It ships tomorrow").property("resolved", true).build());

    assertTrue(interaction.isFinished());
    assertNull(CurrentInteraction.get());
    List<JsonNode> events = events("/events/track");
    assertEquals(1, events.size());
    JsonNode event = events.get(0);
    assertEquals(interaction.getId(), event.get("event_id").asText());
    assertEquals("support_chat", event.get("event").asText());
    assertEquals("user-1", event.get("user_id").asText());
    assertEquals(2, event.get("properties").get("span_count").asInt());
    assertEquals("web", event.get("properties").get("channel").asText());
    assertTrue(event.get("properties").get("resolved").asBoolean());
    assertEquals("It ships tomorrow", event.get("ai_data").get("output").asText());
    assertEquals("tool:lookup_order", event.get("attachments").get(0).get("name").asText());
    assertEquals("ai:echo:echo-1", event.get("attachments").get(1).get("name").asText());
    assertEquals(interaction.getId(), raindrop.getLastTraceId());
  }

  @Test
  void testFinishIsIdempotent() {
    Interaction interaction = raindrop.begin();

    interaction.finish(FinishOptions.output("first"));
    interaction.finish(FinishOptions.output("second"));
    interaction.close();

    List<JsonNode> events = events("/events/track");
    assertEquals(1, events.size());
    assertEquals("first", events.get(0).get("ai_data").get("output").asText());
  }

  @Test
  void testConcurrentFinishKeepsOneFinishersOptions() throws Exception {
    Interaction interaction = raindrop.begin();
    int finishers = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(finishers);
    try {
      for (int i = 0; i < finishers; i++) {
        int id = i;
        pool.submit(() -> {
          start.await();
          interaction.finish(FinishOptions.builder().output("output-" + id).property("finisher", id).build());
          return null;
        });
      }
      start.countDown();
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }

    List<JsonNode> events = events("/events/track");
    assertEquals(1, events.size());
    JsonNode event = events.get(0);
    int winner = event.get("properties").get("finisher").asInt();
    assertEquals("output-" + winner, event.get("ai_data").get("output").asText());
  }

  @Test
  void testCallerChosenEventIdAndAttachments() {
    Interaction interaction = raindrop.begin(BeginOptions.builder().eventId("evt-123")
        .attachment(Attachment.builder().name("doc").value("terms").role("input").build()).build());
    interaction.addAttachments(List.of(Attachment.builder().value("extra").build()));
    interaction.finish();

    JsonNode event = events("/events/track").get(0);
    assertEquals("evt-123", event.get("event_id").asText());
    assertEquals("interaction", event.get("event").asText());
    assertEquals(2, event.get("attachments").size());
    assertEquals("input", event.get("attachments").get(0).get("role").asText());
  }

  @Test
  void testResumeInteractionOnAnotherThread() throws Exception {
    Interaction interaction = raindrop.begin(BeginOptions.builder().event("async_job").build());
    String id = interaction.getId();
    Function<String, String> tool = raindrop.wrapTool("fetch", url -> "page");

    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      executor.submit(() -> {
        Interaction resumed = raindrop.resumeInteraction(id);
        tool.apply("https://example.com");
        resumed.setOutput("done");
        resumed.finish();
        return null;
      }).get(5, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    assertTrue(interaction.isFinished());
    assertNull(raindrop.currentInteraction());
    JsonNode event = events("/events/track").get(0);
    assertEquals(1, event.get("properties").get("span_count").asInt());
    assertEquals("done", event.get("ai_data").get("output").asText());
  }

  @Test
  void testResumeUnknownInteractionThrows() {
    assertThrows(InteractionNotFoundException.class, () -> raindrop.resumeInteraction("nope"));

    Interaction interaction = raindrop.begin();
    interaction.finish();
    assertThrows(InteractionNotFoundException.class, () -> raindrop.resumeInteraction(interaction.getId()));
  }

  @Test
  void testWithInteractionRecordsErrorAndRethrows() {
    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> raindrop.withInteraction(InteractionOptions.builder().event("risky").build(), () -> {
          assertNotNull(raindrop.currentInteraction());
          throw new IllegalStateException("model unavailable");
        }));

    assertEquals("model unavailable", thrown.getMessage());
    assertNull(raindrop.currentInteraction());
    JsonNode event = events("/events/track").get(0);
    assertEquals("risky", event.get("event").asText());
    assertEquals("model unavailable", event.get("properties").get("error").asText());
  }

  @Test
  void testWithInteractionReturnsResult() throws Exception {
    String result = raindrop.withInteraction(InteractionOptions.builder().input("q").build(), () -> {
      raindrop.currentInteraction().setOutput("a");
      return "a";
    });

    assertEquals("a", result);
    JsonNode event = events("/events/track").get(0);
    assertEquals("q", event.get("ai_data").get("input").asText());
    assertEquals("a", event.get("ai_data").get("output").asText());
  }

  @Test
  void testWorkflowUsesNameAsEventAndStringResultAsOutput() {
    Function<String, String> answer = raindrop.workflow("answer_question", question -> "Paris");

    assertEquals("Paris", answer.apply("Capital of France?"));

    JsonNode event = events("/events/track").get(0);
    assertEquals("answer_question", event.get("event").asText());
    assertEquals("Capital of France?", event.get("ai_data").get("input").asText());
    assertEquals("Paris", event.get("ai_data").get("output").asText());
  }

  @Test
  void testStandaloneToolCarriesCurrentUser() {
    raindrop.identify("user-5");
    Function<Integer, Integer> square = raindrop.wrapTool("square", x -> x * x);

    assertEquals(16, square.apply(4));

    JsonNode event = events("/events/track").get(0);
    assertEquals("user-5", event.get("user_id").asText());
    assertEquals("tool:square", event.get("ai_data").get("model").asText());
    assertTrue(events("/users/identify").isEmpty());
  }

  @Test
  void testToolFailureIsRecordedAndRethrown() {
    Function<String, String> broken = raindrop.wrapTool("broken", input -> {
      throw new IllegalArgumentException("bad input");
    });
    Interaction interaction = raindrop.begin();

    assertThrows(IllegalArgumentException.class, () -> broken.apply("x"));
    interaction.finish();

    JsonNode attachment = events("/events/track").get(0).get("attachments").get(0);
    JsonNode value = JsonUtils.parseJson(attachment.get("value").asText());
    assertEquals("bad input", value.get("error").asText());
  }

  @Test
  void testTaskIsMarked() {
    Interaction interaction = raindrop.begin();
    raindrop.wrapTask("plan", Map.of("step", 1), goal -> "plan for " + goal).apply("launch");
    interaction.finish();

    JsonNode attachment = events("/events/track").get(0).get("attachments").get(0);
    JsonNode value = JsonUtils.parseJson(attachment.get("value").asText());
    assertTrue(value.get("properties").get("is_task").asBoolean());
    assertEquals(1, value.get("properties").get("step").asInt());
  }

  @Test
  void testManualSpan() {
    Interaction interaction = raindrop.begin();
    ManualSpan span = raindrop.startSpan("vector_search").recordInput("shoes").recordOutput(List.of("a", "b"));
    span.end();
    span.end("ignored");
    interaction.finish();

    assertTrue(span.isEnded());
    JsonNode event = events("/events/track").get(0);
    assertEquals(1, event.get("properties").get("span_count").asInt());
    JsonNode value = JsonUtils.parseJson(event.get("attachments").get(0).get("value").asText());
    assertEquals(span.getId(), value.get("spanId").asText());
    assertFalse(value.has("error") && !value.get("error").isNull());
  }

  @Test
  void testIdentifyFeedbackAndSignals() {
    raindrop.identify("user-1", UserTraits.builder().name("Ada").plan("pro").build());
    raindrop.feedback("trace_1", FeedbackOptions.builder().type(FeedbackType.THUMBS_UP).build());
    raindrop.trackSignal(SignalOptions.builder("trace_1", "copied").build());

    List<JsonNode> identifies = events("/users/identify");
    assertEquals(1, identifies.size());
    assertEquals("Ada", identifies.get(0).get("traits").get("name").asText());
    List<JsonNode> signals = events("/signals/track");
    assertEquals(2, signals.size());
    assertEquals("thumbs_up", signals.get(0).get("signal_name").asText());
    assertEquals("copied", signals.get(1).get("signal_name").asText());
  }

  @Test
  void testPiiRedactionRunsBeforeSending() {
    raindrop.close();
    raindrop = new Raindrop(options().redactPii(true).build());

    assertTrue(raindrop.getPlugins().get(0) instanceof PiiRedactionPlugin);
    Interaction interaction = raindrop.begin(BeginOptions.builder().input("Email me at ada@example.com").build());
    interaction.finish(FinishOptions.output("Sent to ada@example.com"));

    JsonNode event = events("/events/track").get(0);
    assertEquals("Email me at <REDACTED>", event.get("ai_data").get("input").asText());
    assertEquals("Sent to <REDACTED>", event.get("ai_data").get("output").asText());
  }

  @Test
  void testPluginsSeeLifecycle() {
    RaindropPlugin plugin = mock(RaindropPlugin.class);
    when(plugin.getName()).thenReturn("observer");
    when(plugin.supports(any())).thenReturn(true);
    when(plugin.flush()).thenReturn(CompletableFuture.completedFuture(null));
    when(plugin.shutdown()).thenReturn(CompletableFuture.completedFuture(null));
    raindrop.close();
    raindrop = Raindrop.builder().options(options().build()).plugin(plugin).build();

    Interaction interaction = raindrop.begin();
    raindrop.wrapTool("noop", x -> x).apply("x");
    interaction.finish();
    raindrop.close();

    verify(plugin).onInteractionStart(any(InteractionContext.class));
    verify(plugin).onSpan(any());
    verify(plugin).onInteractionEnd(any(InteractionContext.class));
    verify(plugin).shutdown();
  }

  @Test
  void testCloseFlushesPendingEvents() {
    raindrop.identify("user-1", UserTraits.builder().name("Ada").build());

    raindrop.close();
    raindrop.close();

    assertEquals(1, sender.requests.size());
    assertTrue(raindrop.getRecorder().isClosed());
  }

  @Test
  void testDisabledSendsNothing() {
    raindrop.close();
    raindrop = new Raindrop(options().disabled(true).build());

    raindrop.identify("user-1", UserTraits.builder().name("Ada").build());
    raindrop.workflow("w", x -> "y").apply("x");

    assertTrue(events("/events/track").isEmpty());
    assertTrue(sender.requests.isEmpty());
  }

  /** Records requests in memory and always answers 200. */
  private static final class CapturingSender implements EventSender {
    final List<String[]> requests = new CopyOnWriteArrayList<>();

    @Override
    public int send(String path, String body) {
      requests.add(new String[] { path, body });
      return 200;
    }
  }
}
