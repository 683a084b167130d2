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
package ai.raindrop.core.transport;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.raindrop.core.JsonUtils;
import ai.raindrop.core.model.Attachment;
import ai.raindrop.core.model.FeedbackOptions;
import ai.raindrop.core.model.FeedbackType;
import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.Sentiment;
import ai.raindrop.core.model.SignalOptions;
import ai.raindrop.core.model.SignalType;
import ai.raindrop.core.model.SpanData;
import ai.raindrop.core.model.SpanKind;
import ai.raindrop.core.model.TokenUsage;
import ai.raindrop.core.model.ToolCall;
import ai.raindrop.core.model.TraceData;
import ai.raindrop.core.model.UserTraits;

/**
 * Unit tests for EventFormatter.
 */
class EventFormatterTest {

  private static final long START = 1_700_000_000_000L;

  @Test
  void testFormatCheckoutInteraction() {
    InteractionContext interaction = new InteractionContext("int-checkout", START);
    interaction.setEvent("checkout");
    interaction.setUserId("user-42");
    interaction.setConversationId("conv-7");
    interaction.setInput("Buy the blue shoes");
    interaction.setOutput("Order placed");
    interaction.getProperties().put("cart_size", 2);
    interaction.getAttachments()
        .add(Attachment.builder().type("text").name("receipt").value("#1234").role("output").build());

    SpanData lookup = new SpanData("span-1", "search_inventory", SpanKind.TOOL, START + 10);
    lookup.setInput(Map.of("sku", "BLUE-42"));
    lookup.finish(START + 60, List.of("in stock"), null);
    interaction.appendSpan(lookup);

    SpanData payment = new SpanData("span-2", "charge_card", SpanKind.TOOL, START + 70);
    payment.finish(START + 90, null, "card declined");
    interaction.appendSpan(payment);

    ObjectNode data = EventFormatter.formatInteraction(interaction, START + 1500, null);

    assertEquals("int-checkout", data.get("event_id").asText());
    assertEquals("user-42", data.get("user_id").asText());
    assertEquals("checkout", data.get("event").asText());
    assertEquals("2023-11-14T22:13:20Z", data.get("timestamp").asText());

    JsonNode properties = data.get("properties");
    assertEquals(1500, properties.get("latency_ms").asLong());
    assertEquals(2, properties.get("span_count").asInt());
    assertEquals(2, properties.get("cart_size").asInt());
    assertFalse(properties.has("error"));
    assertEquals(EventFormatter.LIBRARY_NAME, properties.get("$context").get("library").get("name").asText());

    JsonNode aiData = data.get("ai_data");
    assertEquals("Buy the blue shoes", aiData.get("input").asText());
    assertEquals("Order placed", aiData.get("output").asText());
    assertEquals("conv-7", aiData.get("convo_id").asText());

    JsonNode attachments = data.get("attachments");
    assertEquals(3, attachments.size());
    assertEquals("receipt", attachments.get(0).get("name").asText());
    assertEquals("tool:search_inventory", attachments.get(1).get("name").asText());
    assertEquals("code", attachments.get(1).get("type").asText());
    assertEquals("json", attachments.get(1).get("language").asText());

    JsonNode lookupValue = JsonUtils.parseJson(attachments.get(1).get("value").asText());
    assertEquals("span-1", lookupValue.get("spanId").asText());
    assertEquals("BLUE-42", lookupValue.get("input").get("sku").asText());
    assertEquals(50, lookupValue.get("latencyMs").asLong());

    JsonNode paymentValue = JsonUtils.parseJson(attachments.get(2).get("value").asText());
    assertEquals("card declined", paymentValue.get("error").asText());
  }

  @Test
  void testFormatInteractionWithError() {
    InteractionContext interaction = new InteractionContext("int-1", START);

    ObjectNode data = EventFormatter.formatInteraction(interaction, START + 5, "boom");

    assertEquals("boom", data.get("properties").get("error").asText());
    assertEquals(0, data.get("properties").get("span_count").asInt());
    assertFalse(data.has("attachments"));
    assertFalse(data.has("user_id"));
  }

  @Test
  void testFormatTrace() {
    TraceData trace = TraceData.builder().traceId("trace_1").provider("anthropic").model("claude").startTime(START)
        .endTime(START + 250).input(List.of(Map.of("role", "user", "content", "hi"))).output("hello")
        .tokens(TokenUsage.of(12, 8)).toolCalls(List.of(new ToolCall("get_weather", Map.of("city", "Paris"))))
        .userId("user-1").conversationId("conv-1").properties(Map.of("env", "test")).build();

    ObjectNode data = EventFormatter.formatTrace(trace);

    assertEquals("trace_1", data.get("event_id").asText());
    assertEquals(EventFormatter.TRACE_EVENT, data.get("event").asText());
    JsonNode properties = data.get("properties");
    assertEquals("anthropic", properties.get("provider").asText());
    assertEquals(250, properties.get("latency_ms").asLong());
    assertEquals(12, properties.get("input_tokens").asInt());
    assertEquals(8, properties.get("output_tokens").asInt());
    assertEquals(20, properties.get("total_tokens").asInt());
    assertEquals("test", properties.get("env").asText());

    JsonNode aiData = data.get("ai_data");
    assertEquals("claude", aiData.get("model").asText());
    assertTrue(aiData.get("input").isTextual());
    assertTrue(aiData.get("input").asText().contains("\"role\":\"user\""));
    assertEquals("hello", aiData.get("output").asText());

    JsonNode attachments = data.get("attachments");
    assertEquals(1, attachments.size());
    assertEquals("tool:get_weather", attachments.get(0).get("name").asText());
    assertTrue(attachments.get(0).get("value").asText().contains("Paris"));
  }

  @Test
  void testFormatTraceOmitsNullFields() {
    TraceData trace = TraceData.builder().traceId("trace_2").provider("openai").model("gpt-4o").startTime(START)
        .build();

    ObjectNode data = EventFormatter.formatTrace(trace);

    assertFalse(data.has("user_id"));
    assertFalse(data.has("attachments"));
    assertFalse(data.get("ai_data").has("output"));
    assertFalse(data.get("properties").has("input_tokens"));
  }

  @Test
  void testFeedbackScoreAboveThresholdIsPositive() {
    ObjectNode data = EventFormatter.formatFeedback("trace_1",
        FeedbackOptions.builder().score(0.75).comment("great").build());

    assertEquals("positive", data.get("signal_name").asText());
    assertEquals("POSITIVE", data.get("sentiment").asText());
    assertEquals("feedback", data.get("signal_type").asText());
    assertEquals(0.75, data.get("properties").get("score").asDouble());
    assertEquals("great", data.get("properties").get("comment").asText());
  }

  @Test
  void testFeedbackScoreBelowThresholdIsNegative() {
    ObjectNode data = EventFormatter.formatFeedback("trace_1", FeedbackOptions.builder().score(0.3).build());

    assertEquals("negative", data.get("signal_name").asText());
    assertEquals("NEGATIVE", data.get("sentiment").asText());
  }

  @Test
  void testFeedbackScoreAtThresholdIsPositive() {
    ObjectNode data = EventFormatter.formatFeedback("trace_1", FeedbackOptions.builder().score(0.5).build());

    assertEquals("positive", data.get("signal_name").asText());
    assertEquals("POSITIVE", data.get("sentiment").asText());
  }

  @Test
  void testFeedbackTypeWithoutScore() {
    ObjectNode down = EventFormatter.formatFeedback("trace_1",
        FeedbackOptions.builder().type(FeedbackType.THUMBS_DOWN).attachmentId("att-1").build());
    ObjectNode up = EventFormatter.formatFeedback("trace_1",
        FeedbackOptions.builder().type(FeedbackType.THUMBS_UP).timestamp("2024-01-01T00:00:00Z").build());

    assertEquals("thumbs_down", down.get("signal_name").asText());
    assertEquals("NEGATIVE", down.get("sentiment").asText());
    assertEquals("att-1", down.get("attachment_id").asText());
    assertFalse(down.get("properties").has("score"));
    assertEquals("thumbs_up", up.get("signal_name").asText());
    assertEquals("POSITIVE", up.get("sentiment").asText());
    assertEquals("2024-01-01T00:00:00Z", up.get("timestamp").asText());
  }

  @Test
  void testFormatSignal() {
    ObjectNode data = EventFormatter.formatSignal(SignalOptions.builder("trace_1", "regenerate")
        .type(SignalType.EDIT).comment("too long").after("shorter text").property("source", "ui").build());
    ObjectNode defaults = EventFormatter.formatSignal(SignalOptions.builder("trace_2", "copy").build());

    assertEquals("trace_1", data.get("event_id").asText());
    assertEquals("regenerate", data.get("signal_name").asText());
    assertEquals("edit", data.get("signal_type").asText());
    assertEquals("too long", data.get("properties").get("comment").asText());
    assertEquals("shorter text", data.get("properties").get("after").asText());
    assertEquals("ui", data.get("properties").get("source").asText());
    assertEquals("default", defaults.get("signal_type").asText());
    assertEquals(Sentiment.NEGATIVE.name(), defaults.get("sentiment").asText());
    assertEquals(0, defaults.get("properties").size());
  }

  @Test
  void testFormatIdentify() {
    ObjectNode data = EventFormatter.formatIdentify("user-1",
        UserTraits.builder().name("Ada").email("ada@example.com").trait("company", "Acme").build());

    assertEquals("user-1", data.get("user_id").asText());
    JsonNode traits = data.get("traits");
    assertEquals("Ada", traits.get("name").asText());
    assertEquals("ada@example.com", traits.get("email").asText());
    assertEquals("Acme", traits.get("company").asText());
    assertFalse(traits.has("plan"));
  }

  @Test
  void testIsoTimestamp() {
    assertEquals("2023-11-14T22:13:20Z", EventFormatter.isoTimestamp(START));
    assertEquals("2023-11-14T22:13:20.123Z", EventFormatter.isoTimestamp(START + 123));
  }
}
