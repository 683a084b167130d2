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

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils provides JSON serialization utilities shared by payload formatting
 * and delivery.
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Converts an object to JSON string.
   *
   * @param value
   *            the object to convert
   * @return the JSON string
   * @throws RaindropException
   *             if serialization fails
   */
  public static String toJson(Object value) throws RaindropException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new RaindropException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a JSON string to a JsonNode.
   *
   * @param json
   *            the JSON string
   * @return the JsonNode
   * @throws RaindropException
   *             if parsing fails
   */
  public static JsonNode parseJson(String json) throws RaindropException {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new RaindropException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Converts a value to the string form sent to the API. Strings pass through,
   * null stays null and anything else is serialized to JSON. Values that cannot
   * be serialized fall back to {@link String#valueOf(Object)}.
   *
   * @param value
   *            the value to convert
   * @return the string form, or null
   */
  public static String toApiString(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof String) {
      return (String) value;
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException | RuntimeException e) {
      return String.valueOf(value);
    }
  }

  /**
   * Converts a value to a JsonNode without failing. Values that cannot be
   * converted become a text node holding their {@code toString()} form.
   *
   * @param value
   *            the value to convert
   * @return the JsonNode
   */
  public static JsonNode toSafeNode(Object value) {
    if (value instanceof JsonNode) {
      return (JsonNode) value;
    }
    try {
      return objectMapper.valueToTree(value);
    } catch (IllegalArgumentException e) {
      return TextNode.valueOf(String.valueOf(value));
    }
  }

  /**
   * Returns the size of the UTF-8 encoded JSON form of a value.
   *
   * @param value
   *            the value to measure
   * @return the size in bytes, or -1 if the value cannot be serialized
   */
  public static int sizeInBytes(Object value) {
    try {
      return objectMapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8).length;
    } catch (JsonProcessingException | RuntimeException e) {
      return -1;
    }
  }
}
