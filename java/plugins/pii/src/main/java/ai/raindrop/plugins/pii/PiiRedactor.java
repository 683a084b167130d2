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
package ai.raindrop.plugins.pii;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Replaces PII in text with redaction tokens.
 */
public class PiiRedactor {

  private final Set<PiiPattern> patterns;
  private final List<Pattern> customPatterns;
  private final Set<String> allowList;
  private final String replacement;
  private final boolean specificTokens;

  public PiiRedactor() {
    this(PiiPluginOptions.builder().build());
  }

  public PiiRedactor(PiiPluginOptions options) {
    this.patterns = options.getPatterns();
    this.customPatterns = options.getCustomPatterns();
    this.allowList = options.getAllowList();
    this.replacement = options.getReplacement();
    this.specificTokens = options.isSpecificTokens();
  }

  /**
   * Redacts PII from text. Matches found in the allow list are kept.
   *
   * @param text
   *            the text, may be null
   * @return the redacted text
   */
  public String redact(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    String result = text;
    for (PiiPattern pattern : patterns) {
      result = replace(pattern.getPattern(), result, specificTokens ? pattern.getToken() : replacement);
    }
    for (Pattern pattern : customPatterns) {
      result = replace(pattern, result, replacement);
    }
    return result;
  }

  /**
   * Redacts strings nested in maps, collections, arrays of strings and JSON
   * trees. Maps and collections are copied, never modified in place. Other
   * values are returned unchanged.
   *
   * @param value
   *            the value
   * @return the redacted value
   */
  public Object redactObject(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof String) {
      return redact((String) value);
    }
    if (value instanceof Map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        copy.put(entry.getKey(), redactObject(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof Collection) {
      List<Object> copy = new ArrayList<>();
      for (Object item : (Collection<?>) value) {
        copy.add(redactObject(item));
      }
      return copy;
    }
    if (value instanceof String[]) {
      String[] source = (String[]) value;
      String[] copy = new String[source.length];
      for (int i = 0; i < source.length; i++) {
        copy[i] = redact(source[i]);
      }
      return copy;
    }
    if (value instanceof JsonNode) {
      return redactNode(((JsonNode) value).deepCopy());
    }
    return value;
  }

  /**
   * Redacts property values, keeping the keys.
   *
   * @param properties
   *            the properties, may be null
   * @return a redacted copy
   */
  public Map<String, Object> redactProperties(Map<String, ?> properties) {
    Map<String, Object> copy = new LinkedHashMap<>();
    if (properties != null) {
      for (Map.Entry<String, ?> entry : properties.entrySet()) {
        copy.put(entry.getKey(), redactObject(entry.getValue()));
      }
    }
    return copy;
  }

  private JsonNode redactNode(JsonNode node) {
    if (node.isTextual()) {
      return TextNode.valueOf(redact(node.asText()));
    }
    if (node.isObject()) {
      ObjectNode object = (ObjectNode) node;
      Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
      List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
      fields.forEachRemaining(entries::add);
      for (Map.Entry<String, JsonNode> entry : entries) {
        object.set(entry.getKey(), redactNode(entry.getValue()));
      }
      return object;
    }
    if (node.isArray()) {
      ArrayNode array = (ArrayNode) node;
      for (int i = 0; i < array.size(); i++) {
        array.set(i, redactNode(array.get(i)));
      }
      return array;
    }
    return node;
  }

  private String replace(Pattern pattern, String text, String token) {
    Matcher matcher = pattern.matcher(text);
    StringBuilder out = new StringBuilder();
    boolean found = false;
    while (matcher.find()) {
      found = true;
      String match = matcher.group();
      matcher.appendReplacement(out, Matcher.quoteReplacement(allowList.contains(match) ? match : token));
    }
    if (!found) {
      return text;
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
