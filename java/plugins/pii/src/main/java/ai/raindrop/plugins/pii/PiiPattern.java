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

import java.util.regex.Pattern;

/**
 * Built-in PII patterns, applied in declaration order.
 */
public enum PiiPattern {

  EMAIL("<REDACTED_EMAIL>", Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,}\\b",
      Pattern.CASE_INSENSITIVE)),

  /** US-style numbers with optional country code and separators. */
  PHONE("<REDACTED_PHONE>", Pattern.compile("(\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b")),

  SSN("<REDACTED_SSN>", Pattern.compile("\\b\\d{3}[-\\s]?\\d{2}[-\\s]?\\d{4}\\b")),

  /** 13 to 19 digits with optional spaces or dashes. */
  CREDIT_CARD("<REDACTED_CREDIT_CARD>", Pattern.compile("\\b(?:\\d[ -]*?){13,19}\\b")),

  /** API keys and tokens written as key=value or key: value. */
  CREDENTIALS("<REDACTED_CREDENTIALS>", Pattern.compile(
      "\\b(api[_-]?key|token|bearer|authorization|auth[_-]?token|access[_-]?token|secret[_-]?key)"
          + "\\s*[:=]\\s*[\"']?[\\w-]+[\"']?",
      Pattern.CASE_INSENSITIVE)),

  ADDRESS("<REDACTED_ADDRESS>", Pattern.compile(
      "\\b\\d+\\s+[A-Za-z\\s]+\\s+(street|st|avenue|ave|road|rd|boulevard|blvd|lane|ln|drive|dr|court|ct"
          + "|plaza|pl|terrace|ter|way|parkway|pkwy)\\b",
      Pattern.CASE_INSENSITIVE)),

  PASSWORD("<REDACTED_SECRET>", Pattern.compile("\\b(pass(word|phrase)?|secret|pwd|passwd)\\s*[:=]\\s*\\S+",
      Pattern.CASE_INSENSITIVE));

  private final String token;
  private final Pattern pattern;

  PiiPattern(String token, Pattern pattern) {
    this.token = token;
    this.pattern = pattern;
  }

  /**
   * Returns the pattern-specific replacement token, such as
   * {@code <REDACTED_EMAIL>}.
   *
   * @return the token
   */
  public String getToken() {
    return token;
  }

  public Pattern getPattern() {
    return pattern;
  }
}
