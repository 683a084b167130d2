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
package ai.raindrop.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * SpanKind tells whether a span records a tool call or an AI model call.
 */
public enum SpanKind {
  TOOL("tool"), AI("ai");

  private final String value;

  SpanKind(String value) {
    this.value = value;
  }

  /**
   * Returns the wire name of this kind.
   *
   * @return the wire name
   */
  @JsonValue
  public String getValue() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
