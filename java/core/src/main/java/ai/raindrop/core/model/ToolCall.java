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

/**
 * A tool invocation requested by a model: the tool name, its arguments and,
 * when known, its result. Arguments and result are mutable so that plugins can
 * redact them in place.
 */
public class ToolCall {

  private final String name;
  private Object arguments;
  private Object result;

  public ToolCall(String name, Object arguments, Object result) {
    this.name = name;
    this.arguments = arguments;
    this.result = result;
  }

  public ToolCall(String name, Object arguments) {
    this(name, arguments, null);
  }

  public String getName() {
    return name != null ? name : "unknown";
  }

  public Object getArguments() {
    return arguments;
  }

  public void setArguments(Object arguments) {
    this.arguments = arguments;
  }

  public Object getResult() {
    return result;
  }

  public void setResult(Object result) {
    this.result = result;
  }
}
