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
 * Token counts reported by a provider. Each count is independently optional.
 */
public class TokenUsage {

  private final Integer input;
  private final Integer output;
  private final Integer total;

  /**
   * Creates a new TokenUsage.
   *
   * @param input
   *            prompt tokens, may be null
   * @param output
   *            completion tokens, may be null
   * @param total
   *            total tokens, may be null
   */
  public TokenUsage(Integer input, Integer output, Integer total) {
    this.input = input;
    this.output = output;
    this.total = total;
  }

  /**
   * Creates a TokenUsage whose total is the sum of input and output.
   *
   * @param input
   *            prompt tokens
   * @param output
   *            completion tokens
   * @return the token usage
   */
  public static TokenUsage of(int input, int output) {
    return new TokenUsage(input, output, input + output);
  }

  public Integer getInput() {
    return input;
  }

  public Integer getOutput() {
    return output;
  }

  public Integer getTotal() {
    return total;
  }

  @Override
  public String toString() {
    return "TokenUsage{input=" + input + ", output=" + output + ", total=" + total + '}';
  }
}
