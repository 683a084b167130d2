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
 * Sentiment attached to a signal.
 */
public enum Sentiment {
  POSITIVE, NEGATIVE;

  /**
   * Maps a feedback score to a sentiment. Scores of 0.5 and above are positive.
   *
   * @param score
   *            the score, usually between 0 and 1
   * @return the sentiment
   */
  public static Sentiment fromScore(double score) {
    return score >= 0.5 ? POSITIVE : NEGATIVE;
  }
}
