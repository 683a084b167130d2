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

/**
 * Thrown when an interaction is resumed by id but no active interaction with
 * that id exists, either because it was never begun or because it has already
 * finished.
 */
public class InteractionNotFoundException extends RaindropException {

  public static final String ERROR_CODE = "INTERACTION_NOT_FOUND";

  /**
   * Creates a new InteractionNotFoundException.
   *
   * @param interactionId
   *            the id that could not be resolved
   */
  public InteractionNotFoundException(String interactionId) {
    super("No active interaction with ID: " + interactionId, null, ERROR_CODE, interactionId);
  }
}
