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
package ai.raindrop.core.context;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import ai.raindrop.core.InteractionNotFoundException;
import ai.raindrop.core.model.InteractionContext;

/**
 * Maps interaction ids to interactions that have begun and not yet finished,
 * so that an interaction can be resumed on a different call chain.
 */
public class ActiveInteractionRegistry {

  private final Map<String, InteractionContext> active = new ConcurrentHashMap<>();

  /**
   * Registers an interaction. An existing registration with the same id is
   * replaced.
   *
   * @param interaction
   *            the interaction
   */
  public void register(InteractionContext interaction) {
    active.put(interaction.getInteractionId(), interaction);
  }

  /**
   * Looks up an active interaction.
   *
   * @param interactionId
   *            the interaction id
   * @return the interaction
   * @throws InteractionNotFoundException
   *             if the id is unknown or the interaction already finished
   */
  public InteractionContext lookup(String interactionId) {
    InteractionContext interaction = interactionId != null ? active.get(interactionId) : null;
    if (interaction == null || interaction.isFinished()) {
      throw new InteractionNotFoundException(interactionId);
    }
    return interaction;
  }

  /**
   * Removes an interaction. Only the given instance is removed, never a newer
   * registration that reused the id.
   *
   * @param interaction
   *            the interaction
   */
  public void remove(InteractionContext interaction) {
    active.remove(interaction.getInteractionId(), interaction);
  }

  public boolean isActive(String interactionId) {
    return interactionId != null && active.containsKey(interactionId);
  }

  public int size() {
    return active.size();
  }
}
