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

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import ai.raindrop.core.model.InteractionContext;

/**
 * Unit tests for CurrentInteraction.
 */
class CurrentInteractionTest {

  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
    CurrentInteraction.clearIfCurrent(CurrentInteraction.get());
  }

  @Test
  void testNoInteractionByDefault() {
    assertNull(CurrentInteraction.get());
    assertFalse(CurrentInteraction.isActive());
  }

  @Test
  void testScopesNest() {
    InteractionContext outer = new InteractionContext("outer", 0L);
    InteractionContext inner = new InteractionContext("inner", 0L);

    try (CurrentInteraction.Scope outerScope = CurrentInteraction.makeCurrent(outer)) {
      assertSame(outer, CurrentInteraction.get());
      try (CurrentInteraction.Scope innerScope = CurrentInteraction.makeCurrent(inner)) {
        assertSame(inner, CurrentInteraction.get());
        assertSame(inner, innerScope.getInstalled());
      }
      assertSame(outer, CurrentInteraction.get());
    }
    assertNull(CurrentInteraction.get());
  }

  @Test
  void testCloseTwiceRestoresOnce() {
    InteractionContext outer = new InteractionContext("outer", 0L);
    InteractionContext inner = new InteractionContext("inner", 0L);

    try (CurrentInteraction.Scope outerScope = CurrentInteraction.makeCurrent(outer)) {
      CurrentInteraction.Scope innerScope = CurrentInteraction.makeCurrent(inner);
      innerScope.close();
      innerScope.close();
      assertSame(outer, CurrentInteraction.get());
    }
  }

  @Test
  void testOtherThreadsDoNotSeeInteraction() throws Exception {
    InteractionContext interaction = new InteractionContext("i1", 0L);

    try (CurrentInteraction.Scope scope = CurrentInteraction.makeCurrent(interaction)) {
      Future<InteractionContext> seen = executor.submit(CurrentInteraction::get);
      assertNull(seen.get(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void testWrapCarriesInteractionToAnotherThread() throws Exception {
    InteractionContext interaction = new InteractionContext("i1", 0L);
    Callable<InteractionContext> wrapped;

    try (CurrentInteraction.Scope scope = CurrentInteraction.makeCurrent(interaction)) {
      wrapped = CurrentInteraction.wrap(CurrentInteraction::get);
    }

    assertSame(interaction, executor.submit(wrapped).get(5, TimeUnit.SECONDS));
    // The worker thread is left clean afterwards.
    assertNull(executor.submit(CurrentInteraction::get).get(5, TimeUnit.SECONDS));
  }

  @Test
  void testWrapRunnable() throws Exception {
    InteractionContext interaction = new InteractionContext("i1", 0L);
    AtomicReference<InteractionContext> seen = new AtomicReference<>();
    Runnable wrapped;

    try (CurrentInteraction.Scope scope = CurrentInteraction.makeCurrent(interaction)) {
      wrapped = CurrentInteraction.wrap(() -> seen.set(CurrentInteraction.get()));
    }
    executor.submit(wrapped).get(5, TimeUnit.SECONDS);

    assertSame(interaction, seen.get());
  }

  @Test
  void testScopeClosedFromOtherThreadIsIgnored() throws Exception {
    InteractionContext interaction = new InteractionContext("i1", 0L);
    CurrentInteraction.Scope scope = CurrentInteraction.makeCurrent(interaction);

    Future<Boolean> owned = executor.submit(scope::isOwnedByCurrentThread);
    assertFalse(owned.get(5, TimeUnit.SECONDS));
    executor.submit(scope::close).get(5, TimeUnit.SECONDS);

    assertSame(interaction, CurrentInteraction.get());
    scope.close();
    assertNull(CurrentInteraction.get());
  }

  @Test
  void testClearIfCurrent() {
    InteractionContext interaction = new InteractionContext("i1", 0L);
    InteractionContext other = new InteractionContext("i2", 0L);
    CurrentInteraction.makeCurrent(interaction);

    assertFalse(CurrentInteraction.clearIfCurrent(other));
    assertTrue(CurrentInteraction.clearIfCurrent(interaction));
    assertNull(CurrentInteraction.get());
  }
}
