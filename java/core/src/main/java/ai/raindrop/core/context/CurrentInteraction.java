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

import java.util.concurrent.Callable;

import ai.raindrop.core.model.InteractionContext;

/**
 * Tracks the interaction that is active on the current call chain.
 *
 * <p>
 * The value is thread-local: concurrent call chains never observe each other's
 * interaction. Installing an interaction returns a {@link Scope} that restores
 * whatever was active before, so scopes nest with stack discipline. Work handed
 * to another thread keeps the interaction when it is wrapped with
 * {@link #wrap(Callable)} or {@link #wrap(Runnable)}.
 *
 * <pre>{@code
 * try (CurrentInteraction.Scope scope = CurrentInteraction.makeCurrent(interaction)) {
 * 	// provider calls made here attach to the interaction
 * }
 * }</pre>
 */
public final class CurrentInteraction {

  private static final ThreadLocal<InteractionContext> CURRENT = new ThreadLocal<>();

  private CurrentInteraction() {
  }

  /**
   * Returns the interaction active on this thread.
   *
   * @return the interaction, or null if none is active
   */
  public static InteractionContext get() {
    return CURRENT.get();
  }

  /**
   * Checks if an interaction is active on this thread.
   *
   * @return true if an interaction is active
   */
  public static boolean isActive() {
    return CURRENT.get() != null;
  }

  /**
   * Installs an interaction as current on this thread.
   *
   * @param interaction
   *            the interaction to install, may be null to clear
   * @return a scope that restores the previous interaction when closed
   */
  public static Scope makeCurrent(InteractionContext interaction) {
    InteractionContext previous = CURRENT.get();
    set(interaction);
    return new Scope(interaction, previous, Thread.currentThread());
  }

  /**
   * Clears the current interaction if it is the given one. Used when an
   * interaction finishes on a thread other than the one that installed it.
   *
   * @param interaction
   *            the interaction that finished
   * @return true if it was current and has been cleared
   */
  public static boolean clearIfCurrent(InteractionContext interaction) {
    if (interaction != null && CURRENT.get() == interaction) {
      CURRENT.remove();
      return true;
    }
    return false;
  }

  /**
   * Wraps a callable so that it runs with the interaction that is current now,
   * on whichever thread eventually calls it.
   *
   * @param callable
   *            the work to wrap
   * @param <T>
   *            the result type
   * @return the wrapped callable
   */
  public static <T> Callable<T> wrap(Callable<T> callable) {
    InteractionContext captured = CURRENT.get();
    return () -> {
      try (Scope scope = makeCurrent(captured)) {
        return callable.call();
      }
    };
  }

  /**
   * Wraps a runnable so that it runs with the interaction that is current now.
   *
   * @param runnable
   *            the work to wrap
   * @return the wrapped runnable
   */
  public static Runnable wrap(Runnable runnable) {
    InteractionContext captured = CURRENT.get();
    return () -> {
      try (Scope scope = makeCurrent(captured)) {
        runnable.run();
      }
    };
  }

  private static void set(InteractionContext interaction) {
    if (interaction != null) {
      CURRENT.set(interaction);
    } else {
      CURRENT.remove();
    }
  }

  /**
   * Restore token returned by {@link CurrentInteraction#makeCurrent}. Closing
   * it reinstates the interaction that was current before. Closing twice, or
   * from a thread other than the one that opened it, has no effect.
   */
  public static final class Scope implements AutoCloseable {

    private final InteractionContext installed;
    private final InteractionContext previous;
    private final Thread owner;
    private boolean closed;

    private Scope(InteractionContext installed, InteractionContext previous, Thread owner) {
      this.installed = installed;
      this.previous = previous;
      this.owner = owner;
    }

    /**
     * Returns the interaction this scope installed.
     *
     * @return the installed interaction, may be null
     */
    public InteractionContext getInstalled() {
      return installed;
    }

    /**
     * Returns true if this scope can be closed from the calling thread.
     *
     * @return true if the calling thread opened this scope
     */
    public boolean isOwnedByCurrentThread() {
      return Thread.currentThread() == owner;
    }

    @Override
    public void close() {
      if (closed || !isOwnedByCurrentThread()) {
        return;
      }
      closed = true;
      set(previous);
    }
  }
}
