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

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.raindrop.core.context.ActiveInteractionRegistry;
import ai.raindrop.core.context.CurrentInteraction;
import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SpanData;
import ai.raindrop.core.model.TraceData;
import ai.raindrop.core.plugin.PluginPipeline;
import ai.raindrop.core.transport.Transport;
import ai.raindrop.core.wrapper.WrapperContext;

/**
 * TelemetryRecorder connects the interaction model, the plugin pipeline and
 * the transport. Every finished interaction, span and trace passes through the
 * plugins exactly once and then reaches the transport.
 */
public class TelemetryRecorder implements WrapperContext {

  private static final Logger logger = LoggerFactory.getLogger(TelemetryRecorder.class);

  private final Transport transport;
  private final PluginPipeline plugins;
  private final boolean debug;
  private final ActiveInteractionRegistry registry = new ActiveInteractionRegistry();
  private final AtomicReference<String> currentUserId = new AtomicReference<>();
  private final AtomicReference<String> lastTraceId = new AtomicReference<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Creates a new TelemetryRecorder.
   *
   * @param transport
   *            the transport events are delivered through
   * @param plugins
   *            the plugin pipeline
   * @param debug
   *            whether to log routine activity at INFO level
   */
  public TelemetryRecorder(Transport transport, PluginPipeline plugins, boolean debug) {
    this.transport = transport;
    this.plugins = plugins;
    this.debug = debug;
  }

  @Override
  public String generateTraceId() {
    return "trace_" + UUID.randomUUID();
  }

  @Override
  public String getCurrentUserId() {
    return currentUserId.get();
  }

  public void setCurrentUserId(String userId) {
    currentUserId.set(userId);
  }

  @Override
  public InteractionContext getCurrentInteraction() {
    InteractionContext interaction = CurrentInteraction.get();
    return interaction != null && !interaction.isFinished() ? interaction : null;
  }

  @Override
  public boolean isDebug() {
    return debug;
  }

  /**
   * Registers a new interaction as active and notifies plugins. Does not make
   * it current.
   *
   * @param interaction
   *            the interaction
   */
  public void startInteraction(InteractionContext interaction) {
    registry.register(interaction);
    plugins.onInteractionStart(interaction);
    logRoutine("Interaction began: {}", interaction.getInteractionId());
  }

  /**
   * Looks up an interaction that has begun and not finished.
   *
   * @param interactionId
   *            the interaction id
   * @return the interaction
   * @throws InteractionNotFoundException
   *             if the id is unknown or the interaction already finished
   */
  public InteractionContext lookupActive(String interactionId) {
    return registry.lookup(interactionId);
  }

  /**
   * Finishes an interaction: removes it from the registry, runs end plugins
   * and queues it for delivery. Only the first call for an interaction has an
   * effect.
   *
   * @param interaction
   *            the interaction
   * @param error
   *            the error message, or null on success
   * @return true if this call finished the interaction
   */
  public boolean finishInteraction(InteractionContext interaction, String error) {
    return finishInteraction(interaction, error, null);
  }

  /**
   * Finishes an interaction, applying last changes to it first. The changes are
   * applied only by the call that wins the finish, before end plugins run.
   *
   * @param interaction
   *            the interaction
   * @param error
   *            the error message, or null on success
   * @param finalChanges
   *            applied to the interaction once it is marked finished, may be
   *            null
   * @return true if this call finished the interaction
   */
  public boolean finishInteraction(InteractionContext interaction, String error,
      Consumer<InteractionContext> finalChanges) {
    if (!interaction.markFinished()) {
      return false;
    }
    long endTime = System.currentTimeMillis();
    try {
      if (finalChanges != null) {
        finalChanges.accept(interaction);
      }
      plugins.onInteractionEnd(interaction);
      transport.sendInteraction(interaction, endTime, error);
      lastTraceId.set(interaction.getInteractionId());
      logRoutine("Interaction finished: {}", interaction.getInteractionId());
    } finally {
      registry.remove(interaction);
    }
    return true;
  }

  @Override
  public void completeSpan(SpanData span, InteractionContext interaction) {
    if (interaction != null && !interaction.isFinished()) {
      span.setParentId(interaction.getInteractionId());
    }
    plugins.onSpan(span);
    if (interaction != null && interaction.appendSpan(span)) {
      logRoutine("Span {} added to interaction {}", span.getName(), interaction.getInteractionId());
      return;
    }
    TraceData trace = TraceData.fromStandaloneSpan(span);
    trace.setUserId(getCurrentUserId());
    transport.sendTrace(trace);
    lastTraceId.set(trace.getTraceId());
  }

  @Override
  public void sendTrace(TraceData trace) {
    plugins.onTrace(trace);
    transport.sendTrace(trace);
    lastTraceId.set(trace.getTraceId());
    logRoutine("Trace sent: {}", trace.getTraceId());
  }

  /**
   * Returns the id of the most recently sent trace or interaction.
   *
   * @return the id, or null
   */
  public String getLastTraceId() {
    return lastTraceId.get();
  }

  /**
   * Flushes plugins, then the transport.
   */
  public void flush() {
    plugins.flush();
    transport.flush();
  }

  /**
   * Flushes and shuts down plugins, then closes the transport. Only the first
   * call has an effect.
   */
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      plugins.flush();
      plugins.shutdown();
    } finally {
      transport.close();
    }
    logRoutine("Raindrop closed: {}", transport.getStats());
  }

  public boolean isClosed() {
    return closed.get();
  }

  public ActiveInteractionRegistry getRegistry() {
    return registry;
  }

  public PluginPipeline getPlugins() {
    return plugins;
  }

  public Transport getTransport() {
    return transport;
  }

  private void logRoutine(String format, Object... args) {
    if (debug) {
      logger.info(format, args);
    } else {
      logger.debug(format, args);
    }
  }
}
