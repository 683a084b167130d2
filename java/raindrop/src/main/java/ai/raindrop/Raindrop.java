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
package ai.raindrop;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.raindrop.core.InteractionNotFoundException;
import ai.raindrop.core.TelemetryRecorder;
import ai.raindrop.core.context.CurrentInteraction;
import ai.raindrop.core.model.FeedbackOptions;
import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SignalOptions;
import ai.raindrop.core.model.SpanData;
import ai.raindrop.core.model.SpanKind;
import ai.raindrop.core.model.UserTraits;
import ai.raindrop.core.plugin.PluginPipeline;
import ai.raindrop.core.plugin.RaindropPlugin;
import ai.raindrop.core.transport.Transport;
import ai.raindrop.core.transport.TransportConfig;
import ai.raindrop.core.wrapper.ProviderAdapter;
import ai.raindrop.core.wrapper.ProviderCall;
import ai.raindrop.core.wrapper.StreamAdapter;
import ai.raindrop.core.wrapper.StreamingProviderCall;
import ai.raindrop.core.wrapper.TracedClient;
import ai.raindrop.core.wrapper.TracedStreamClient;
import ai.raindrop.plugins.pii.PiiRedactionPlugin;

/**
 * Raindrop is the main entry point for AI observability.
 *
 * <p>
 * It traces provider calls, groups them into interactions, records tool and
 * task spans, and sends feedback, signals and user identity. Everything is
 * delivered in the background; none of the tracing methods perform network
 * I/O or throw because of delivery problems.
 *
 * <pre>{@code
 * Raindrop raindrop = Raindrop.builder().options(RaindropOptions.builder().apiKey(key).build()).build();
 * TracedClient<ChatRequest, ChatResponse> chat = raindrop.wrap(adapter, client::chat);
 * TracedResponse<ChatResponse> response = chat.call(request);
 * raindrop.feedback(response.getTraceId(), FeedbackOptions.builder().type(FeedbackType.THUMBS_UP).build());
 * }</pre>
 */
public class Raindrop implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(Raindrop.class);

  private final RaindropOptions options;
  private final TelemetryRecorder recorder;
  private final Object hookLock = new Object();
  private Thread shutdownHook;

  /**
   * Creates a new Raindrop instance with default options.
   */
  public Raindrop() {
    this(RaindropOptions.builder().build());
  }

  /**
   * Creates a new Raindrop instance with the given options.
   *
   * @param options
   *            the Raindrop options
   */
  public Raindrop(RaindropOptions options) {
    this.options = options;

    List<RaindropPlugin> plugins = new ArrayList<>();
    if (options.isRedactPii()) {
      plugins.add(new PiiRedactionPlugin());
    }
    plugins.addAll(options.getPlugins());
    PluginPipeline pipeline = new PluginPipeline(plugins, options.isDebug(), options.getPluginTimeout());

    TransportConfig transportConfig = options.toTransportConfig();
    Transport transport = options.getEventSender() != null
        ? new Transport(transportConfig, options.getEventSender())
        : new Transport(transportConfig);
    this.recorder = new TelemetryRecorder(transport, pipeline, options.isDebug());

    if (options.isRegisterShutdownHook()) {
      registerShutdownHook();
    }
    if (options.isDebug()) {
      List<String> names = new ArrayList<>();
      for (RaindropPlugin plugin : plugins) {
        names.add(plugin.getName());
      }
      logger.info("Raindrop initialized (baseUrl={}, disabled={}, plugins={})", options.getBaseUrl(),
          options.isDisabled(), names);
    }
  }

  /**
   * Creates a new Raindrop builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  // =========================================================================
  // Provider wrapping
  // =========================================================================

  /**
   * Wraps a provider call so that every call is traced.
   *
   * @param adapter
   *            extracts telemetry from requests and responses
   * @param call
   *            the underlying provider call
   * @param <Q>
   *            request type
   * @param <R>
   *            response type
   * @return the traced client
   */
  public <Q, R> TracedClient<Q, R> wrap(ProviderAdapter<Q, R> adapter, ProviderCall<Q, R> call) {
    logRoutine("Wrapping provider: {}", adapter.getProvider());
    return new TracedClient<>(recorder, adapter, call);
  }

  /**
   * Wraps a streaming provider call so that every stream is traced.
   *
   * @param adapter
   *            extracts telemetry from requests and chunks
   * @param call
   *            the underlying streaming call
   * @param <Q>
   *            request type
   * @param <C>
   *            chunk type
   * @return the traced client
   */
  public <Q, C> TracedStreamClient<Q, C> wrapStream(StreamAdapter<Q, C> adapter, StreamingProviderCall<Q, C> call) {
    logRoutine("Wrapping streaming provider: {}", adapter.getProvider());
    return new TracedStreamClient<>(recorder, adapter, call);
  }

  // =========================================================================
  // Users and signals
  // =========================================================================

  /**
   * Identifies the user for all subsequent traces and interactions. An
   * identify event is sent only when traits are given.
   *
   * @param userId
   *            the user id
   * @param traits
   *            the user traits, may be null
   */
  public void identify(String userId, UserTraits traits) {
    recorder.setCurrentUserId(userId);
    if (traits != null) {
      recorder.getTransport().sendIdentify(userId, traits);
    }
    logRoutine("User identified: {}", userId);
  }

  public void identify(String userId) {
    identify(userId, null);
  }

  /**
   * Sends feedback for a trace or interaction.
   *
   * @param traceId
   *            the trace or interaction id
   * @param feedback
   *            the feedback
   */
  public void feedback(String traceId, FeedbackOptions feedback) {
    recorder.getTransport().sendFeedback(traceId, feedback);
    logRoutine("Feedback sent: {}", traceId);
  }

  /**
   * Sends a custom signal, such as an edit or a detected hallucination.
   *
   * @param signal
   *            the signal
   */
  public void trackSignal(SignalOptions signal) {
    recorder.getTransport().sendSignal(signal);
    logRoutine("Signal tracked: {} {}", signal.getEventId(), signal.getName());
  }

  // =========================================================================
  // Interactions
  // =========================================================================

  /**
   * Begins an interaction and makes it current on this thread until it is
   * finished.
   *
   * @param beginOptions
   *            the interaction options
   * @return the interaction handle
   */
  public Interaction begin(BeginOptions beginOptions) {
    BeginOptions opts = beginOptions != null ? beginOptions : BeginOptions.builder().build();
    String id = opts.getEventId() != null ? opts.getEventId() : recorder.generateTraceId();
    InteractionContext context = new InteractionContext(id, System.currentTimeMillis());
    context.setUserId(opts.getUserId() != null ? opts.getUserId() : recorder.getCurrentUserId());
    context.setConversationId(opts.getConversationId());
    context.setInput(opts.getInput());
    context.setModel(opts.getModel());
    context.setEvent(opts.getEvent());
    context.getProperties().putAll(opts.getProperties());
    context.getAttachments().addAll(opts.getAttachments());

    CurrentInteraction.Scope scope = CurrentInteraction.makeCurrent(context);
    recorder.startInteraction(context);
    return new Interaction(context, recorder, scope);
  }

  public Interaction begin() {
    return begin(null);
  }

  /**
   * Resumes an interaction that has begun and not finished, making it current
   * on this thread.
   *
   * @param interactionId
   *            the interaction id
   * @return the interaction handle
   * @throws InteractionNotFoundException
   *             if no active interaction has that id
   */
  public Interaction resumeInteraction(String interactionId) {
    InteractionContext context = recorder.lookupActive(interactionId);
    CurrentInteraction.Scope scope = CurrentInteraction.makeCurrent(context);
    logRoutine("Interaction resumed: {}", interactionId);
    return new Interaction(context, recorder, scope);
  }

  /**
   * Runs work inside a new interaction. The interaction is current while the
   * work runs, and the previous one is restored afterwards. A thrown exception
   * is recorded as the interaction error and rethrown.
   *
   * @param interactionOptions
   *            the interaction options
   * @param work
   *            the work
   * @param <T>
   *            the result type
   * @return the result of the work
   * @throws Exception
   *             whatever the work throws
   */
  public <T> T withInteraction(InteractionOptions interactionOptions, Callable<T> work) throws Exception {
    InteractionOptions opts = interactionOptions != null ? interactionOptions : InteractionOptions.builder().build();
    InteractionContext context = newScopedInteraction(opts, opts.getEvent(), opts.getInput());
    recorder.startInteraction(context);
    String error = null;
    try (CurrentInteraction.Scope scope = CurrentInteraction.makeCurrent(context)) {
      return work.call();
    } catch (Exception | Error e) {
      error = errorMessage(e);
      throw e;
    } finally {
      recorder.finishInteraction(context, error);
    }
  }

  /**
   * Returns a handle for the interaction current on this thread.
   *
   * @return the handle, or null if no interaction is active
   */
  public Interaction currentInteraction() {
    InteractionContext context = recorder.getCurrentInteraction();
    return context != null ? new Interaction(context, recorder, null) : null;
  }

  /**
   * Wraps a function as a workflow: every call runs as its own interaction
   * whose event is the workflow name. The string form of the argument is the
   * input and a {@code String} result becomes the output.
   *
   * @param name
   *            the workflow name
   * @param fn
   *            the function
   * @param <I>
   *            input type
   * @param <O>
   *            output type
   * @return the traced function
   */
  public <I, O> Function<I, O> workflow(String name, Function<I, O> fn) {
    return workflow(name, InteractionOptions.builder().build(), fn);
  }

  /**
   * Wraps a function as a workflow with extra interaction options. The event
   * defaults to the workflow name.
   *
   * @param name
   *            the workflow name
   * @param workflowOptions
   *            user, conversation and properties for each run
   * @param fn
   *            the function
   * @param <I>
   *            input type
   * @param <O>
   *            output type
   * @return the traced function
   */
  public <I, O> Function<I, O> workflow(String name, InteractionOptions workflowOptions, Function<I, O> fn) {
    String event = workflowOptions.getEvent() != null ? workflowOptions.getEvent() : name;
    return input -> {
      InteractionContext context = newScopedInteraction(workflowOptions, event,
          input != null ? String.valueOf(input) : null);
      recorder.startInteraction(context);
      logRoutine("Workflow started: {} {}", name, context.getInteractionId());
      String error = null;
      try (CurrentInteraction.Scope scope = CurrentInteraction.makeCurrent(context)) {
        O result = fn.apply(input);
        if (result instanceof String) {
          context.setOutput((String) result);
        }
        return result;
      } catch (RuntimeException | Error e) {
        error = errorMessage(e);
        throw e;
      } finally {
        recorder.finishInteraction(context, error);
      }
    };
  }

  // =========================================================================
  // Spans
  // =========================================================================

  public <I, O> Function<I, O> wrapTool(String name, Function<I, O> fn) {
    return wrapTool(name, Map.of(), fn);
  }

  /**
   * Wraps a function as a tool. Each call is recorded as a tool span of the
   * current interaction, or as a standalone trace outside one.
   *
   * @param name
   *            the tool name
   * @param properties
   *            properties attached to every span
   * @param fn
   *            the function
   * @param <I>
   *            input type
   * @param <O>
   *            output type
   * @return the traced function
   */
  public <I, O> Function<I, O> wrapTool(String name, Map<String, ?> properties, Function<I, O> fn) {
    return input -> runSpan(name, false, properties, input, fn);
  }

  public <I, O> Function<I, O> wrapTask(String name, Function<I, O> fn) {
    return wrapTask(name, Map.of(), fn);
  }

  /**
   * Wraps a function as a task, a higher level unit of work. Tasks are
   * recorded like tools with the {@code is_task} property set.
   *
   * @param name
   *            the task name
   * @param properties
   *            properties attached to every span
   * @param fn
   *            the function
   * @param <I>
   *            input type
   * @param <O>
   *            output type
   * @return the traced function
   */
  public <I, O> Function<I, O> wrapTask(String name, Map<String, ?> properties, Function<I, O> fn) {
    return input -> runSpan(name, true, properties, input, fn);
  }

  /**
   * Starts a span that is ended explicitly.
   *
   * @param name
   *            the span name
   * @param kind
   *            tool or ai, defaults to tool
   * @param properties
   *            initial properties, may be null
   * @return the span handle
   */
  public ManualSpan startSpan(String name, SpanKind kind, Map<String, ?> properties) {
    InteractionContext interaction = recorder.getCurrentInteraction();
    SpanData span = new SpanData(recorder.generateTraceId(), name, kind, System.currentTimeMillis());
    span.putProperties(properties);
    logRoutine("Manual span started: {} {}", name, span.getSpanId());
    return new ManualSpan(span, interaction, recorder);
  }

  public ManualSpan startSpan(String name) {
    return startSpan(name, SpanKind.TOOL, null);
  }

  // =========================================================================
  // Lifecycle
  // =========================================================================

  /**
   * Returns the id of the most recent trace or interaction sent.
   *
   * @return the id, or null
   */
  public String getLastTraceId() {
    return recorder.getLastTraceId();
  }

  /**
   * Flushes plugins, then sends all queued events and waits for delivery.
   */
  public void flush() {
    recorder.flush();
  }

  /**
   * Flushes and shuts down plugins, then flushes and closes the transport.
   * Only the first call has an effect.
   */
  @Override
  public void close() {
    unregisterShutdownHook();
    recorder.close();
  }

  /**
   * Registers a JVM shutdown hook that closes this instance. Registering more
   * than once has no effect.
   */
  public void registerShutdownHook() {
    synchronized (hookLock) {
      if (shutdownHook != null || recorder.isClosed()) {
        return;
      }
      shutdownHook = new Thread(recorder::close, "raindrop-shutdown");
      Runtime.getRuntime().addShutdownHook(shutdownHook);
    }
  }

  public RaindropOptions getOptions() {
    return options;
  }

  public List<RaindropPlugin> getPlugins() {
    return recorder.getPlugins().getPlugins();
  }

  /**
   * Returns the telemetry pipeline, for custom provider wrappers.
   *
   * @return the recorder
   */
  public TelemetryRecorder getRecorder() {
    return recorder;
  }

  private void unregisterShutdownHook() {
    synchronized (hookLock) {
      if (shutdownHook == null) {
        return;
      }
      try {
        Runtime.getRuntime().removeShutdownHook(shutdownHook);
      } catch (IllegalStateException e) {
        // JVM is already shutting down and the hook is running
        logger.debug("Shutdown in progress, leaving hook registered");
      }
      shutdownHook = null;
    }
  }

  private InteractionContext newScopedInteraction(InteractionOptions opts, String event, String input) {
    InteractionContext context = new InteractionContext(recorder.generateTraceId(), System.currentTimeMillis());
    context.setUserId(opts.getUserId() != null ? opts.getUserId() : recorder.getCurrentUserId());
    context.setConversationId(opts.getConversationId());
    context.setInput(input);
    context.setEvent(event);
    context.getProperties().putAll(opts.getProperties());
    return context;
  }

  private <I, O> O runSpan(String name, boolean task, Map<String, ?> properties, I input, Function<I, O> fn) {
    InteractionContext interaction = recorder.getCurrentInteraction();
    SpanData span = new SpanData(recorder.generateTraceId(), name, SpanKind.TOOL, System.currentTimeMillis());
    span.setInput(input);
    if (task) {
      span.getProperties().put("is_task", true);
    }
    span.putProperties(properties);
    logRoutine("{} started: {} {}", task ? "Task" : "Tool", name, span.getSpanId());

    O result;
    try {
      result = fn.apply(input);
    } catch (RuntimeException | Error e) {
      span.finish(System.currentTimeMillis(), null, errorMessage(e));
      recorder.completeSpan(span, interaction);
      throw e;
    }
    span.finish(System.currentTimeMillis(), result, null);
    recorder.completeSpan(span, interaction);
    return result;
  }

  private static String errorMessage(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
  }

  private void logRoutine(String format, Object... args) {
    if (options.isDebug()) {
      logger.info(format, args);
    } else {
      logger.debug(format, args);
    }
  }

  /**
   * Builder for Raindrop.
   */
  public static class Builder {
    private RaindropOptions options;
    private final List<RaindropPlugin> plugins = new ArrayList<>();

    /**
     * Sets the Raindrop options.
     *
     * @param options
     *            the options
     * @return this builder
     */
    public Builder options(RaindropOptions options) {
      this.options = options;
      return this;
    }

    /**
     * Adds a plugin after those configured in the options.
     *
     * @param plugin
     *            the plugin to add
     * @return this builder
     */
    public Builder plugin(RaindropPlugin plugin) {
      this.plugins.add(plugin);
      return this;
    }

    /**
     * Builds the Raindrop instance.
     *
     * @return the configured Raindrop instance
     */
    public Raindrop build() {
      RaindropOptions base = options != null ? options : RaindropOptions.builder().build();
      if (plugins.isEmpty()) {
        return new Raindrop(base);
      }
      RaindropOptions merged = RaindropOptions.builder().apiKey(base.getApiKey()).baseUrl(base.getBaseUrl())
          .debug(base.isDebug()).disabled(base.isDisabled()).flushInterval(base.getFlushInterval())
          .maxQueueSize(base.getMaxQueueSize()).maxRetries(base.getMaxRetries())
          .initialBackoff(base.getInitialBackoff()).requestTimeout(base.getRequestTimeout())
          .plugins(base.getPlugins()).plugins(plugins).redactPii(base.isRedactPii())
          .registerShutdownHook(base.isRegisterShutdownHook()).pluginTimeout(base.getPluginTimeout())
          .eventSender(base.getEventSender()).build();
      return new Raindrop(merged);
    }
  }
}
