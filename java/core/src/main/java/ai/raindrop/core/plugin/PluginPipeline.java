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
package ai.raindrop.core.plugin;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.raindrop.core.DaemonThreadFactory;
import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SpanData;
import ai.raindrop.core.model.TraceData;

/**
 * PluginPipeline invokes registered plugins in registration order and isolates
 * their failures. A plugin that throws never prevents the remaining plugins or
 * the delivery of the data from running.
 *
 * <p>
 * Data hooks run inline. Flush and shutdown hooks are submitted to a small
 * worker pool and awaited up to the configured timeout.
 */
public class PluginPipeline {

  private static final Logger logger = LoggerFactory.getLogger(PluginPipeline.class);
  private static final int MAX_WORKERS = 4;

  private final List<RaindropPlugin> plugins;
  private final boolean debug;
  private final Duration timeout;
  private final ExecutorService lifecycleExecutor;
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  /**
   * Creates a new PluginPipeline.
   *
   * @param plugins
   *            the plugins in invocation order
   * @param debug
   *            whether to report plugin failures at WARN level
   * @param timeout
   *            how long flush and shutdown wait for plugins
   */
  public PluginPipeline(List<? extends RaindropPlugin> plugins, boolean debug, Duration timeout) {
    List<RaindropPlugin> copy = new ArrayList<>();
    if (plugins != null) {
      for (RaindropPlugin plugin : plugins) {
        if (plugin != null) {
          copy.add(plugin);
        }
      }
    }
    this.plugins = Collections.unmodifiableList(copy);
    this.debug = debug;
    this.timeout = timeout;
    int workers = Math.max(1, Math.min(MAX_WORKERS, this.plugins.size()));
    this.lifecycleExecutor = Executors.newFixedThreadPool(workers, new DaemonThreadFactory("raindrop-plugin"));
  }

  /**
   * Returns the registered plugins in invocation order.
   *
   * @return the plugins
   */
  public List<RaindropPlugin> getPlugins() {
    return plugins;
  }

  public void onInteractionStart(InteractionContext interaction) {
    invoke(PluginHook.INTERACTION_START, plugin -> plugin.onInteractionStart(interaction));
  }

  public void onInteractionEnd(InteractionContext interaction) {
    invoke(PluginHook.INTERACTION_END, plugin -> plugin.onInteractionEnd(interaction));
  }

  public void onSpan(SpanData span) {
    invoke(PluginHook.SPAN, plugin -> plugin.onSpan(span));
  }

  public void onTrace(TraceData trace) {
    invoke(PluginHook.TRACE, plugin -> plugin.onTrace(trace));
  }

  /**
   * Flushes all plugins and waits for them up to the timeout. Does nothing
   * after {@link #shutdown()}.
   */
  public void flush() {
    if (shutdown.get()) {
      return;
    }
    runLifecycle(PluginHook.FLUSH, RaindropPlugin::flush);
  }

  /**
   * Shuts all plugins down and releases the worker pool. Only the first call
   * has an effect.
   */
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    try {
      runLifecycle(PluginHook.SHUTDOWN, RaindropPlugin::shutdown);
    } finally {
      lifecycleExecutor.shutdownNow();
    }
  }

  public boolean isShutdown() {
    return shutdown.get();
  }

  private void invoke(PluginHook hook, Consumer<RaindropPlugin> call) {
    for (RaindropPlugin plugin : plugins) {
      if (!supports(plugin, hook)) {
        continue;
      }
      try {
        call.accept(plugin);
      } catch (RuntimeException e) {
        reportFailure(plugin, hook, e);
      }
    }
  }

  private void runLifecycle(PluginHook hook, Function<RaindropPlugin, CompletableFuture<Void>> call) {
    List<CompletableFuture<Void>> futures = new ArrayList<>();
    for (RaindropPlugin plugin : plugins) {
      if (!supports(plugin, hook)) {
        continue;
      }
      CompletableFuture<Void> future;
      try {
        future = CompletableFuture.supplyAsync(() -> call.apply(plugin), lifecycleExecutor)
            .thenCompose(result -> result != null ? result : CompletableFuture.<Void>completedFuture(null));
      } catch (RejectedExecutionException e) {
        reportFailure(plugin, hook, e);
        continue;
      }
      futures.add(future.exceptionally(e -> {
        reportFailure(plugin, hook, e);
        return null;
      }));
    }
    if (futures.isEmpty()) {
      return;
    }
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get(timeout.toMillis(),
          TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      logger.warn("Plugin {} did not complete within {} ms", hook, timeout.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting for plugin {}", hook);
    } catch (ExecutionException e) {
      logger.warn("Plugin {} failed", hook, e.getCause());
    }
  }

  private boolean supports(RaindropPlugin plugin, PluginHook hook) {
    try {
      return plugin.supports(hook);
    } catch (RuntimeException e) {
      reportFailure(plugin, hook, e);
      return false;
    }
  }

  private void reportFailure(RaindropPlugin plugin, PluginHook hook, Throwable error) {
    String name = pluginName(plugin);
    if (debug) {
      logger.warn("Plugin {} threw in {}: {}", name, hook, error.getMessage(), error);
    } else {
      logger.debug("Plugin {} threw in {}: {}", name, hook, error.getMessage());
    }
  }

  private static String pluginName(RaindropPlugin plugin) {
    try {
      return plugin.getName();
    } catch (RuntimeException e) {
      return plugin.getClass().getName();
    }
  }
}
