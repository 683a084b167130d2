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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import ai.raindrop.core.plugin.RaindropPlugin;
import ai.raindrop.core.transport.EventSender;
import ai.raindrop.core.transport.TransportConfig;

/**
 * RaindropOptions contains configuration options for {@link Raindrop}.
 *
 * <p>
 * The builder starts from the environment: {@code RAINDROP_API_KEY},
 * {@code RAINDROP_BASE_URL}, {@code RAINDROP_DEBUG} and
 * {@code RAINDROP_DISABLED}. Explicit builder calls override them.
 */
public class RaindropOptions {

  private final String apiKey;
  private final String baseUrl;
  private final boolean debug;
  private final boolean disabled;
  private final Duration flushInterval;
  private final int maxQueueSize;
  private final int maxRetries;
  private final Duration initialBackoff;
  private final Duration requestTimeout;
  private final List<RaindropPlugin> plugins;
  private final boolean redactPii;
  private final boolean registerShutdownHook;
  private final Duration pluginTimeout;
  private final EventSender eventSender;

  private RaindropOptions(Builder builder) {
    this.apiKey = builder.apiKey;
    this.baseUrl = builder.baseUrl;
    this.debug = builder.debug;
    this.disabled = builder.disabled;
    this.flushInterval = builder.flushInterval;
    this.maxQueueSize = builder.maxQueueSize;
    this.maxRetries = builder.maxRetries;
    this.initialBackoff = builder.initialBackoff;
    this.requestTimeout = builder.requestTimeout;
    this.plugins = List.copyOf(builder.plugins);
    this.redactPii = builder.redactPii;
    this.registerShutdownHook = builder.registerShutdownHook;
    this.pluginTimeout = builder.pluginTimeout;
    this.eventSender = builder.eventSender;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public String getApiKey() {
    return apiKey;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public boolean isDebug() {
    return debug;
  }

  public boolean isDisabled() {
    return disabled;
  }

  public Duration getFlushInterval() {
    return flushInterval;
  }

  public int getMaxQueueSize() {
    return maxQueueSize;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  /**
   * Returns the plugins in invocation order, not including the PII plugin
   * added by {@link #isRedactPii()}.
   *
   * @return the plugins
   */
  public List<RaindropPlugin> getPlugins() {
    return plugins;
  }

  /**
   * Returns whether the PII redaction plugin is placed in front of all other
   * plugins.
   *
   * @return true if PII is redacted
   */
  public boolean isRedactPii() {
    return redactPii;
  }

  public boolean isRegisterShutdownHook() {
    return registerShutdownHook;
  }

  public Duration getPluginTimeout() {
    return pluginTimeout;
  }

  /**
   * Returns the sender used instead of the HTTP sender, if any.
   *
   * @return the sender, or null to post over HTTP
   */
  public EventSender getEventSender() {
    return eventSender;
  }

  /**
   * Derives the transport configuration.
   *
   * @return the transport configuration
   */
  public TransportConfig toTransportConfig() {
    return TransportConfig.builder().apiKey(apiKey).baseUrl(baseUrl).debug(debug).disabled(disabled)
        .flushInterval(flushInterval).maxQueueSize(maxQueueSize).maxRetries(maxRetries)
        .initialBackoff(initialBackoff).requestTimeout(requestTimeout).build();
  }

  /**
   * Builder for RaindropOptions.
   */
  public static class Builder {
    private String apiKey = System.getenv("RAINDROP_API_KEY");
    private String baseUrl = baseUrlFromEnv();
    private boolean debug = flagFromEnv("RAINDROP_DEBUG");
    private boolean disabled = flagFromEnv("RAINDROP_DISABLED");
    private Duration flushInterval = Duration.ofSeconds(1);
    private int maxQueueSize = 100;
    private int maxRetries = 3;
    private Duration initialBackoff = Duration.ofMillis(100);
    private Duration requestTimeout = Duration.ofSeconds(30);
    private final List<RaindropPlugin> plugins = new ArrayList<>();
    private boolean redactPii = false;
    private boolean registerShutdownHook = true;
    private Duration pluginTimeout = Duration.ofSeconds(5);
    private EventSender eventSender;

    private static String baseUrlFromEnv() {
      String url = System.getenv("RAINDROP_BASE_URL");
      return url != null && !url.isEmpty() ? url : TransportConfig.DEFAULT_BASE_URL;
    }

    private static boolean flagFromEnv(String name) {
      String value = System.getenv(name);
      return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    public Builder apiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public Builder disabled(boolean disabled) {
      this.disabled = disabled;
      return this;
    }

    public Builder flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    public Builder maxQueueSize(int maxQueueSize) {
      this.maxQueueSize = maxQueueSize;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder initialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /**
     * Adds a plugin. Plugins run in the order they are added.
     *
     * @param plugin
     *            the plugin to add
     * @return this builder
     */
    public Builder plugin(RaindropPlugin plugin) {
      if (plugin != null) {
        this.plugins.add(plugin);
      }
      return this;
    }

    public Builder plugins(List<? extends RaindropPlugin> plugins) {
      if (plugins != null) {
        plugins.forEach(this::plugin);
      }
      return this;
    }

    public Builder redactPii(boolean redactPii) {
      this.redactPii = redactPii;
      return this;
    }

    public Builder registerShutdownHook(boolean registerShutdownHook) {
      this.registerShutdownHook = registerShutdownHook;
      return this;
    }

    public Builder pluginTimeout(Duration pluginTimeout) {
      this.pluginTimeout = pluginTimeout;
      return this;
    }

    /**
     * Replaces the HTTP sender, for example with an in-memory one in tests.
     *
     * @param eventSender
     *            the sender
     * @return this builder
     */
    public Builder eventSender(EventSender eventSender) {
      this.eventSender = eventSender;
      return this;
    }

    public RaindropOptions build() {
      if (pluginTimeout == null || pluginTimeout.isNegative()) {
        throw new IllegalArgumentException("pluginTimeout must not be negative");
      }
      return new RaindropOptions(this);
    }
  }
}
