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
package ai.raindrop.core.transport;

import java.time.Duration;

/**
 * Settings for the {@link Transport}.
 */
public class TransportConfig {

  public static final String DEFAULT_BASE_URL = "https://api.raindrop.ai";
  public static final int MAX_EVENT_SIZE_BYTES = 1024 * 1024;

  private final String apiKey;
  private final String baseUrl;
  private final boolean debug;
  private final boolean disabled;
  private final Duration flushInterval;
  private final int maxQueueSize;
  private final int maxRetries;
  private final Duration initialBackoff;
  private final Duration requestTimeout;
  private final Duration connectTimeout;
  private final int maxEventSizeBytes;
  private final double capacityWarningRatio;

  private TransportConfig(Builder builder) {
    this.apiKey = builder.apiKey;
    this.baseUrl = builder.baseUrl;
    this.debug = builder.debug;
    this.disabled = builder.disabled;
    this.flushInterval = builder.flushInterval;
    this.maxQueueSize = builder.maxQueueSize;
    this.maxRetries = builder.maxRetries;
    this.initialBackoff = builder.initialBackoff;
    this.requestTimeout = builder.requestTimeout;
    this.connectTimeout = builder.connectTimeout;
    this.maxEventSizeBytes = builder.maxEventSizeBytes;
    this.capacityWarningRatio = builder.capacityWarningRatio;
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

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public int getMaxEventSizeBytes() {
    return maxEventSizeBytes;
  }

  public double getCapacityWarningRatio() {
    return capacityWarningRatio;
  }

  /**
   * Returns the queue length at which a capacity warning is logged.
   *
   * @return the warning threshold
   */
  public int getCapacityWarningThreshold() {
    return (int) (maxQueueSize * capacityWarningRatio);
  }

  /**
   * Builder for TransportConfig.
   */
  public static class Builder {
    private String apiKey;
    private String baseUrl = DEFAULT_BASE_URL;
    private boolean debug = false;
    private boolean disabled = false;
    private Duration flushInterval = Duration.ofSeconds(1);
    private int maxQueueSize = 100;
    private int maxRetries = 3;
    private Duration initialBackoff = Duration.ofMillis(100);
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private int maxEventSizeBytes = MAX_EVENT_SIZE_BYTES;
    private double capacityWarningRatio = 0.8;

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

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder maxEventSizeBytes(int maxEventSizeBytes) {
      this.maxEventSizeBytes = maxEventSizeBytes;
      return this;
    }

    public Builder capacityWarningRatio(double capacityWarningRatio) {
      this.capacityWarningRatio = capacityWarningRatio;
      return this;
    }

    public TransportConfig build() {
      if (baseUrl == null || baseUrl.isEmpty()) {
        throw new IllegalArgumentException("baseUrl is required");
      }
      if (maxQueueSize < 1) {
        throw new IllegalArgumentException("maxQueueSize must be at least 1");
      }
      if (maxRetries < 0) {
        throw new IllegalArgumentException("maxRetries must not be negative");
      }
      if (flushInterval == null || flushInterval.isNegative()) {
        throw new IllegalArgumentException("flushInterval must not be negative");
      }
      if (initialBackoff == null || initialBackoff.isNegative()) {
        throw new IllegalArgumentException("initialBackoff must not be negative");
      }
      if (capacityWarningRatio <= 0 || capacityWarningRatio > 1) {
        throw new IllegalArgumentException("capacityWarningRatio must be in (0, 1]");
      }
      return new TransportConfig(this);
    }
  }
}
