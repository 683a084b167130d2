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
package ai.raindrop.plugins.otel;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;

/**
 * Options for the OpenTelemetry export plugin.
 */
public class OtelPluginOptions {

  private final String serviceName;
  private final String tracerName;
  private final boolean includeContent;
  private final String attributePrefix;
  private final OpenTelemetry openTelemetry;

  private OtelPluginOptions(Builder builder) {
    this.serviceName = builder.serviceName;
    this.tracerName = builder.tracerName;
    this.includeContent = builder.includeContent;
    this.attributePrefix = builder.attributePrefix;
    this.openTelemetry = builder.openTelemetry;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the service name recorded on every span as
   * {@code <prefix>.service}.
   *
   * @return the service name
   */
  public String getServiceName() {
    return serviceName;
  }

  public String getTracerName() {
    return tracerName;
  }

  /**
   * Returns whether input and output are recorded as span attributes.
   *
   * @return true to include content
   */
  public boolean isIncludeContent() {
    return includeContent;
  }

  public String getAttributePrefix() {
    return attributePrefix;
  }

  /**
   * Returns the OpenTelemetry instance spans are created with.
   *
   * @return the configured instance, or the global one when none was set
   */
  public OpenTelemetry getOpenTelemetry() {
    return openTelemetry != null ? openTelemetry : GlobalOpenTelemetry.get();
  }

  /**
   * Builder for OtelPluginOptions.
   */
  public static class Builder {
    private String serviceName = "raindrop";
    private String tracerName = "raindrop";
    private boolean includeContent = true;
    private String attributePrefix = "raindrop";
    private OpenTelemetry openTelemetry;

    public Builder serviceName(String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    public Builder tracerName(String tracerName) {
      this.tracerName = tracerName;
      return this;
    }

    public Builder includeContent(boolean includeContent) {
      this.includeContent = includeContent;
      return this;
    }

    public Builder attributePrefix(String attributePrefix) {
      this.attributePrefix = attributePrefix;
      return this;
    }

    /**
     * Sets the OpenTelemetry instance. When unset the global instance is used,
     * so the host application configures exporters as usual.
     *
     * @param openTelemetry
     *            the OpenTelemetry instance
     * @return this builder
     */
    public Builder openTelemetry(OpenTelemetry openTelemetry) {
      this.openTelemetry = openTelemetry;
      return this;
    }

    public OtelPluginOptions build() {
      if (attributePrefix == null || attributePrefix.isEmpty()) {
        throw new IllegalArgumentException("attributePrefix is required");
      }
      return new OtelPluginOptions(this);
    }
  }
}
