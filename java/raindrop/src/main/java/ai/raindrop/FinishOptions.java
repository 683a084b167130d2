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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.raindrop.core.model.Attachment;

/**
 * Options for {@link Interaction#finish(FinishOptions)}. Properties and
 * attachments are merged into the interaction; a non-null output replaces it.
 */
public class FinishOptions {

  private final String output;
  private final Map<String, Object> properties;
  private final List<Attachment> attachments;

  private FinishOptions(Builder builder) {
    this.output = builder.output;
    this.properties = builder.properties;
    this.attachments = builder.attachments;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Shortcut for options that only set the output.
   *
   * @param output
   *            the output
   * @return the options
   */
  public static FinishOptions output(String output) {
    return builder().output(output).build();
  }

  public String getOutput() {
    return output;
  }

  public Map<String, Object> getProperties() {
    return properties;
  }

  public List<Attachment> getAttachments() {
    return attachments;
  }

  /**
   * Builder for FinishOptions.
   */
  public static class Builder {
    private String output;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<Attachment> attachments = new ArrayList<>();

    public Builder output(String output) {
      this.output = output;
      return this;
    }

    public Builder property(String key, Object value) {
      this.properties.put(key, value);
      return this;
    }

    public Builder properties(Map<String, ?> properties) {
      if (properties != null) {
        this.properties.putAll(properties);
      }
      return this;
    }

    public Builder attachment(Attachment attachment) {
      if (attachment != null) {
        this.attachments.add(attachment);
      }
      return this;
    }

    public FinishOptions build() {
      return new FinishOptions(this);
    }
  }
}
