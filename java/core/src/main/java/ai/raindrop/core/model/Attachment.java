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
package ai.raindrop.core.model;

/**
 * An attachment sent along with an interaction, such as a retrieved document,
 * generated code or an image URL. The value and name are mutable so that
 * redaction plugins can rewrite them.
 */
public class Attachment {

  private final String type;
  private String value;
  private final String role;
  private String name;
  private final String language;
  private final String attachmentId;

  private Attachment(Builder builder) {
    this.type = builder.type;
    this.value = builder.value;
    this.role = builder.role;
    this.name = builder.name;
    this.language = builder.language;
    this.attachmentId = builder.attachmentId;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the attachment type: code, text, image or iframe.
   *
   * @return the type
   */
  public String getType() {
    return type;
  }

  public String getValue() {
    return value;
  }

  public void setValue(String value) {
    this.value = value;
  }

  /**
   * Returns the role: input or output.
   *
   * @return the role
   */
  public String getRole() {
    return role;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getLanguage() {
    return language;
  }

  /**
   * Returns the id signals can use to target this attachment.
   *
   * @return the attachment id, or null
   */
  public String getAttachmentId() {
    return attachmentId;
  }

  /**
   * Builder for Attachment.
   */
  public static class Builder {
    private String type = "text";
    private String value;
    private String role = "output";
    private String name;
    private String language;
    private String attachmentId;

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder value(String value) {
      this.value = value;
      return this;
    }

    public Builder role(String role) {
      this.role = role;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder language(String language) {
      this.language = language;
      return this;
    }

    public Builder attachmentId(String attachmentId) {
      this.attachmentId = attachmentId;
      return this;
    }

    public Attachment build() {
      if (value == null) {
        throw new IllegalStateException("value is required");
      }
      return new Attachment(this);
    }
  }
}
