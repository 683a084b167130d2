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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Traits describing an identified user.
 */
public class UserTraits {

  private final String name;
  private final String email;
  private final String plan;
  private final Map<String, Object> extra;

  private UserTraits(Builder builder) {
    this.name = builder.name;
    this.email = builder.email;
    this.plan = builder.plan;
    this.extra = new LinkedHashMap<>(builder.extra);
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
   * Creates traits from a map. The keys {@code name}, {@code email} and
   * {@code plan} are recognized; everything else is kept as extra traits.
   *
   * @param traits
   *            the trait map
   * @return the traits
   */
  public static UserTraits fromMap(Map<String, ?> traits) {
    Builder builder = builder();
    traits.forEach((key, value) -> {
      if ("name".equals(key)) {
        builder.name(value != null ? value.toString() : null);
      } else if ("email".equals(key)) {
        builder.email(value != null ? value.toString() : null);
      } else if ("plan".equals(key)) {
        builder.plan(value != null ? value.toString() : null);
      } else {
        builder.trait(key, value);
      }
    });
    return builder.build();
  }

  public String getName() {
    return name;
  }

  public String getEmail() {
    return email;
  }

  public String getPlan() {
    return plan;
  }

  public Map<String, Object> getExtra() {
    return extra;
  }

  /**
   * Returns the traits as a flat map, omitting empty standard traits.
   *
   * @return the trait map
   */
  public Map<String, Object> toMap() {
    Map<String, Object> result = new LinkedHashMap<>();
    if (name != null && !name.isEmpty()) {
      result.put("name", name);
    }
    if (email != null && !email.isEmpty()) {
      result.put("email", email);
    }
    if (plan != null && !plan.isEmpty()) {
      result.put("plan", plan);
    }
    result.putAll(extra);
    return result;
  }

  /**
   * Builder for UserTraits.
   */
  public static class Builder {
    private String name;
    private String email;
    private String plan;
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder email(String email) {
      this.email = email;
      return this;
    }

    public Builder plan(String plan) {
      this.plan = plan;
      return this;
    }

    public Builder trait(String key, Object value) {
      this.extra.put(key, value);
      return this;
    }

    public UserTraits build() {
      return new UserTraits(this);
    }
  }
}
