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
package ai.raindrop.plugins.pii;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Options for the PII redaction plugin.
 */
public class PiiPluginOptions {

  public static final String DEFAULT_REPLACEMENT = "<REDACTED>";

  private final Set<PiiPattern> patterns;
  private final List<Pattern> customPatterns;
  private final Set<String> allowList;
  private final String replacement;
  private final boolean specificTokens;

  private PiiPluginOptions(Builder builder) {
    this.patterns = builder.patterns.isEmpty()
        ? EnumSet.allOf(PiiPattern.class)
        : EnumSet.copyOf(builder.patterns);
    this.customPatterns = List.copyOf(builder.customPatterns);
    this.allowList = Set.copyOf(builder.allowList);
    this.replacement = builder.replacement;
    this.specificTokens = builder.specificTokens;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the built-in patterns to apply. Defaults to all of them.
   *
   * @return the patterns
   */
  public Set<PiiPattern> getPatterns() {
    return patterns;
  }

  /**
   * Returns extra patterns, applied after the built-in ones and always
   * replaced with the generic replacement.
   *
   * @return the custom patterns
   */
  public List<Pattern> getCustomPatterns() {
    return customPatterns;
  }

  /**
   * Returns exact matches that are never redacted.
   *
   * @return the allow list
   */
  public Set<String> getAllowList() {
    return allowList;
  }

  public String getReplacement() {
    return replacement;
  }

  /**
   * Returns whether built-in patterns use their specific token, such as
   * {@code <REDACTED_EMAIL>}, instead of the generic replacement.
   *
   * @return true for specific tokens
   */
  public boolean isSpecificTokens() {
    return specificTokens;
  }

  /**
   * Builder for PiiPluginOptions.
   */
  public static class Builder {
    private final Set<PiiPattern> patterns = new LinkedHashSet<>();
    private final List<Pattern> customPatterns = new ArrayList<>();
    private final Set<String> allowList = new LinkedHashSet<>();
    private String replacement = DEFAULT_REPLACEMENT;
    private boolean specificTokens = false;

    public Builder pattern(PiiPattern pattern) {
      this.patterns.add(pattern);
      return this;
    }

    public Builder patterns(Collection<PiiPattern> patterns) {
      this.patterns.addAll(patterns);
      return this;
    }

    public Builder customPattern(Pattern pattern) {
      this.customPatterns.add(pattern);
      return this;
    }

    public Builder allow(String value) {
      this.allowList.add(value);
      return this;
    }

    public Builder allowList(Collection<String> values) {
      this.allowList.addAll(values);
      return this;
    }

    public Builder replacement(String replacement) {
      this.replacement = replacement;
      return this;
    }

    public Builder specificTokens(boolean specificTokens) {
      this.specificTokens = specificTokens;
      return this;
    }

    public PiiPluginOptions build() {
      if (replacement == null) {
        throw new IllegalArgumentException("replacement must not be null");
      }
      return new PiiPluginOptions(this);
    }
  }
}
