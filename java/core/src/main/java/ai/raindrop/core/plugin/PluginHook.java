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

/**
 * The lifecycle points at which plugins are invoked.
 */
public enum PluginHook {
  /** An interaction has begun. */
  INTERACTION_START,
  /** An interaction is about to be sent. */
  INTERACTION_END,
  /** A span has completed and is about to be stored or sent. */
  SPAN,
  /** A standalone trace is about to be sent. */
  TRACE,
  /** Buffered plugin data should be exported. */
  FLUSH,
  /** Plugin resources should be released. */
  SHUTDOWN
}
