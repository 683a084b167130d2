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

/**
 * The type tag of a queued event. The tag decides which endpoint the event is
 * delivered to.
 */
public enum EventType {
  TRACE("trace", Endpoint.EVENTS),
  INTERACTION("interaction", Endpoint.EVENTS),
  FEEDBACK("feedback", Endpoint.SIGNALS),
  IDENTIFY("identify", Endpoint.IDENTIFY);

  private final String value;
  private final Endpoint endpoint;

  EventType(String value, Endpoint endpoint) {
    this.value = value;
    this.endpoint = endpoint;
  }

  public String getValue() {
    return value;
  }

  public Endpoint getEndpoint() {
    return endpoint;
  }

  /**
   * Collection endpoints, relative to {@code <baseUrl>/v1}.
   */
  public enum Endpoint {
    EVENTS("/events/track", true),
    SIGNALS("/signals/track", true),
    IDENTIFY("/users/identify", false);

    private final String path;
    private final boolean batched;

    Endpoint(String path, boolean batched) {
      this.path = path;
      this.batched = batched;
    }

    public String getPath() {
      return path;
    }

    /**
     * Returns whether events for this endpoint are posted as a JSON array, as
     * opposed to one request per event.
     *
     * @return true for batched endpoints
     */
    public boolean isBatched() {
      return batched;
    }
  }
}
