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

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A formatted payload waiting in the transport queue. Owned by the queue from
 * enqueue until it is drained into a batch.
 */
public final class QueuedEvent {

  private final EventType type;
  private final ObjectNode payload;
  private final long timestamp;
  private final int sizeBytes;

  /**
   * Creates a new QueuedEvent.
   *
   * @param type
   *            the event type
   * @param payload
   *            the formatted payload
   * @param timestamp
   *            enqueue time in epoch milliseconds
   * @param sizeBytes
   *            serialized size, or -1 when unknown
   */
  public QueuedEvent(EventType type, ObjectNode payload, long timestamp, int sizeBytes) {
    this.type = type;
    this.payload = payload;
    this.timestamp = timestamp;
    this.sizeBytes = sizeBytes;
  }

  public EventType getType() {
    return type;
  }

  public ObjectNode getPayload() {
    return payload;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public int getSizeBytes() {
    return sizeBytes;
  }

  @Override
  public String toString() {
    return "QueuedEvent{type=" + type.getValue() + ", sizeBytes=" + sizeBytes + "}";
  }
}
