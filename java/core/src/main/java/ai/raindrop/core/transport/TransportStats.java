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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters describing what the transport has done with the events handed to
 * it. Safe to read from any thread.
 */
public class TransportStats {

  private final AtomicLong enqueued = new AtomicLong();
  private final AtomicLong droppedOversize = new AtomicLong();
  private final AtomicLong droppedOverflow = new AtomicLong();
  private final AtomicLong capacityWarnings = new AtomicLong();
  private final AtomicLong attempts = new AtomicLong();
  private final AtomicLong deliveredRequests = new AtomicLong();
  private final AtomicLong failedRequests = new AtomicLong();

  void recordEnqueued() {
    enqueued.incrementAndGet();
  }

  void recordDroppedOversize() {
    droppedOversize.incrementAndGet();
  }

  void recordDroppedOverflow() {
    droppedOverflow.incrementAndGet();
  }

  void recordCapacityWarning() {
    capacityWarnings.incrementAndGet();
  }

  void recordAttempt() {
    attempts.incrementAndGet();
  }

  void recordDelivered() {
    deliveredRequests.incrementAndGet();
  }

  void recordFailed() {
    failedRequests.incrementAndGet();
  }

  /** Events accepted into the queue. */
  public long getEnqueued() {
    return enqueued.get();
  }

  /** Events rejected for exceeding the size cap. */
  public long getDroppedOversize() {
    return droppedOversize.get();
  }

  /** Queued events evicted to make room for newer ones. */
  public long getDroppedOverflow() {
    return droppedOverflow.get();
  }

  public long getCapacityWarnings() {
    return capacityWarnings.get();
  }

  /** HTTP requests attempted, retries included. */
  public long getAttempts() {
    return attempts.get();
  }

  /** Requests that ended in a 2xx response. */
  public long getDeliveredRequests() {
    return deliveredRequests.get();
  }

  /** Requests dropped after the retry budget ran out. */
  public long getFailedRequests() {
    return failedRequests.get();
  }

  @Override
  public String toString() {
    return "TransportStats{enqueued=" + enqueued + ", droppedOversize=" + droppedOversize + ", droppedOverflow="
        + droppedOverflow + ", capacityWarnings=" + capacityWarnings + ", attempts=" + attempts
        + ", deliveredRequests=" + deliveredRequests + ", failedRequests=" + failedRequests + "}";
  }
}
