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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.raindrop.core.DaemonThreadFactory;
import ai.raindrop.core.JsonUtils;
import ai.raindrop.core.RaindropException;
import ai.raindrop.core.model.FeedbackOptions;
import ai.raindrop.core.model.InteractionContext;
import ai.raindrop.core.model.SignalOptions;
import ai.raindrop.core.model.TraceData;
import ai.raindrop.core.model.UserTraits;

/**
 * Transport buffers formatted events and delivers them to the Raindrop API in
 * the background.
 *
 * <p>
 * The {@code send*} methods only format and enqueue, so they return without
 * any network I/O. The queue is bounded: when full, the oldest event is
 * evicted, and events larger than the size cap are rejected outright. The
 * first event enqueued after a drain arms a single flush timer. A flush swaps
 * the queue out under the lock and posts trace and interaction events as one
 * batch, feedback and signal events as another, and identify events one by
 * one. Failed requests are retried with exponential backoff and dropped once
 * the retry budget is spent. Delivery failures are logged and counted, never
 * thrown.
 */
public class Transport implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(Transport.class);
  private static final int SENDER_THREADS = 4;

  private final TransportConfig config;
  private final EventSender sender;
  private final TransportStats stats = new TransportStats();

  private final Object lock = new Object();
  private final Deque<QueuedEvent> queue = new ArrayDeque<>();
  private ScheduledFuture<?> flushTimer;
  private boolean closed;

  private final ScheduledExecutorService scheduler;
  private final ExecutorService senderPool;

  /**
   * Creates a transport that delivers over HTTP.
   *
   * @param config
   *            the transport configuration
   */
  public Transport(TransportConfig config) {
    this(config, new HttpEventSender(config));
  }

  /**
   * Creates a transport that delivers through the given sender.
   *
   * @param config
   *            the transport configuration
   * @param sender
   *            the sender
   */
  public Transport(TransportConfig config, EventSender sender) {
    this.config = config;
    this.sender = sender;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("raindrop-flush"));
    this.senderPool = Executors.newFixedThreadPool(SENDER_THREADS, new DaemonThreadFactory("raindrop-send"));
  }

  /**
   * Queues a standalone trace.
   *
   * @param trace
   *            the trace
   */
  public void sendTrace(TraceData trace) {
    if (config.isDisabled()) {
      return;
    }
    try {
      enqueue(EventType.TRACE, EventFormatter.formatTrace(trace));
    } catch (RuntimeException e) {
      logDrop("Failed to format trace {}: {}", trace.getTraceId(), e.getMessage());
    }
  }

  /**
   * Queues a finished interaction together with its spans.
   *
   * @param interaction
   *            the interaction
   * @param endTime
   *            finish time in epoch milliseconds
   * @param error
   *            the error message, or null on success
   */
  public void sendInteraction(InteractionContext interaction, long endTime, String error) {
    if (config.isDisabled()) {
      return;
    }
    try {
      enqueue(EventType.INTERACTION, EventFormatter.formatInteraction(interaction, endTime, error));
    } catch (RuntimeException e) {
      logDrop("Failed to format interaction {}: {}", interaction.getInteractionId(), e.getMessage());
    }
  }

  /**
   * Queues a feedback signal.
   *
   * @param traceId
   *            the trace or interaction the feedback refers to
   * @param feedback
   *            the feedback
   */
  public void sendFeedback(String traceId, FeedbackOptions feedback) {
    if (config.isDisabled()) {
      return;
    }
    try {
      enqueue(EventType.FEEDBACK, EventFormatter.formatFeedback(traceId, feedback));
    } catch (RuntimeException e) {
      logDrop("Failed to format feedback for {}: {}", traceId, e.getMessage());
    }
  }

  /**
   * Queues a custom signal. Signals share the feedback endpoint.
   *
   * @param signal
   *            the signal
   */
  public void sendSignal(SignalOptions signal) {
    if (config.isDisabled()) {
      return;
    }
    try {
      enqueue(EventType.FEEDBACK, EventFormatter.formatSignal(signal));
    } catch (RuntimeException e) {
      logDrop("Failed to format signal {}: {}", signal.getName(), e.getMessage());
    }
  }

  /**
   * Queues a user identification.
   *
   * @param userId
   *            the user id
   * @param traits
   *            the user traits
   */
  public void sendIdentify(String userId, UserTraits traits) {
    if (config.isDisabled()) {
      return;
    }
    try {
      enqueue(EventType.IDENTIFY, EventFormatter.formatIdentify(userId, traits));
    } catch (RuntimeException e) {
      logDrop("Failed to format identify for {}: {}", userId, e.getMessage());
    }
  }

  void enqueue(EventType type, ObjectNode payload) {
    int size = JsonUtils.sizeInBytes(payload);
    if (size > config.getMaxEventSizeBytes()) {
      stats.recordDroppedOversize();
      logDrop("Event exceeds {} byte limit ({} bytes), skipping {} event", config.getMaxEventSizeBytes(), size,
          type.getValue());
      return;
    }

    QueuedEvent event = new QueuedEvent(type, payload, System.currentTimeMillis(), size);
    synchronized (lock) {
      if (closed) {
        logDrop("Transport is closed, dropping {} event", type.getValue());
        return;
      }
      int max = config.getMaxQueueSize();
      if (queue.size() >= max) {
        QueuedEvent evicted = queue.pollFirst();
        stats.recordDroppedOverflow();
        logDrop("Buffer full, discarding oldest event: {}", evicted);
      } else if (queue.size() >= config.getCapacityWarningThreshold()) {
        stats.recordCapacityWarning();
        logDrop("Buffer at {}% capacity", Math.round(queue.size() * 100.0 / max));
      }
      queue.addLast(event);
      stats.recordEnqueued();
      logRoutine("Queued event: {} {}", type.getValue(), payload);

      if (flushTimer == null) {
        flushTimer = scheduler.schedule(() -> {
          flushAsync();
        }, config.getFlushInterval().toMillis(), TimeUnit.MILLISECONDS);
      }
    }
  }

  /**
   * Drains the queue and starts delivering its events. Cancels any pending
   * flush timer.
   *
   * @return a future completing when every request of this drain has been
   *         delivered or dropped
   */
  public CompletableFuture<Void> flushAsync() {
    List<QueuedEvent> events;
    synchronized (lock) {
      if (flushTimer != null) {
        flushTimer.cancel(false);
        flushTimer = null;
      }
      if (queue.isEmpty()) {
        return CompletableFuture.completedFuture(null);
      }
      events = new ArrayList<>(queue);
      queue.clear();
    }
    return dispatch(events);
  }

  /**
   * Drains the queue and waits for delivery to finish.
   */
  public void flush() {
    try {
      flushAsync().join();
    } catch (CompletionException e) {
      logDrop("Flush failed: {}", e.getMessage());
    }
  }

  /**
   * Flushes pending events and releases the sender. Only the first call has an
   * effect. Events queued after close are dropped.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
    }
    try {
      flush();
    } finally {
      scheduler.shutdownNow();
      senderPool.shutdown();
      try {
        if (!senderPool.awaitTermination(config.getRequestTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
          senderPool.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        senderPool.shutdownNow();
      }
      try {
        sender.close();
      } catch (Exception e) {
        logger.debug("Error closing event sender", e);
      }
    }
  }

  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  /**
   * Returns the number of events waiting for the next flush.
   *
   * @return the queue length
   */
  public int getQueueSize() {
    synchronized (lock) {
      return queue.size();
    }
  }

  public TransportStats getStats() {
    return stats;
  }

  public TransportConfig getConfig() {
    return config;
  }

  private CompletableFuture<Void> dispatch(List<QueuedEvent> events) {
    ArrayNode tracked = JsonUtils.getObjectMapper().createArrayNode();
    ArrayNode signals = JsonUtils.getObjectMapper().createArrayNode();
    List<ObjectNode> identifies = new ArrayList<>();
    for (QueuedEvent event : events) {
      switch (event.getType().getEndpoint()) {
        case EVENTS:
          tracked.add(event.getPayload());
          break;
        case SIGNALS:
          signals.add(event.getPayload());
          break;
        default:
          identifies.add(event.getPayload());
          break;
      }
    }

    List<CompletableFuture<Void>> requests = new ArrayList<>();
    if (!tracked.isEmpty()) {
      requests.add(submit(EventType.Endpoint.EVENTS.getPath(), tracked, tracked.size()));
    }
    if (!signals.isEmpty()) {
      requests.add(submit(EventType.Endpoint.SIGNALS.getPath(), signals, signals.size()));
    }
    for (ObjectNode identify : identifies) {
      requests.add(submit(EventType.Endpoint.IDENTIFY.getPath(), identify, 1));
    }
    return CompletableFuture.allOf(requests.toArray(new CompletableFuture<?>[0]));
  }

  private CompletableFuture<Void> submit(String path, JsonNode body, int eventCount) {
    try {
      return CompletableFuture.runAsync(() -> deliver(path, body, eventCount), senderPool);
    } catch (RejectedExecutionException e) {
      // Pool already shut down by close(); deliver on the calling thread.
      deliver(path, body, eventCount);
      return CompletableFuture.completedFuture(null);
    }
  }

  private void deliver(String path, JsonNode body, int eventCount) {
    String json;
    try {
      json = JsonUtils.toJson(body);
    } catch (RaindropException e) {
      stats.recordFailed();
      logDrop("Failed to serialize {} events for {}: {}", eventCount, path, e.getMessage());
      return;
    }

    long delay = config.getInitialBackoff().toMillis();
    for (int attempt = 0;; attempt++) {
      stats.recordAttempt();
      String failure;
      try {
        int status = sender.send(path, json);
        if (status >= 200 && status < 300) {
          stats.recordDelivered();
          logRoutine("Sent {} events to {}", eventCount, path);
          return;
        }
        failure = "HTTP " + status;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        stats.recordFailed();
        logDrop("Interrupted while sending {} events to {}", eventCount, path);
        return;
      } catch (Exception e) {
        failure = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      }

      if (attempt >= config.getMaxRetries()) {
        stats.recordFailed();
        logDrop("Failed to send {} events to {} after {} attempts: {}", eventCount, path, attempt + 1, failure);
        return;
      }
      logRoutine("Request to {} failed ({}), retrying in {} ms", path, failure, delay);
      try {
        Thread.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        stats.recordFailed();
        logDrop("Retry interrupted, dropping {} events for {}", eventCount, path);
        return;
      }
      delay *= 2;
    }
  }

  private void logRoutine(String format, Object... args) {
    if (config.isDebug()) {
      logger.info(format, args);
    } else {
      logger.debug(format, args);
    }
  }

  private void logDrop(String format, Object... args) {
    if (config.isDebug()) {
      logger.warn(format, args);
    } else {
      logger.debug(format, args);
    }
  }
}
