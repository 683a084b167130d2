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

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.databind.JsonNode;

import ai.raindrop.core.JsonUtils;

/**
 * EventSender that records every request and answers with scripted status
 * codes.
 */
public class RecordingEventSender implements EventSender {

  private final List<Request> requests = new CopyOnWriteArrayList<>();
  private final Deque<Integer> scripted = new ConcurrentLinkedDeque<>();
  private volatile int defaultStatus = 200;
  private volatile boolean closed;

  /**
   * Queues status codes returned by the next requests, in order. Once used up
   * the default status is returned.
   */
  public RecordingEventSender respondWith(int... statuses) {
    for (int status : statuses) {
      scripted.addLast(status);
    }
    return this;
  }

  public RecordingEventSender defaultStatus(int status) {
    this.defaultStatus = status;
    return this;
  }

  @Override
  public int send(String path, String body) {
    requests.add(new Request(path, body));
    Integer status = scripted.pollFirst();
    return status != null ? status : defaultStatus;
  }

  @Override
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  public List<Request> getRequests() {
    return new ArrayList<>(requests);
  }

  public List<Request> getRequests(String path) {
    List<Request> matching = new ArrayList<>();
    for (Request request : requests) {
      if (request.getPath().equals(path)) {
        matching.add(request);
      }
    }
    return matching;
  }

  /**
   * A recorded request.
   */
  public static final class Request {
    private final String path;
    private final String body;

    Request(String path, String body) {
      this.path = path;
      this.body = body;
    }

    public String getPath() {
      return path;
    }

    public String getBody() {
      return body;
    }

    public JsonNode json() {
      return JsonUtils.parseJson(body);
    }
  }
}
