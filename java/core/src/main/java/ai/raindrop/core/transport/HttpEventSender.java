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

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.raindrop.core.DaemonThreadFactory;

/**
 * HTTP-based sender that posts payloads to the Raindrop API with bearer
 * authentication.
 */
public class HttpEventSender implements EventSender {

  private static final Logger logger = LoggerFactory.getLogger(HttpEventSender.class);

  private final String baseUrl;
  private final String apiKey;
  private final TransportConfig config;
  private final ExecutorService executor;
  private final HttpClient httpClient;

  /**
   * Creates a new HTTP event sender.
   *
   * @param config
   *            the transport configuration
   */
  public HttpEventSender(TransportConfig config) {
    String url = config.getBaseUrl();
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    this.apiKey = config.getApiKey();
    this.config = config;
    this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("raindrop-http"));
    this.httpClient = HttpClient.newBuilder().connectTimeout(config.getConnectTimeout()).executor(executor).build();
  }

  @Override
  public int send(String path, String body) throws Exception {
    HttpRequest.Builder request = HttpRequest.newBuilder().uri(URI.create(baseUrl + "/v1" + path))
        .header("Content-Type", "application/json").header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
        .timeout(config.getRequestTimeout());
    if (apiKey != null && !apiKey.isEmpty()) {
      request.header("Authorization", "Bearer " + apiKey);
    }

    HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      logger.debug("Raindrop API returned status={} for {}: {}", response.statusCode(), path, response.body());
    }
    return response.statusCode();
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
