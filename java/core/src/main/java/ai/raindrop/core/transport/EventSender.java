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
 * Client that posts serialized payloads to the collection backend.
 */
public interface EventSender extends AutoCloseable {

  /**
   * Posts a JSON body to an endpoint.
   *
   * @param path
   *            the endpoint path, relative to {@code <baseUrl>/v1}
   * @param body
   *            the JSON body
   * @return the HTTP status code
   * @throws Exception
   *             if the request could not be completed
   */
  int send(String path, String body) throws Exception;

  @Override
  default void close() {
  }
}
