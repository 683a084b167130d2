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
package ai.raindrop.core;

/**
 * RaindropException is the base exception for all Raindrop errors. It carries
 * an optional error code and the id of the trace or interaction it relates to.
 *
 * <p>
 * Telemetry failures are never surfaced to callers through this type; it is
 * reserved for integration mistakes such as referencing an interaction that is
 * no longer active.
 */
public class RaindropException extends RuntimeException {

  private final String errorCode;
  private final String traceId;

  /**
   * Creates a new RaindropException.
   *
   * @param message
   *            the error message
   */
  public RaindropException(String message) {
    this(message, null, null, null);
  }

  /**
   * Creates a new RaindropException with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public RaindropException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  /**
   * Creates a new RaindropException with full details.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param errorCode
   *            the error code
   * @param traceId
   *            the trace or interaction id the error relates to
   */
  public RaindropException(String message, Throwable cause, String errorCode, String traceId) {
    super(message, cause);
    this.errorCode = errorCode;
    this.traceId = traceId;
  }

  /**
   * Returns the error code.
   *
   * @return the error code, or null if not set
   */
  public String getErrorCode() {
    return errorCode;
  }

  /**
   * Returns the trace or interaction id for this error.
   *
   * @return the id, or null if not set
   */
  public String getTraceId() {
    return traceId;
  }
}
