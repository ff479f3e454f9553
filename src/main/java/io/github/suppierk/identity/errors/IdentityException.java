/*
 * Copyright 2024 Roman Khlebnov
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
 */

package io.github.suppierk.identity.errors;

import java.io.Serial;

/**
 * Base type of every failure the identity core reports to its callers.
 *
 * <p>The hierarchy is closed: callers can rely on the listed subclasses being the only failure
 * kinds produced by the event store, the aggregates, the command handlers and the projectors.
 * Each failure carries the most appropriate HTTP status code for the consumer convenience, so that
 * the HTTP layer does not have to re-classify them.
 */
public abstract sealed class IdentityException extends RuntimeException
    permits AggregateNotFoundException,
        ConcurrencyConflictException,
        DomainValidationException,
        EventSerializationException,
        ProjectionException,
        StorageFailureException {
  @Serial private static final long serialVersionUID = -3323466104745498105L;

  /**
   * Constructs a new exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  protected IdentityException(String message) {
    super(message);
  }

  /**
   * Constructs a new exception with the specified detail message and cause.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  protected IdentityException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this failure
   */
  public abstract int getStatusCode();
}
