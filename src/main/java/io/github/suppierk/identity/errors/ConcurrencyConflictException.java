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
import java.util.UUID;

/**
 * Thrown when the version observed by a writer no longer matches the version of the stream at
 * commit time.
 *
 * <p>The caller may re-run the whole load-decide-append cycle; nothing in the core retries on its
 * own.
 */
public final class ConcurrencyConflictException extends IdentityException {
  @Serial private static final long serialVersionUID = -8046316707183296651L;

  private final UUID aggregateId;
  private final long expectedVersion;

  /**
   * Used when the actual version is known at the time of the check.
   *
   * @param aggregateId of the contended stream
   * @param expectedVersion the writer has observed
   * @param actualVersion found in the store
   */
  public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, long actualVersion) {
    super(
        "Aggregate '%s' is at version %d, but version %d was expected"
            .formatted(aggregateId, actualVersion, expectedVersion));
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
  }

  /**
   * Used when the storage medium itself has rejected the write, typically via the uniqueness
   * constraint on the stream position.
   *
   * @param aggregateId of the contended stream
   * @param expectedVersion the writer has observed
   * @param cause reported by the storage medium
   */
  public ConcurrencyConflictException(UUID aggregateId, long expectedVersion, Throwable cause) {
    super(
        "Aggregate '%s' was modified concurrently after version %d"
            .formatted(aggregateId, expectedVersion),
        cause);
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
  }

  public UUID getAggregateId() {
    return aggregateId;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   */
  @SuppressWarnings("squid:S3400")
  @Override
  public int getStatusCode() {
    return 409;
  }
}
