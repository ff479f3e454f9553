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

package io.github.suppierk.identity.es;

import io.github.suppierk.identity.domain.IdentityEvent;
import io.github.suppierk.identity.errors.AggregateNotFoundException;
import io.github.suppierk.identity.errors.ConcurrencyConflictException;
import io.github.suppierk.identity.errors.StorageFailureException;
import java.util.List;
import java.util.UUID;

/**
 * Append-only, per-aggregate event log with optimistic concurrency control.
 *
 * <p>Every implementation must guarantee that sequence numbers of one stream are strictly
 * increasing, start at 1 and have no gaps; stored events are never changed or removed.
 */
public interface EventStore {
  /**
   * Atomically appends events to the end of the stream.
   *
   * <p>If the current version of the stream is not {@code expectedVersion}, nothing is written.
   * Otherwise the events receive sequence numbers {@code expectedVersion + 1} to {@code
   * expectedVersion + events.size()} in the given order and are committed as a single unit.
   *
   * @param aggregateId of the stream to append to
   * @param events to append, non-empty, all belonging to {@code aggregateId}
   * @param expectedVersion the version the caller observed, {@code 0} for a new stream
   * @throws IllegalArgumentException if the arguments are malformed
   * @throws ConcurrencyConflictException if the stream is not at {@code expectedVersion}
   * @throws StorageFailureException if the storage medium failed
   */
  void append(UUID aggregateId, List<? extends IdentityEvent> events, long expectedVersion);

  /**
   * @param aggregateId of the stream to read
   * @return all stored events of the stream in ascending sequence order, never empty
   * @throws AggregateNotFoundException if the stream has no events
   * @throws StorageFailureException if the storage medium failed
   */
  List<StoredEvent> load(UUID aggregateId);

  /**
   * Checks the arguments of {@link #append(UUID, List, long)} which do not depend on the stored
   * state.
   *
   * @throws IllegalArgumentException if any argument is malformed
   */
  static void verifyAppendArguments(
      final UUID aggregateId, final List<? extends IdentityEvent> events, final long expectedVersion) {
    if (aggregateId == null) {
      throw new IllegalArgumentException("Aggregate id cannot be null");
    }

    if (events == null || events.isEmpty()) {
      throw new IllegalArgumentException("Events cannot be empty");
    }

    if (expectedVersion < 0) {
      throw new IllegalArgumentException(
          "Expected version cannot be negative, got %d".formatted(expectedVersion));
    }

    for (IdentityEvent event : events) {
      if (event == null) {
        throw new IllegalArgumentException("Event cannot be null");
      }

      if (!aggregateId.equals(event.aggregateId())) {
        throw new IllegalArgumentException(
            "Event %s belongs to aggregate '%s', not '%s'"
                .formatted(event.type().tag(), event.aggregateId(), aggregateId));
      }
    }
  }
}
