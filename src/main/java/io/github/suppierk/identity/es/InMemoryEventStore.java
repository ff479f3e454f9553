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

import com.fasterxml.jackson.databind.JsonNode;
import io.github.suppierk.identity.domain.IdentityEvent;
import io.github.suppierk.identity.errors.AggregateNotFoundException;
import io.github.suppierk.identity.errors.ConcurrencyConflictException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} keeping streams in memory, intended for tests and local tooling.
 *
 * <p>Appends to one stream are serialized by the map, appends to different streams do not block
 * each other.
 */
public final class InMemoryEventStore implements EventStore {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryEventStore.class);

  private final ConcurrentMap<UUID, List<StoredEvent>> streams;
  private final EventCodec eventCodec;
  private final Clock clock;

  public InMemoryEventStore() {
    this(new EventCodec(), Clock.systemUTC());
  }

  /**
   * @param eventCodec to produce payloads with
   * @param clock to timestamp stored events with
   * @throws IllegalArgumentException if any argument is null
   */
  public InMemoryEventStore(final EventCodec eventCodec, final Clock clock) {
    if (eventCodec == null) {
      throw new IllegalArgumentException("Event codec cannot be null");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    this.streams = new ConcurrentHashMap<>();
    this.eventCodec = eventCodec;
    this.clock = clock;
  }

  /** {@inheritDoc} */
  @Override
  public void append(
      final UUID aggregateId, final List<? extends IdentityEvent> events, final long expectedVersion) {
    EventStore.verifyAppendArguments(aggregateId, events, expectedVersion);

    // Encoding happens outside of the critical section, a failure there must not touch the stream
    final List<IdentityEvent> batch = List.copyOf(events);
    final List<JsonNode> payloads = batch.stream().map(eventCodec::encode).toList();
    final Instant createdAt = clock.instant();

    streams.compute(
        aggregateId,
        (id, existing) -> {
          final List<StoredEvent> current = existing == null ? List.of() : existing;
          if (current.size() != expectedVersion) {
            LOG.debug(
                "Rejected append to {}: expected version {}, actual {}",
                id,
                expectedVersion,
                current.size());
            throw new ConcurrencyConflictException(id, expectedVersion, current.size());
          }

          final List<StoredEvent> appended = new ArrayList<>(current.size() + batch.size());
          appended.addAll(current);

          long sequence = expectedVersion;
          for (int i = 0; i < batch.size(); i++) {
            sequence++;
            appended.add(
                new StoredEvent(
                    UUID.randomUUID(),
                    id,
                    sequence,
                    batch.get(i).type().tag(),
                    payloads.get(i),
                    createdAt));
          }

          return List.copyOf(appended);
        });

    LOG.debug(
        "Appended {} event(s) to {} after version {}", batch.size(), aggregateId, expectedVersion);
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> load(final UUID aggregateId) {
    if (aggregateId == null) {
      throw new IllegalArgumentException("Aggregate id cannot be null");
    }

    final List<StoredEvent> stream = streams.get(aggregateId);
    if (stream == null || stream.isEmpty()) {
      throw new AggregateNotFoundException(aggregateId);
    }

    return stream;
  }
}
