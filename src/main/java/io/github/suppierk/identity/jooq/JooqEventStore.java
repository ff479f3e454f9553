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

package io.github.suppierk.identity.jooq;

import static io.github.suppierk.identity.jooq.IdentityTables.Events.AGGREGATE_ID;
import static io.github.suppierk.identity.jooq.IdentityTables.Events.CREATED_AT;
import static io.github.suppierk.identity.jooq.IdentityTables.Events.EVENT_TYPE;
import static io.github.suppierk.identity.jooq.IdentityTables.Events.ID;
import static io.github.suppierk.identity.jooq.IdentityTables.Events.PAYLOAD;
import static io.github.suppierk.identity.jooq.IdentityTables.Events.SEQUENCE;
import static io.github.suppierk.identity.jooq.IdentityTables.Events.TABLE;

import io.github.suppierk.identity.domain.IdentityEvent;
import io.github.suppierk.identity.errors.AggregateNotFoundException;
import io.github.suppierk.identity.errors.ConcurrencyConflictException;
import io.github.suppierk.identity.errors.StorageFailureException;
import io.github.suppierk.identity.es.EventCodec;
import io.github.suppierk.identity.es.EventStore;
import io.github.suppierk.identity.es.StoredEvent;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.InsertValuesStep6;
import org.jooq.Record;
import org.jooq.Record6;
import org.jooq.Result;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable {@link EventStore} on top of a relational database accessed with jOOQ.
 *
 * <p>The version check performed inside the transaction is only a pre-check: two transactions can
 * observe the same version concurrently. The authoritative guard is the unique constraint {@value
 * #SEQUENCE_CONSTRAINT} on {@code (aggregate_id, sequence)}, whose violation is reported as {@link
 * ConcurrencyConflictException}, so the store stays correct without serializable isolation.
 */
public final class JooqEventStore implements EventStore {
  private static final Logger LOG = LoggerFactory.getLogger(JooqEventStore.class);

  static final String SEQUENCE_CONSTRAINT = "uq_events_aggregate_sequence";

  /** Serialization failure. */
  private static final String SERIALIZATION_FAILURE = "40001";

  /** Concurrent update of the same row as reported by H2. */
  private static final String H2_CONCURRENT_UPDATE = "90131";

  private final DslContextProvider dslContextProvider;
  private final EventCodec eventCodec;
  private final Clock clock;

  public JooqEventStore(final DslContextProvider dslContextProvider) {
    this(dslContextProvider, new EventCodec(), Clock.systemUTC());
  }

  /**
   * @param dslContextProvider to choose the database of a stream with
   * @param eventCodec to convert events with
   * @param clock to timestamp stored events with
   * @throws IllegalArgumentException if any argument is null
   */
  public JooqEventStore(
      final DslContextProvider dslContextProvider, final EventCodec eventCodec, final Clock clock) {
    if (dslContextProvider == null) {
      throw new IllegalArgumentException("DSLContext provider cannot be null");
    }

    if (eventCodec == null) {
      throw new IllegalArgumentException("Event codec cannot be null");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    this.dslContextProvider = dslContextProvider;
    this.eventCodec = eventCodec;
    this.clock = clock;
  }

  /** {@inheritDoc} */
  @Override
  public void append(
      final UUID aggregateId, final List<? extends IdentityEvent> events, final long expectedVersion) {
    EventStore.verifyAppendArguments(aggregateId, events, expectedVersion);

    final List<IdentityEvent> batch = List.copyOf(events);
    final List<String> payloads =
        batch.stream().map(event -> eventCodec.writePayload(eventCodec.encode(event))).toList();
    final Instant createdAt = clock.instant().truncatedTo(ChronoUnit.MICROS);

    final DSLContext dsl = dslContext(aggregateId);

    try {
      dsl.transaction(
          (final Configuration trx) -> {
            final long currentVersion = currentVersion(trx.dsl(), aggregateId);
            if (currentVersion != expectedVersion) {
              throw new ConcurrencyConflictException(aggregateId, expectedVersion, currentVersion);
            }

            InsertValuesStep6<Record, UUID, UUID, Long, String, String, Instant> insert =
                trx.dsl().insertInto(TABLE, ID, AGGREGATE_ID, SEQUENCE, EVENT_TYPE, PAYLOAD, CREATED_AT);

            for (int i = 0; i < batch.size(); i++) {
              insert =
                  insert.values(
                      UUID.randomUUID(),
                      aggregateId,
                      expectedVersion + i + 1,
                      batch.get(i).type().tag(),
                      payloads.get(i),
                      createdAt);
            }

            insert.execute();
          });
    } catch (ConcurrencyConflictException e) {
      LOG.debug("Rejected append to {}: {}", aggregateId, e.getMessage());
      throw e;
    } catch (DataAccessException e) {
      if (isConcurrentWrite(e)) {
        LOG.debug(
            "Concurrent append to {} lost the race at version {}", aggregateId, expectedVersion);
        throw new ConcurrencyConflictException(aggregateId, expectedVersion, e);
      }

      LOG.warn("Cannot append to {}", aggregateId, e);
      throw new StorageFailureException(
          "Cannot append %d event(s) to aggregate '%s'".formatted(batch.size(), aggregateId), e);
    }

    LOG.debug(
        "Appended {} event(s) to {} after version {}", batch.size(), aggregateId, expectedVersion);
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> load(final UUID aggregateId) {
    if (aggregateId == null) {
      throw new IllegalArgumentException("Aggregate id cannot be null");
    }

    final Result<Record6<UUID, UUID, Long, String, String, Instant>> rows;
    try {
      rows =
          dslContext(aggregateId)
              .select(ID, AGGREGATE_ID, SEQUENCE, EVENT_TYPE, PAYLOAD, CREATED_AT)
              .from(TABLE)
              .where(AGGREGATE_ID.eq(aggregateId))
              .orderBy(SEQUENCE.asc())
              .fetch();
    } catch (DataAccessException e) {
      LOG.warn("Cannot load {}", aggregateId, e);
      throw new StorageFailureException(
          "Cannot load aggregate '%s'".formatted(aggregateId), e);
    }

    if (rows.isEmpty()) {
      throw new AggregateNotFoundException(aggregateId);
    }

    return rows.map(
        row ->
            new StoredEvent(
                row.value1(),
                row.value2(),
                row.value3(),
                row.value4(),
                eventCodec.readPayload(row.value5()),
                row.value6()));
  }

  private DSLContext dslContext(final UUID aggregateId) {
    final DSLContext dsl = dslContextProvider.apply(aggregateId);
    if (dsl == null) {
      throw new IllegalStateException(
          "DSLContext provider returned null for aggregate '%s'".formatted(aggregateId));
    }

    return dsl;
  }

  private static long currentVersion(final DSLContext dsl, final UUID aggregateId) {
    final Long maxSequence =
        dsl.select(DSL.max(SEQUENCE))
            .from(TABLE)
            .where(AGGREGATE_ID.eq(aggregateId))
            .fetchOne(0, Long.class);

    return maxSequence == null ? 0L : maxSequence;
  }

  /**
   * @param e raised by the database
   * @return {@code true} if another transaction appended to the same stream first
   */
  static boolean isConcurrentWrite(final DataAccessException e) {
    final String sqlState = e.sqlState();
    if (SERIALIZATION_FAILURE.equals(sqlState) || H2_CONCURRENT_UPDATE.equals(sqlState)) {
      return true;
    }

    if (e.sqlStateClass() != SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
      return false;
    }

    for (Throwable cause = e; cause != null; cause = cause.getCause()) {
      final String message = cause.getMessage();
      if (message != null && message.toLowerCase(Locale.ROOT).contains(SEQUENCE_CONSTRAINT)) {
        return true;
      }
    }

    return false;
  }
}
