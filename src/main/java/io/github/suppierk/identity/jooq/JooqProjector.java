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

import io.github.suppierk.identity.domain.EventType;
import io.github.suppierk.identity.errors.IdentityException;
import io.github.suppierk.identity.errors.ProjectionException;
import io.github.suppierk.identity.es.EventCodec;
import io.github.suppierk.identity.es.StoredEvent;
import io.github.suppierk.identity.projection.Projector;
import java.util.Optional;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.exception.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Projector} maintaining a read-model table with jOOQ.
 *
 * <p>Every failure, including undecodable payloads and database errors, is reported as {@link
 * ProjectionException}.
 */
public abstract sealed class JooqProjector implements Projector
    permits JooqUserProjector, JooqRoleProjector {
  private static final Logger LOG = LoggerFactory.getLogger(JooqProjector.class);

  private final DslContextProvider dslContextProvider;
  private final EventCodec eventCodec;

  protected JooqProjector(final DslContextProvider dslContextProvider, final EventCodec eventCodec) {
    if (dslContextProvider == null) {
      throw new IllegalArgumentException("DSLContext provider cannot be null");
    }

    if (eventCodec == null) {
      throw new IllegalArgumentException("Event codec cannot be null");
    }

    this.dslContextProvider = dslContextProvider;
    this.eventCodec = eventCodec;
  }

  protected final EventCodec eventCodec() {
    return eventCodec;
  }

  /**
   * @param type of the event
   * @param event to apply
   * @param dsl of the database holding the stream of the event
   * @return {@code false} if the read model does not track this event type
   */
  protected abstract boolean project(EventType type, StoredEvent event, DSLContext dsl);

  /** {@inheritDoc} */
  @Override
  public final void handle(final StoredEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Stored event cannot be null");
    }

    final Optional<EventType> type = EventType.fromTag(event.eventType());
    if (type.isEmpty()) {
      LOG.debug("{} skips unknown event type '{}'", getClass().getSimpleName(), event.eventType());
      return;
    }

    final boolean projected;
    try {
      projected = project(type.get(), event, dslContext(event.aggregateId()));
    } catch (ProjectionException e) {
      LOG.warn("{} failed on {}: {}", getClass().getSimpleName(), describe(event), e.getMessage());
      throw e;
    } catch (IdentityException | DataAccessException e) {
      LOG.warn("{} failed on {}", getClass().getSimpleName(), describe(event), e);
      throw new ProjectionException("Cannot project %s".formatted(describe(event)), e);
    }

    if (projected) {
      LOG.debug("{} applied {}", getClass().getSimpleName(), describe(event));
    }
  }

  /**
   * @param rowsUpdated reported by the update statement
   * @param readModel name of the read model
   * @param id of the row
   * @throws ProjectionException if no row was updated
   */
  protected static void requireUpdated(final int rowsUpdated, final String readModel, final UUID id) {
    if (rowsUpdated == 0) {
      throw new ProjectionException("%s row '%s' does not exist".formatted(readModel, id));
    }
  }

  private DSLContext dslContext(final UUID aggregateId) {
    final DSLContext dsl = dslContextProvider.apply(aggregateId);
    if (dsl == null) {
      throw new IllegalStateException(
          "DSLContext provider returned null for aggregate '%s'".formatted(aggregateId));
    }

    return dsl;
  }

  private static String describe(final StoredEvent event) {
    return "%s #%d of '%s'".formatted(event.eventType(), event.sequence(), event.aggregateId());
  }
}
