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

import static io.github.suppierk.identity.jooq.IdentityTables.UsersView.CREATED_AT;
import static io.github.suppierk.identity.jooq.IdentityTables.UsersView.EMAIL;
import static io.github.suppierk.identity.jooq.IdentityTables.UsersView.ID;
import static io.github.suppierk.identity.jooq.IdentityTables.UsersView.PASSWORD_HASH;
import static io.github.suppierk.identity.jooq.IdentityTables.UsersView.STATUS;
import static io.github.suppierk.identity.jooq.IdentityTables.UsersView.TABLE;
import static io.github.suppierk.identity.jooq.IdentityTables.UsersView.TENANT_ID;
import static io.github.suppierk.identity.jooq.IdentityTables.UsersView.UPDATED_AT;
import static io.github.suppierk.identity.jooq.IdentityTables.UsersView.USERNAME;

import io.github.suppierk.identity.domain.EventType;
import io.github.suppierk.identity.domain.IdentityEvent;
import io.github.suppierk.identity.domain.UserStatus;
import io.github.suppierk.identity.es.EventCodec;
import io.github.suppierk.identity.es.StoredEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;

/** Maintains {@code users_view} from the user events. */
public final class JooqUserProjector extends JooqProjector {
  private static final String READ_MODEL = "users_view";

  public JooqUserProjector(final DslContextProvider dslContextProvider) {
    this(dslContextProvider, new EventCodec());
  }

  public JooqUserProjector(final DslContextProvider dslContextProvider, final EventCodec eventCodec) {
    super(dslContextProvider, eventCodec);
  }

  @Override
  protected boolean project(final EventType type, final StoredEvent event, final DSLContext dsl) {
    switch (type) {
      case USER_REGISTERED -> {
        final var registered = eventCodec().decode(event, IdentityEvent.UserRegistered.class);
        dsl.insertInto(TABLE)
            .set(ID, registered.userId())
            .set(TENANT_ID, registered.tenantId())
            .set(USERNAME, registered.username())
            .set(EMAIL, registered.email())
            .set(PASSWORD_HASH, registered.passwordHash())
            .set(STATUS, UserStatus.ACTIVE.readModelValue())
            .set(CREATED_AT, event.createdAt())
            .set(UPDATED_AT, event.createdAt())
            .execute();
        return true;
      }
      case USER_UPDATED -> {
        final var updated = eventCodec().decode(event, IdentityEvent.UserUpdated.class);
        final Map<Field<?>, Object> changes = new LinkedHashMap<>();
        if (updated.username() != null) {
          changes.put(USERNAME, updated.username());
        }
        if (updated.email() != null) {
          changes.put(EMAIL, updated.email());
        }
        changes.put(UPDATED_AT, event.createdAt());

        requireUpdated(
            dsl.update(TABLE).set(changes).where(ID.eq(updated.userId())).execute(),
            READ_MODEL,
            updated.userId());
        return true;
      }
      case USER_DEACTIVATED -> {
        final var deactivated = eventCodec().decode(event, IdentityEvent.UserDeactivated.class);
        requireUpdated(
            dsl.update(TABLE)
                .set(STATUS, UserStatus.INACTIVE.readModelValue())
                .set(UPDATED_AT, event.createdAt())
                .where(ID.eq(deactivated.userId()))
                .execute(),
            READ_MODEL,
            deactivated.userId());
        return true;
      }
      default -> {
        return false;
      }
    }
  }
}
