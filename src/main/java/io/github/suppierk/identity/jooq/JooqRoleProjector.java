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

import static io.github.suppierk.identity.jooq.IdentityTables.RolesView.CODE;
import static io.github.suppierk.identity.jooq.IdentityTables.RolesView.CREATED_AT;
import static io.github.suppierk.identity.jooq.IdentityTables.RolesView.DELETED;
import static io.github.suppierk.identity.jooq.IdentityTables.RolesView.DESCRIPTION;
import static io.github.suppierk.identity.jooq.IdentityTables.RolesView.ID;
import static io.github.suppierk.identity.jooq.IdentityTables.RolesView.NAME;
import static io.github.suppierk.identity.jooq.IdentityTables.RolesView.TABLE;
import static io.github.suppierk.identity.jooq.IdentityTables.RolesView.TENANT_ID;
import static io.github.suppierk.identity.jooq.IdentityTables.RolesView.UPDATED_AT;

import io.github.suppierk.identity.domain.EventType;
import io.github.suppierk.identity.domain.IdentityEvent;
import io.github.suppierk.identity.es.EventCodec;
import io.github.suppierk.identity.es.StoredEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;

/** Maintains {@code roles_view} from the role events; deleted roles are flagged, never removed. */
public final class JooqRoleProjector extends JooqProjector {
  private static final String READ_MODEL = "roles_view";

  public JooqRoleProjector(final DslContextProvider dslContextProvider) {
    this(dslContextProvider, new EventCodec());
  }

  public JooqRoleProjector(final DslContextProvider dslContextProvider, final EventCodec eventCodec) {
    super(dslContextProvider, eventCodec);
  }

  @Override
  protected boolean project(final EventType type, final StoredEvent event, final DSLContext dsl) {
    switch (type) {
      case ROLE_CREATED -> {
        final var created = eventCodec().decode(event, IdentityEvent.RoleCreated.class);
        dsl.insertInto(TABLE)
            .set(ID, created.roleId())
            .set(TENANT_ID, created.tenantId())
            .set(NAME, created.name())
            .set(CODE, created.code())
            .set(DESCRIPTION, created.description())
            .set(DELETED, false)
            .set(CREATED_AT, event.createdAt())
            .set(UPDATED_AT, event.createdAt())
            .execute();
        return true;
      }
      case ROLE_UPDATED -> {
        final var updated = eventCodec().decode(event, IdentityEvent.RoleUpdated.class);
        final Map<Field<?>, Object> changes = new LinkedHashMap<>();
        if (updated.name() != null) {
          changes.put(NAME, updated.name());
        }
        if (updated.description() != null) {
          changes.put(DESCRIPTION, updated.description());
        }
        changes.put(UPDATED_AT, event.createdAt());

        requireUpdated(
            dsl.update(TABLE).set(changes).where(ID.eq(updated.roleId())).execute(),
            READ_MODEL,
            updated.roleId());
        return true;
      }
      case ROLE_DELETED -> {
        final var deleted = eventCodec().decode(event, IdentityEvent.RoleDeleted.class);
        requireUpdated(
            dsl.update(TABLE)
                .set(DELETED, true)
                .set(UPDATED_AT, event.createdAt())
                .where(ID.eq(deleted.roleId()))
                .execute(),
            READ_MODEL,
            deleted.roleId());
        return true;
      }
      default -> {
        return false;
      }
    }
  }
}
