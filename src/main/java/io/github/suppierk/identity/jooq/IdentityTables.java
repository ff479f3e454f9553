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

import java.time.Instant;
import java.util.UUID;
import org.jooq.DataType;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * Table and column definitions matching {@code identity_schema.sql}.
 *
 * <p>Names are unquoted, so they follow the identifier case rules of the database.
 */
public final class IdentityTables {
  private IdentityTables() {
    // No instance
  }

  private static <T> Field<T> column(final String name, final DataType<T> type) {
    return DSL.field(DSL.unquotedName(name), type);
  }

  /** Append-only event log. */
  public static final class Events {
    public static final Table<Record> TABLE = DSL.table(DSL.unquotedName("events"));

    public static final Field<UUID> ID = column("id", SQLDataType.UUID);
    public static final Field<UUID> AGGREGATE_ID = column("aggregate_id", SQLDataType.UUID);
    public static final Field<Long> SEQUENCE = column("sequence", SQLDataType.BIGINT);
    public static final Field<String> EVENT_TYPE = column("event_type", SQLDataType.VARCHAR);
    public static final Field<String> PAYLOAD = column("payload", SQLDataType.VARCHAR);
    public static final Field<Instant> CREATED_AT = column("created_at", SQLDataType.INSTANT);

    private Events() {
      // No instance
    }
  }

  /** Read model of the users. */
  public static final class UsersView {
    public static final Table<Record> TABLE = DSL.table(DSL.unquotedName("users_view"));

    public static final Field<UUID> ID = column("id", SQLDataType.UUID);
    public static final Field<UUID> TENANT_ID = column("tenant_id", SQLDataType.UUID);
    public static final Field<String> USERNAME = column("username", SQLDataType.VARCHAR);
    public static final Field<String> EMAIL = column("email", SQLDataType.VARCHAR);
    public static final Field<String> PASSWORD_HASH = column("password_hash", SQLDataType.VARCHAR);
    public static final Field<String> STATUS = column("status", SQLDataType.VARCHAR);
    public static final Field<Instant> CREATED_AT = column("created_at", SQLDataType.INSTANT);
    public static final Field<Instant> UPDATED_AT = column("updated_at", SQLDataType.INSTANT);

    private UsersView() {
      // No instance
    }
  }

  /** Read model of the roles. */
  public static final class RolesView {
    public static final Table<Record> TABLE = DSL.table(DSL.unquotedName("roles_view"));

    public static final Field<UUID> ID = column("id", SQLDataType.UUID);
    public static final Field<UUID> TENANT_ID = column("tenant_id", SQLDataType.UUID);
    public static final Field<String> NAME = column("name", SQLDataType.VARCHAR);
    public static final Field<String> CODE = column("code", SQLDataType.VARCHAR);
    public static final Field<String> DESCRIPTION = column("description", SQLDataType.VARCHAR);
    public static final Field<Boolean> DELETED = column("deleted", SQLDataType.BOOLEAN);
    public static final Field<Instant> CREATED_AT = column("created_at", SQLDataType.INSTANT);
    public static final Field<Instant> UPDATED_AT = column("updated_at", SQLDataType.INSTANT);

    private RolesView() {
      // No instance
    }
  }
}
