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

import io.github.suppierk.identity.domain.UserStatus;
import io.github.suppierk.identity.errors.StorageFailureException;
import io.github.suppierk.identity.jooq.IdentityTables.RolesView;
import io.github.suppierk.identity.jooq.IdentityTables.UsersView;
import io.github.suppierk.identity.projection.RoleView;
import io.github.suppierk.identity.projection.UserView;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SelectJoinStep;
import org.jooq.SortField;
import org.jooq.exception.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read side of the identity core, served from the projected read models only.
 *
 * <p>Results are eventually consistent with the event streams.
 */
public final class ReadModelQueries {
  private static final Logger LOG = LoggerFactory.getLogger(ReadModelQueries.class);

  private static final List<Field<?>> USER_FIELDS =
      List.of(
          UsersView.ID,
          UsersView.TENANT_ID,
          UsersView.USERNAME,
          UsersView.EMAIL,
          UsersView.PASSWORD_HASH,
          UsersView.STATUS,
          UsersView.CREATED_AT,
          UsersView.UPDATED_AT);

  private static final List<Field<?>> ROLE_FIELDS =
      List.of(
          RolesView.ID,
          RolesView.TENANT_ID,
          RolesView.NAME,
          RolesView.CODE,
          RolesView.DESCRIPTION,
          RolesView.DELETED,
          RolesView.CREATED_AT,
          RolesView.UPDATED_AT);

  // Oldest row first, lookups by non-unique columns stay deterministic
  private static final List<SortField<?>> USER_ORDER =
      List.of(UsersView.CREATED_AT.asc(), UsersView.ID.asc());

  private static final List<SortField<?>> ROLE_ORDER =
      List.of(RolesView.CREATED_AT.asc(), RolesView.ID.asc());

  private final DSLContext dsl;

  /**
   * @param dsl of the database holding the read models
   * @throws IllegalArgumentException if the argument is null
   */
  public ReadModelQueries(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext cannot be null");
    }

    this.dsl = dsl;
  }

  public Optional<UserView> findUserById(final UUID userId) {
    requireArgument(userId, "User id");
    return fetchFirst(
        selectUsers(), UsersView.ID.eq(userId), USER_ORDER, ReadModelQueries::toUserView);
  }

  /**
   * Usernames are not unique within a tenant, the earliest registered match wins.
   *
   * @param tenantId owning the user
   * @param username to look up
   * @return the earliest registered user with the username, if any
   */
  public Optional<UserView> findUserByUsername(final UUID tenantId, final String username) {
    requireArgument(tenantId, "Tenant id");
    requireArgument(username, "Username");
    return fetchFirst(
        selectUsers(),
        UsersView.TENANT_ID.eq(tenantId).and(UsersView.USERNAME.eq(username)),
        USER_ORDER,
        ReadModelQueries::toUserView);
  }

  public Optional<UserView> findUserByEmail(final UUID tenantId, final String email) {
    requireArgument(tenantId, "Tenant id");
    requireArgument(email, "Email");
    return fetchFirst(
        selectUsers(),
        UsersView.TENANT_ID.eq(tenantId).and(UsersView.EMAIL.eq(email)),
        USER_ORDER,
        ReadModelQueries::toUserView);
  }

  /**
   * @param tenantId owning the users
   * @param limit maximum amount of users to return, positive
   * @param offset amount of users to skip, non-negative
   * @return page of users ordered by username
   */
  public List<UserView> listUsers(final UUID tenantId, final int limit, final int offset) {
    requireArgument(tenantId, "Tenant id");
    if (limit <= 0 || offset < 0) {
      throw new IllegalArgumentException(
          "Invalid page: limit %d, offset %d".formatted(limit, offset));
    }

    return fetchList(
        () ->
            selectUsers()
                .where(UsersView.TENANT_ID.eq(tenantId))
                .orderBy(UsersView.USERNAME.asc(), UsersView.ID.asc())
                .limit(limit)
                .offset(offset)
                .fetch(ReadModelQueries::toUserView));
  }

  public List<UserView> listUsersByStatus(final UUID tenantId, final UserStatus status) {
    requireArgument(tenantId, "Tenant id");
    requireArgument(status, "Status");

    return fetchList(
        () ->
            selectUsers()
                .where(UsersView.TENANT_ID.eq(tenantId))
                .and(UsersView.STATUS.eq(status.readModelValue()))
                .orderBy(UsersView.USERNAME.asc(), UsersView.ID.asc())
                .fetch(ReadModelQueries::toUserView));
  }

  public Optional<RoleView> findRoleById(final UUID roleId) {
    requireArgument(roleId, "Role id");
    return fetchFirst(
        selectRoles(), RolesView.ID.eq(roleId), ROLE_ORDER, ReadModelQueries::toRoleView);
  }

  public Optional<RoleView> findRoleByCode(final UUID tenantId, final String code) {
    requireArgument(tenantId, "Tenant id");
    requireArgument(code, "Role code");
    return fetchFirst(
        selectRoles(),
        RolesView.TENANT_ID.eq(tenantId).and(RolesView.CODE.eq(code)),
        ROLE_ORDER,
        ReadModelQueries::toRoleView);
  }

  /**
   * @param tenantId owning the roles
   * @return roles which were not deleted, ordered by name
   */
  public List<RoleView> listRoles(final UUID tenantId) {
    requireArgument(tenantId, "Tenant id");

    return fetchList(
        () ->
            selectRoles()
                .where(RolesView.TENANT_ID.eq(tenantId))
                .and(RolesView.DELETED.isFalse())
                .orderBy(RolesView.NAME.asc(), RolesView.ID.asc())
                .fetch(ReadModelQueries::toRoleView));
  }

  private SelectJoinStep<Record> selectUsers() {
    return dsl.select(USER_FIELDS).from(UsersView.TABLE);
  }

  private SelectJoinStep<Record> selectRoles() {
    return dsl.select(ROLE_FIELDS).from(RolesView.TABLE);
  }

  private static UserView toUserView(final Record row) {
    return new UserView(
        row.get(UsersView.ID),
        row.get(UsersView.TENANT_ID),
        row.get(UsersView.USERNAME),
        row.get(UsersView.EMAIL),
        row.get(UsersView.PASSWORD_HASH),
        toUserStatus(row),
        row.get(UsersView.CREATED_AT),
        row.get(UsersView.UPDATED_AT));
  }

  private static UserStatus toUserStatus(final Record row) {
    final String status = row.get(UsersView.STATUS);
    try {
      return UserStatus.fromReadModelValue(status);
    } catch (IllegalArgumentException e) {
      LOG.warn("User {} has unknown status '{}' in the read model", row.get(UsersView.ID), status);
      throw new StorageFailureException(
          "Unknown user status '%s' in the read model".formatted(status), e);
    }
  }

  private static RoleView toRoleView(final Record row) {
    return new RoleView(
        row.get(RolesView.ID),
        row.get(RolesView.TENANT_ID),
        row.get(RolesView.NAME),
        row.get(RolesView.CODE),
        row.get(RolesView.DESCRIPTION),
        Boolean.TRUE.equals(row.get(RolesView.DELETED)),
        row.get(RolesView.CREATED_AT),
        row.get(RolesView.UPDATED_AT));
  }

  private static <T> Optional<T> fetchFirst(
      final SelectJoinStep<Record> select,
      final Condition condition,
      final List<SortField<?>> order,
      final Function<Record, T> mapper) {
    try {
      return select.where(condition).orderBy(order).limit(1).fetchOptional().map(mapper);
    } catch (DataAccessException e) {
      LOG.warn("Read model query failed", e);
      throw new StorageFailureException("Read model query failed", e);
    }
  }

  private static <T> List<T> fetchList(final Supplier<List<T>> query) {
    try {
      return query.get();
    } catch (DataAccessException e) {
      LOG.warn("Read model query failed", e);
      throw new StorageFailureException("Read model query failed", e);
    }
  }

  private static void requireArgument(final Object value, final String name) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(name));
    }
  }
}
