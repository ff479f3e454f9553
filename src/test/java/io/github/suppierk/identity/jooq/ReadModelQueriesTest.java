package io.github.suppierk.identity.jooq;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.identity.domain.IdentityEvent;
import io.github.suppierk.identity.domain.UserStatus;
import io.github.suppierk.identity.errors.StorageFailureException;
import io.github.suppierk.identity.es.EventCodec;
import io.github.suppierk.identity.es.StoredEvent;
import io.github.suppierk.identity.projection.RoleView;
import io.github.suppierk.identity.projection.UserView;
import io.github.suppierk.identity.test.H2Database;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.h2.jdbcx.JdbcConnectionPool;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReadModelQueriesTest {
  static final EventCodec CODEC = new EventCodec();
  static final DSLContext DSL_CONTEXT = H2Database.create("read_model_queries");
  static final ReadModelQueries QUERIES = new ReadModelQueries(DSL_CONTEXT);

  static final UUID TENANT_ID = UUID.randomUUID();
  static final UUID OTHER_TENANT_ID = UUID.randomUUID();
  static final UUID CAROL_ID = UUID.randomUUID();
  static final UUID ADMIN_ROLE_ID = UUID.randomUUID();

  static final UUID DUPLICATES_TENANT_ID = UUID.randomUUID();
  static final UUID FIRST_ERIN_ID = UUID.randomUUID();
  static final UUID SECOND_ERIN_ID = UUID.randomUUID();
  static final UUID FIRST_OPS_ROLE_ID = UUID.randomUUID();

  static StoredEvent stored(final IdentityEvent event, final long sequence) {
    return stored(event, sequence, Instant.parse("2024-05-01T10:00:00Z"));
  }

  static StoredEvent stored(
      final IdentityEvent event, final long sequence, final Instant createdAt) {
    return new StoredEvent(
        UUID.randomUUID(),
        event.aggregateId(),
        sequence,
        event.type().tag(),
        CODEC.encode(event),
        createdAt);
  }

  static void register(final UUID userId, final UUID tenantId, final String username) {
    new JooqUserProjector(DslContextProvider.dslContextIdentity(DSL_CONTEXT), CODEC)
        .handle(
            stored(
                new IdentityEvent.UserRegistered(
                    userId, tenantId, username, username + "@example.com", "hash"),
                1L));
  }

  static void createRole(final UUID roleId, final String name, final String code) {
    new JooqRoleProjector(DslContextProvider.dslContextIdentity(DSL_CONTEXT), CODEC)
        .handle(stored(new IdentityEvent.RoleCreated(roleId, TENANT_ID, name, code, null), 1L));
  }

  @BeforeAll
  static void setUp() {
    H2Database.truncate(DSL_CONTEXT);

    register(UUID.randomUUID(), TENANT_ID, "dave");
    register(UUID.randomUUID(), TENANT_ID, "alice");
    register(CAROL_ID, TENANT_ID, "carol");
    register(UUID.randomUUID(), TENANT_ID, "bob");
    register(UUID.randomUUID(), OTHER_TENANT_ID, "alice");

    new JooqUserProjector(DslContextProvider.dslContextIdentity(DSL_CONTEXT), CODEC)
        .handle(stored(new IdentityEvent.UserDeactivated(CAROL_ID, "left"), 2L));

    createRole(ADMIN_ROLE_ID, "Administrator", "admin");
    createRole(UUID.randomUUID(), "Auditor", "audit");
    final var removedRoleId = UUID.randomUUID();
    createRole(removedRoleId, "Legacy", "legacy");
    new JooqRoleProjector(DslContextProvider.dslContextIdentity(DSL_CONTEXT), CODEC)
        .handle(stored(new IdentityEvent.RoleDeleted(removedRoleId), 2L));

    // Registered later, projected first
    final var userProjector =
        new JooqUserProjector(DslContextProvider.dslContextIdentity(DSL_CONTEXT), CODEC);
    userProjector.handle(
        stored(
            new IdentityEvent.UserRegistered(
                SECOND_ERIN_ID, DUPLICATES_TENANT_ID, "erin", "erin@example.com", "hash"),
            1L,
            Instant.parse("2024-05-02T10:00:00Z")));
    userProjector.handle(
        stored(
            new IdentityEvent.UserRegistered(
                FIRST_ERIN_ID, DUPLICATES_TENANT_ID, "erin", "erin@example.com", "hash"),
            1L,
            Instant.parse("2024-05-01T10:00:00Z")));

    final var roleProjector =
        new JooqRoleProjector(DslContextProvider.dslContextIdentity(DSL_CONTEXT), CODEC);
    roleProjector.handle(
        stored(
            new IdentityEvent.RoleCreated(
                UUID.randomUUID(), DUPLICATES_TENANT_ID, "Operations", "ops", null),
            1L,
            Instant.parse("2024-05-03T10:00:00Z")));
    roleProjector.handle(
        stored(
            new IdentityEvent.RoleCreated(
                FIRST_OPS_ROLE_ID, DUPLICATES_TENANT_ID, "Operations", "ops", null),
            1L,
            Instant.parse("2024-05-01T10:00:00Z")));
  }

  @Nested
  class Users {
    @Test
    void when_user_is_looked_up_by_username_then_tenant_is_respected() {
      final var alice = QUERIES.findUserByUsername(TENANT_ID, "alice").orElseThrow();
      final var otherAlice = QUERIES.findUserByUsername(OTHER_TENANT_ID, "alice").orElseThrow();

      assertEquals(TENANT_ID, alice.tenantId());
      assertEquals(OTHER_TENANT_ID, otherAlice.tenantId());
      assertTrue(QUERIES.findUserByUsername(OTHER_TENANT_ID, "bob").isEmpty());
    }

    @Test
    void when_user_is_looked_up_by_email_then_it_is_found() {
      assertEquals(
          "bob", QUERIES.findUserByEmail(TENANT_ID, "bob@example.com").orElseThrow().username());
      assertTrue(QUERIES.findUserByEmail(TENANT_ID, "nobody@example.com").isEmpty());
    }

    @Test
    void when_users_are_paged_then_they_are_ordered_by_username() {
      final var firstPage = QUERIES.listUsers(TENANT_ID, 2, 0);
      final var secondPage = QUERIES.listUsers(TENANT_ID, 2, 2);

      assertEquals(List.of("alice", "bob"), firstPage.stream().map(UserView::username).toList());
      assertEquals(List.of("carol", "dave"), secondPage.stream().map(UserView::username).toList());
      assertTrue(QUERIES.listUsers(TENANT_ID, 2, 4).isEmpty());
    }

    @Test
    void when_users_are_filtered_by_status_then_only_matching_users_are_returned() {
      final var inactive = QUERIES.listUsersByStatus(TENANT_ID, UserStatus.INACTIVE);
      final var active = QUERIES.listUsersByStatus(TENANT_ID, UserStatus.ACTIVE);

      assertEquals(List.of(CAROL_ID), inactive.stream().map(UserView::id).toList());
      assertEquals(
          List.of("alice", "bob", "dave"), active.stream().map(UserView::username).toList());
    }

    @Test
    void when_page_or_arguments_are_invalid_then_illegal_argument_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> QUERIES.listUsers(TENANT_ID, 0, 0));
      assertThrows(IllegalArgumentException.class, () -> QUERIES.listUsers(TENANT_ID, 1, -1));
      assertThrows(IllegalArgumentException.class, () -> QUERIES.listUsers(null, 1, 0));
      assertThrows(IllegalArgumentException.class, () -> QUERIES.findUserById(null));
    }
  }

  @Nested
  class Duplicates {
    @Test
    void when_username_is_shared_then_earliest_registered_user_is_returned() {
      assertEquals(
          FIRST_ERIN_ID,
          QUERIES.findUserByUsername(DUPLICATES_TENANT_ID, "erin").orElseThrow().id());
    }

    @Test
    void when_email_is_shared_then_earliest_registered_user_is_returned() {
      assertEquals(
          FIRST_ERIN_ID,
          QUERIES.findUserByEmail(DUPLICATES_TENANT_ID, "erin@example.com").orElseThrow().id());
    }

    @Test
    void when_role_code_is_shared_then_earliest_created_role_is_returned() {
      assertEquals(
          FIRST_OPS_ROLE_ID,
          QUERIES.findRoleByCode(DUPLICATES_TENANT_ID, "ops").orElseThrow().id());
    }
  }

  @Nested
  class Roles {
    @Test
    void when_role_is_looked_up_by_code_then_it_is_found() {
      assertEquals(ADMIN_ROLE_ID, QUERIES.findRoleByCode(TENANT_ID, "admin").orElseThrow().id());
      assertTrue(QUERIES.findRoleByCode(OTHER_TENANT_ID, "admin").isEmpty());
    }

    @Test
    void when_roles_are_listed_then_deleted_ones_are_excluded() {
      assertEquals(
          List.of("Administrator", "Auditor"),
          QUERIES.listRoles(TENANT_ID).stream().map(RoleView::name).toList());
    }

    @Test
    void when_deleted_role_is_looked_up_directly_then_it_is_still_found() {
      assertTrue(QUERIES.findRoleByCode(TENANT_ID, "legacy").orElseThrow().deleted());
    }
  }

  @Test
  void when_user_status_is_unknown_then_storage_failure_is_thrown() {
    final var tenantId = UUID.randomUUID();
    final var createdAt = Instant.parse("2024-05-01T10:00:00Z");
    DSL_CONTEXT
        .insertInto(IdentityTables.UsersView.TABLE)
        .set(IdentityTables.UsersView.ID, UUID.randomUUID())
        .set(IdentityTables.UsersView.TENANT_ID, tenantId)
        .set(IdentityTables.UsersView.USERNAME, "frank")
        .set(IdentityTables.UsersView.EMAIL, "frank@example.com")
        .set(IdentityTables.UsersView.PASSWORD_HASH, "hash")
        .set(IdentityTables.UsersView.STATUS, "banned")
        .set(IdentityTables.UsersView.CREATED_AT, createdAt)
        .set(IdentityTables.UsersView.UPDATED_AT, createdAt)
        .execute();

    assertThrows(
        StorageFailureException.class, () -> QUERIES.findUserByUsername(tenantId, "frank"));
    assertThrows(StorageFailureException.class, () -> QUERIES.listUsers(tenantId, 10, 0));
  }

  @Test
  void when_read_model_is_missing_then_storage_failure_is_thrown() {
    final var emptyDatabase =
        DSL.using(
            JdbcConnectionPool.create("jdbc:h2:mem:no_read_model;DB_CLOSE_DELAY=-1", "sa", ""),
            SQLDialect.H2);
    final var queries = new ReadModelQueries(emptyDatabase);

    assertThrows(StorageFailureException.class, () -> queries.findUserById(UUID.randomUUID()));
    assertThrows(StorageFailureException.class, () -> queries.listRoles(TENANT_ID));
    assertThrows(IllegalArgumentException.class, () -> new ReadModelQueries(null));
  }
}
