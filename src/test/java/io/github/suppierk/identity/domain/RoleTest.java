package io.github.suppierk.identity.domain;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.identity.errors.DomainValidationException;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RoleTest {
  static final UUID ROLE_ID = UUID.randomUUID();
  static final UUID TENANT_ID = UUID.randomUUID();

  static Role createdRole() {
    return Role.fromEvents(
        List.of(Role.create(ROLE_ID, TENANT_ID, "Administrator", "admin", "Full access")));
  }

  @Nested
  class Creation {
    @Test
    void when_code_contains_space_then_creation_is_rejected() {
      assertThrows(
          DomainValidationException.class,
          () -> Role.create(ROLE_ID, TENANT_ID, "Admin", "admin role", null));
    }

    @Test
    void when_code_has_letters_digits_and_underscores_then_creation_is_accepted() {
      final var event =
          assertInstanceOf(
              IdentityEvent.RoleCreated.class,
              assertDoesNotThrow(
                  () -> Role.create(ROLE_ID, TENANT_ID, "Admin", "admin_role_1", null)));

      assertEquals("admin_role_1", event.code());
    }

    @Test
    void when_code_contains_punctuation_then_creation_is_rejected() {
      assertThrows(
          DomainValidationException.class,
          () -> Role.create(ROLE_ID, TENANT_ID, "Admin", "admin-role", null));
      assertThrows(
          DomainValidationException.class,
          () -> Role.create(ROLE_ID, TENANT_ID, "Admin", "admin.role", null));
    }

    @Test
    void when_name_or_code_is_empty_then_creation_is_rejected() {
      assertThrows(
          DomainValidationException.class,
          () -> Role.create(ROLE_ID, TENANT_ID, "", "admin", null));
      assertThrows(
          DomainValidationException.class,
          () -> Role.create(ROLE_ID, TENANT_ID, "Admin", "", null));
      assertThrows(
          DomainValidationException.class,
          () -> Role.create(ROLE_ID, TENANT_ID, "Admin", null, null));
    }

    @Test
    void when_creation_is_applied_then_role_has_version_one() {
      final var role = createdRole();

      assertEquals(ROLE_ID, role.id());
      assertEquals("Administrator", role.name());
      assertEquals("admin", role.code());
      assertEquals("Full access", role.description());
      assertFalse(role.deleted());
      assertEquals(1L, role.version());
    }
  }

  @Nested
  class Update {
    @Test
    void when_new_name_is_empty_then_update_is_rejected() {
      assertThrows(DomainValidationException.class, () -> createdRole().update("", null));
    }

    @Test
    void when_only_description_is_supplied_then_name_stays_unchanged() {
      final var role = createdRole();
      final var updated = role.apply(role.update(null, "Almost everything"));

      assertEquals("Administrator", updated.name());
      assertEquals("Almost everything", updated.description());
      assertEquals(2L, updated.version());
    }
  }

  @Nested
  class Deletion {
    @Test
    void when_role_is_deleted_then_prior_state_is_retained() {
      final var role = createdRole();
      final var deleted = role.apply(role.delete());

      assertTrue(deleted.deleted());
      assertEquals("Administrator", deleted.name());
      assertEquals("admin", deleted.code());
      assertEquals("Full access", deleted.description());
      assertEquals(2L, deleted.version());
    }
  }

  @Nested
  class Replay {
    @Test
    void when_k_events_are_folded_then_version_is_k() {
      final List<IdentityEvent> events =
          List.of(
              Role.create(ROLE_ID, TENANT_ID, "Admin", "admin", null),
              new IdentityEvent.RoleUpdated(ROLE_ID, "Administrator", null),
              new IdentityEvent.RoleUpdated(ROLE_ID, null, "Full access"),
              new IdentityEvent.RoleDeleted(ROLE_ID));

      for (int k = 0; k <= events.size(); k++) {
        assertEquals(k, Role.fromEvents(events.subList(0, k)).version());
      }

      assertEquals(Role.fromEvents(events), Role.fromEvents(events));
    }

    @Test
    void when_user_event_is_folded_then_only_version_changes() {
      final var role = createdRole();
      final var folded = role.apply(new IdentityEvent.UserDeactivated(UUID.randomUUID(), null));

      assertEquals(2L, folded.version());
      assertEquals(role.name(), folded.name());
    }
  }
}
