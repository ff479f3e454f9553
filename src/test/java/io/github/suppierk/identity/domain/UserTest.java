package io.github.suppierk.identity.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.identity.errors.DomainValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UserTest {
  static final UUID USER_ID = UUID.randomUUID();
  static final UUID TENANT_ID = UUID.randomUUID();

  static IdentityEvent registered() {
    return User.register(USER_ID, TENANT_ID, "alice", "alice@example.com", "hash");
  }

  static User activeUser() {
    return User.fromEvents(List.of(registered()));
  }

  @Nested
  class Registration {
    @Test
    void when_input_is_valid_then_registered_event_is_produced() {
      final var event = assertInstanceOf(IdentityEvent.UserRegistered.class, registered());

      assertEquals(USER_ID, event.userId());
      assertEquals(TENANT_ID, event.tenantId());
      assertEquals("alice", event.username());
      assertEquals("alice@example.com", event.email());
      assertEquals("hash", event.passwordHash());
    }

    @Test
    void when_username_is_empty_then_registration_is_rejected() {
      assertThrows(
          DomainValidationException.class,
          () -> User.register(USER_ID, TENANT_ID, "", "alice@example.com", "hash"));
      assertThrows(
          DomainValidationException.class,
          () -> User.register(USER_ID, TENANT_ID, null, "alice@example.com", "hash"));
    }

    @Test
    void when_email_lacks_at_sign_then_registration_is_rejected() {
      assertThrows(
          DomainValidationException.class,
          () -> User.register(USER_ID, TENANT_ID, "alice", "alice.example.com", "hash"));
      assertThrows(
          DomainValidationException.class,
          () -> User.register(USER_ID, TENANT_ID, "alice", "", "hash"));
    }

    @Test
    void when_password_hash_is_empty_then_registration_is_rejected() {
      assertThrows(
          DomainValidationException.class,
          () -> User.register(USER_ID, TENANT_ID, "alice", "alice@example.com", ""));
    }

    @Test
    void when_id_is_null_then_illegal_argument_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () -> User.register(null, TENANT_ID, "alice", "alice@example.com", "hash"));
    }

    @Test
    void when_registration_is_applied_then_user_is_active_with_version_one() {
      final var user = activeUser();

      assertEquals(USER_ID, user.id());
      assertEquals(UserStatus.ACTIVE, user.status());
      assertEquals(1L, user.version());
      assertTrue(user.roleIds().isEmpty());
    }

    @Test
    void when_user_is_printed_then_password_hash_is_hidden() {
      assertFalse(activeUser().toString().contains("hash"));
      assertFalse(registered().toString().contains("hash"));
    }
  }

  @Nested
  class StatusGuard {
    @Test
    void when_active_user_is_deactivated_then_it_becomes_inactive() {
      final var user = activeUser();
      final var event = user.deactivate("left the company");
      final var deactivated = user.apply(event);

      assertEquals(UserStatus.INACTIVE, deactivated.status());
      assertEquals(2L, deactivated.version());
      assertEquals(UserStatus.ACTIVE, user.status());
    }

    @Test
    void when_inactive_user_is_updated_or_deactivated_then_domain_error_is_thrown() {
      final var user = activeUser();
      final var inactive = user.apply(user.deactivate("reason"));

      assertThrows(DomainValidationException.class, () -> inactive.update("bob", null));
      assertThrows(DomainValidationException.class, () -> inactive.deactivate("again"));
      assertThrows(
          DomainValidationException.class, () -> inactive.assignRole(UUID.randomUUID()));
    }

    @Test
    void when_locked_user_is_updated_then_domain_error_is_thrown() {
      final var locked =
          new User(
              USER_ID, TENANT_ID, "alice", "a@b", "hash", UserStatus.LOCKED, Set.of(), 3L);

      assertThrows(DomainValidationException.class, () -> locked.update("bob", null));
      assertThrows(DomainValidationException.class, () -> locked.deactivate("reason"));
    }
  }

  @Nested
  class Update {
    @Test
    void when_only_username_is_supplied_then_email_stays_unchanged() {
      final var user = activeUser();
      final var updated = user.apply(user.update("bob", null));

      assertEquals("bob", updated.username());
      assertEquals("alice@example.com", updated.email());
      assertEquals(2L, updated.version());
    }

    @Test
    void when_supplied_values_are_invalid_then_update_is_rejected() {
      final var user = activeUser();

      assertThrows(DomainValidationException.class, () -> user.update("", null));
      assertThrows(DomainValidationException.class, () -> user.update(null, "no-at-sign"));
    }

    @Test
    void when_nothing_is_supplied_then_event_carries_no_changes() {
      final var event =
          assertInstanceOf(IdentityEvent.UserUpdated.class, activeUser().update(null, null));

      assertNull(event.username());
      assertNull(event.email());
    }
  }

  @Nested
  class Roles {
    @Test
    void when_role_is_assigned_then_it_can_be_removed() {
      final var roleId = UUID.randomUUID();
      final var user = activeUser();
      final var withRole = user.apply(user.assignRole(roleId));

      assertEquals(Set.of(roleId), withRole.roleIds());
      assertThrows(DomainValidationException.class, () -> withRole.assignRole(roleId));

      final var withoutRole = withRole.apply(withRole.removeRole(roleId));
      assertTrue(withoutRole.roleIds().isEmpty());
      assertEquals(3L, withoutRole.version());
    }

    @Test
    void when_role_is_not_assigned_then_removal_is_rejected() {
      final var user = activeUser();

      assertThrows(DomainValidationException.class, () -> user.removeRole(UUID.randomUUID()));
      assertThrows(DomainValidationException.class, () -> user.removeRole(null));
      assertThrows(DomainValidationException.class, () -> user.assignRole(null));
    }
  }

  @Nested
  class Replay {
    @Test
    void when_events_are_folded_at_once_or_one_by_one_then_state_is_the_same() {
      final var roleId = UUID.randomUUID();
      final List<IdentityEvent> events =
          List.of(
              registered(),
              new IdentityEvent.UserUpdated(USER_ID, "bob", null),
              new IdentityEvent.UserRoleAssigned(USER_ID, roleId),
              new IdentityEvent.UserUpdated(USER_ID, null, "bob@example.com"),
              new IdentityEvent.UserDeactivated(USER_ID, "reason"));

      var stepByStep = User.empty();
      final List<IdentityEvent> prefix = new ArrayList<>();
      for (IdentityEvent event : events) {
        stepByStep = stepByStep.apply(event);
        prefix.add(event);
        assertEquals(User.fromEvents(prefix), stepByStep);
        assertEquals(prefix.size(), stepByStep.version());
      }

      assertEquals(User.fromEvents(events), User.fromEvents(events));
      assertEquals("bob", stepByStep.username());
      assertEquals("bob@example.com", stepByStep.email());
      assertEquals(UserStatus.INACTIVE, stepByStep.status());
    }

    @Test
    void when_no_events_are_folded_then_zero_value_is_returned() {
      final var user = User.fromEvents(List.of());

      assertEquals(User.empty(), user);
      assertEquals(0L, user.version());
      assertNull(user.id());
      assertEquals(UserStatus.ACTIVE, user.status());
    }

    @Test
    void when_role_event_is_folded_then_only_version_changes() {
      final var user = activeUser();
      final var folded =
          user.apply(new IdentityEvent.RoleDeleted(UUID.randomUUID()));

      assertEquals(2L, folded.version());
      assertEquals(user.username(), folded.username());
      assertEquals(user.status(), folded.status());
    }

    @Test
    void when_null_is_folded_then_illegal_argument_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> User.empty().apply(null));
      assertThrows(IllegalArgumentException.class, () -> User.fromEvents(null));
    }
  }
}
