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

package io.github.suppierk.identity.domain;

import io.github.suppierk.identity.errors.DomainValidationException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * State of the user aggregate, rebuilt from the user's event stream.
 *
 * @param id of the user, {@code null} before registration was applied
 * @param tenantId owning the user
 * @param username login name
 * @param email contact address
 * @param passwordHash credential hash produced outside of this core
 * @param status lifecycle status
 * @param roleIds ids of the roles currently assigned to the user
 * @param version amount of events applied
 */
public record User(
    UUID id,
    UUID tenantId,
    String username,
    String email,
    String passwordHash,
    UserStatus status,
    Set<UUID> roleIds,
    long version)
    implements Aggregate<User> {
  private static final User EMPTY = new User(null, null, "", "", "", UserStatus.ACTIVE, Set.of(), 0L);

  public User {
    roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
  }

  /**
   * @return the zero value every replay starts from
   */
  public static User empty() {
    return EMPTY;
  }

  /**
   * @param events of a single user, ordered by sequence number
   * @return rebuilt state
   */
  public static User fromEvents(final List<? extends IdentityEvent> events) {
    return Aggregate.fold(EMPTY, events);
  }

  /**
   * Decides whether a new user can be registered.
   *
   * @return {@link IdentityEvent.UserRegistered} for the given id
   * @throws DomainValidationException if username or password hash is empty, or email is malformed
   */
  public static IdentityEvent register(
      final UUID id,
      final UUID tenantId,
      final String username,
      final String email,
      final String passwordHash) {
    if (id == null) {
      throw new IllegalArgumentException("User id cannot be null");
    }

    requireNonEmpty(username, "Username cannot be empty");
    requireEmail(email);
    requireNonEmpty(passwordHash, "Password hash cannot be empty");

    return new IdentityEvent.UserRegistered(id, tenantId, username, email, passwordHash);
  }

  /**
   * Decides whether username and/or email can be changed; {@code null} arguments stay unchanged.
   *
   * @return {@link IdentityEvent.UserUpdated}
   * @throws DomainValidationException if the user is not active or a supplied value is invalid
   */
  public IdentityEvent update(final String newUsername, final String newEmail) {
    requireActive("Cannot update inactive or locked user");

    if (newUsername != null) {
      requireNonEmpty(newUsername, "Username cannot be empty");
    }

    if (newEmail != null) {
      requireEmail(newEmail);
    }

    return new IdentityEvent.UserUpdated(id, newUsername, newEmail);
  }

  /**
   * Decides whether the user can be deactivated. Deactivation cannot be undone.
   *
   * @return {@link IdentityEvent.UserDeactivated}
   * @throws DomainValidationException if the user is not active
   */
  public IdentityEvent deactivate(final String reason) {
    requireActive("User is already inactive or locked");
    return new IdentityEvent.UserDeactivated(id, reason);
  }

  public IdentityEvent assignRole(final UUID roleId) {
    requireActive("Cannot assign roles to inactive or locked user");

    if (roleId == null) {
      throw new DomainValidationException("Role id cannot be empty");
    }

    if (roleIds.contains(roleId)) {
      throw new DomainValidationException("Role '%s' is already assigned".formatted(roleId));
    }

    return new IdentityEvent.UserRoleAssigned(id, roleId);
  }

  public IdentityEvent removeRole(final UUID roleId) {
    if (roleId == null || !roleIds.contains(roleId)) {
      throw new DomainValidationException("Role '%s' is not assigned".formatted(roleId));
    }

    return new IdentityEvent.UserRoleRemoved(id, roleId);
  }

  /** {@inheritDoc} */
  @Override
  public User apply(final IdentityEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    final long nextVersion = version + 1;

    return switch (event.type()) {
      case USER_REGISTERED -> {
        final var registered = (IdentityEvent.UserRegistered) event;
        yield new User(
            registered.userId(),
            registered.tenantId(),
            registered.username(),
            registered.email(),
            registered.passwordHash(),
            UserStatus.ACTIVE,
            roleIds,
            nextVersion);
      }
      case USER_UPDATED -> {
        final var updated = (IdentityEvent.UserUpdated) event;
        yield new User(
            id,
            tenantId,
            updated.username() != null ? updated.username() : username,
            updated.email() != null ? updated.email() : email,
            passwordHash,
            status,
            roleIds,
            nextVersion);
      }
      case USER_DEACTIVATED ->
          new User(
              id, tenantId, username, email, passwordHash, UserStatus.INACTIVE, roleIds, nextVersion);
      case USER_ROLE_ASSIGNED -> {
        final Set<UUID> assigned = new HashSet<>(roleIds);
        assigned.add(((IdentityEvent.UserRoleAssigned) event).roleId());
        yield new User(id, tenantId, username, email, passwordHash, status, assigned, nextVersion);
      }
      case USER_ROLE_REMOVED -> {
        final Set<UUID> remaining = new HashSet<>(roleIds);
        remaining.remove(((IdentityEvent.UserRoleRemoved) event).roleId());
        yield new User(id, tenantId, username, email, passwordHash, status, remaining, nextVersion);
      }
      case ROLE_CREATED, ROLE_UPDATED, ROLE_DELETED -> withVersion(nextVersion);
    };
  }

  @Override
  public String toString() {
    return "User[id=%s, tenantId=%s, username=%s, email=%s, status=%s, roleIds=%s, version=%d]"
        .formatted(id, tenantId, username, email, status, roleIds, version);
  }

  private User withVersion(final long newVersion) {
    return new User(id, tenantId, username, email, passwordHash, status, roleIds, newVersion);
  }

  private void requireActive(final String message) {
    if (status != UserStatus.ACTIVE) {
      throw new DomainValidationException(message);
    }
  }

  private static void requireNonEmpty(final String value, final String message) {
    if (value == null || value.isEmpty()) {
      throw new DomainValidationException(message);
    }
  }

  private static void requireEmail(final String email) {
    if (email == null || email.isEmpty() || !email.contains("@")) {
      throw new DomainValidationException("Invalid email format");
    }
  }
}
