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
import java.util.List;
import java.util.UUID;

/**
 * State of the role aggregate, rebuilt from the role's event stream.
 *
 * <p>Deleting a role only marks it as deleted: its name, code and description stay available for
 * audit purposes.
 *
 * @param id of the role, {@code null} before creation was applied
 * @param tenantId owning the role
 * @param name human-readable name
 * @param code machine-readable code
 * @param description optional description, may be {@code null}
 * @param deleted whether a deletion was recorded
 * @param version amount of events applied
 */
public record Role(
    UUID id,
    UUID tenantId,
    String name,
    String code,
    String description,
    boolean deleted,
    long version)
    implements Aggregate<Role> {
  private static final Role EMPTY = new Role(null, null, "", "", null, false, 0L);

  public static Role empty() {
    return EMPTY;
  }

  public static Role fromEvents(final List<? extends IdentityEvent> events) {
    return Aggregate.fold(EMPTY, events);
  }

  /**
   * Decides whether a new role can be created.
   *
   * @return {@link IdentityEvent.RoleCreated} for the given id
   * @throws DomainValidationException if the name is empty or the code is empty or contains
   *     anything but letters, digits and underscores
   */
  public static IdentityEvent create(
      final UUID id,
      final UUID tenantId,
      final String name,
      final String code,
      final String description) {
    if (id == null) {
      throw new IllegalArgumentException("Role id cannot be null");
    }

    if (name == null || name.isEmpty()) {
      throw new DomainValidationException("Role name cannot be empty");
    }

    if (code == null || code.isEmpty()) {
      throw new DomainValidationException("Role code cannot be empty");
    }

    if (!isValidCode(code)) {
      throw new DomainValidationException(
          "Role code can only contain alphanumeric characters and underscores");
    }

    return new IdentityEvent.RoleCreated(id, tenantId, name, code, description);
  }

  /**
   * @param newName replacement name or {@code null} to keep the current one
   * @param newDescription replacement description or {@code null} to keep the current one
   * @return {@link IdentityEvent.RoleUpdated}
   * @throws DomainValidationException if the supplied name is empty
   */
  public IdentityEvent update(final String newName, final String newDescription) {
    if (newName != null && newName.isEmpty()) {
      throw new DomainValidationException("Role name cannot be empty");
    }

    return new IdentityEvent.RoleUpdated(id, newName, newDescription);
  }

  public IdentityEvent delete() {
    return new IdentityEvent.RoleDeleted(id);
  }

  /** {@inheritDoc} */
  @Override
  public Role apply(final IdentityEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    final long nextVersion = version + 1;

    return switch (event.type()) {
      case ROLE_CREATED -> {
        final var created = (IdentityEvent.RoleCreated) event;
        yield new Role(
            created.roleId(),
            created.tenantId(),
            created.name(),
            created.code(),
            created.description(),
            false,
            nextVersion);
      }
      case ROLE_UPDATED -> {
        final var updated = (IdentityEvent.RoleUpdated) event;
        yield new Role(
            id,
            tenantId,
            updated.name() != null ? updated.name() : name,
            code,
            updated.description() != null ? updated.description() : description,
            deleted,
            nextVersion);
      }
      case ROLE_DELETED -> new Role(id, tenantId, name, code, description, true, nextVersion);
      case USER_REGISTERED,
          USER_UPDATED,
          USER_DEACTIVATED,
          USER_ROLE_ASSIGNED,
          USER_ROLE_REMOVED ->
          new Role(id, tenantId, name, code, description, deleted, nextVersion);
    };
  }

  private static boolean isValidCode(final String code) {
    for (int i = 0; i < code.length(); ) {
      final int codePoint = code.codePointAt(i);
      if (codePoint != '_' && !Character.isLetterOrDigit(codePoint)) {
        return false;
      }
      i += Character.charCount(codePoint);
    }
    return true;
  }
}
