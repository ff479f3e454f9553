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

import java.util.UUID;

/**
 * Closed set of facts which can happen to identity aggregates.
 *
 * <p>Events are immutable and carry only the aggregate id and the fields changed. Optional fields
 * are {@code null} when they were not changed; they are left out of the stored payload.
 *
 * <p>Consumers dispatch on {@link #type()} with a {@code switch} over {@link EventType}, which keeps
 * the matching exhaustive at compile time.
 */
public sealed interface IdentityEvent
    permits IdentityEvent.UserRegistered,
        IdentityEvent.UserUpdated,
        IdentityEvent.UserDeactivated,
        IdentityEvent.UserRoleAssigned,
        IdentityEvent.UserRoleRemoved,
        IdentityEvent.RoleCreated,
        IdentityEvent.RoleUpdated,
        IdentityEvent.RoleDeleted {

  /**
   * @return id of the stream this event belongs to
   */
  UUID aggregateId();

  /**
   * @return persistence and dispatch discriminant
   */
  EventType type();

  record UserRegistered(
      UUID userId, UUID tenantId, String username, String email, String passwordHash)
      implements IdentityEvent {
    @Override
    public UUID aggregateId() {
      return userId;
    }

    @Override
    public EventType type() {
      return EventType.USER_REGISTERED;
    }

    @Override
    public String toString() {
      return "UserRegistered[userId=%s, tenantId=%s, username=%s, email=%s]"
          .formatted(userId, tenantId, username, email);
    }
  }

  /**
   * @param userId of the user
   * @param username new username or {@code null} if unchanged
   * @param email new email or {@code null} if unchanged
   */
  record UserUpdated(UUID userId, String username, String email) implements IdentityEvent {
    @Override
    public UUID aggregateId() {
      return userId;
    }

    @Override
    public EventType type() {
      return EventType.USER_UPDATED;
    }
  }

  record UserDeactivated(UUID userId, String reason) implements IdentityEvent {
    @Override
    public UUID aggregateId() {
      return userId;
    }

    @Override
    public EventType type() {
      return EventType.USER_DEACTIVATED;
    }
  }

  record UserRoleAssigned(UUID userId, UUID roleId) implements IdentityEvent {
    @Override
    public UUID aggregateId() {
      return userId;
    }

    @Override
    public EventType type() {
      return EventType.USER_ROLE_ASSIGNED;
    }
  }

  record UserRoleRemoved(UUID userId, UUID roleId) implements IdentityEvent {
    @Override
    public UUID aggregateId() {
      return userId;
    }

    @Override
    public EventType type() {
      return EventType.USER_ROLE_REMOVED;
    }
  }

  /**
   * @param roleId of the role
   * @param tenantId owning the role
   * @param name human-readable name
   * @param code machine-readable code, alphanumeric and underscores
   * @param description optional, may be {@code null}
   */
  record RoleCreated(UUID roleId, UUID tenantId, String name, String code, String description)
      implements IdentityEvent {
    @Override
    public UUID aggregateId() {
      return roleId;
    }

    @Override
    public EventType type() {
      return EventType.ROLE_CREATED;
    }
  }

  record RoleUpdated(UUID roleId, String name, String description) implements IdentityEvent {
    @Override
    public UUID aggregateId() {
      return roleId;
    }

    @Override
    public EventType type() {
      return EventType.ROLE_UPDATED;
    }
  }

  record RoleDeleted(UUID roleId) implements IdentityEvent {
    @Override
    public UUID aggregateId() {
      return roleId;
    }

    @Override
    public EventType type() {
      return EventType.ROLE_DELETED;
    }
  }
}
