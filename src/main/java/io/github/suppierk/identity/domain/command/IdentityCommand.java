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

package io.github.suppierk.identity.domain.command;

import io.github.suppierk.identity.cqrs.DomainCommand;
import java.io.Serial;
import java.time.Instant;
import java.util.UUID;

/**
 * Closed set of commands accepted by {@link IdentityAccessContext}.
 *
 * <p>Optional fields of update commands are {@code null} when the value must stay unchanged.
 */
public sealed interface IdentityCommand
    permits IdentityCommand.RegisterUser,
        IdentityCommand.UpdateUser,
        IdentityCommand.DeactivateUser,
        IdentityCommand.AssignUserRole,
        IdentityCommand.RemoveUserRole,
        IdentityCommand.CreateRole,
        IdentityCommand.UpdateRole,
        IdentityCommand.DeleteRole {

  record RegisterUser(
      UUID messageId,
      Instant createdAt,
      UUID tenantId,
      String username,
      String email,
      String passwordHash)
      implements IdentityCommand, DomainCommand.Create<UUID, Instant> {
    @Serial private static final long serialVersionUID = -2214769404731095146L;

    public RegisterUser(
        final UUID tenantId, final String username, final String email, final String passwordHash) {
      this(UUID.randomUUID(), Instant.now(), tenantId, username, email, passwordHash);
    }

    @Override
    public String toString() {
      return "RegisterUser[messageId=%s, createdAt=%s, tenantId=%s, username=%s, email=%s]"
          .formatted(messageId, createdAt, tenantId, username, email);
    }
  }

  record UpdateUser(UUID messageId, Instant createdAt, UUID userId, String username, String email)
      implements IdentityCommand, DomainCommand.Update<UUID, Instant> {
    @Serial private static final long serialVersionUID = 4420851907314880021L;

    public UpdateUser(final UUID userId, final String username, final String email) {
      this(UUID.randomUUID(), Instant.now(), userId, username, email);
    }

    @Override
    public UUID aggregateId() {
      return userId;
    }
  }

  record DeactivateUser(UUID messageId, Instant createdAt, UUID userId, String reason)
      implements IdentityCommand, DomainCommand.Update<UUID, Instant> {
    @Serial private static final long serialVersionUID = 7051216395573264807L;

    public DeactivateUser(final UUID userId, final String reason) {
      this(UUID.randomUUID(), Instant.now(), userId, reason);
    }

    @Override
    public UUID aggregateId() {
      return userId;
    }
  }

  record AssignUserRole(UUID messageId, Instant createdAt, UUID userId, UUID roleId)
      implements IdentityCommand, DomainCommand.Update<UUID, Instant> {
    @Serial private static final long serialVersionUID = -6154337061385426923L;

    public AssignUserRole(final UUID userId, final UUID roleId) {
      this(UUID.randomUUID(), Instant.now(), userId, roleId);
    }

    @Override
    public UUID aggregateId() {
      return userId;
    }
  }

  record RemoveUserRole(UUID messageId, Instant createdAt, UUID userId, UUID roleId)
      implements IdentityCommand, DomainCommand.Update<UUID, Instant> {
    @Serial private static final long serialVersionUID = 2987745212070369915L;

    public RemoveUserRole(final UUID userId, final UUID roleId) {
      this(UUID.randomUUID(), Instant.now(), userId, roleId);
    }

    @Override
    public UUID aggregateId() {
      return userId;
    }
  }

  record CreateRole(
      UUID messageId,
      Instant createdAt,
      UUID tenantId,
      String name,
      String code,
      String description)
      implements IdentityCommand, DomainCommand.Create<UUID, Instant> {
    @Serial private static final long serialVersionUID = 1370655914520781410L;

    public CreateRole(
        final UUID tenantId, final String name, final String code, final String description) {
      this(UUID.randomUUID(), Instant.now(), tenantId, name, code, description);
    }
  }

  record UpdateRole(UUID messageId, Instant createdAt, UUID roleId, String name, String description)
      implements IdentityCommand, DomainCommand.Update<UUID, Instant> {
    @Serial private static final long serialVersionUID = -830244935905522868L;

    public UpdateRole(final UUID roleId, final String name, final String description) {
      this(UUID.randomUUID(), Instant.now(), roleId, name, description);
    }

    @Override
    public UUID aggregateId() {
      return roleId;
    }
  }

  record DeleteRole(UUID messageId, Instant createdAt, UUID roleId)
      implements IdentityCommand, DomainCommand.Delete<UUID, Instant> {
    @Serial private static final long serialVersionUID = 5523690061477913046L;

    public DeleteRole(final UUID roleId) {
      this(UUID.randomUUID(), Instant.now(), roleId);
    }

    @Override
    public UUID aggregateId() {
      return roleId;
    }
  }
}
