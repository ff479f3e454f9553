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

import io.github.suppierk.identity.cqrs.DomainCommandHandler;
import io.github.suppierk.identity.domain.IdentityEvent;
import io.github.suppierk.identity.domain.Role;
import io.github.suppierk.identity.domain.command.IdentityCommand.CreateRole;
import io.github.suppierk.identity.domain.command.IdentityCommand.DeleteRole;
import io.github.suppierk.identity.domain.command.IdentityCommand.UpdateRole;
import io.github.suppierk.identity.errors.AggregateNotFoundException;
import java.util.List;
import java.util.UUID;

final class RoleCommandHandlers {
  private RoleCommandHandlers() {
    // No instance
  }

  static List<DomainCommandHandler<?, ?>> all() {
    return List.of(new CreateRoleHandler(), new UpdateRoleHandler(), new DeleteRoleHandler());
  }

  static Role requireRole(final Role state, final UUID aggregateId) {
    if (state.id() == null) {
      throw new AggregateNotFoundException(aggregateId, "role");
    }

    return state;
  }

  static final class CreateRoleHandler extends DomainCommandHandler.Create<CreateRole> {
    CreateRoleHandler() {
      super(CreateRole.class);
    }

    @Override
    protected IdentityEvent decide(final CreateRole command, final UUID aggregateId) {
      return Role.create(
          aggregateId, command.tenantId(), command.name(), command.code(), command.description());
    }
  }

  static final class UpdateRoleHandler extends DomainCommandHandler.Update<UpdateRole, Role> {
    UpdateRoleHandler() {
      super(UpdateRole.class, Role.empty());
    }

    @Override
    protected IdentityEvent decide(final UpdateRole command, final Role state) {
      return requireRole(state, command.roleId()).update(command.name(), command.description());
    }
  }

  static final class DeleteRoleHandler extends DomainCommandHandler.Delete<DeleteRole, Role> {
    DeleteRoleHandler() {
      super(DeleteRole.class, Role.empty());
    }

    @Override
    protected IdentityEvent decide(final DeleteRole command, final Role state) {
      return requireRole(state, command.roleId()).delete();
    }
  }
}
