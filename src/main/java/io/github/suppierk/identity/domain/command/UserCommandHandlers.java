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
import io.github.suppierk.identity.domain.User;
import io.github.suppierk.identity.domain.command.IdentityCommand.AssignUserRole;
import io.github.suppierk.identity.domain.command.IdentityCommand.DeactivateUser;
import io.github.suppierk.identity.domain.command.IdentityCommand.RegisterUser;
import io.github.suppierk.identity.domain.command.IdentityCommand.RemoveUserRole;
import io.github.suppierk.identity.domain.command.IdentityCommand.UpdateUser;
import io.github.suppierk.identity.errors.AggregateNotFoundException;
import java.util.List;
import java.util.UUID;

/** Handlers of the commands targeting the user stream. */
final class UserCommandHandlers {
  private UserCommandHandlers() {
    // No instance
  }

  static List<DomainCommandHandler<?, ?>> all() {
    return List.of(
        new RegisterUserHandler(),
        new UpdateUserHandler(),
        new DeactivateUserHandler(),
        new AssignUserRoleHandler(),
        new RemoveUserRoleHandler());
  }

  /** A role stream folded into {@link User} leaves the user id unset. */
  static User requireUser(final User state, final UUID aggregateId) {
    if (state.id() == null) {
      throw new AggregateNotFoundException(aggregateId, "user");
    }

    return state;
  }

  static final class RegisterUserHandler extends DomainCommandHandler.Create<RegisterUser> {
    RegisterUserHandler() {
      super(RegisterUser.class);
    }

    @Override
    protected IdentityEvent decide(final RegisterUser command, final UUID aggregateId) {
      return User.register(
          aggregateId,
          command.tenantId(),
          command.username(),
          command.email(),
          command.passwordHash());
    }
  }

  static final class UpdateUserHandler extends DomainCommandHandler.Update<UpdateUser, User> {
    UpdateUserHandler() {
      super(UpdateUser.class, User.empty());
    }

    @Override
    protected IdentityEvent decide(final UpdateUser command, final User state) {
      return requireUser(state, command.userId()).update(command.username(), command.email());
    }
  }

  static final class DeactivateUserHandler
      extends DomainCommandHandler.Update<DeactivateUser, User> {
    DeactivateUserHandler() {
      super(DeactivateUser.class, User.empty());
    }

    @Override
    protected IdentityEvent decide(final DeactivateUser command, final User state) {
      return requireUser(state, command.userId()).deactivate(command.reason());
    }
  }

  static final class AssignUserRoleHandler
      extends DomainCommandHandler.Update<AssignUserRole, User> {
    AssignUserRoleHandler() {
      super(AssignUserRole.class, User.empty());
    }

    @Override
    protected IdentityEvent decide(final AssignUserRole command, final User state) {
      return requireUser(state, command.userId()).assignRole(command.roleId());
    }
  }

  static final class RemoveUserRoleHandler
      extends DomainCommandHandler.Update<RemoveUserRole, User> {
    RemoveUserRoleHandler() {
      super(RemoveUserRole.class, User.empty());
    }

    @Override
    protected IdentityEvent decide(final RemoveUserRole command, final User state) {
      return requireUser(state, command.userId()).removeRole(command.roleId());
    }
  }
}
