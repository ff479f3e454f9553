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

import io.github.suppierk.identity.cqrs.BoundedContext;
import io.github.suppierk.identity.domain.Role;
import io.github.suppierk.identity.domain.User;
import io.github.suppierk.identity.domain.command.IdentityCommand.AssignUserRole;
import io.github.suppierk.identity.domain.command.IdentityCommand.CreateRole;
import io.github.suppierk.identity.domain.command.IdentityCommand.DeactivateUser;
import io.github.suppierk.identity.domain.command.IdentityCommand.DeleteRole;
import io.github.suppierk.identity.domain.command.IdentityCommand.RegisterUser;
import io.github.suppierk.identity.domain.command.IdentityCommand.RemoveUserRole;
import io.github.suppierk.identity.domain.command.IdentityCommand.UpdateRole;
import io.github.suppierk.identity.domain.command.IdentityCommand.UpdateUser;
import io.github.suppierk.identity.errors.AggregateNotFoundException;
import io.github.suppierk.identity.errors.ConcurrencyConflictException;
import io.github.suppierk.identity.errors.DomainValidationException;
import io.github.suppierk.identity.es.EventCodec;
import io.github.suppierk.identity.es.EventStore;
import java.util.UUID;

/**
 * Command service of the identity core: one operation per {@link IdentityCommand}.
 *
 * <p>Every operation either appends exactly one event or none. Failures are reported as:
 *
 * <ul>
 *   <li>{@link DomainValidationException} when the aggregate rejects the command.
 *   <li>{@link AggregateNotFoundException} when the target stream does not exist.
 *   <li>{@link ConcurrencyConflictException} when another writer appended to the same stream between
 *       the load and the append. The command is not retried.
 * </ul>
 *
 * <p>Instances are thread-safe as long as the underlying {@link EventStore} is.
 */
public final class IdentityAccessContext extends BoundedContext {
  public IdentityAccessContext(final EventStore eventStore) {
    this(eventStore, new EventCodec());
  }

  public IdentityAccessContext(final EventStore eventStore, final EventCodec eventCodec) {
    super(eventStore, eventCodec);
    UserCommandHandlers.all().forEach(this::addDomainCommandHandler);
    RoleCommandHandlers.all().forEach(this::addDomainCommandHandler);
  }

  /**
   * @return id of the new user
   */
  public UUID registerUser(final RegisterUser command) {
    return createModel(command);
  }

  /**
   * @return version of the user stream after the update
   */
  public long updateUser(final UpdateUser command) {
    return updateModel(command);
  }

  public long deactivateUser(final DeactivateUser command) {
    return updateModel(command);
  }

  public long assignUserRole(final AssignUserRole command) {
    return updateModel(command);
  }

  public long removeUserRole(final RemoveUserRole command) {
    return updateModel(command);
  }

  /**
   * @return id of the new role
   */
  public UUID createRole(final CreateRole command) {
    return createModel(command);
  }

  public long updateRole(final UpdateRole command) {
    return updateModel(command);
  }

  public long deleteRole(final DeleteRole command) {
    return deleteModel(command);
  }

  /**
   * @param userId of the stream
   * @return user rebuilt from all stored events
   * @throws AggregateNotFoundException if there is no user with this id
   */
  public User loadUser(final UUID userId) {
    return UserCommandHandlers.requireUser(loadModel(userId, User.empty()), userId);
  }

  /**
   * @param roleId of the stream
   * @return role rebuilt from all stored events, deleted roles included
   * @throws AggregateNotFoundException if there is no role with this id
   */
  public Role loadRole(final UUID roleId) {
    return RoleCommandHandlers.requireRole(loadModel(roleId, Role.empty()), roleId);
  }
}
