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

package io.github.suppierk.identity.cqrs;

import io.github.suppierk.identity.domain.Aggregate;
import io.github.suppierk.identity.errors.AggregateNotFoundException;
import io.github.suppierk.identity.es.EventCodec;
import io.github.suppierk.identity.es.EventStore;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Defines a collection of the {@link DomainCommandHandler}s sharing one {@link EventStore}.
 *
 * <p>Every {@link DomainCommand} class is served by exactly one handler. The context holds no
 * aggregate state between calls: each command rebuilds the state it needs from the store, so
 * commands for different aggregates never interfere with each other and commands for the same
 * aggregate are ordered by the optimistic check of the store.
 */
public abstract non-sealed class BoundedContext extends Suspicious {
  private static final Logger LOG = LoggerFactory.getLogger(BoundedContext.class);

  private final EventStore eventStore;
  private final EventCodec eventCodec;
  private final ConcurrentMap<Class<?>, DomainCommandHandler<?, ?>> domainCommandHandlers;

  /**
   * @param eventStore to read and append events with
   * @param eventCodec to decode stored events with
   * @throws IllegalArgumentException if any of the arguments is null
   */
  protected BoundedContext(final EventStore eventStore, final EventCodec eventCodec) {
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.eventCodec = throwIllegalArgumentIfNull(eventCodec, "Event codec");
    this.domainCommandHandlers = new ConcurrentHashMap<>();
  }

  /**
   * @param handler to serve its {@link DomainCommandHandler#getCommandClass()}
   * @throws IllegalArgumentException if the handler is null
   * @throws IllegalStateException if the command class is already served by another handler
   */
  public final void addDomainCommandHandler(final DomainCommandHandler<?, ?> handler) {
    final DomainCommandHandler<?, ?> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Command handler");
    final Class<?> commandClass = nonNullHandler.getCommandClass();

    final DomainCommandHandler<?, ?> existing =
        domainCommandHandlers.putIfAbsent(commandClass, nonNullHandler);
    if (existing != null) {
      throw new IllegalStateException(
          "Command '%s' is already handled by '%s'"
              .formatted(commandClass.getSimpleName(), existing.getClass().getSimpleName()));
    }

    LOG.debug(
        "Registered '{}' for command '{}'",
        nonNullHandler.getClass().getSimpleName(),
        commandClass.getSimpleName());
  }

  /**
   * @return unmodifiable snapshot of the command classes this context can serve
   */
  public final Set<Class<?>> getSupportedDomainCommandClasses() {
    return Set.copyOf(domainCommandHandlers.keySet());
  }

  /**
   * @param command to create a new aggregate with
   * @param <CREATE> is the type of the command
   * @return id of the new aggregate
   * @throws IllegalArgumentException if the command is null
   * @throws UnsupportedOperationException if no creation handler serves the command
   */
  @SuppressWarnings({"unchecked", "squid:S119"})
  public final <CREATE extends DomainCommand.Create<?, ?>> UUID createModel(final CREATE command) {
    final DomainCommandHandler<?, ?> handler = findHandler(command);
    if (!(handler instanceof DomainCommandHandler.Create)) {
      throw new UnsupportedOperationException(
          "'%s' is not a creation handler".formatted(handler.getClass().getSimpleName()));
    }

    return ((DomainCommandHandler.Create<CREATE>) handler)
        .runInContext(command, eventStore, eventCodec);
  }

  /**
   * @param command to change an existing aggregate with
   * @param <UPDATE> is the type of the command
   * @return version of the aggregate after the change
   * @throws IllegalArgumentException if the command is null
   * @throws UnsupportedOperationException if no update handler serves the command
   */
  @SuppressWarnings({"unchecked", "squid:S119"})
  public final <UPDATE extends DomainCommand.Update<?, ?>> long updateModel(final UPDATE command) {
    final DomainCommandHandler<?, ?> handler = findHandler(command);
    if (!(handler instanceof DomainCommandHandler.Update)) {
      throw new UnsupportedOperationException(
          "'%s' is not an update handler".formatted(handler.getClass().getSimpleName()));
    }

    return ((DomainCommandHandler.Update<UPDATE, ?>) handler)
        .runInContext(command, eventStore, eventCodec);
  }

  /**
   * @param command to delete an existing aggregate with
   * @param <DELETE> is the type of the command
   * @return version of the aggregate after the deletion
   * @throws IllegalArgumentException if the command is null
   * @throws UnsupportedOperationException if no deletion handler serves the command
   */
  @SuppressWarnings({"unchecked", "squid:S119"})
  public final <DELETE extends DomainCommand.Delete<?, ?>> long deleteModel(final DELETE command) {
    final DomainCommandHandler<?, ?> handler = findHandler(command);
    if (!(handler instanceof DomainCommandHandler.Delete)) {
      throw new UnsupportedOperationException(
          "'%s' is not a deletion handler".formatted(handler.getClass().getSimpleName()));
    }

    return ((DomainCommandHandler.Delete<DELETE, ?>) handler)
        .runInContext(command, eventStore, eventCodec);
  }

  /**
   * Rebuilds the current state of an aggregate from its stream.
   *
   * @param aggregateId of the stream
   * @param initialState zero value of the aggregate
   * @param <STATE> is the aggregate type
   * @return state after all stored events
   * @throws AggregateNotFoundException if the stream is empty
   */
  @SuppressWarnings("squid:S119")
  public final <STATE extends Aggregate<STATE>> STATE loadModel(
      final UUID aggregateId, final STATE initialState) {
    final UUID nonNullAggregateId = throwIllegalArgumentIfNull(aggregateId, "Aggregate id");
    final STATE nonNullInitialState = throwIllegalArgumentIfNull(initialState, "Initial state");

    return Aggregate.fold(
        nonNullInitialState, eventCodec.decodeAll(eventStore.load(nonNullAggregateId)));
  }

  private DomainCommandHandler<?, ?> findHandler(final DomainCommand<?, ?> command) {
    final DomainCommand<?, ?> nonNullCommand = throwIllegalArgumentIfNull(command, "Command");

    return throwUnsupportedOperationIfNull(
        domainCommandHandlers.get(nonNullCommand.getClass()),
        "Handler for command '%s'".formatted(nonNullCommand.getClass().getSimpleName()));
  }
}
