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
import io.github.suppierk.identity.domain.IdentityEvent;
import io.github.suppierk.identity.errors.ConcurrencyConflictException;
import io.github.suppierk.identity.errors.DomainValidationException;
import io.github.suppierk.identity.es.EventCodec;
import io.github.suppierk.identity.es.EventStore;
import io.github.suppierk.identity.es.StoredEvent;
import io.github.suppierk.java.Try;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to accept and process the work associated to a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li>Load the event history of the target aggregate (skipped for {@link DomainCommand.Create}).
 *   <li>Fold the history into the current {@link Aggregate} state.
 *   <li>Let the aggregate decide which single {@link IdentityEvent} the command produces.
 *   <li>Append that event with the version observed before the decision was made.
 * </ul>
 *
 * <p>No lock is held across these steps: a concurrent writer of the same stream is detected by the
 * {@link EventStore} and reported as {@link ConcurrencyConflictException}, which is never retried
 * here. A rejected decision never reaches the {@link EventStore}.
 *
 * <p>Because {@link DomainCommand} leverages new Java {@code sealed} feature, for more type safety
 * this class also makes use of the same feature.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @param <OUTPUT> the output of the command: new aggregate id for creations, version of the stream
 *     after the command otherwise
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainCommandHandler<
  COMMAND extends DomainCommand<?, ?>,
  OUTPUT
>
extends
        Suspicious
permits
  DomainCommandHandler.Create,
  DomainCommandHandler.Update,
  DomainCommandHandler.Delete
{
// @formatter:on
  private static final Logger LOG = LoggerFactory.getLogger(DomainCommandHandler.class);

  private static final String DECIDED_EVENT = "Decided event";

  private final Class<COMMAND> commandClass;

  /**
   * Constructs a new {@link DomainCommandHandler} for a specific {@link DomainCommand} class.
   *
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
  }

  /**
   * Returns the class type of the command being handled by this {@link DomainCommandHandler}.
   *
   * @return the class type of the command
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  /**
   * Executes the core logic of the command.
   *
   * @param command being executed
   * @param eventStore to read and append events with
   * @param eventCodec to decode stored events with
   * @return the result of the command execution
   */
  protected abstract OUTPUT internalRunContract(
      final COMMAND command, final EventStore eventStore, final EventCodec eventCodec);

  /**
   * Executes the given command against the given store.
   *
   * <p>The usage of {@link Try} will "hide" the exception that can be thrown by {@link
   * #internalRunContract(DomainCommand, EventStore, EventCodec)} - but not get rid of it. Actual
   * exception along with its stacktrace is rethrown once the outcome was logged.
   *
   * @param command to be executed
   * @param eventStore to read and append events with
   * @param eventCodec to decode stored events with
   * @return the result of the command execution
   * @throws IllegalArgumentException if the command is null
   * @throws IllegalStateException if any internal state is invalid (typically null)
   */
  final OUTPUT runInContext(
      final COMMAND command, final EventStore eventStore, final EventCodec eventCodec) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final EventStore nonNullEventStore = throwIllegalStateIfNull(eventStore, "Event store");
    final EventCodec nonNullEventCodec = throwIllegalStateIfNull(eventCodec, "Event codec");

    final Try<OUTPUT> output =
        Try.of(
            () ->
                throwIllegalStateIfNull(
                    internalRunContract(nonNullCommand, nonNullEventStore, nonNullEventCodec),
                    "Command handler result"));

    output.ifSuccess(
        result ->
            LOG.debug(
                "{} '{}' succeeded with {}",
                commandClass.getSimpleName(),
                nonNullCommand.messageId(),
                result));

    output.ifFailure(reason -> logFailure(nonNullCommand, reason));

    return output.get();
  }

  /**
   * Shared flow of the commands targeting an existing stream.
   *
   * @param aggregateId of the stream
   * @param initialState zero value of the aggregate
   * @param decision of the aggregate, taken on the rebuilt state
   * @param eventStore to read and append events with
   * @param eventCodec to decode stored events with
   * @param <STATE> the aggregate type
   * @return version of the stream after the append
   */
  final <STATE extends Aggregate<STATE>> long loadDecideAppend(
      final UUID aggregateId,
      final STATE initialState,
      final Function<STATE, IdentityEvent> decision,
      final EventStore eventStore,
      final EventCodec eventCodec) {
    final List<StoredEvent> history = eventStore.load(aggregateId);
    final STATE state = Aggregate.fold(initialState, eventCodec.decodeAll(history));
    final long observedVersion = state.version();

    final IdentityEvent event = throwIllegalStateIfNull(decision.apply(state), DECIDED_EVENT);
    eventStore.append(aggregateId, List.of(event), observedVersion);

    return observedVersion + 1;
  }

  private void logFailure(final COMMAND command, final Throwable reason) {
    if (reason instanceof DomainValidationException) {
      LOG.debug(
          "{} '{}' rejected: {}",
          commandClass.getSimpleName(),
          command.messageId(),
          reason.getMessage());
    } else if (reason instanceof ConcurrencyConflictException) {
      LOG.info(
          "{} '{}' lost a concurrent write: {}",
          commandClass.getSimpleName(),
          command.messageId(),
          reason.getMessage());
    } else {
      LOG.warn("{} '{}' failed", commandClass.getSimpleName(), command.messageId(), reason);
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Create}.
   *
   * <p>A new stream has no history, so nothing is loaded: the event is appended with expected
   * version {@code 0}, and a concurrent creation of the same id is reported as a conflict.
   *
   * @param <CREATE> the type of the particular {@link DomainCommand.Create}
   */
  // @formatter:off
  public abstract static non-sealed class Create<
    CREATE extends DomainCommand.Create<?, ?>
  > extends DomainCommandHandler<CREATE, UUID> {
  // @formatter:on
    protected Create(final Class<CREATE> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic deciding the creation event.
     *
     * @param command containing the data required to create the aggregate
     * @param aggregateId assigned to the new aggregate
     * @return the creation event
     * @throws DomainValidationException if the command violates aggregate rules
     */
    protected abstract IdentityEvent decide(final CREATE command, final UUID aggregateId);

    /**
     * @param command being executed
     * @return id for the new stream, random by default
     */
    protected UUID newAggregateId(final CREATE command) {
      return UUID.randomUUID();
    }

    /** {@inheritDoc} */
    @Override
    protected final UUID internalRunContract(
        final CREATE command, final EventStore eventStore, final EventCodec eventCodec) {
      final UUID aggregateId =
          throwIllegalStateIfNull(newAggregateId(command), "New aggregate id");
      final IdentityEvent event =
          throwIllegalStateIfNull(decide(command, aggregateId), DECIDED_EVENT);

      eventStore.append(aggregateId, List.of(event), 0L);
      return aggregateId;
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Update}.
   *
   * @param <UPDATE> the type of the particular {@link DomainCommand.Update}
   * @param <STATE> the aggregate type the command is decided on
   */
  // @formatter:off
  public abstract static non-sealed class Update<
    UPDATE extends DomainCommand.Update<?, ?>,
    STATE extends Aggregate<STATE>
  > extends DomainCommandHandler<UPDATE, Long> {
  // @formatter:on
    private final STATE initialState;

    protected Update(final Class<UPDATE> commandClass, final STATE initialState) {
      super(commandClass);
      this.initialState = throwIllegalArgumentIfNull(initialState, "Initial state");
    }

    /**
     * Business logic deciding the event on the current state.
     *
     * @param command containing the data required to change the aggregate
     * @param state rebuilt from the stored history
     * @return the resulting event
     * @throws DomainValidationException if the command violates aggregate rules
     */
    protected abstract IdentityEvent decide(final UPDATE command, final STATE state);

    /** {@inheritDoc} */
    @Override
    protected final Long internalRunContract(
        final UPDATE command, final EventStore eventStore, final EventCodec eventCodec) {
      final UUID aggregateId =
          throwIllegalStateIfNull(command.aggregateId(), "Command's aggregate id");

      return loadDecideAppend(
          aggregateId, initialState, state -> decide(command, state), eventStore, eventCodec);
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Delete}.
   *
   * <p>The deletion fact is appended like any other event, prior events are kept.
   *
   * @param <DELETE> the type of the particular {@link DomainCommand.Delete}
   * @param <STATE> the aggregate type the command is decided on
   */
  // @formatter:off
  public abstract static non-sealed class Delete<
    DELETE extends DomainCommand.Delete<?, ?>,
    STATE extends Aggregate<STATE>
  > extends DomainCommandHandler<DELETE, Long> {
  // @formatter:on
    private final STATE initialState;

    protected Delete(final Class<DELETE> commandClass, final STATE initialState) {
      super(commandClass);
      this.initialState = throwIllegalArgumentIfNull(initialState, "Initial state");
    }

    /**
     * Business logic deciding the deletion event on the current state.
     *
     * @param command containing the data required to delete the aggregate
     * @param state rebuilt from the stored history
     * @return the deletion event
     */
    protected abstract IdentityEvent decide(final DELETE command, final STATE state);

    /** {@inheritDoc} */
    @Override
    protected final Long internalRunContract(
        final DELETE command, final EventStore eventStore, final EventCodec eventCodec) {
      final UUID aggregateId =
          throwIllegalStateIfNull(command.aggregateId(), "Command's aggregate id");

      return loadDecideAppend(
          aggregateId, initialState, state -> decide(command, state), eventStore, eventCodec);
    }
  }
}
