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

import java.io.Serializable;
import java.time.temporal.Temporal;
import java.util.UUID;

/**
 * Represents an immutable request to change the state of exactly one aggregate.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Deactivate User' instead of 'Set
 * User status to INACTIVE'. A command is translated into at most one event.
 *
 * <p>We leverage Java {@code sealed} feature to split commands by their relation to the event
 * stream:
 *
 * <ul>
 *   <li>{@link Create} starts a new stream and therefore never reads one.
 *   <li>{@link Update} and {@link Delete} target an existing stream identified by {@link
 *       Update#aggregateId()} / {@link Delete#aggregateId()}.
 * </ul>
 *
 * @param <I> is the type of the command identifier
 * @param <T> is the type of the timestamp when this command was created
 */
// @formatter:off
public sealed interface DomainCommand<
  I extends Serializable,
  T extends Temporal & Serializable
> extends DomainMessage<I, T>
permits
  DomainCommand.Create,
  DomainCommand.Update,
  DomainCommand.Delete
{
// @formatter:on

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to create a new
   * aggregate in the system.
   */
  // @formatter:off
  non-sealed interface Create<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {}
  // @formatter:on

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to change an
   * existing aggregate in the system.
   */
  // @formatter:off
  non-sealed interface Update<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {
  // @formatter:on

    /**
     * @return id of the stream to change
     */
    UUID aggregateId();
  }

  /**
   * Marker interface, denoting that the command is supposed to represent an intent to delete an
   * existing aggregate in the system.
   *
   * <p>Deletion is recorded as a fact, the stream itself is never removed.
   */
  // @formatter:off
  non-sealed interface Delete<
    I extends Serializable,
    T extends Temporal & Serializable
  > extends DomainCommand<I, T> {
  // @formatter:on

    /**
     * @return id of the stream to delete
     */
    UUID aggregateId();
  }
}
