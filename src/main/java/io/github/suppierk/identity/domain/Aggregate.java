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

import java.util.List;

/**
 * State of an event-sourced consistency boundary.
 *
 * <p>Implementations are immutable values: command operations inspect the state and either throw a
 * {@link io.github.suppierk.identity.errors.DomainValidationException} or return a new {@link
 * IdentityEvent}, while {@link #apply(IdentityEvent)} is the only way to get the next state.
 *
 * @param <SELF> the concrete aggregate type
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public interface Aggregate<SELF extends Aggregate<SELF>> {
  /**
   * @return amount of events folded into this state, which is also the sequence number of the last
   *     stored event of the stream
   */
  long version();

  /**
   * Folds a single event into the state.
   *
   * @param event to apply
   * @return new state with version incremented by one
   */
  SELF apply(IdentityEvent event);

  /**
   * Replays the events in the given order, starting from {@code initial}.
   *
   * @param initial state to start from, usually the zero value of the aggregate
   * @param events ordered by their sequence number
   * @param <S> the concrete aggregate type
   * @return the state after the last event
   */
  static <S extends Aggregate<S>> S fold(final S initial, final List<? extends IdentityEvent> events) {
    if (initial == null) {
      throw new IllegalArgumentException("Initial state cannot be null");
    }

    if (events == null) {
      throw new IllegalArgumentException("Events cannot be null");
    }

    S state = initial;
    for (IdentityEvent event : events) {
      state = state.apply(event);
    }
    return state;
  }
}
