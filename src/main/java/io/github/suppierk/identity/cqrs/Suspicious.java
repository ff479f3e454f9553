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

import java.util.function.Function;

/**
 * Internal sealed utility guarding the command pipeline against {@code null}s.
 *
 * <p>Every value coming from a caller or from a subclass hook passes through one of these checks,
 * and the kind of exception tells who is at fault: the caller ({@link IllegalArgumentException}),
 * the wiring of the context ({@link IllegalStateException}) or the lack of a registered handler
 * ({@link UnsupportedOperationException}).
 */
abstract sealed class Suspicious permits BoundedContext, DomainCommandHandler {
  private static <T> T requireNonNull(
      final T value,
      final String message,
      final Function<String, ? extends RuntimeException> exceptionFactory) {
    if (value == null) {
      throw exceptionFactory.apply(message);
    }

    return value;
  }

  /**
   * For values the context or a handler is responsible for, such as collaborators or hook results.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the value name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(final T value, final String whatMustNotBeNull) {
    return requireNonNull(
        value, "%s cannot be null".formatted(whatMustNotBeNull), IllegalStateException::new);
  }

  /**
   * For method arguments only.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the argument name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(final T value, final String whatMustNotBeNull) {
    return requireNonNull(
        value, "%s cannot be null".formatted(whatMustNotBeNull), IllegalArgumentException::new);
  }

  /**
   * For lookups of a capability which might not be registered.
   *
   * @param value which must not be {@code null}
   * @param whatIsMissing describes the capability
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws UnsupportedOperationException when the value is {@code null}
   */
  protected final <T> T throwUnsupportedOperationIfNull(final T value, final String whatIsMissing) {
    return requireNonNull(
        value, "%s is not registered".formatted(whatIsMissing), UnsupportedOperationException::new);
  }
}
