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

package io.github.suppierk.identity.jooq;

import java.util.UUID;
import java.util.function.Function;
import org.jooq.DSLContext;

/**
 * Allows for flexibility to define {@link DSLContext}s to be used.
 *
 * <p>Extends {@link Function} to give the ability to decide which {@link DSLContext} to use based
 * on the aggregate id of the stream, where one of the usage examples might be to spread streams
 * over several databases. All reads and writes of one stream must resolve to the same database.
 */
@FunctionalInterface
public interface DslContextProvider extends Function<UUID, DSLContext> {

  /**
   * Similar to {@link Function#identity()}.
   *
   * @param dslContext to create {@link DslContextProvider} with
   * @return a new instance of {@link DslContextProvider} which simply returns provided {@link
   *     DSLContext} for every stream
   */
  static DslContextProvider dslContextIdentity(final DSLContext dslContext) {
    if (dslContext == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    return aggregateId -> dslContext;
  }
}
