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

/**
 * Defines the command side of the identity core.
 *
 * <p>Here is how the pieces relate to each other when an administrator deactivates a user:
 *
 * <ul>
 *   <li>The request becomes a {@link io.github.suppierk.identity.cqrs.DomainCommand.Update}, which
 *       names the user stream by its aggregate id.
 *   <li>The {@link io.github.suppierk.identity.cqrs.BoundedContext} picks the single {@link
 *       io.github.suppierk.identity.cqrs.DomainCommandHandler} registered for that command class.
 *   <li>The handler loads the user stream from the {@link io.github.suppierk.identity.es.EventStore},
 *       folds it into the current {@link io.github.suppierk.identity.domain.User} and lets the user
 *       decide the resulting event.
 *   <li>The event is appended with the version observed during the load. When another writer got
 *       there first, the caller receives {@link
 *       io.github.suppierk.identity.errors.ConcurrencyConflictException} and decides whether to
 *       retry.
 *   <li>Read models are refreshed separately by feeding the appended events to projectors.
 * </ul>
 */
package io.github.suppierk.identity.cqrs;
