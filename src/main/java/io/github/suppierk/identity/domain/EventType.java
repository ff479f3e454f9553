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

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Persistence discriminant of {@link IdentityEvent}s.
 *
 * <p>The tag is what is written into the {@code event_type} column and what projectors dispatch on,
 * therefore tags must never be renamed once events carrying them were stored.
 */
public enum EventType {
  USER_REGISTERED("UserRegistered", IdentityEvent.UserRegistered.class),
  USER_UPDATED("UserUpdated", IdentityEvent.UserUpdated.class),
  USER_DEACTIVATED("UserDeactivated", IdentityEvent.UserDeactivated.class),
  USER_ROLE_ASSIGNED("UserRoleAssigned", IdentityEvent.UserRoleAssigned.class),
  USER_ROLE_REMOVED("UserRoleRemoved", IdentityEvent.UserRoleRemoved.class),
  ROLE_CREATED("RoleCreated", IdentityEvent.RoleCreated.class),
  ROLE_UPDATED("RoleUpdated", IdentityEvent.RoleUpdated.class),
  ROLE_DELETED("RoleDeleted", IdentityEvent.RoleDeleted.class);

  private static final Map<String, EventType> BY_TAG =
      Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(EventType::tag, Function.identity()));

  private final String tag;
  private final Class<? extends IdentityEvent> eventClass;

  EventType(final String tag, final Class<? extends IdentityEvent> eventClass) {
    this.tag = tag;
    this.eventClass = eventClass;
  }

  /**
   * @param tag as stored alongside the payload
   * @return matching type or {@link Optional#empty()} if the tag is not known to this codebase
   */
  public static Optional<EventType> fromTag(final String tag) {
    if (tag == null) {
      return Optional.empty();
    }

    return Optional.ofNullable(BY_TAG.get(tag));
  }

  public String tag() {
    return tag;
  }

  public Class<? extends IdentityEvent> eventClass() {
    return eventClass;
  }
}
