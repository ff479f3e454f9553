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

import java.util.Locale;

/** Lifecycle status of a {@link User}. */
public enum UserStatus {
  ACTIVE,
  INACTIVE,
  LOCKED;

  /**
   * @return lower-case representation used by the read models
   */
  public String readModelValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * @param value as stored by the read models
   * @return matching status
   * @throws IllegalArgumentException if the value denotes no status
   */
  public static UserStatus fromReadModelValue(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("User status cannot be null");
    }

    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
