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

package io.github.suppierk.identity.projection;

import io.github.suppierk.identity.domain.UserStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * Row of the users read model.
 *
 * @param updatedAt {@code createdAt} of the last event applied to the row
 */
public record UserView(
    UUID id,
    UUID tenantId,
    String username,
    String email,
    String passwordHash,
    UserStatus status,
    Instant createdAt,
    Instant updatedAt) {
  @Override
  public String toString() {
    return "UserView[id=%s, tenantId=%s, username=%s, email=%s, status=%s, createdAt=%s, updatedAt=%s]"
        .formatted(id, tenantId, username, email, status, createdAt, updatedAt);
  }
}
