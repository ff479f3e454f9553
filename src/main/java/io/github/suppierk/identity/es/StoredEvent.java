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

package io.github.suppierk.identity.es;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted envelope of an {@link io.github.suppierk.identity.domain.IdentityEvent}.
 *
 * <p>The payload is a structured document whose schema is keyed by {@code eventType}. The envelope
 * owns a private copy of the payload and hands out copies only, so that stored events cannot be
 * mutated after they were created.
 *
 * @param id unique id of the stored record
 * @param aggregateId id of the stream
 * @param sequence position within the stream, starting at 1
 * @param eventType tag of the payload schema
 * @param payload event fields
 * @param createdAt commit timestamp in UTC
 */
public record StoredEvent(
    UUID id, UUID aggregateId, long sequence, String eventType, JsonNode payload, Instant createdAt) {
  public StoredEvent {
    if (id == null || aggregateId == null || eventType == null || payload == null) {
      throw new IllegalArgumentException("Stored event fields cannot be null");
    }

    if (createdAt == null) {
      throw new IllegalArgumentException("Stored event timestamp cannot be null");
    }

    if (sequence < 1) {
      throw new IllegalArgumentException(
          "Sequence must start at 1, got %d".formatted(sequence));
    }

    payload = payload.deepCopy();
  }

  /**
   * @return a copy of the payload
   */
  @Override
  public JsonNode payload() {
    return payload.deepCopy();
  }
}
