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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.identity.domain.EventType;
import io.github.suppierk.identity.domain.IdentityEvent;
import io.github.suppierk.identity.errors.EventSerializationException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts {@link IdentityEvent}s to and from the structured payload of {@link StoredEvent}s.
 *
 * <p>The payload holds the event fields only, the discriminant lives in {@link
 * StoredEvent#eventType()}. Optional fields which are not set are not written. Unknown payload
 * fields are treated as schema drift and rejected.
 *
 * <p>Instances are thread-safe.
 */
public final class EventCodec {
  private final ObjectMapper objectMapper;

  public EventCodec() {
    this(
        new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES));
  }

  /**
   * @param objectMapper preconfigured mapper, for example shared with the HTTP layer
   * @throws IllegalArgumentException if the mapper is null
   */
  public EventCodec(final ObjectMapper objectMapper) {
    if (objectMapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    this.objectMapper = objectMapper;
  }

  /**
   * @param event to convert
   * @return payload document
   * @throws EventSerializationException if the event cannot be represented
   */
  public JsonNode encode(final IdentityEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    try {
      return objectMapper.valueToTree(event);
    } catch (IllegalArgumentException e) {
      throw new EventSerializationException(
          "Cannot encode %s event".formatted(event.type().tag()), e);
    }
  }

  /**
   * @param storedEvent to decode
   * @return event of the type declared by the stored tag
   * @throws EventSerializationException if the tag is unknown or the payload does not match it
   */
  public IdentityEvent decode(final StoredEvent storedEvent) {
    if (storedEvent == null) {
      throw new IllegalArgumentException("Stored event cannot be null");
    }

    final EventType type =
        EventType.fromTag(storedEvent.eventType())
            .orElseThrow(
                () ->
                    new EventSerializationException(
                        "Unknown event type '%s' at sequence %d of aggregate '%s'"
                            .formatted(
                                storedEvent.eventType(),
                                storedEvent.sequence(),
                                storedEvent.aggregateId())));

    return decode(storedEvent, type.eventClass());
  }

  /**
   * @param storedEvent to decode
   * @param eventClass expected event class
   * @param <E> expected event type
   * @return decoded event
   * @throws EventSerializationException if the stored tag does not denote {@code eventClass} or the
   *     payload does not match it
   */
  public <E extends IdentityEvent> E decode(final StoredEvent storedEvent, final Class<E> eventClass) {
    if (storedEvent == null) {
      throw new IllegalArgumentException("Stored event cannot be null");
    }

    if (eventClass == null) {
      throw new IllegalArgumentException("Event class cannot be null");
    }

    final boolean tagMatches =
        EventType.fromTag(storedEvent.eventType())
            .map(type -> type.eventClass().equals(eventClass))
            .orElse(false);

    if (!tagMatches) {
      throw new EventSerializationException(
          "Event type '%s' cannot be decoded as %s"
              .formatted(storedEvent.eventType(), eventClass.getSimpleName()));
    }

    final E event;
    try {
      event = objectMapper.treeToValue(storedEvent.payload(), eventClass);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new EventSerializationException(
          "Cannot decode %s payload at sequence %d of aggregate '%s'"
              .formatted(storedEvent.eventType(), storedEvent.sequence(), storedEvent.aggregateId()),
          e);
    }

    if (event == null || !storedEvent.aggregateId().equals(event.aggregateId())) {
      throw new EventSerializationException(
          "%s payload at sequence %d does not belong to aggregate '%s'"
              .formatted(storedEvent.eventType(), storedEvent.sequence(), storedEvent.aggregateId()));
    }

    return event;
  }

  /**
   * @param storedEvents of a single stream in sequence order
   * @return decoded events in the same order
   */
  public List<IdentityEvent> decodeAll(final List<StoredEvent> storedEvents) {
    if (storedEvents == null) {
      throw new IllegalArgumentException("Stored events cannot be null");
    }

    final List<IdentityEvent> events = new ArrayList<>(storedEvents.size());
    for (StoredEvent storedEvent : storedEvents) {
      events.add(decode(storedEvent));
    }
    return events;
  }

  /**
   * @param payload document
   * @return textual form for storage media without a native document type
   */
  public String writePayload(final JsonNode payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new EventSerializationException("Cannot write event payload", e);
    }
  }

  /**
   * @param payload textual form
   * @return payload document
   * @throws EventSerializationException if the text is not a JSON document
   */
  public JsonNode readPayload(final String payload) {
    if (payload == null) {
      throw new EventSerializationException("Stored payload is missing");
    }

    try {
      return objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      throw new EventSerializationException("Cannot read event payload", e);
    }
  }
}
