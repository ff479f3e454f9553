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

package io.github.suppierk.identity.errors;

import java.io.Serial;

/**
 * Thrown when an event cannot be turned into a payload, or when a stored payload cannot be decoded
 * into the event type declared by its tag.
 *
 * <p>Fatal for the read in progress: stored payloads are never repaired automatically.
 */
public final class EventSerializationException extends IdentityException {
  @Serial private static final long serialVersionUID = -1510938204563727066L;

  public EventSerializationException(String message) {
    super(message);
  }

  public EventSerializationException(String message, Throwable cause) {
    super(message, cause);
  }

  @SuppressWarnings("squid:S3400")
  @Override
  public int getStatusCode() {
    return 500;
  }
}
