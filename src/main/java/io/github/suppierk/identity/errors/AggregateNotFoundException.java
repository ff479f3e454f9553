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
import java.util.UUID;

/**
 * Thrown when a stream has no stored events, or when its events describe another kind of aggregate
 * than the one requested.
 */
public final class AggregateNotFoundException extends IdentityException {
  @Serial private static final long serialVersionUID = 2230846585612453372L;

  private final UUID aggregateId;

  public AggregateNotFoundException(UUID aggregateId) {
    super("Aggregate '%s' has no stored events".formatted(aggregateId));
    this.aggregateId = aggregateId;
  }

  public AggregateNotFoundException(UUID aggregateId, String aggregateKind) {
    super("No %s with id '%s'".formatted(aggregateKind, aggregateId));
    this.aggregateId = aggregateId;
  }

  public UUID getAggregateId() {
    return aggregateId;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/404">404 Not Found</a>
   */
  @SuppressWarnings("squid:S3400")
  @Override
  public int getStatusCode() {
    return 404;
  }
}
