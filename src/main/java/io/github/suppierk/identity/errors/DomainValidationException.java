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
 * Thrown when command input violates an aggregate rule: empty names, malformed emails or a status
 * which does not allow the requested transition.
 *
 * <p>Never results in a stored event.
 */
public final class DomainValidationException extends IdentityException {
  @Serial private static final long serialVersionUID = 4719520311958021431L;

  public DomainValidationException(String message) {
    super(message);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/400">400 Bad
   *     Request</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  @Override
  public int getStatusCode() {
    return 400;
  }
}
