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

import io.github.suppierk.identity.errors.ProjectionException;
import io.github.suppierk.identity.es.StoredEvent;

/**
 * Keeps one read model eventually consistent with the committed events.
 *
 * <p>Invoked by an external delivery mechanism, once per committed event in sequence order of its
 * stream. Duplicate delivery is not detected here.
 */
@FunctionalInterface
public interface Projector {
  /**
   * Applies the event to the read model; event types the read model does not track are ignored.
   *
   * @param event committed event
   * @throws ProjectionException if the event cannot be applied, for example when it updates a row
   *     which was never created
   */
  void handle(StoredEvent event);
}
