/*
 * Copyright 2026 Yellowbrick Data, Inc.
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

package ai.floedb.snapcat.store;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of an entity/attribute store snapshot.
 *
 * <p>Implementations must return entities and attributes in a stable order for the lifetime of the
 * snapshot; cluster detection is order dependent. Callers never mutate the store through this
 * interface, and implementations need not be thread-safe.
 */
public interface EntityStore {

  /** All live entities, in enumeration order. */
  List<EntityId> entities();

  /** Attributes present on {@code entity}, in storage order; empty for an unknown entity. */
  List<AttributeId> attributes(EntityId entity);

  boolean has(EntityId entity, AttributeId attribute);

  /** Raw attribute value, or empty when the entity does not carry the attribute. */
  Optional<Object> get(EntityId entity, AttributeId attribute);

  Optional<AttributeInfo> attributeInfo(AttributeId attribute);

  default int entityCount() {
    return entities().size();
  }
}
