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

package ai.floedb.snapcat.store.memory;

import ai.floedb.snapcat.store.AttributeId;
import ai.floedb.snapcat.store.AttributeInfo;
import ai.floedb.snapcat.store.EntityId;
import ai.floedb.snapcat.store.EntityStore;
import ai.floedb.snapcat.types.TypeId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Insertion-ordered {@link EntityStore} held on the heap.
 *
 * <p>Entities enumerate in spawn order and attributes in insertion order per entity. Not
 * thread-safe; populate it fully before handing it to an exporter.
 */
public class InMemoryEntityStore implements EntityStore {

  private static final Object TAG = new Object();

  private final List<AttributeInfo> attributes = new ArrayList<>();
  private final Map<String, AttributeId> attributesByName = new LinkedHashMap<>();
  private final Map<EntityId, Map<AttributeId, Object>> entities = new LinkedHashMap<>();
  private long nextEntity = 1;

  /** Declares a value attribute of registered type {@code typeId}. */
  public AttributeId attribute(String name, TypeId typeId) {
    Objects.requireNonNull(typeId, "typeId");
    return declare(new AttributeInfo(name, Optional.of(typeId), false));
  }

  /** Declares a zero-size marker attribute. */
  public AttributeId marker(String name, TypeId typeId) {
    Objects.requireNonNull(typeId, "typeId");
    return declare(new AttributeInfo(name, Optional.of(typeId), true));
  }

  /** Declares an attribute the store has no type id for. */
  public AttributeId untyped(String name) {
    return declare(new AttributeInfo(name, Optional.empty(), false));
  }

  private AttributeId declare(AttributeInfo info) {
    if (attributesByName.containsKey(info.name())) {
      throw new IllegalArgumentException("attribute already declared: " + info.name());
    }
    AttributeId id = AttributeId.of(attributes.size());
    attributes.add(info);
    attributesByName.put(info.name(), id);
    return id;
  }

  public Optional<AttributeId> attributeId(String name) {
    return Optional.ofNullable(attributesByName.get(name));
  }

  public EntityId spawn() {
    EntityId id = EntityId.of(nextEntity++);
    entities.put(id, new LinkedHashMap<>());
    return id;
  }

  public InMemoryEntityStore insert(EntityId entity, AttributeId attribute, Object value) {
    Objects.requireNonNull(value, "value");
    if (attribute.index() >= attributes.size()) {
      throw new IllegalArgumentException("unknown attribute: " + attribute);
    }
    row(entity).put(attribute, value);
    return this;
  }

  /** Attaches a marker attribute, which carries no value of interest. */
  public InMemoryEntityStore tag(EntityId entity, AttributeId marker) {
    return insert(entity, marker, TAG);
  }

  public boolean remove(EntityId entity, AttributeId attribute) {
    return row(entity).remove(attribute) != null;
  }

  public boolean despawn(EntityId entity) {
    return entities.remove(entity) != null;
  }

  private Map<AttributeId, Object> row(EntityId entity) {
    Map<AttributeId, Object> row = entities.get(entity);
    if (row == null) {
      throw new IllegalArgumentException("unknown entity: " + entity);
    }
    return row;
  }

  @Override
  public List<EntityId> entities() {
    return List.copyOf(entities.keySet());
  }

  @Override
  public List<AttributeId> attributes(EntityId entity) {
    Map<AttributeId, Object> row = entities.get(entity);
    return row == null ? List.of() : List.copyOf(row.keySet());
  }

  @Override
  public boolean has(EntityId entity, AttributeId attribute) {
    Map<AttributeId, Object> row = entities.get(entity);
    return row != null && row.containsKey(attribute);
  }

  @Override
  public Optional<Object> get(EntityId entity, AttributeId attribute) {
    Map<AttributeId, Object> row = entities.get(entity);
    return row == null ? Optional.empty() : Optional.ofNullable(row.get(attribute));
  }

  @Override
  public Optional<AttributeInfo> attributeInfo(AttributeId attribute) {
    if (attribute == null || attribute.index() >= attributes.size()) {
      return Optional.empty();
    }
    return Optional.of(attributes.get(attribute.index()));
  }

  @Override
  public int entityCount() {
    return entities.size();
  }
}
