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

package ai.floedb.snapcat.export.columns;

import ai.floedb.snapcat.export.ExportException;
import ai.floedb.snapcat.store.EntityId;
import ai.floedb.snapcat.store.EntityStore;
import ai.floedb.snapcat.types.ReflectionException;
import ai.floedb.snapcat.types.Reflector;
import ai.floedb.snapcat.types.TypeId;
import ai.floedb.snapcat.types.TypeRegistration;
import ai.floedb.snapcat.types.TypeRegistry;
import ai.floedb.snapcat.types.ValueView;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Reads attribute values from the store and turns them into column values.
 *
 * <p>A value that cannot be read, reflected or fitted to its column is left out of the column and
 * logged; it is never replaced by a null. Columns can therefore be shorter than the set of
 * qualifying entities.
 */
public final class ColumnMaterializer {

  private static final Logger LOG = Logger.getLogger(ColumnMaterializer.class);

  private final EntityStore store;
  private final TypeRegistry registry;

  public ColumnMaterializer(EntityStore store, TypeRegistry registry) {
    this.store = Objects.requireNonNull(store, "store");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /** Entities carrying every value attribute of {@code schema}, in store order. */
  public List<EntityId> qualifying(ClusterSchema schema) {
    List<EntityId> out = new ArrayList<>();
    for (EntityId entity : store.entities()) {
      boolean all = true;
      for (ColumnSpec column : schema.columns()) {
        if (!store.has(entity, column.attribute().id())) {
          all = false;
          break;
        }
      }
      if (all) {
        out.add(entity);
      }
    }
    return out;
  }

  public MaterializedColumn materialize(ColumnSpec column, List<EntityId> entities) {
    List<EntityId> present = new ArrayList<>(entities.size());
    List<Object> values = new ArrayList<>(entities.size());
    int omitted = 0;
    for (EntityId entity : entities) {
      try {
        values.add(value(column, entity));
        present.add(entity);
      } catch (ExportException.SerializationFailure e) {
        omitted++;
        LOG.warnf("omitting %s of %s: %s", column.columnName(), entity, e.getMessage());
      }
    }
    if (omitted > 0) {
      LOG.warnf("column %s lost %d of %d values", column.columnName(), omitted, entities.size());
    }
    return new MaterializedColumn(column, present, values, omitted);
  }

  private Object value(ColumnSpec column, EntityId entity) {
    String attribute = column.attribute().name();
    Object raw =
        store
            .get(entity, column.attribute().id())
            .orElseThrow(
                () -> new ExportException.SerializationFailure("attribute missing: " + attribute));
    TypeId typeId =
        column
            .typeId()
            .orElseThrow(
                () ->
                    new ExportException.SerializationFailure(
                        "attribute " + attribute + " has no type id"));
    TypeRegistration registration =
        registry
            .registration(typeId)
            .orElseThrow(
                () ->
                    new ExportException.SerializationFailure(
                        "type " + typeId + " of " + attribute + " is not registered"));
    Reflector reflector =
        registration
            .reflector()
            .orElseThrow(
                () ->
                    new ExportException.SerializationFailure(
                        "type " + typeId + " of " + attribute + " cannot be reflected"));

    ValueView view;
    try {
      view = reflector.reflect(raw);
    } catch (RuntimeException e) {
      throw new ExportException.SerializationFailure(
          "failed to reflect " + attribute + ": " + e.getMessage(), e);
    }
    try {
      return column.plan().extract(view);
    } catch (ReflectionException e) {
      throw new ExportException.SerializationFailure(
          "value of " + attribute + " does not fit column " + column.columnName() + ": "
              + e.getMessage(),
          e);
    }
  }
}
