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

import ai.floedb.snapcat.store.EntityId;
import java.util.List;
import java.util.Objects;

/**
 * Values of one column with the entity each came from.
 *
 * @param omitted number of qualifying entities whose value could not be materialized
 */
public record MaterializedColumn(
    ColumnSpec spec, List<EntityId> entities, List<Object> values, int omitted) {

  public MaterializedColumn {
    Objects.requireNonNull(spec, "spec");
    entities = List.copyOf(entities);
    values = List.copyOf(values);
    if (entities.size() != values.size()) {
      throw new IllegalArgumentException(
          "entity/value count mismatch: " + entities.size() + " vs " + values.size());
    }
  }

  public int size() {
    return values.size();
  }
}
