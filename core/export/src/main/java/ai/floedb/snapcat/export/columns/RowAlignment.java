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
import ai.floedb.snapcat.export.RaggedColumnPolicy;
import ai.floedb.snapcat.store.EntityId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jboss.logging.Logger;

/** Lines materialized columns up into rows, one row per entity present in every column. */
public final class RowAlignment {

  private static final Logger LOG = Logger.getLogger(RowAlignment.class);

  private RowAlignment() {}

  /**
   * Aligned rows ready for a batch.
   *
   * @param droppedRows entities present in some but not all columns
   */
  public record Rows(List<EntityId> entities, List<List<Object>> columns, int droppedRows) {}

  /**
   * @throws ExportException.WriteFailure under {@link RaggedColumnPolicy#FAIL} when the columns do
   *     not cover the same entities
   */
  public static Rows align(List<MaterializedColumn> columns, RaggedColumnPolicy policy) {
    if (columns.isEmpty()) {
      return new Rows(List.of(), List.of(), 0);
    }
    List<EntityId> first = columns.get(0).entities();
    boolean ragged = false;
    for (MaterializedColumn column : columns) {
      if (!column.entities().equals(first)) {
        ragged = true;
        break;
      }
    }
    if (!ragged) {
      List<List<Object>> values = new ArrayList<>(columns.size());
      for (MaterializedColumn column : columns) {
        values.add(column.values());
      }
      return new Rows(first, values, 0);
    }

    if (policy == RaggedColumnPolicy.FAIL) {
      StringBuilder lengths = new StringBuilder();
      for (MaterializedColumn column : columns) {
        if (lengths.length() > 0) {
          lengths.append(", ");
        }
        lengths.append(column.spec().columnName()).append('=').append(column.size());
      }
      throw new ExportException.WriteFailure("column lengths differ: " + lengths);
    }

    Set<EntityId> union = new LinkedHashSet<>();
    Set<EntityId> common = new LinkedHashSet<>(first);
    for (MaterializedColumn column : columns) {
      union.addAll(column.entities());
      common.retainAll(new HashSet<>(column.entities()));
    }
    List<EntityId> entities = List.copyOf(common);
    List<List<Object>> values = new ArrayList<>(columns.size());
    for (MaterializedColumn column : columns) {
      Map<EntityId, Object> byEntity = new HashMap<>();
      for (int i = 0; i < column.size(); i++) {
        byEntity.put(column.entities().get(i), column.values().get(i));
      }
      List<Object> aligned = new ArrayList<>(entities.size());
      for (EntityId entity : entities) {
        aligned.add(byEntity.get(entity));
      }
      values.add(aligned);
    }
    int dropped = union.size() - entities.size();
    LOG.warnf("dropped %d incomplete rows, %d rows remain", dropped, entities.size());
    return new Rows(entities, values, dropped);
  }
}
