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

import ai.floedb.snapcat.arrow.ColumnPlan;
import ai.floedb.snapcat.export.cluster.ClusterAttribute;
import ai.floedb.snapcat.types.TypeId;
import java.util.Objects;
import java.util.Optional;
import org.apache.arrow.vector.types.pojo.Field;

/** One output column: the attribute it comes from, its unique column name and its layout. */
public record ColumnSpec(
    ClusterAttribute attribute, String columnName, ColumnPlan plan, Optional<TypeId> typeId) {

  public ColumnSpec {
    Objects.requireNonNull(attribute, "attribute");
    Objects.requireNonNull(columnName, "columnName");
    Objects.requireNonNull(plan, "plan");
    typeId = typeId == null ? Optional.empty() : typeId;
  }

  public Field field() {
    return plan.field(columnName);
  }
}
