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

import ai.floedb.snapcat.export.cluster.AttributeCluster;
import ai.floedb.snapcat.export.cluster.ClusterAttribute;
import java.util.List;
import org.apache.arrow.vector.types.pojo.Schema;

/** Output layout of one cluster: a column per value attribute, markers set aside. */
public record ClusterSchema(
    AttributeCluster cluster, List<ColumnSpec> columns, List<ClusterAttribute> markers) {

  public ClusterSchema {
    columns = List.copyOf(columns);
    markers = List.copyOf(markers);
  }

  public Schema arrowSchema() {
    return new Schema(columns.stream().map(ColumnSpec::field).toList());
  }
}
