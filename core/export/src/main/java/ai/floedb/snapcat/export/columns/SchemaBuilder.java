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

import ai.floedb.snapcat.arrow.ColumnEncoding;
import ai.floedb.snapcat.arrow.ColumnMappings;
import ai.floedb.snapcat.arrow.ColumnPlan;
import ai.floedb.snapcat.export.ExportException;
import ai.floedb.snapcat.export.cluster.AttributeCluster;
import ai.floedb.snapcat.export.cluster.ClusterAttribute;
import ai.floedb.snapcat.store.AttributeInfo;
import ai.floedb.snapcat.store.EntityStore;
import ai.floedb.snapcat.types.TypeDescriptor;
import ai.floedb.snapcat.types.TypeRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Derives the column layout of a cluster from the registered type of each attribute.
 *
 * <p>Columns follow cluster order and are named by the attribute's short name. A short name already
 * used in the same cluster gets a {@code _2}, {@code _3}, ... suffix. Attributes without a
 * registered type become debug-string columns.
 */
public final class SchemaBuilder {

  private static final Logger LOG = Logger.getLogger(SchemaBuilder.class);

  private final EntityStore store;
  private final TypeRegistry registry;
  private final ColumnEncoding encoding;

  public SchemaBuilder(EntityStore store, TypeRegistry registry, ColumnEncoding encoding) {
    this.store = Objects.requireNonNull(store, "store");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.encoding = Objects.requireNonNull(encoding, "encoding");
  }

  /**
   * @throws ExportException.SerializationFailure if the store has no metadata for an attribute
   */
  public ClusterSchema build(AttributeCluster cluster) {
    List<ColumnSpec> columns = new ArrayList<>();
    List<ClusterAttribute> markers = new ArrayList<>();
    Set<String> used = new HashSet<>();

    for (ClusterAttribute attribute : cluster.attributes()) {
      AttributeInfo info =
          store
              .attributeInfo(attribute.id())
              .orElseThrow(
                  () ->
                      new ExportException.SerializationFailure(
                          "attribute " + attribute.name() + " is unknown to the store"));
      if (info.marker()) {
        markers.add(attribute);
        continue;
      }
      columns.add(
          new ColumnSpec(
              attribute, uniqueName(columnName(info, attribute), used), plan(info), info.typeId()));
    }
    return new ClusterSchema(cluster, columns, markers);
  }

  private ColumnPlan plan(AttributeInfo info) {
    Optional<TypeDescriptor> descriptor = info.typeId().flatMap(registry::descriptor);
    if (descriptor.isEmpty()) {
      LOG.debugf("attribute %s has no registered type, using a debug-string column", info.name());
      return ColumnMappings.unresolved();
    }
    return ColumnMappings.plan(descriptor.get(), encoding);
  }

  private static String columnName(AttributeInfo info, ClusterAttribute attribute) {
    String shortName = info.shortName();
    return shortName.isBlank() ? "attribute_" + attribute.id().index() : shortName;
  }

  private static String uniqueName(String name, Set<String> used) {
    String candidate = name;
    for (int n = 2; !used.add(candidate); n++) {
      candidate = name + "_" + n;
    }
    return candidate;
  }
}
