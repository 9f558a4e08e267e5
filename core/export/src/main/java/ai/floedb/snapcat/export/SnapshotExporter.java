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

package ai.floedb.snapcat.export;

import ai.floedb.snapcat.export.cluster.AttributeCluster;
import ai.floedb.snapcat.export.cluster.ClusterAttribute;
import ai.floedb.snapcat.export.cluster.ClusterDetector;
import ai.floedb.snapcat.export.columns.ClusterSchema;
import ai.floedb.snapcat.export.columns.ColumnMaterializer;
import ai.floedb.snapcat.export.columns.ColumnSpec;
import ai.floedb.snapcat.export.columns.MaterializedColumn;
import ai.floedb.snapcat.export.columns.RowAlignment;
import ai.floedb.snapcat.export.columns.SchemaBuilder;
import ai.floedb.snapcat.export.parquet.FileNames;
import ai.floedb.snapcat.export.parquet.ParquetBatchWriter;
import ai.floedb.snapcat.store.AttributeInfo;
import ai.floedb.snapcat.store.EntityId;
import ai.floedb.snapcat.store.EntityStore;
import ai.floedb.snapcat.types.TypeRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

/**
 * Exports an entity store snapshot as one Parquet file per marked attribute cluster.
 *
 * <p>Clusters come from the configuration when it lists any, otherwise from {@link
 * ClusterDetector}. Clusters without a marker attribute are skipped. Clusters are processed one
 * after the other on the calling thread; the first I/O or write failure ends the export and files
 * already written stay on disk.
 */
public final class SnapshotExporter {

  private static final Logger LOG = Logger.getLogger(SnapshotExporter.class);

  /** MDC key holding the file name of the cluster being written. */
  public static final String MDC_CLUSTER = "snapcat.cluster";

  private final ExportConfig config;

  public SnapshotExporter(ExportConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public ExportResult export(EntityStore store, TypeRegistry registry) {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(registry, "registry");

    List<AttributeCluster> clusters =
        config.clusters().isEmpty()
            ? new ClusterDetector(config.clustering()).detect(store, registry)
            : ClusterDetector.resolve(config.clusters(), store);
    logAnalysis(clusters);
    Diagnostics.relief(config.fileName(), "every cluster is written under the configured name");

    SchemaBuilder schemas = new SchemaBuilder(store, registry, config.encoding());
    ColumnMaterializer materializer = new ColumnMaterializer(store, registry);
    ParquetBatchWriter writer = new ParquetBatchWriter(config.writer());

    List<ClusterExport> exports = new ArrayList<>();
    for (AttributeCluster cluster : clusters) {
      if (!hasMarker(store, cluster)) {
        LOG.debugf("skipping cluster %s: no marker attribute", cluster);
        continue;
      }
      String name = FileNames.name(cluster, config);
      MDC.put(MDC_CLUSTER, name);
      try {
        exportCluster(cluster, name, schemas, materializer, writer).ifPresent(exports::add);
      } finally {
        MDC.remove(MDC_CLUSTER);
      }
    }

    LOG.infof("export finished: %d of %d clusters written", exports.size(), clusters.size());
    return new ExportResult(clusters, exports);
  }

  private Optional<ClusterExport> exportCluster(
      AttributeCluster cluster,
      String name,
      SchemaBuilder schemas,
      ColumnMaterializer materializer,
      ParquetBatchWriter writer) {
    ClusterSchema schema;
    try {
      schema = schemas.build(cluster);
    } catch (ExportException.SerializationFailure e) {
      LOG.errorf("skipping cluster %s: %s", cluster, e.getMessage());
      return Optional.empty();
    }
    if (schema.columns().isEmpty()) {
      LOG.warnf("skipping cluster %s: only marker attributes", cluster);
      return Optional.empty();
    }

    List<EntityId> entities = materializer.qualifying(schema);
    List<MaterializedColumn> columns = new ArrayList<>(schema.columns().size());
    int omitted = 0;
    for (ColumnSpec spec : schema.columns()) {
      MaterializedColumn column = materializer.materialize(spec, entities);
      omitted += column.omitted();
      columns.add(column);
    }
    RowAlignment.Rows rows = RowAlignment.align(columns, config.raggedColumns());

    Path path = FileNames.path(config.outputPath(), name);
    ParquetBatchWriter.WrittenFile written =
        writer.write(path, schema.arrowSchema(), rows.columns());
    return Optional.of(
        new ClusterExport(
            cluster,
            written.path(),
            schema.arrowSchema(),
            written.rowCount(),
            schema.columns().size(),
            omitted,
            rows.droppedRows()));
  }

  private static boolean hasMarker(EntityStore store, AttributeCluster cluster) {
    for (ClusterAttribute attribute : cluster.attributes()) {
      if (store.attributeInfo(attribute.id()).map(AttributeInfo::marker).orElse(false)) {
        return true;
      }
    }
    return false;
  }

  private static void logAnalysis(List<AttributeCluster> clusters) {
    LOG.infof("cluster analysis: %d clusters", clusters.size());
    for (int i = 0; i < clusters.size(); i++) {
      AttributeCluster cluster = clusters.get(i);
      Diagnostics.report("cluster " + i + " (" + cluster.size() + " attributes)", cluster);
    }
  }
}
