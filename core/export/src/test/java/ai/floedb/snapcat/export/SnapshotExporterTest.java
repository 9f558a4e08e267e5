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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.snapcat.arrow.ColumnEncoding;
import ai.floedb.snapcat.export.Fixtures.Health;
import ai.floedb.snapcat.export.Fixtures.PersistTag;
import ai.floedb.snapcat.export.Fixtures.Position;
import ai.floedb.snapcat.export.parquet.IcebergSchemas;
import ai.floedb.snapcat.store.AttributeId;
import ai.floedb.snapcat.store.EntityId;
import ai.floedb.snapcat.types.TypeId;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.iceberg.Schema;
import org.apache.iceberg.data.Record;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SnapshotExporterTest {

  @TempDir Path dir;

  private final Fixtures world = new Fixtures();

  @Test
  void onlyMarkedClusterIsWritten_overEveryEntityWithItsValueAttributes() throws IOException {
    EntityId a = world.store.spawn();
    world.store.insert(a, world.position, new Position(1, 1, 1));
    EntityId b = world.store.spawn();
    world.store.insert(b, world.position, new Position(2, 2, 2));
    EntityId c = world.store.spawn();
    world.store.insert(c, world.position, new Position(3, 3, 3)).tag(c, world.persist);

    ExportResult result = exporter(config()).export(world.store, world.registry);

    assertThat(result.clusters()).hasSize(2);
    assertThat(result.exports()).hasSize(1);
    ClusterExport export = result.exports().get(0);
    assertThat(export.path().getFileName().toString())
        .isEqualTo("world_Position_PersistTag.parquet");
    assertThat(export.rowCount()).isEqualTo(3);
    assertThat(export.columnCount()).isEqualTo(1);
    assertThat(export.schema().getFields())
        .extracting(Field::getName)
        .containsExactly("Position");
    try (var files = Files.list(dir)) {
      assertThat(files).hasSize(1);
    }
  }

  @Test
  void roundTrip_everyEntityBecomesOneRow() throws IOException {
    int n = 25;
    for (int i = 0; i < n; i++) {
      EntityId e = world.store.spawn();
      world.store
          .insert(e, world.position, new Position(i, i * 2, i * 3))
          .insert(e, world.health, new Health(100 - i))
          .insert(e, world.name, "unit-" + i)
          .tag(e, world.persist);
    }

    ExportResult result = exporter(config()).export(world.store, world.registry);

    assertThat(result.exports()).hasSize(1);
    ClusterExport export = result.exports().get(0);
    assertThat(export.rowCount()).isEqualTo(n);
    assertThat(export.columnCount()).isEqualTo(3);
    assertThat(export.omittedValues()).isZero();
    assertThat(Fixtures.rowGroups(export.path())).isEqualTo(1);

    Schema schema = IcebergSchemas.fromArrow(export.schema());
    List<Record> records = Fixtures.readRecords(export.path(), schema);
    assertThat(records).hasSize(n);
    for (int i = 0; i < n; i++) {
      Record r = records.get(i);
      assertThat(r.getField("Health")).isEqualTo(100 - i);
      assertThat(r.getField("Name")).isEqualTo("unit-" + i);
      assertThat(((Record) r.getField("Position")).getField("y")).isEqualTo((float) (i * 2));
    }
  }

  @Test
  void unreflectableValue_isOmittedAndExportSucceeds() throws IOException {
    for (int i = 0; i < 3; i++) {
      EntityId e = world.store.spawn();
      world.store
          .insert(e, world.position, new Position(i, i, i))
          .insert(e, world.health, i == 1 ? "corrupt" : new Health(i))
          .tag(e, world.persist);
    }

    ExportResult result = exporter(config()).export(world.store, world.registry);

    ClusterExport export = result.exports().get(0);
    assertThat(export.omittedValues()).isEqualTo(1);
    assertThat(export.droppedRows()).isEqualTo(1);
    assertThat(export.rowCount()).isEqualTo(2);
    List<Record> records =
        Fixtures.readRecords(export.path(), IcebergSchemas.fromArrow(export.schema()));
    assertThat(records).extracting(r -> r.getField("Health")).containsExactly(0, 2);
  }

  @Test
  void unreflectableValue_failsWhenRaggedColumnsAreRejected() {
    for (int i = 0; i < 2; i++) {
      EntityId e = world.store.spawn();
      world.store
          .insert(e, world.position, new Position(i, i, i))
          .insert(e, world.health, i == 1 ? "corrupt" : new Health(i))
          .tag(e, world.persist);
    }
    ExportConfig config = config().toBuilder().raggedColumns(RaggedColumnPolicy.FAIL).build();

    assertThatThrownBy(() -> exporter(config).export(world.store, world.registry))
        .isInstanceOf(ExportException.WriteFailure.class);
  }

  @Test
  void manualClusters_bypassDetection() {
    EntityId e = world.store.spawn();
    world.store
        .insert(e, world.position, new Position(1, 2, 3))
        .insert(e, world.health, new Health(9))
        .tag(e, world.persist);
    EntityId other = world.store.spawn();
    world.store.insert(other, world.health, new Health(1)).tag(other, world.persist);

    ExportConfig config =
        config().toBuilder()
            .clusters(List.of(List.of("game::stats::Health", "game::PersistTag", "game::Nope")))
            .build();
    ExportResult result = exporter(config).export(world.store, world.registry);

    assertThat(result.clusters()).hasSize(1);
    assertThat(result.exports().get(0).rowCount()).isEqualTo(2);
    assertThat(result.exports().get(0).path().getFileName().toString())
        .isEqualTo("world_Health_PersistTag.parquet");
  }

  @Test
  void unregisteredAttributeInManualCluster_isOmittedAndExportCompletes() {
    AttributeId mystery = world.store.attribute("game::Mystery", TypeId.of(999));
    for (int i = 0; i < 2; i++) {
      EntityId e = world.store.spawn();
      world.store
          .insert(e, world.health, new Health(i))
          .insert(e, mystery, "opaque")
          .tag(e, world.persist);
    }
    ExportConfig config =
        config().toBuilder()
            .clusters(List.of(List.of("game::stats::Health", "game::Mystery", "game::PersistTag")))
            .build();

    ExportResult result = exporter(config).export(world.store, world.registry);

    ClusterExport export = result.exports().get(0);
    assertThat(Files.exists(export.path())).isTrue();
    assertThat(export.columnCount()).isEqualTo(2);
    assertThat(export.omittedValues()).isEqualTo(2);
    assertThat(export.droppedRows()).isEqualTo(2);
    assertThat(export.rowCount()).isZero();
  }

  @Test
  void valueOutsideColumnRange_isOmittedNotTruncated() throws IOException {
    Fixtures.Letters w = Fixtures.letters(1);
    AttributeId keep = w.store().marker("t::Keep", TypeId.of(200));
    EntityId big = w.store().spawn();
    w.store().insert(big, w.ids().get(0), 5_000_000_000L).tag(big, keep);
    EntityId small = w.store().spawn();
    w.store().insert(small, w.ids().get(0), 7L).tag(small, keep);
    ExportConfig config =
        config().toBuilder().clusters(List.of(List.of("t::A", "t::Keep"))).build();

    ClusterExport export = exporter(config).export(w.store(), w.registry()).exports().get(0);

    assertThat(export.omittedValues()).isEqualTo(1);
    assertThat(export.rowCount()).isEqualTo(1);
    List<Record> records =
        Fixtures.readRecords(export.path(), IcebergSchemas.fromArrow(export.schema()));
    assertThat(records).extracting(r -> r.getField("A")).containsExactly(7);
  }

  @Test
  void fileNameOverride_andDebugStringEncoding() throws IOException {
    EntityId e = world.store.spawn();
    world.store
        .insert(e, world.position, new Position(1, 2, 3))
        .insert(e, world.health, new Health(5))
        .tag(e, world.persist);

    ExportConfig config =
        config().toBuilder().fileName("snapshot").encoding(ColumnEncoding.DEBUG_STRING).build();
    ClusterExport export = exporter(config).export(world.store, world.registry).exports().get(0);

    assertThat(export.path().getFileName().toString()).isEqualTo("world_snapshot.parquet");
    Record r =
        Fixtures.readRecords(export.path(), IcebergSchemas.fromArrow(export.schema())).get(0);
    assertThat(r.getField("Health")).isEqualTo("5");
    assertThat(r.getField("Position")).isEqualTo("Position { x: 1.0, y: 2.0, z: 3.0 }");
  }

  @Test
  void markerOnlyCluster_isSkipped() {
    EntityId e = world.store.spawn();
    world.store.tag(e, world.persist);

    ExportResult result = exporter(config()).export(world.store, world.registry);

    assertThat(result.clusters()).hasSize(1);
    assertThat(result.exports()).isEmpty();
  }

  @Test
  void unusableOutputPath_isIoFailureAndEarlierFilesRemain() throws IOException {
    EntityId e = world.store.spawn();
    world.store.insert(e, world.position, new Position(1, 2, 3)).tag(e, world.persist);
    Path first = exporter(config()).export(world.store, world.registry).files().get(0);

    Path blocker = Files.writeString(dir.resolve("blocker"), "file");
    ExportConfig broken =
        config().toBuilder().outputPath(blocker.resolve("nested/world").toString()).build();

    assertThatThrownBy(() -> exporter(broken).export(world.store, world.registry))
        .isInstanceOf(ExportException.IoFailure.class);
    assertThat(Files.exists(first)).isTrue();
  }

  @Test
  void seedModeChangesClusters() {
    Fixtures.Letters w = Fixtures.letters(10);
    w.spawn(Fixtures.Letters.range(0, 10));
    w.spawn(Fixtures.Letters.range(0, 9));
    w.spawn(0, 1, 2, 3, 4, 5, 6, 7, 9);
    ExportConfig fixed =
        config().toBuilder()
            .clustering(new ClusteringOptions(0.8d, ClusteringOptions.SeedMode.FIXED_SEED))
            .build();

    assertThat(exporter(config()).export(w.store(), w.registry()).clusters()).hasSize(2);
    assertThat(exporter(fixed).export(w.store(), w.registry()).clusters()).hasSize(1);
  }

  @Test
  void markerValueIsNeverMaterialized() {
    EntityId e = world.store.spawn();
    world.store.insert(e, world.persist, new PersistTag());
    world.store.insert(e, world.health, new Health(3));

    ExportResult result = exporter(config()).export(world.store, world.registry);

    ClusterExport export = result.exports().get(0);
    assertThat(export.rowCount()).isEqualTo(1);
    assertThat(export.schema().getFields()).extracting(Field::getName).containsExactly("Health");
  }

  private ExportConfig config() {
    return ExportConfig.builder().outputPath(dir.resolve("world").toString()).build();
  }

  private static SnapshotExporter exporter(ExportConfig config) {
    return new SnapshotExporter(config);
  }
}
