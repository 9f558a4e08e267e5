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

import ai.floedb.snapcat.store.AttributeId;
import ai.floedb.snapcat.store.memory.InMemoryEntityStore;
import ai.floedb.snapcat.types.ScalarKind;
import ai.floedb.snapcat.types.TypeDescriptor;
import ai.floedb.snapcat.types.TypeId;
import ai.floedb.snapcat.types.TypeRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.hadoop.conf.Configuration;
import org.apache.iceberg.Files;
import org.apache.iceberg.Schema;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.data.parquet.GenericParquetReaders;
import org.apache.iceberg.io.CloseableIterable;
import org.apache.iceberg.parquet.Parquet;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;

/** Shared game-like world used by the export tests. */
public final class Fixtures {

  public record Position(float x, float y, float z) {}

  public record Health(int output) {}

  public record PersistTag() {}

  public static final TypeId POSITION = TypeId.of(1);
  public static final TypeId HEALTH = TypeId.of(2);
  public static final TypeId NAME = TypeId.of(3);
  public static final TypeId PERSIST = TypeId.of(4);

  public final TypeRegistry registry =
      TypeRegistry.builder()
          .registerRecord(POSITION, Position.class)
          .registerRecord(HEALTH, Health.class)
          .register(NAME, TypeDescriptor.opaque("alloc::string::String"))
          .registerRecord(PERSIST, PersistTag.class)
          .build();

  public final InMemoryEntityStore store = new InMemoryEntityStore();
  public final AttributeId position = store.attribute("game::Position", POSITION);
  public final AttributeId health = store.attribute("game::stats::Health", HEALTH);
  public final AttributeId name = store.attribute("game::Name", NAME);
  public final AttributeId persist = store.marker("game::PersistTag", PERSIST);

  /** Store and registry with {@code count} integer attributes named {@code t::A}, {@code t::B}. */
  public static Letters letters(int count) {
    TypeRegistry.Builder registry = TypeRegistry.builder();
    InMemoryEntityStore store = new InMemoryEntityStore();
    List<AttributeId> ids = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      TypeId type = TypeId.of(100 + i);
      registry.register(type, TypeDescriptor.scalar(ScalarKind.I32));
      ids.add(store.attribute("t::" + (char) ('A' + i), type));
    }
    return new Letters(store, registry.build(), ids);
  }

  public record Letters(InMemoryEntityStore store, TypeRegistry registry, List<AttributeId> ids) {

    /** Spawns an entity carrying the attributes at {@code indexes}, all with value 1. */
    public void spawn(int... indexes) {
      var entity = store.spawn();
      for (int i : indexes) {
        store.insert(entity, ids.get(i), 1);
      }
    }

    public static int[] range(int from, int to) {
      int[] out = new int[to - from];
      for (int i = from; i < to; i++) {
        out[i - from] = i;
      }
      return out;
    }
  }

  public static List<Record> readRecords(Path file, Schema schema) throws IOException {
    List<Record> out = new ArrayList<>();
    try (CloseableIterable<Record> records =
        Parquet.read(Files.localInput(file.toFile()))
            .project(schema)
            .createReaderFunc(fileSchema -> GenericParquetReaders.buildReader(schema, fileSchema))
            .build()) {
      for (Record r : records) {
        out.add(r.copy());
      }
    }
    return out;
  }

  public static int rowGroups(Path file) throws IOException {
    try (ParquetFileReader reader =
        ParquetFileReader.open(
            HadoopInputFile.fromPath(
                new org.apache.hadoop.fs.Path(file.toUri()), new Configuration()))) {
      return reader.getRowGroups().size();
    }
  }
}
