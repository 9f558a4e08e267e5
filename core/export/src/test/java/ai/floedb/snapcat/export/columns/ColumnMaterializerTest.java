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

import static ai.floedb.snapcat.export.columns.SchemaBuilderTest.attr;
import static ai.floedb.snapcat.export.columns.SchemaBuilderTest.cluster;
import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.snapcat.arrow.ColumnEncoding;
import ai.floedb.snapcat.export.Fixtures;
import ai.floedb.snapcat.export.Fixtures.Health;
import ai.floedb.snapcat.export.Fixtures.Position;
import ai.floedb.snapcat.store.AttributeId;
import ai.floedb.snapcat.store.EntityId;
import ai.floedb.snapcat.types.ScalarKind;
import ai.floedb.snapcat.types.TypeDescriptor;
import ai.floedb.snapcat.types.TypeId;
import ai.floedb.snapcat.types.TypeRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ColumnMaterializerTest {

  private final Fixtures world = new Fixtures();
  private ClusterSchema schema;
  private ColumnMaterializer materializer;

  @BeforeEach
  void setUp() {
    schema =
        new SchemaBuilder(world.store, world.registry, ColumnEncoding.TYPED)
            .build(
                cluster(
                    attr("game::Position", world.position),
                    attr("game::stats::Health", world.health),
                    attr("game::PersistTag", world.persist)));
    materializer = new ColumnMaterializer(world.store, world.registry);
  }

  @Test
  void qualifying_requiresEveryValueAttributeButNoMarker() {
    EntityId full = spawn(new Position(1, 2, 3), new Health(10));
    EntityId untagged = spawn(new Position(4, 5, 6), new Health(20));
    world.store.tag(full, world.persist);
    EntityId partial = world.store.spawn();
    world.store.insert(partial, world.position, new Position(0, 0, 0));

    assertThat(materializer.qualifying(schema)).containsExactly(full, untagged);
  }

  @Test
  void materialize_producesTypedValues() {
    EntityId a = spawn(new Position(1, 2, 3), new Health(10));
    EntityId b = spawn(new Position(4, 5, 6), new Health(20));

    MaterializedColumn positions = materializer.materialize(schema.columns().get(0), List.of(a, b));
    MaterializedColumn health = materializer.materialize(schema.columns().get(1), List.of(a, b));

    assertThat(positions.values())
        .containsExactly(Map.of("x", 1f, "y", 2f, "z", 3f), Map.of("x", 4f, "y", 5f, "z", 6f));
    assertThat(health.values()).containsExactly(10, 20);
    assertThat(health.entities()).containsExactly(a, b);
    assertThat(health.omitted()).isZero();
  }

  @Test
  void materialize_omitsValuesThatFailToReflect() {
    EntityId a = spawn(new Position(1, 2, 3), new Health(10));
    EntityId broken = world.store.spawn();
    world.store.insert(broken, world.position, new Position(0, 0, 0));
    world.store.insert(broken, world.health, "not a health value");
    EntityId c = spawn(new Position(7, 8, 9), new Health(30));

    MaterializedColumn health =
        materializer.materialize(schema.columns().get(1), List.of(a, broken, c));

    assertThat(health.values()).containsExactly(10, 30);
    assertThat(health.entities()).containsExactly(a, c);
    assertThat(health.omitted()).isEqualTo(1);
  }

  @Test
  void materialize_omitsMissingAttributes() {
    EntityId a = spawn(new Position(1, 2, 3), new Health(10));
    EntityId gone = spawn(new Position(1, 1, 1), new Health(1));
    world.store.remove(gone, world.health);

    MaterializedColumn health = materializer.materialize(schema.columns().get(1), List.of(a, gone));

    assertThat(health.size()).isEqualTo(1);
    assertThat(health.omitted()).isEqualTo(1);
  }

  @Test
  void materialize_omitsValuesWithoutUsableType() {
    TypeId sealed = TypeId.of(50);
    TypeRegistry registry =
        TypeRegistry.builder()
            .registerRecord(Fixtures.HEALTH, Health.class)
            .registerWithoutReflector(sealed, TypeDescriptor.scalar(ScalarKind.I32))
            .build();
    AttributeId unregistered = world.store.attribute("game::Mystery", TypeId.of(999));
    AttributeId untyped = world.store.untyped("game::Blob");
    AttributeId unreflectable = world.store.attribute("game::Sealed", sealed);
    EntityId a = world.store.spawn();
    EntityId b = world.store.spawn();
    for (EntityId e : List.of(a, b)) {
      world.store
          .insert(e, world.health, new Health(1))
          .insert(e, unregistered, 1)
          .insert(e, untyped, "blob")
          .insert(e, unreflectable, 2);
    }
    ClusterSchema mixed =
        new SchemaBuilder(world.store, registry, ColumnEncoding.TYPED)
            .build(
                cluster(
                    attr("game::stats::Health", world.health),
                    attr("game::Mystery", unregistered),
                    attr("game::Blob", untyped),
                    attr("game::Sealed", unreflectable)));
    ColumnMaterializer typed = new ColumnMaterializer(world.store, registry);

    List<EntityId> rows = typed.qualifying(mixed);

    assertThat(rows).containsExactly(a, b);
    assertThat(typed.materialize(mixed.columns().get(0), rows).values()).containsExactly(1, 1);
    for (ColumnSpec column : mixed.columns().subList(1, 4)) {
      MaterializedColumn out = typed.materialize(column, rows);
      assertThat(out.values()).as(column.columnName()).isEmpty();
      assertThat(out.entities()).as(column.columnName()).isEmpty();
      assertThat(out.omitted()).as(column.columnName()).isEqualTo(2);
    }
  }

  private EntityId spawn(Position position, Health health) {
    EntityId e = world.store.spawn();
    world.store.insert(e, world.position, position).insert(e, world.health, health);
    return e;
  }
}
