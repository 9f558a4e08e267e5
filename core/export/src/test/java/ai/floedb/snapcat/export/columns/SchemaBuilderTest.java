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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.snapcat.arrow.ColumnEncoding;
import ai.floedb.snapcat.export.ExportException;
import ai.floedb.snapcat.export.Fixtures;
import ai.floedb.snapcat.export.cluster.AttributeCluster;
import ai.floedb.snapcat.export.cluster.ClusterAttribute;
import ai.floedb.snapcat.store.AttributeId;
import ai.floedb.snapcat.types.TypeId;
import java.util.List;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.Test;

class SchemaBuilderTest {

  private final Fixtures world = new Fixtures();

  @Test
  void build_skipsMarkersAndKeepsClusterOrder() {
    AttributeCluster cluster =
        cluster(
            attr("game::Position", world.position),
            attr("game::PersistTag", world.persist),
            attr("game::stats::Health", world.health),
            attr("game::Name", world.name));

    ClusterSchema schema = schemaBuilder(ColumnEncoding.TYPED).build(cluster);
    Schema arrow = schema.arrowSchema();

    assertThat(arrow.getFields()).extracting(Field::getName)
        .containsExactly("Position", "Health", "Name");
    assertThat(schema.markers()).extracting(ClusterAttribute::name)
        .containsExactly("game::PersistTag");
    assertThat(arrow.getFields().get(0).getType()).isEqualTo(ArrowType.Struct.INSTANCE);
    assertThat(arrow.getFields().get(1).getType()).isEqualTo(new ArrowType.Int(32, true));
    assertThat(arrow.getFields().get(2).getType()).isEqualTo(ArrowType.Utf8.INSTANCE);
    assertThat(arrow.getFields()).allMatch(Field::isNullable);
  }

  @Test
  void build_debugStringEncodingUsesUtf8Everywhere() {
    ClusterSchema schema =
        schemaBuilder(ColumnEncoding.DEBUG_STRING)
            .build(
                cluster(
                    attr("game::Position", world.position),
                    attr("game::stats::Health", world.health)));

    assertThat(schema.arrowSchema().getFields())
        .extracting(Field::getType)
        .containsOnly(ArrowType.Utf8.INSTANCE);
  }

  @Test
  void build_suffixesDuplicateShortNames() {
    AttributeId otherHealth = world.store.attribute("ui::Health", Fixtures.HEALTH);

    ClusterSchema schema =
        schemaBuilder(ColumnEncoding.TYPED)
            .build(
                cluster(
                    attr("game::stats::Health", world.health),
                    attr("ui::Health", otherHealth)));

    assertThat(schema.columns()).extracting(ColumnSpec::columnName)
        .containsExactly("Health", "Health_2");
  }

  @Test
  void build_unregisteredTypeFallsBackToUtf8() {
    AttributeId loose = world.store.attribute("game::Loose", TypeId.of(999));
    AttributeId untyped = world.store.untyped("game::Untyped");

    ClusterSchema schema =
        schemaBuilder(ColumnEncoding.TYPED)
            .build(cluster(attr("game::Loose", loose), attr("game::Untyped", untyped)));

    assertThat(schema.arrowSchema().getFields())
        .extracting(Field::getType)
        .containsExactly(ArrowType.Utf8.INSTANCE, ArrowType.Utf8.INSTANCE);
  }

  @Test
  void build_unknownAttributeIsSerializationFailure() {
    AttributeCluster cluster = cluster(attr("game::Ghost", AttributeId.of(77)));

    assertThatThrownBy(() -> schemaBuilder(ColumnEncoding.TYPED).build(cluster))
        .isInstanceOf(ExportException.SerializationFailure.class)
        .hasMessageContaining("game::Ghost");
  }

  private SchemaBuilder schemaBuilder(ColumnEncoding encoding) {
    return new SchemaBuilder(world.store, world.registry, encoding);
  }

  static ClusterAttribute attr(String name, AttributeId id) {
    return new ClusterAttribute(name, id);
  }

  static AttributeCluster cluster(ClusterAttribute... attributes) {
    return new AttributeCluster(List.of(attributes));
  }
}
