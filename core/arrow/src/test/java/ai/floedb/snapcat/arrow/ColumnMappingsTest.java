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

package ai.floedb.snapcat.arrow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.snapcat.types.ReflectionException;
import ai.floedb.snapcat.types.ScalarKind;
import ai.floedb.snapcat.types.TypeDescriptor;
import ai.floedb.snapcat.types.ValueView;
import java.util.List;
import java.util.Map;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.junit.jupiter.api.Test;

class ColumnMappingsTest {

  private static final TypeDescriptor.StructType HEALTH =
      TypeDescriptor.struct(
          "game::stats::Health",
          TypeDescriptor.field("output", TypeDescriptor.scalar(ScalarKind.I32)));

  @Test
  void scalars_mapToMatchingArrowTypes() {
    assertThat(typedField(TypeDescriptor.scalar(ScalarKind.F32)).getType())
        .isEqualTo(new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE));
    assertThat(typedField(TypeDescriptor.scalar(ScalarKind.U32)).getType())
        .isEqualTo(new ArrowType.Int(32, false));
    assertThat(typedField(TypeDescriptor.scalar(ScalarKind.ENTITY)).getType())
        .isEqualTo(new ArrowType.Int(64, false));
    assertThat(typedField(TypeDescriptor.scalar(ScalarKind.BOOL)).getType())
        .isEqualTo(ArrowType.Bool.INSTANCE);
    assertThat(typedField(TypeDescriptor.scalar(ScalarKind.I64)).isNullable()).isTrue();
  }

  @Test
  void vec3_mapsToStructOfNonNullFloats() {
    Field f = typedField(TypeDescriptor.vec3("game::Position"));

    assertThat(f.getType()).isEqualTo(ArrowType.Struct.INSTANCE);
    assertThat(f.getChildren()).extracting(Field::getName).containsExactly("x", "y", "z");
    assertThat(f.getChildren()).noneMatch(Field::isNullable);
  }

  @Test
  void outputField_unwrapsToInnerType() {
    ColumnPlan plan = ColumnMappings.plan(HEALTH, ColumnEncoding.TYPED);
    ValueView health =
        new ValueView.StructValue(
            HEALTH.typePath(),
            List.of(new ValueView.FieldValue("output", ValueView.scalar(ScalarKind.I32, 75))));

    assertThat(plan.field("Health").getType()).isEqualTo(new ArrowType.Int(32, true));
    assertThat(plan.extract(health)).isEqualTo(75);
  }

  @Test
  void otherKinds_fallBackToUtf8() {
    TypeDescriptor name = TypeDescriptor.opaque("alloc::string::String");
    TypeDescriptor state = new TypeDescriptor.EnumType("game::State", List.of("Idle", "Run"));
    TypeDescriptor tuple =
        new TypeDescriptor.TupleType(
            "game::Score", List.of(TypeDescriptor.scalar(ScalarKind.U32), name));
    TypeDescriptor plain =
        TypeDescriptor.struct(
            "game::Stats", TypeDescriptor.field("hp", TypeDescriptor.scalar(ScalarKind.I32)));

    for (TypeDescriptor d : List.of(name, state, tuple, plain)) {
      assertThat(typedField(d).getType()).isEqualTo(ArrowType.Utf8.INSTANCE);
    }

    ColumnPlan tuplePlan = ColumnMappings.plan(tuple, ColumnEncoding.TYPED);
    ValueView score =
        new ValueView.TupleValue(
            "game::Score",
            List.of(ValueView.scalar(ScalarKind.U32, 9L), new ValueView.OpaqueValue("nine")));
    assertThat(tuplePlan.extract(score)).isEqualTo("9");

    assertThat(ColumnMappings.plan(name, ColumnEncoding.TYPED)
            .extract(new ValueView.OpaqueValue("Alice")))
        .isEqualTo("Alice");
  }

  @Test
  void lists_keepTypedItemsOnlyForScalarsAndVectors() {
    TypeDescriptor ints = TypeDescriptor.list(TypeDescriptor.scalar(ScalarKind.I32));
    TypeDescriptor points = TypeDescriptor.array(TypeDescriptor.vec3("game::Point"), 2);
    TypeDescriptor states =
        TypeDescriptor.list(new TypeDescriptor.EnumType("game::State", List.of()));

    assertThat(typedField(ints).getType()).isEqualTo(ArrowType.List.INSTANCE);
    assertThat(typedField(ints).getChildren().get(0).getType())
        .isEqualTo(new ArrowType.Int(32, true));
    assertThat(typedField(points).getType()).isEqualTo(new ArrowType.FixedSizeList(2));
    assertThat(typedField(points).getChildren().get(0).getType())
        .isEqualTo(ArrowType.Struct.INSTANCE);
    assertThat(typedField(states).getChildren().get(0).getType())
        .isEqualTo(ArrowType.Utf8.INSTANCE);
  }

  @Test
  void fixedList_rejectsWrongLength() {
    ColumnPlan plan =
        ColumnMappings.plan(
            TypeDescriptor.array(TypeDescriptor.scalar(ScalarKind.F64), 3), ColumnEncoding.TYPED);

    assertThatThrownBy(
            () ->
                plan.extract(
                    new ValueView.ListValue(List.of(ValueView.scalar(ScalarKind.F64, 1.0)))))
        .isInstanceOf(ReflectionException.class)
        .hasMessageContaining("length mismatch");
  }

  @Test
  void vec3_extractsAxisMap() {
    ColumnPlan plan =
        ColumnMappings.plan(TypeDescriptor.vec3("game::Position"), ColumnEncoding.TYPED);
    ValueView pos =
        new ValueView.StructValue(
            "game::Position",
            List.of(
                new ValueView.FieldValue("x", ValueView.scalar(ScalarKind.F32, 1f)),
                new ValueView.FieldValue("y", ValueView.scalar(ScalarKind.F32, 2f)),
                new ValueView.FieldValue("z", ValueView.scalar(ScalarKind.F32, 3f))));

    assertThat(plan.extract(pos)).isEqualTo(Map.of("x", 1f, "y", 2f, "z", 3f));
  }

  @Test
  void scalarPlan_rejectsOtherKinds() {
    ColumnPlan plan =
        ColumnMappings.plan(TypeDescriptor.scalar(ScalarKind.I32), ColumnEncoding.TYPED);

    assertThatThrownBy(() -> plan.extract(ValueView.scalar(ScalarKind.I64, 1L)))
        .isInstanceOf(ReflectionException.class);
  }

  @Test
  void debugStringEncoding_stringifiesEveryKind() {
    TypeDescriptor ints = TypeDescriptor.list(TypeDescriptor.scalar(ScalarKind.I32));
    ColumnPlan health = ColumnMappings.plan(HEALTH, ColumnEncoding.DEBUG_STRING);
    ColumnPlan list = ColumnMappings.plan(ints, ColumnEncoding.DEBUG_STRING);
    ColumnPlan scalar =
        ColumnMappings.plan(TypeDescriptor.scalar(ScalarKind.F64), ColumnEncoding.DEBUG_STRING);

    assertThat(health.field("Health").getType()).isEqualTo(ArrowType.Utf8.INSTANCE);
    assertThat(list.field("Ids").getType()).isEqualTo(ArrowType.Utf8.INSTANCE);
    assertThat(
            health.extract(
                new ValueView.StructValue(
                    HEALTH.typePath(),
                    List.of(
                        new ValueView.FieldValue(
                            "output", ValueView.scalar(ScalarKind.I32, 5))))))
        .isEqualTo("5");
    assertThat(
            list.extract(
                new ValueView.ListValue(
                    List.of(
                        ValueView.scalar(ScalarKind.I32, 1), ValueView.scalar(ScalarKind.I32, 2)))))
        .isEqualTo("[1, 2]");
    assertThat(scalar.extract(ValueView.scalar(ScalarKind.F64, 0.5))).isEqualTo("0.5");
  }

  private static Field typedField(TypeDescriptor d) {
    return ColumnMappings.plan(d, ColumnEncoding.TYPED).field("col");
  }
}
