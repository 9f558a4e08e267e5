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

import ai.floedb.snapcat.types.DebugFormat;
import ai.floedb.snapcat.types.ReflectionException;
import ai.floedb.snapcat.types.ScalarKind;
import ai.floedb.snapcat.types.ValueView;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * Column layout chosen for one attribute type.
 *
 * <p>A plan answers two questions that must agree with each other: which Arrow field describes the
 * column ({@link #field}), and which column value a reflected {@link ValueView} turns into
 * ({@link #extract}). Column values are plain Java objects that {@link ArrowColumns} knows how to
 * write: boxed scalars, {@link String}, {@code Map<String, Object>} for structs and {@link List}
 * for list items.
 */
public sealed interface ColumnPlan
    permits ColumnPlan.Scalar,
        ColumnPlan.Vec3,
        ColumnPlan.OutputField,
        ColumnPlan.ListOf,
        ColumnPlan.FixedListOf,
        ColumnPlan.Text,
        ColumnPlan.DebugString {

  String ITEM_FIELD = "item";

  /** Arrow field for a column named {@code name}. Top-level columns are always nullable. */
  Field field(String name);

  /**
   * Converts one reflected value into its column value.
   *
   * @throws ReflectionException if the value's shape does not fit this plan
   */
  Object extract(ValueView view);

  /** Fixed-width scalar column. */
  record Scalar(ScalarKind kind) implements ColumnPlan {
    public Scalar {
      Objects.requireNonNull(kind, "kind");
    }

    public ArrowType arrowType() {
      return switch (kind) {
        case F32 -> new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
        case F64 -> new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
        case I32, U32 -> new ArrowType.Int(32, !kind.isUnsigned());
        case I64, U64, ENTITY -> new ArrowType.Int(64, !kind.isUnsigned());
        case BOOL -> ArrowType.Bool.INSTANCE;
      };
    }

    @Override
    public Field field(String name) {
      return new Field(name, FieldType.nullable(arrowType()), List.of());
    }

    @Override
    public Object extract(ValueView view) {
      if (view instanceof ValueView.ScalarValue s && s.kind() == kind) {
        return s.value();
      }
      throw mismatch(kind.typePath(), view);
    }
  }

  /** Struct of three non-null {@code f32} children {@code x, y, z}. */
  record Vec3() implements ColumnPlan {
    private static final List<String> AXES = List.of("x", "y", "z");

    @Override
    public Field field(String name) {
      List<Field> children = new ArrayList<>(AXES.size());
      for (String axis : AXES) {
        children.add(
            new Field(
                axis,
                FieldType.notNullable(new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE)),
                List.of()));
      }
      return new Field(name, FieldType.nullable(ArrowType.Struct.INSTANCE), children);
    }

    @Override
    public Object extract(ValueView view) {
      if (!(view instanceof ValueView.StructValue st)) {
        throw mismatch("vec3", view);
      }
      Map<String, Object> out = new LinkedHashMap<>();
      for (String axis : AXES) {
        ValueView component =
            st.field(axis).orElseThrow(() -> new ReflectionException("vec3 without " + axis));
        if (!(component instanceof ValueView.ScalarValue s) || s.kind() != ScalarKind.F32) {
          throw mismatch("f32", component);
        }
        out.put(axis, s.value());
      }
      return out;
    }
  }

  /** Struct whose {@code output} field stands for the whole value. */
  record OutputField(ColumnPlan inner) implements ColumnPlan {
    public static final String NAME = "output";

    public OutputField {
      Objects.requireNonNull(inner, "inner");
    }

    @Override
    public Field field(String name) {
      return inner.field(name);
    }

    @Override
    public Object extract(ValueView view) {
      return inner.extract(outputOf(view));
    }

    static ValueView outputOf(ValueView view) {
      if (view instanceof ValueView.StructValue st) {
        return st.field(NAME)
            .orElseThrow(() -> new ReflectionException("no output field in " + st.typePath()));
      }
      throw mismatch("struct with output field", view);
    }
  }

  /** Variable-length list of non-null items. */
  record ListOf(ColumnPlan item) implements ColumnPlan {
    public ListOf {
      Objects.requireNonNull(item, "item");
    }

    @Override
    public Field field(String name) {
      return new Field(
          name, FieldType.nullable(ArrowType.List.INSTANCE), List.of(itemField(item)));
    }

    @Override
    public Object extract(ValueView view) {
      return extractItems(item, view);
    }
  }

  /** Fixed-size list; every value must have exactly {@code length} items. */
  record FixedListOf(ColumnPlan item, int length) implements ColumnPlan {
    public FixedListOf {
      Objects.requireNonNull(item, "item");
      if (length < 0) {
        throw new IllegalArgumentException("length must be >= 0");
      }
    }

    @Override
    public Field field(String name) {
      return new Field(
          name,
          FieldType.nullable(new ArrowType.FixedSizeList(length)),
          List.of(itemField(item)));
    }

    @Override
    public Object extract(ValueView view) {
      List<Object> items = extractItems(item, view);
      if (items.size() != length) {
        throw new ReflectionException(
            "fixed-size list length mismatch: expected=" + length + " actual=" + items.size());
      }
      return items;
    }
  }

  /** Utf8 column of an opaque value: strings verbatim, anything else as its debug string. */
  record Text() implements ColumnPlan {
    @Override
    public Field field(String name) {
      return utf8(name);
    }

    @Override
    public Object extract(ValueView view) {
      if (view instanceof ValueView.OpaqueValue o && o.value() instanceof CharSequence text) {
        return text.toString();
      }
      return DebugFormat.of(view);
    }
  }

  /** Utf8 column of a debug string taken from some part of the value. */
  record DebugString(Extraction extraction) implements ColumnPlan {
    public enum Extraction {
      WHOLE,
      FIRST_FIELD,
      OUTPUT_FIELD,
      LIST_ITEMS
    }

    public DebugString {
      Objects.requireNonNull(extraction, "extraction");
    }

    @Override
    public Field field(String name) {
      return utf8(name);
    }

    @Override
    public Object extract(ValueView view) {
      return switch (extraction) {
        case WHOLE -> DebugFormat.of(view);
        case OUTPUT_FIELD -> DebugFormat.of(OutputField.outputOf(view));
        case FIRST_FIELD -> {
          if (view instanceof ValueView.TupleValue t && !t.fields().isEmpty()) {
            yield DebugFormat.of(t.fields().get(0));
          }
          yield DebugFormat.of(view);
        }
        case LIST_ITEMS -> {
          if (view instanceof ValueView.ListValue l) {
            yield DebugFormat.ofItems(l.items());
          }
          throw mismatch("list", view);
        }
      };
    }
  }

  private static Field itemField(ColumnPlan item) {
    Field f = item.field(ITEM_FIELD);
    return new Field(
        ITEM_FIELD,
        new FieldType(false, f.getType(), f.getDictionary(), f.getMetadata()),
        f.getChildren());
  }

  private static Field utf8(String name) {
    return new Field(name, FieldType.nullable(ArrowType.Utf8.INSTANCE), List.of());
  }

  private static List<Object> extractItems(ColumnPlan item, ValueView view) {
    if (!(view instanceof ValueView.ListValue l)) {
      throw mismatch("list", view);
    }
    List<Object> out = new ArrayList<>(l.items().size());
    for (ValueView v : l.items()) {
      out.add(item.extract(v));
    }
    return out;
  }

  private static ReflectionException mismatch(String expected, ValueView actual) {
    return new ReflectionException(
        "value shape " + actual.getClass().getSimpleName() + " does not fit " + expected);
  }
}
