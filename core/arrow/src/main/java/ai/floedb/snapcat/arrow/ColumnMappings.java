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

import ai.floedb.snapcat.arrow.ColumnPlan.DebugString.Extraction;
import ai.floedb.snapcat.types.TypeDescriptor;
import java.util.Objects;

/**
 * The per-kind column mapping table.
 *
 * <p>Typed encoding:
 *
 * <pre>
 *   scalar f32 / f64 / i32 / i64 / u32 / u64 / bool / entity   matching Arrow scalar
 *   struct {x: f32, y: f32, z: f32}                            Struct of non-null f32
 *   struct with an "output" field                              mapping of that field
 *   opaque                                                     Utf8 (text)
 *   tuple                                                      Utf8 (first field)
 *   list / fixed-size array                                    List / FixedSizeList of item
 *   anything else                                              Utf8 (debug string)
 * </pre>
 *
 * List items map to typed children only when they are scalars or vec3 structs; other items become
 * Utf8.
 */
public final class ColumnMappings {

  private static final ColumnPlan WHOLE = new ColumnPlan.DebugString(Extraction.WHOLE);

  private ColumnMappings() {}

  public static ColumnPlan plan(TypeDescriptor descriptor, ColumnEncoding encoding) {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(encoding, "encoding");
    return encoding == ColumnEncoding.DEBUG_STRING ? debugPlan(descriptor) : typedPlan(descriptor);
  }

  /** Plan for an attribute whose type is unknown to the registry. */
  public static ColumnPlan unresolved() {
    return WHOLE;
  }

  private static ColumnPlan typedPlan(TypeDescriptor d) {
    if (d instanceof TypeDescriptor.ScalarType s) {
      return new ColumnPlan.Scalar(s.kind());
    }
    if (d instanceof TypeDescriptor.StructType st) {
      if (st.isVec3()) {
        return new ColumnPlan.Vec3();
      }
      return st.field(ColumnPlan.OutputField.NAME)
          .<ColumnPlan>map(output -> new ColumnPlan.OutputField(typedPlan(output)))
          .orElse(WHOLE);
    }
    if (d instanceof TypeDescriptor.OpaqueType) {
      return new ColumnPlan.Text();
    }
    if (d instanceof TypeDescriptor.TupleType) {
      return new ColumnPlan.DebugString(Extraction.FIRST_FIELD);
    }
    if (d instanceof TypeDescriptor.ListType l) {
      return new ColumnPlan.ListOf(itemPlan(l.item()));
    }
    if (d instanceof TypeDescriptor.ArrayType a) {
      return new ColumnPlan.FixedListOf(itemPlan(a.item()), a.length());
    }
    // enums, maps, unresolved
    return WHOLE;
  }

  private static ColumnPlan itemPlan(TypeDescriptor item) {
    if (item instanceof TypeDescriptor.ScalarType s) {
      return new ColumnPlan.Scalar(s.kind());
    }
    if (item instanceof TypeDescriptor.StructType st && st.isVec3()) {
      return new ColumnPlan.Vec3();
    }
    if (item instanceof TypeDescriptor.OpaqueType) {
      return new ColumnPlan.Text();
    }
    return WHOLE;
  }

  private static ColumnPlan debugPlan(TypeDescriptor d) {
    if (d instanceof TypeDescriptor.StructType st
        && st.field(ColumnPlan.OutputField.NAME).isPresent()) {
      return new ColumnPlan.DebugString(Extraction.OUTPUT_FIELD);
    }
    if (d instanceof TypeDescriptor.TupleType) {
      return new ColumnPlan.DebugString(Extraction.FIRST_FIELD);
    }
    if (d instanceof TypeDescriptor.ListType || d instanceof TypeDescriptor.ArrayType) {
      return new ColumnPlan.DebugString(Extraction.LIST_ITEMS);
    }
    return WHOLE;
  }
}
