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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.FixedSizeListVector;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.complex.StructVector;

/**
 * Moves column values (as produced by {@link ColumnPlan#extract}) into and out of Arrow vectors.
 *
 * <p>Supported vectors: Utf8, signed and unsigned 32/64-bit ints, single and double floats,
 * booleans, structs (values are {@code Map<String, ?>} keyed by child name), lists and fixed-size
 * lists (values are {@link List}s).
 */
public final class ArrowColumns {

  private ArrowColumns() {}

  /**
   * Writes {@code columns} into the vectors of {@code root}, column {@code i} into field vector
   * {@code i}. All columns must have the same length, which becomes the row count.
   */
  public static VectorSchemaRoot fill(VectorSchemaRoot root, List<? extends List<?>> columns) {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(columns, "columns");

    List<FieldVector> vectors = root.getFieldVectors();
    if (columns.size() != vectors.size()) {
      throw new IllegalArgumentException(
          "column count mismatch: expected=" + vectors.size() + " actual=" + columns.size());
    }
    int rowCount = columns.isEmpty() ? 0 : columns.get(0).size();
    for (int column = 0; column < columns.size(); column++) {
      int length = columns.get(column).size();
      if (length != rowCount) {
        throw new IllegalArgumentException(
            "column length mismatch for "
                + vectors.get(column).getName()
                + ": expected="
                + rowCount
                + " actual="
                + length);
      }
    }

    for (FieldVector vector : vectors) {
      vector.setInitialCapacity(rowCount);
      vector.allocateNew();
    }
    for (int column = 0; column < columns.size(); column++) {
      FieldVector vector = vectors.get(column);
      List<?> values = columns.get(column);
      for (int row = 0; row < rowCount; row++) {
        writeValue(vector, row, values.get(row));
      }
      vector.setValueCount(rowCount);
    }
    root.setRowCount(rowCount);
    return root;
  }

  /** Reads one value back in the same representation {@link #fill} accepts. */
  public static Object read(FieldVector vector, int index) {
    if (vector.isNull(index)) {
      return null;
    }
    if (vector instanceof VarCharVector varChar) {
      return new String(varChar.get(index), StandardCharsets.UTF_8);
    }
    if (vector instanceof IntVector intVec) {
      return intVec.get(index);
    }
    if (vector instanceof BigIntVector bigInt) {
      return bigInt.get(index);
    }
    if (vector instanceof UInt4Vector uint4) {
      return uint4.getValueAsLong(index);
    }
    if (vector instanceof UInt8Vector uint8) {
      return uint8.get(index);
    }
    if (vector instanceof Float4Vector float4) {
      return float4.get(index);
    }
    if (vector instanceof Float8Vector float8) {
      return float8.get(index);
    }
    if (vector instanceof BitVector bit) {
      return bit.get(index) == 1;
    }
    if (vector instanceof StructVector struct) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (FieldVector child : struct.getChildrenFromFields()) {
        out.put(child.getName(), read(child, index));
      }
      return out;
    }
    if (vector instanceof ListVector list) {
      FieldVector data = list.getDataVector();
      int start = list.getElementStartIndex(index);
      int end = list.getElementEndIndex(index);
      List<Object> out = new ArrayList<>(end - start);
      for (int i = start; i < end; i++) {
        out.add(read(data, i));
      }
      return out;
    }
    if (vector instanceof FixedSizeListVector fixed) {
      FieldVector data = fixed.getDataVector();
      int size = fixed.getListSize();
      List<Object> out = new ArrayList<>(size);
      for (int i = 0; i < size; i++) {
        out.add(read(data, index * size + i));
      }
      return out;
    }
    throw new IllegalArgumentException(
        "unsupported vector type " + vector.getClass().getSimpleName());
  }

  private static void writeValue(FieldVector vector, int idx, Object value) {
    if (value == null) {
      vector.setNull(idx);
      return;
    }
    if (vector instanceof VarCharVector varChar) {
      varChar.setSafe(idx, value.toString().getBytes(StandardCharsets.UTF_8));
      return;
    }
    if (vector instanceof IntVector intVec) {
      intVec.setSafe(idx, number(value, vector).intValue());
      return;
    }
    if (vector instanceof BigIntVector bigInt) {
      bigInt.setSafe(idx, number(value, vector).longValue());
      return;
    }
    if (vector instanceof UInt4Vector uint4) {
      // u32 values arrive widened to long; the low 32 bits are the unsigned value.
      uint4.setSafe(idx, (int) number(value, vector).longValue());
      return;
    }
    if (vector instanceof UInt8Vector uint8) {
      uint8.setSafe(idx, number(value, vector).longValue());
      return;
    }
    if (vector instanceof Float4Vector float4) {
      float4.setSafe(idx, number(value, vector).floatValue());
      return;
    }
    if (vector instanceof Float8Vector float8) {
      float8.setSafe(idx, number(value, vector).doubleValue());
      return;
    }
    if (vector instanceof BitVector bit) {
      if (!(value instanceof Boolean b)) {
        throw new IllegalArgumentException(
            "BOOL value must be Boolean for " + vector.getName() + ", got " + typeOf(value));
      }
      bit.setSafe(idx, b ? 1 : 0);
      return;
    }
    if (vector instanceof StructVector struct) {
      if (!(value instanceof Map<?, ?> fields)) {
        throw new IllegalArgumentException(
            "STRUCT value must be a Map for " + vector.getName() + ", got " + typeOf(value));
      }
      struct.setIndexDefined(idx);
      for (FieldVector child : struct.getChildrenFromFields()) {
        if (!fields.containsKey(child.getName())) {
          throw new IllegalArgumentException(
              "STRUCT value for " + vector.getName() + " has no field " + child.getName());
        }
        writeValue(child, idx, fields.get(child.getName()));
      }
      return;
    }
    if (vector instanceof ListVector list) {
      List<?> items = items(value, vector);
      FieldVector data = list.getDataVector();
      int start = list.startNewValue(idx);
      for (int i = 0; i < items.size(); i++) {
        writeValue(data, start + i, items.get(i));
      }
      list.endValue(idx, items.size());
      return;
    }
    if (vector instanceof FixedSizeListVector fixed) {
      List<?> items = items(value, vector);
      int size = fixed.getListSize();
      if (items.size() != size) {
        throw new IllegalArgumentException(
            "fixed-size list length mismatch for "
                + vector.getName()
                + ": expected="
                + size
                + " actual="
                + items.size());
      }
      fixed.setNotNull(idx);
      FieldVector data = fixed.getDataVector();
      for (int i = 0; i < size; i++) {
        writeValue(data, idx * size + i, items.get(i));
      }
      return;
    }
    throw new IllegalArgumentException(
        "unsupported vector type " + vector.getClass().getSimpleName());
  }

  private static Number number(Object value, FieldVector vector) {
    if (value instanceof Number n) {
      return n;
    }
    throw new IllegalArgumentException(
        "numeric value expected for " + vector.getName() + ", got " + typeOf(value));
  }

  private static List<?> items(Object value, FieldVector vector) {
    if (value instanceof List<?> items) {
      return items;
    }
    throw new IllegalArgumentException(
        "LIST value must be a List for " + vector.getName() + ", got " + typeOf(value));
  }

  private static String typeOf(Object value) {
    return value.getClass().getSimpleName();
  }
}
