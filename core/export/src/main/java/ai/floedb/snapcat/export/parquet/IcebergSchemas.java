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

package ai.floedb.snapcat.export.parquet;

import ai.floedb.snapcat.arrow.ArrowColumns;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.iceberg.Schema;
import org.apache.iceberg.data.GenericRecord;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.types.Type;
import org.apache.iceberg.types.Types;

/**
 * Arrow to Iceberg schema and row conversion for the Parquet writer.
 *
 * <p>Unsigned 32-bit ints widen to Iceberg {@code long}. Unsigned 64-bit ints are stored in {@code
 * long} with their bit pattern unchanged. Fixed-size lists become plain lists. Field ids are
 * assigned depth first, starting at 1.
 */
public final class IcebergSchemas {

  private IcebergSchemas() {}

  public static Schema fromArrow(org.apache.arrow.vector.types.pojo.Schema arrow) {
    AtomicInteger ids = new AtomicInteger(0);
    List<Types.NestedField> fields = new ArrayList<>(arrow.getFields().size());
    for (Field field : arrow.getFields()) {
      fields.add(nestedField(field, ids));
    }
    return new Schema(fields);
  }

  private static Types.NestedField nestedField(Field field, AtomicInteger ids) {
    int id = ids.incrementAndGet();
    Type type = type(field, ids);
    return field.isNullable()
        ? Types.NestedField.optional(id, field.getName(), type)
        : Types.NestedField.required(id, field.getName(), type);
  }

  private static Type type(Field field, AtomicInteger ids) {
    ArrowType arrow = field.getType();
    if (arrow instanceof ArrowType.Int i) {
      return i.getBitWidth() == 32 && i.getIsSigned()
          ? Types.IntegerType.get()
          : Types.LongType.get();
    }
    if (arrow instanceof ArrowType.FloatingPoint fp) {
      return fp.getPrecision() == FloatingPointPrecision.SINGLE
          ? Types.FloatType.get()
          : Types.DoubleType.get();
    }
    if (arrow instanceof ArrowType.Bool) {
      return Types.BooleanType.get();
    }
    if (arrow instanceof ArrowType.Utf8) {
      return Types.StringType.get();
    }
    if (arrow instanceof ArrowType.Struct) {
      List<Types.NestedField> children = new ArrayList<>(field.getChildren().size());
      for (Field child : field.getChildren()) {
        children.add(nestedField(child, ids));
      }
      return Types.StructType.of(children);
    }
    if (arrow instanceof ArrowType.List || arrow instanceof ArrowType.FixedSizeList) {
      Field item = field.getChildren().get(0);
      int elementId = ids.incrementAndGet();
      Type element = type(item, ids);
      return item.isNullable()
          ? Types.ListType.ofOptional(elementId, element)
          : Types.ListType.ofRequired(elementId, element);
    }
    throw new IllegalArgumentException(
        "unsupported Arrow type for column " + field.getName() + ": " + arrow);
  }

  /** Row {@code row} of {@code root} as an Iceberg record of {@code schema}. */
  public static Record toRecord(VectorSchemaRoot root, int row, Schema schema) {
    GenericRecord record = GenericRecord.create(schema);
    for (FieldVector vector : root.getFieldVectors()) {
      Types.NestedField field = schema.findField(vector.getName());
      record.setField(vector.getName(), convert(ArrowColumns.read(vector, row), field.type()));
    }
    return record;
  }

  private static Object convert(Object value, Type type) {
    if (value == null) {
      return null;
    }
    if (type.isStructType() && value instanceof Map<?, ?> fields) {
      Types.StructType struct = type.asStructType();
      GenericRecord record = GenericRecord.create(struct);
      for (Types.NestedField child : struct.fields()) {
        record.setField(child.name(), convert(fields.get(child.name()), child.type()));
      }
      return record;
    }
    if (type.isListType() && value instanceof List<?> items) {
      Type element = type.asListType().elementType();
      List<Object> out = new ArrayList<>(items.size());
      for (Object item : items) {
        out.add(convert(item, element));
      }
      return out;
    }
    if (type.typeId() == Type.TypeID.LONG && value instanceof Number n) {
      return n.longValue();
    }
    return value;
  }
}
