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

package ai.floedb.snapcat.types;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime shape of a registered type.
 *
 * <p>The set of variants is closed; consumers dispatch on it exhaustively. Nested types (struct
 * fields, list items) are described inline. A nested type the registry could not resolve is
 * represented by {@link UnresolvedType}.
 */
public sealed interface TypeDescriptor
    permits TypeDescriptor.ScalarType,
        TypeDescriptor.OpaqueType,
        TypeDescriptor.StructType,
        TypeDescriptor.TupleType,
        TypeDescriptor.EnumType,
        TypeDescriptor.ListType,
        TypeDescriptor.ArrayType,
        TypeDescriptor.MapType,
        TypeDescriptor.UnresolvedType {

  /** Fully qualified type path, e.g. {@code game::stats::Health} or {@code com.acme.Health}. */
  String typePath();

  /** Fixed-width numeric or boolean value. */
  record ScalarType(String typePath, ScalarKind kind) implements TypeDescriptor {
    public ScalarType {
      Objects.requireNonNull(typePath, "typePath");
      Objects.requireNonNull(kind, "kind");
    }
  }

  /** Leaf value with no columnar counterpart (strings, decimals, handles, ...). */
  record OpaqueType(String typePath) implements TypeDescriptor {
    public OpaqueType {
      Objects.requireNonNull(typePath, "typePath");
    }
  }

  record NamedField(String name, TypeDescriptor type) {
    public NamedField {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
    }
  }

  /** Struct with named fields. A struct with no fields is a zero-size marker. */
  record StructType(String typePath, List<NamedField> fields) implements TypeDescriptor {
    public StructType {
      Objects.requireNonNull(typePath, "typePath");
      fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public Optional<TypeDescriptor> field(String name) {
      for (NamedField f : fields) {
        if (f.name().equals(name)) {
          return Optional.of(f.type());
        }
      }
      return Optional.empty();
    }

    /** True for a 3-component float vector: exactly fields {@code x, y, z}, all {@code f32}. */
    public boolean isVec3() {
      if (fields.size() != 3) {
        return false;
      }
      String[] names = {"x", "y", "z"};
      for (int i = 0; i < 3; i++) {
        NamedField f = fields.get(i);
        if (!f.name().equals(names[i])
            || !(f.type() instanceof ScalarType s)
            || s.kind() != ScalarKind.F32) {
          return false;
        }
      }
      return true;
    }
  }

  /** Positional fields: a tuple, or a tuple struct when {@code typePath} names a type. */
  record TupleType(String typePath, List<TypeDescriptor> fields) implements TypeDescriptor {
    public TupleType {
      Objects.requireNonNull(typePath, "typePath");
      fields = fields == null ? List.of() : List.copyOf(fields);
    }
  }

  record EnumType(String typePath, List<String> variants) implements TypeDescriptor {
    public EnumType {
      Objects.requireNonNull(typePath, "typePath");
      variants = variants == null ? List.of() : List.copyOf(variants);
    }
  }

  /** Variable-length sequence. */
  record ListType(String typePath, TypeDescriptor item) implements TypeDescriptor {
    public ListType {
      Objects.requireNonNull(typePath, "typePath");
      Objects.requireNonNull(item, "item");
    }
  }

  /** Fixed-length sequence. */
  record ArrayType(String typePath, TypeDescriptor item, int length) implements TypeDescriptor {
    public ArrayType {
      Objects.requireNonNull(typePath, "typePath");
      Objects.requireNonNull(item, "item");
      if (length < 0) {
        throw new IllegalArgumentException("array length must be >= 0");
      }
    }
  }

  record MapType(String typePath, TypeDescriptor key, TypeDescriptor value)
      implements TypeDescriptor {
    public MapType {
      Objects.requireNonNull(typePath, "typePath");
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
    }
  }

  /** A nested type the registry has no registration for. */
  record UnresolvedType(String typePath) implements TypeDescriptor {
    public UnresolvedType {
      Objects.requireNonNull(typePath, "typePath");
    }
  }

  static ScalarType scalar(ScalarKind kind) {
    return new ScalarType(kind.typePath(), kind);
  }

  static OpaqueType opaque(String typePath) {
    return new OpaqueType(typePath);
  }

  static StructType struct(String typePath, NamedField... fields) {
    return new StructType(typePath, List.of(fields));
  }

  static NamedField field(String name, TypeDescriptor type) {
    return new NamedField(name, type);
  }

  static StructType vec3(String typePath) {
    return struct(
        typePath,
        field("x", scalar(ScalarKind.F32)),
        field("y", scalar(ScalarKind.F32)),
        field("z", scalar(ScalarKind.F32)));
  }

  static ListType list(TypeDescriptor item) {
    return new ListType("list<" + item.typePath() + ">", item);
  }

  static ArrayType array(TypeDescriptor item, int length) {
    return new ArrayType("[" + item.typePath() + "; " + length + "]", item, length);
  }
}
