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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Generic, read-only view of one live value, produced by a {@link Reflector}. */
public sealed interface ValueView
    permits ValueView.ScalarValue,
        ValueView.OpaqueValue,
        ValueView.StructValue,
        ValueView.TupleValue,
        ValueView.EnumValue,
        ValueView.ListValue,
        ValueView.MapValue {

  /** A scalar in the canonical carrier type of its kind (see {@link ScalarKind#coerce}). */
  record ScalarValue(ScalarKind kind, Object value) implements ValueView {
    public ScalarValue {
      Objects.requireNonNull(kind, "kind");
      value = kind.coerce(value);
    }
  }

  record OpaqueValue(Object value) implements ValueView {}

  record FieldValue(String name, ValueView value) {
    public FieldValue {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(value, "value");
    }
  }

  record StructValue(String typePath, List<FieldValue> fields) implements ValueView {
    public StructValue {
      Objects.requireNonNull(typePath, "typePath");
      fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public Optional<ValueView> field(String name) {
      for (FieldValue f : fields) {
        if (f.name().equals(name)) {
          return Optional.of(f.value());
        }
      }
      return Optional.empty();
    }
  }

  record TupleValue(String typePath, List<ValueView> fields) implements ValueView {
    public TupleValue {
      Objects.requireNonNull(typePath, "typePath");
      fields = fields == null ? List.of() : List.copyOf(fields);
    }
  }

  record EnumValue(String typePath, String variant, List<ValueView> payload)
      implements ValueView {
    public EnumValue {
      Objects.requireNonNull(typePath, "typePath");
      Objects.requireNonNull(variant, "variant");
      payload = payload == null ? List.of() : List.copyOf(payload);
    }
  }

  /** List or fixed-size array items, in order. */
  record ListValue(List<ValueView> items) implements ValueView {
    public ListValue {
      items = items == null ? List.of() : List.copyOf(items);
    }
  }

  record MapValue(Map<ValueView, ValueView> entries) implements ValueView {
    public MapValue {
      entries =
          entries == null
              ? Map.of()
              : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
  }

  static ScalarValue scalar(ScalarKind kind, Object value) {
    return new ScalarValue(kind, value);
  }
}
