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

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptor-driven reflection over plain Java values.
 *
 * <p>Accepted carriers per descriptor kind:
 *
 * <ul>
 *   <li>scalar: {@link Number} ({@link Boolean} for {@code bool})
 *   <li>struct: a {@link Record} or a {@code Map<String, ?>} keyed by field name
 *   <li>tuple: a {@link List}, an {@code Object[]} or a {@link Record} (positional)
 *   <li>enum: a Java {@link Enum} or a variant name
 *   <li>list / array: an {@link Iterable} or a Java array
 *   <li>map: a {@link Map}
 *   <li>opaque and unresolved: anything
 * </ul>
 */
public final class Reflectors {

  private Reflectors() {}

  public static Reflector of(TypeDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    return raw -> view(descriptor, raw);
  }

  public static ValueView view(TypeDescriptor descriptor, Object raw) {
    if (raw == null) {
      throw new ReflectionException("null value for " + descriptor.typePath());
    }
    if (descriptor instanceof TypeDescriptor.ScalarType s) {
      return new ValueView.ScalarValue(s.kind(), raw);
    }
    if (descriptor instanceof TypeDescriptor.OpaqueType
        || descriptor instanceof TypeDescriptor.UnresolvedType) {
      return new ValueView.OpaqueValue(raw);
    }
    if (descriptor instanceof TypeDescriptor.StructType st) {
      return struct(st, raw);
    }
    if (descriptor instanceof TypeDescriptor.TupleType t) {
      return tuple(t, raw);
    }
    if (descriptor instanceof TypeDescriptor.EnumType e) {
      return enumValue(e, raw);
    }
    if (descriptor instanceof TypeDescriptor.ListType l) {
      return new ValueView.ListValue(items(l.item(), raw));
    }
    if (descriptor instanceof TypeDescriptor.ArrayType a) {
      List<ValueView> items = items(a.item(), raw);
      if (items.size() != a.length()) {
        throw new ReflectionException(
            "array length mismatch for " + a.typePath() + ": expected=" + a.length()
                + " actual=" + items.size());
      }
      return new ValueView.ListValue(items);
    }
    if (descriptor instanceof TypeDescriptor.MapType m) {
      if (!(raw instanceof Map<?, ?> map)) {
        throw mismatch(descriptor, raw);
      }
      Map<ValueView, ValueView> entries = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        entries.put(view(m.key(), entry.getKey()), view(m.value(), entry.getValue()));
      }
      return new ValueView.MapValue(entries);
    }
    throw mismatch(descriptor, raw);
  }

  private static ValueView struct(TypeDescriptor.StructType st, Object raw) {
    Map<String, Object> byName = new LinkedHashMap<>();
    if (raw instanceof Record record) {
      for (RecordReflectors.ComponentValue c : RecordReflectors.components(record)) {
        byName.put(c.name(), c.value());
      }
    } else if (raw instanceof Map<?, ?> map) {
      map.forEach((k, v) -> byName.put(String.valueOf(k), v));
    } else {
      throw mismatch(st, raw);
    }

    List<ValueView.FieldValue> fields = new ArrayList<>(st.fields().size());
    for (TypeDescriptor.NamedField f : st.fields()) {
      if (!byName.containsKey(f.name())) {
        throw new ReflectionException("missing field " + f.name() + " for " + st.typePath());
      }
      fields.add(new ValueView.FieldValue(f.name(), view(f.type(), byName.get(f.name()))));
    }
    return new ValueView.StructValue(st.typePath(), fields);
  }

  private static ValueView tuple(TypeDescriptor.TupleType t, Object raw) {
    List<Object> positional = new ArrayList<>();
    if (raw instanceof Record record) {
      for (RecordReflectors.ComponentValue c : RecordReflectors.components(record)) {
        positional.add(c.value());
      }
    } else if (raw instanceof List<?> list) {
      positional.addAll(list);
    } else if (raw instanceof Object[] array) {
      positional.addAll(Arrays.asList(array));
    } else {
      throw mismatch(t, raw);
    }
    if (positional.size() != t.fields().size()) {
      throw new ReflectionException(
          "tuple arity mismatch for " + t.typePath() + ": expected=" + t.fields().size()
              + " actual=" + positional.size());
    }
    List<ValueView> fields = new ArrayList<>(positional.size());
    for (int i = 0; i < positional.size(); i++) {
      fields.add(view(t.fields().get(i), positional.get(i)));
    }
    return new ValueView.TupleValue(t.typePath(), fields);
  }

  private static ValueView enumValue(TypeDescriptor.EnumType e, Object raw) {
    String variant;
    if (raw instanceof Enum<?> constant) {
      variant = constant.name();
    } else if (raw instanceof CharSequence name) {
      variant = name.toString();
    } else {
      throw mismatch(e, raw);
    }
    if (!e.variants().isEmpty() && !e.variants().contains(variant)) {
      throw new ReflectionException("unknown variant " + variant + " for " + e.typePath());
    }
    return new ValueView.EnumValue(e.typePath(), variant, List.of());
  }

  private static List<ValueView> items(TypeDescriptor item, Object raw) {
    List<ValueView> out = new ArrayList<>();
    if (raw instanceof Iterable<?> iterable) {
      for (Object o : iterable) {
        out.add(view(item, o));
      }
    } else if (raw.getClass().isArray()) {
      int n = Array.getLength(raw);
      for (int i = 0; i < n; i++) {
        out.add(view(item, Array.get(raw, i)));
      }
    } else {
      throw new ReflectionException(
          "expected a sequence of " + item.typePath() + ", got " + raw.getClass().getName());
    }
    return out;
  }

  private static ReflectionException mismatch(TypeDescriptor descriptor, Object raw) {
    return new ReflectionException(
        "value of " + raw.getClass().getName() + " does not fit " + descriptor.typePath());
  }
}
