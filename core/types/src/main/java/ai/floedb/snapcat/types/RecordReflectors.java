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

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derives {@link TypeDescriptor}s from Java record classes and reads record components by name.
 *
 * <p>Component mapping: {@code float}, {@code double}, {@code int}, {@code long} and {@code
 * boolean} (and their boxes) become scalars, with {@link Unsigned} turning {@code int}/{@code long}
 * into {@code u32}/{@code u64}. {@link EntityReference} types become entity scalars. Nested
 * records become structs, enums become enums, {@code List<T>} and Java arrays become lists, {@code
 * Map<K, V>} becomes a map. Anything else is opaque.
 */
public final class RecordReflectors {

  private static final ClassValue<List<Accessor>> ACCESSORS =
      new ClassValue<>() {
        @Override
        protected List<Accessor> computeValue(Class<?> type) {
          return bindAccessors(type);
        }
      };

  private RecordReflectors() {}

  record Accessor(String name, MethodHandle getter) {}

  public static TypeDescriptor.StructType describe(Class<? extends Record> recordClass) {
    return describeRecord(recordClass, new HashSet<>());
  }

  /** Type path used for a class: its canonical name when it has one. */
  public static String typePath(Class<?> type) {
    return Optional.ofNullable(type.getCanonicalName()).orElse(type.getName());
  }

  /** A component value; {@code value} may be null. */
  record ComponentValue(String name, Object value) {}

  /** Component values of {@code record} in declaration order, under their described names. */
  static List<ComponentValue> components(Record record) {
    List<Accessor> accessors = ACCESSORS.get(record.getClass());
    List<ComponentValue> out = new ArrayList<>(accessors.size());
    for (Accessor a : accessors) {
      try {
        out.add(new ComponentValue(a.name(), a.getter().invoke(record)));
      } catch (Throwable t) {
        throw new ReflectionException(
            "failed to read component " + a.name() + " of " + record.getClass().getName(), t);
      }
    }
    return out;
  }

  private static List<Accessor> bindAccessors(Class<?> rc) {
    if (!rc.isRecord()) {
      throw new IllegalArgumentException("Not a record: " + rc.getName());
    }
    MethodHandles.Lookup lookup = MethodHandles.lookup();
    RecordComponent[] comps = rc.getRecordComponents();
    List<Accessor> accessors = new ArrayList<>(comps.length);
    for (RecordComponent comp : comps) {
      Method accessor = comp.getAccessor();
      MethodHandle getter;
      try {
        accessor.setAccessible(true);
        getter = lookup.unreflect(accessor);
      } catch (IllegalAccessException | RuntimeException e) {
        throw new IllegalArgumentException("Failed to bind accessor for " + componentName(comp), e);
      }
      accessors.add(new Accessor(componentName(comp), getter));
    }
    return List.copyOf(accessors);
  }

  private static String componentName(RecordComponent comp) {
    return Optional.ofNullable(comp.getAnnotation(FieldName.class))
        .map(FieldName::value)
        .orElse(comp.getName());
  }

  private static TypeDescriptor.StructType describeRecord(Class<?> rc, Set<Class<?>> visiting) {
    if (!rc.isRecord()) {
      throw new IllegalArgumentException("Not a record: " + rc.getName());
    }
    visiting.add(rc);
    List<TypeDescriptor.NamedField> fields = new ArrayList<>();
    for (RecordComponent comp : rc.getRecordComponents()) {
      boolean unsigned = comp.isAnnotationPresent(Unsigned.class);
      fields.add(
          new TypeDescriptor.NamedField(
              componentName(comp), describeType(comp.getGenericType(), unsigned, visiting)));
    }
    visiting.remove(rc);
    return new TypeDescriptor.StructType(typePath(rc), fields);
  }

  private static TypeDescriptor describeType(Type type, boolean unsigned, Set<Class<?>> visiting) {
    if (type instanceof ParameterizedType p && p.getRawType() instanceof Class<?> raw) {
      Type[] args = p.getActualTypeArguments();
      if (List.class.isAssignableFrom(raw) && args.length == 1) {
        return TypeDescriptor.list(describeType(args[0], false, visiting));
      }
      if (Map.class.isAssignableFrom(raw) && args.length == 2) {
        TypeDescriptor k = describeType(args[0], false, visiting);
        TypeDescriptor v = describeType(args[1], false, visiting);
        return new TypeDescriptor.MapType(
            "map<" + k.typePath() + ", " + v.typePath() + ">", k, v);
      }
      return describeType(raw, unsigned, visiting);
    }
    if (!(type instanceof Class<?> jt)) {
      return new TypeDescriptor.UnresolvedType(type.getTypeName());
    }
    Optional<ScalarKind> scalar =
        jt.isPrimitive() || jt.getName().startsWith("java.lang.")
            ? ScalarKind.fromTypePath(jt.getName())
            : Optional.empty();
    if (scalar.isPresent()) {
      return TypeDescriptor.scalar(unsigned ? scalar.get().toUnsigned() : scalar.get());
    }
    if (EntityReference.class.isAssignableFrom(jt)) {
      return TypeDescriptor.scalar(ScalarKind.ENTITY);
    }
    if (jt.isArray()) {
      return TypeDescriptor.list(describeType(jt.getComponentType(), unsigned, visiting));
    }
    if (jt.isEnum()) {
      List<String> variants = new ArrayList<>();
      for (Object constant : jt.getEnumConstants()) {
        variants.add(((Enum<?>) constant).name());
      }
      return new TypeDescriptor.EnumType(typePath(jt), variants);
    }
    if (jt.isRecord()) {
      if (visiting.contains(jt)) {
        return new TypeDescriptor.UnresolvedType(typePath(jt));
      }
      return describeRecord(jt, visiting);
    }
    if (List.class.isAssignableFrom(jt)) {
      return TypeDescriptor.list(new TypeDescriptor.UnresolvedType("java.lang.Object"));
    }
    return TypeDescriptor.opaque(typePath(jt));
  }
}
