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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable type-descriptor lookup for one export invocation.
 *
 * <p>Built once by the caller and passed to every component; there is no process-wide registry.
 * Every registered type id is "known" and takes part in cluster detection.
 */
public final class TypeRegistry {

  private static final TypeRegistry EMPTY = new TypeRegistry(Map.of());

  private final Map<TypeId, TypeRegistration> registrations;

  private TypeRegistry(Map<TypeId, TypeRegistration> registrations) {
    this.registrations = registrations;
  }

  public static TypeRegistry empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<TypeRegistration> registration(TypeId id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(registrations.get(id));
  }

  public Optional<TypeDescriptor> descriptor(TypeId id) {
    return registration(id).map(TypeRegistration::descriptor);
  }

  /** Allow-list of type ids considered by cluster detection, in registration order. */
  public Set<TypeId> knownTypes() {
    return registrations.keySet();
  }

  public boolean isKnown(TypeId id) {
    return id != null && registrations.containsKey(id);
  }

  public int size() {
    return registrations.size();
  }

  public static final class Builder {
    private final Map<TypeId, TypeRegistration> registrations = new LinkedHashMap<>();

    private Builder() {}

    /** Registers a type with a descriptor-driven reflector ({@link Reflectors#of}). */
    public Builder register(TypeId id, TypeDescriptor descriptor) {
      return register(id, descriptor, Reflectors.of(descriptor));
    }

    public Builder register(TypeId id, TypeDescriptor descriptor, Reflector reflector) {
      Objects.requireNonNull(reflector, "reflector");
      return put(new TypeRegistration(id, descriptor, Optional.of(reflector)));
    }

    /** Registers a record class; the descriptor is derived from its components. */
    public Builder registerRecord(TypeId id, Class<? extends Record> recordClass) {
      return register(id, RecordReflectors.describe(recordClass));
    }

    /** Registers type metadata that has no reflect capability. */
    public Builder registerWithoutReflector(TypeId id, TypeDescriptor descriptor) {
      return put(new TypeRegistration(id, descriptor, Optional.empty()));
    }

    private Builder put(TypeRegistration registration) {
      if (registrations.putIfAbsent(registration.id(), registration) != null) {
        throw new IllegalArgumentException("type already registered: " + registration.id());
      }
      return this;
    }

    public TypeRegistry build() {
      return new TypeRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(registrations)));
    }
  }
}
