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

import java.util.Objects;
import java.util.Optional;

/**
 * What the registry knows about one type. A registration without a reflector describes the type
 * but cannot produce values for it.
 */
public record TypeRegistration(
    TypeId id, TypeDescriptor descriptor, Optional<Reflector> reflector) {

  public TypeRegistration {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(descriptor, "descriptor");
    reflector = reflector == null ? Optional.empty() : reflector;
  }
}
