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

package ai.floedb.snapcat.store;

import ai.floedb.snapcat.types.DebugFormat;
import ai.floedb.snapcat.types.TypeId;
import java.util.Objects;
import java.util.Optional;

/**
 * Store metadata for one attribute.
 *
 * @param name fully qualified type path of the attribute, {@code ::} or {@code .} separated
 * @param typeId registered type of the attribute's values, if the store knows one
 * @param marker true for zero-size attributes used only to select which clusters are exported
 */
public record AttributeInfo(String name, Optional<TypeId> typeId, boolean marker) {

  public AttributeInfo {
    Objects.requireNonNull(name, "name");
    typeId = typeId == null ? Optional.empty() : typeId;
  }

  /** Portion of {@link #name()} after the last {@code ::} or {@code .}. */
  public String shortName() {
    return DebugFormat.shortName(name);
  }
}
