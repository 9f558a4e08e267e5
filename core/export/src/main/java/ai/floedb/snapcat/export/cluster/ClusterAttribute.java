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

package ai.floedb.snapcat.export.cluster;

import ai.floedb.snapcat.store.AttributeId;
import java.util.Objects;

/** One attribute of a cluster: its fully qualified name and its store id. */
public record ClusterAttribute(String name, AttributeId id) {

  public ClusterAttribute {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(id, "id");
  }
}
