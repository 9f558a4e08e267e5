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
import java.util.List;
import java.util.stream.Collectors;

/** Ordered attribute set shared by a group of entities. Order is the seed entity's order. */
public record AttributeCluster(List<ClusterAttribute> attributes) {

  public AttributeCluster {
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }

  public List<AttributeId> ids() {
    return attributes.stream().map(ClusterAttribute::id).toList();
  }

  public List<String> names() {
    return attributes.stream().map(ClusterAttribute::name).toList();
  }

  public int size() {
    return attributes.size();
  }

  public boolean isEmpty() {
    return attributes.isEmpty();
  }

  public boolean contains(AttributeId id) {
    for (ClusterAttribute a : attributes) {
      if (a.id().equals(id)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return attributes.stream()
        .map(ClusterAttribute::name)
        .collect(Collectors.joining(", ", "[", "]"));
  }
}
