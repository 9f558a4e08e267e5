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

import ai.floedb.snapcat.export.ClusteringOptions;
import ai.floedb.snapcat.export.Diagnostics;
import ai.floedb.snapcat.store.AttributeId;
import ai.floedb.snapcat.store.AttributeInfo;
import ai.floedb.snapcat.store.EntityId;
import ai.floedb.snapcat.store.EntityStore;
import ai.floedb.snapcat.types.TypeId;
import ai.floedb.snapcat.types.TypeRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Groups entities by attribute signature.
 *
 * <p>A signature is the ordered set of an entity's attributes whose type is registered. Entities
 * are visited in store order; the first unassigned entity seeds a cluster and every later
 * unassigned entity whose Jaccard similarity strictly exceeds the threshold is merged into it,
 * shrinking the cluster to the common attributes. Each entity joins at most one cluster. The
 * result depends on store order and is not an optimal partition.
 *
 * <p>Quadratic in the number of entities.
 */
public final class ClusterDetector {

  private static final Logger LOG = Logger.getLogger(ClusterDetector.class);

  private final ClusteringOptions options;

  public ClusterDetector(ClusteringOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public List<AttributeCluster> detect(EntityStore store, TypeRegistry registry) {
    List<Set<AttributeId>> signatures = new ArrayList<>();
    for (EntityId entity : store.entities()) {
      Set<AttributeId> signature = signature(store, registry, entity);
      if (!signature.isEmpty()) {
        signatures.add(signature);
      }
    }

    boolean[] assigned = new boolean[signatures.size()];
    List<AttributeCluster> clusters = new ArrayList<>();
    for (int i = 0; i < signatures.size(); i++) {
      if (assigned[i]) {
        continue;
      }
      assigned[i] = true;
      Set<AttributeId> origin = signatures.get(i);
      Set<AttributeId> seed = new LinkedHashSet<>(origin);
      int members = 1;

      for (int j = i + 1; j < signatures.size(); j++) {
        if (assigned[j]) {
          continue;
        }
        Set<AttributeId> other = signatures.get(j);
        Set<AttributeId> base =
            options.seedMode() == ClusteringOptions.SeedMode.FIXED_SEED ? origin : seed;
        if (jaccard(base, other) > options.similarityThreshold()) {
          seed.retainAll(other);
          assigned[j] = true;
          members++;
        }
      }

      if (!seed.isEmpty()) {
        AttributeCluster cluster = toCluster(store, seed);
        LOG.debugf("cluster %s covers %d entities", cluster, members);
        clusters.add(cluster);
      }
    }

    LOG.infof(
        "detected %d clusters over %d entities with registered attributes",
        clusters.size(),
        signatures.size());
    return clusters;
  }

  /**
   * Resolves manual clusters given as attribute names against the attributes present on the
   * store's entities. Unknown names are logged and skipped; clusters left empty are dropped.
   */
  public static List<AttributeCluster> resolve(List<List<String>> clusters, EntityStore store) {
    Map<String, AttributeId> byName = new LinkedHashMap<>();
    for (EntityId entity : store.entities()) {
      for (AttributeId id : store.attributes(entity)) {
        store.attributeInfo(id).ifPresent(info -> byName.putIfAbsent(info.name(), id));
      }
    }

    List<AttributeCluster> out = new ArrayList<>();
    for (List<String> names : clusters) {
      List<ClusterAttribute> attributes = new ArrayList<>();
      Set<AttributeId> seen = new HashSet<>();
      for (String name : names) {
        Optional<AttributeId> id =
            Diagnostics.complain(
                Optional.ofNullable(byName.get(name)), "no entity carries attribute " + name);
        if (id.isPresent() && seen.add(id.get())) {
          attributes.add(new ClusterAttribute(name, id.get()));
        }
      }
      if (Diagnostics.complain(!attributes.isEmpty(), "manual cluster " + names + " is empty")) {
        out.add(new AttributeCluster(attributes));
      }
    }
    return out;
  }

  /** Intersection size over union size; zero when both sets are empty. */
  public static double jaccard(Set<?> a, Set<?> b) {
    if (a.isEmpty() && b.isEmpty()) {
      return 0.0d;
    }
    int intersection = 0;
    for (Object o : a) {
      if (b.contains(o)) {
        intersection++;
      }
    }
    int union = a.size() + b.size() - intersection;
    return (double) intersection / (double) union;
  }

  private static Set<AttributeId> signature(
      EntityStore store, TypeRegistry registry, EntityId entity) {
    Set<AttributeId> out = new LinkedHashSet<>();
    for (AttributeId id : store.attributes(entity)) {
      Optional<TypeId> type = store.attributeInfo(id).flatMap(AttributeInfo::typeId);
      if (type.isPresent() && registry.isKnown(type.get())) {
        out.add(id);
      }
    }
    return out;
  }

  private static AttributeCluster toCluster(EntityStore store, Set<AttributeId> ids) {
    List<ClusterAttribute> attributes = new ArrayList<>(ids.size());
    for (AttributeId id : ids) {
      String name = store.attributeInfo(id).map(AttributeInfo::name).orElse(id.toString());
      attributes.add(new ClusterAttribute(name, id));
    }
    return new AttributeCluster(attributes);
  }
}
