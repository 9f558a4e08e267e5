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

package ai.floedb.snapcat.export;

import java.util.Locale;
import java.util.Objects;

/**
 * Greedy cluster detection settings.
 *
 * @param similarityThreshold Jaccard similarity an entity must strictly exceed to join a cluster
 * @param seedMode what the similarity is measured against
 */
public record ClusteringOptions(double similarityThreshold, SeedMode seedMode) {

  public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8d;

  public ClusteringOptions {
    if (Double.isNaN(similarityThreshold)
        || similarityThreshold < 0.0d
        || similarityThreshold > 1.0d) {
      throw new IllegalArgumentException(
          "similarity threshold must be within [0, 1]: " + similarityThreshold);
    }
    seedMode = Objects.requireNonNullElse(seedMode, SeedMode.NARROWING);
  }

  public static ClusteringOptions defaults() {
    return new ClusteringOptions(DEFAULT_SIMILARITY_THRESHOLD, SeedMode.NARROWING);
  }

  public enum SeedMode {
    /** Compare against the running intersection; each merge can make later merges harder. */
    NARROWING,
    /** Compare against the seed entity's own signature. */
    FIXED_SEED;

    public static SeedMode fromString(String value) {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
  }
}
