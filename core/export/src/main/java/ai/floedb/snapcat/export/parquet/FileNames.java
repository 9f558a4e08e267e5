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

package ai.floedb.snapcat.export.parquet;

import ai.floedb.snapcat.export.ExportConfig;
import ai.floedb.snapcat.export.cluster.AttributeCluster;
import ai.floedb.snapcat.export.cluster.ClusterAttribute;
import ai.floedb.snapcat.types.DebugFormat;
import java.nio.file.Path;
import java.util.StringJoiner;

/** Output file naming: {@code <outputPath>_<name>.parquet}. */
public final class FileNames {

  public static final String EXTENSION = ".parquet";

  private FileNames() {}

  /**
   * The configured file name if there is one, else the short names of every cluster attribute
   * (markers included) joined by {@code _} and cut to {@code fileNameBudget} characters.
   */
  public static String name(AttributeCluster cluster, ExportConfig config) {
    return config.fileName().orElseGet(() -> derived(cluster, config.fileNameBudget()));
  }

  public static String derived(AttributeCluster cluster, int budget) {
    StringJoiner joined = new StringJoiner("_");
    for (ClusterAttribute attribute : cluster.attributes()) {
      joined.add(DebugFormat.shortName(attribute.name()));
    }
    String name = sanitize(joined.toString());
    return name.length() <= budget ? name : name.substring(0, budget);
  }

  public static Path path(String outputPath, String name) {
    return Path.of(outputPath + "_" + name + EXTENSION);
  }

  // Generic arguments and path separators in type names must not leak into the file name.
  private static String sanitize(String name) {
    StringBuilder sb = new StringBuilder(name.length());
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      boolean safe =
          (c >= 'a' && c <= 'z')
              || (c >= 'A' && c <= 'Z')
              || (c >= '0' && c <= '9')
              || c == '_'
              || c == '-'
              || c == '.';
      sb.append(safe ? c : '_');
    }
    return sb.toString();
  }
}
