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

import ai.floedb.snapcat.export.cluster.AttributeCluster;
import java.nio.file.Path;
import java.util.List;

/** Outcome of one export: every cluster considered and the files written for them. */
public record ExportResult(List<AttributeCluster> clusters, List<ClusterExport> exports) {

  public ExportResult {
    clusters = List.copyOf(clusters);
    exports = List.copyOf(exports);
  }

  public List<Path> files() {
    return exports.stream().map(ClusterExport::path).toList();
  }
}
