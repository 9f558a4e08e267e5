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
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * One written file.
 *
 * @param omittedValues values left out of their column because they could not be materialized
 * @param droppedRows entities left out of the file because some of their values were omitted
 */
public record ClusterExport(
    AttributeCluster cluster,
    Path path,
    Schema schema,
    long rowCount,
    int columnCount,
    int omittedValues,
    int droppedRows) {}
