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

import ai.floedb.snapcat.arrow.ArrowColumns;
import ai.floedb.snapcat.export.Diagnostics;
import ai.floedb.snapcat.export.ExportException;
import ai.floedb.snapcat.export.WriterOptions;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.iceberg.Schema;
import org.apache.iceberg.TableProperties;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.data.parquet.GenericParquetWriter;
import org.apache.iceberg.io.FileAppender;
import org.apache.iceberg.parquet.Parquet;
import org.jboss.logging.Logger;

/**
 * Writes one batch of columns as one Parquet file.
 *
 * <p>The columns are assembled into an Arrow {@link VectorSchemaRoot} and written row by row
 * through the Iceberg generic Parquet writer. An existing file at the target path is replaced. With
 * the default row group size the whole batch lands in a single row group.
 */
public final class ParquetBatchWriter {

  private static final Logger LOG = Logger.getLogger(ParquetBatchWriter.class);

  private final WriterOptions options;

  public ParquetBatchWriter(WriterOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /** What ended up on disk. */
  public record WrittenFile(Path path, Schema schema, long rowCount) {}

  /**
   * @throws ExportException.IoFailure if the directory or file cannot be created or written
   * @throws ExportException.WriteFailure if the columns do not fit the schema or encoding fails
   */
  public WrittenFile write(
      Path path,
      org.apache.arrow.vector.types.pojo.Schema arrowSchema,
      List<List<Object>> columns) {
    Path target = path.toAbsolutePath();
    createParent(target);

    try (BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);
        VectorSchemaRoot root = VectorSchemaRoot.create(arrowSchema, allocator)) {
      Schema schema;
      try {
        ArrowColumns.fill(root, columns);
        schema = IcebergSchemas.fromArrow(arrowSchema);
      } catch (IllegalArgumentException e) {
        throw new ExportException.WriteFailure(
            "cannot assemble batch for " + target + ": " + e.getMessage(), e);
      }

      long rows = append(target, schema, root);
      LOG.infof("wrote %d rows, %d columns to %s", rows, columns.size(), target);
      return new WrittenFile(target, schema, rows);
    }
  }

  private long append(Path target, Schema schema, VectorSchemaRoot root) {
    try (FileAppender<Record> appender = open(target, schema)) {
      for (int row = 0; row < root.getRowCount(); row++) {
        appender.add(IcebergSchemas.toRecord(root, row, schema));
      }
    } catch (IOException | UncheckedIOException e) {
      discard(target);
      throw new ExportException.IoFailure("failed to write " + target, e);
    } catch (RuntimeException e) {
      discard(target);
      throw new ExportException.WriteFailure(
          "failed to encode " + target + ": " + e.getMessage(), e);
    }
    return root.getRowCount();
  }

  private FileAppender<Record> open(Path target, Schema schema) throws IOException {
    return Parquet.write(org.apache.iceberg.Files.localOutput(target.toFile()))
        .schema(schema)
        .createWriterFunc(GenericParquetWriter::buildWriter)
        .set(TableProperties.PARQUET_COMPRESSION, options.compression().codecName())
        .set(
            TableProperties.PARQUET_ROW_GROUP_SIZE_BYTES,
            Long.toString(options.rowGroupSizeBytes()))
        .set(TableProperties.PARQUET_PAGE_SIZE_BYTES, Long.toString(options.pageSizeBytes()))
        .overwrite()
        .build();
  }

  private static void createParent(Path target) {
    Path parent = target.getParent();
    if (parent == null) {
      return;
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException e) {
      throw new ExportException.IoFailure("cannot create directory " + parent, e);
    }
  }

  private static void discard(Path target) {
    Diagnostics.hope(() -> Files.deleteIfExists(target), "could not remove partial file " + target);
  }
}
