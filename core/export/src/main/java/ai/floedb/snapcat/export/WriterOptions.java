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

/** Parquet encoder settings. */
public record WriterOptions(Compression compression, long rowGroupSizeBytes, long pageSizeBytes) {

  /** Large enough that every file holds a single row group. */
  public static final long DEFAULT_ROW_GROUP_SIZE_BYTES = Integer.MAX_VALUE;

  public static final long DEFAULT_PAGE_SIZE_BYTES = 1024L * 1024L;

  public WriterOptions {
    compression = Objects.requireNonNullElse(compression, Compression.SNAPPY);
    if (rowGroupSizeBytes <= 0 || rowGroupSizeBytes > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("row group size out of range: " + rowGroupSizeBytes);
    }
    if (pageSizeBytes <= 0 || pageSizeBytes > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("page size out of range: " + pageSizeBytes);
    }
  }

  public static WriterOptions defaults() {
    return new WriterOptions(
        Compression.SNAPPY, DEFAULT_ROW_GROUP_SIZE_BYTES, DEFAULT_PAGE_SIZE_BYTES);
  }

  public enum Compression {
    SNAPPY,
    GZIP,
    ZSTD,
    UNCOMPRESSED;

    /** Codec name as understood by the Parquet writer properties. */
    public String codecName() {
      return name().toLowerCase(Locale.ROOT);
    }

    public static Compression fromString(String value) {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
  }
}
