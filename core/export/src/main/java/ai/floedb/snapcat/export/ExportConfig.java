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

import ai.floedb.snapcat.arrow.ColumnEncoding;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Settings for one export invocation.
 *
 * @param outputPath prefix of every produced file; files are named {@code
 *     <outputPath>_<name>.parquet}
 * @param fileName literal replacement for the derived per-cluster name
 * @param clusters manual clusters as lists of attribute names; when non-empty, detection is skipped
 * @param fileNameBudget maximum length of a derived name
 * @param encoding column layout
 * @param raggedColumns handling of columns that lost values to reflection failures
 * @param clustering cluster detection settings
 * @param writer Parquet encoder settings
 */
public record ExportConfig(
    String outputPath,
    Optional<String> fileName,
    List<List<String>> clusters,
    int fileNameBudget,
    ColumnEncoding encoding,
    RaggedColumnPolicy raggedColumns,
    ClusteringOptions clustering,
    WriterOptions writer) {

  public static final String OUTPUT_PATH = "export.output-path";
  public static final String FILE_NAME = "export.file-name";
  public static final String CLUSTERS = "export.clusters";
  public static final String FILE_NAME_BUDGET = "export.file-name-budget";
  public static final String ENCODING = "export.encoding";
  public static final String RAGGED_COLUMNS = "export.ragged-columns";
  public static final String SIMILARITY_THRESHOLD = "cluster.similarity-threshold";
  public static final String SEED_MODE = "cluster.seed-mode";
  public static final String COMPRESSION = "parquet.compression";
  public static final String ROW_GROUP_SIZE_BYTES = "parquet.row-group-size-bytes";
  public static final String PAGE_SIZE_BYTES = "parquet.page-size-bytes";

  public static final String DEFAULT_OUTPUT_PATH = "./";
  public static final int DEFAULT_FILE_NAME_BUDGET = 20;

  public ExportConfig {
    outputPath = Objects.requireNonNullElse(outputPath, DEFAULT_OUTPUT_PATH);
    fileName = fileName == null ? Optional.empty() : fileName.filter(n -> !n.isBlank());
    clusters = clusters == null ? List.of() : deepImmutableCopy(clusters);
    if (fileNameBudget <= 0) {
      throw new IllegalArgumentException("file name budget must be > 0: " + fileNameBudget);
    }
    encoding = Objects.requireNonNullElse(encoding, ColumnEncoding.TYPED);
    raggedColumns =
        Objects.requireNonNullElse(raggedColumns, RaggedColumnPolicy.DROP_INCOMPLETE_ROWS);
    clustering = Objects.requireNonNullElse(clustering, ClusteringOptions.defaults());
    writer = Objects.requireNonNullElse(writer, WriterOptions.defaults());
  }

  private static List<List<String>> deepImmutableCopy(List<List<String>> src) {
    return src.stream()
        .map(inner -> inner == null ? List.<String>of() : List.copyOf(inner))
        .toList();
  }

  public static ExportConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .outputPath(outputPath)
        .fileName(fileName.orElse(null))
        .clusters(clusters)
        .fileNameBudget(fileNameBudget)
        .encoding(encoding)
        .raggedColumns(raggedColumns)
        .clustering(clustering)
        .writer(writer);
  }

  /**
   * Builds a config from flat string options; absent keys take their defaults.
   *
   * @throws IllegalArgumentException naming the key when a value cannot be parsed
   */
  public static ExportConfig fromOptions(Map<String, String> options) {
    Map<String, String> opts = options == null ? Collections.emptyMap() : options;
    ClusteringOptions clusteringDefaults = ClusteringOptions.defaults();
    WriterOptions writerDefaults = WriterOptions.defaults();

    ClusteringOptions clustering =
        new ClusteringOptions(
            parse(
                SIMILARITY_THRESHOLD,
                opts,
                ExportConfig::threshold,
                clusteringDefaults.similarityThreshold()),
            parse(
                SEED_MODE,
                opts,
                ClusteringOptions.SeedMode::fromString,
                clusteringDefaults.seedMode()));

    WriterOptions writer =
        new WriterOptions(
            parse(
                COMPRESSION,
                opts,
                WriterOptions.Compression::fromString,
                writerDefaults.compression()),
            parse(
                ROW_GROUP_SIZE_BYTES,
                opts,
                ExportConfig::positiveLong,
                writerDefaults.rowGroupSizeBytes()),
            parse(
                PAGE_SIZE_BYTES,
                opts,
                ExportConfig::positiveLong,
                writerDefaults.pageSizeBytes()));

    return builder()
        .outputPath(opts.getOrDefault(OUTPUT_PATH, DEFAULT_OUTPUT_PATH))
        .fileName(opts.get(FILE_NAME))
        .clusters(parse(CLUSTERS, opts, ExportConfig::parseClusters, List.of()))
        .fileNameBudget(
            parse(
                FILE_NAME_BUDGET,
                opts,
                raw -> (int) positiveLong(raw),
                DEFAULT_FILE_NAME_BUDGET))
        .encoding(parse(ENCODING, opts, ColumnEncoding::fromString, ColumnEncoding.TYPED))
        .raggedColumns(
            parse(
                RAGGED_COLUMNS,
                opts,
                RaggedColumnPolicy::fromString,
                RaggedColumnPolicy.DROP_INCOMPLETE_ROWS))
        .clustering(clustering)
        .writer(writer)
        .build();
  }

  private static <T> T parse(
      String key, Map<String, String> opts, Function<String, T> parser, T fallback) {
    String raw = opts.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return parser.apply(raw.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("invalid value for " + key + ": " + raw, e);
    }
  }

  private static double threshold(String raw) {
    double v = Double.parseDouble(raw);
    if (!(v >= 0.0d && v <= 1.0d)) {
      throw new IllegalArgumentException("out of range: " + v);
    }
    return v;
  }

  private static long positiveLong(String raw) {
    long v = Long.parseLong(raw);
    if (v <= 0 || v > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("out of range: " + v);
    }
    return v;
  }

  /** {@code "a::Pos,a::Vel;a::Health"} into {@code [[a::Pos, a::Vel], [a::Health]]}. */
  static List<List<String>> parseClusters(String raw) {
    List<List<String>> out = new ArrayList<>();
    for (String cluster : raw.split(";")) {
      List<String> names = new ArrayList<>();
      for (String name : cluster.split(",")) {
        if (!name.isBlank()) {
          names.add(name.trim());
        }
      }
      if (!names.isEmpty()) {
        out.add(names);
      }
    }
    return out;
  }

  public static final class Builder {
    private String outputPath = DEFAULT_OUTPUT_PATH;
    private String fileName;
    private List<List<String>> clusters = List.of();
    private int fileNameBudget = DEFAULT_FILE_NAME_BUDGET;
    private ColumnEncoding encoding = ColumnEncoding.TYPED;
    private RaggedColumnPolicy raggedColumns = RaggedColumnPolicy.DROP_INCOMPLETE_ROWS;
    private ClusteringOptions clustering = ClusteringOptions.defaults();
    private WriterOptions writer = WriterOptions.defaults();

    private Builder() {}

    public Builder outputPath(String outputPath) {
      this.outputPath = outputPath;
      return this;
    }

    public Builder fileName(String fileName) {
      this.fileName = fileName;
      return this;
    }

    public Builder clusters(List<List<String>> clusters) {
      this.clusters = clusters;
      return this;
    }

    public Builder fileNameBudget(int fileNameBudget) {
      this.fileNameBudget = fileNameBudget;
      return this;
    }

    public Builder encoding(ColumnEncoding encoding) {
      this.encoding = encoding;
      return this;
    }

    public Builder raggedColumns(RaggedColumnPolicy raggedColumns) {
      this.raggedColumns = raggedColumns;
      return this;
    }

    public Builder clustering(ClusteringOptions clustering) {
      this.clustering = clustering;
      return this;
    }

    public Builder writer(WriterOptions writer) {
      this.writer = writer;
      return this;
    }

    public ExportConfig build() {
      return new ExportConfig(
          outputPath,
          Optional.ofNullable(fileName),
          clusters,
          fileNameBudget,
          encoding,
          raggedColumns,
          clustering,
          writer);
    }
  }
}
