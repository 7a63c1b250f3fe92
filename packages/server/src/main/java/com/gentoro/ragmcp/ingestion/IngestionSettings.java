package com.gentoro.ragmcp.ingestion;

import java.util.List;
import org.apache.commons.configuration2.Configuration;

/** Tunables of the ingestion pipeline, read from the {@code ingestion.*} keys. */
public record IngestionSettings(
    int chunkSize,
    int chunkOverlap,
    List<String> separators,
    int embeddingParallelism,
    RetentionPolicy retention,
    boolean destructiveReingest) {

  public static final int DEFAULT_CHUNK_SIZE = 500;
  public static final int DEFAULT_CHUNK_OVERLAP = 50;
  public static final List<String> DEFAULT_SEPARATORS = List.of("\n\n");
  public static final int DEFAULT_EMBEDDING_PARALLELISM = 4;

  public IngestionSettings {
    separators = List.copyOf(separators);
    if (embeddingParallelism < 1) {
      throw new IllegalArgumentException(
          "embeddingParallelism must be >= 1 (was " + embeddingParallelism + ")");
    }
  }

  public static IngestionSettings defaults() {
    return new IngestionSettings(
        DEFAULT_CHUNK_SIZE,
        DEFAULT_CHUNK_OVERLAP,
        DEFAULT_SEPARATORS,
        DEFAULT_EMBEDDING_PARALLELISM,
        RetentionPolicy.KEEP_HISTORY,
        false);
  }

  public static IngestionSettings fromConfiguration(Configuration cfg) {
    return new IngestionSettings(
        cfg.getInt("ingestion.chunk-size", DEFAULT_CHUNK_SIZE),
        cfg.getInt("ingestion.chunk-overlap", DEFAULT_CHUNK_OVERLAP),
        cfg.getList(String.class, "ingestion.separators", DEFAULT_SEPARATORS),
        cfg.getInt("ingestion.embedding-parallelism", DEFAULT_EMBEDDING_PARALLELISM),
        RetentionPolicy.fromValue(
            cfg.getString("ingestion.retention", RetentionPolicy.KEEP_HISTORY.value())),
        cfg.getBoolean("ingestion.destructive-reingest", false));
  }

  public RecursiveTextSplitter newSplitter() {
    return new RecursiveTextSplitter(chunkSize, chunkOverlap, separators);
  }
}
