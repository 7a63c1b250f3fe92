package com.gentoro.ragmcp.store;

import com.gentoro.ragmcp.ingestion.ResourceCategory;
import java.util.Objects;

/**
 * The persisted unit of the tenant corpus. Records are inserted once and never updated; a changed
 * chunk produces a new record next to the old one.
 */
public record IndexedRecord(
    ResourceCategory category,
    String resourceName,
    String sourcePath,
    int chunkId,
    String fingerprint,
    String content,
    String embeddedContent,
    double[] embedding) {

  public IndexedRecord {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(resourceName, "resourceName");
    Objects.requireNonNull(sourcePath, "sourcePath");
    Objects.requireNonNull(fingerprint, "fingerprint");
    Objects.requireNonNull(embedding, "embedding");
  }

  public ChunkIdentity identity() {
    return new ChunkIdentity(resourceName, sourcePath, chunkId);
  }

  @Override
  public String toString() {
    return "IndexedRecord{"
        + category.label()
        + ", "
        + resourceName
        + ", "
        + sourcePath
        + "#"
        + chunkId
        + ", fingerprint="
        + fingerprint
        + ", dimensions="
        + embedding.length
        + '}';
  }
}
