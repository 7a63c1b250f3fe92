package com.gentoro.ragmcp.ingestion;

import com.gentoro.ragmcp.store.ChunkIdentity;

/**
 * A slice of a {@link SourceDocument}.
 *
 * @param chunkId 0-based position of the slice within its source
 * @param text the slice as stored and returned to callers
 * @param embeddedText the text sent to the embedder
 */
public record Chunk(
    String resourceName, String sourcePath, int chunkId, String text, String embeddedText) {

  public ChunkIdentity identity() {
    return new ChunkIdentity(resourceName, sourcePath, chunkId);
  }

  public String fingerprint() {
    return ContentFingerprint.of(text);
  }

  public ResourceCategory category() {
    return ResourceCategory.classify(sourcePath);
  }

  @Override
  public String toString() {
    return "Chunk{"
        + "resourceName='"
        + resourceName
        + '\''
        + ", sourcePath='"
        + sourcePath
        + '\''
        + ", chunkId="
        + chunkId
        + ", contentLength="
        + (text == null ? 0 : text.length())
        + '}';
  }
}
