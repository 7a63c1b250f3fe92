package com.gentoro.ragmcp.ingestion;

import java.util.Objects;

/**
 * Raw text of one file of a resource directory.
 *
 * @param resourceName owning resource (library) name
 * @param sourcePath path relative to the resource directory, always with {@code /} separators
 * @param text file content
 */
public record SourceDocument(String resourceName, String sourcePath, String text) {
  public SourceDocument {
    Objects.requireNonNull(resourceName, "resourceName");
    Objects.requireNonNull(sourcePath, "sourcePath");
    Objects.requireNonNull(text, "text");
  }
}
