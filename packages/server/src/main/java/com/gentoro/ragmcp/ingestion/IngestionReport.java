package com.gentoro.ragmcp.ingestion;

/** Outcome of one ingestion run. */
public record IngestionReport(
    String resourceName,
    int documents,
    int chunks,
    int skipped,
    int inserted,
    long deleted,
    boolean rebuilt) {

  @Override
  public String toString() {
    return "IngestionReport{"
        + resourceName
        + ": documents="
        + documents
        + ", chunks="
        + chunks
        + ", skipped="
        + skipped
        + ", inserted="
        + inserted
        + ", deleted="
        + deleted
        + (rebuilt ? ", rebuilt" : "")
        + '}';
  }
}
