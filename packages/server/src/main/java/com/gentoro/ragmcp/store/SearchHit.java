package com.gentoro.ragmcp.store;

/** One similarity search result, as projected by the store. */
public record SearchHit(
    String content,
    String category,
    String resourceName,
    String sourcePath,
    int chunkId,
    double score) {}
