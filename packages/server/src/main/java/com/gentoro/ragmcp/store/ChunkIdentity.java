package com.gentoro.ragmcp.store;

/** Identity of a chunk across ingestions: which resource, which source file, which slice. */
public record ChunkIdentity(String resourceName, String sourcePath, int chunkId) {}
