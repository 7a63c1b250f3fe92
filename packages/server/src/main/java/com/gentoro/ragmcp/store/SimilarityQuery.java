package com.gentoro.ragmcp.store;

/**
 * A filtered nearest-neighbour query: the {@code limit} best matches among {@code numCandidates}
 * candidates whose category and resource name equal the given values.
 */
public record SimilarityQuery(
    String indexName,
    double[] vector,
    String category,
    String resourceName,
    int numCandidates,
    int limit) {}
