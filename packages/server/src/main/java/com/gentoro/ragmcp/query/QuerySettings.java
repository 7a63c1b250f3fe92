package com.gentoro.ragmcp.query;

import org.apache.commons.configuration2.Configuration;

/** Vector search parameters ({@code query.*} keys). */
public record QuerySettings(String indexName, int numCandidates, int limit) {

  public static final String DEFAULT_INDEX_NAME = "vector_index";
  public static final int DEFAULT_NUM_CANDIDATES = 15;
  public static final int DEFAULT_LIMIT = 3;

  public QuerySettings {
    if (limit < 1 || numCandidates < limit) {
      throw new IllegalArgumentException(
          "query.limit must be >= 1 and <= query.num-candidates (limit="
              + limit
              + ", numCandidates="
              + numCandidates
              + ")");
    }
  }

  public static QuerySettings defaults() {
    return new QuerySettings(DEFAULT_INDEX_NAME, DEFAULT_NUM_CANDIDATES, DEFAULT_LIMIT);
  }

  public static QuerySettings fromConfiguration(Configuration cfg) {
    return new QuerySettings(
        cfg.getString("query.index-name", DEFAULT_INDEX_NAME),
        cfg.getInt("query.num-candidates", DEFAULT_NUM_CANDIDATES),
        cfg.getInt("query.limit", DEFAULT_LIMIT));
  }
}
