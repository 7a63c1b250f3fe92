package com.gentoro.ragmcp.query;

import com.gentoro.ragmcp.ingestion.ResourceCategory;
import com.gentoro.ragmcp.store.SearchHit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranked hits per category. Iteration order is the order in which categories were searched; each
 * list keeps the store's ranking.
 */
public final class QueryResult {
  private final Map<ResourceCategory, List<SearchHit>> hits;

  QueryResult(Map<ResourceCategory, List<SearchHit>> hits) {
    Map<ResourceCategory, List<SearchHit>> copy = new LinkedHashMap<>();
    hits.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    this.hits = Collections.unmodifiableMap(copy);
  }

  static QueryResult empty() {
    return new QueryResult(Map.of());
  }

  public Map<ResourceCategory, List<SearchHit>> hitsByCategory() {
    return hits;
  }

  public int totalHits() {
    return hits.values().stream().mapToInt(List::size).sum();
  }

  public boolean isEmpty() {
    return totalHits() == 0;
  }
}
