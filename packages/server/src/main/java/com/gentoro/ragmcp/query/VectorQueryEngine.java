package com.gentoro.ragmcp.query;

import com.gentoro.ragmcp.embedding.EmbeddingClient;
import com.gentoro.ragmcp.ingestion.ResourceCategory;
import com.gentoro.ragmcp.store.SearchHit;
import com.gentoro.ragmcp.store.SimilarityQuery;
import com.gentoro.ragmcp.store.VectorStore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers a question against one resource of a tenant store.
 *
 * <p>The vector index is created on first use. The question is embedded once and one filtered
 * similarity search is issued per category present in the store; results are kept per category in
 * enumeration order.
 */
public class VectorQueryEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(VectorQueryEngine.class);

  public static final String NO_CONTENT = "No content found.";

  private final QuerySettings settings;
  private final EmbeddingClient embeddingClient;

  public VectorQueryEngine(QuerySettings settings, EmbeddingClient embeddingClient) {
    this.settings = settings;
    this.embeddingClient = embeddingClient;
  }

  /** The context payload for the question, or {@link #NO_CONTENT} when nothing matched. */
  public String query(String question, String resourceName, VectorStore store) {
    QueryResult result = search(question, resourceName, store);
    if (result.isEmpty()) {
      log.info("No results found for the query on resource {}", resourceName);
      return NO_CONTENT;
    }
    return ContextFormatter.toJson(result);
  }

  public QueryResult search(String question, String resourceName, VectorStore store) {
    if (store.ensureVectorIndex(settings.indexName(), embeddingClient.dimensions())) {
      log.info("Vector index {} created", settings.indexName());
    }

    List<String> categories = store.distinctCategories().stream().sorted().toList();
    if (categories.isEmpty()) {
      return QueryResult.empty();
    }

    log.debug("Searching {} categories of {} for: {}", categories, resourceName, question);
    double[] vector = embeddingClient.embed(question);

    Map<ResourceCategory, List<SearchHit>> hits = new LinkedHashMap<>();
    for (String label : categories) {
      Optional<ResourceCategory> category = ResourceCategory.fromLabel(label);
      if (category.isEmpty()) {
        log.warn("Ignoring unknown resource_type '{}' in store", label);
        continue;
      }
      hits.put(
          category.get(),
          store.similaritySearch(
              new SimilarityQuery(
                  settings.indexName(),
                  vector,
                  label,
                  resourceName,
                  settings.numCandidates(),
                  settings.limit())));
    }
    return new QueryResult(hits);
  }
}
