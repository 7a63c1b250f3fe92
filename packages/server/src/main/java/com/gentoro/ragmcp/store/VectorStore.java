package com.gentoro.ragmcp.store;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Handle on one tenant's vector store. Implementations must be safe for concurrent use by
 * several requests once acquired; failures surface as {@link
 * com.gentoro.ragmcp.exception.StoreException}.
 */
public interface VectorStore extends AutoCloseable {

  /** Fingerprints already recorded for every chunk identity of the given resource. */
  Map<ChunkIdentity, Set<String>> recordedFingerprints(String resourceName);

  /** Insert all records in a single write. An empty list is a no-op. */
  void insertAll(List<IndexedRecord> records);

  /**
   * Delete records of the given identities whose fingerprint differs from the current one.
   *
   * @return number of deleted records
   */
  long deleteSuperseded(Map<ChunkIdentity, String> currentFingerprints);

  /**
   * Remove every record of this tenant's collection.
   *
   * @return number of deleted records
   */
  long deleteAll();

  /** Distinct category labels currently present. */
  List<String> distinctCategories();

  /**
   * Create the vector search index when it does not exist yet. Safe to call on every query.
   *
   * @return {@code true} when this call created the index
   */
  boolean ensureVectorIndex(String indexName, int dimensions);

  /** Best matches for the query, highest score first. */
  List<SearchHit> similaritySearch(SimilarityQuery query);

  @Override
  void close();
}
