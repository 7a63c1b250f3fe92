package com.gentoro.ragmcp.store.mongo;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.ne;
import static com.mongodb.client.model.Filters.or;

import com.gentoro.ragmcp.exception.CancelledException;
import com.gentoro.ragmcp.exception.StoreException;
import com.gentoro.ragmcp.store.ChunkIdentity;
import com.gentoro.ragmcp.store.IndexedRecord;
import com.gentoro.ragmcp.store.SearchHit;
import com.gentoro.ragmcp.store.SimilarityQuery;
import com.gentoro.ragmcp.store.VectorStore;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoInterruptedException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Projections;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.bson.Document;
import org.bson.conversions.Bson;

/**
 * {@link VectorStore} backed by one MongoDB Atlas collection. Similarity search uses the {@code
 * $vectorSearch} aggregation stage over the {@code embedding} field.
 */
public class MongoVectorStore implements VectorStore {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(MongoVectorStore.class);

  static final String F_TYPE = "resource_type";
  static final String F_NAME = "resource_name";
  static final String F_DOCUMENT = "document";
  static final String F_CHUNK_ID = "chunk_id";
  static final String F_HASH = "file_hash";
  static final String F_CONTENT = "content";
  static final String F_EMBEDDED = "embedded_content";
  static final String F_EMBEDDING = "embedding";

  private static final int NAMESPACE_NOT_FOUND = 26;
  private static final int NAMESPACE_EXISTS = 48;
  private static final int INDEX_ALREADY_EXISTS = 68;

  private final MongoClient client;
  private final MongoDatabase database;
  private final MongoCollection<Document> collection;

  public MongoVectorStore(MongoClient client, String database, String collection) {
    this.client = client;
    this.database = client.getDatabase(database);
    this.collection = this.database.getCollection(collection);
  }

  @Override
  public Map<ChunkIdentity, Set<String>> recordedFingerprints(String resourceName) {
    return call(
        "read recorded fingerprints",
        () -> {
          Map<ChunkIdentity, Set<String>> out = new HashMap<>();
          for (Document d :
              collection
                  .find(eq(F_NAME, resourceName))
                  .projection(
                      Projections.fields(
                          Projections.include(F_DOCUMENT, F_CHUNK_ID, F_HASH),
                          Projections.excludeId()))) {
            ChunkIdentity id =
                new ChunkIdentity(resourceName, d.getString(F_DOCUMENT), intValue(d, F_CHUNK_ID));
            out.computeIfAbsent(id, k -> new HashSet<>()).add(d.getString(F_HASH));
          }
          return out;
        });
  }

  @Override
  public void insertAll(List<IndexedRecord> records) {
    if (records.isEmpty()) return;
    List<Document> docs = new ArrayList<>(records.size());
    for (IndexedRecord r : records) docs.add(toDocument(r));
    call(
        "insert records",
        () -> {
          collection.insertMany(docs);
          return null;
        });
    log.info("Inserted {} new embedding record(s) into {}", docs.size(), collection.getNamespace());
  }

  @Override
  public long deleteSuperseded(Map<ChunkIdentity, String> currentFingerprints) {
    if (currentFingerprints.isEmpty()) return 0;
    List<Bson> clauses = new ArrayList<>(currentFingerprints.size());
    currentFingerprints.forEach(
        (id, fingerprint) ->
            clauses.add(
                and(
                    eq(F_NAME, id.resourceName()),
                    eq(F_DOCUMENT, id.sourcePath()),
                    eq(F_CHUNK_ID, id.chunkId()),
                    ne(F_HASH, fingerprint))));
    long deleted =
        call(
            "delete superseded records",
            () -> collection.deleteMany(or(clauses)).getDeletedCount());
    log.debug("Deleted {} superseded record(s)", deleted);
    return deleted;
  }

  @Override
  public long deleteAll() {
    long deleted =
        call("clear collection", () -> collection.deleteMany(new Document()).getDeletedCount());
    log.warn("Cleared {} record(s) from {}", deleted, collection.getNamespace());
    return deleted;
  }

  @Override
  public List<String> distinctCategories() {
    return call(
        "list categories",
        () -> collection.distinct(F_TYPE, String.class).into(new ArrayList<>()));
  }

  @Override
  public boolean ensureVectorIndex(String indexName, int dimensions) {
    return call(
        "ensure vector index",
        () -> {
          ensureCollection();
          for (Document idx : collection.listSearchIndexes()) {
            if (indexName.equals(idx.getString("name"))) {
              return false;
            }
          }
          try {
            database.runCommand(
                createIndexCommand(
                    collection.getNamespace().getCollectionName(), indexName, dimensions));
          } catch (MongoCommandException e) {
            if (e.getErrorCode() == INDEX_ALREADY_EXISTS
                || String.valueOf(e.getErrorMessage()).contains("already exists")) {
              log.debug("Vector index {} was created concurrently", indexName);
              return false;
            }
            throw e;
          }
          log.info("Created vector search index {} on {}", indexName, collection.getNamespace());
          return true;
        });
  }

  private void ensureCollection() {
    String name = collection.getNamespace().getCollectionName();
    if (database.listCollectionNames().into(new ArrayList<>()).contains(name)) return;
    try {
      database.createCollection(name);
    } catch (MongoCommandException e) {
      if (e.getErrorCode() != NAMESPACE_EXISTS) throw e;
    }
  }

  static Document createIndexCommand(String collectionName, String indexName, int dimensions) {
    Document definition =
        new Document(
            "fields",
            List.of(
                new Document("type", "vector")
                    .append("path", F_EMBEDDING)
                    .append("numDimensions", dimensions)
                    .append("similarity", "cosine"),
                new Document("type", "filter").append("path", F_TYPE),
                new Document("type", "filter").append("path", F_NAME)));
    return new Document("createSearchIndexes", collectionName)
        .append(
            "indexes",
            List.of(
                new Document("name", indexName)
                    .append("type", "vectorSearch")
                    .append("definition", definition)));
  }

  @Override
  public List<SearchHit> similaritySearch(SimilarityQuery query) {
    List<Document> pipeline = searchPipeline(query);
    return call(
        "vector search",
        () -> {
          List<SearchHit> hits = new ArrayList<>();
          for (Document d : collection.aggregate(pipeline)) {
            Object score = d.get("score");
            hits.add(
                new SearchHit(
                    d.getString(F_CONTENT),
                    d.getString(F_TYPE),
                    d.getString(F_NAME),
                    d.getString(F_DOCUMENT),
                    intValue(d, F_CHUNK_ID),
                    score instanceof Number n ? n.doubleValue() : 0d));
          }
          return hits;
        });
  }

  static List<Document> searchPipeline(SimilarityQuery query) {
    Document vectorSearch =
        new Document("index", query.indexName())
            .append("queryVector", toList(query.vector()))
            .append(
                "filter",
                new Document(
                    "$and",
                    List.of(
                        new Document(F_TYPE, query.category()),
                        new Document(F_NAME, query.resourceName()))))
            .append("path", F_EMBEDDING)
            .append("numCandidates", query.numCandidates())
            .append("limit", query.limit());
    Document project =
        new Document(F_CONTENT, 1)
            .append(F_TYPE, 1)
            .append(F_NAME, 1)
            .append(F_DOCUMENT, 1)
            .append(F_CHUNK_ID, 1)
            .append("score", new Document("$meta", "vectorSearchScore"));
    return List.of(new Document("$vectorSearch", vectorSearch), new Document("$project", project));
  }

  static Document toDocument(IndexedRecord r) {
    return new Document(F_TYPE, r.category().label())
        .append(F_NAME, r.resourceName())
        .append(F_DOCUMENT, r.sourcePath())
        .append(F_CHUNK_ID, r.chunkId())
        .append(F_HASH, r.fingerprint())
        .append(F_CONTENT, r.content())
        .append(F_EMBEDDED, r.embeddedContent())
        .append(F_EMBEDDING, toList(r.embedding()));
  }

  private static List<Double> toList(double[] vector) {
    List<Double> out = new ArrayList<>(vector.length);
    for (double v : vector) out.add(v);
    return out;
  }

  private static int intValue(Document d, String field) {
    Object v = d.get(field);
    return v instanceof Number n ? n.intValue() : -1;
  }

  private <T> T call(String action, Supplier<T> op) {
    try {
      return op.get();
    } catch (MongoInterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancelledException("Interrupted while trying to " + action, e);
    } catch (MongoCommandException e) {
      if (e.getErrorCode() == NAMESPACE_NOT_FOUND) {
        throw new StoreException("Collection " + collection.getNamespace() + " not found", e);
      }
      throw new StoreException("Failed to " + action + ": " + e.getErrorMessage(), e);
    } catch (MongoException e) {
      throw new StoreException("Failed to " + action + ": " + e.getMessage(), e);
    } catch (IllegalStateException e) {
      // client already closed
      throw new StoreException("Failed to " + action + ": store handle is closed", e);
    }
  }

  @Override
  public void close() {
    client.close();
  }
}
