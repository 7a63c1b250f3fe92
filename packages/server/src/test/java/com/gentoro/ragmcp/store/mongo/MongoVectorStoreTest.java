package com.gentoro.ragmcp.store.mongo;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.ragmcp.ingestion.ResourceCategory;
import com.gentoro.ragmcp.store.IndexedRecord;
import com.gentoro.ragmcp.store.SimilarityQuery;
import java.util.List;
import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MongoVectorStore")
class MongoVectorStoreTest {

  @Test
  @DisplayName("$vectorSearch filters on category and resource and projects the score")
  void searchPipeline() {
    List<Document> pipeline =
        MongoVectorStore.searchPipeline(
            new SimilarityQuery(
                "vector_index", new double[] {0.25, -0.5}, "document", "stableclimgen", 15, 3));

    assertEquals(2, pipeline.size());
    Document search = pipeline.get(0).get("$vectorSearch", Document.class);
    assertEquals("vector_index", search.getString("index"));
    assertEquals("embedding", search.getString("path"));
    assertEquals(List.of(0.25, -0.5), search.getList("queryVector", Double.class));
    assertEquals(15, search.getInteger("numCandidates"));
    assertEquals(3, search.getInteger("limit"));
    assertEquals(
        List.of(
            new Document("resource_type", "document"),
            new Document("resource_name", "stableclimgen")),
        search.get("filter", Document.class).getList("$and", Document.class));

    Document project = pipeline.get(1).get("$project", Document.class);
    assertEquals(new Document("$meta", "vectorSearchScore"), project.get("score"));
    for (String field :
        List.of("content", "resource_type", "resource_name", "document", "chunk_id")) {
      assertEquals(1, project.getInteger(field), field);
    }
    assertFalse(project.containsKey("embedding"));
  }

  @Test
  @DisplayName("records are stored under the collection's field names")
  void recordDocument() {
    IndexedRecord record =
        new IndexedRecord(
            ResourceCategory.EXAMPLE,
            "stableclimgen",
            "examples/query.json",
            2,
            "c0ffee",
            "{\"variable\": \"tas\"}",
            "examples/query.json\n\n{\"variable\": \"tas\"}",
            new double[] {0.123456789012345, 1e-12});

    Document doc = MongoVectorStore.toDocument(record);

    assertEquals("example", doc.getString("resource_type"));
    assertEquals("stableclimgen", doc.getString("resource_name"));
    assertEquals("examples/query.json", doc.getString("document"));
    assertEquals(2, doc.getInteger("chunk_id"));
    assertEquals("c0ffee", doc.getString("file_hash"));
    assertEquals("{\"variable\": \"tas\"}", doc.getString("content"));
    assertEquals(
        "examples/query.json\n\n{\"variable\": \"tas\"}", doc.getString("embedded_content"));
    assertEquals(List.of(0.123456789012345, 1e-12), doc.getList("embedding", Double.class));
    assertEquals(8, doc.size());
  }

  @Test
  @DisplayName("the vector index uses cosine similarity with category and resource filters")
  void indexDefinition() {
    Document command = MongoVectorStore.createIndexCommand("embeddings", "vector_index", 1024);

    assertEquals("embeddings", command.getString("createSearchIndexes"));
    List<Document> indexes = command.getList("indexes", Document.class);
    assertEquals(1, indexes.size());
    assertEquals("vector_index", indexes.get(0).getString("name"));
    assertEquals("vectorSearch", indexes.get(0).getString("type"));

    List<Document> fields =
        indexes.get(0).get("definition", Document.class).getList("fields", Document.class);
    assertEquals(
        List.of(
            new Document("type", "vector")
                .append("path", "embedding")
                .append("numDimensions", 1024)
                .append("similarity", "cosine"),
            new Document("type", "filter").append("path", "resource_type"),
            new Document("type", "filter").append("path", "resource_name")),
        fields);
  }
}
