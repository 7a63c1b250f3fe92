package com.gentoro.ragmcp.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.ragmcp.embedding.FakeEmbeddingClient;
import com.gentoro.ragmcp.exception.ConnectionUnavailableException;
import com.gentoro.ragmcp.ingestion.IngestionPipeline;
import com.gentoro.ragmcp.ingestion.IngestionSettings;
import com.gentoro.ragmcp.ingestion.RetentionPolicy;
import com.gentoro.ragmcp.query.QuerySettings;
import com.gentoro.ragmcp.query.VectorQueryEngine;
import com.gentoro.ragmcp.store.ConnectionMultiplexer;
import com.gentoro.ragmcp.store.InMemoryVectorStore;
import com.gentoro.ragmcp.tenant.CredentialStore;
import com.gentoro.ragmcp.tenant.TenantCredential;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ToolEndpoint")
class ToolEndpointTest {

  private static final CredentialStore CREDENTIALS =
      new CredentialStore(CredentialStore.DEFAULT_SCHEMES);
  private static final TenantCredential TENANT_A = CREDENTIALS.require("mongodb://a/rag");
  private static final TenantCredential TENANT_B = CREDENTIALS.require("mongodb+srv://b/rag");

  @TempDir Path resources;

  private final Map<TenantCredential, InMemoryVectorStore> stores = new ConcurrentHashMap<>();
  private FakeEmbeddingClient embedder;
  private ConnectionMultiplexer connections;
  private IngestionPipeline pipeline;

  @BeforeEach
  void setUp() throws Exception {
    Path lib = resources.resolve("stableclimgen");
    Files.createDirectories(lib);
    Files.writeString(lib.resolve("guide.md"), "Load global temperature data with load_era5().");
    Files.writeString(lib.resolve("example.json"), "{\"call\": \"load_era5\", \"var\": \"tas\"}");

    embedder = new FakeEmbeddingClient();
    connections =
        new ConnectionMultiplexer(
            credential -> stores.computeIfAbsent(credential, c -> new InMemoryVectorStore()), 4);
    pipeline = new IngestionPipeline(IngestionSettings.defaults(), embedder);
  }

  @AfterEach
  void tearDown() {
    pipeline.close();
    connections.close();
  }

  private ToolEndpoint endpoint(List<String> supported) {
    return new ToolEndpoint(
        resources,
        supported,
        connections,
        pipeline,
        new VectorQueryEngine(QuerySettings.defaults(), embedder));
  }

  @Test
  @DisplayName("unsupported resources are answered with a message and touch no store")
  void unsupportedResource() {
    String answer = endpoint(List.of("stableclimgen")).answer(TENANT_A, "q", "numpy");

    assertEquals("Library 'numpy' is not supported.", answer);
    assertEquals(0, connections.size());
  }

  @Test
  @DisplayName("a supported resource without a directory is reported")
  void missingDirectory() {
    String answer = endpoint(List.of("stableclimgen", "xarray")).answer(TENANT_A, "q", "xarray");

    assertEquals("Resource directory not found: " + resources.resolve("xarray"), answer);
    assertEquals(0, connections.size());
  }

  @Test
  @DisplayName("ingests the resource into the caller's store and answers from it")
  void ingestsAndAnswers() throws Exception {
    String answer =
        endpoint(List.of("stableclimgen"))
            .answer(TENANT_A, "global temperature data", "stableclimgen");

    JsonNode json = new ObjectMapper().readTree(answer);
    assertEquals(2, json.size());
    assertEquals("document", json.get(0).get(0).get("kind").asText());
    assertTrue(json.get(0).get(0).get("content").get(0).asText().contains("load_era5"));
    assertEquals("example", json.get(1).get(0).get("kind").asText());
    assertEquals(2, stores.get(TENANT_A).records().size());
  }

  @Test
  @DisplayName("tenants never see each other's records")
  void tenantIsolation() {
    ToolEndpoint tool = endpoint(List.of("stableclimgen"));
    tool.answer(TENANT_A, "temperature", "stableclimgen");
    tool.answer(TENANT_A, "temperature", "stableclimgen");
    tool.answer(TENANT_B, "temperature", "stableclimgen");

    assertNotSame(stores.get(TENANT_A), stores.get(TENANT_B));
    assertEquals(2, stores.get(TENANT_A).records().size());
    assertEquals(2, stores.get(TENANT_B).records().size());
    assertEquals(1, stores.get(TENANT_A).insertCalls());
  }

  @Test
  @DisplayName("destructive re-ingestion is used only when enabled")
  void destructiveReingest() {
    pipeline.close();
    IngestionSettings d = IngestionSettings.defaults();
    pipeline =
        new IngestionPipeline(
            new IngestionSettings(
                d.chunkSize(),
                d.chunkOverlap(),
                d.separators(),
                1,
                RetentionPolicy.KEEP_HISTORY,
                true),
            embedder);
    ToolEndpoint tool = endpoint(List.of("stableclimgen"));

    tool.answer(TENANT_A, "temperature", "stableclimgen");
    tool.answer(TENANT_A, "temperature", "stableclimgen");

    assertEquals(2, stores.get(TENANT_A).records().size());
    assertEquals(2, stores.get(TENANT_A).insertCalls());
  }

  @Test
  @DisplayName("the tenant's handle is released when the call returns")
  void releasesHandleAfterAnswer() {
    connections.close();
    connections =
        new ConnectionMultiplexer(
            credential -> stores.computeIfAbsent(credential, c -> new InMemoryVectorStore()), 1);
    ToolEndpoint tool = endpoint(List.of("stableclimgen"));

    tool.answer(TENANT_A, "temperature", "stableclimgen");
    assertFalse(stores.get(TENANT_A).isClosed());

    tool.answer(TENANT_B, "temperature", "stableclimgen");
    assertTrue(stores.get(TENANT_A).isClosed(), "evicted and no longer leased");
    assertFalse(stores.get(TENANT_B).isClosed());
  }

  @Test
  @DisplayName("store connection failures propagate as typed exceptions")
  void connectionFailure() {
    ConnectionMultiplexer failing =
        new ConnectionMultiplexer(
            credential -> {
              throw new ConnectionUnavailableException("unreachable", credential.redacted());
            },
            4);
    ToolEndpoint tool =
        new ToolEndpoint(
            resources,
            List.of("stableclimgen"),
            failing,
            pipeline,
            new VectorQueryEngine(QuerySettings.defaults(), embedder));

    assertThrows(
        ConnectionUnavailableException.class,
        () -> tool.answer(TENANT_A, "temperature", "stableclimgen"));
    assertEquals(0, failing.size());
  }
}
