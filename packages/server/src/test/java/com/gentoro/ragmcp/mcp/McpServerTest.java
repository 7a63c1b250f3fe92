package com.gentoro.ragmcp.mcp;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.ragmcp.RagMcp;
import com.gentoro.ragmcp.embedding.FakeEmbeddingClient;
import com.gentoro.ragmcp.exception.CredentialException;
import com.gentoro.ragmcp.http.EmbeddedJettyServer;
import com.gentoro.ragmcp.ingestion.IngestionPipeline;
import com.gentoro.ragmcp.ingestion.IngestionSettings;
import com.gentoro.ragmcp.query.QuerySettings;
import com.gentoro.ragmcp.query.VectorQueryEngine;
import com.gentoro.ragmcp.store.ConnectionMultiplexer;
import com.gentoro.ragmcp.store.InMemoryVectorStore;
import com.gentoro.ragmcp.tenant.CredentialStore;
import com.gentoro.ragmcp.tenant.TenantCredential;
import io.modelcontextprotocol.common.McpTransportContext;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("McpServer")
class McpServerTest {

  private static final MediaType JSON = MediaType.get("application/json");
  private static final CredentialStore CREDENTIALS =
      new CredentialStore(CredentialStore.DEFAULT_SCHEMES);

  @TempDir Path resources;

  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private IngestionPipeline pipeline;
  private ConnectionMultiplexer connections;
  private final OkHttpClient client = new OkHttpClient();
  private String url;

  @BeforeEach
  void setUp() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("http.hostname", "127.0.0.1");
    cfg.setProperty("http.port", 0);
    httpServer = new EmbeddedJettyServer(cfg);
    httpServer.prepare();

    FakeEmbeddingClient embedder = new FakeEmbeddingClient();
    connections = new ConnectionMultiplexer(credential -> new InMemoryVectorStore(), 4);
    pipeline = new IngestionPipeline(IngestionSettings.defaults(), embedder);
    ToolEndpoint tool =
        new ToolEndpoint(
            resources,
            List.of("stableclimgen"),
            connections,
            pipeline,
            new VectorQueryEngine(QuerySettings.defaults(), embedder));

    RagMcp ragMcp = mock(RagMcp.class);
    when(ragMcp.configuration()).thenReturn(cfg);
    when(ragMcp.httpServer()).thenReturn(httpServer);
    when(ragMcp.credentialStore()).thenReturn(CREDENTIALS);
    when(ragMcp.toolEndpoint()).thenReturn(tool);

    mcpServer = new McpServer(ragMcp);
    mcpServer.register();
    httpServer.start();
    url = "http://127.0.0.1:" + httpServer.getPort() + "/mcp";
  }

  @AfterEach
  void tearDown() {
    mcpServer.close();
    httpServer.close();
    pipeline.close();
    connections.close();
  }

  private Response post(String body, String sessionId, String credential) throws IOException {
    Request.Builder b =
        new Request.Builder()
            .url(url)
            .header("Accept", "application/json, text/event-stream")
            .post(RequestBody.create(body, JSON));
    if (sessionId != null) b.header("Mcp-Session-Id", sessionId);
    if (credential != null) b.header("mongodb-uri", credential);
    return client.newCall(b.build()).execute();
  }

  private static final String INITIALIZE =
      "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{"
          + "\"protocolVersion\":\"2025-03-26\",\"capabilities\":{},"
          + "\"clientInfo\":{\"name\":\"test\",\"version\":\"1.0\"}}}";

  @Test
  @DisplayName("requests without a tenant credential never reach the MCP transport")
  void gateGuardsEndpoint() throws IOException {
    try (Response r = post(INITIALIZE, null, null)) {
      assertEquals(400, r.code());
      assertTrue(r.body().string().contains("-32600"));
    }
  }

  @Test
  @DisplayName("the tool receives the caller's credential through the transport context")
  void toolCallCarriesTenant() throws IOException {
    String credential = "mongodb://tenant-a/rag";
    String sessionId;
    try (Response r = post(INITIALIZE, null, credential)) {
      assertEquals(200, r.code());
      assertTrue(r.body().string().contains("rag_server"));
      sessionId = r.header("Mcp-Session-Id");
    }
    assertNotNull(sessionId);

    try (Response r =
        post(
            "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}",
            sessionId,
            credential)) {
      assertTrue(r.isSuccessful());
    }

    String call =
        "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\",\"params\":{"
            + "\"name\":\"get_context_from_resources\",\"arguments\":{"
            + "\"question\":\"temperature\",\"resources_to_retrieve_from\":\"numpy\"}}}";
    try (Response r = post(call, sessionId, credential)) {
      assertEquals(200, r.code());
      String body = r.body().string();
      assertTrue(body.contains("Library 'numpy' is not supported."), body);
      assertFalse(body.contains("No tenant credential"), body);
    }
  }

  @Test
  @DisplayName("tenant lookup fails loudly when the transport context has no credential")
  void tenantFromContext() {
    TenantCredential tenant = CREDENTIALS.require("mongodb://db/rag");
    assertEquals(
        tenant,
        McpServer.tenantOf(
            McpTransportContext.create(Map.of(McpServer.TENANT_CONTEXT_KEY, tenant))));
    assertThrows(CredentialException.class, () -> McpServer.tenantOf(McpTransportContext.EMPTY));
  }
}
