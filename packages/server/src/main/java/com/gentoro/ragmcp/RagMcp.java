package com.gentoro.ragmcp;

import com.gentoro.ragmcp.actuator.ActuatorService;
import com.gentoro.ragmcp.embedding.EmbeddingClient;
import com.gentoro.ragmcp.embedding.EmbeddingSettings;
import com.gentoro.ragmcp.embedding.OpenAiCompatibleEmbeddingClient;
import com.gentoro.ragmcp.exception.NetworkException;
import com.gentoro.ragmcp.exception.StateException;
import com.gentoro.ragmcp.http.EmbeddedJettyServer;
import com.gentoro.ragmcp.ingestion.IngestionPipeline;
import com.gentoro.ragmcp.ingestion.IngestionSettings;
import com.gentoro.ragmcp.mcp.McpServer;
import com.gentoro.ragmcp.mcp.ToolEndpoint;
import com.gentoro.ragmcp.query.QuerySettings;
import com.gentoro.ragmcp.query.VectorQueryEngine;
import com.gentoro.ragmcp.store.ConnectionMultiplexer;
import com.gentoro.ragmcp.store.StoreSettings;
import com.gentoro.ragmcp.store.mongo.MongoVectorStoreConnector;
import com.gentoro.ragmcp.tenant.CredentialStore;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/** Application context: builds every component from configuration and owns their lifecycle. */
public class RagMcp {

  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(RagMcp.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private CredentialStore credentialStore;
  private ConnectionMultiplexer connections;
  private EmbeddingClient embeddingClient;
  private IngestionPipeline ingestionPipeline;
  private VectorQueryEngine queryEngine;
  private ToolEndpoint toolEndpoint;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public RagMcp(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // The MCP SDK and Jetty log through SLF4J; silence java.util.logging.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    if ("help".equals(startupParameters.mode())) {
      System.out.println(StartupParameters.usage());
      return;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.ragmcp.logging.LoggingService.applyConfiguration(configuration());

    this.credentialStore = CredentialStore.fromConfiguration(configuration());
    this.connections =
        ConnectionMultiplexer.fromConfiguration(
            new MongoVectorStoreConnector(StoreSettings.fromConfiguration(configuration())),
            configuration());
    this.embeddingClient =
        new OpenAiCompatibleEmbeddingClient(EmbeddingSettings.fromConfiguration(configuration()));
    this.ingestionPipeline =
        new IngestionPipeline(
            IngestionSettings.fromConfiguration(configuration()), embeddingClient);
    this.queryEngine =
        new VectorQueryEngine(QuerySettings.fromConfiguration(configuration()), embeddingClient);
    this.toolEndpoint =
        ToolEndpoint.fromConfiguration(
            configuration(), connections, ingestionPipeline, queryEngine);

    switch (startupParameters.mode()) {
      case "server":
        startServer();
        break;
      case "query":
        try {
          System.out.println(runQuery());
        } finally {
          shutdown();
        }
        break;
      default:
        shutdown();
        throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  private void startServer() {
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new ActuatorService(this).register();
      this.mcpServer = new McpServer(this);
      mcpServer.register();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
  }

  /** One ingestion and query for the resource, question and store given on the command line. */
  private String runQuery() {
    return toolEndpoint.answer(
        credentialStore.require(startupParameters.getParameter("store-uri")),
        startupParameters.getParameter("question"),
        startupParameters.getParameter("resource"));
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "rag-mcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
        closeQuietly(ingestionPipeline);
        closeQuietly(connections);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {} during shutdown", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  public boolean isServerMode() {
    return "server".equals(startupParameters.mode());
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("RagMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public CredentialStore credentialStore() {
    return credentialStore;
  }

  public ConnectionMultiplexer connections() {
    return connections;
  }

  public ToolEndpoint toolEndpoint() {
    return toolEndpoint;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
