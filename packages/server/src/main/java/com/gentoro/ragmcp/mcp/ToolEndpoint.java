package com.gentoro.ragmcp.mcp;

import com.gentoro.ragmcp.ingestion.IngestionPipeline;
import com.gentoro.ragmcp.query.VectorQueryEngine;
import com.gentoro.ragmcp.store.ConnectionMultiplexer;
import com.gentoro.ragmcp.store.StoreLease;
import com.gentoro.ragmcp.store.VectorStore;
import com.gentoro.ragmcp.tenant.TenantCredential;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * The {@code get_context_from_resources} tool: validates the requested resource, brings the
 * tenant's store up to date with it and answers the question from the store.
 *
 * <p>An unknown resource or a missing resource directory is answered with a plain-text message;
 * every other failure propagates as a typed exception.
 */
public class ToolEndpoint {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(ToolEndpoint.class);

  public static final String TOOL_NAME = "get_context_from_resources";
  public static final String ARG_QUESTION = "question";
  public static final String ARG_RESOURCE = "resources_to_retrieve_from";
  public static final String TOOL_DESCRIPTION =
      "Search Python package/library documentation and examples to find relevant context. "
          + "'question' is the user's question; 'resources_to_retrieve_from' is the name of the "
          + "library to search, one of the folder names of the resource directory.";

  private final Path resourcesRoot;
  private final Set<String> supportedResources;
  private final ConnectionMultiplexer connections;
  private final IngestionPipeline ingestionPipeline;
  private final VectorQueryEngine queryEngine;

  public ToolEndpoint(
      Path resourcesRoot,
      Collection<String> supportedResources,
      ConnectionMultiplexer connections,
      IngestionPipeline ingestionPipeline,
      VectorQueryEngine queryEngine) {
    this.resourcesRoot = resourcesRoot;
    this.supportedResources = Set.copyOf(supportedResources);
    this.connections = connections;
    this.ingestionPipeline = ingestionPipeline;
    this.queryEngine = queryEngine;
  }

  public static ToolEndpoint fromConfiguration(
      Configuration cfg,
      ConnectionMultiplexer connections,
      IngestionPipeline ingestionPipeline,
      VectorQueryEngine queryEngine) {
    return new ToolEndpoint(
        Path.of(cfg.getString("resources.root", "resources")),
        cfg.getList(String.class, "resources.supported", List.of("stableclimgen")),
        connections,
        ingestionPipeline,
        queryEngine);
  }

  public String answer(TenantCredential credential, String question, String resource) {
    log.info("Searching for context in {} documentation for question: {}", resource, question);
    if (resource == null || !supportedResources.contains(resource)) {
      log.warn("Library '{}' is not supported", resource);
      return "Library '" + resource + "' is not supported.";
    }

    Path directory = resourcesRoot.resolve(resource);
    if (!Files.isDirectory(directory)) {
      return "Resource directory not found: " + directory;
    }

    try (StoreLease lease = connections.acquire(credential)) {
      VectorStore store = lease.store();
      if (ingestionPipeline.settings().destructiveReingest()) {
        ingestionPipeline.rebuild(resource, directory, store);
      } else {
        ingestionPipeline.ingest(resource, directory, store);
      }
      return queryEngine.query(question, resource, store);
    }
  }

  public Set<String> supportedResources() {
    return supportedResources;
  }
}
