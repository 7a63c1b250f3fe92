package com.gentoro.ragmcp.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.ragmcp.RagMcp;
import com.gentoro.ragmcp.exception.CredentialException;
import com.gentoro.ragmcp.exception.ExceptionUtil;
import com.gentoro.ragmcp.exception.RagMcpException;
import com.gentoro.ragmcp.tenant.TenantCredential;
import com.gentoro.ragmcp.tenant.TenantGate;
import io.modelcontextprotocol.common.McpTransportContext;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import jakarta.servlet.DispatcherType;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.eclipse.jetty.ee10.servlet.FilterHolder;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Registers the MCP Streamable HTTP servlet, guarded by the {@link TenantGate}, on the shared
 * Jetty context.
 *
 * <p>The tenant credential accepted by the gate is copied from the servlet request into the MCP
 * transport context and handed to {@link ToolEndpoint} explicitly.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) servlet path; default "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) reject HTTP DELETE; default false
 *   <li><b>http.mcp.server.name</b> / <b>http.mcp.server.version</b> reported to clients; default
 *       "rag_server" / "1.0.0"
 *   <li><b>tenant.credential-header</b> header carrying the store URI; default "mongodb-uri"
 * </ul>
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(McpServer.class);

  static final String TENANT_CONTEXT_KEY = "tenant";

  private final RagMcp ragMcp;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(RagMcp ragMcp) {
    this.ragMcp = ragMcp;
  }

  /** Register the gate filter and the MCP servlet without managing the Jetty lifecycle. */
  public void register() {
    String endpoint =
        normalizeEndpoint(ragMcp.configuration().getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = ragMcp.configuration().getBoolean("http.mcp.disallow-delete", false);
    String serverName = ragMcp.configuration().getString("http.mcp.server.name", "rag_server");
    String serverVersion = ragMcp.configuration().getString("http.mcp.server.version", "1.0.0");
    String credentialHeader =
        ragMcp
            .configuration()
            .getString("tenant.credential-header", TenantGate.DEFAULT_CREDENTIAL_HEADER);

    var json = new JacksonMcpJsonMapper(new ObjectMapper());
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(json)
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .contextExtractor(
                request ->
                    TenantGate.tenantOf(request)
                        .map(
                            tenant ->
                                McpTransportContext.create(
                                    Map.<String, Object>of(TENANT_CONTEXT_KEY, tenant)))
                        .orElse(McpTransportContext.EMPTY))
            .build();

    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(contextTool())
            .build();

    var context = ragMcp.httpServer().getContextHandler();
    context.addFilter(
        new FilterHolder(new TenantGate(endpoint, credentialHeader, ragMcp.credentialStore())),
        "/*",
        EnumSet.of(DispatcherType.REQUEST));
    context.addServlet(new ServletHolder(servletTransport), endpoint);

    log.info(
        "MCP servlet registered at http://localhost:{}{}", ragMcp.httpServer().getPort(), endpoint);
  }

  private McpServerFeatures.SyncToolSpecification contextTool() {
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(ToolEndpoint.TOOL_NAME)
                .description(ToolEndpoint.TOOL_DESCRIPTION)
                .inputSchema(
                    new McpSchema.JsonSchema(
                        "object",
                        Map.of(
                            ToolEndpoint.ARG_QUESTION, Map.of("type", "string"),
                            ToolEndpoint.ARG_RESOURCE, Map.of("type", "string")),
                        List.of(ToolEndpoint.ARG_QUESTION, ToolEndpoint.ARG_RESOURCE),
                        false,
                        Collections.emptyMap(),
                        Collections.emptyMap()))
                .build())
        .callHandler(
            (exchange, request) -> {
              try {
                TenantCredential tenant = tenantOf(exchange.transportContext());
                Map<String, Object> args =
                    Objects.requireNonNullElse(
                        request.arguments(), Collections.<String, Object>emptyMap());
                String text =
                    ragMcp
                        .toolEndpoint()
                        .answer(
                            tenant,
                            stringArg(args, ToolEndpoint.ARG_QUESTION),
                            stringArg(args, ToolEndpoint.ARG_RESOURCE));
                return new McpSchema.CallToolResult(text, false);
              } catch (RagMcpException e) {
                if (e.isRetryable()) {
                  log.warn("{} failed temporarily: {}", ToolEndpoint.TOOL_NAME, e.toString());
                } else {
                  log.error("Failed to handle {} tool request", ToolEndpoint.TOOL_NAME, e);
                }
                return new McpSchema.CallToolResult(ExceptionUtil.describe(e), true);
              } catch (Exception e) {
                log.error("Failed to handle {} tool request", ToolEndpoint.TOOL_NAME, e);
                return new McpSchema.CallToolResult(ExceptionUtil.describe(e), true);
              }
            })
        .build();
  }

  static TenantCredential tenantOf(McpTransportContext context) {
    Object tenant = context == null ? null : context.get(TENANT_CONTEXT_KEY);
    if (tenant instanceof TenantCredential credential) {
      return credential;
    }
    throw new CredentialException("No tenant credential attached to this call");
  }

  private static String stringArg(Map<String, Object> args, String name) {
    Object value = args.get(name);
    return value == null ? null : value.toString();
  }

  /** Clean up MCP transport/resources. */
  @Override
  public void close() {
    if (mcpServer != null) {
      try {
        mcpServer.closeGracefully();
      } finally {
        mcpServer = null;
      }
    }
    if (servletTransport != null) {
      try {
        servletTransport.destroy();
      } finally {
        servletTransport = null;
      }
    }
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
