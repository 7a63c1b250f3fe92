package com.gentoro.ragmcp.actuator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.ragmcp.RagMcp;
import com.gentoro.ragmcp.store.ConnectionMultiplexer;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health check endpoint in the style of Spring Boot's actuator.
 *
 * <p>Registers a servlet at path: /actuator/health
 *
 * <p>Response body: {"status":"UP","connections":N} where N is the number of cached tenant store
 * connections.
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(ActuatorService.class);

  public static final String HEALTH_PATH = "/actuator/health";

  private final RagMcp ragMcp;

  public ActuatorService(RagMcp ragMcp) {
    this.ragMcp = ragMcp;
  }

  /** Register the actuator servlet with the shared Jetty context handler. */
  public void register() {
    ragMcp
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(new HealthServlet(ragMcp.connections())), HEALTH_PATH);
    log.info("Actuator health endpoint registered at {}", HEALTH_PATH);
  }

  static class HealthServlet extends HttpServlet {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final transient ConnectionMultiplexer connections;

    HealthServlet(ConnectionMultiplexer connections) {
      this.connections = connections;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      ObjectNode payload = MAPPER.createObjectNode();
      payload.put("status", "UP");
      payload.put("connections", connections.size());
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println(MAPPER.writeValueAsString(payload));
      }
    }
  }
}
