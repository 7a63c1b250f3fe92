package com.gentoro.ragmcp.http;

import com.gentoro.ragmcp.exception.ConfigException;
import com.gentoro.ragmcp.exception.ExceptionUtil;
import com.gentoro.ragmcp.exception.NetworkException;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (start/stop/join) and exposes the underlying {@link
 * Server} and {@link ServletContextHandler} so that other components can register their filters
 * and servlets. Binds to {@code http.hostname}:{@code http.port}; port 0 picks a free port.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  public static final int DEFAULT_PORT = 8050;
  static final String ANY_HOST = "0.0.0.0";

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Builds the server, its single connector and the root context; does not start it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      String host = bindHost();
      int port = bindPort();
      Server s = new Server();
      ServerConnector connector = new ServerConnector(s);
      if (!ANY_HOST.equals(host)) {
        connector.setHost(host);
      }
      connector.setPort(port);
      s.addConnector(connector);

      ServletContextHandler context = new ServletContextHandler();
      context.setContextPath("/");
      s.setHandler(context);

      this.server = s;
      this.contextHandler = context;
      log.debug("HTTP server prepared for {}:{}", host, port);
    }
  }

  private String bindHost() {
    String host = configuration.getString("http.hostname", ANY_HOST);
    if (host == null || host.isBlank()) {
      throw new ConfigException("Missing http.hostname configuration");
    }
    return host.trim();
  }

  private int bindPort() {
    int port;
    try {
      port = configuration.getInt("http.port", DEFAULT_PORT);
    } catch (RuntimeException e) {
      throw new ConfigException("http.port is not a number", e);
    }
    if (port < 0 || port > 65535) {
      throw new ConfigException("http.port out of range: " + port);
    }
    return port;
  }

  /** Start Jetty if not already started. */
  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }

      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, ex -> new NetworkException("Could not start the HTTP server on " + bindPort(), ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server != null) {
        try {
          if (server.isRunning() || server.isStarted() || server.isStarting()) {
            server.stop();
          }
        } catch (Exception e) {
          log.error("Error stopping jetty server; continuing shutdown", e);
        } finally {
          server = null;
          contextHandler = null;
        }
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        for (Connector c : server.getConnectors()) {
          if (c instanceof ServerConnector sc && sc.getLocalPort() > 0) {
            return sc.getLocalPort();
          }
        }
      }
      return configuration.getInt("http.port", DEFAULT_PORT);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
