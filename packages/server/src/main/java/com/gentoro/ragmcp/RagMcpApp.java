package com.gentoro.ragmcp;

public class RagMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(RagMcpApp.class);

  public static void main(String[] args) {
    RagMcp app;
    try {
      app = new RagMcp(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(StartupParameters.usage());
      System.exit(2);
      return;
    }

    try {
      app.initialize();
      if (app.isServerMode()) {
        app.waitShutdownSignal();
      }
    } catch (Exception e) {
      log.error("Application failed", e);
      app.shutdown();
      System.exit(1);
    }
  }
}
