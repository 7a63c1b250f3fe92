package com.gentoro.ragmcp;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaultsToServerModeWithClasspathConfiguration() {
    StartupParameters p = new StartupParameters(new String[0]);
    assertEquals("server", p.mode());
    assertEquals("classpath:application.yaml", p.configFile());
  }

  @Test
  void parsesNameValuePairs() {
    StartupParameters p =
        new StartupParameters(
            new String[] {
              "--mode", "query",
              "--resource", "stableclimgen",
              "--question", "Get global temperature data",
              "--store-uri", "mongodb://localhost:27017",
              "--config-file", "config/local.yaml"
            });
    assertEquals("query", p.mode());
    assertEquals("stableclimgen", p.getParameter("resource"));
    assertEquals("Get global temperature data", p.getParameter("question"));
    assertEquals("config/local.yaml", p.configFile());
    assertTrue(p.getOptionalParameter("missing").isEmpty());
  }

  @Test
  void queryModeRequiresItsArguments() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> new StartupParameters(new String[] {"--mode", "query", "--resource", "lib"}));
    assertTrue(e.getMessage().contains("--question"));
  }

  @Test
  void rejectsUnknownMode() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "interactive"}));
  }
}
