package com.gentoro.ragmcp;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line arguments in {@code --name value} form.
 *
 * <p>Modes: {@code server} (default) serves MCP over HTTP; {@code query} runs one ingestion and
 * query for {@code --resource}, {@code --question} and {@code --store-uri} and prints the result;
 * {@code help} prints usage.
 */
public class StartupParameters {

  static final Set<String> MODES = Set.of("server", "query", "help");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "server");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    String mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode)) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }

    String configFile = parameters.get("config-file");
    if (configFile == null || configFile.isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }

    if ("query".equals(mode)) {
      for (String required : new String[] {"resource", "question", "store-uri"}) {
        String value = parameters.get(required);
        if (value == null || value.isBlank()) {
          throw new IllegalArgumentException("Mode 'query' requires --" + required);
        }
      }
    }
  }

  public String mode() {
    return parameters.get("mode");
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/rag-mcp.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file").orElse("classpath:application.yaml");
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public static String usage() {
    return String.join(
        System.lineSeparator(),
        "Usage: rag-mcp-server [--config-file <location>] [--mode server|query|help]",
        "  --mode server   serve the MCP endpoint over HTTP (default)",
        "  --mode query    --resource <name> --question <text> --store-uri <mongodb uri>",
        "                  ingest the resource and print the retrieved context",
        "  --config-file   classpath:<resource>, file:<uri> or a filesystem path");
  }
}
