package com.gentoro.ragmcp.embedding;

import org.apache.commons.configuration2.Configuration;

/** Connection and model parameters of the embedding provider ({@code embedding.*} keys). */
public record EmbeddingSettings(
    String baseUrl, String model, int dimensions, double temperature, int timeoutSeconds) {

  public static final String DEFAULT_BASE_URL = "http://litellm:4000";
  public static final String DEFAULT_MODEL = "ollama/mxbai-embed-large:latest";
  public static final int DEFAULT_DIMENSIONS = 1024;

  public static EmbeddingSettings fromConfiguration(Configuration cfg) {
    return new EmbeddingSettings(
        cfg.getString("embedding.base-url", DEFAULT_BASE_URL),
        cfg.getString("embedding.model", DEFAULT_MODEL),
        cfg.getInt("embedding.dimensions", DEFAULT_DIMENSIONS),
        cfg.getDouble("embedding.temperature", 0.2),
        cfg.getInt("embedding.timeout-seconds", 60));
  }
}
