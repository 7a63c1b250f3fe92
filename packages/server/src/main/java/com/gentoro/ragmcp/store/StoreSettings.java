package com.gentoro.ragmcp.store;

import org.apache.commons.configuration2.Configuration;

/** Where tenant records live inside each tenant's deployment ({@code store.*} keys). */
public record StoreSettings(
    String database, String collection, int connectTimeoutMs, int cacheCapacity) {

  public static final String DEFAULT_DATABASE = "rag";
  public static final String DEFAULT_COLLECTION = "embeddings";
  public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5000;

  public static StoreSettings fromConfiguration(Configuration cfg) {
    return new StoreSettings(
        cfg.getString("store.database", DEFAULT_DATABASE),
        cfg.getString("store.collection", DEFAULT_COLLECTION),
        cfg.getInt("store.connect-timeout-ms", DEFAULT_CONNECT_TIMEOUT_MS),
        cfg.getInt("store.cache-capacity", ConnectionMultiplexer.DEFAULT_CAPACITY));
  }
}
