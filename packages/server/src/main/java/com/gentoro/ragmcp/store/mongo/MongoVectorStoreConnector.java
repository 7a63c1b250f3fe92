package com.gentoro.ragmcp.store.mongo;

import com.gentoro.ragmcp.exception.ConnectionUnavailableException;
import com.gentoro.ragmcp.store.StoreSettings;
import com.gentoro.ragmcp.store.VectorStore;
import com.gentoro.ragmcp.store.VectorStoreConnector;
import com.gentoro.ragmcp.tenant.TenantCredential;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoConfigurationException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.bson.Document;

/**
 * Opens a MongoDB client for a tenant credential and verifies it with a {@code ping} bounded by
 * the configured server selection timeout.
 */
public class MongoVectorStoreConnector implements VectorStoreConnector {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(MongoVectorStoreConnector.class);

  private final StoreSettings settings;

  public MongoVectorStoreConnector(StoreSettings settings) {
    this.settings = settings;
  }

  @Override
  public VectorStore connect(TenantCredential credential) {
    String store = credential.redacted();
    MongoClientSettings clientSettings;
    try {
      clientSettings =
          MongoClientSettings.builder()
              .applyConnectionString(new ConnectionString(credential.value()))
              .applyToClusterSettings(
                  b -> b.serverSelectionTimeout(settings.connectTimeoutMs(), TimeUnit.MILLISECONDS))
              .applyToSocketSettings(
                  b -> b.connectTimeout(settings.connectTimeoutMs(), TimeUnit.MILLISECONDS))
              .build();
    } catch (IllegalArgumentException e) {
      throw new ConnectionUnavailableException(describe(credential, e), store, e);
    }

    MongoClient client = null;
    try {
      client = MongoClients.create(clientSettings);
      client.getDatabase(settings.database()).runCommand(new Document("ping", 1));
    } catch (MongoException e) {
      if (client != null) {
        client.close();
      }
      throw new ConnectionUnavailableException(describe(credential, e), store, e);
    }
    log.debug("Connected to store {}", store);
    return new MongoVectorStore(client, settings.database(), settings.collection());
  }

  static String describe(TenantCredential credential, RuntimeException failure) {
    String store = credential.redacted();
    String cause = String.valueOf(failure.getMessage());
    boolean srv = credential.value().startsWith("mongodb+srv://");
    if (failure instanceof MongoConfigurationException
        || (srv && (failure instanceof IllegalArgumentException || mentionsSrvLookup(cause)))) {
      return "Store host " + store + " could not be resolved: " + cause;
    }
    if (failure instanceof IllegalArgumentException) {
      return "Store connection string " + store + " is malformed: " + cause;
    }
    return "Store " + store + " is unreachable: " + cause;
  }

  private static boolean mentionsSrvLookup(String message) {
    String m = message.toLowerCase(Locale.ROOT);
    return m.contains("srv") && (m.contains("lookup") || m.contains("resolution"));
  }
}
