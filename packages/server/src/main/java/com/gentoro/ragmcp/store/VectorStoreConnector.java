package com.gentoro.ragmcp.store;

import com.gentoro.ragmcp.tenant.TenantCredential;

/** Opens a live store handle for a tenant credential. */
@FunctionalInterface
public interface VectorStoreConnector {

  /**
   * Connect and verify reachability.
   *
   * @throws com.gentoro.ragmcp.exception.ConnectionUnavailableException when the store cannot be
   *     reached within the configured timeout
   */
  VectorStore connect(TenantCredential credential);
}
