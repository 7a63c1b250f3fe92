package com.gentoro.ragmcp.store;

import com.gentoro.ragmcp.tenant.TenantCredential;

/**
 * A tenant's hold on a cached store handle. The handle stays open until every lease on it is
 * closed, even when the cache evicts it in the meantime. Closing a lease twice has no effect.
 */
public final class StoreLease implements AutoCloseable {
  private final TenantCredential credential;
  private final VectorStore store;
  private final Runnable release;
  private boolean released;

  StoreLease(TenantCredential credential, VectorStore store, Runnable release) {
    this.credential = credential;
    this.store = store;
    this.release = release;
  }

  public TenantCredential credential() {
    return credential;
  }

  public VectorStore store() {
    return store;
  }

  @Override
  public void close() {
    synchronized (this) {
      if (released) return;
      released = true;
    }
    release.run();
  }
}
