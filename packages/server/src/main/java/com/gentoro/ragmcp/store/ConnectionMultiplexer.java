package com.gentoro.ragmcp.store;

import com.gentoro.ragmcp.exception.CancelledException;
import com.gentoro.ragmcp.exception.StateException;
import com.gentoro.ragmcp.exception.StoreException;
import com.gentoro.ragmcp.tenant.TenantCredential;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.apache.commons.configuration2.Configuration;

/**
 * Bounded cache of live store handles keyed by tenant credential.
 *
 * <p>Entries are kept in least-recently-used order. When the cache grows beyond its capacity the
 * least recently used connected entry is evicted. Callers hold a {@link StoreLease} while they
 * use a handle; an evicted handle is closed once its last lease is released, so evicting one
 * tenant never breaks a call that is still running against it.
 *
 * <p>Connecting happens outside the cache lock; concurrent callers asking for the same new
 * credential wait on the single in-flight connection instead of opening their own. A failed
 * connection is never cached.
 */
public class ConnectionMultiplexer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(ConnectionMultiplexer.class);

  public static final int DEFAULT_CAPACITY = 32;

  /** Cache slot. {@code leases} and {@code retired} are guarded by the multiplexer lock. */
  private static final class Entry {
    final CompletableFuture<VectorStore> handle = new CompletableFuture<>();
    int leases;
    boolean retired;

    boolean connected() {
      return handle.isDone() && !handle.isCompletedExceptionally();
    }
  }

  private final VectorStoreConnector connector;
  private final int capacity;
  private final Object lock = new Object();
  private final LinkedHashMap<TenantCredential, Entry> entries =
      new LinkedHashMap<>(16, 0.75f, true);
  private boolean closed;

  public ConnectionMultiplexer(VectorStoreConnector connector, int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1 (was " + capacity + ")");
    }
    this.connector = connector;
    this.capacity = capacity;
  }

  public static ConnectionMultiplexer fromConfiguration(
      VectorStoreConnector connector, Configuration cfg) {
    return new ConnectionMultiplexer(
        connector, cfg.getInt("store.cache-capacity", DEFAULT_CAPACITY));
  }

  /**
   * Lease the live handle for this credential, connecting on first use. The lease must be closed
   * once the caller is done with the handle.
   *
   * @throws com.gentoro.ragmcp.exception.ConnectionUnavailableException when the store cannot be
   *     reached; nothing is cached in that case
   */
  public StoreLease acquire(TenantCredential credential) {
    Entry entry;
    boolean owner = false;
    List<VectorStore> evicted = List.of();
    synchronized (lock) {
      if (closed) {
        throw new StateException("Connection multiplexer is closed");
      }
      entry = entries.get(credential);
      if (entry == null) {
        entry = new Entry();
        entries.put(credential, entry);
        owner = true;
        evicted = evictOverflow();
      }
      entry.leases++;
    }
    closeAll(evicted);

    boolean leased = false;
    try {
      if (owner) {
        connect(credential, entry);
      }
      VectorStore store = await(credential, entry.handle);
      Entry held = entry;
      StoreLease lease = new StoreLease(credential, store, () -> release(held));
      leased = true;
      return lease;
    } finally {
      if (!leased) {
        release(entry);
      }
    }
  }

  private void connect(TenantCredential credential, Entry entry) {
    log.info("Opening store connection for {}", credential.redacted());
    VectorStore store;
    try {
      store = connector.connect(credential);
    } catch (Throwable e) {
      synchronized (lock) {
        entries.remove(credential, entry);
      }
      entry.handle.completeExceptionally(e);
      throw e;
    }

    boolean orphaned;
    synchronized (lock) {
      orphaned = closed;
    }
    if (orphaned) {
      StateException e = new StateException("Connection multiplexer closed while connecting");
      entry.handle.completeExceptionally(e);
      closeAll(List.of(store));
      throw e;
    }
    entry.handle.complete(store);
  }

  private static VectorStore await(
      TenantCredential credential, CompletableFuture<VectorStore> pending) {
    try {
      return pending.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancelledException(
          "Interrupted while waiting for store connection " + credential.redacted(), e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) {
        throw re;
      }
      if (cause instanceof Error err) {
        throw err;
      }
      throw new StoreException("Failed to connect to store " + credential.redacted(), cause);
    }
  }

  private void release(Entry entry) {
    VectorStore idle = null;
    synchronized (lock) {
      entry.leases--;
      if (entry.retired && entry.leases == 0 && entry.connected()) {
        idle = entry.handle.join();
      }
    }
    if (idle != null) {
      log.debug("Closing retired store connection after its last lease was released");
      closeAll(List.of(idle));
    }
  }

  /**
   * Must be called while holding {@link #lock}. In-flight entries are never evicted; evicted
   * entries still leased are closed by the last {@link #release}.
   */
  private List<VectorStore> evictOverflow() {
    List<VectorStore> idle = new ArrayList<>();
    Iterator<Map.Entry<TenantCredential, Entry>> it = entries.entrySet().iterator();
    while (entries.size() > capacity && it.hasNext()) {
      Map.Entry<TenantCredential, Entry> eldest = it.next();
      Entry entry = eldest.getValue();
      if (!entry.connected()) {
        continue;
      }
      it.remove();
      entry.retired = true;
      if (entry.leases == 0) {
        idle.add(entry.handle.join());
      }
      log.info(
          "Evicting least recently used store connection {} ({} active lease(s))",
          eldest.getKey().redacted(),
          entry.leases);
    }
    return idle;
  }

  private static void closeAll(List<VectorStore> stores) {
    for (VectorStore store : stores) {
      try {
        store.close();
      } catch (RuntimeException e) {
        log.warn("Failed to close store connection", e);
      }
    }
  }

  /** Number of cached (connected or connecting) entries. */
  public int size() {
    synchronized (lock) {
      return entries.size();
    }
  }

  public int capacity() {
    return capacity;
  }

  /** Whether a handle for this credential is cached, without touching the LRU order. */
  public boolean isCached(TenantCredential credential) {
    synchronized (lock) {
      return entries.containsKey(credential);
    }
  }

  /** Close idle handles now and leased ones when their last lease is released. */
  @Override
  public void close() {
    List<VectorStore> idle = new ArrayList<>();
    int deferred = 0;
    synchronized (lock) {
      if (closed) return;
      closed = true;
      for (Entry entry : entries.values()) {
        entry.retired = true;
        if (!entry.connected()) continue;
        if (entry.leases == 0) {
          idle.add(entry.handle.join());
        } else {
          deferred++;
        }
      }
      entries.clear();
    }
    log.info(
        "Closing {} cached store connection(s), {} more once released", idle.size(), deferred);
    closeAll(idle);
  }
}
