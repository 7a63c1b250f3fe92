package com.gentoro.ragmcp.ingestion;

import com.gentoro.ragmcp.embedding.EmbeddingClient;
import com.gentoro.ragmcp.exception.CancelledException;
import com.gentoro.ragmcp.exception.EmbeddingProviderException;
import com.gentoro.ragmcp.exception.RagMcpException;
import com.gentoro.ragmcp.store.ChunkIdentity;
import com.gentoro.ragmcp.store.IndexedRecord;
import com.gentoro.ragmcp.store.VectorStore;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Brings a tenant's store up to date with a resource directory.
 *
 * <p>Documents are loaded and split into chunks, chunks already recorded with the same fingerprint
 * are skipped, and the remaining ones are embedded in parallel on a bounded pool. Records are
 * written in a single insert once every embedding succeeded; if any embedding fails nothing is
 * written. Running {@link #ingest} twice over an unchanged directory inserts nothing the second
 * time.
 */
public class IngestionPipeline implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(IngestionPipeline.class);

  private final IngestionSettings settings;
  private final EmbeddingClient embeddingClient;
  private final DirectoryLoader loader;
  private final RecursiveTextSplitter splitter;
  private final ChangeDetector changeDetector;
  private final ExecutorService embeddingPool;

  public IngestionPipeline(IngestionSettings settings, EmbeddingClient embeddingClient) {
    this.settings = settings;
    this.embeddingClient = embeddingClient;
    this.loader = new DirectoryLoader();
    this.splitter = settings.newSplitter();
    this.changeDetector = new ChangeDetector();
    this.embeddingPool =
        Executors.newFixedThreadPool(settings.embeddingParallelism(), new EmbeddingThreads());
  }

  public IngestionSettings settings() {
    return settings;
  }

  /** Insert records for new or modified chunks of {@code sourceDirectory}. */
  public IngestionReport ingest(String resourceName, Path sourceDirectory, VectorStore store) {
    List<SourceDocument> documents = loader.load(resourceName, sourceDirectory);
    List<Chunk> chunks = chunkAll(documents);
    List<Chunk> changed = changeDetector.filter(chunks, store);

    List<IndexedRecord> records = embedAll(changed);
    store.insertAll(records);

    long deleted = 0;
    if (settings.retention() == RetentionPolicy.REPLACE_SUPERSEDED && !records.isEmpty()) {
      Map<ChunkIdentity, String> current = new LinkedHashMap<>();
      for (IndexedRecord r : records) current.put(r.identity(), r.fingerprint());
      deleted = store.deleteSuperseded(current);
    }

    IngestionReport report =
        new IngestionReport(
            resourceName,
            documents.size(),
            chunks.size(),
            chunks.size() - changed.size(),
            records.size(),
            deleted,
            false);
    if (records.isEmpty()) {
      log.debug("Resource {} is up to date: {}", resourceName, report);
    } else {
      log.info("Ingested resource {}: {}", resourceName, report);
    }
    return report;
  }

  /**
   * Destructive re-ingestion: every record of the tenant's collection is deleted and the whole
   * directory is ingested as new. The directory is loaded and embedded before anything is
   * deleted, so a failure leaves the store untouched.
   */
  public IngestionReport rebuild(String resourceName, Path sourceDirectory, VectorStore store) {
    List<SourceDocument> documents = loader.load(resourceName, sourceDirectory);
    List<Chunk> chunks = chunkAll(documents);
    List<IndexedRecord> records = embedAll(chunks);

    long deleted = store.deleteAll();
    store.insertAll(records);

    IngestionReport report =
        new IngestionReport(
            resourceName, documents.size(), chunks.size(), 0, records.size(), deleted, true);
    log.warn("Rebuilt tenant collection from resource {}: {}", resourceName, report);
    return report;
  }

  private List<Chunk> chunkAll(List<SourceDocument> documents) {
    List<Chunk> chunks = new ArrayList<>();
    for (SourceDocument d : documents) {
      chunks.addAll(splitter.chunk(d));
    }
    return chunks;
  }

  private List<IndexedRecord> embedAll(List<Chunk> chunks) {
    if (chunks.isEmpty()) return List.of();

    List<Future<IndexedRecord>> futures = new ArrayList<>(chunks.size());
    for (Chunk c : chunks) {
      futures.add(embeddingPool.submit(() -> toRecord(c)));
    }

    List<IndexedRecord> records = new ArrayList<>(chunks.size());
    try {
      for (Future<IndexedRecord> f : futures) {
        records.add(f.get());
      }
    } catch (InterruptedException e) {
      cancelAll(futures);
      Thread.currentThread().interrupt();
      throw new CancelledException("Ingestion cancelled while embedding chunks", e);
    } catch (ExecutionException e) {
      cancelAll(futures);
      Throwable cause = e.getCause();
      if (cause instanceof RagMcpException re) {
        throw re;
      }
      throw new EmbeddingProviderException("Failed to embed chunk: " + cause.getMessage(), cause);
    }
    return records;
  }

  private IndexedRecord toRecord(Chunk chunk) {
    double[] vector = embeddingClient.embed(chunk.embeddedText());
    return new IndexedRecord(
        chunk.category(),
        chunk.resourceName(),
        chunk.sourcePath(),
        chunk.chunkId(),
        chunk.fingerprint(),
        chunk.text(),
        chunk.embeddedText(),
        vector);
  }

  private static void cancelAll(List<? extends Future<?>> futures) {
    for (Future<?> f : futures) {
      f.cancel(true);
    }
  }

  @Override
  public void close() {
    embeddingPool.shutdownNow();
    try {
      if (!embeddingPool.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Embedding pool did not terminate within 5 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static final class EmbeddingThreads implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "embedding-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
