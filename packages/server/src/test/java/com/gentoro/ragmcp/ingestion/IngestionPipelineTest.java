package com.gentoro.ragmcp.ingestion;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.ragmcp.embedding.FakeEmbeddingClient;
import com.gentoro.ragmcp.exception.EmbeddingProviderException;
import com.gentoro.ragmcp.store.InMemoryVectorStore;
import com.gentoro.ragmcp.store.IndexedRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("IngestionPipeline")
class IngestionPipelineTest {

  @TempDir Path resources;

  private Path library;
  private FakeEmbeddingClient embedder;
  private InMemoryVectorStore store;
  private IngestionPipeline pipeline;

  /** A paragraph long enough to form its own chunk with the default settings. */
  private static String paragraph(String word) {
    return (word + " ").repeat(300 / (word.length() + 1)).trim();
  }

  @BeforeEach
  void setUp() throws Exception {
    library = resources.resolve("stableclimgen");
    Files.createDirectories(library.resolve("examples"));
    Files.writeString(
        library.resolve("guide.md"),
        paragraph("temperature")
            + "\n\n"
            + paragraph("precipitation")
            + "\n\n"
            + paragraph("wind"));
    Files.writeString(library.resolve("examples/query.json"), "{\"variable\": \"tas\"}");
    embedder = new FakeEmbeddingClient();
    store = new InMemoryVectorStore();
    pipeline = new IngestionPipeline(IngestionSettings.defaults(), embedder);
  }

  @AfterEach
  void tearDown() {
    pipeline.close();
  }

  @Test
  @DisplayName("first run inserts one record per chunk in a single write")
  void firstRun() {
    IngestionReport report = pipeline.ingest("stableclimgen", library, store);

    assertEquals(2, report.documents());
    assertEquals(4, report.chunks());
    assertEquals(4, report.inserted());
    assertEquals(0, report.skipped());
    assertEquals(1, store.insertCalls());

    List<IndexedRecord> records = store.records();
    assertEquals(4, records.size());
    IndexedRecord example =
        records.stream().filter(r -> r.sourcePath().endsWith(".json")).findFirst().orElseThrow();
    assertEquals(ResourceCategory.EXAMPLE, example.category());
    assertEquals(
        3, records.stream().filter(r -> r.category() == ResourceCategory.DOCUMENT).count());
    assertEquals(
        List.of(0, 1, 2),
        records.stream()
            .filter(r -> r.sourcePath().equals("guide.md"))
            .map(IndexedRecord::chunkId)
            .sorted()
            .collect(Collectors.toList()));
  }

  @Test
  @DisplayName("re-running over an unchanged directory inserts and embeds nothing")
  void idempotent() {
    pipeline.ingest("stableclimgen", library, store);
    int embeddings = embedder.calls().size();

    IngestionReport second = pipeline.ingest("stableclimgen", library, store);

    assertEquals(0, second.inserted());
    assertEquals(4, second.skipped());
    assertEquals(4, store.records().size());
    assertEquals(1, store.insertCalls());
    assertEquals(embeddings, embedder.calls().size());
  }

  @Test
  @DisplayName("one modified chunk yields exactly one new record and keeps the old one")
  void incremental() throws Exception {
    pipeline.ingest("stableclimgen", library, store);
    Files.writeString(
        library.resolve("guide.md"),
        paragraph("temperature") + "\n\n" + paragraph("humidity") + "\n\n" + paragraph("wind"));

    IngestionReport report = pipeline.ingest("stableclimgen", library, store);

    assertEquals(1, report.inserted());
    assertEquals(0, report.deleted());
    List<IndexedRecord> chunk1 =
        store.records().stream()
            .filter(r -> r.sourcePath().equals("guide.md") && r.chunkId() == 1)
            .collect(Collectors.toList());
    assertEquals(2, chunk1.size());
    assertTrue(chunk1.stream().anyMatch(r -> r.content().startsWith("humidity")));
    assertTrue(chunk1.stream().anyMatch(r -> r.content().startsWith("precipitation")));
  }

  @Test
  @DisplayName("replace-superseded retention deletes the outdated version")
  void replaceSuperseded() throws Exception {
    pipeline.close();
    IngestionSettings d = IngestionSettings.defaults();
    pipeline =
        new IngestionPipeline(
            new IngestionSettings(
                d.chunkSize(),
                d.chunkOverlap(),
                d.separators(),
                2,
                RetentionPolicy.REPLACE_SUPERSEDED,
                false),
            embedder);
    pipeline.ingest("stableclimgen", library, store);
    Files.writeString(
        library.resolve("guide.md"),
        paragraph("temperature") + "\n\n" + paragraph("humidity") + "\n\n" + paragraph("wind"));

    IngestionReport report = pipeline.ingest("stableclimgen", library, store);

    assertEquals(1, report.inserted());
    assertEquals(1, report.deleted());
    assertEquals(4, store.records().size());
    assertTrue(store.records().stream().noneMatch(r -> r.content().startsWith("precipitation")));
  }

  @Test
  @DisplayName("an embedding failure aborts the run before anything is written")
  void allOrNothing() throws Exception {
    Files.writeString(
        library.resolve("broken.md"), "this chunk is " + FakeEmbeddingClient.FAIL_MARKER);

    assertThrows(
        EmbeddingProviderException.class, () -> pipeline.ingest("stableclimgen", library, store));

    assertTrue(store.records().isEmpty());
    assertEquals(0, store.insertCalls());
  }

  @Test
  @DisplayName("rebuild clears the collection and ingests everything again")
  void rebuild() {
    pipeline.ingest("stableclimgen", library, store);

    IngestionReport report = pipeline.rebuild("stableclimgen", library, store);

    assertTrue(report.rebuilt());
    assertEquals(4, report.deleted());
    assertEquals(4, report.inserted());
    assertEquals(4, store.records().size());
  }

  @Test
  @DisplayName("a failing rebuild leaves existing records in place")
  void failingRebuildKeepsRecords() throws Exception {
    pipeline.ingest("stableclimgen", library, store);
    Files.writeString(library.resolve("broken.md"), FakeEmbeddingClient.FAIL_MARKER);

    assertThrows(
        EmbeddingProviderException.class, () -> pipeline.rebuild("stableclimgen", library, store));

    assertEquals(4, store.records().size());
  }

  @Test
  @DisplayName("settings are read from configuration keys")
  void settingsFromConfiguration() {
    org.apache.commons.configuration2.BaseConfiguration cfg =
        new org.apache.commons.configuration2.BaseConfiguration();
    cfg.setProperty("ingestion.chunk-size", 300);
    cfg.setProperty("ingestion.retention", "replace-superseded");
    cfg.setProperty("ingestion.destructive-reingest", "true");

    IngestionSettings s = IngestionSettings.fromConfiguration(cfg);

    assertEquals(300, s.chunkSize());
    assertEquals(50, s.chunkOverlap());
    assertEquals(List.of("\n\n"), s.separators());
    assertEquals(RetentionPolicy.REPLACE_SUPERSEDED, s.retention());
    assertTrue(s.destructiveReingest());
  }
}
