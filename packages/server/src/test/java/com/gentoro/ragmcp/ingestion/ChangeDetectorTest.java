package com.gentoro.ragmcp.ingestion;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.ragmcp.store.InMemoryVectorStore;
import com.gentoro.ragmcp.store.IndexedRecord;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChangeDetector")
class ChangeDetectorTest {

  private InMemoryVectorStore store;
  private final ChangeDetector detector = new ChangeDetector();

  private static Chunk chunk(String path, int id, String text) {
    return new Chunk("lib", path, id, text, path + "\n\n" + text);
  }

  private static IndexedRecord recorded(Chunk c) {
    return new IndexedRecord(
        c.category(),
        c.resourceName(),
        c.sourcePath(),
        c.chunkId(),
        c.fingerprint(),
        c.text(),
        c.embeddedText(),
        new double[] {1d});
  }

  @BeforeEach
  void setUp() {
    store = new InMemoryVectorStore();
    store.insertAll(
        List.of(recorded(chunk("guide.md", 0, "intro")), recorded(chunk("guide.md", 1, "usage"))));
  }

  @Test
  @DisplayName("unchanged chunks are skipped; changed and new chunks are kept")
  void keepsOnlyNewOrModified() {
    Chunk unchanged = chunk("guide.md", 0, "intro");
    Chunk modified = chunk("guide.md", 1, "usage, revised");
    Chunk added = chunk("guide.md", 2, "faq");

    List<Chunk> result = detector.filter(List.of(unchanged, modified, added), store);

    assertEquals(List.of(modified, added), result);
  }

  @Test
  @DisplayName("same text under another identity counts as new")
  void identityMatters() {
    Chunk moved = chunk("other.md", 0, "intro");
    assertEquals(List.of(moved), detector.filter(List.of(moved), store));
  }

  @Test
  @DisplayName("whitespace-only differences are not changes")
  void canonicalTextComparison() {
    Chunk crlf = chunk("guide.md", 0, "intro\r\n");
    assertTrue(detector.filter(List.of(crlf), store).isEmpty());
  }

  @Test
  @DisplayName("content reverting to an older recorded version is not re-ingested")
  void anyRecordedVersionMatches() {
    store.insertAll(List.of(recorded(chunk("guide.md", 1, "usage v2"))));
    assertTrue(detector.filter(List.of(chunk("guide.md", 1, "usage")), store).isEmpty());
  }

  @Test
  @DisplayName("reads recorded fingerprints once and never writes")
  void readOnlySingleQuery() {
    int inserts = store.insertCalls();
    detector.filter(
        List.of(chunk("guide.md", 0, "a"), chunk("guide.md", 1, "b"), chunk("x.md", 0, "c")),
        store);

    assertEquals(1, store.fingerprintReads());
    assertEquals(inserts, store.insertCalls());
    assertEquals(2, store.records().size());
  }
}
