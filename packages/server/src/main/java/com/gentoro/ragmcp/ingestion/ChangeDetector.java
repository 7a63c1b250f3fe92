package com.gentoro.ragmcp.ingestion;

import com.gentoro.ragmcp.store.ChunkIdentity;
import com.gentoro.ragmcp.store.VectorStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Selects the chunks that are new or whose content changed since they were last ingested.
 *
 * <p>Recorded fingerprints are read once per resource and grouped by chunk identity. A candidate is
 * kept iff its own fingerprint is not among those recorded for its identity; any other metadata
 * difference is ignored. The store is never written.
 */
public class ChangeDetector {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(ChangeDetector.class);

  public List<Chunk> filter(List<Chunk> candidates, VectorStore store) {
    if (candidates.isEmpty()) return List.of();

    Set<String> resources = new LinkedHashSet<>();
    for (Chunk c : candidates) resources.add(c.resourceName());

    Map<ChunkIdentity, Set<String>> recorded = new HashMap<>();
    for (String resource : resources) {
      recorded.putAll(store.recordedFingerprints(resource));
    }

    List<Chunk> changed = new ArrayList<>();
    for (Chunk c : candidates) {
      Set<String> known = recorded.get(c.identity());
      if (known == null || !known.contains(c.fingerprint())) {
        changed.add(c);
      }
    }
    log.debug(
        "{} of {} chunk(s) are new or modified for {}",
        changed.size(),
        candidates.size(),
        resources);
    return changed;
  }
}
