package com.gentoro.ragmcp.ingestion;

import java.util.Locale;
import java.util.Optional;

/** Content categories the query engine searches separately. */
public enum ResourceCategory {
  DOCUMENT("document"),
  EXAMPLE("example");

  private final String label;

  ResourceCategory(String label) {
    this.label = label;
  }

  /** Value stored in the {@code resource_type} field. */
  public String label() {
    return label;
  }

  /** JSON sources are worked examples, everything else is documentation. */
  public static ResourceCategory classify(String sourcePath) {
    if (sourcePath == null) return DOCUMENT;
    return sourcePath.toLowerCase(Locale.ROOT).endsWith(".json") ? EXAMPLE : DOCUMENT;
  }

  public static Optional<ResourceCategory> fromLabel(String label) {
    for (ResourceCategory c : values()) {
      if (c.label.equals(label)) return Optional.of(c);
    }
    return Optional.empty();
  }
}
