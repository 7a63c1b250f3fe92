package com.gentoro.ragmcp.ingestion;

import com.gentoro.ragmcp.exception.ConfigException;

/** What happens to records of a chunk whose content changed. */
public enum RetentionPolicy {
  /** Superseded records stay in the store next to the new one. */
  KEEP_HISTORY("keep-history"),
  /** Superseded records are deleted once the new records are inserted. */
  REPLACE_SUPERSEDED("replace-superseded");

  private final String value;

  RetentionPolicy(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static RetentionPolicy fromValue(String value) {
    for (RetentionPolicy p : values()) {
      if (p.value.equalsIgnoreCase(value == null ? "" : value.trim())) return p;
    }
    throw new ConfigException(
        "Unknown ingestion.retention '"
            + value
            + "' (expected keep-history or replace-superseded)");
  }
}
