package com.gentoro.ragmcp.tenant;

import com.gentoro.ragmcp.logging.LoggingService;
import java.util.Objects;

/**
 * A validated store credential identifying one tenant. Instances are only produced by {@link
 * CredentialStore}; {@link #toString()} never reveals the secret parts of the URI.
 */
public final class TenantCredential {
  private final String value;

  TenantCredential(String value) {
    this.value = Objects.requireNonNull(value, "value");
  }

  /** The full connection string, to be handed to the store driver only. */
  public String value() {
    return value;
  }

  public String redacted() {
    return LoggingService.redact(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TenantCredential)) return false;
    return value.equals(((TenantCredential) o).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return "TenantCredential{" + redacted() + '}';
  }
}
