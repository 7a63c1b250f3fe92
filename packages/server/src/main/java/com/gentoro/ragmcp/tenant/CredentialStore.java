package com.gentoro.ragmcp.tenant;

import com.gentoro.ragmcp.exception.ConfigException;
import com.gentoro.ragmcp.exception.CredentialException;
import java.util.List;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/** Validates and normalizes raw credential strings against the accepted store URI schemes. */
public class CredentialStore {
  public static final List<String> DEFAULT_SCHEMES = List.of("mongodb://", "mongodb+srv://");

  private final List<String> acceptedSchemes;

  public CredentialStore(List<String> acceptedSchemes) {
    if (acceptedSchemes == null || acceptedSchemes.isEmpty()) {
      throw new ConfigException("At least one accepted credential scheme is required");
    }
    this.acceptedSchemes = List.copyOf(acceptedSchemes);
  }

  public static CredentialStore fromConfiguration(Configuration cfg) {
    List<String> schemes = cfg.getList(String.class, "tenant.accepted-schemes", DEFAULT_SCHEMES);
    return new CredentialStore(schemes);
  }

  /** Accepted iff non-empty after trimming and starting with one of the accepted schemes. */
  public Optional<TenantCredential> normalize(String raw) {
    if (raw == null) return Optional.empty();
    String candidate = raw.trim();
    if (candidate.isEmpty()) return Optional.empty();
    for (String scheme : acceptedSchemes) {
      if (candidate.startsWith(scheme)) {
        return Optional.of(new TenantCredential(candidate));
      }
    }
    return Optional.empty();
  }

  public boolean isValid(String raw) {
    return normalize(raw).isPresent();
  }

  public TenantCredential require(String raw) {
    return normalize(raw)
        .orElseThrow(
            () ->
                new CredentialException(
                    "Invalid store credential (expected " + describeSchemes() + ")"));
  }

  /** Human readable list of accepted prefixes, e.g. {@code mongodb:// or mongodb+srv://}. */
  public String describeSchemes() {
    return String.join(" or ", acceptedSchemes);
  }

  public List<String> acceptedSchemes() {
    return acceptedSchemes;
  }
}
