package com.gentoro.ragmcp.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base runtime exception carrying a stable {@link RagMcpErrorCode} and optional diagnostic
 * context. The context map is copied and exposed read-only.
 */
public class RagMcpException extends RuntimeException {
  /** Context key under which store-related failures record the redacted tenant store. */
  public static final String STORE_KEY = "store";

  private final RagMcpErrorCode code;
  private final Map<String, Object> context;

  public RagMcpException(RagMcpErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public RagMcpException(RagMcpErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public RagMcpException(RagMcpErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public RagMcpException(
      RagMcpErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public RagMcpErrorCode getCode() {
    return code;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach(m::put);
    return Collections.unmodifiableMap(m);
  }

  /** Whether the same tool call may succeed when repeated later. */
  public boolean isRetryable() {
    return code.isRetryable();
  }

  /** The redacted tenant store this failure concerns, when known. */
  public Optional<String> store() {
    Object store = context.get(STORE_KEY);
    return store == null ? Optional.empty() : Optional.of(store.toString());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + getMessage()
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
