package com.gentoro.ragmcp.exception;

/**
 * Canonical error codes for the RAG MCP server. Codes are stable and suitable for logs and tool
 * error payloads; prefer the most specific code that reflects the failure origin.
 *
 * <p>Retryable codes describe conditions outside the caller's request (an unreachable tenant
 * store, a failing embeddings provider) that may clear up on their own.
 */
public enum RagMcpErrorCode {
  // Generic
  FAILED_PRECONDITION(false),
  UNAUTHENTICATED(false),
  CANCELLED(true),

  // I/O and configuration
  CONFIGURATION_ERROR(false),
  IO_ERROR(false),
  SERIALIZATION_ERROR(false),
  NETWORK_ERROR(true),

  // Tenant store and embeddings provider
  STORE_UNAVAILABLE(true),
  STORE_ERROR(false),
  EMBEDDING_ERROR(true);

  private final boolean retryable;

  RagMcpErrorCode(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
