package com.gentoro.ragmcp.exception;

/** The embedding provider failed or returned an empty or malformed payload. */
public class EmbeddingProviderException extends RagMcpException {
  public EmbeddingProviderException(String message) {
    super(RagMcpErrorCode.EMBEDDING_ERROR, message);
  }

  public EmbeddingProviderException(String message, Throwable cause) {
    super(RagMcpErrorCode.EMBEDDING_ERROR, message, cause);
  }
}
