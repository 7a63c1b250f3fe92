package com.gentoro.ragmcp.exception;

/** A read or write against a tenant vector store failed. */
public class StoreException extends RagMcpException {
  public StoreException(String message) {
    super(RagMcpErrorCode.STORE_ERROR, message);
  }

  public StoreException(String message, Throwable cause) {
    super(RagMcpErrorCode.STORE_ERROR, message, cause);
  }
}
