package com.gentoro.ragmcp.exception;

import java.util.Map;

/** The tenant store could not be reached within the configured connection timeout. */
public class ConnectionUnavailableException extends RagMcpException {
  public ConnectionUnavailableException(String message, String redactedCredential) {
    super(RagMcpErrorCode.STORE_UNAVAILABLE, message, Map.of(STORE_KEY, redactedCredential));
  }

  public ConnectionUnavailableException(
      String message, String redactedCredential, Throwable cause) {
    super(RagMcpErrorCode.STORE_UNAVAILABLE, message, Map.of(STORE_KEY, redactedCredential), cause);
  }
}
