package com.gentoro.ragmcp.exception;

/** Network-level problem binding or serving the HTTP listener. */
public class NetworkException extends RagMcpException {
  public NetworkException(String message) {
    super(RagMcpErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(RagMcpErrorCode.NETWORK_ERROR, message, cause);
  }
}
