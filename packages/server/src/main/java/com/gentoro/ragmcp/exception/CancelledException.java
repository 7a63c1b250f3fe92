package com.gentoro.ragmcp.exception;

/** The calling request was abandoned while work was in flight. */
public class CancelledException extends RagMcpException {
  public CancelledException(String message) {
    super(RagMcpErrorCode.CANCELLED, message);
  }

  public CancelledException(String message, Throwable cause) {
    super(RagMcpErrorCode.CANCELLED, message, cause);
  }
}
