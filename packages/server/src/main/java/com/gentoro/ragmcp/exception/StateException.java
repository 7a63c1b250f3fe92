package com.gentoro.ragmcp.exception;

/** Component used in an invalid lifecycle state. */
public class StateException extends RagMcpException {
  public StateException(String message) {
    super(RagMcpErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(RagMcpErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
