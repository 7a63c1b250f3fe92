package com.gentoro.ragmcp.exception;

/** Reading or writing a structured payload failed. */
public class SerializationException extends RagMcpException {
  public SerializationException(String message) {
    super(RagMcpErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(RagMcpErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
