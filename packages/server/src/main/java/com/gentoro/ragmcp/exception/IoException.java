package com.gentoro.ragmcp.exception;

/** I/O operation failed (filesystem, classpath, source directories). */
public class IoException extends RagMcpException {
  public IoException(String message) {
    super(RagMcpErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(RagMcpErrorCode.IO_ERROR, message, cause);
  }
}
