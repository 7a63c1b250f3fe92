package com.gentoro.ragmcp.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends RagMcpException {
  public ConfigException(String message) {
    super(RagMcpErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(RagMcpErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
