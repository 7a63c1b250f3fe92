package com.gentoro.ragmcp.exception;

/**
 * The request carried no tenant credential, or one that does not use an accepted store scheme.
 * Raised before any connection attempt; the offending value is never included in the message.
 */
public class CredentialException extends RagMcpException {
  public CredentialException(String message) {
    super(RagMcpErrorCode.UNAUTHENTICATED, message);
  }
}
