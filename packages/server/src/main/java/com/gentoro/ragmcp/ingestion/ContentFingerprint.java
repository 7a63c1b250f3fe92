package com.gentoro.ragmcp.ingestion;

import com.gentoro.ragmcp.exception.StateException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 digest of a chunk's canonical text. Line endings are normalized to {@code \n} and
 * surrounding whitespace is trimmed, so two chunks with equal fingerprints are treated as the same
 * content.
 */
public final class ContentFingerprint {
  private ContentFingerprint() {}

  public static String of(String text) {
    byte[] digest = sha256().digest(canonical(text).getBytes(StandardCharsets.UTF_8));
    return HexFormat.of().formatHex(digest);
  }

  static String canonical(String text) {
    if (text == null) return "";
    return text.replace("\r\n", "\n").replace('\r', '\n').strip();
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new StateException("SHA-256 is not available in this JVM", e);
    }
  }
}
