package com.gentoro.ragmcp.exception;

import java.util.function.Function;

/** Utility helpers for dealing with exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, joining at most
   * {@code maxFrames} frames in call order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Message suitable for a tool error result: the exception message when present, otherwise a
   * compact stack trace. Retryable failures say so.
   */
  public static String describe(Throwable t) {
    String message = t.getMessage();
    if (message == null || message.isBlank()) {
      message = t.getClass().getSimpleName() + ": " + formatCompactStackTrace(t);
    }
    if (t instanceof RagMcpException r && r.isRetryable()) {
      return message + " (temporary failure, the call can be retried)";
    }
    return message;
  }

  /** Return {@code t} when it is already a {@link RagMcpException}, otherwise wrap it. */
  public static RagMcpException rethrowIfUnchecked(
      Throwable t, Function<Throwable, RagMcpException> supplier) {
    if (t instanceof RagMcpException) {
      return (RagMcpException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
