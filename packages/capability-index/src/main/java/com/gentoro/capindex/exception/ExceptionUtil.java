package com.gentoro.capindex.exception;

import java.time.Instant;
import java.util.function.Function;

/** Helpers for turning exceptions into structured, log friendly shapes. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. Code, retryability and context are
   * preserved for {@link CapIndexException}s.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof CapIndexException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.isRetryable(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        CapIndexErrorCode.UNKNOWN,
        false,
        null,
        Instant.now());
  }

  /**
   * Single line summary of the top {@code maxFrames} stack frames, joined with {@code " > "}.
   * Passing a value {@code <= 0} includes all frames.
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

  /** Return {@code t} when it already is a {@link CapIndexException}, otherwise wrap it. */
  public static CapIndexException rethrowIfUnchecked(
      Throwable t, Function<Throwable, CapIndexException> supplier) {
    if (t instanceof CapIndexException ex) {
      return ex;
    }
    return supplier.apply(t);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
