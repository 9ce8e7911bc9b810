package com.gentoro.lightdocs.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is a {@link
   * LightDocsException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof LightDocsException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        LightDocsErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Produce a single-line summary of a throwable's stack, joining up to {@code maxFrames} frames in
   * call order, e.g. {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}.
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
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

  /** Convenience overload using a default of 5 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 5);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  /**
   * Return {@code t} itself when it is already a {@link LightDocsException}, otherwise the
   * exception produced by {@code supplier}. Callers throw the result.
   */
  public static LightDocsException rethrowIfUnchecked(
      Throwable t, Function<Throwable, LightDocsException> supplier) {
    if (t instanceof LightDocsException) {
      return (LightDocsException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
