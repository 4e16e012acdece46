package com.gentoro.onerag.exception;

import java.time.Instant;
import java.util.Map;

/** Helpers for turning failures into log lines and structured details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /** Structured view of {@code t}; code and context survive for OneRag exceptions. */
  public static ErrorDetails toErrorDetails(Throwable t) {
    OneRagErrorCode code = OneRagErrorCode.UNKNOWN;
    Map<String, Object> context = Map.of();
    if (t instanceof OneRagException ex) {
      code = ex.getCode();
      context = ex.getContext();
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(), messageOf(t), code, context, Instant.now());
  }

  /** {@code Type: message} of the innermost cause. */
  public static String rootMessage(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root.getClass().getSimpleName() + ": " + messageOf(root);
  }

  private static String messageOf(Throwable t) {
    return t.getMessage() == null ? "" : t.getMessage();
  }
}
