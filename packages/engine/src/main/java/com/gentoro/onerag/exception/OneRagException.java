package com.gentoro.onerag.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of every failure raised by OneRag. Carries a stable {@link OneRagErrorCode} and an
 * unmodifiable context map (status codes, paths, ids) for logs and callers.
 */
public class OneRagException extends RuntimeException {
  private final OneRagErrorCode code;
  private final Map<String, Object> context;

  public OneRagException(OneRagErrorCode code, String message) {
    this(code, message, null, null);
  }

  public OneRagException(OneRagErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public OneRagException(OneRagErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public OneRagException(
      OneRagErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context =
        context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(context));
  }

  public OneRagErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName());
    sb.append('[').append(code).append("] ").append(getMessage());
    if (!context.isEmpty()) sb.append(' ').append(context);
    return sb.toString();
  }
}
