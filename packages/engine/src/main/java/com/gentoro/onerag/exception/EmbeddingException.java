package com.gentoro.onerag.exception;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Failure reported by an embedding provider.
 *
 * <p>Provider adapters classify each failure at the SDK boundary with {@link #classify}, so the
 * retry loop only looks at {@link #kind()}.
 */
public class EmbeddingException extends OneRagException {

  /** Retry classification of an embedding failure. */
  public enum Kind {
    /** HTTP 429, quota exhausted or rate limited: long exponential backoff. */
    RATE_LIMITED,
    /** HTTP 400 or an invalid request: never retried. */
    FATAL,
    /** Everything else, including other 4xx, 5xx and network errors: short backoff. */
    TRANSIENT;

    public boolean retryable() {
      return this != FATAL;
    }
  }

  private final Kind kind;
  private final Integer statusCode;

  public EmbeddingException(Kind kind, String message) {
    this(kind, null, message, null);
  }

  public EmbeddingException(Kind kind, Integer statusCode, String message, Throwable cause) {
    super(
        OneRagErrorCode.EMBEDDING_ERROR,
        message,
        statusCode == null
            ? Map.of("kind", kind.name())
            : Map.of("kind", kind.name(), "statusCode", statusCode),
        cause);
    this.kind = kind;
    this.statusCode = statusCode;
  }

  public Kind kind() {
    return kind;
  }

  public boolean isRetryable() {
    return kind.retryable();
  }

  public OptionalInt statusCode() {
    return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }

  /**
   * Retry classification from an optional HTTP status and the error text. Rate limiting wins over
   * a malformed request; anything unrecognised is transient.
   */
  public static Kind classify(Integer status, String message) {
    String text = message == null ? "" : message.toLowerCase(Locale.ROOT);
    if ((status != null && status == 429)
        || text.contains("429")
        || text.contains("quota")
        || text.contains("rate limit")
        || text.contains("rate_limit")) {
      return Kind.RATE_LIMITED;
    }
    if ((status != null && status == 400) || text.contains("400") || text.contains("invalid")) {
      return Kind.FATAL;
    }
    return Kind.TRANSIENT;
  }
}
