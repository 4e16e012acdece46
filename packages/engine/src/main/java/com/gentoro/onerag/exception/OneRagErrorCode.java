package com.gentoro.onerag.exception;

/** Stable failure codes carried by every {@link OneRagException}. */
public enum OneRagErrorCode {
  UNKNOWN,
  /** Caller passed a bad argument or a setting is out of range. */
  INVALID_ARGUMENT,
  /** Operation not allowed in the current state, e.g. a closed engine or finished job. */
  FAILED_PRECONDITION,
  NOT_FOUND,
  /** Interrupted while waiting on a provider, a retry backoff or the rate limiter. */
  CANCELLED,
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
  EXTRACTION_ERROR,
  EMBEDDING_ERROR,
  VECTOR_INDEX_ERROR,
  MANIFEST_ERROR,
  /** Stored checksum, schema version or vector reference does not match what was expected. */
  MANIFEST_INTEGRITY_ERROR,
  EXPLAINER_VALIDATION_ERROR,
  PROMPT_ERROR,
  LLM_ERROR
}
