package com.gentoro.onerag.exception;

import java.util.Map;

/**
 * A manifest write violated a uniqueness or foreign-key constraint. Always surfaced to the caller.
 */
public class ManifestIntegrityException extends OneRagException {
  public ManifestIntegrityException(String message, Map<String, ?> context, Throwable cause) {
    super(OneRagErrorCode.MANIFEST_INTEGRITY_ERROR, message, context, cause);
  }
}
