package com.gentoro.onerag.exception;

/** Manifest store failure other than an integrity violation. */
public class ManifestException extends OneRagException {
  public ManifestException(String message) {
    super(OneRagErrorCode.MANIFEST_ERROR, message);
  }

  public ManifestException(String message, Throwable cause) {
    super(OneRagErrorCode.MANIFEST_ERROR, message, cause);
  }
}
