package com.gentoro.onerag.exception;

import java.util.Map;

/** A source file could not be read or parsed into text. */
public class ExtractionException extends OneRagException {
  public ExtractionException(String message) {
    super(OneRagErrorCode.EXTRACTION_ERROR, message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(OneRagErrorCode.EXTRACTION_ERROR, message, cause);
  }

  public ExtractionException(String message, String path, String mimeType, Throwable cause) {
    super(
        OneRagErrorCode.EXTRACTION_ERROR,
        message,
        Map.of("path", String.valueOf(path), "mimeType", String.valueOf(mimeType)),
        cause);
  }
}
