package com.gentoro.onerag.exception;

/** Caller supplied an invalid argument. */
public class ValidationException extends OneRagException {
  public ValidationException(String message) {
    super(OneRagErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(OneRagErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
