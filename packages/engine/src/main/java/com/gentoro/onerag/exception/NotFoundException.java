package com.gentoro.onerag.exception;

/** Requested resource does not exist. */
public class NotFoundException extends OneRagException {
  public NotFoundException(String message) {
    super(OneRagErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(OneRagErrorCode.NOT_FOUND, message, cause);
  }
}
