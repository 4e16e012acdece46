package com.gentoro.onerag.exception;

/** Operation invoked while the component is in the wrong state. */
public class StateException extends OneRagException {
  public StateException(String message) {
    super(OneRagErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(OneRagErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
