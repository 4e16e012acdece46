package com.gentoro.onerag.exception;

/** The vector engine could not be reached, timed out, or rejected a request. */
public class VectorIndexException extends OneRagException {
  public VectorIndexException(String message) {
    super(OneRagErrorCode.VECTOR_INDEX_ERROR, message);
  }

  public VectorIndexException(String message, Throwable cause) {
    super(OneRagErrorCode.VECTOR_INDEX_ERROR, message, cause);
  }
}
