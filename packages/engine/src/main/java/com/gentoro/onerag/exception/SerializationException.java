package com.gentoro.onerag.exception;

/** JSON/YAML (de)serialization failure. */
public class SerializationException extends OneRagException {
  public SerializationException(String message) {
    super(OneRagErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(OneRagErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
