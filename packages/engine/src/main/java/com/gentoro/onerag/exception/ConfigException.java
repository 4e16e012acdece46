package com.gentoro.onerag.exception;

/** Invalid or missing configuration. */
public class ConfigException extends OneRagException {
  public ConfigException(String message) {
    super(OneRagErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(OneRagErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
