package com.gentoro.onerag.exception;

import java.util.Map;

/** A chat completion call failed. */
public class LlmException extends OneRagException {
  public LlmException(String message) {
    super(OneRagErrorCode.LLM_ERROR, message);
  }

  public LlmException(String message, Throwable cause) {
    super(OneRagErrorCode.LLM_ERROR, message, cause);
  }

  public LlmException(String message, int statusCode, Throwable cause) {
    super(OneRagErrorCode.LLM_ERROR, message, Map.of("statusCode", statusCode), cause);
  }
}
