package com.gentoro.onerag.exception;

/** Prompt template could not be loaded or rendered. */
public class PromptException extends OneRagException {
  public PromptException(String message) {
    super(OneRagErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(OneRagErrorCode.PROMPT_ERROR, message, cause);
  }
}
