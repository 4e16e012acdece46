package com.gentoro.onerag.retrieval;

import java.util.Locale;

/** Whether a candidate may be acted upon under the current governance mode. */
public enum AllowedStatus {
  ALLOWED,
  BLOCKED,
  PROMPT_REQUIRED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
