package com.gentoro.onerag.retrieval;

import java.util.Locale;

public enum RiskLevel {
  SAFE,
  SENSITIVE,
  DANGEROUS;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Unknown or missing values are treated as {@link #SAFE}. */
  public static RiskLevel fromValue(Object value) {
    if (value instanceof String s) {
      for (RiskLevel r : values()) {
        if (r.value().equals(s.trim().toLowerCase(Locale.ROOT))) return r;
      }
    }
    return SAFE;
  }
}
