package com.gentoro.onerag.manifest;

import com.gentoro.onerag.exception.ValidationException;
import java.util.Locale;

/** Document lifecycle. An ingested document becomes stale when its source changes. */
public enum DocumentStatus {
  PENDING,
  INGESTED,
  FAILED,
  STALE;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static DocumentStatus fromDb(String value) {
    for (DocumentStatus s : values()) {
      if (s.dbValue().equals(value)) return s;
    }
    throw new ValidationException("Invalid document status: " + value);
  }
}
