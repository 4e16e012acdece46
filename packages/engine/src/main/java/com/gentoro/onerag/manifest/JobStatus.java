package com.gentoro.onerag.manifest;

import com.gentoro.onerag.exception.ValidationException;
import java.util.Locale;

public enum JobStatus {
  RUNNING,
  COMPLETED,
  FAILED;

  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTerminal() {
    return this != RUNNING;
  }

  public static JobStatus fromDb(String value) {
    for (JobStatus s : values()) {
      if (s.dbValue().equals(value)) return s;
    }
    throw new ValidationException("Invalid ingest job status: " + value);
  }
}
