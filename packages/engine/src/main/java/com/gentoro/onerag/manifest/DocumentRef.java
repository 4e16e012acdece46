package com.gentoro.onerag.manifest;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Attributes of a source document about to be registered in the manifest. */
public record DocumentRef(
    String path,
    String mimeType,
    String scope,
    Instant sourceMtime,
    String fileHash,
    Map<String, Object> metadata) {

  public DocumentRef {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mimeType, "mimeType");
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(sourceMtime, "sourceMtime");
    Objects.requireNonNull(fileHash, "fileHash");
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
