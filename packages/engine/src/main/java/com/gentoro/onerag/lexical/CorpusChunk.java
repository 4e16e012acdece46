package com.gentoro.onerag.lexical;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Chunk text plus the document attributes needed to present a lexical-only match. */
public record CorpusChunk(
    String chunkId,
    String docId,
    String path,
    String scope,
    String text,
    Map<String, Object> metadata) {

  public CorpusChunk {
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
