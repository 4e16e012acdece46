package com.gentoro.onerag.manifest;

import java.util.Objects;

/** A chunk to be recorded for a document. {@code text} is kept for lexical indexing. */
public record ChunkRef(
    String docId,
    int chunkIndex,
    long offsetStart,
    long offsetEnd,
    String chunkHash,
    int tokenCount,
    String extractor,
    String extractorVersion,
    String scope,
    String text) {

  public ChunkRef {
    Objects.requireNonNull(docId, "docId");
    Objects.requireNonNull(chunkHash, "chunkHash");
    Objects.requireNonNull(extractor, "extractor");
    Objects.requireNonNull(extractorVersion, "extractorVersion");
    Objects.requireNonNull(scope, "scope");
  }
}
