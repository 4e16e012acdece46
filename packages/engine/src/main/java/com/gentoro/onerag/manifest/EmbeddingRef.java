package com.gentoro.onerag.manifest;

import java.util.Objects;

/** Links a chunk to the vector-engine point holding its embedding. */
public record EmbeddingRef(String chunkId, String model, String modelVersion, String vectorRef) {
  public EmbeddingRef {
    Objects.requireNonNull(chunkId, "chunkId");
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(modelVersion, "modelVersion");
    Objects.requireNonNull(vectorRef, "vectorRef");
  }
}
