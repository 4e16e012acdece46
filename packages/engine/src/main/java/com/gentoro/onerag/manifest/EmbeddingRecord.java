package com.gentoro.onerag.manifest;

import java.time.Instant;

public record EmbeddingRecord(
    String embeddingId,
    String chunkId,
    String model,
    String modelVersion,
    Instant embeddedAt,
    String vectorRef) {}
