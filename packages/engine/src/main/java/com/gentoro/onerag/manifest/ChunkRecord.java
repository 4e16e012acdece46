package com.gentoro.onerag.manifest;

import java.time.Instant;

public record ChunkRecord(
    String chunkId,
    String docId,
    int chunkIndex,
    long offsetStart,
    long offsetEnd,
    String chunkHash,
    int tokenCount,
    String extractor,
    String extractorVersion,
    String scope,
    Instant createdAt,
    String text) {}
