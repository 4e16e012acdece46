package com.gentoro.onerag.embedding;

/** Cumulative counters of an {@link EmbeddingAdapter} since creation or the last reset. */
public record EmbeddingUsage(
    long callCount, long tokenCount, long errorCount, String model, String modelVersion) {}
