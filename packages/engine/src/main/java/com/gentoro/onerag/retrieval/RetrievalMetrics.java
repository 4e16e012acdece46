package com.gentoro.onerag.retrieval;

import com.gentoro.onerag.lexical.Bm25Index;

/** Counters of a {@link HybridRetriever}. {@code lexicalStats} is null while no index is built. */
public record RetrievalMetrics(
    long searchCount,
    double totalLatencyMs,
    double avgLatencyMs,
    long cacheHits,
    long cacheMisses,
    boolean lexicalEnabled,
    double semanticWeight,
    double bm25Weight,
    String lexicalScope,
    Bm25Index.Stats lexicalStats) {}
