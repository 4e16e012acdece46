package com.gentoro.onerag.retrieval;

import java.util.Map;

/**
 * A ranked chunk returned by {@link HybridRetriever}. Never persisted.
 *
 * @param score combined score after the governance multiplier
 * @param semanticScore raw vector similarity, 0 when only the lexical index matched
 * @param bm25Score normalized lexical score, null when the lexical index did not match
 * @param snippet first 300 characters of the chunk text
 * @param rank 1-based position in the final ranking
 */
public record RetrievalCandidate(
    String chunkId,
    String docId,
    String path,
    double score,
    double semanticScore,
    Double bm25Score,
    String snippet,
    String scope,
    RiskLevel riskLevel,
    AllowedStatus allowedInMode,
    Map<String, Object> metadata,
    int rank) {

  public RetrievalCandidate withRank(int newRank) {
    return new RetrievalCandidate(
        chunkId,
        docId,
        path,
        score,
        semanticScore,
        bm25Score,
        snippet,
        scope,
        riskLevel,
        allowedInMode,
        metadata,
        newRank);
  }
}
