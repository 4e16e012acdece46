package com.gentoro.onerag.explainer;

import com.gentoro.onerag.utility.JacksonUtility;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Selection made by {@link RetrievalExplainer}.
 *
 * @param selectedChunkIds ids taken from the candidate set, never invented
 * @param rationales chunk id to a short justification
 * @param missingContextRequests entries with {@code topic} and {@code reason}
 * @param discardedTop entries with {@code chunk_id} and {@code reason}
 * @param tokenCount approximate tokens of the selected chunks
 */
public record ExplainerOutput(
    List<String> selectedChunkIds,
    Map<String, String> rationales,
    List<String> keyConcepts,
    List<Map<String, String>> missingContextRequests,
    double confidenceScore,
    List<Map<String, String>> discardedTop,
    int tokenCount,
    Instant generatedAt) {

  public ExplainerOutput {
    selectedChunkIds = List.copyOf(selectedChunkIds);
    rationales = Collections.unmodifiableMap(new LinkedHashMap<>(rationales));
    keyConcepts = List.copyOf(keyConcepts);
    missingContextRequests = List.copyOf(missingContextRequests);
    discardedTop = List.copyOf(discardedTop);
  }

  /** Below 0.5 a caller may want to re-retrieve. */
  public boolean isLowConfidence() {
    return confidenceScore < 0.5;
  }

  public boolean hasMissingContext() {
    return !missingContextRequests.isEmpty();
  }

  public int selectionCount() {
    return selectedChunkIds.size();
  }

  ExplainerOutput withSelection(List<String> ids, Map<String, String> keptRationales, int tokens) {
    return new ExplainerOutput(
        ids,
        keptRationales,
        keyConcepts,
        missingContextRequests,
        confidenceScore,
        discardedTop,
        tokens,
        generatedAt);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("selected_chunk_ids", selectedChunkIds);
    m.put("rationales", rationales);
    m.put("key_concepts", keyConcepts);
    m.put("missing_context_requests", missingContextRequests);
    m.put("confidence_score", confidenceScore);
    m.put("discarded_top", discardedTop);
    m.put("token_count", tokenCount);
    m.put("generated_at", generatedAt.toString());
    return m;
  }

  public String toJson() {
    return JacksonUtility.toJson(toMap());
  }
}
