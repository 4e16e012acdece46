package com.gentoro.onerag.explainer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onerag.exception.ExceptionUtil;
import com.gentoro.onerag.exception.ExplainerValidationException;
import com.gentoro.onerag.exception.ValidationException;
import com.gentoro.onerag.model.ChatProvider;
import com.gentoro.onerag.prompt.PromptRepository;
import com.gentoro.onerag.prompt.PromptTemplate;
import com.gentoro.onerag.retrieval.RetrievalCandidate;
import com.gentoro.onerag.retrieval.RiskLevel;
import com.gentoro.onerag.utility.JacksonUtility;
import com.gentoro.onerag.utility.StringUtility;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Narrows ranked retrieval candidates to a justified subset using an LLM.
 *
 * <p>The model's answer is untrusted: ids outside the candidate set are dropped along with their
 * rationales, list fields of the wrong shape become empty and the confidence is clamped to [0, 1].
 * An unusable answer is retried with a simplified prompt up to {@code maxRetries} times. When every
 * attempt fails the top {@code minSelected} candidates by score are returned with confidence 0.3,
 * so this class never fails because of the LLM.
 */
public class RetrievalExplainer {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(RetrievalExplainer.class);

  static final String PROMPT_ID = "retrieval-explainer";
  static final double FALLBACK_CONFIDENCE = 0.3;

  private final ChatProvider chatProvider;
  private final PromptTemplate prompt;
  private final ExplainerSettings settings;

  private final AtomicLong selectionCount = new AtomicLong();
  private final AtomicLong retryCount = new AtomicLong();
  private final AtomicLong validationFailures = new AtomicLong();

  public RetrievalExplainer(
      ChatProvider chatProvider, PromptRepository prompts, ExplainerSettings settings) {
    this.chatProvider = Objects.requireNonNull(chatProvider, "chatProvider");
    this.prompt = Objects.requireNonNull(prompts, "prompts").get(PROMPT_ID);
    this.settings = Objects.requireNonNull(settings, "settings");
    log.info(
        "Retrieval explainer initialized: model={}, temperature={}, max_selected={}",
        settings.model(),
        settings.temperature(),
        settings.maxSelected());
  }

  public ExplainerOutput selectChunks(String query, List<RetrievalCandidate> candidates) {
    return selectChunks(query, candidates, settings.tokenBudget());
  }

  /**
   * Selects between {@code minSelected} and {@code maxSelected} candidates for {@code query}.
   *
   * @throws ValidationException if the query is blank or there are no candidates
   */
  public ExplainerOutput selectChunks(
      String query, List<RetrievalCandidate> candidates, int tokenBudget) {
    if (candidates == null || candidates.isEmpty()) {
      throw new ValidationException("Candidates list cannot be empty");
    }
    if (query == null || query.isBlank()) {
      throw new ValidationException("Query cannot be empty");
    }
    String q = query.strip();
    Map<String, RetrievalCandidate> lookup = new LinkedHashMap<>();
    for (RetrievalCandidate c : candidates) {
      lookup.putIfAbsent(c.chunkId(), c);
    }
    log.info(
        "Selecting chunks: query='{}', candidates={}, token_budget={}",
        StringUtility.truncate(q, 50),
        candidates.size(),
        tokenBudget);

    String lastError = null;
    for (int attempt = 0; attempt <= settings.maxRetries(); attempt++) {
      boolean retry = attempt > 0;
      if (retry) {
        retryCount.incrementAndGet();
      }
      String response;
      try {
        response = callLlm(q, candidates, retry);
      } catch (RuntimeException e) {
        lastError = "LLM call error: " + e.getMessage();
        log.error("LLM call failed (attempt {}): {}", attempt + 1, e.getMessage());
        continue;
      }
      try {
        ExplainerOutput output = parseResponse(response, lookup);
        validate(output, candidates.size());
        ExplainerOutput result = applyTokenBudget(output, lookup, tokenBudget);
        selectionCount.incrementAndGet();
        log.info(
            "Chunk selection complete: selected={}, confidence={}",
            result.selectionCount(),
            String.format(Locale.ROOT, "%.2f", result.confidenceScore()));
        return result;
      } catch (JsonProcessingException e) {
        lastError = "JSON parse error: " + e.getOriginalMessage();
        validationFailures.incrementAndGet();
        log.warn("JSON parse failed (attempt {}): {}", attempt + 1, e.getOriginalMessage());
      } catch (ExplainerValidationException e) {
        lastError = String.join("; ", e.problems());
        validationFailures.incrementAndGet();
        log.warn("Validation failed (attempt {}): {}", attempt + 1, lastError);
      } catch (RuntimeException e) {
        lastError = "Selection error: " + ExceptionUtil.rootMessage(e);
        validationFailures.incrementAndGet();
        log.warn("Selection failed (attempt {}): {}", attempt + 1, lastError, e);
      }
    }
    log.error(
        "Selection failed after {} attempts: {}", settings.maxRetries() + 1, lastError);
    return fallback(candidates, lastError);
  }

  public ExplainerMetrics metrics() {
    return new ExplainerMetrics(
        selectionCount.get(),
        retryCount.get(),
        validationFailures.get(),
        settings.model(),
        settings.temperature(),
        settings.maxSelected(),
        settings.minSelected());
  }

  private String callLlm(String query, List<RetrievalCandidate> candidates, boolean retry) {
    Map<String, Object> vars = new HashMap<>();
    vars.put("query", query);
    vars.put("candidates", retry ? retryViews(candidates) : candidateViews(candidates));
    List<ChatProvider.Message> messages =
        prompt.newSession().enable(retry ? "retry" : "select", vars).renderMessages();
    return chatProvider.complete(
        settings.model(), messages, settings.temperature(), responseFormat(settings.model()));
  }

  /** OpenAI-family and Gemini models get native JSON mode; Anthropic has none. */
  static ChatProvider.ResponseFormat responseFormat(String model) {
    String m = model.toLowerCase(Locale.ROOT);
    return m.contains("gpt") || m.contains("o1") || m.contains("gemini")
        ? ChatProvider.ResponseFormat.JSON_OBJECT
        : ChatProvider.ResponseFormat.TEXT;
  }

  private static List<Map<String, Object>> candidateViews(List<RetrievalCandidate> candidates) {
    List<Map<String, Object>> views = new ArrayList<>(candidates.size());
    int index = 1;
    for (RetrievalCandidate c : candidates) {
      StringBuilder scores =
          new StringBuilder(
              String.format(
                  Locale.ROOT, "%.4f (semantic: %.4f", c.score(), c.semanticScore()));
      if (c.bm25Score() != null) {
        scores.append(String.format(Locale.ROOT, ", bm25: %.4f", c.bm25Score()));
      }
      scores.append(')');
      Map<String, Object> view = new HashMap<>();
      view.put("index", index++);
      view.put("id", c.chunkId());
      view.put("scores", scores.toString());
      view.put("path", Objects.toString(c.path(), ""));
      view.put("risk", (c.riskLevel() == null ? RiskLevel.SAFE : c.riskLevel()).value());
      view.put("scope", Objects.toString(c.scope(), ""));
      view.put("snippet", StringUtility.truncate(c.snippet(), 200));
      views.add(view);
    }
    return views;
  }

  private static List<Map<String, Object>> retryViews(List<RetrievalCandidate> candidates) {
    List<Map<String, Object>> views = new ArrayList<>(candidates.size());
    for (RetrievalCandidate c : candidates) {
      Map<String, Object> view = new HashMap<>();
      view.put("id", c.chunkId());
      view.put("score", String.format(Locale.ROOT, "%.3f", c.score()));
      view.put("snippet", StringUtility.truncate(c.snippet(), 100));
      views.add(view);
    }
    return views;
  }

  ExplainerOutput parseResponse(String response, Map<String, RetrievalCandidate> lookup)
      throws JsonProcessingException {
    JsonNode data = JacksonUtility.getJsonMapper().readTree(StringUtility.stripCodeFence(response));
    if (data == null || !data.isObject()) {
      throw new ExplainerValidationException(List.of("Response is not a JSON object"));
    }

    Set<String> selected = new LinkedHashSet<>();
    List<String> hallucinated = new ArrayList<>();
    for (JsonNode idNode : arrayOrEmpty(data.get("selected_chunk_ids"))) {
      String id = idNode.asText();
      if (lookup.containsKey(id)) {
        selected.add(id);
      } else {
        hallucinated.add(id);
        log.warn("Detected hallucinated chunk_id: {}", id);
      }
    }
    if (!hallucinated.isEmpty()) {
      log.warn("Filtered {} hallucinated chunk IDs: {}", hallucinated.size(), hallucinated);
    }

    Map<String, String> rationales = new LinkedHashMap<>();
    JsonNode rawRationales = data.get("rationales");
    if (rawRationales != null && rawRationales.isObject()) {
      rawRationales
          .fields()
          .forEachRemaining(
              e -> {
                if (lookup.containsKey(e.getKey())) {
                  rationales.put(e.getKey(), e.getValue().asText());
                }
              });
    }

    List<String> keyConcepts = new ArrayList<>();
    for (JsonNode n : arrayOrEmpty(data.get("key_concepts"))) {
      keyConcepts.add(n.asText());
    }

    JsonNode confidenceNode = data.get("confidence");
    double confidence =
        confidenceNode != null && confidenceNode.isNumber() ? confidenceNode.asDouble() : 0.5;
    confidence = Math.max(0.0, Math.min(1.0, confidence));

    List<String> ids = List.copyOf(selected);
    return new ExplainerOutput(
        ids,
        rationales,
        keyConcepts,
        objectList(data.get("missing_context")),
        confidence,
        objectList(data.get("discarded_top")),
        estimateTokens(ids, lookup),
        Instant.now());
  }

  void validate(ExplainerOutput output, int candidateCount) {
    List<String> problems = new ArrayList<>();
    int count = output.selectionCount();
    if (count < settings.minSelected() && candidateCount >= settings.minSelected()) {
      problems.add(
          "Selected %d chunks, minimum is %d".formatted(count, settings.minSelected()));
    }
    if (count > settings.maxSelected()) {
      problems.add(
          "Selected %d chunks, maximum is %d".formatted(count, settings.maxSelected()));
    }
    if (output.confidenceScore() < 0.0 || output.confidenceScore() > 1.0) {
      problems.add("Confidence %s not in [0, 1]".formatted(output.confidenceScore()));
    }
    if (!problems.isEmpty()) {
      throw new ExplainerValidationException(problems);
    }
  }

  /**
   * Keeps the best-scoring selected chunks that fit {@code tokenBudget}, stopping once at least
   * {@code minSelected} are kept and 80% of the budget is used. Never goes below {@code
   * minSelected}, even over budget.
   */
  ExplainerOutput applyTokenBudget(
      ExplainerOutput output, Map<String, RetrievalCandidate> lookup, int tokenBudget) {
    if (output.tokenCount() <= tokenBudget) return output;
    log.info("Token budget exceeded ({} > {}), trimming", output.tokenCount(), tokenBudget);

    List<RetrievalCandidate> byScore =
        output.selectedChunkIds().stream()
            .map(lookup::get)
            .filter(Objects::nonNull)
            .sorted(Comparator.comparingDouble(RetrievalCandidate::score).reversed())
            .toList();

    List<String> kept = new ArrayList<>();
    int total = 0;
    for (RetrievalCandidate c : byScore) {
      int tokens = chunkTokens(c);
      if (total + tokens <= tokenBudget) {
        kept.add(c.chunkId());
        total += tokens;
      }
      if (kept.size() >= settings.minSelected() && total >= tokenBudget * 0.8) {
        break;
      }
    }
    if (kept.size() < settings.minSelected()) {
      for (RetrievalCandidate c : byScore) {
        if (kept.size() >= settings.minSelected()) break;
        if (!kept.contains(c.chunkId())) {
          kept.add(c.chunkId());
        }
      }
    }

    Map<String, String> keptRationales = new LinkedHashMap<>();
    output.rationales().forEach((k, v) -> {
      if (kept.contains(k)) keptRationales.put(k, v);
    });
    int newTokens = kept.stream().mapToInt(id -> chunkTokens(lookup.get(id))).sum();
    log.info("Trimmed to {} chunks, ~{} tokens", kept.size(), newTokens);
    return output.withSelection(kept, keptRationales, newTokens);
  }

  ExplainerOutput fallback(List<RetrievalCandidate> candidates, String error) {
    log.warn("Using fallback selection due to: {}", error);
    List<RetrievalCandidate> top =
        candidates.stream()
            .sorted(Comparator.comparingDouble(RetrievalCandidate::score).reversed())
            .limit(settings.minSelected())
            .toList();
    List<String> ids = new ArrayList<>();
    Map<String, String> rationales = new LinkedHashMap<>();
    int tokens = 0;
    for (RetrievalCandidate c : top) {
      ids.add(c.chunkId());
      rationales.put(
          c.chunkId(),
          String.format(
              Locale.ROOT,
              "Fallback selection: highest scoring candidate (score=%.3f)",
              c.score()));
      tokens += chunkTokens(c);
    }
    Map<String, String> missing = new LinkedHashMap<>();
    missing.put("topic", "LLM Selection");
    missing.put(
        "reason", "LLM-based selection failed: " + error + ". Using score-based fallback.");
    return new ExplainerOutput(
        ids,
        rationales,
        List.of(),
        List.of(missing),
        FALLBACK_CONFIDENCE,
        List.of(),
        tokens,
        Instant.now());
  }

  /** Snippets are about a third of the chunk; four characters per token. */
  static int estimateTokens(List<String> ids, Map<String, RetrievalCandidate> lookup) {
    long chars = 0;
    for (String id : ids) {
      RetrievalCandidate c = lookup.get(id);
      if (c != null) {
        chars += (long) snippetLength(c) * 3;
      }
    }
    return (int) (chars / 4);
  }

  private static int chunkTokens(RetrievalCandidate c) {
    return snippetLength(c) * 3 / 4;
  }

  /** A caller-built candidate may carry no snippet; it counts as empty. */
  private static int snippetLength(RetrievalCandidate c) {
    return c.snippet() == null ? 0 : c.snippet().length();
  }

  private static Iterable<JsonNode> arrayOrEmpty(JsonNode node) {
    return node != null && node.isArray() ? node : List.of();
  }

  private static List<Map<String, String>> objectList(JsonNode node) {
    List<Map<String, String>> out = new ArrayList<>();
    for (JsonNode item : arrayOrEmpty(node)) {
      if (!item.isObject()) continue;
      Map<String, String> entry = new LinkedHashMap<>();
      item.fields().forEachRemaining(e -> entry.put(e.getKey(), e.getValue().asText()));
      out.add(entry);
    }
    return out;
  }
}
