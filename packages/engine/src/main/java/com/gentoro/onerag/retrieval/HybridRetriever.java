package com.gentoro.onerag.retrieval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.gentoro.onerag.embedding.EmbeddingAdapter;
import com.gentoro.onerag.embedding.EmbeddingResult;
import com.gentoro.onerag.exception.ExceptionUtil;
import com.gentoro.onerag.lexical.Bm25Index;
import com.gentoro.onerag.lexical.CorpusChunk;
import com.gentoro.onerag.lexical.LexicalCorpus;
import com.gentoro.onerag.lexical.ScoredChunk;
import com.gentoro.onerag.utility.StringUtility;
import com.gentoro.onerag.vector.PayloadFilters;
import com.gentoro.onerag.vector.VectorIndexClient;
import com.gentoro.onerag.vector.VectorSearchHit;
import java.util.ArrayList;
import java.util.Collections;
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
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hybrid semantic + lexical retriever with governance-aware ranking.
 *
 * <ol>
 *   <li>Embed the query (TTL cache in front of the embedding adapter).
 *   <li>Vector search for {@code 2 * topK} hits restricted to the scope.
 *   <li>BM25 search for {@code 2 * topK} hits; the index is rebuilt from the {@link LexicalCorpus}
 *       whenever the requested scope differs from the indexed one.
 *   <li>Min-max normalize both score sets and combine them with the configured weights.
 *   <li>Apply the {@link GovernanceMode} multiplier for each candidate's risk level.
 *   <li>Sort, truncate to {@code topK} and assign 1-based ranks.
 * </ol>
 *
 * Interactive search favours availability: any failure is logged and yields an empty list.
 *
 * <p>The query-embedding cache is a Caffeine cache bounded by size and TTL. At capacity it evicts
 * by Caffeine's W-TinyLFU policy, which may drop a newer, rarely used entry before the oldest one.
 */
public class HybridRetriever {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(HybridRetriever.class);

  static final int SNIPPET_CHARS = 300;

  /** Payload keys promoted to candidate fields and therefore left out of the metadata. */
  private static final Set<String> PROMOTED_FIELDS =
      Set.of("doc_id", "path", "text", "scope", "risk_level");

  private static final Comparator<RetrievalCandidate> RANKING =
      Comparator.comparingDouble(RetrievalCandidate::score)
          .reversed()
          .thenComparing(
              Comparator.comparingDouble(RetrievalCandidate::semanticScore).reversed())
          .thenComparing(RetrievalCandidate::chunkId);

  private final VectorIndexClient vectorIndex;
  private final EmbeddingAdapter embedder;
  private final LexicalCorpus corpus;
  private final RetrieverSettings settings;
  private final Cache<String, float[]> queryCache;

  private final ReentrantLock lexicalLock = new ReentrantLock();
  private final Bm25Index lexicalIndex = new Bm25Index();
  private Map<String, CorpusChunk> lexicalChunks = Map.of();
  private String lexicalScope;

  private final AtomicLong searchCount = new AtomicLong();
  private final DoubleAdder totalLatencyMs = new DoubleAdder();
  private final AtomicLong cacheHits = new AtomicLong();
  private final AtomicLong cacheMisses = new AtomicLong();

  private record Merged(
      String chunkId,
      double score,
      double semanticScore,
      Double bm25Score,
      Map<String, Object> payload) {}

  private record LexicalMatches(List<ScoredChunk> hits, Map<String, CorpusChunk> chunks) {
    static final LexicalMatches NONE = new LexicalMatches(List.of(), Map.of());
  }

  public HybridRetriever(
      VectorIndexClient vectorIndex,
      EmbeddingAdapter embedder,
      LexicalCorpus corpus,
      RetrieverSettings settings) {
    this(vectorIndex, embedder, corpus, settings, Ticker.systemTicker());
  }

  HybridRetriever(
      VectorIndexClient vectorIndex,
      EmbeddingAdapter embedder,
      LexicalCorpus corpus,
      RetrieverSettings settings,
      Ticker ticker) {
    this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
    this.embedder = Objects.requireNonNull(embedder, "embedder");
    this.corpus = Objects.requireNonNull(corpus, "corpus");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.queryCache =
        Caffeine.newBuilder()
            .expireAfterWrite(settings.cacheTtl())
            .maximumSize(settings.cacheCapacity())
            .ticker(ticker)
            .executor(Runnable::run)
            .build();

    if (Math.abs(settings.semanticWeight() + settings.bm25Weight() - 1.0) > 0.001) {
      log.warn(
          "BM25 weight ({}) + semantic weight ({}) != 1.0, results may be unexpected",
          settings.bm25Weight(),
          settings.semanticWeight());
    }
    log.info(
        "Hybrid retriever initialized: bm25={}, bm25_weight={}, semantic_weight={}",
        settings.lexicalEnabled(),
        settings.bm25Weight(),
        settings.semanticWeight());
  }

  public RetrieverSettings settings() {
    return settings;
  }

  /** Searches with the default top-k under {@link GovernanceMode#PERMISSION}. */
  public List<RetrievalCandidate> search(String query, String scope) {
    return search(query, scope, settings.defaultTopK(), GovernanceMode.PERMISSION, null);
  }

  /**
   * @param filters extra payload conditions passed to the vector engine, may be null
   * @return ranked candidates; empty for a blank query or scope, or on any failure
   */
  public List<RetrievalCandidate> search(
      String query, String scope, int topK, GovernanceMode mode, Map<String, Object> filters) {
    long start = System.nanoTime();
    try {
      if (query == null || query.isBlank()) {
        log.warn("Empty query provided to search");
        return List.of();
      }
      if (scope == null || scope.isBlank()) {
        log.warn("No scope provided to search");
        return List.of();
      }
      if (topK <= 0) return List.of();
      String q = query.strip();
      GovernanceMode effectiveMode = mode == null ? GovernanceMode.PERMISSION : mode;

      float[] embedding = queryEmbedding(q);
      if (embedding == null) {
        log.error("Failed to embed query");
        return List.of();
      }

      List<VectorSearchHit> semantic = vectorSearch(embedding, scope, topK * 2, filters);
      if (semantic.isEmpty()) {
        log.info("No semantic results for query: {}", StringUtility.truncate(q, 50));
        return List.of();
      }

      LexicalMatches lexical =
          settings.lexicalEnabled() ? lexicalSearch(q, scope, topK * 2) : LexicalMatches.NONE;
      List<Merged> merged =
          lexical.hits().isEmpty() ? semanticOnly(semantic) : merge(semantic, lexical, filters);

      List<RetrievalCandidate> sorted =
          applyGovernance(merged, effectiveMode).stream().sorted(RANKING).limit(topK).toList();
      List<RetrievalCandidate> ranked = new ArrayList<>(sorted.size());
      for (int i = 0; i < sorted.size(); i++) {
        ranked.add(sorted.get(i).withRank(i + 1));
      }

      double latencyMs = (System.nanoTime() - start) / 1e6d;
      searchCount.incrementAndGet();
      totalLatencyMs.add(latencyMs);
      log.info(
          "Search completed: query='{}', scope={}, results={}, latency={}ms",
          StringUtility.truncate(q, 30),
          scope,
          ranked.size(),
          String.format(Locale.ROOT, "%.1f", latencyMs));
      if (latencyMs > settings.latencyWarning().toMillis()) {
        log.warn(
            "Search latency {}ms exceeds {}ms target",
            String.format(Locale.ROOT, "%.1f", latencyMs),
            settings.latencyWarning().toMillis());
      }
      return ranked;
    } catch (RuntimeException e) {
      log.error("Search failed: {}", ExceptionUtil.toErrorDetails(e), e);
      return List.of();
    }
  }

  /** Drops the lexical index; the next search rebuilds it. */
  public void invalidateLexicalIndex() {
    lexicalLock.lock();
    try {
      resetLexical();
    } finally {
      lexicalLock.unlock();
    }
    log.info("BM25 index invalidated");
  }

  public void clearQueryCache() {
    queryCache.invalidateAll();
    log.info("Query embedding cache cleared");
  }

  public RetrievalMetrics metrics() {
    String scope;
    Bm25Index.Stats stats;
    lexicalLock.lock();
    try {
      scope = lexicalScope;
      stats = scope == null ? null : lexicalIndex.stats();
    } finally {
      lexicalLock.unlock();
    }
    long count = searchCount.get();
    double total = totalLatencyMs.sum();
    return new RetrievalMetrics(
        count,
        total,
        count > 0 ? total / count : 0.0,
        cacheHits.get(),
        cacheMisses.get(),
        settings.lexicalEnabled(),
        settings.semanticWeight(),
        settings.bm25Weight(),
        scope,
        stats);
  }

  private float[] queryEmbedding(String query) {
    float[] cached = queryCache.getIfPresent(query);
    if (cached != null) {
      cacheHits.incrementAndGet();
      log.debug("Query embedding cache hit: {}", StringUtility.truncate(query, 30));
      return cached;
    }
    cacheMisses.incrementAndGet();
    try {
      EmbeddingResult result = embedder.embedQuery(query);
      queryCache.put(query, result.vector());
      return result.vector();
    } catch (RuntimeException e) {
      log.error("Query embedding failed: {}", e.getMessage());
      return null;
    }
  }

  private List<VectorSearchHit> vectorSearch(
      float[] embedding, String scope, int topK, Map<String, Object> filters) {
    try {
      return vectorIndex.search(embedding, scope, topK, filters, null);
    } catch (RuntimeException e) {
      log.error("Vector search failed: {}", e.getMessage());
      return List.of();
    }
  }

  private LexicalMatches lexicalSearch(String query, String scope, int topK) {
    lexicalLock.lock();
    try {
      if (!scope.equals(lexicalScope)) {
        rebuildLexicalIndex(scope);
      }
      return new LexicalMatches(lexicalIndex.search(query, topK), lexicalChunks);
    } catch (RuntimeException e) {
      log.error("BM25 search failed: {}", e.getMessage(), e);
      resetLexical();
      return LexicalMatches.NONE;
    } finally {
      lexicalLock.unlock();
    }
  }

  private void rebuildLexicalIndex(String scope) {
    log.info("Building BM25 index for scope: {}", scope);
    List<CorpusChunk> chunks = corpus.listChunkTextsByScope(scope);
    if (chunks.isEmpty()) {
      log.warn("No chunks found for scope {}", scope);
    }
    lexicalIndex.build(chunks);
    Map<String, CorpusChunk> byId = new HashMap<>();
    for (CorpusChunk chunk : chunks) {
      byId.put(chunk.chunkId(), chunk);
    }
    lexicalChunks = Collections.unmodifiableMap(byId);
    lexicalScope = scope;
  }

  private void resetLexical() {
    lexicalIndex.clear();
    lexicalChunks = Map.of();
    lexicalScope = null;
  }

  private static List<Merged> semanticOnly(List<VectorSearchHit> semantic) {
    List<Merged> out = new ArrayList<>(semantic.size());
    for (VectorSearchHit hit : semantic) {
      out.add(new Merged(hit.id(), hit.score(), hit.score(), null, hit.payload()));
    }
    return out;
  }

  private List<Merged> merge(
      List<VectorSearchHit> semantic, LexicalMatches lexical, Map<String, Object> filters) {
    Map<String, VectorSearchHit> semanticById = new LinkedHashMap<>();
    Map<String, Double> semanticScores = new LinkedHashMap<>();
    for (VectorSearchHit hit : semantic) {
      if (semanticById.putIfAbsent(hit.id(), hit) == null) {
        semanticScores.put(hit.id(), hit.score());
      }
    }
    Map<String, Double> bm25Scores = new LinkedHashMap<>();
    for (ScoredChunk hit : lexical.hits()) {
      bm25Scores.putIfAbsent(hit.chunkId(), hit.score());
    }
    Map<String, Double> semanticNorm = normalize(semanticScores);
    Map<String, Double> bm25Norm = normalize(bm25Scores);

    Set<String> ids = new LinkedHashSet<>(semanticById.keySet());
    ids.addAll(bm25Norm.keySet());

    List<Merged> merged = new ArrayList<>(ids.size());
    for (String id : ids) {
      VectorSearchHit hit = semanticById.get(id);
      Map<String, Object> payload;
      double normalizedSemantic;
      double rawSemantic;
      if (hit != null) {
        payload = hit.payload();
        normalizedSemantic = semanticNorm.get(id);
        rawSemantic = hit.score();
      } else {
        CorpusChunk chunk = lexical.chunks().get(id);
        payload = chunk == null ? Map.of() : lexicalPayload(chunk);
        if (!PayloadFilters.matches(payload, filters)) continue;
        normalizedSemantic = 0.0;
        rawSemantic = 0.0;
      }
      Double bm25 = bm25Norm.get(id);
      double combined =
          settings.semanticWeight() * normalizedSemantic
              + settings.bm25Weight() * (bm25 == null ? 0.0 : bm25);
      merged.add(new Merged(id, combined, rawSemantic, bm25, payload));
    }
    return merged;
  }

  /** Min-max normalization to [0, 1]; a degenerate range maps every score to 0.5. */
  static Map<String, Double> normalize(Map<String, Double> scores) {
    if (scores.isEmpty()) return scores;
    double min = Collections.min(scores.values());
    double max = Collections.max(scores.values());
    double range = max - min;
    Map<String, Double> out = new LinkedHashMap<>();
    scores.forEach((id, s) -> out.put(id, range > 0 ? (s - min) / range : 0.5));
    return out;
  }

  private static Map<String, Object> lexicalPayload(CorpusChunk chunk) {
    Map<String, Object> payload = new LinkedHashMap<>(chunk.metadata());
    payload.put("doc_id", chunk.docId());
    payload.put("path", chunk.path());
    payload.put("scope", chunk.scope());
    payload.put("text", chunk.text());
    return payload;
  }

  private static List<RetrievalCandidate> applyGovernance(
      List<Merged> merged, GovernanceMode mode) {
    List<RetrievalCandidate> out = new ArrayList<>(merged.size());
    for (Merged m : merged) {
      Map<String, Object> payload = m.payload();
      RiskLevel risk = RiskLevel.fromValue(payload.get("risk_level"));
      Map<String, Object> metadata = new LinkedHashMap<>();
      payload.forEach(
          (k, v) -> {
            if (!PROMOTED_FIELDS.contains(k)) metadata.put(k, v);
          });
      out.add(
          new RetrievalCandidate(
              m.chunkId(),
              asString(payload.get("doc_id")),
              asString(payload.get("path")),
              m.score() * mode.multiplier(risk),
              m.semanticScore(),
              m.bm25Score(),
              StringUtility.truncate(asString(payload.get("text")), SNIPPET_CHARS),
              asString(payload.get("scope")),
              risk,
              mode.allowedStatus(risk),
              Collections.unmodifiableMap(metadata),
              0));
    }
    return out;
  }

  private static String asString(Object value) {
    return value == null ? "" : value.toString();
  }
}
