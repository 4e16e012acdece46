package com.gentoro.onerag.lexical;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory Okapi BM25 index over chunk texts.
 *
 * <pre>
 * IDF(t)     = ln((N - df(t) + 0.5) / (df(t) + 0.5) + 1)
 * score(D,Q) = sum over t in Q of IDF(t) * tf(t,D) * (k1 + 1)
 *                                 / (tf(t,D) + k1 * (1 - b + b * |D| / avgdl))
 * </pre>
 *
 * <p>Postings are kept per term and IDF is derived from the live document frequency at query
 * time, so {@link #update} and {@link #remove} touch only the terms of the affected chunk. Reads
 * and writes are guarded by a read/write lock.
 */
public class Bm25Index {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(Bm25Index.class);

  private static final Pattern TOKEN = Pattern.compile("[a-z0-9_]+");

  private final double k1;
  private final double b;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  /** chunk id -> term frequencies. */
  private final Map<String, Map<String, Integer>> documents = new HashMap<>();
  private final Map<String, Integer> docLengths = new HashMap<>();
  /** term -> (chunk id -> tf). */
  private final Map<String, Map<String, Integer>> postings = new HashMap<>();
  private long totalLength;
  private boolean built;

  public Bm25Index() {
    this(1.5, 0.75);
  }

  public Bm25Index(double k1, double b) {
    this.k1 = k1;
    this.b = b;
  }

  /** Statistics snapshot. */
  public record Stats(
      int totalDocuments,
      int uniqueTerms,
      double avgDocLength,
      boolean built,
      double k1,
      double b) {}

  /**
   * Lowercases, extracts {@code [a-z0-9_]+} runs and drops one-character tokens other than "a" and
   * "i".
   */
  public static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) return tokens;
    Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (m.find()) {
      String t = m.group();
      if (t.length() > 1 || t.equals("a") || t.equals("i")) {
        tokens.add(t);
      }
    }
    return tokens;
  }

  /**
   * Replaces the index content with {@code chunks}. An empty corpus still marks the index as built.
   */
  public void build(Collection<CorpusChunk> chunks) {
    lock.writeLock().lock();
    try {
      clearState();
      for (CorpusChunk chunk : chunks) {
        if (chunk.chunkId() == null || chunk.chunkId().isBlank()) {
          log.warn("Skipping chunk without chunk id");
          continue;
        }
        addDocument(chunk.chunkId(), tokenize(chunk.text()));
      }
      built = true;
      log.info(
          "BM25 index built: {} documents, {} unique terms, avg length {}",
          documents.size(),
          postings.size(),
          String.format(Locale.ROOT, "%.1f", avgDocLength()));
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Adds or replaces one chunk. Text without tokens only removes the previous entry. */
  public void update(String chunkId, String text) {
    lock.writeLock().lock();
    try {
      removeDocument(chunkId);
      List<String> tokens = tokenize(text);
      if (!tokens.isEmpty()) {
        addDocument(chunkId, tokens);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Returns true if the chunk was indexed. */
  public boolean remove(String chunkId) {
    lock.writeLock().lock();
    try {
      return removeDocument(chunkId);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Scores every chunk sharing a term with {@code query}.
   *
   * @return matches with a positive score, best first; empty for a blank query or an unbuilt index
   */
  public List<ScoredChunk> search(String query, int topK) {
    List<String> queryTokens = tokenize(query);
    if (queryTokens.isEmpty() || topK <= 0) return List.of();

    lock.readLock().lock();
    try {
      if (!built) {
        log.warn("BM25 index not built, returning empty results");
        return List.of();
      }
      int n = documents.size();
      double avgdl = avgDocLength();
      Map<String, Double> scores = new HashMap<>();
      for (String term : queryTokens) {
        Map<String, Integer> posting = postings.get(term);
        if (posting == null) continue;
        double idf = idf(n, posting.size());
        if (idf <= 0) continue;
        for (Map.Entry<String, Integer> e : posting.entrySet()) {
          int tf = e.getValue();
          int len = docLengths.get(e.getKey());
          double denom = tf + k1 * (1 - b + b * (len / avgdl));
          scores.merge(e.getKey(), idf * (tf * (k1 + 1)) / denom, Double::sum);
        }
      }
      return scores.entrySet().stream()
          .filter(e -> e.getValue() > 0)
          .map(e -> new ScoredChunk(e.getKey(), e.getValue()))
          .sorted(
              Comparator.comparingDouble(ScoredChunk::score)
                  .reversed()
                  .thenComparing(ScoredChunk::chunkId))
          .limit(topK)
          .toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isBuilt() {
    lock.readLock().lock();
    try {
      return built;
    } finally {
      lock.readLock().unlock();
    }
  }

  public Stats stats() {
    lock.readLock().lock();
    try {
      return new Stats(documents.size(), postings.size(), avgDocLength(), built, k1, b);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Drops all content and marks the index unbuilt. */
  public void clear() {
    lock.writeLock().lock();
    try {
      clearState();
    } finally {
      lock.writeLock().unlock();
    }
  }

  static double idf(int totalDocs, int df) {
    return Math.log((totalDocs - df + 0.5) / (df + 0.5) + 1);
  }

  private void addDocument(String chunkId, List<String> tokens) {
    Map<String, Integer> tf = new HashMap<>();
    for (String t : tokens) {
      tf.merge(t, 1, Integer::sum);
    }
    documents.put(chunkId, tf);
    docLengths.put(chunkId, tokens.size());
    totalLength += tokens.size();
    tf.forEach(
        (term, count) -> postings.computeIfAbsent(term, k -> new HashMap<>()).put(chunkId, count));
  }

  private boolean removeDocument(String chunkId) {
    Map<String, Integer> tf = documents.remove(chunkId);
    if (tf == null) return false;
    totalLength -= docLengths.remove(chunkId);
    for (String term : tf.keySet()) {
      Map<String, Integer> posting = postings.get(term);
      posting.remove(chunkId);
      if (posting.isEmpty()) {
        postings.remove(term);
      }
    }
    return true;
  }

  private double avgDocLength() {
    return documents.isEmpty() ? 0.0 : (double) totalLength / documents.size();
  }

  private void clearState() {
    documents.clear();
    docLengths.clear();
    postings.clear();
    totalLength = 0;
    built = false;
  }
}
