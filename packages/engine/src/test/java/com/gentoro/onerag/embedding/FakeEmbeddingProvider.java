package com.gentoro.onerag.embedding;

import com.gentoro.onerag.lexical.Bm25Index;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic bag-of-words embedder: each token is hashed into one of {@link #DIMENSION} buckets
 * and the vector is L2-normalized, so texts sharing words have a positive cosine similarity.
 */
public class FakeEmbeddingProvider implements EmbeddingProvider {
  public static final int DIMENSION = 64;

  private final AtomicInteger batchCalls = new AtomicInteger();
  private final AtomicInteger embeddedTexts = new AtomicInteger();

  @Override
  public String model() {
    return "fake-embedding";
  }

  @Override
  public String modelVersion() {
    return "1";
  }

  @Override
  public List<EmbeddingResult> embedBatch(List<String> texts) {
    batchCalls.incrementAndGet();
    embeddedTexts.addAndGet(texts.size());
    return texts.stream().map(this::embed).toList();
  }

  @Override
  public EmbeddingResult embedQuery(String text) {
    return embed(text);
  }

  public int batchCalls() {
    return batchCalls.get();
  }

  public int embeddedTexts() {
    return embeddedTexts.get();
  }

  public static float[] vectorFor(String text) {
    float[] v = new float[DIMENSION];
    List<String> tokens = Bm25Index.tokenize(text);
    if (tokens.isEmpty()) {
      v[0] = 1f;
      return v;
    }
    for (String token : tokens) {
      v[Math.floorMod(token.hashCode(), DIMENSION)] += 1f;
    }
    double norm = 0;
    for (float f : v) norm += f * f;
    float len = (float) Math.sqrt(norm);
    for (int i = 0; i < v.length; i++) v[i] /= len;
    return v;
  }

  private EmbeddingResult embed(String text) {
    return new EmbeddingResult(vectorFor(text), Bm25Index.tokenize(text).size(), model(), "1");
  }
}
