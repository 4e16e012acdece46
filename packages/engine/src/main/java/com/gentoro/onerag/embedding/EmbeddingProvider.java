package com.gentoro.onerag.embedding;

import java.util.List;

/**
 * Remote embedding model. Implementations perform exactly one provider call per invocation and
 * report failures as {@link com.gentoro.onerag.exception.EmbeddingException} classified by status
 * code; batching, rate limiting and retries belong to {@link EmbeddingAdapter}.
 *
 * <p>Document and query embeddings use distinct task modes where the provider supports them, so
 * identical text may yield different vectors depending on role.
 */
public interface EmbeddingProvider {

  String model();

  String modelVersion();

  /** Embeds documents; the result list is aligned with {@code texts}. */
  List<EmbeddingResult> embedBatch(List<String> texts);

  /** Embeds a search query. */
  EmbeddingResult embedQuery(String text);
}
