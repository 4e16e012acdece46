package com.gentoro.onerag.embedding;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for embedding providers, registered in {@code
 * META-INF/services/com.gentoro.onerag.embedding.EmbeddingProviderSpi}.
 */
public interface EmbeddingProviderSpi {

  /** A stable, lowercase identifier (e.g. "openai", "gemini"). */
  String providerId();

  /**
   * @param subConfiguration the {@code embedding} configuration subset
   */
  EmbeddingProvider create(Configuration subConfiguration);
}
