package com.gentoro.onerag.embedding;

import com.gentoro.onerag.exception.ConfigException;
import com.google.genai.Client;
import org.apache.commons.configuration2.Configuration;

/** SPI registration for {@link GeminiEmbeddingProvider}. */
public final class GeminiEmbeddingProviderSpi implements EmbeddingProviderSpi {
  @Override
  public String providerId() {
    return "gemini";
  }

  @Override
  public EmbeddingProvider create(Configuration cfg) {
    String apiKey = cfg.getString("apiKey");
    if (apiKey == null || apiKey.isBlank()) {
      throw new ConfigException("Missing embedding.apiKey for Gemini");
    }
    Integer dimensions = cfg.containsKey("dimensions") ? cfg.getInt("dimensions") : null;
    return new GeminiEmbeddingProvider(
        Client.builder().apiKey(apiKey).build(),
        cfg.getString("model", "text-embedding-004"),
        cfg.getString("model-version", "1.0"),
        dimensions);
  }
}
