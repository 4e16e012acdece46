package com.gentoro.onerag.embedding;

import com.gentoro.onerag.exception.ConfigException;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** SPI registration for {@link OpenAiEmbeddingProvider}. */
public final class OpenAiEmbeddingProviderSpi implements EmbeddingProviderSpi {
  @Override
  public String providerId() {
    return "openai";
  }

  @Override
  public EmbeddingProvider create(Configuration cfg) {
    String apiKey = cfg.getString("apiKey");
    if (apiKey == null || apiKey.isBlank()) {
      throw new ConfigException("Missing embedding.apiKey for OpenAI");
    }
    OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder().apiKey(apiKey);
    String baseUrl = cfg.getString("baseUrl", null);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    Long dimensions = cfg.containsKey("dimensions") ? cfg.getLong("dimensions") : null;
    return new OpenAiEmbeddingProvider(
        builder.build(),
        cfg.getString("model", "text-embedding-3-small"),
        cfg.getString("model-version", "1.0"),
        dimensions);
  }
}
