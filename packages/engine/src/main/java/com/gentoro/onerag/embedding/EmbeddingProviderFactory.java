package com.gentoro.onerag.embedding;

import com.gentoro.onerag.exception.ConfigException;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Resolves the configured {@code embedding.provider} through the SPI. */
public final class EmbeddingProviderFactory {
  private EmbeddingProviderFactory() {}

  public static EmbeddingProvider create(Configuration embeddingCfg) {
    String provider = embeddingCfg.getString("provider");
    if (provider == null || provider.isBlank()) {
      throw new ConfigException("Missing embedding.provider");
    }
    String id = provider.trim().toLowerCase(Locale.ROOT);
    for (EmbeddingProviderSpi spi : ServiceLoader.load(EmbeddingProviderSpi.class)) {
      if (id.equals(spi.providerId())) {
        return spi.create(embeddingCfg);
      }
    }
    throw new ConfigException("Unknown embedding provider: " + id);
  }
}
