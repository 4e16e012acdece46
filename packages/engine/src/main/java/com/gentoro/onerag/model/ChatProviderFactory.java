package com.gentoro.onerag.model;

import com.gentoro.onerag.exception.ConfigException;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Creates {@link ChatProvider} instances from configuration through the SPI. */
public final class ChatProviderFactory {
  private ChatProviderFactory() {}

  /**
   * Creates the provider named by {@code llm.active-profile}.
   *
   * <pre>
   *   llm.active-profile = default
   *   llm.default.provider = openai
   *   llm.default.apiKey = ${env:OPENAI_API_KEY}
   * </pre>
   */
  public static ChatProvider createProvider(Configuration configuration) {
    String namespace = configuration.getString("llm.active-profile", "default").trim();
    if (namespace.isEmpty() || !configuration.getKeys("llm." + namespace).hasNext()) {
      throw new ConfigException("Missing llm.%s configuration".formatted(namespace));
    }
    return create(configuration.subset("llm." + namespace));
  }

  /** Creates a provider from a subset that carries at least a {@code provider} key. */
  public static ChatProvider create(Configuration subConfig) {
    String provider = subConfig.getString("provider");
    if (provider == null || provider.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.provider");
    }
    String id = provider.trim().toLowerCase(Locale.ROOT);
    for (ChatProviderSpi spi : ServiceLoader.load(ChatProviderSpi.class)) {
      if (id.equals(spi.providerId())) {
        return spi.create(subConfig);
      }
    }
    throw new ConfigException("Unknown chat provider: " + id);
  }
}
