package com.gentoro.onerag.model;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable chat providers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in {@code
 * META-INF/services/com.gentoro.onerag.model.ChatProviderSpi}. Each identifies itself with a
 * stable lowercase {@code providerId} ("openai", "anthropic", "gemini").
 */
public interface ChatProviderSpi {

  String providerId();

  /**
   * Creates a configured provider.
   *
   * @param subConfiguration provider-specific configuration subset (e.g. {@code llm.default.*})
   * @throws com.gentoro.onerag.exception.ConfigException when required keys are missing
   */
  ChatProvider create(Configuration subConfiguration);
}
