package com.gentoro.onerag.model;

import com.gentoro.onerag.exception.ConfigException;
import com.google.genai.Client;
import org.apache.commons.configuration2.Configuration;

/** SPI registration for {@link GeminiChatProvider}. */
public final class GeminiChatProviderSpi implements ChatProviderSpi {
  @Override
  public String providerId() {
    return "gemini";
  }

  @Override
  public ChatProvider create(Configuration subConfiguration) {
    String apiKey = subConfiguration.getString("apiKey");
    if (apiKey == null || apiKey.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.apiKey for Gemini");
    }
    return new GeminiChatProvider(Client.builder().apiKey(apiKey).build());
  }
}
