package com.gentoro.onerag.model;

import com.anthropic.client.AnthropicClient;
import com.anthropic.client.okhttp.AnthropicOkHttpClient;
import com.gentoro.onerag.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/** SPI registration for {@link AnthropicChatProvider}. */
public final class AnthropicChatProviderSpi implements ChatProviderSpi {
  @Override
  public String providerId() {
    return "anthropic";
  }

  @Override
  public ChatProvider create(Configuration configuration) {
    String apiKey = configuration.getString("apiKey");
    if (apiKey == null || apiKey.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.apiKey for Anthropic");
    }
    AnthropicClient client = AnthropicOkHttpClient.builder().apiKey(apiKey).build();
    return new AnthropicChatProvider(client, configuration.getLong("max-tokens", 4096L));
  }
}
