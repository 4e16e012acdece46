package com.gentoro.onerag.model;

import com.gentoro.onerag.exception.ConfigException;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** SPI registration for {@link OpenAiChatProvider}. */
public final class OpenAiChatProviderSpi implements ChatProviderSpi {
  @Override
  public String providerId() {
    return "openai";
  }

  @Override
  public ChatProvider create(Configuration subConfiguration) {
    String apiKey = subConfiguration.getString("apiKey");
    if (apiKey == null || apiKey.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.apiKey for OpenAI");
    }
    OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder().apiKey(apiKey);
    String baseUrl = subConfiguration.getString("baseUrl", null);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    return new OpenAiChatProvider(builder.build());
  }
}
