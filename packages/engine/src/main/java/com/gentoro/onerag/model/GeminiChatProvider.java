package com.gentoro.onerag.model;

import com.gentoro.onerag.exception.LlmException;
import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
import java.util.ArrayList;
import java.util.List;

/** Google Gemini implementation of {@link ChatProvider}. */
public class GeminiChatProvider implements ChatProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(GeminiChatProvider.class);
  private final Client geminiClient;

  public GeminiChatProvider(Client geminiClient) {
    this.geminiClient = geminiClient;
  }

  @Override
  public String complete(
      String model, List<Message> messages, double temperature, ResponseFormat responseFormat) {
    GenerateContentConfig.Builder configBuilder =
        GenerateContentConfig.builder().temperature((float) temperature).candidateCount(1);

    String system = Message.firstContent(messages, Role.SYSTEM);
    if (system != null) {
      configBuilder.systemInstruction(
          Content.builder().role("user").parts(Part.fromText(system)).build());
    }
    if (responseFormat == ResponseFormat.JSON_OBJECT) {
      configBuilder.responseMimeType("application/json");
    }

    List<Content> contents = new ArrayList<>();
    for (Message message : Message.allExcept(messages, Role.SYSTEM)) {
      contents.add(
          Content.builder()
              .role(message.role() == Role.ASSISTANT ? "model" : "user")
              .parts(Part.fromText(message.content()))
              .build());
    }

    long start = System.currentTimeMillis();
    GenerateContentResponse response;
    try {
      response = geminiClient.models.generateContent(model, contents, configBuilder.build());
    } catch (ApiException e) {
      throw new LlmException("Gemini completion failed: " + e.getMessage(), e.code(), e);
    } catch (RuntimeException e) {
      throw new LlmException("Gemini completion failed: " + e.getMessage(), e);
    }
    log.debug("[Inference] Gemini({}) took {} ms", model, System.currentTimeMillis() - start);

    String text = response.text();
    return text == null ? "" : text.trim();
  }
}
