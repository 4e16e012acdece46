package com.gentoro.onerag.model;

import com.gentoro.onerag.exception.LlmException;
import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import java.util.List;

/** OpenAI implementation of {@link ChatProvider} using the openai-java Chat Completions API. */
public class OpenAiChatProvider implements ChatProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(OpenAiChatProvider.class);
  private final OpenAIClient openAIClient;

  public OpenAiChatProvider(OpenAIClient openAIClient) {
    this.openAIClient = openAIClient;
  }

  @Override
  public String complete(
      String model, List<Message> messages, double temperature, ResponseFormat responseFormat) {
    ChatCompletionCreateParams.Builder builder =
        ChatCompletionCreateParams.builder().model(model).temperature(temperature);

    for (Message message : messages) {
      switch (message.role()) {
        case SYSTEM -> builder.addSystemMessage(message.content());
        case USER -> builder.addUserMessage(message.content());
        case ASSISTANT -> builder.addAssistantMessage(message.content());
      }
    }
    if (responseFormat == ResponseFormat.JSON_OBJECT) {
      builder.responseFormat(ResponseFormatJsonObject.builder().build());
    }

    long start = System.currentTimeMillis();
    ChatCompletion completion;
    try {
      completion = openAIClient.chat().completions().create(builder.build());
    } catch (OpenAIServiceException e) {
      throw new LlmException("OpenAI completion failed: " + e.getMessage(), e.statusCode(), e);
    } catch (OpenAIException e) {
      throw new LlmException("OpenAI completion failed: " + e.getMessage(), e);
    }
    log.debug(
        "[Inference] OpenAI({}) took {} ms", model, System.currentTimeMillis() - start);

    if (completion.choices().isEmpty()) {
      throw new LlmException("OpenAI returned no choices for model " + model);
    }
    return completion.choices().get(0).message().content().map(String::trim).orElse("");
  }
}
