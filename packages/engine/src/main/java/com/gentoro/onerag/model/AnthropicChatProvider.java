package com.gentoro.onerag.model;

import com.anthropic.client.AnthropicClient;
import com.anthropic.errors.AnthropicException;
import com.anthropic.errors.AnthropicServiceException;
import com.anthropic.models.messages.ContentBlock;
import com.anthropic.models.messages.MessageCreateParams;
import com.gentoro.onerag.exception.LlmException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Anthropic implementation of {@link ChatProvider}. The Messages API has no JSON response mode, so
 * {@link ResponseFormat#JSON_OBJECT} relies on the prompt alone.
 */
public class AnthropicChatProvider implements ChatProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(AnthropicChatProvider.class);
  private final AnthropicClient anthropicClient;
  private final long maxTokens;

  public AnthropicChatProvider(AnthropicClient anthropicClient, long maxTokens) {
    this.anthropicClient = anthropicClient;
    this.maxTokens = maxTokens;
  }

  @Override
  public String complete(
      String model, List<Message> messages, double temperature, ResponseFormat responseFormat) {
    MessageCreateParams.Builder builder =
        MessageCreateParams.builder().model(model).maxTokens(maxTokens).temperature(temperature);

    String system = Message.firstContent(messages, Role.SYSTEM);
    if (system != null) {
      builder.system(system);
    }
    for (Message message : Message.allExcept(messages, Role.SYSTEM)) {
      if (message.role() == Role.ASSISTANT) {
        builder.addAssistantMessage(message.content());
      } else {
        builder.addUserMessage(message.content());
      }
    }

    long start = System.currentTimeMillis();
    com.anthropic.models.messages.Message response;
    try {
      response = anthropicClient.messages().create(builder.build());
    } catch (AnthropicServiceException e) {
      throw new LlmException("Anthropic completion failed: " + e.getMessage(), e.statusCode(), e);
    } catch (AnthropicException e) {
      throw new LlmException("Anthropic completion failed: " + e.getMessage(), e);
    }
    log.debug("[Inference] Anthropic({}) took {} ms", model, System.currentTimeMillis() - start);

    return response.content().stream()
        .filter(ContentBlock::isText)
        .map(block -> block.asText().text())
        .collect(Collectors.joining())
        .trim();
  }
}
