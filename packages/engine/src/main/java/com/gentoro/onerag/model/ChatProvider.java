package com.gentoro.onerag.model;

import java.util.List;

/**
 * Chat completion abstraction over Large Language Model providers.
 *
 * <p>Concrete providers wrap a vendor SDK and are selected via {@link ChatProviderFactory} or the
 * {@link java.util.ServiceLoader} managed SPI {@link ChatProviderSpi}. Implementations translate
 * vendor failures into {@link com.gentoro.onerag.exception.LlmException}.
 */
public interface ChatProvider {

  /**
   * Runs a single, tool-free completion.
   *
   * @param model provider model identifier (e.g. "gpt-4o-mini")
   * @param messages ordered conversation; at most one {@link Role#SYSTEM} message is honoured
   * @param temperature sampling temperature
   * @param responseFormat requested output format; providers without native JSON mode ignore it
   * @return the assistant text, never null
   */
  String complete(
      String model, List<Message> messages, double temperature, ResponseFormat responseFormat);

  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  enum ResponseFormat {
    TEXT,
    JSON_OBJECT
  }

  record Message(Role role, String content) {
    public static Message system(String content) {
      return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
      return new Message(Role.USER, content);
    }

    static List<Message> allExcept(List<Message> messages, Role role) {
      return messages.stream().filter(m -> m.role() != role).toList();
    }

    static String firstContent(List<Message> messages, Role role) {
      return messages.stream()
          .filter(m -> m.role() == role)
          .map(Message::content)
          .findFirst()
          .orElse(null);
    }
  }
}
