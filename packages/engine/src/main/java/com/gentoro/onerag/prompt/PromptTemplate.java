package com.gentoro.onerag.prompt;

import com.gentoro.onerag.model.ChatProvider;
import java.util.List;
import java.util.Map;

/**
 * A named list of message sections. The template itself never changes; each {@link
 * PromptSession} chooses which sections to render and with which variables.
 */
public interface PromptTemplate {
  String id();

  List<PromptSection> sections();

  PromptSession newSession();

  /** One message of the template, rendered only while enabled in a session. */
  record PromptSection(
      ChatProvider.Role role, String id, boolean enabledByDefault, String content) {}

  /** Not thread-safe; create one per render. */
  interface PromptSession {
    /** Enables {@code sectionId}, replacing any variables bound to it earlier. */
    PromptSession enable(String sectionId, Map<String, Object> vars);

    PromptSession disable(String... sectionIds);

    PromptSession clear();

    /** Enabled sections in template order. */
    List<ChatProvider.Message> renderMessages();
  }
}
