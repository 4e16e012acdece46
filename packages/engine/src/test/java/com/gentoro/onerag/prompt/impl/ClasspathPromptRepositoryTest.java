package com.gentoro.onerag.prompt.impl;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onerag.exception.ConfigException;
import com.gentoro.onerag.exception.NotFoundException;
import com.gentoro.onerag.exception.PromptException;
import com.gentoro.onerag.exception.ValidationException;
import com.gentoro.onerag.model.ChatProvider;
import com.gentoro.onerag.prompt.PromptRepository;
import com.gentoro.onerag.prompt.PromptRepositoryFactory;
import com.gentoro.onerag.prompt.PromptTemplate;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClasspathPromptRepositoryTest {

  private final PromptRepository repository = new ClasspathPromptRepository("/prompts/");

  @Test
  @DisplayName("sections load with roles and default enablement")
  void loadsSections() {
    PromptTemplate template = repository.get("greeting");

    assertEquals("greeting", template.id());
    assertEquals(3, template.sections().size());
    PromptTemplate.PromptSection intro = template.sections().get(0);
    assertEquals(ChatProvider.Role.SYSTEM, intro.role());
    assertTrue(intro.enabledByDefault());
    assertFalse(template.sections().get(1).enabledByDefault());
    assertSame(template, repository.get("/greeting"));
  }

  @Test
  @DisplayName("only enabled sections render, in definition order")
  void rendersEnabledSections() {
    List<ChatProvider.Message> messages =
        repository
            .get("greeting")
            .newSession()
            .enable("ask", Map.of("question", "What is BM25?"))
            .enable("example", Map.of())
            .disable("example")
            .renderMessages();

    assertEquals(2, messages.size());
    assertEquals("You answer questions about the product.", messages.get(0).content());
    assertEquals(ChatProvider.Role.USER, messages.get(1).role());
    assertEquals("Question: What is BM25?\n", messages.get(1).content());
  }

  @Test
  @DisplayName("sessions are independent of each other")
  void sessionsAreIsolated() {
    PromptTemplate template = repository.get("greeting");
    PromptTemplate.PromptSession first = template.newSession().clear();
    PromptTemplate.PromptSession second = template.newSession();

    assertTrue(first.renderMessages().isEmpty());
    assertEquals(1, second.renderMessages().size());
  }

  @Test
  @DisplayName("undefined variables fail rendering")
  void strictVariables() {
    PromptTemplate.PromptSession session =
        repository.get("greeting").newSession().enable("ask", Map.of());
    assertThrows(PromptException.class, session::renderMessages);
  }

  @Test
  @DisplayName("missing and malformed prompts are reported")
  void missingAndMalformed() {
    assertThrows(NotFoundException.class, () -> repository.get("absent"));
    assertThrows(ValidationException.class, () -> repository.get("broken"));
  }

  @Test
  @DisplayName("factory accepts classpath locations only")
  void factory() {
    BaseConfiguration cfg = new BaseConfiguration();
    assertNotNull(PromptRepositoryFactory.create(cfg).get("retrieval-explainer"));

    cfg.setProperty("location", "file:/tmp/prompts");
    assertThrows(ConfigException.class, () -> PromptRepositoryFactory.create(cfg));
    cfg.setProperty("location", "classpath:/");
    assertThrows(ConfigException.class, () -> PromptRepositoryFactory.create(cfg));
  }
}
