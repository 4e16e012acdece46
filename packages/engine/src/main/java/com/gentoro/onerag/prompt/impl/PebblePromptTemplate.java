package com.gentoro.onerag.prompt.impl;

import com.gentoro.onerag.exception.PromptException;
import com.gentoro.onerag.model.ChatProvider;
import com.gentoro.onerag.prompt.PromptTemplate;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Compiles every section once with Pebble; undefined variables fail the render. */
public class PebblePromptTemplate implements PromptTemplate {
  private static final PebbleEngine PEBBLE =
      new PebbleEngine.Builder().strictVariables(true).autoEscaping(false).build();

  private final String id;
  private final List<PromptSection> sections;
  private final Map<String, PebbleTemplate> templatesBySection = new LinkedHashMap<>();

  public PebblePromptTemplate(String id, List<PromptSection> sections) {
    if (id == null || id.isBlank()) {
      throw new PromptException("Prompt template id must not be blank");
    }
    this.id = id;
    this.sections = List.copyOf(sections);
    for (PromptSection section : this.sections) {
      if (templatesBySection.containsKey(section.id())) {
        throw new PromptException("Duplicate section '" + section.id() + "' in prompt " + id);
      }
      templatesBySection.put(section.id(), PEBBLE.getLiteralTemplate(section.content()));
    }
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public List<PromptSection> sections() {
    return sections;
  }

  @Override
  public PromptSession newSession() {
    Map<String, Map<String, Object>> initial = new HashMap<>();
    sections.stream()
        .filter(PromptSection::enabledByDefault)
        .forEach(s -> initial.put(s.id(), Map.of()));
    return new Session(initial);
  }

  private String render(PromptSection section, Map<String, Object> vars) {
    StringWriter out = new StringWriter();
    try {
      templatesBySection.get(section.id()).evaluate(out, vars);
    } catch (IOException | RuntimeException e) {
      throw new PromptException(
          "Cannot render section '%s' of prompt '%s'".formatted(section.id(), id), e);
    }
    return out.toString();
  }

  private final class Session implements PromptSession {
    private final Map<String, Map<String, Object>> active;

    private Session(Map<String, Map<String, Object>> active) {
      this.active = active;
    }

    @Override
    public PromptSession enable(String sectionId, Map<String, Object> vars) {
      if (!templatesBySection.containsKey(sectionId)) {
        throw new PromptException("Prompt '" + id + "' has no section '" + sectionId + "'");
      }
      active.put(sectionId, vars == null ? Map.of() : new HashMap<>(vars));
      return this;
    }

    @Override
    public PromptSession disable(String... sectionIds) {
      for (String sectionId : sectionIds) active.remove(sectionId);
      return this;
    }

    @Override
    public PromptSession clear() {
      active.clear();
      return this;
    }

    @Override
    public List<ChatProvider.Message> renderMessages() {
      return sections.stream()
          .filter(s -> active.containsKey(s.id()))
          .map(s -> new ChatProvider.Message(s.role(), render(s, active.get(s.id()))))
          .toList();
    }
  }
}
