package com.gentoro.onerag.prompt.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.onerag.exception.NotFoundException;
import com.gentoro.onerag.exception.PromptException;
import com.gentoro.onerag.exception.ValidationException;
import com.gentoro.onerag.model.ChatProvider;
import com.gentoro.onerag.prompt.PromptRepository;
import com.gentoro.onerag.prompt.PromptTemplate;
import com.gentoro.onerag.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Prompt templates stored as YAML under a classpath directory, e.g. {@code
 * prompts/retrieval-explainer.yaml}. Each file holds a {@code sections} list of {@code role},
 * {@code id}, optional {@code enabled} and {@code content}. Templates are parsed once and cached.
 */
public class ClasspathPromptRepository implements PromptRepository {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(ClasspathPromptRepository.class);

  @JsonIgnoreProperties(ignoreUnknown = true)
  record PromptFile(List<SectionYaml> sections) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SectionYaml(String role, String id, Boolean enabled, String content) {}

  private final String directory;
  private final ClassLoader loader;
  private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

  public ClasspathPromptRepository(String directory) {
    this(directory, null);
  }

  public ClasspathPromptRepository(String directory, ClassLoader loader) {
    this.directory = trimSlashes(directory);
    this.loader = loader != null ? loader : ClasspathPromptRepository.class.getClassLoader();
  }

  @Override
  public PromptTemplate get(String name) {
    String id = trimSlashes(name);
    if (id.isEmpty()) {
      throw new ValidationException("Prompt name must not be blank");
    }
    return templates.computeIfAbsent(id, this::load);
  }

  private PromptTemplate load(String id) {
    String resource =
        Stream.of(".yaml", ".yml")
            .map(ext -> directory + "/" + id + ext)
            .filter(r -> loader.getResource(r) != null)
            .findFirst()
            .orElseThrow(
                () -> new NotFoundException("No prompt '" + id + "' under " + directory));

    PromptFile file;
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new NotFoundException("Prompt resource disappeared: " + resource);
      }
      file = JacksonUtility.getYamlMapper().readValue(in, PromptFile.class);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Malformed prompt YAML " + resource, e);
    } catch (IOException e) {
      throw new PromptException("Failed to read prompt " + resource, e);
    }
    if (file == null || file.sections() == null || file.sections().isEmpty()) {
      throw new ValidationException("Prompt " + resource + " defines no sections");
    }

    List<PromptTemplate.PromptSection> sections = new ArrayList<>();
    for (SectionYaml raw : file.sections()) {
      sections.add(toSection(id, raw));
    }
    log.debug("Loaded prompt '{}' with {} sections from {}", id, sections.size(), resource);
    return new PebblePromptTemplate(id, sections);
  }

  private static PromptTemplate.PromptSection toSection(String promptId, SectionYaml raw) {
    if (raw.id() == null || raw.id().isBlank()) {
      throw new ValidationException("Section without id in prompt " + promptId);
    }
    if (raw.content() == null || raw.content().isBlank()) {
      throw new ValidationException(
          "Section '%s' of prompt %s has no content".formatted(raw.id(), promptId));
    }
    return new PromptTemplate.PromptSection(
        parseRole(promptId, raw), raw.id(), Boolean.TRUE.equals(raw.enabled()), raw.content());
  }

  private static ChatProvider.Role parseRole(String promptId, SectionYaml raw) {
    if (raw.role() == null) {
      throw new ValidationException(
          "Section '%s' of prompt %s has no role".formatted(raw.id(), promptId));
    }
    try {
      return ChatProvider.Role.valueOf(raw.role().trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException(
          "Section '%s' of prompt %s has unknown role '%s'"
              .formatted(raw.id(), promptId, raw.role()),
          e);
    }
  }

  private static String trimSlashes(String path) {
    String p = path == null ? "" : path.trim();
    while (p.startsWith("/")) p = p.substring(1);
    while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
    return p;
  }
}
