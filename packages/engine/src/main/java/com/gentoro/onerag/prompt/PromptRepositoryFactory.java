package com.gentoro.onerag.prompt;

import com.gentoro.onerag.exception.ConfigException;
import com.gentoro.onerag.prompt.impl.ClasspathPromptRepository;
import org.apache.commons.configuration2.Configuration;

public final class PromptRepositoryFactory {
  private PromptRepositoryFactory() {}

  /**
   * Create a PromptRepository from the {@code prompt} configuration subset. Supported property:
   * {@code location}, e.g. "classpath:prompts" (the default).
   */
  public static PromptRepository create(Configuration promptCfg) {
    String location = promptCfg.getString("location", "classpath:prompts").trim();
    if (!location.startsWith("classpath:")) {
      throw new ConfigException("Unsupported prompt.location (expected classpath:): " + location);
    }
    String base = location.substring("classpath:".length());
    if (base.startsWith("/")) base = base.substring(1);
    if (base.isBlank()) {
      throw new ConfigException("Invalid prompt.location: base path is empty");
    }
    return new ClasspathPromptRepository(base);
  }
}
