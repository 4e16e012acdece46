package com.gentoro.onerag.prompt;

/** Source of named prompt templates. */
public interface PromptRepository {
  /**
   * Loads the template with the given id.
   *
   * @throws com.gentoro.onerag.exception.NotFoundException when no such template exists
   */
  PromptTemplate get(String name);
}
