package com.gentoro.onerag.exception;

import java.util.List;
import java.util.Map;

/** Selector output that fails validation against the candidate set. */
public class ExplainerValidationException extends OneRagException {
  private final List<String> problems;

  public ExplainerValidationException(List<String> problems) {
    super(
        OneRagErrorCode.EXPLAINER_VALIDATION_ERROR,
        "Selection failed validation: " + String.join("; ", problems),
        Map.of("problems", List.copyOf(problems)));
    this.problems = List.copyOf(problems);
  }

  public List<String> problems() {
    return problems;
  }
}
