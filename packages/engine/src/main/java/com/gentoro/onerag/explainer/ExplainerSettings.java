package com.gentoro.onerag.explainer;

import com.gentoro.onerag.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * @param maxRetries extra attempts, with the simplified prompt, after an unusable response
 * @param tokenBudget budget used when the caller does not pass one
 */
public record ExplainerSettings(
    String model,
    double temperature,
    int minSelected,
    int maxSelected,
    int maxRetries,
    int tokenBudget) {

  public ExplainerSettings {
    if (model == null || model.isBlank()) throw new ConfigException("explainer.model is required");
    if (minSelected < 0) throw new ConfigException("explainer.min-selected must not be negative");
    if (maxSelected < minSelected) {
      throw new ConfigException("explainer.max-selected must be >= explainer.min-selected");
    }
    if (maxRetries < 0) throw new ConfigException("explainer.max-retries must not be negative");
    if (tokenBudget <= 0) throw new ConfigException("explainer.token-budget must be positive");
  }

  public static ExplainerSettings defaults() {
    return new ExplainerSettings("gpt-4o-mini", 0.3, 3, 8, 2, 4000);
  }

  /** Reads the {@code explainer} configuration subset. */
  public static ExplainerSettings from(Configuration cfg) {
    ExplainerSettings d = defaults();
    return new ExplainerSettings(
        cfg.getString("model", d.model()),
        cfg.getDouble("temperature", d.temperature()),
        cfg.getInt("min-selected", d.minSelected()),
        cfg.getInt("max-selected", d.maxSelected()),
        cfg.getInt("max-retries", d.maxRetries()),
        cfg.getInt("token-budget", d.tokenBudget()));
  }
}
