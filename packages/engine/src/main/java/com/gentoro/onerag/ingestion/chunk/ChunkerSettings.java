package com.gentoro.onerag.ingestion.chunk;

import com.gentoro.onerag.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/** Token bounds for {@link Chunker}. */
public record ChunkerSettings(int targetTokens, int overlapTokens, int minTokens, int maxTokens) {

  public ChunkerSettings {
    if (targetTokens <= 0) {
      throw new ConfigException("chunker.target-tokens must be positive: " + targetTokens);
    }
    if (overlapTokens < 0 || minTokens < 0) {
      throw new ConfigException("chunker overlap/min tokens must not be negative");
    }
    if (maxTokens < targetTokens) {
      throw new ConfigException(
          "chunker.max-tokens (%d) must be >= target-tokens (%d)"
              .formatted(maxTokens, targetTokens));
    }
  }

  public static ChunkerSettings defaults() {
    return new ChunkerSettings(512, 50, 100, 2000);
  }

  /** Reads the {@code chunker} configuration subset. */
  public static ChunkerSettings from(Configuration cfg) {
    ChunkerSettings d = defaults();
    return new ChunkerSettings(
        cfg.getInt("target-tokens", d.targetTokens()),
        cfg.getInt("overlap-tokens", d.overlapTokens()),
        cfg.getInt("min-tokens", d.minTokens()),
        cfg.getInt("max-tokens", d.maxTokens()));
  }

  /** Tokens the sliding window advances per step; never less than one. */
  public int step() {
    return Math.max(targetTokens - overlapTokens, 1);
  }
}
