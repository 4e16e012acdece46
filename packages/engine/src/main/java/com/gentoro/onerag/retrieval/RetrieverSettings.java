package com.gentoro.onerag.retrieval;

import com.gentoro.onerag.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * @param semanticWeight weight of the normalized vector score
 * @param bm25Weight weight of the normalized lexical score
 * @param latencyWarning searches slower than this are logged at warn
 */
public record RetrieverSettings(
    double semanticWeight,
    double bm25Weight,
    boolean lexicalEnabled,
    Duration cacheTtl,
    int cacheCapacity,
    int defaultTopK,
    Duration latencyWarning) {

  public RetrieverSettings {
    if (semanticWeight < 0 || bm25Weight < 0) {
      throw new ConfigException("retrieval weights must not be negative");
    }
    if (cacheCapacity <= 0) throw new ConfigException("retrieval.cache-capacity must be positive");
    if (defaultTopK <= 0) throw new ConfigException("retrieval.top-k must be positive");
  }

  public static RetrieverSettings defaults() {
    return new RetrieverSettings(
        0.6, 0.4, true, Duration.ofSeconds(60), 100, 30, Duration.ofMillis(170));
  }

  /** Reads the {@code retrieval} configuration subset. */
  public static RetrieverSettings from(Configuration cfg) {
    RetrieverSettings d = defaults();
    return new RetrieverSettings(
        cfg.getDouble("semantic-weight", d.semanticWeight()),
        cfg.getDouble("bm25-weight", d.bm25Weight()),
        cfg.getBoolean("lexical-enabled", d.lexicalEnabled()),
        Duration.ofSeconds(cfg.getLong("cache-ttl-seconds", d.cacheTtl().toSeconds())),
        cfg.getInt("cache-capacity", d.cacheCapacity()),
        cfg.getInt("top-k", d.defaultTopK()),
        Duration.ofMillis(cfg.getLong("latency-warning-ms", d.latencyWarning().toMillis())));
  }
}
