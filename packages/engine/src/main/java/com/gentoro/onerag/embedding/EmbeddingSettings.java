package com.gentoro.onerag.embedding;

import com.gentoro.onerag.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Batching, rate limiting and retry bounds for {@link EmbeddingAdapter}.
 *
 * @param maxRetries retries after the first attempt
 * @param retryBaseDelay backoff base for rate-limit failures
 * @param transientBaseDelay backoff base for other retryable failures
 * @param callsPerMinute global ceiling on provider calls; zero disables limiting
 * @param attemptTimeout upper bound per provider call; zero disables the timeout
 */
public record EmbeddingSettings(
    int batchSize,
    int maxRetries,
    Duration retryBaseDelay,
    Duration transientBaseDelay,
    int callsPerMinute,
    Duration attemptTimeout) {

  public EmbeddingSettings {
    if (batchSize <= 0) throw new ConfigException("embedding.batch-size must be positive");
    if (maxRetries < 0) throw new ConfigException("embedding.max-retries must not be negative");
    if (callsPerMinute < 0) {
      throw new ConfigException("embedding.calls-per-minute must not be negative");
    }
  }

  public static EmbeddingSettings defaults() {
    return new EmbeddingSettings(
        100, 3, Duration.ofSeconds(60), Duration.ofSeconds(5), 60, Duration.ofSeconds(120));
  }

  /** Reads the {@code embedding} configuration subset. */
  public static EmbeddingSettings from(Configuration cfg) {
    EmbeddingSettings d = defaults();
    return new EmbeddingSettings(
        cfg.getInt("batch-size", d.batchSize()),
        cfg.getInt("max-retries", d.maxRetries()),
        Duration.ofMillis(cfg.getLong("retry-base-delay-ms", d.retryBaseDelay().toMillis())),
        Duration.ofMillis(
            cfg.getLong("transient-base-delay-ms", d.transientBaseDelay().toMillis())),
        cfg.getInt("calls-per-minute", d.callsPerMinute()),
        Duration.ofMillis(cfg.getLong("attempt-timeout-ms", d.attemptTimeout().toMillis())));
  }
}
