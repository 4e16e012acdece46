package com.gentoro.onerag.embedding;

import com.gentoro.onerag.exception.EmbeddingException;
import com.gentoro.onerag.exception.OneRagErrorCode;
import com.gentoro.onerag.exception.OneRagException;
import com.gentoro.onerag.utility.Sleeper;
import com.gentoro.onerag.utility.StringUtility;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Batches texts, rate-limits and retries calls to an {@link EmbeddingProvider}, and keeps usage
 * counters.
 *
 * <p>Retry policy per batch, driven by {@link EmbeddingException.Kind}:
 *
 * <ul>
 *   <li>{@code RATE_LIMITED}: sleep {@code retryBaseDelay * 2^n}, retry
 *   <li>{@code FATAL}: rethrow immediately
 *   <li>{@code TRANSIENT}: sleep {@code transientBaseDelay * 2^n}, retry
 * </ul>
 *
 * After {@code maxRetries} retries the last error is rethrown. Each provider call runs on a worker
 * thread bounded by {@code attemptTimeout}; interrupting the caller cancels the in-flight call and
 * any backoff sleep.
 */
public class EmbeddingAdapter implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(EmbeddingAdapter.class);

  private final EmbeddingProvider provider;
  private final EmbeddingSettings settings;
  private final EmbeddingRateLimiter rateLimiter;
  private final Sleeper sleeper;
  private final ExecutorService workers;

  private final AtomicLong callCount = new AtomicLong();
  private final AtomicLong tokenCount = new AtomicLong();
  private final AtomicLong errorCount = new AtomicLong();

  public EmbeddingAdapter(EmbeddingProvider provider, EmbeddingSettings settings) {
    this(
        provider,
        settings,
        new EmbeddingRateLimiter(settings.callsPerMinute()),
        Sleeper.THREAD);
  }

  public EmbeddingAdapter(
      EmbeddingProvider provider,
      EmbeddingSettings settings,
      EmbeddingRateLimiter rateLimiter,
      Sleeper sleeper) {
    this.provider = Objects.requireNonNull(provider, "provider");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    AtomicInteger threadIds = new AtomicInteger();
    this.workers =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "embedding-call-" + threadIds.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public String model() {
    return provider.model();
  }

  public String modelVersion() {
    return provider.modelVersion();
  }

  /** Embeds documents in batches of {@code batchSize}; output is aligned with {@code texts}. */
  public List<EmbeddingResult> embedDocuments(List<String> texts) {
    List<EmbeddingResult> results = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i += settings.batchSize()) {
      List<String> batch = texts.subList(i, Math.min(i + settings.batchSize(), texts.size()));
      results.addAll(embedBatchWithRetry(List.copyOf(batch)));
    }
    return results;
  }

  /**
   * Embeds a search query in query mode. Queries are interactive, so they are rate-limited but not
   * retried.
   */
  public EmbeddingResult embedQuery(String query) {
    try {
      rateLimiter.acquire();
      EmbeddingResult result = callWithTimeout(() -> provider.embedQuery(query));
      callCount.incrementAndGet();
      tokenCount.addAndGet(StringUtility.wordCount(query));
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OneRagException(OneRagErrorCode.CANCELLED, "Query embedding interrupted", e);
    } catch (EmbeddingException e) {
      errorCount.incrementAndGet();
      log.error("Query embedding failed: {}", e.getMessage());
      throw e;
    }
  }

  public EmbeddingUsage usage() {
    return new EmbeddingUsage(
        callCount.get(), tokenCount.get(), errorCount.get(), model(), modelVersion());
  }

  public void resetUsage() {
    callCount.set(0);
    tokenCount.set(0);
    errorCount.set(0);
  }

  private List<EmbeddingResult> embedBatchWithRetry(List<String> batch) {
    EmbeddingException last = null;
    for (int attempt = 0; attempt <= settings.maxRetries(); attempt++) {
      try {
        rateLimiter.acquire();
        List<EmbeddingResult> results = callWithTimeout(() -> provider.embedBatch(batch));
        if (results.size() != batch.size()) {
          throw new EmbeddingException(
              EmbeddingException.Kind.FATAL,
              "Provider returned %d vectors for %d texts".formatted(results.size(), batch.size()));
        }
        callCount.incrementAndGet();
        tokenCount.addAndGet(batch.stream().mapToLong(StringUtility::wordCount).sum());
        log.debug("Embedded batch of {} texts", batch.size());
        return results;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new OneRagException(OneRagErrorCode.CANCELLED, "Embedding interrupted", e);
      } catch (EmbeddingException e) {
        errorCount.incrementAndGet();
        last = e;
        if (!e.isRetryable()) {
          log.error("Embedding request rejected, not retrying: {}", e.getMessage());
          throw e;
        }
        if (attempt == settings.maxRetries()) {
          break;
        }
        Duration wait = backoff(e.kind(), attempt);
        log.warn(
            "Embedding failed ({}), retry {}/{} in {} ms: {}",
            e.kind(),
            attempt + 1,
            settings.maxRetries(),
            wait.toMillis(),
            e.getMessage());
        pause(wait);
      }
    }
    log.error("All {} retries exhausted for batch embedding", settings.maxRetries());
    throw last;
  }

  Duration backoff(EmbeddingException.Kind kind, int attempt) {
    Duration base =
        kind == EmbeddingException.Kind.RATE_LIMITED
            ? settings.retryBaseDelay()
            : settings.transientBaseDelay();
    return base.multipliedBy(1L << Math.min(attempt, 20));
  }

  private void pause(Duration wait) {
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OneRagException(OneRagErrorCode.CANCELLED, "Embedding retry interrupted", e);
    }
  }

  private <T> T callWithTimeout(Supplier<T> call) throws InterruptedException {
    Duration timeout = settings.attemptTimeout();
    if (timeout.isZero() || timeout.isNegative()) {
      return invoke(call);
    }
    Future<T> future = workers.submit(() -> invoke(call));
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new EmbeddingException(
          EmbeddingException.Kind.TRANSIENT,
          null,
          "Embedding call timed out after " + timeout.toMillis() + " ms",
          e);
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof EmbeddingException ee) throw ee;
      throw classify(cause);
    }
  }

  private static <T> T invoke(Supplier<T> call) {
    try {
      return call.get();
    } catch (EmbeddingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw classify(e);
    }
  }

  /** Classification for failures a provider did not type; only the message is available. */
  static EmbeddingException classify(Throwable t) {
    return new EmbeddingException(
        EmbeddingException.classify(null, t.getMessage()),
        null,
        "Embedding provider failed: " + t.getMessage(),
        t);
  }

  @Override
  public void close() {
    workers.shutdownNow();
  }
}
