package com.gentoro.onerag.embedding;

import com.gentoro.onerag.utility.Sleeper;
import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Spaces provider calls at least {@code 60s / callsPerMinute} apart.
 *
 * <p>The check and the sleep happen under the instance monitor, so concurrent callers queue up and
 * the ceiling holds across threads. One limiter is shared by every adapter that talks to the same
 * provider account.
 */
public class EmbeddingRateLimiter {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(EmbeddingRateLimiter.class);

  private final long intervalMs;
  private final LongSupplier clockMs;
  private final Sleeper sleeper;

  private boolean called;
  private long lastCallAt;

  public EmbeddingRateLimiter(int callsPerMinute) {
    this(callsPerMinute, System::currentTimeMillis, Sleeper.THREAD);
  }

  public EmbeddingRateLimiter(int callsPerMinute, LongSupplier clockMs, Sleeper sleeper) {
    this.intervalMs = callsPerMinute <= 0 ? 0L : 60_000L / callsPerMinute;
    this.clockMs = clockMs;
    this.sleeper = sleeper;
  }

  public long intervalMs() {
    return intervalMs;
  }

  /** Blocks until the next call is allowed, then records it. */
  public synchronized void acquire() throws InterruptedException {
    if (intervalMs == 0) return;
    long wait = waitTime(clockMs.getAsLong());
    if (wait > 0) {
      log.debug("Rate limiting: sleeping {} ms", wait);
      sleeper.sleep(Duration.ofMillis(wait));
    }
    called = true;
    lastCallAt = clockMs.getAsLong();
  }

  /** Milliseconds a call at {@code nowMs} would have to wait. */
  synchronized long waitTime(long nowMs) {
    if (!called) return 0L;
    long since = nowMs - lastCallAt;
    return since < intervalMs ? intervalMs - since : 0L;
  }
}
