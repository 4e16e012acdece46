package com.gentoro.onerag.utility;

import java.time.Duration;

/** Blocking pause that honours thread interruption; replaced by a recorder in tests. */
@FunctionalInterface
public interface Sleeper {
  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
