package com.verlumen.marketpipe.ingestion;

import java.time.Duration;

/** Waits between retry attempts. Swapped out in tests. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
