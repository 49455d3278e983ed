package com.verlumen.marketpipe.ingestion;

import com.google.auto.value.AutoValue;
import java.time.Duration;

/**
 * Position in the retry state machine.
 *
 * @see RetryPolicy#next
 */
@AutoValue
public abstract class RetryState {
  public static RetryState initial() {
    return create(RetryPhase.ATTEMPTING, 1, Duration.ZERO);
  }

  static RetryState create(RetryPhase phase, int attempt, Duration delay) {
    return new AutoValue_RetryState(phase, attempt, delay);
  }

  public abstract RetryPhase phase();

  /** 1-based number of the current (or last) attempt. */
  public abstract int attempt();

  /** How long to wait before the next attempt; zero outside {@link RetryPhase#BACKOFF}. */
  public abstract Duration delay();
}
