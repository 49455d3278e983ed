package com.verlumen.marketpipe.ingestion;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import java.time.Duration;

/**
 * Exponential backoff as a pure state machine.
 *
 * <pre>
 *   ATTEMPTING --SUCCESS--------------------------> SUCCEEDED
 *   ATTEMPTING --TRANSIENT_FAILURE (attempts left)--> BACKOFF(delay)
 *   ATTEMPTING --TRANSIENT_FAILURE (no attempts)----> EXHAUSTED
 *   BACKOFF    --BACKOFF_ELAPSED--------------------> ATTEMPTING(attempt + 1)
 * </pre>
 *
 * <p>The delay before attempt {@code n + 1} is {@code baseDelay * 2^(n - 1)}, capped at
 * {@code maxDelay} and spread by up to {@code jitterFraction} in either direction.
 */
@AutoValue
public abstract class RetryPolicy {
  public static RetryPolicy create(
      int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFraction) {
    checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1: %s", maxAttempts);
    checkArgument(!baseDelay.isNegative() && !maxDelay.isNegative(), "Delays must be non-negative");
    checkArgument(jitterFraction >= 0 && jitterFraction < 1, "jitterFraction must be in [0, 1)");
    return new AutoValue_RetryPolicy(maxAttempts, baseDelay, maxDelay, jitterFraction);
  }

  public abstract int maxAttempts();

  public abstract Duration baseDelay();

  public abstract Duration maxDelay();

  public abstract double jitterFraction();

  /**
   * Transition function.
   *
   * @param jitterSample a value in [0, 1) used only when entering {@link RetryPhase#BACKOFF}
   * @throws IllegalStateException if {@code event} is not valid in the current phase
   */
  public RetryState next(RetryState state, RetryEvent event, double jitterSample) {
    checkState(!state.phase().isTerminal(), "No transitions out of %s", state.phase());
    switch (state.phase()) {
      case ATTEMPTING:
        if (event == RetryEvent.SUCCESS) {
          return RetryState.create(RetryPhase.SUCCEEDED, state.attempt(), Duration.ZERO);
        }
        checkState(event == RetryEvent.TRANSIENT_FAILURE, "Unexpected %s while attempting", event);
        if (state.attempt() >= maxAttempts()) {
          return RetryState.create(RetryPhase.EXHAUSTED, state.attempt(), Duration.ZERO);
        }
        return RetryState.create(
            RetryPhase.BACKOFF, state.attempt(), backoffDelay(state.attempt(), jitterSample));
      case BACKOFF:
        checkState(event == RetryEvent.BACKOFF_ELAPSED, "Unexpected %s during backoff", event);
        return RetryState.create(RetryPhase.ATTEMPTING, state.attempt() + 1, Duration.ZERO);
      default:
        throw new IllegalStateException("Unhandled phase " + state.phase());
    }
  }

  /** Delay after the given failed attempt, numbered from 1; the first retry waits the base delay. */
  Duration backoffDelay(int failedAttempt, double jitterSample) {
    checkArgument(jitterSample >= 0 && jitterSample < 1, "jitterSample must be in [0, 1)");
    // Cap the exponent well before the multiplication could overflow.
    int exponent = Math.min(failedAttempt - 1, 30);
    double uncapped = baseDelay().toMillis() * Math.pow(2, exponent);
    double capped = Math.min(uncapped, maxDelay().toMillis());
    double jittered = capped * (1 - jitterFraction() + 2 * jitterFraction() * jitterSample);
    return Duration.ofMillis(Math.round(Math.min(jittered, maxDelay().toMillis())));
  }
}
