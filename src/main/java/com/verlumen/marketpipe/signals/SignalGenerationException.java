package com.verlumen.marketpipe.signals;

import java.time.Instant;

/** No signal could be produced for one timestamp. */
public final class SignalGenerationException extends Exception {
  private final Instant timestamp;
  private final boolean retryable;

  SignalGenerationException(Instant timestamp, String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.timestamp = timestamp;
    this.retryable = retryable;
  }

  public Instant timestamp() {
    return timestamp;
  }

  /** True if the model was unavailable rather than unable to score the record. */
  public boolean isRetryable() {
    return retryable;
  }
}
