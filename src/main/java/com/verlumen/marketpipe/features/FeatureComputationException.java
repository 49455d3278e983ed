package com.verlumen.marketpipe.features;

import java.time.Instant;

/** The input window for one timestamp could not be used. Fails that timestamp only. */
public final class FeatureComputationException extends Exception {
  private final Instant timestamp;

  FeatureComputationException(Instant timestamp, String message) {
    super(message);
    this.timestamp = timestamp;
  }

  public Instant timestamp() {
    return timestamp;
  }
}
