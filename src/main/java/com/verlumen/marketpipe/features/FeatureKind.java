package com.verlumen.marketpipe.features;

public enum FeatureKind {
  ROLLING_MEAN(0, true),
  ROLLING_STDDEV(0, true),
  ROLLING_HIGH(0, true),
  ROLLING_LOW(0, true),
  VOLUME_SUM(0, true),
  MOMENTUM(1, false),
  SIMPLE_RETURN(1, false),
  LOG_RETURN(1, false),
  REALIZED_VOLATILITY(1, false);

  private final int extraPoints;
  private final boolean aggregate;

  FeatureKind(int extraPoints, boolean aggregate) {
    this.extraPoints = extraPoints;
    this.aggregate = aggregate;
  }

  /**
   * Number of observations a window of {@code window} periods spans. Differences over N periods
   * need N + 1 closes.
   */
  public int pointsNeeded(int window) {
    return window + extraPoints;
  }

  /** Aggregates stay meaningful over a window with holes; differences do not. */
  public boolean supportsGapTolerance() {
    return aggregate;
  }
}
