package com.verlumen.marketpipe.signals;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * Threshold bands over the expected return. Returns at or above {@code buyThreshold} buy and
 * returns at or below {@code -sellThreshold} sell; anything in between holds.
 */
@AutoValue
public abstract class ThresholdDecisionPolicy {
  public static ThresholdDecisionPolicy create(double buyThreshold, double sellThreshold) {
    checkArgument(buyThreshold > 0, "buyThreshold must be positive: %s", buyThreshold);
    checkArgument(sellThreshold > 0, "sellThreshold must be positive: %s", sellThreshold);
    return new AutoValue_ThresholdDecisionPolicy(buyThreshold, sellThreshold);
  }

  public abstract double buyThreshold();

  public abstract double sellThreshold();

  public Decision decide(Prediction prediction) {
    if (prediction.expectedReturn() >= buyThreshold()) {
      return Decision.BUY;
    }
    if (prediction.expectedReturn() <= -sellThreshold()) {
      return Decision.SELL;
    }
    return Decision.HOLD;
  }

  /** The model's confidence clamped to [0, 1]; NaN counts as no confidence. */
  public double confidence(Prediction prediction) {
    double confidence = prediction.confidence();
    if (Double.isNaN(confidence)) {
      return 0;
    }
    return Math.max(0, Math.min(1, confidence));
  }
}
