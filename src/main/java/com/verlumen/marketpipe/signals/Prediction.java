package com.verlumen.marketpipe.signals;

import com.google.auto.value.AutoValue;

/** What a model expects from the instrument over its horizon. */
@AutoValue
public abstract class Prediction {
  public static Prediction create(double expectedReturn, double confidence) {
    return new AutoValue_Prediction(expectedReturn, confidence);
  }

  /** Fractional return, e.g. 0.02 for +2%. */
  public abstract double expectedReturn();

  public abstract double confidence();
}
