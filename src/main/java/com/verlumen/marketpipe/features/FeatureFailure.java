package com.verlumen.marketpipe.features;

import com.google.auto.value.AutoValue;
import java.time.Instant;

@AutoValue
public abstract class FeatureFailure {
  public static FeatureFailure create(Instant timestamp, String reason) {
    return new AutoValue_FeatureFailure(timestamp, reason);
  }

  static FeatureFailure of(FeatureComputationException e) {
    return create(e.timestamp(), e.getMessage());
  }

  public abstract Instant timestamp();

  public abstract String reason();
}
