package com.verlumen.marketpipe.signals;

import com.google.auto.value.AutoValue;
import com.verlumen.marketpipe.instruments.Instrument;
import java.time.Instant;

/** An audited decision, reproducible from its feature record and model version. */
@AutoValue
public abstract class Signal {
  public static Builder builder() {
    return new AutoValue_Signal.Builder();
  }

  public abstract Instrument instrument();

  /** Timestamp of the feature record the decision was made from. */
  public abstract Instant timestamp();

  public abstract Decision decision();

  public abstract double confidence();

  public abstract double expectedReturn();

  public abstract String featureSetVersion();

  public abstract String modelVersion();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setInstrument(Instrument instrument);

    public abstract Builder setTimestamp(Instant timestamp);

    public abstract Builder setDecision(Decision decision);

    public abstract Builder setConfidence(double confidence);

    public abstract Builder setExpectedReturn(double expectedReturn);

    public abstract Builder setFeatureSetVersion(String featureSetVersion);

    public abstract Builder setModelVersion(String modelVersion);

    public abstract Signal build();
  }
}
