package com.verlumen.marketpipe.pipeline;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.signals.Signal;
import java.time.Instant;
import java.util.Optional;

/** What a cycle did for one instrument after ingestion. */
@AutoValue
public abstract class InstrumentReport {
  static Builder builder(Instrument instrument) {
    return new AutoValue_InstrumentReport.Builder()
        .setInstrument(instrument)
        .setFeaturesWritten(0)
        .setFailedTimestamps(ImmutableList.of());
  }

  public abstract Instrument instrument();

  /** Feature records that were new or changed in the processed store. */
  public abstract int featuresWritten();

  public abstract ImmutableList<Instant> failedTimestamps();

  public abstract Optional<Signal> signal();

  public abstract Optional<String> signalError();

  /** Set when features could not be computed or stored at all. */
  public abstract Optional<String> featureError();

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setInstrument(Instrument instrument);

    abstract Builder setFeaturesWritten(int featuresWritten);

    abstract Builder setFailedTimestamps(ImmutableList<Instant> failedTimestamps);

    abstract Builder setSignal(Signal signal);

    abstract Builder setSignalError(String signalError);

    abstract Builder setFeatureError(String featureError);

    abstract InstrumentReport build();
  }
}
