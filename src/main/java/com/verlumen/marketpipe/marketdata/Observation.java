package com.verlumen.marketpipe.marketdata;

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSortedMap;
import com.verlumen.marketpipe.instruments.Instrument;
import java.time.Instant;
import java.util.Optional;

/**
 * One raw OHLCV bar for an instrument, exactly as a source reported it.
 *
 * <p>The timestamp is the bar's open time. Observations are never mutated; a restated bar arrives
 * as a new observation with a higher {@link #revision()} for the same {@link #key()}.
 */
@AutoValue
public abstract class Observation {
  public static Builder builder() {
    return new AutoValue_Observation.Builder()
        .setRevision(0)
        .setAttributes(ImmutableSortedMap.of());
  }

  public abstract Instrument instrument();

  public abstract Instant timestamp();

  public abstract double open();

  public abstract double high();

  public abstract double low();

  public abstract double close();

  public abstract double volume();

  /** Name of the source adapter that produced the bar, e.g. {@code binance}. */
  public abstract String source();

  /** Identifier of the committed batch; empty until the Raw Store accepts the observation. */
  public abstract Optional<String> ingestionId();

  /** 0 for the first report of a bar; corrections use higher revisions and supersede lower ones. */
  public abstract int revision();

  /** Provider specific extras such as {@code adjusted_close} or {@code num_trades}. */
  public abstract ImmutableSortedMap<String, Double> attributes();

  public abstract Builder toBuilder();

  public ObservationKey key() {
    return ObservationKey.create(instrument(), timestamp(), source());
  }

  public boolean isCorrection() {
    return revision() > 0;
  }

  public Observation withIngestionId(String ingestionId) {
    return toBuilder().setIngestionId(ingestionId).build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setInstrument(Instrument instrument);

    public abstract Builder setTimestamp(Instant timestamp);

    public abstract Builder setOpen(double open);

    public abstract Builder setHigh(double high);

    public abstract Builder setLow(double low);

    public abstract Builder setClose(double close);

    public abstract Builder setVolume(double volume);

    public abstract Builder setSource(String source);

    public abstract Builder setIngestionId(String ingestionId);

    public abstract Builder setRevision(int revision);

    public abstract Builder setAttributes(ImmutableSortedMap<String, Double> attributes);

    abstract Observation autoBuild();

    public Observation build() {
      Observation observation = autoBuild();
      checkState(observation.revision() >= 0, "Negative revision: %s", observation.revision());
      checkState(!observation.source().isEmpty(), "Observation source must not be empty");
      return observation;
    }
  }
}
