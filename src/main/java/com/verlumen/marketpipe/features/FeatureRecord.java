package com.verlumen.marketpipe.features;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSortedMap;
import com.verlumen.marketpipe.instruments.Instrument;
import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Feature values of one instrument at one timestamp, computed from observations at or before that
 * timestamp. Features still warming up are absent from {@link #values()}.
 */
@AutoValue
public abstract class FeatureRecord {
  public static FeatureRecord create(
      Instrument instrument,
      Instant timestamp,
      String featureSetVersion,
      ImmutableSortedMap<String, Double> values) {
    checkArgument(!values.isEmpty(), "A feature record needs at least one value");
    return new AutoValue_FeatureRecord(instrument, timestamp, featureSetVersion, values);
  }

  public abstract Instrument instrument();

  public abstract Instant timestamp();

  public abstract String featureSetVersion();

  public abstract ImmutableSortedMap<String, Double> values();

  public OptionalDouble value(String name) {
    Double value = values().get(name);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }
}
