package com.verlumen.marketpipe.features;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.marketpipe.instruments.Instrument;
import java.time.Instant;
import java.util.Optional;

/** Records computed for one instrument, plus the timestamps that failed. */
@AutoValue
public abstract class FeatureBatchResult {
  public static FeatureBatchResult create(
      Instrument instrument,
      String featureSetVersion,
      ImmutableList<FeatureRecord> records,
      ImmutableList<FeatureFailure> failures) {
    return new AutoValue_FeatureBatchResult(instrument, featureSetVersion, records, failures);
  }

  public abstract Instrument instrument();

  public abstract String featureSetVersion();

  /** Ascending by timestamp. */
  public abstract ImmutableList<FeatureRecord> records();

  public abstract ImmutableList<FeatureFailure> failures();

  public ImmutableList<Instant> failedTimestamps() {
    return failures().stream().map(FeatureFailure::timestamp).collect(toImmutableList());
  }

  public Optional<FeatureRecord> latest() {
    return records().isEmpty() ? Optional.empty() : Optional.of(records().get(records().size() - 1));
  }
}
