package com.verlumen.marketpipe.pipeline;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.marketpipe.ingestion.PairOutcome;
import java.time.Duration;
import java.time.Instant;

/**
 * Structured outcome of one cycle. Partial success is normal: some pairs may advance while others
 * report a failure.
 */
@AutoValue
public abstract class CycleReport {
  static CycleReport create(
      Instant asOf,
      ImmutableList<PairOutcome> pairOutcomes,
      ImmutableList<InstrumentReport> instrumentReports,
      Duration duration) {
    return new AutoValue_CycleReport(asOf, pairOutcomes, instrumentReports, duration);
  }

  public abstract Instant asOf();

  public abstract ImmutableList<PairOutcome> pairOutcomes();

  public abstract ImmutableList<InstrumentReport> instrumentReports();

  public abstract Duration duration();

  public long failedPairs() {
    return pairOutcomes().stream().filter(outcome -> !outcome.succeeded()).count();
  }
}
