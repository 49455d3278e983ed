package com.verlumen.marketpipe.ingestion;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;

/**
 * Pulls new observations for (instrument, source) pairs into the raw store and advances their
 * cursors. Failures are reported in the returned outcomes, never thrown.
 */
public interface IngestionCoordinator {
  /** Runs one cycle for {@code pair}, ingesting completed bars up to {@code asOf}. */
  PairOutcome ingest(IngestionPair pair, Instant asOf);

  /** Runs one cycle per pair in parallel. Outcomes are in the order of {@code pairs}. */
  ImmutableList<PairOutcome> ingestAll(List<IngestionPair> pairs, Instant asOf);
}
