package com.verlumen.marketpipe.features;

import com.google.common.collect.ImmutableMap;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;
import java.util.List;

/**
 * Derives feature records from the raw store. A record at {@code t} only ever reads observations
 * at or before {@code t}, and recomputing an unchanged range yields identical records.
 */
public interface FeatureEngine {
  /**
   * Computes records for every observed timestamp of {@code instrument} inside {@code range}.
   * Timestamps whose input window is malformed are reported as failures and skipped.
   */
  FeatureBatchResult compute(Instrument instrument, TimeRange range, String featureSetVersion)
      throws StorageException;

  /**
   * Runs {@link #compute} for each instrument in parallel. Instruments whose raw data could not be
   * read are logged and left out of the result.
   */
  ImmutableMap<Instrument, FeatureBatchResult> computeAll(
      List<Instrument> instruments, TimeRange range, String featureSetVersion);
}
