package com.verlumen.marketpipe.signals;

import com.verlumen.marketpipe.features.FeatureRecord;

public interface SignalGenerator {
  /**
   * Scores {@code record}, decides, appends the signal to the log and publishes it if actionable.
   * Deterministic for a given record and model version; nothing is retried.
   */
  Signal generate(FeatureRecord record) throws SignalGenerationException;
}
