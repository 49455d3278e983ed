package com.verlumen.marketpipe.signals;

import com.verlumen.marketpipe.features.FeatureRecord;
import java.util.OptionalDouble;

/**
 * Stand-in model for dry runs: expects the short moving average to keep pulling away from the long
 * one, {@code sma_5 / sma_20 - 1}.
 */
final class ReturnHeuristicModel implements PredictionModel {
  static final String MODEL_VERSION = "sma-ratio-v1";

  @Override
  public String modelVersion() {
    return MODEL_VERSION;
  }

  @Override
  public Prediction predict(FeatureRecord record) throws ModelInferenceException {
    OptionalDouble fast = record.value("sma_5");
    OptionalDouble slow = record.value("sma_20");
    if (fast.isEmpty() || slow.isEmpty()) {
      throw new ModelInferenceException(
          "Record at " + record.timestamp() + " lacks sma_5 or sma_20");
    }
    double expectedReturn = fast.getAsDouble() / slow.getAsDouble() - 1;
    // Confidence saturates once the averages are 2% apart.
    return Prediction.create(expectedReturn, Math.min(1, Math.abs(expectedReturn) * 50));
  }
}
