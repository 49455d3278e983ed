package com.verlumen.marketpipe.signals;

import com.verlumen.marketpipe.features.FeatureRecord;

/** An external model, opaque apart from its version. */
public interface PredictionModel {
  /** Identifies the model build; recorded on every signal. */
  String modelVersion();

  Prediction predict(FeatureRecord record) throws ModelUnavailableException, ModelInferenceException;
}
