package com.verlumen.marketpipe.signals;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.marketpipe.features.FeatureRecord;
import com.verlumen.marketpipe.storage.StorageException;

final class SignalGeneratorImpl implements SignalGenerator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final PredictionModel model;
  private final ThresholdDecisionPolicy policy;
  private final SignalLog signalLog;
  private final SignalPublisher publisher;

  @Inject
  SignalGeneratorImpl(
      PredictionModel model,
      ThresholdDecisionPolicy policy,
      SignalLog signalLog,
      SignalPublisher publisher) {
    this.model = model;
    this.policy = policy;
    this.signalLog = signalLog;
    this.publisher = publisher;
  }

  @Override
  public Signal generate(FeatureRecord record) throws SignalGenerationException {
    Prediction prediction;
    try {
      prediction = model.predict(record);
    } catch (ModelUnavailableException e) {
      throw new SignalGenerationException(
          record.timestamp(),
          String.format("Model %s unavailable for %s", model.modelVersion(), record.instrument()),
          e,
          /* retryable= */ true);
    } catch (ModelInferenceException e) {
      throw new SignalGenerationException(
          record.timestamp(),
          String.format("Model %s could not score %s at %s", model.modelVersion(), record.instrument(), record.timestamp()),
          e,
          /* retryable= */ false);
    }

    Signal signal =
        Signal.builder()
            .setInstrument(record.instrument())
            .setTimestamp(record.timestamp())
            .setDecision(policy.decide(prediction))
            .setConfidence(policy.confidence(prediction))
            .setExpectedReturn(prediction.expectedReturn())
            .setFeatureSetVersion(record.featureSetVersion())
            .setModelVersion(model.modelVersion())
            .build();

    boolean appended;
    try {
      appended = signalLog.append(signal);
    } catch (StorageException e) {
      throw new SignalGenerationException(
          record.timestamp(), "Could not record signal for " + record.instrument(), e, true);
    }
    // Re-running a cycle must not publish the same signal twice.
    if (appended && signal.decision().isActionable()) {
      publisher.publish(signal);
    } else {
      logger.atFine().log("Not publishing %s (new=%s)", signal, appended);
    }
    return signal;
  }
}
