package com.verlumen.marketpipe.signals;

import com.google.auto.value.AutoValue;
import com.google.common.flogger.FluentLogger;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import com.verlumen.marketpipe.execution.RunMode;
import com.verlumen.marketpipe.http.HttpClient;

@AutoValue
public abstract class SignalsModule extends AbstractModule {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static SignalsModule create(SignalsConfig config) {
    return new AutoValue_SignalsModule(config);
  }

  abstract SignalsConfig config();

  @Override
  protected void configure() {
    bind(SignalGenerator.class).to(SignalGeneratorImpl.class);
    bind(SignalLog.class).to(SignalLogImpl.class);
    bind(ThresholdDecisionPolicy.class)
        .toInstance(ThresholdDecisionPolicy.create(config().buyThreshold(), config().sellThreshold()));
    install(new FactoryModuleBuilder()
        .implement(SignalPublisher.class, KafkaSignalPublisher.class)
        .build(SignalPublisher.Factory.class));
  }

  @Provides
  @Singleton
  PredictionModel providePredictionModel(HttpClient httpClient) {
    if (config().modelEndpoint().isPresent()) {
      logger.atInfo().log("Using remote model %s at %s", config().modelVersion(), config().modelEndpoint().get());
      return new RemotePredictionModel(httpClient, config().modelEndpoint().get(), config().modelVersion());
    }
    logger.atInfo().log("No model endpoint configured, using %s", ReturnHeuristicModel.MODEL_VERSION);
    return new ReturnHeuristicModel();
  }

  @Provides
  @Singleton
  SignalPublisher provideSignalPublisher(RunMode runMode, SignalPublisher.Factory factory) {
    if (RunMode.DRY.equals(runMode)) {
      return new LoggingSignalPublisher();
    }
    return factory.create(config().signalTopic());
  }
}
