package com.verlumen.marketpipe.pipeline;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.verlumen.marketpipe.execution.ExecutionModule;
import com.verlumen.marketpipe.execution.RunMode;
import com.verlumen.marketpipe.features.FeaturesModule;
import com.verlumen.marketpipe.http.HttpModule;
import com.verlumen.marketpipe.ingestion.IngestionConfig;
import com.verlumen.marketpipe.ingestion.IngestionModule;
import com.verlumen.marketpipe.instruments.InstrumentsModule;
import com.verlumen.marketpipe.kafka.KafkaModule;
import com.verlumen.marketpipe.marketdata.MarketDataConfig;
import com.verlumen.marketpipe.marketdata.MarketDataModule;
import com.verlumen.marketpipe.processed.ProcessedStoreModule;
import com.verlumen.marketpipe.rawstore.RawStoreModule;
import com.verlumen.marketpipe.signals.SignalsConfig;
import com.verlumen.marketpipe.signals.SignalsModule;
import com.verlumen.marketpipe.storage.StorageModule;
import java.nio.file.Path;
import java.util.Optional;

@AutoValue
abstract class PipelineModule extends AbstractModule {
  static PipelineModule create(
      RunMode runMode,
      ImmutableList<String> instrumentSpecs,
      Optional<Path> dataDirectory,
      String bootstrapServers,
      MarketDataConfig marketDataConfig,
      IngestionConfig ingestionConfig,
      SignalsConfig signalsConfig,
      PipelineConfig pipelineConfig) {
    return new AutoValue_PipelineModule(
        runMode,
        instrumentSpecs,
        dataDirectory,
        bootstrapServers,
        marketDataConfig,
        ingestionConfig,
        signalsConfig,
        pipelineConfig);
  }

  abstract RunMode runMode();

  abstract ImmutableList<String> instrumentSpecs();

  abstract Optional<Path> dataDirectory();

  abstract String bootstrapServers();

  abstract MarketDataConfig marketDataConfig();

  abstract IngestionConfig ingestionConfig();

  abstract SignalsConfig signalsConfig();

  abstract PipelineConfig pipelineConfig();

  @Override
  protected void configure() {
    install(ExecutionModule.create(runMode().name()));
    install(FeaturesModule.create());
    install(HttpModule.create());
    install(IngestionModule.create(ingestionConfig()));
    install(InstrumentsModule.create(runMode(), instrumentSpecs()));
    install(KafkaModule.create(bootstrapServers()));
    install(MarketDataModule.create(marketDataConfig()));
    install(ProcessedStoreModule.create());
    install(RawStoreModule.create());
    install(SignalsModule.create(signalsConfig()));
    install(StorageModule.create(dataDirectory()));

    bind(PipelineConfig.class).toInstance(pipelineConfig());
    bind(CycleRunner.class).to(CycleRunnerImpl.class);
  }
}
