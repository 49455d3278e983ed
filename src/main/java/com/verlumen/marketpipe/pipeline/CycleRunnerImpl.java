package com.verlumen.marketpipe.pipeline;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multimaps;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.marketpipe.features.FeatureBatchResult;
import com.verlumen.marketpipe.features.FeatureEngine;
import com.verlumen.marketpipe.features.FeatureRecord;
import com.verlumen.marketpipe.features.FeatureSetRegistry;
import com.verlumen.marketpipe.ingestion.IngestionCoordinator;
import com.verlumen.marketpipe.ingestion.IngestionPair;
import com.verlumen.marketpipe.ingestion.PairOutcome;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.marketdata.SourceAdapter;
import com.verlumen.marketpipe.processed.ProcessedStore;
import com.verlumen.marketpipe.signals.SignalGenerationException;
import com.verlumen.marketpipe.signals.SignalGenerator;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class CycleRunnerImpl implements CycleRunner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  // A daily series recomputes at least a week so weekends never leave the range empty.
  private static final int MIN_RECOMPUTE_PERIODS = 7;

  private final IngestionCoordinator ingestionCoordinator;
  private final FeatureEngine featureEngine;
  private final ProcessedStore processedStore;
  private final SignalGenerator signalGenerator;
  private final Map<String, SourceAdapter> adapters;
  private final FeatureSetRegistry featureSetRegistry;
  private final PipelineConfig config;
  private final Ticker ticker;

  @Inject
  CycleRunnerImpl(
      IngestionCoordinator ingestionCoordinator,
      FeatureEngine featureEngine,
      ProcessedStore processedStore,
      SignalGenerator signalGenerator,
      Map<String, SourceAdapter> adapters,
      FeatureSetRegistry featureSetRegistry,
      PipelineConfig config,
      Ticker ticker) {
    this.ingestionCoordinator = ingestionCoordinator;
    this.featureEngine = featureEngine;
    this.processedStore = processedStore;
    this.signalGenerator = signalGenerator;
    this.adapters = adapters;
    this.featureSetRegistry = featureSetRegistry;
    this.config = config;
    this.ticker = ticker;
  }

  @Override
  public CycleReport runCycle(List<Instrument> instruments, Instant asOf) {
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    logger.atInfo().log("Starting cycle for %d instruments as of %s", instruments.size(), asOf);

    ImmutableList<PairOutcome> outcomes = ingestionCoordinator.ingestAll(pairs(instruments), asOf);

    ImmutableMap<Instrument, FeatureBatchResult> features = computeFeatures(instruments, asOf);
    ImmutableList.Builder<InstrumentReport> reports = ImmutableList.builder();
    for (Instrument instrument : instruments) {
      reports.add(processInstrument(instrument, Optional.ofNullable(features.get(instrument))));
    }

    CycleReport report = CycleReport.create(asOf, outcomes, reports.build(), stopwatch.elapsed());
    logger.atInfo().log(
        "Cycle as of %s finished in %s: %d of %d pairs failed",
        asOf, report.duration(), report.failedPairs(), outcomes.size());
    return report;
  }

  /** Computes each asset class with its own feature set over a range spanning a few of its bars. */
  private ImmutableMap<Instrument, FeatureBatchResult> computeFeatures(
      List<Instrument> instruments, Instant asOf) {
    ImmutableListMultimap<String, Instrument> byVersion =
        Multimaps.index(instruments, config::featureSetVersion);
    ImmutableMap.Builder<Instrument, FeatureBatchResult> features = ImmutableMap.builder();
    for (Map.Entry<String, List<Instrument>> group : Multimaps.asMap(byVersion).entrySet()) {
      Duration bar = featureSetRegistry.get(group.getKey()).timeFrame().getDuration();
      Duration horizon = Collections.max(
          ImmutableList.of(config.recomputeHorizon(), bar.multipliedBy(MIN_RECOMPUTE_PERIODS)));
      TimeRange range = TimeRange.create(asOf.minus(horizon), asOf);
      features.putAll(featureEngine.computeAll(group.getValue(), range, group.getKey()));
    }
    return features.buildKeepingLast();
  }

  private ImmutableList<IngestionPair> pairs(List<Instrument> instruments) {
    ImmutableList.Builder<IngestionPair> pairs = ImmutableList.builder();
    for (Instrument instrument : instruments) {
      boolean served = false;
      for (String source : config.sources()) {
        SourceAdapter adapter = adapters.get(source);
        if (adapter == null) {
          logger.atWarning().log("Ignoring unknown source %s", source);
          continue;
        }
        if (adapter.supports(instrument)) {
          pairs.add(IngestionPair.create(instrument, source));
          served = true;
        }
      }
      if (!served) {
        logger.atWarning().log("No configured source serves %s", instrument);
      }
    }
    return pairs.build();
  }

  private InstrumentReport processInstrument(
      Instrument instrument, Optional<FeatureBatchResult> features) {
    InstrumentReport.Builder report = InstrumentReport.builder(instrument);
    if (features.isEmpty()) {
      return report.setFeatureError("Raw data for " + instrument + " could not be read").build();
    }
    report.setFailedTimestamps(features.get().failedTimestamps());
    try {
      report.setFeaturesWritten(processedStore.write(features.get().records()));
    } catch (StorageException e) {
      logger.atWarning().withCause(e).log("Could not store features for %s", instrument);
      return report.setFeatureError("Could not store features: " + e.getMessage()).build();
    }

    Optional<FeatureRecord> latest = features.get().latest();
    if (latest.isEmpty()) {
      logger.atInfo().log("No computable features for %s yet", instrument);
      return report.build();
    }
    try {
      report.setSignal(signalGenerator.generate(latest.get()));
    } catch (SignalGenerationException e) {
      logger.atWarning().withCause(e).log("No signal for %s at %s", instrument, e.timestamp());
      report.setSignalError(e.getMessage());
    }
    return report.build();
  }
}
