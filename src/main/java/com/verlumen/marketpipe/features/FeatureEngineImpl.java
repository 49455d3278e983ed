package com.verlumen.marketpipe.features;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.marketdata.Observation;
import com.verlumen.marketpipe.rawstore.RawStore;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;
import com.verlumen.marketpipe.time.TradingCalendar;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

final class FeatureEngineImpl implements FeatureEngine {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final RawStore rawStore;
  private final FeatureSetRegistry registry;

  @Inject
  FeatureEngineImpl(RawStore rawStore, FeatureSetRegistry registry) {
    this.rawStore = rawStore;
    this.registry = registry;
  }

  @Override
  public FeatureBatchResult compute(Instrument instrument, TimeRange range, String featureSetVersion)
      throws StorageException {
    FeatureSet featureSet = registry.get(featureSetVersion);
    TradingCalendar calendar = instrument.assetClass().calendar();
    int horizon = featureSet.horizonPeriods();

    // Read enough history that the first timestamp in range sees the same window as it would in a
    // longer computation. Nothing after range.end() is read.
    Instant lookbackStart = calendar.stepBack(range.start(), featureSet.timeFrame(), horizon);
    ImmutableList<Observation> observations =
        onePerTimestamp(
            rawStore.read(instrument, range.withStart(lookbackStart), featureSet.source()));

    RollingWindow window = new RollingWindow(calendar, featureSet.timeFrame(), horizon);
    FeatureCalculator calculator = new FeatureCalculator(featureSet);
    ImmutableList.Builder<FeatureRecord> records = ImmutableList.builder();
    ImmutableList.Builder<FeatureFailure> failures = ImmutableList.builder();
    for (Observation observation : observations) {
      window.push(observation);
      if (!range.contains(observation.timestamp())) {
        continue;
      }
      try {
        ImmutableSortedMap<String, Double> values = calculator.compute(window);
        if (!values.isEmpty()) {
          records.add(
              FeatureRecord.create(instrument, observation.timestamp(), featureSetVersion, values));
        }
      } catch (FeatureComputationException e) {
        logger.atFine().log("Skipping %s at %s: %s", instrument, e.timestamp(), e.getMessage());
        failures.add(FeatureFailure.of(e));
      }
    }

    FeatureBatchResult result =
        FeatureBatchResult.create(instrument, featureSetVersion, records.build(), failures.build());
    logger.atInfo().log(
        "Computed %d %s records for %s over %s..%s (%d failed)",
        result.records().size(),
        featureSetVersion,
        instrument,
        range.start(),
        range.end(),
        result.failures().size());
    return result;
  }

  @Override
  public ImmutableMap<Instrument, FeatureBatchResult> computeAll(
      List<Instrument> instruments, TimeRange range, String featureSetVersion) {
    if (instruments.isEmpty()) {
      return ImmutableMap.of();
    }
    ExecutorService executor =
        Executors.newFixedThreadPool(
            Math.min(instruments.size(), Runtime.getRuntime().availableProcessors()),
            new ThreadFactoryBuilder().setNameFormat("features-%d").setDaemon(true).build());
    try {
      List<Future<FeatureBatchResult>> futures = new ArrayList<>();
      for (Instrument instrument : instruments) {
        futures.add(executor.submit(() -> compute(instrument, range, featureSetVersion)));
      }
      ImmutableMap.Builder<Instrument, FeatureBatchResult> results = ImmutableMap.builder();
      for (int i = 0; i < instruments.size(); i++) {
        try {
          results.put(instruments.get(i), futures.get(i).get());
        } catch (ExecutionException e) {
          logger.atSevere().withCause(e.getCause()).log(
              "Feature computation for %s failed", instruments.get(i));
        }
      }
      return results.buildOrThrow();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while computing features", e);
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Collapses observations sharing a timestamp. The raw store returns them ordered by timestamp
   * then source, so the first of each run is the lexicographically first source.
   */
  private static ImmutableList<Observation> onePerTimestamp(List<Observation> observations) {
    List<Observation> collapsed = new ArrayList<>();
    for (Observation observation : observations) {
      if (collapsed.isEmpty()
          || !collapsed.get(collapsed.size() - 1).timestamp().equals(observation.timestamp())) {
        collapsed.add(observation);
      }
    }
    return ImmutableList.copyOf(collapsed);
  }
}
