package com.verlumen.marketpipe.features;

import static com.google.common.base.Preconditions.checkArgument;
import static com.verlumen.marketpipe.features.FeatureDefinition.sensitive;
import static com.verlumen.marketpipe.features.FeatureDefinition.tolerant;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.verlumen.marketpipe.time.TimeFrame;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Known feature sets by version. Versions are write-once. */
@Singleton
public final class FeatureSetRegistry {
  public static final String CORE_MINUTE = "core-1m-v1";
  public static final String CORE_DAILY = "core-1d-v1";

  private final ConcurrentMap<String, FeatureSet> featureSets = new ConcurrentHashMap<>();

  @Inject
  public FeatureSetRegistry() {
    register(core(CORE_MINUTE, TimeFrame.ONE_MIN));
    register(core(CORE_DAILY, TimeFrame.ONE_DAY));
  }

  /**
   * @throws IllegalArgumentException if a different feature set already uses the version
   */
  public void register(FeatureSet featureSet) {
    FeatureSet existing = featureSets.putIfAbsent(featureSet.version(), featureSet);
    checkArgument(
        existing == null || existing.equals(featureSet),
        "Feature set version %s is already registered with other definitions",
        featureSet.version());
  }

  public FeatureSet get(String version) {
    FeatureSet featureSet = featureSets.get(version);
    checkArgument(featureSet != null, "Unknown feature set version: %s", version);
    return featureSet;
  }

  public ImmutableSet<String> versions() {
    return ImmutableSet.copyOf(featureSets.keySet());
  }

  private static FeatureSet core(String version, TimeFrame timeFrame) {
    return FeatureSet.create(
        version,
        timeFrame,
        Optional.empty(),
        ImmutableList.of(
            sensitive("sma_5", FeatureKind.ROLLING_MEAN, 5),
            sensitive("sma_20", FeatureKind.ROLLING_MEAN, 20),
            sensitive("sma_50", FeatureKind.ROLLING_MEAN, 50),
            sensitive("stddev_20", FeatureKind.ROLLING_STDDEV, 20),
            sensitive("momentum_5", FeatureKind.MOMENTUM, 5),
            sensitive("momentum_20", FeatureKind.MOMENTUM, 20),
            sensitive("return_1", FeatureKind.SIMPLE_RETURN, 1),
            sensitive("log_return_1", FeatureKind.LOG_RETURN, 1),
            sensitive("volatility_20", FeatureKind.REALIZED_VOLATILITY, 20),
            tolerant("volume_sum_20", FeatureKind.VOLUME_SUM, 20),
            sensitive("high_20", FeatureKind.ROLLING_HIGH, 20),
            sensitive("low_20", FeatureKind.ROLLING_LOW, 20)));
  }
}
