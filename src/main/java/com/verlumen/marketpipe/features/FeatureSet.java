package com.verlumen.marketpipe.features;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.marketpipe.time.TimeFrame;
import java.util.Optional;

/**
 * A versioned, immutable group of feature definitions. Changing any definition requires a new
 * version so that materialized records stay reproducible.
 */
@AutoValue
public abstract class FeatureSet {
  public static FeatureSet create(
      String version,
      TimeFrame timeFrame,
      Optional<String> source,
      ImmutableList<FeatureDefinition> definitions) {
    checkArgument(!version.isEmpty(), "Feature set version must not be empty");
    checkArgument(!definitions.isEmpty(), "Feature set %s has no definitions", version);
    checkArgument(
        definitions.stream().map(FeatureDefinition::name).distinct().count() == definitions.size(),
        "Feature set %s has duplicate feature names", version);
    return new AutoValue_FeatureSet(version, timeFrame, source, definitions);
  }

  public abstract String version();

  public abstract TimeFrame timeFrame();

  /** Source to read observations from; when empty all sources are merged. */
  public abstract Optional<String> source();

  public abstract ImmutableList<FeatureDefinition> definitions();

  /**
   * Expected periods of history kept behind each timestamp. Gap-tolerant windows look for their
   * anchoring observation up to twice their length back.
   */
  public int horizonPeriods() {
    return 2 * definitions().stream().mapToInt(FeatureDefinition::pointsNeeded).max().getAsInt();
  }
}
