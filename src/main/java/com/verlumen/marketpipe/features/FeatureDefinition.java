package com.verlumen.marketpipe.features;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** One named feature: what to compute, over how many periods, and how gaps are treated. */
@AutoValue
public abstract class FeatureDefinition {
  public static FeatureDefinition create(
      String name, FeatureKind kind, int window, GapPolicy gapPolicy) {
    checkArgument(!name.isEmpty(), "Feature name must not be empty");
    checkArgument(window >= 1, "Window of %s must be positive: %s", name, window);
    checkArgument(
        gapPolicy == GapPolicy.GAP_SENSITIVE || kind.supportsGapTolerance(),
        "%s cannot be gap tolerant", kind);
    checkArgument(
        kind != FeatureKind.REALIZED_VOLATILITY || window >= 2,
        "Realized volatility needs at least two returns: %s", name);
    return new AutoValue_FeatureDefinition(name, kind, window, gapPolicy);
  }

  public static FeatureDefinition sensitive(String name, FeatureKind kind, int window) {
    return create(name, kind, window, GapPolicy.GAP_SENSITIVE);
  }

  public static FeatureDefinition tolerant(String name, FeatureKind kind, int window) {
    return create(name, kind, window, GapPolicy.GAP_TOLERANT);
  }

  public abstract String name();

  public abstract FeatureKind kind();

  /** Length in periods of the trailing window. */
  public abstract int window();

  public abstract GapPolicy gapPolicy();

  public int pointsNeeded() {
    return kind().pointsNeeded(window());
  }
}
