package com.verlumen.marketpipe.pipeline;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.marketpipe.instruments.AssetClass;
import com.verlumen.marketpipe.instruments.Instrument;
import java.time.Duration;

/**
 * @param sources source adapters to pull from; every listed source that serves an instrument is
 *     ingested. When two sources report the same timestamp, features use the lexicographically
 *     first source name unless the feature set pins one.
 * @param featureSetVersions feature set materialized for each asset class, matching the bar
 *     interval its sources serve
 * @param recomputeHorizon how far before the as-of instant features are recomputed each cycle
 */
record PipelineConfig(
    ImmutableList<String> sources,
    ImmutableMap<AssetClass, String> featureSetVersions,
    Duration recomputeHorizon) {

  String featureSetVersion(Instrument instrument) {
    String version = featureSetVersions.get(instrument.assetClass());
    checkArgument(version != null, "No feature set configured for %s", instrument.assetClass());
    return version;
  }
}
