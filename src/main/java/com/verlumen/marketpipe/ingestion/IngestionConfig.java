package com.verlumen.marketpipe.ingestion;

import com.google.common.collect.ImmutableMap;
import java.time.Duration;

/**
 * Tuning for ingestion cycles.
 *
 * @param rateLimitOverrides permits per second by source name, replacing the adapter's hint
 */
public record IngestionConfig(
    RetryPolicy retryPolicy,
    Duration cycleTimeout,
    Duration lockTimeout,
    int maxPagesPerCycle,
    int parallelism,
    ImmutableMap<String, Double> rateLimitOverrides) {
  public static IngestionConfig defaults() {
    return new IngestionConfig(
        RetryPolicy.create(5, Duration.ofMillis(500), Duration.ofSeconds(30), 0.2),
        Duration.ofMinutes(2),
        Duration.ofSeconds(5),
        50,
        4,
        ImmutableMap.of());
  }

  public IngestionConfig withRetryPolicy(RetryPolicy policy) {
    return new IngestionConfig(
        policy, cycleTimeout, lockTimeout, maxPagesPerCycle, parallelism, rateLimitOverrides);
  }

  public IngestionConfig withCycleTimeout(Duration timeout) {
    return new IngestionConfig(
        retryPolicy, timeout, lockTimeout, maxPagesPerCycle, parallelism, rateLimitOverrides);
  }

  public IngestionConfig withRateLimitOverrides(ImmutableMap<String, Double> overrides) {
    return new IngestionConfig(
        retryPolicy, cycleTimeout, lockTimeout, maxPagesPerCycle, parallelism, overrides);
  }
}
