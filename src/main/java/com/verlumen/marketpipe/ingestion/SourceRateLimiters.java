package com.verlumen.marketpipe.ingestion;

import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.RateLimiter;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.verlumen.marketpipe.marketdata.SourceAdapter;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** One token bucket per source, shared by every instrument pulled from it. */
@Singleton
final class SourceRateLimiters {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ConcurrentMap<String, RateLimiter> limiters = new ConcurrentHashMap<>();
  private final IngestionConfig config;

  @Inject
  SourceRateLimiters(IngestionConfig config) {
    this.config = config;
  }

  /**
   * Waits for a permit for at most {@code timeout}.
   *
   * @return false if no permit became available in time
   */
  boolean tryAcquire(SourceAdapter adapter, Duration timeout) {
    return limiterFor(adapter).tryAcquire(timeout);
  }

  private RateLimiter limiterFor(SourceAdapter adapter) {
    return limiters.computeIfAbsent(
        adapter.sourceName(),
        source -> {
          double permitsPerSecond =
              config
                  .rateLimitOverrides()
                  .getOrDefault(source, adapter.capabilities().rateLimitPermitsPerSecond());
          logger.atInfo().log("Rate limiting %s to %.3f requests/s", source, permitsPerSecond);
          return RateLimiter.create(permitsPerSecond);
        });
  }
}
