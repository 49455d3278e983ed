package com.verlumen.marketpipe.marketdata;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class SourceCapabilities {
  public static SourceCapabilities create(
      PaginationScheme paginationScheme,
      double rateLimitPermitsPerSecond,
      boolean supportsBackfill,
      int maxPageSize) {
    checkArgument(rateLimitPermitsPerSecond > 0, "Rate limit must be positive");
    checkArgument(maxPageSize > 0, "Page size must be positive");
    return new AutoValue_SourceCapabilities(
        paginationScheme, rateLimitPermitsPerSecond, supportsBackfill, maxPageSize);
  }

  public abstract PaginationScheme paginationScheme();

  /** Requests per second the provider tolerates across all instruments. */
  public abstract double rateLimitPermitsPerSecond();

  public abstract boolean supportsBackfill();

  public abstract int maxPageSize();
}
