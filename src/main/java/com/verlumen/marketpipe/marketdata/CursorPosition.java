package com.verlumen.marketpipe.marketdata;

import com.google.auto.value.AutoValue;
import java.time.Instant;
import java.util.Optional;

/**
 * Where a source should resume: the timestamp of the last committed bar and, for page-token
 * providers, the token that continues after it.
 */
@AutoValue
public abstract class CursorPosition {
  private static final CursorPosition START = new AutoValue_CursorPosition(Optional.empty(), Optional.empty());

  /** Nothing ingested yet; adapters start from their configured backfill point. */
  public static CursorPosition start() {
    return START;
  }

  public static CursorPosition at(Instant lastTimestamp) {
    return new AutoValue_CursorPosition(Optional.of(lastTimestamp), Optional.empty());
  }

  public static CursorPosition at(Instant lastTimestamp, String pageToken) {
    return new AutoValue_CursorPosition(Optional.of(lastTimestamp), Optional.of(pageToken));
  }

  public static CursorPosition create(Optional<Instant> lastTimestamp, Optional<String> pageToken) {
    return new AutoValue_CursorPosition(lastTimestamp, pageToken);
  }

  public abstract Optional<Instant> lastTimestamp();

  public abstract Optional<String> pageToken();

  /** True if {@code other} is not behind this position. */
  public boolean isAtOrBefore(CursorPosition other) {
    if (lastTimestamp().isEmpty()) {
      return true;
    }
    return other.lastTimestamp().map(t -> !t.isBefore(lastTimestamp().get())).orElse(false);
  }
}
