package com.verlumen.marketpipe.time;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Instant;

/** A closed interval of instants, {@code [start, end]}. */
@AutoValue
public abstract class TimeRange {
  public static TimeRange create(Instant start, Instant end) {
    checkArgument(!end.isBefore(start), "Range end %s precedes start %s", end, start);
    return new AutoValue_TimeRange(start, end);
  }

  /** Everything from the epoch up to and including {@code end}. */
  public static TimeRange upTo(Instant end) {
    return create(Instant.EPOCH, end);
  }

  public static TimeRange at(Instant instant) {
    return create(instant, instant);
  }

  public abstract Instant start();

  public abstract Instant end();

  public boolean contains(Instant instant) {
    return !instant.isBefore(start()) && !instant.isAfter(end());
  }

  public TimeRange withStart(Instant newStart) {
    return create(newStart, end());
  }
}
