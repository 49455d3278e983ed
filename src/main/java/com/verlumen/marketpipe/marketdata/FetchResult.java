package com.verlumen.marketpipe.marketdata;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** One page of observations and the position that continues after it. */
@AutoValue
public abstract class FetchResult {
  public static FetchResult create(
      ImmutableList<Observation> observations, CursorPosition nextPosition, boolean hasMore) {
    return new AutoValue_FetchResult(observations, nextPosition, hasMore);
  }

  public static FetchResult empty(CursorPosition position) {
    return create(ImmutableList.of(), position, false);
  }

  /** Observations in ascending timestamp order. */
  public abstract ImmutableList<Observation> observations();

  public abstract CursorPosition nextPosition();

  /** True if the source reported further pages before the requested upper bound. */
  public abstract boolean hasMore();
}
