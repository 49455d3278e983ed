package com.verlumen.marketpipe.ingestion;

import com.google.auto.value.AutoValue;
import com.verlumen.marketpipe.marketdata.CursorPosition;

/**
 * Watermark of one {@link IngestionPair}. Every advance bumps {@link #version()}, which is what
 * compare-and-set updates are checked against.
 */
@AutoValue
public abstract class IngestionCursor {
  public static IngestionCursor initial(IngestionPair pair) {
    return create(pair, CursorPosition.start(), 0L);
  }

  public static IngestionCursor create(IngestionPair pair, CursorPosition position, long version) {
    return new AutoValue_IngestionCursor(pair, position, version);
  }

  public abstract IngestionPair pair();

  public abstract CursorPosition position();

  public abstract long version();

  public IngestionCursor advanceTo(CursorPosition next) {
    return create(pair(), next, version() + 1);
  }
}
