package com.verlumen.marketpipe.ingestion;

import com.google.auto.value.AutoValue;
import com.verlumen.marketpipe.instruments.Instrument;

/** The unit of ingestion work: one instrument pulled from one source. */
@AutoValue
public abstract class IngestionPair {
  public static IngestionPair create(Instrument instrument, String source) {
    return new AutoValue_IngestionPair(instrument, source);
  }

  public abstract Instrument instrument();

  public abstract String source();

  @Override
  public final String toString() {
    return instrument().symbol() + "@" + source();
  }
}
