package com.verlumen.marketpipe.signals;

import com.google.common.collect.ImmutableList;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;

/** Append-only audit trail of signals. Entries are never replaced. */
public interface SignalLog {
  /** @return false if an entry with the same key already existed */
  boolean append(Signal signal) throws StorageException;

  ImmutableList<Signal> read(Instrument instrument, TimeRange range) throws StorageException;
}
