package com.verlumen.marketpipe.rawstore;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.marketdata.Observation;
import com.verlumen.marketpipe.marketdata.ObservationKey;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of observations exactly as received, partitioned by instrument and day.
 *
 * <p>Nothing is ever overwritten or deleted. Appending an observation whose key and revision are
 * already stored is a no-op.
 */
public interface RawStore {
  /**
   * Durably appends a batch for one (instrument, source) pair as a single atomic unit.
   *
   * @throws IllegalArgumentException if an observation belongs to another instrument or source
   */
  AppendResult append(Instrument instrument, String source, List<Observation> observations)
      throws StorageException;

  /**
   * Effective observations in {@code range}, ordered by timestamp then source. Where corrections
   * exist only the highest revision of a key is returned.
   */
  ImmutableList<Observation> read(Instrument instrument, TimeRange range, Optional<String> source)
      throws StorageException;

  /** Keys already committed for the pair inside {@code range}. */
  ImmutableSet<ObservationKey> existingKeys(Instrument instrument, String source, TimeRange range)
      throws StorageException;
}
