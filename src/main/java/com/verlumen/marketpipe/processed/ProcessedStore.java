package com.verlumen.marketpipe.processed;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.verlumen.marketpipe.features.FeatureRecord;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;
import java.util.List;

/**
 * Materialized feature records keyed by (instrument, timestamp, feature set version). Versions
 * are kept side by side.
 */
public interface ProcessedStore {
  /**
   * Upserts {@code records}. Writing records equal to the stored ones changes nothing.
   *
   * @return the number of records that were new or different
   */
  int write(List<FeatureRecord> records) throws StorageException;

  /** Records in {@code range}, ascending by timestamp. */
  ImmutableList<FeatureRecord> read(Instrument instrument, TimeRange range, String featureSetVersion)
      throws StorageException;

  /** Feature set versions materialized for {@code instrument}. */
  ImmutableSortedSet<String> versions(Instrument instrument) throws StorageException;
}
