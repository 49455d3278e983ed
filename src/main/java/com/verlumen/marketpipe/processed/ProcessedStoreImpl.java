package com.verlumen.marketpipe.processed;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableSortedSet.toImmutableSortedSet;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Multimaps;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Striped;
import com.google.inject.Inject;
import com.verlumen.marketpipe.features.FeatureRecord;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.storage.BlobStore;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;
import com.verlumen.marketpipe.time.Timestamps;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;

/**
 * {@link ProcessedStore} with one blob per day: {@code processed/<version>/<instrument>/<day>.json}.
 * A partition is rewritten only when merging changes its bytes.
 */
final class ProcessedStoreImpl implements ProcessedStore {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String ROOT = "processed/";
  private static final String SUFFIX = ".json";

  private final BlobStore blobStore;
  private final Striped<Lock> partitionLocks = Striped.lock(64);

  @Inject
  ProcessedStoreImpl(BlobStore blobStore) {
    this.blobStore = blobStore;
  }

  @Override
  public int write(List<FeatureRecord> records) throws StorageException {
    ImmutableListMultimap<String, FeatureRecord> byPartition =
        Multimaps.index(
            records,
            record ->
                partitionKey(
                    record.featureSetVersion(),
                    record.instrument(),
                    Timestamps.toDayBucket(record.timestamp())));
    int changed = 0;
    for (Map.Entry<String, Collection<FeatureRecord>> partition : byPartition.asMap().entrySet()) {
      changed += upsert(partition.getKey(), partition.getValue());
    }
    logger.atFine().log(
        "Upserted %d feature records into %d partitions, %d changed",
        records.size(), byPartition.keySet().size(), changed);
    return changed;
  }

  private int upsert(String key, Collection<FeatureRecord> incoming) throws StorageException {
    FeatureRecord sample = incoming.iterator().next();
    Lock lock = partitionLocks.get(key);
    lock.lock();
    try {
      Optional<byte[]> stored = blobStore.get(key);
      TreeMap<Instant, FeatureRecord> merged = new TreeMap<>();
      if (stored.isPresent()) {
        for (FeatureRecord record :
            FeatureRecordCodec.decode(sample.instrument(), sample.featureSetVersion(), stored.get())) {
          merged.put(record.timestamp(), record);
        }
      }
      int changed = 0;
      for (FeatureRecord record : incoming) {
        if (!record.equals(merged.put(record.timestamp(), record))) {
          changed++;
        }
      }
      byte[] encoded = FeatureRecordCodec.encode(merged.values());
      if (stored.isEmpty() || !Arrays.equals(stored.get(), encoded)) {
        blobStore.put(key, encoded);
      }
      return changed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public ImmutableList<FeatureRecord> read(
      Instrument instrument, TimeRange range, String featureSetVersion) throws StorageException {
    String prefix = ROOT + featureSetVersion + "/" + instrument.storageKey() + "/";
    String firstDay = Timestamps.toDayBucket(range.start());
    String lastDay = Timestamps.toDayBucket(range.end());
    ImmutableList.Builder<FeatureRecord> records = ImmutableList.builder();
    for (String key : blobStore.list(prefix)) {
      String name = key.substring(prefix.length());
      if (!name.endsWith(SUFFIX) || name.contains("/")) {
        continue;
      }
      String day = name.substring(0, name.length() - SUFFIX.length());
      if (day.compareTo(firstDay) < 0 || day.compareTo(lastDay) > 0) {
        continue;
      }
      Optional<byte[]> bytes = blobStore.get(key);
      if (bytes.isEmpty()) {
        throw new StorageException("Partition disappeared while reading: " + key);
      }
      FeatureRecordCodec.decode(instrument, featureSetVersion, bytes.get()).stream()
          .filter(record -> range.contains(record.timestamp()))
          .forEach(records::add);
    }
    return records.build().stream()
        .sorted(Comparator.comparing(FeatureRecord::timestamp))
        .collect(toImmutableList());
  }

  @Override
  public ImmutableSortedSet<String> versions(Instrument instrument) throws StorageException {
    // processed/<version>/<instrument>/<day>.json, where <instrument> spans several segments
    String partitionPrefix = instrument.storageKey() + "/";
    return blobStore.list(ROOT).stream()
        .map(key -> Splitter.on('/').limit(2).splitToList(key.substring(ROOT.length())))
        .filter(parts -> parts.size() == 2 && parts.get(1).startsWith(partitionPrefix))
        .filter(parts -> isPartitionName(parts.get(1).substring(partitionPrefix.length())))
        .map(parts -> parts.get(0))
        .collect(toImmutableSortedSet(Comparator.naturalOrder()));
  }

  private static boolean isPartitionName(String name) {
    return name.endsWith(SUFFIX) && !name.contains("/");
  }

  private static String partitionKey(String version, Instrument instrument, String day) {
    return ROOT + version + "/" + instrument.storageKey() + "/" + day + SUFFIX;
  }
}
