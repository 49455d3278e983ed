package com.verlumen.marketpipe.rawstore;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multimaps;
import com.google.common.flogger.FluentLogger;
import com.google.common.hash.Hashing;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.marketdata.Observation;
import com.verlumen.marketpipe.marketdata.ObservationKey;
import com.verlumen.marketpipe.storage.BlobStore;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;
import com.verlumen.marketpipe.time.Timestamps;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link RawStore} over a {@link BlobStore}.
 *
 * <p>A batch is written as one segment per day bucket, {@code raw/<instrument>/<day>/<source>/<id>.json},
 * followed by a commit marker {@code raw-commits/<instrument>/<source>/<id>.json}. Segments without a
 * marker are ignored by readers, so a batch spanning several partitions becomes visible at once.
 * The batch id is a hash of the batch content; replaying an interrupted batch rewrites identical
 * segments and then commits them.
 */
final class RawStoreImpl implements RawStore {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String SEGMENT_ROOT = "raw/";
  private static final String COMMIT_ROOT = "raw-commits/";
  private static final String SUFFIX = ".json";
  private static final Comparator<Observation> STORAGE_ORDER =
      Comparator.comparing(Observation::timestamp)
          .thenComparing(Observation::source)
          .thenComparingInt(Observation::revision);

  private final BlobStore blobStore;

  @Inject
  RawStoreImpl(BlobStore blobStore) {
    this.blobStore = blobStore;
  }

  @Override
  public AppendResult append(Instrument instrument, String source, List<Observation> observations)
      throws StorageException {
    for (Observation observation : observations) {
      checkArgument(
          observation.instrument().equals(instrument) && observation.source().equals(source),
          "Observation %s does not belong to %s@%s", observation.key(), instrument, source);
    }
    if (observations.isEmpty()) {
      return AppendResult.allDuplicates(0);
    }

    TimeRange span =
        TimeRange.create(
            observations.stream().map(Observation::timestamp).min(Comparator.naturalOrder()).get(),
            observations.stream().map(Observation::timestamp).max(Comparator.naturalOrder()).get());
    Set<RevisionKey> present = new HashSet<>();
    for (Observation stored : committed(instrument, span, Optional.of(source))) {
      present.add(RevisionKey.of(stored));
    }

    ImmutableList<Observation> fresh =
        observations.stream()
            .filter(observation -> present.add(RevisionKey.of(observation)))
            .sorted(STORAGE_ORDER)
            .collect(toImmutableList());
    int duplicates = observations.size() - fresh.size();
    if (fresh.isEmpty()) {
      logger.atFine().log("All %d observations for %s@%s already stored", duplicates, instrument, source);
      return AppendResult.allDuplicates(duplicates);
    }

    String ingestionId = ingestionId(instrument, source, fresh);
    ImmutableListMultimap<String, Observation> byDay =
        Multimaps.index(
            fresh.stream().map(o -> o.withIngestionId(ingestionId)).collect(toImmutableList()),
            observation -> Timestamps.toDayBucket(observation.timestamp()));

    JsonArray segments = new JsonArray();
    for (Map.Entry<String, List<Observation>> day : Multimaps.asMap(byDay).entrySet()) {
      String key = segmentKey(instrument, day.getKey(), source, ingestionId);
      blobStore.put(key, ObservationCodec.encode(day.getValue()));
      segments.add(key);
    }
    JsonObject marker = new JsonObject();
    marker.addProperty("count", fresh.size());
    marker.add("segments", segments);
    blobStore.put(
        commitKey(instrument, source, ingestionId), marker.toString().getBytes(StandardCharsets.UTF_8));

    logger.atInfo().log(
        "Committed batch %s for %s@%s: %d appended, %d duplicates across %d partitions",
        ingestionId, instrument, source, fresh.size(), duplicates, segments.size());
    return AppendResult.create(fresh.size(), duplicates, Optional.of(ingestionId));
  }

  @Override
  public ImmutableList<Observation> read(Instrument instrument, TimeRange range, Optional<String> source)
      throws StorageException {
    Map<ObservationKey, Observation> effective = new LinkedHashMap<>();
    for (Observation observation : committed(instrument, range, source)) {
      effective.merge(
          observation.key(),
          observation,
          (current, candidate) -> candidate.revision() > current.revision() ? candidate : current);
    }
    return effective.values().stream().sorted(STORAGE_ORDER).collect(toImmutableList());
  }

  @Override
  public ImmutableSet<ObservationKey> existingKeys(Instrument instrument, String source, TimeRange range)
      throws StorageException {
    return committed(instrument, range, Optional.of(source)).stream()
        .map(Observation::key)
        .collect(toImmutableSet());
  }

  /** Every committed observation, all revisions, in storage order. */
  private ImmutableList<Observation> committed(
      Instrument instrument, TimeRange range, Optional<String> source) throws StorageException {
    ImmutableSet<String> committedBatches = committedBatches(instrument);
    String firstDay = Timestamps.toDayBucket(range.start());
    String lastDay = Timestamps.toDayBucket(range.end());

    ImmutableList.Builder<Observation> observations = ImmutableList.builder();
    String prefix = SEGMENT_ROOT + instrument.storageKey() + "/";
    for (String key : blobStore.list(prefix)) {
      // <day>/<source>/<id>.json
      List<String> parts = Splitter.on('/').splitToList(key.substring(prefix.length()));
      if (parts.size() != 3 || !parts.get(2).endsWith(SUFFIX)) {
        continue;
      }
      String day = parts.get(0);
      String segmentSource = parts.get(1);
      String batch = segmentSource + "/" + stripSuffix(parts.get(2));
      if (day.compareTo(firstDay) < 0
          || day.compareTo(lastDay) > 0
          || source.map(s -> !s.equals(segmentSource)).orElse(false)
          || !committedBatches.contains(batch)) {
        continue;
      }
      Optional<byte[]> bytes = blobStore.get(key);
      if (bytes.isEmpty()) {
        throw new StorageException("Committed segment disappeared: " + key);
      }
      ObservationCodec.decode(bytes.get()).stream()
          .filter(observation -> observation.instrument().equals(instrument))
          .filter(observation -> range.contains(observation.timestamp()))
          .forEach(observations::add);
    }
    return observations.build().stream().sorted(STORAGE_ORDER).collect(toImmutableList());
  }

  /** Committed batches of the instrument as {@code <source>/<id>}. */
  private ImmutableSet<String> committedBatches(Instrument instrument) throws StorageException {
    String prefix = COMMIT_ROOT + instrument.storageKey() + "/";
    return blobStore.list(prefix).stream()
        .filter(key -> key.endsWith(SUFFIX))
        .map(key -> stripSuffix(key.substring(prefix.length())))
        .collect(toImmutableSet());
  }

  private static String ingestionId(Instrument instrument, String source, List<Observation> fresh) {
    return Hashing.sha256()
        .newHasher()
        .putString(instrument.storageKey(), StandardCharsets.UTF_8)
        .putString(source, StandardCharsets.UTF_8)
        .putBytes(ObservationCodec.encode(fresh))
        .hash()
        .toString()
        .substring(0, 24);
  }

  private static String segmentKey(Instrument instrument, String day, String source, String ingestionId) {
    return SEGMENT_ROOT + instrument.storageKey() + "/" + day + "/" + source + "/" + ingestionId + SUFFIX;
  }

  private static String commitKey(Instrument instrument, String source, String ingestionId) {
    return COMMIT_ROOT + instrument.storageKey() + "/" + source + "/" + ingestionId + SUFFIX;
  }

  private static String stripSuffix(String name) {
    return name.substring(0, name.length() - SUFFIX.length());
  }

  /** Raw identity of a stored row: key plus revision. */
  private record RevisionKey(ObservationKey key, int revision) {
    static RevisionKey of(Observation observation) {
      return new RevisionKey(observation.key(), observation.revision());
    }
  }
}
