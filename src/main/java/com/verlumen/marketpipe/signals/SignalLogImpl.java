package com.verlumen.marketpipe.signals;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.storage.BlobStore;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;
import com.verlumen.marketpipe.time.Timestamps;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;

/**
 * Stores each signal once at
 * {@code signals/<instrument>/<day>/<epochMillis>-<modelVersion>-<featureSetVersion>.json}.
 */
final class SignalLogImpl implements SignalLog {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String ROOT = "signals/";
  private static final CharMatcher KEY_SAFE =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("._"));

  private final BlobStore blobStore;

  @Inject
  SignalLogImpl(BlobStore blobStore) {
    this.blobStore = blobStore;
  }

  @Override
  public boolean append(Signal signal) throws StorageException {
    String key = key(signal);
    byte[] encoded = SignalCodec.encode(signal);
    if (blobStore.putIfAbsent(key, encoded)) {
      logger.atInfo().log(
          "Recorded %s signal for %s at %s (model %s)",
          signal.decision(), signal.instrument(), signal.timestamp(), signal.modelVersion());
      return true;
    }
    Optional<byte[]> existing = blobStore.get(key);
    if (existing.isPresent() && !Arrays.equals(existing.get(), encoded)) {
      logger.atWarning().log("Keeping the signal already logged at %s; new one differs: %s", key, signal);
    }
    return false;
  }

  @Override
  public ImmutableList<Signal> read(Instrument instrument, TimeRange range) throws StorageException {
    String prefix = ROOT + instrument.storageKey() + "/";
    String firstDay = Timestamps.toDayBucket(range.start());
    String lastDay = Timestamps.toDayBucket(range.end());
    ImmutableList.Builder<Signal> signals = ImmutableList.builder();
    for (String key : blobStore.list(prefix)) {
      String day = key.substring(prefix.length()).split("/", 2)[0];
      if (day.compareTo(firstDay) < 0 || day.compareTo(lastDay) > 0) {
        continue;
      }
      Optional<byte[]> bytes = blobStore.get(key);
      if (bytes.isPresent()) {
        Signal signal = SignalCodec.decode(instrument, bytes.get());
        if (range.contains(signal.timestamp())) {
          signals.add(signal);
        }
      }
    }
    return signals.build().stream()
        .sorted(Comparator.comparing(Signal::timestamp))
        .collect(toImmutableList());
  }

  private static String key(Signal signal) {
    return ROOT
        + signal.instrument().storageKey()
        + "/"
        + Timestamps.toDayBucket(signal.timestamp())
        + "/"
        + signal.timestamp().toEpochMilli()
        + "-"
        + KEY_SAFE.negate().replaceFrom(signal.modelVersion(), '_')
        + "-"
        + KEY_SAFE.negate().replaceFrom(signal.featureSetVersion(), '_')
        + ".json";
  }
}
