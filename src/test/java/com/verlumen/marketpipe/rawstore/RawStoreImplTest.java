package com.verlumen.marketpipe.rawstore;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.marketdata.Observation;
import com.verlumen.marketpipe.storage.BlobStore;
import com.verlumen.marketpipe.storage.InMemoryBlobStore;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RawStoreImplTest {
  private static final Instant T0 = Instant.parse("2024-01-01T23:50:00Z");
  private static final Instrument BTC_USDT = Instrument.crypto("BTC/USDT", "binance");
  private static final Instrument BTC_USDT_KRAKEN = Instrument.crypto("BTC/USDT", "kraken");
  private static final TimeRange EVERYTHING = TimeRange.upTo(Instant.parse("2030-01-01T00:00:00Z"));

  private final InMemoryBlobStore blobStore = new InMemoryBlobStore();
  private final RawStoreImpl rawStore = new RawStoreImpl(blobStore);

  @Test
  public void append_thenRead_returnsObservationsWithIngestionId() throws Exception {
    // Act
    AppendResult result = rawStore.append(BTC_USDT, "binance", bars(0, 5));
    ImmutableList<Observation> stored = rawStore.read(BTC_USDT, EVERYTHING, Optional.empty());

    // Assert
    assertThat(result.appended()).isEqualTo(5);
    assertThat(result.duplicates()).isEqualTo(0);
    assertThat(stored).hasSize(5);
    assertThat(stored.get(0).ingestionId()).isEqualTo(result.ingestionId());
  }

  @Test
  public void append_sameBatchTwice_secondIsAllDuplicates() throws Exception {
    // Arrange
    rawStore.append(BTC_USDT, "binance", bars(0, 5));

    // Act
    AppendResult result = rawStore.append(BTC_USDT, "binance", bars(0, 5));

    // Assert
    assertThat(result).isEqualTo(AppendResult.allDuplicates(5));
    assertThat(rawStore.read(BTC_USDT, EVERYTHING, Optional.empty())).hasSize(5);
  }

  @Test
  public void append_overlappingBatches_storeEachKeyOnce() throws Exception {
    // Arrange
    rawStore.append(BTC_USDT, "binance", bars(0, 11));

    // Act
    AppendResult result = rawStore.append(BTC_USDT, "binance", bars(5, 11));

    // Assert
    assertThat(result.appended()).isEqualTo(5);
    assertThat(result.duplicates()).isEqualTo(6);
    assertThat(rawStore.read(BTC_USDT, EVERYTHING, Optional.empty())).hasSize(16);
  }

  @Test
  public void read_correction_supersedesOriginal() throws Exception {
    // Arrange
    rawStore.append(BTC_USDT, "binance", bars(0, 3));
    Observation corrected = bar(1).toBuilder().setClose(999.0).setRevision(1).build();

    // Act
    rawStore.append(BTC_USDT, "binance", ImmutableList.of(corrected));
    ImmutableList<Observation> stored = rawStore.read(BTC_USDT, EVERYTHING, Optional.empty());

    // Assert
    assertThat(stored).hasSize(3);
    assertThat(stored.get(1).close()).isEqualTo(999.0);
    assertThat(stored.get(1).revision()).isEqualTo(1);
  }

  @Test
  public void read_subRangeAcrossDayBoundary_isClosedAndOrdered() throws Exception {
    // Arrange
    rawStore.append(BTC_USDT, "binance", bars(0, 20));
    TimeRange range = TimeRange.create(T0.plus(Duration.ofMinutes(8)), T0.plus(Duration.ofMinutes(12)));

    // Act
    ImmutableList<Observation> stored = rawStore.read(BTC_USDT, range, Optional.of("binance"));

    // Assert
    assertThat(stored).hasSize(5);
    assertThat(stored.get(0).timestamp()).isEqualTo(range.start());
    assertThat(stored.get(4).timestamp()).isEqualTo(range.end());
  }

  @Test
  public void read_otherSource_isFilteredOut() throws Exception {
    // Arrange
    rawStore.append(BTC_USDT, "binance", bars(0, 3));

    // Act & Assert
    assertThat(rawStore.read(BTC_USDT, EVERYTHING, Optional.of("dryrun"))).isEmpty();
    assertThat(rawStore.existingKeys(BTC_USDT, "binance", EVERYTHING)).hasSize(3);
  }

  @Test
  public void append_crashBeforeCommit_isInvisibleAndReplaySucceeds() throws Exception {
    // Arrange
    RawStoreImpl crashing = new RawStoreImpl(new FailingCommitBlobStore(blobStore));
    assertThrows(StorageException.class, () -> crashing.append(BTC_USDT, "binance", bars(0, 20)));

    // Act
    ImmutableList<Observation> beforeReplay = rawStore.read(BTC_USDT, EVERYTHING, Optional.empty());
    AppendResult replay = rawStore.append(BTC_USDT, "binance", bars(0, 20));

    // Assert
    assertThat(beforeReplay).isEmpty();
    assertThat(replay.appended()).isEqualTo(20);
    assertThat(rawStore.read(BTC_USDT, EVERYTHING, Optional.empty())).hasSize(20);
  }

  @Test
  public void append_batchAcrossDayBoundary_writesDaySegmentsAndOneCommitMarker() throws Exception {
    // Act
    AppendResult result = rawStore.append(BTC_USDT, "binance", bars(0, 20));

    // Assert
    String id = result.ingestionId().get();
    assertThat(blobStore.snapshot().keySet())
        .containsExactly(
            "raw/crypto/binance/BTC-USDT/2024-01-01/binance/" + id + ".json",
            "raw/crypto/binance/BTC-USDT/2024-01-02/binance/" + id + ".json",
            "raw-commits/crypto/binance/BTC-USDT/binance/" + id + ".json");
  }

  @Test
  public void append_foreignInstrument_throwsIllegalArgumentException() {
    // Arrange
    Observation foreign = bar(0).toBuilder().setInstrument(Instrument.crypto("ETH/USDT", "binance")).build();

    // Act & Assert
    assertThrows(
        IllegalArgumentException.class,
        () -> rawStore.append(BTC_USDT, "binance", ImmutableList.of(foreign)));
  }

  @Test
  public void read_sameSymbolOnAnotherVenue_isIsolated() throws Exception {
    // Arrange
    rawStore.append(BTC_USDT, "binance", bars(0, 5));

    // Act
    ImmutableList<Observation> kraken = rawStore.read(BTC_USDT_KRAKEN, EVERYTHING, Optional.empty());
    AppendResult krakenAppend = rawStore.append(BTC_USDT_KRAKEN, "binance", onVenue(BTC_USDT_KRAKEN, bars(0, 3)));

    // Assert
    assertThat(kraken).isEmpty();
    assertThat(rawStore.existingKeys(BTC_USDT_KRAKEN, "binance", EVERYTHING)).hasSize(3);
    assertThat(krakenAppend.appended()).isEqualTo(3);
    assertThat(rawStore.read(BTC_USDT, EVERYTHING, Optional.empty())).hasSize(5);
    for (Observation observation : rawStore.read(BTC_USDT_KRAKEN, EVERYTHING, Optional.empty())) {
      assertThat(observation.instrument()).isEqualTo(BTC_USDT_KRAKEN);
    }
  }

  @Test
  public void read_committedSegmentOfOtherInstrumentUnderItsPrefix_isFiltered() throws Exception {
    // Arrange
    rawStore.append(BTC_USDT_KRAKEN, "binance", onVenue(BTC_USDT_KRAKEN, bars(0, 3)));
    for (Map.Entry<String, byte[]> blob : blobStore.snapshot().entrySet()) {
      blobStore.put(
          blob.getKey().replace(BTC_USDT_KRAKEN.storageKey(), BTC_USDT.storageKey()), blob.getValue());
    }

    // Act
    ImmutableList<Observation> stored = rawStore.read(BTC_USDT, EVERYTHING, Optional.empty());

    // Assert
    assertThat(stored).isEmpty();
  }

  private static ImmutableList<Observation> onVenue(Instrument instrument, ImmutableList<Observation> bars) {
    return bars.stream()
        .map(bar -> bar.toBuilder().setInstrument(instrument).build())
        .collect(ImmutableList.toImmutableList());
  }

  private static ImmutableList<Observation> bars(int from, int count) {
    return IntStream.range(from, from + count).mapToObj(RawStoreImplTest::bar).collect(ImmutableList.toImmutableList());
  }

  private static Observation bar(int minute) {
    double close = 100.0 + minute;
    return Observation.builder()
        .setInstrument(BTC_USDT)
        .setTimestamp(T0.plus(Duration.ofMinutes(minute)))
        .setOpen(close - 0.5)
        .setHigh(close + 1)
        .setLow(close - 1)
        .setClose(close)
        .setVolume(10.0)
        .setSource("binance")
        .build();
  }

  /** Writes segments through to the delegate but refuses commit markers. */
  private static final class FailingCommitBlobStore implements BlobStore {
    private final BlobStore delegate;

    FailingCommitBlobStore(BlobStore delegate) {
      this.delegate = delegate;
    }

    @Override
    public boolean putIfAbsent(String key, byte[] data) throws StorageException {
      return delegate.putIfAbsent(key, data);
    }

    @Override
    public void put(String key, byte[] data) throws StorageException {
      if (key.startsWith("raw-commits/")) {
        throw new StorageException("disk full");
      }
      delegate.put(key, data);
    }

    @Override
    public Optional<byte[]> get(String key) throws StorageException {
      return delegate.get(key);
    }

    @Override
    public ImmutableList<String> list(String prefix) throws StorageException {
      return delegate.list(prefix);
    }
  }
}
