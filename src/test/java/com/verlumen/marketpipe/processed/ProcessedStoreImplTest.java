package com.verlumen.marketpipe.processed;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.verlumen.marketpipe.features.FeatureRecord;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.storage.InMemoryBlobStore;
import com.verlumen.marketpipe.time.TimeRange;
import java.time.Instant;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ProcessedStoreImplTest {
  private static final Instrument BTC_USDT = Instrument.crypto("BTC/USDT", "binance");
  private static final Instant LATE_MONDAY = Instant.parse("2024-01-01T23:59:00Z");
  private static final Instant EARLY_TUESDAY = Instant.parse("2024-01-02T00:00:00Z");
  private static final Instant LATER_TUESDAY = Instant.parse("2024-01-02T00:01:00Z");

  private final InMemoryBlobStore blobStore = new InMemoryBlobStore();
  private final ProcessedStoreImpl store = new ProcessedStoreImpl(blobStore);

  @Test
  public void write_thenRead_returnsRecordsInTimestampOrder() throws Exception {
    // Arrange
    ImmutableList<FeatureRecord> records =
        ImmutableList.of(
            record(LATER_TUESDAY, "core-1m-v1", 3.0),
            record(LATE_MONDAY, "core-1m-v1", 1.0),
            record(EARLY_TUESDAY, "core-1m-v1", 2.0));

    // Act
    int written = store.write(records);
    ImmutableList<FeatureRecord> read =
        store.read(BTC_USDT, TimeRange.create(LATE_MONDAY, LATER_TUESDAY), "core-1m-v1");

    // Assert
    assertThat(written).isEqualTo(3);
    assertThat(read)
        .containsExactly(records.get(1), records.get(2), records.get(0))
        .inOrder();
  }

  @Test
  public void write_sameRecordsAgain_changesNothing() throws Exception {
    // Arrange
    ImmutableList<FeatureRecord> records =
        ImmutableList.of(record(LATE_MONDAY, "core-1m-v1", 1.0), record(EARLY_TUESDAY, "core-1m-v1", 2.0));
    store.write(records);
    ImmutableSortedMap<String, byte[]> before = blobStore.snapshot();

    // Act
    int written = store.write(records);

    // Assert
    assertThat(written).isEqualTo(0);
    ImmutableSortedMap<String, byte[]> after = blobStore.snapshot();
    assertThat(after.keySet()).isEqualTo(before.keySet());
    for (String key : before.keySet()) {
      assertThat(after.get(key)).isEqualTo(before.get(key));
    }
  }

  @Test
  public void write_changedValue_replacesRecordAtTimestamp() throws Exception {
    // Arrange
    store.write(ImmutableList.of(record(LATE_MONDAY, "core-1m-v1", 1.0)));

    // Act
    int written = store.write(ImmutableList.of(record(LATE_MONDAY, "core-1m-v1", 1.5)));

    // Assert
    assertThat(written).isEqualTo(1);
    assertThat(store.read(BTC_USDT, TimeRange.at(LATE_MONDAY), "core-1m-v1"))
        .containsExactly(record(LATE_MONDAY, "core-1m-v1", 1.5));
  }

  @Test
  public void read_isScopedToVersion() throws Exception {
    // Arrange
    store.write(
        ImmutableList.of(record(LATE_MONDAY, "core-1m-v1", 1.0), record(LATE_MONDAY, "core-1m-v2", 9.0)));

    // Act & Assert
    assertThat(store.read(BTC_USDT, TimeRange.at(LATE_MONDAY), "core-1m-v2"))
        .containsExactly(record(LATE_MONDAY, "core-1m-v2", 9.0));
    assertThat(store.versions(BTC_USDT)).containsExactly("core-1m-v1", "core-1m-v2").inOrder();
    assertThat(store.versions(Instrument.crypto("ETH/USDT", "binance"))).isEmpty();
    assertThat(store.versions(Instrument.crypto("BTC/USDT", "kraken"))).isEmpty();
  }

  private static FeatureRecord record(Instant timestamp, String version, double sma) {
    return FeatureRecord.create(
        BTC_USDT, timestamp, version, ImmutableSortedMap.of("return_1", 0.001, "sma_5", sma));
  }
}
