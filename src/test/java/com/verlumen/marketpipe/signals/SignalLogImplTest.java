package com.verlumen.marketpipe.signals;

import static com.google.common.truth.Truth.assertThat;

import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.storage.InMemoryBlobStore;
import com.verlumen.marketpipe.time.TimeRange;
import java.time.Instant;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SignalLogImplTest {
  private static final Instrument AAPL = Instrument.equity("AAPL", "nasdaq");
  private static final Instant MONDAY = Instant.parse("2024-01-08T00:00:00Z");
  private static final Instant TUESDAY = Instant.parse("2024-01-09T00:00:00Z");

  private final InMemoryBlobStore blobStore = new InMemoryBlobStore();
  private final SignalLogImpl signalLog = new SignalLogImpl(blobStore);

  @Test
  public void append_newSignal_isStoredUnderInstrumentAndDay() throws Exception {
    // Act
    boolean appended = signalLog.append(signal(MONDAY, Decision.BUY, "model/v1"));

    // Assert
    assertThat(appended).isTrue();
    assertThat(blobStore.snapshot().keySet())
        .containsExactly("signals/equity/nasdaq/AAPL/2024-01-08/" + MONDAY.toEpochMilli() + "-model_v1-core_1d_v1.json");
  }

  @Test
  public void append_sameKeyAgain_keepsFirstEntry() throws Exception {
    // Arrange
    Signal original = signal(MONDAY, Decision.BUY, "v1");
    signalLog.append(original);

    // Act
    boolean appended = signalLog.append(signal(MONDAY, Decision.SELL, "v1"));

    // Assert
    assertThat(appended).isFalse();
    assertThat(signalLog.read(AAPL, TimeRange.at(MONDAY))).containsExactly(original);
  }

  @Test
  public void append_otherModelVersion_isSeparateEntry() throws Exception {
    // Act
    signalLog.append(signal(MONDAY, Decision.BUY, "v1"));
    boolean appended = signalLog.append(signal(MONDAY, Decision.HOLD, "v2"));

    // Assert
    assertThat(appended).isTrue();
    assertThat(signalLog.read(AAPL, TimeRange.at(MONDAY))).hasSize(2);
  }

  @Test
  public void read_returnsSignalsInRangeOrderedByTimestamp() throws Exception {
    // Arrange
    Signal tuesday = signal(TUESDAY, Decision.SELL, "v1");
    Signal monday = signal(MONDAY, Decision.BUY, "v1");
    signalLog.append(tuesday);
    signalLog.append(monday);

    // Act & Assert
    assertThat(signalLog.read(AAPL, TimeRange.create(MONDAY, TUESDAY))).containsExactly(monday, tuesday).inOrder();
    assertThat(signalLog.read(AAPL, TimeRange.at(TUESDAY))).containsExactly(tuesday);
  }

  private static Signal signal(Instant timestamp, Decision decision, String modelVersion) {
    return Signal.builder()
        .setInstrument(AAPL)
        .setTimestamp(timestamp)
        .setDecision(decision)
        .setConfidence(0.75)
        .setExpectedReturn(decision == Decision.SELL ? -0.03 : 0.03)
        .setFeatureSetVersion("core-1d-v1")
        .setModelVersion(modelVersion)
        .build();
  }
}
