package com.verlumen.marketpipe.ingestion;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.marketdata.CursorPosition;
import com.verlumen.marketpipe.storage.InMemoryBlobStore;
import java.time.Instant;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CursorStoreImplTest {
  private static final IngestionPair PAIR =
      IngestionPair.create(Instrument.equity("AAPL", "nasdaq"), "alphavantage");
  private static final CursorPosition POSITION =
      CursorPosition.at(Instant.parse("2024-01-04T00:00:00Z"), "2024-01-04");

  private final InMemoryBlobStore blobStore = new InMemoryBlobStore();
  private final CursorStoreImpl cursorStore = new CursorStoreImpl(blobStore);

  @Test
  public void read_neverWritten_returnsInitialCursor() throws Exception {
    assertThat(cursorStore.read(PAIR)).isEqualTo(IngestionCursor.initial(PAIR));
  }

  @Test
  public void compareAndSet_matchingVersion_persistsPositionAndToken() throws Exception {
    // Arrange
    IngestionCursor initial = cursorStore.read(PAIR);

    // Act
    boolean swapped = cursorStore.compareAndSet(initial, initial.advanceTo(POSITION));

    // Assert
    assertThat(swapped).isTrue();
    IngestionCursor stored = new CursorStoreImpl(blobStore).read(PAIR);
    assertThat(stored.position()).isEqualTo(POSITION);
    assertThat(stored.version()).isEqualTo(1);
  }

  @Test
  public void compareAndSet_staleVersion_returnsFalseAndKeepsStoredCursor() throws Exception {
    // Arrange
    IngestionCursor initial = cursorStore.read(PAIR);
    cursorStore.compareAndSet(initial, initial.advanceTo(POSITION));

    // Act
    boolean swapped =
        cursorStore.compareAndSet(initial, initial.advanceTo(CursorPosition.at(Instant.EPOCH)));

    // Assert
    assertThat(swapped).isFalse();
    assertThat(cursorStore.read(PAIR).position()).isEqualTo(POSITION);
  }

  @Test
  public void compareAndSet_sameSymbolOnAnotherVenue_leavesItsCursorUntouched() throws Exception {
    // Arrange
    IngestionPair xetra = IngestionPair.create(Instrument.equity("AAPL", "xetra"), "alphavantage");
    IngestionCursor initial = cursorStore.read(PAIR);

    // Act
    cursorStore.compareAndSet(initial, initial.advanceTo(POSITION));

    // Assert
    assertThat(cursorStore.read(xetra)).isEqualTo(IngestionCursor.initial(xetra));
    assertThat(cursorStore.read(PAIR).version()).isEqualTo(1);
  }

  @Test
  public void compareAndSet_versionSkipsAhead_throwsIllegalArgumentException() {
    // Arrange
    IngestionCursor initial = IngestionCursor.initial(PAIR);
    IngestionCursor skipped = IngestionCursor.create(PAIR, POSITION, 2);

    // Act & Assert
    assertThrows(IllegalArgumentException.class, () -> cursorStore.compareAndSet(initial, skipped));
  }
}
