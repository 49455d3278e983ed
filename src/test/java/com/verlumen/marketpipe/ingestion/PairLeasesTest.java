package com.verlumen.marketpipe.ingestion;

import static com.google.common.truth.Truth.assertThat;

import com.verlumen.marketpipe.instruments.Instrument;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PairLeasesTest {
  private static final IngestionPair BTC = IngestionPair.create(Instrument.crypto("BTC/USDT", "binance"), "binance");
  private static final IngestionPair ETH = IngestionPair.create(Instrument.crypto("ETH/USDT", "binance"), "binance");

  private final PairLeases leases = new PairLeases();

  @Test
  public void tryAcquire_heldByAnotherThread_timesOut() throws Exception {
    // Arrange
    try (PairLeases.Lease held = leases.tryAcquire(BTC, Duration.ZERO).get()) {
      // Act
      Optional<PairLeases.Lease> contended =
          CompletableFuture.supplyAsync(() -> acquire(BTC)).get(5, TimeUnit.SECONDS);

      // Assert
      assertThat(contended).isEmpty();
    }
  }

  @Test
  public void tryAcquire_differentPair_doesNotContend() throws Exception {
    try (PairLeases.Lease held = leases.tryAcquire(BTC, Duration.ZERO).get()) {
      Optional<PairLeases.Lease> other =
          CompletableFuture.supplyAsync(() -> acquire(ETH)).get(5, TimeUnit.SECONDS);

      assertThat(other).isPresent();
    }
  }

  @Test
  public void tryAcquire_afterRelease_succeeds() throws Exception {
    // Arrange
    leases.tryAcquire(BTC, Duration.ZERO).get().close();

    // Act
    Optional<PairLeases.Lease> again =
        CompletableFuture.supplyAsync(() -> acquire(BTC)).get(5, TimeUnit.SECONDS);

    // Assert
    assertThat(again).isPresent();
  }

  private Optional<PairLeases.Lease> acquire(IngestionPair pair) {
    try {
      return leases.tryAcquire(pair, Duration.ofMillis(50));
    } catch (InterruptedException e) {
      throw new AssertionError(e);
    }
  }
}
