package com.verlumen.marketpipe.ingestion;

import static com.google.common.collect.ImmutableSortedMap.toImmutableSortedMap;
import static com.google.common.truth.Truth.assertThat;
import static com.verlumen.marketpipe.ingestion.ScriptedSourceAdapter.bar;
import static com.verlumen.marketpipe.ingestion.ScriptedSourceAdapter.minute;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Ordering;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.inject.Guice;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.marketdata.CursorPosition;
import com.verlumen.marketpipe.marketdata.FetchResult;
import com.verlumen.marketpipe.marketdata.PaginationScheme;
import com.verlumen.marketpipe.marketdata.PermanentSourceException;
import com.verlumen.marketpipe.marketdata.SourceAdapter;
import com.verlumen.marketpipe.marketdata.SourceCapabilities;
import com.verlumen.marketpipe.marketdata.TransientSourceException;
import com.verlumen.marketpipe.rawstore.RawStore;
import com.verlumen.marketpipe.rawstore.RawStoreModule;
import com.verlumen.marketpipe.storage.BlobStore;
import com.verlumen.marketpipe.storage.InMemoryBlobStore;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IngestionCoordinatorImplTest {
  private static final Instrument BTC_USDT = Instrument.crypto("BTC/USDT", "binance");
  private static final Instrument ETH_USDT = Instrument.crypto("ETH/USDT", "binance");
  private static final IngestionPair BTC_PAIR = IngestionPair.create(BTC_USDT, "scripted");
  private static final TimeRange EVERYTHING = TimeRange.upTo(Instant.parse("2030-01-01T00:00:00Z"));
  private static final IngestionConfig CONFIG =
      IngestionConfig.defaults()
          .withRetryPolicy(RetryPolicy.create(3, Duration.ofMillis(1), Duration.ofMillis(10), 0.0));

  private final InMemoryBlobStore blobStore = new InMemoryBlobStore();
  private final RawStore rawStore = rawStoreOver(blobStore);
  private final List<Duration> sleeps = new ArrayList<>();
  private final ExecutorService fetchExecutor = Executors.newCachedThreadPool();

  @After
  public void tearDown() {
    fetchExecutor.shutdownNow();
  }

  @Test
  public void ingest_pagesThroughSeriesAndAdvancesCursor() throws Exception {
    // Arrange
    ScriptedSourceAdapter source = new ScriptedSourceAdapter("scripted", 4).serving(BTC_USDT, 0, 10);

    // Act
    PairOutcome outcome = coordinator(CONFIG, source).ingest(BTC_PAIR, minute(10));

    // Assert
    assertThat(outcome.status()).isEqualTo(IngestionStatus.SUCCEEDED);
    assertThat(outcome.pages()).isEqualTo(3);
    assertThat(outcome.appended()).isEqualTo(11);
    assertThat(rawStore.read(BTC_USDT, EVERYTHING, Optional.empty())).hasSize(11);
    IngestionCursor cursor = new CursorStoreImpl(blobStore).read(BTC_PAIR);
    assertThat(cursor.position()).isEqualTo(CursorPosition.at(minute(10)));
    assertThat(cursor.version()).isEqualTo(3);
  }

  @Test
  public void ingest_secondCycleWithNothingNew_isNoOp() throws Exception {
    // Arrange
    ScriptedSourceAdapter source = new ScriptedSourceAdapter("scripted", 100).serving(BTC_USDT, 0, 10);
    IngestionCoordinator coordinator = coordinator(CONFIG, source);
    coordinator.ingest(BTC_PAIR, minute(10));
    ImmutableSortedMap<String, String> before = contents(blobStore);

    // Act
    PairOutcome outcome = coordinator.ingest(BTC_PAIR, minute(10));

    // Assert
    assertThat(outcome.succeeded()).isTrue();
    assertThat(outcome.appended()).isEqualTo(0);
    assertThat(contents(blobStore)).isEqualTo(before);
  }

  @Test
  public void ingest_overlappingWindows_storeEachBarOnce() throws Exception {
    // Arrange
    ScriptedSourceAdapter source =
        new ScriptedSourceAdapter("scripted", 100).serving(BTC_USDT, 0, 10).ignoringCursor();
    IngestionCoordinator coordinator = coordinator(CONFIG, source);
    coordinator.ingest(BTC_PAIR, minute(15));

    // Act
    source.serving(BTC_USDT, 5, 15);
    PairOutcome outcome = coordinator.ingest(BTC_PAIR, minute(15));

    // Assert
    assertThat(outcome.fetched()).isEqualTo(11);
    assertThat(outcome.appended()).isEqualTo(5);
    assertThat(outcome.duplicates()).isEqualTo(6);
    assertThat(rawStore.read(BTC_USDT, EVERYTHING, Optional.empty())).hasSize(16);
  }

  @Test
  public void ingest_crashBetweenCommitAndCursorAdvance_recoversToCleanState() throws Exception {
    // Arrange
    ScriptedSourceAdapter source = new ScriptedSourceAdapter("scripted", 100).serving(BTC_USDT, 0, 10);
    CrashOnceCursorStore crashing = new CrashOnceCursorStore(new CursorStoreImpl(blobStore));
    IngestionCoordinator coordinator = coordinator(CONFIG, crashing, source);
    assertThrows(IllegalStateException.class, () -> coordinator.ingest(BTC_PAIR, minute(10)));

    // Act
    PairOutcome recovery = coordinator.ingest(BTC_PAIR, minute(10));

    // Assert
    assertThat(recovery.succeeded()).isTrue();
    assertThat(recovery.appended()).isEqualTo(0);
    assertThat(recovery.duplicates()).isEqualTo(11);
    InMemoryBlobStore cleanStore = new InMemoryBlobStore();
    new IngestionCoordinatorTestRun(cleanStore).run(BTC_PAIR, minute(10), BTC_USDT, 0, 10);
    assertThat(contents(blobStore)).isEqualTo(contents(cleanStore));
  }

  @Test
  public void ingest_transientFailures_retriedWithBackoff() throws Exception {
    // Arrange
    ScriptedSourceAdapter source =
        new ScriptedSourceAdapter("scripted", 100)
            .serving(BTC_USDT, 0, 4)
            .failingWith(new TransientSourceException("503"), new TransientSourceException("timeout"));

    // Act
    PairOutcome outcome = coordinator(CONFIG, source).ingest(BTC_PAIR, minute(4));

    // Assert
    assertThat(outcome.succeeded()).isTrue();
    assertThat(outcome.attempts()).isEqualTo(3);
    assertThat(outcome.appended()).isEqualTo(5);
    assertThat(sleeps).containsExactly(Duration.ofMillis(1), Duration.ofMillis(2)).inOrder();
  }

  @Test
  public void ingest_retriesExhausted_failsTransientAndKeepsCursor() throws Exception {
    // Arrange
    ScriptedSourceAdapter source =
        new ScriptedSourceAdapter("scripted", 100)
            .serving(BTC_USDT, 0, 4)
            .failingWith(
                new TransientSourceException("503"),
                new TransientSourceException("503"),
                new TransientSourceException("503"));

    // Act
    PairOutcome outcome = coordinator(CONFIG, source).ingest(BTC_PAIR, minute(4));

    // Assert
    assertThat(outcome.status()).isEqualTo(IngestionStatus.INGESTION_FAILED);
    assertThat(outcome.failureKind()).hasValue(FailureKind.TRANSIENT);
    assertThat(outcome.attempts()).isEqualTo(3);
    assertThat(outcome.message().get()).contains("gave up after 3 attempts");
    assertThat(new CursorStoreImpl(blobStore).read(BTC_PAIR)).isEqualTo(IngestionCursor.initial(BTC_PAIR));
  }

  @Test
  public void ingest_permanentFailure_failsWithoutRetry() throws Exception {
    // Arrange
    ScriptedSourceAdapter source =
        new ScriptedSourceAdapter("scripted", 100)
            .serving(BTC_USDT, 0, 4)
            .failingWith(new PermanentSourceException("Invalid symbol"));

    // Act
    PairOutcome outcome = coordinator(CONFIG, source).ingest(BTC_PAIR, minute(4));

    // Assert
    assertThat(outcome.status()).isEqualTo(IngestionStatus.INGESTION_FAILED);
    assertThat(outcome.failureKind()).hasValue(FailureKind.PERMANENT);
    assertThat(outcome.attempts()).isEqualTo(1);
    assertThat(sleeps).isEmpty();
  }

  @Test
  public void ingest_outOfOrderPage_rejectsWholePage() throws Exception {
    // Arrange
    ScriptedSourceAdapter source =
        new ScriptedSourceAdapter("scripted", 100)
            .servingExactly(
                ImmutableList.of(
                    bar(BTC_USDT, "scripted", 0), bar(BTC_USDT, "scripted", 2), bar(BTC_USDT, "scripted", 1)));

    // Act
    PairOutcome outcome = coordinator(CONFIG, source).ingest(BTC_PAIR, minute(5));

    // Assert
    assertThat(outcome.status()).isEqualTo(IngestionStatus.INGESTION_FAILED);
    assertThat(outcome.failureKind()).hasValue(FailureKind.PERMANENT);
    assertThat(rawStore.read(BTC_USDT, EVERYTHING, Optional.empty())).isEmpty();
  }

  @Test
  public void ingest_barsAfterAsOf_areDroppedAndLeftForLaterCycle() throws Exception {
    // Arrange
    ScriptedSourceAdapter source =
        new ScriptedSourceAdapter("scripted", 100)
            .servingExactly(
                ImmutableList.of(bar(BTC_USDT, "scripted", 0), bar(BTC_USDT, "scripted", 9)));

    // Act
    PairOutcome outcome = coordinator(CONFIG, source).ingest(BTC_PAIR, minute(5));

    // Assert
    assertThat(outcome.fetched()).isEqualTo(2);
    assertThat(outcome.appended()).isEqualTo(1);
    assertThat(rawStore.read(BTC_USDT, EVERYTHING, Optional.empty())).hasSize(1);
    assertThat(new CursorStoreImpl(blobStore).read(BTC_PAIR).position())
        .isEqualTo(CursorPosition.at(minute(0)));
  }

  @Test
  public void ingest_unknownSource_failsPermanent() {
    // Act
    PairOutcome outcome =
        coordinator(CONFIG, new ScriptedSourceAdapter("scripted", 10))
            .ingest(IngestionPair.create(BTC_USDT, "nowhere"), minute(5));

    // Assert
    assertThat(outcome.status()).isEqualTo(IngestionStatus.INGESTION_FAILED);
    assertThat(outcome.failureKind()).hasValue(FailureKind.PERMANENT);
  }

  @Test
  public void ingest_sourceExceedsCycleDeadline_timesOut() {
    // Arrange
    IngestionConfig shortCycle = CONFIG.withCycleTimeout(Duration.ofMillis(200));

    // Act
    PairOutcome outcome =
        coordinator(shortCycle, new HangingSourceAdapter())
            .ingest(IngestionPair.create(BTC_USDT, HangingSourceAdapter.NAME), minute(5));

    // Assert
    assertThat(outcome.status()).isEqualTo(IngestionStatus.INGESTION_TIMEOUT);
    assertThat(outcome.failureKind()).hasValue(FailureKind.TRANSIENT);
    assertThat(outcome.duration()).isLessThan(Duration.ofSeconds(5));
  }

  @Test
  public void ingest_storageFailure_retriedAsResourceError() throws Exception {
    // Arrange
    ScriptedSourceAdapter source = new ScriptedSourceAdapter("scripted", 100).serving(BTC_USDT, 0, 4);
    FlakyCursorStore flaky = new FlakyCursorStore(new CursorStoreImpl(blobStore), 5);

    // Act
    PairOutcome outcome = coordinator(CONFIG, flaky, source).ingest(BTC_PAIR, minute(4));

    // Assert
    assertThat(outcome.status()).isEqualTo(IngestionStatus.INGESTION_FAILED);
    assertThat(outcome.failureKind()).hasValue(FailureKind.RESOURCE);
  }

  @Test
  public void ingestAll_failingPairsDoNotAffectOthers() throws Exception {
    // Arrange
    ScriptedSourceAdapter good = new ScriptedSourceAdapter("scripted", 100).serving(BTC_USDT, 0, 4);
    ScriptedSourceAdapter broken =
        new ScriptedSourceAdapter("broken", 100).failingWith(new PermanentSourceException("Unknown symbol"));
    ScriptedSourceAdapter crashing =
        new ScriptedSourceAdapter("crashing", 100).failingWith(new IllegalStateException("bug"));
    IngestionPair brokenPair = IngestionPair.create(ETH_USDT, "broken");
    IngestionPair crashingPair = IngestionPair.create(ETH_USDT, "crashing");

    // Act
    ImmutableList<PairOutcome> outcomes =
        coordinator(CONFIG, good, broken, crashing)
            .ingestAll(ImmutableList.of(brokenPair, BTC_PAIR, crashingPair), minute(4));

    // Assert
    assertThat(outcomes).hasSize(3);
    assertThat(outcomes.get(0).pair()).isEqualTo(brokenPair);
    assertThat(outcomes.get(0).failureKind()).hasValue(FailureKind.PERMANENT);
    assertThat(outcomes.get(1).succeeded()).isTrue();
    assertThat(outcomes.get(1).appended()).isEqualTo(5);
    assertThat(outcomes.get(2).status()).isEqualTo(IngestionStatus.INGESTION_FAILED);
    assertThat(outcomes.get(2).message().get()).contains("Unexpected error");
  }

  @Test
  public void ingest_adapterBug_propagates() {
    // Arrange
    ScriptedSourceAdapter crashing =
        new ScriptedSourceAdapter("scripted", 100).failingWith(new IllegalStateException("bug"));

    // Act & Assert
    assertThrows(
        UncheckedExecutionException.class, () -> coordinator(CONFIG, crashing).ingest(BTC_PAIR, minute(4)));
  }

  private IngestionCoordinator coordinator(IngestionConfig config, SourceAdapter... sources) {
    return coordinator(config, new CursorStoreImpl(blobStore), sources);
  }

  private IngestionCoordinator coordinator(
      IngestionConfig config, CursorStore cursorStore, SourceAdapter... sources) {
    ImmutableMap.Builder<String, SourceAdapter> adapters = ImmutableMap.builder();
    for (SourceAdapter source : sources) {
      adapters.put(source.sourceName(), source);
    }
    return new IngestionCoordinatorImpl(
        adapters.buildOrThrow(),
        rawStore,
        cursorStore,
        new PairLeases(),
        new SourceRateLimiters(config),
        SimpleTimeLimiter.create(fetchExecutor),
        sleeps::add,
        Ticker.systemTicker(),
        config);
  }

  private static RawStore rawStoreOver(BlobStore blobStore) {
    return Guice.createInjector(
            RawStoreModule.create(), binder -> binder.bind(BlobStore.class).toInstance(blobStore))
        .getInstance(RawStore.class);
  }

  private static ImmutableSortedMap<String, String> contents(InMemoryBlobStore store) {
    return store.snapshot().entrySet().stream()
        .collect(
            toImmutableSortedMap(
                Ordering.natural(),
                Map.Entry::getKey,
                entry -> new String(entry.getValue(), StandardCharsets.UTF_8)));
  }

  /** A clean, crash-free run over its own store. */
  private final class IngestionCoordinatorTestRun {
    private final InMemoryBlobStore store;

    IngestionCoordinatorTestRun(InMemoryBlobStore store) {
      this.store = store;
    }

    void run(IngestionPair pair, Instant asOf, Instrument instrument, int from, int to) {
      ScriptedSourceAdapter source = new ScriptedSourceAdapter(pair.source(), 100).serving(instrument, from, to);
      new IngestionCoordinatorImpl(
              ImmutableMap.of(source.sourceName(), source),
              rawStoreOver(store),
              new CursorStoreImpl(store),
              new PairLeases(),
              new SourceRateLimiters(CONFIG),
              SimpleTimeLimiter.create(fetchExecutor),
              duration -> {},
              Ticker.systemTicker(),
              CONFIG)
          .ingest(pair, asOf);
    }
  }

  /** Simulates a process dying right after the raw store commit. */
  private static final class CrashOnceCursorStore implements CursorStore {
    private final CursorStore delegate;
    private final AtomicBoolean crashed = new AtomicBoolean();

    CrashOnceCursorStore(CursorStore delegate) {
      this.delegate = delegate;
    }

    @Override
    public IngestionCursor read(IngestionPair pair) throws StorageException {
      return delegate.read(pair);
    }

    @Override
    public boolean compareAndSet(IngestionCursor expected, IngestionCursor updated)
        throws StorageException {
      if (crashed.compareAndSet(false, true)) {
        throw new IllegalStateException("simulated crash");
      }
      return delegate.compareAndSet(expected, updated);
    }
  }

  private static final class FlakyCursorStore implements CursorStore {
    private final CursorStore delegate;
    private int failuresLeft;

    FlakyCursorStore(CursorStore delegate, int failures) {
      this.delegate = delegate;
      this.failuresLeft = failures;
    }

    @Override
    public IngestionCursor read(IngestionPair pair) throws StorageException {
      if (failuresLeft > 0) {
        failuresLeft--;
        throw new StorageException("bucket unavailable");
      }
      return delegate.read(pair);
    }

    @Override
    public boolean compareAndSet(IngestionCursor expected, IngestionCursor updated)
        throws StorageException {
      return delegate.compareAndSet(expected, updated);
    }
  }

  private static final class HangingSourceAdapter implements SourceAdapter {
    static final String NAME = "hanging";

    @Override
    public String sourceName() {
      return NAME;
    }

    @Override
    public SourceCapabilities capabilities() {
      return SourceCapabilities.create(PaginationScheme.TIME_WINDOW, 1_000.0, true, 10);
    }

    @Override
    public boolean supports(Instrument instrument) {
      return true;
    }

    @Override
    public FetchResult fetch(Instrument instrument, CursorPosition since, Instant until)
        throws InterruptedException {
      Thread.sleep(Duration.ofSeconds(30).toMillis());
      return FetchResult.empty(since);
    }
  }
}
