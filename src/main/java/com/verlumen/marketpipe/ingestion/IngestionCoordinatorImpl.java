package com.verlumen.marketpipe.ingestion;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.inject.Inject;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.marketdata.CursorPosition;
import com.verlumen.marketpipe.marketdata.FetchResult;
import com.verlumen.marketpipe.marketdata.Observation;
import com.verlumen.marketpipe.marketdata.ObservationKey;
import com.verlumen.marketpipe.marketdata.PermanentSourceException;
import com.verlumen.marketpipe.marketdata.SourceAdapter;
import com.verlumen.marketpipe.marketdata.SourceException;
import com.verlumen.marketpipe.marketdata.TransientSourceException;
import com.verlumen.marketpipe.rawstore.AppendResult;
import com.verlumen.marketpipe.rawstore.RawStore;
import com.verlumen.marketpipe.storage.StorageException;
import com.verlumen.marketpipe.time.TimeRange;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;

/**
 * Cycle per pair: take the pair's lease, read its cursor, then for each page fetch (rate limited,
 * deadline bounded, retried), validate, dedupe, commit to the raw store and only then advance the
 * cursor. A crash between commit and advance makes the next cycle re-fetch the page, which the
 * dedupe absorbs.
 */
final class IngestionCoordinatorImpl implements IngestionCoordinator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Map<String, SourceAdapter> adapters;
  private final RawStore rawStore;
  private final CursorStore cursorStore;
  private final PairLeases leases;
  private final SourceRateLimiters rateLimiters;
  private final TimeLimiter timeLimiter;
  private final Sleeper sleeper;
  private final Ticker ticker;
  private final IngestionConfig config;

  @Inject
  IngestionCoordinatorImpl(
      Map<String, SourceAdapter> adapters,
      RawStore rawStore,
      CursorStore cursorStore,
      PairLeases leases,
      SourceRateLimiters rateLimiters,
      TimeLimiter timeLimiter,
      Sleeper sleeper,
      Ticker ticker,
      IngestionConfig config) {
    this.adapters = adapters;
    this.rawStore = rawStore;
    this.cursorStore = cursorStore;
    this.leases = leases;
    this.rateLimiters = rateLimiters;
    this.timeLimiter = timeLimiter;
    this.sleeper = sleeper;
    this.ticker = ticker;
    this.config = config;
  }

  @Override
  public PairOutcome ingest(IngestionPair pair, Instant asOf) {
    PairOutcome outcome = new Cycle(pair, asOf).run();
    logger.atInfo().log(
        "pair=%s outcome=%s fetched=%d appended=%d duplicates=%d pages=%d attempts=%d durationMs=%d",
        pair,
        outcome.status(),
        outcome.fetched(),
        outcome.appended(),
        outcome.duplicates(),
        outcome.pages(),
        outcome.attempts(),
        outcome.duration().toMillis());
    return outcome;
  }

  @Override
  public ImmutableList<PairOutcome> ingestAll(List<IngestionPair> pairs, Instant asOf) {
    if (pairs.isEmpty()) {
      return ImmutableList.of();
    }
    ExecutorService executor =
        Executors.newFixedThreadPool(
            Math.min(config.parallelism(), pairs.size()),
            new ThreadFactoryBuilder().setNameFormat("ingestion-%d").setDaemon(true).build());
    try {
      ImmutableList<Future<PairOutcome>> futures =
          pairs.stream()
              .map(pair -> executor.submit(() -> ingest(pair, asOf)))
              .collect(toImmutableList());
      ImmutableList.Builder<PairOutcome> outcomes = ImmutableList.builder();
      for (int i = 0; i < pairs.size(); i++) {
        IngestionPair pair = pairs.get(i);
        try {
          outcomes.add(futures.get(i).get());
        } catch (ExecutionException e) {
          logger.atSevere().withCause(e.getCause()).log("Ingestion of %s crashed", pair);
          outcomes.add(
              PairOutcome.builder(pair)
                  .setStatus(IngestionStatus.INGESTION_FAILED)
                  .setFailureKind(FailureKind.PERMANENT)
                  .setMessage("Unexpected error: " + e.getCause())
                  .build());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          outcomes.add(
              PairOutcome.builder(pair)
                  .setStatus(IngestionStatus.INGESTION_TIMEOUT)
                  .setFailureKind(FailureKind.TRANSIENT)
                  .setMessage("Interrupted while waiting for ingestion")
                  .build());
        }
      }
      return outcomes.build();
    } finally {
      executor.shutdownNow();
    }
  }

  /** State of one pair's cycle. Counters and retry state never outlive it. */
  private final class Cycle {
    private final IngestionPair pair;
    private final Instant asOf;
    private final Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    private int fetched;
    private int appended;
    private int duplicates;
    private int pages;
    private int attempts;

    Cycle(IngestionPair pair, Instant asOf) {
      this.pair = pair;
      this.asOf = asOf;
    }

    PairOutcome run() {
      try {
        SourceAdapter adapter = adapters.get(pair.source());
        if (adapter == null) {
          throw new CycleFailure(
              IngestionStatus.INGESTION_FAILED, FailureKind.PERMANENT, "No source named " + pair.source());
        }
        if (!adapter.supports(pair.instrument())) {
          throw new CycleFailure(
              IngestionStatus.INGESTION_FAILED,
              FailureKind.PERMANENT,
              pair.source() + " does not serve " + pair.instrument());
        }
        Duration leaseWait = min(config.lockTimeout(), remaining());
        Optional<PairLeases.Lease> lease = leases.tryAcquire(pair, leaseWait);
        if (lease.isEmpty()) {
          throw new CycleFailure(
              IngestionStatus.INGESTION_FAILED,
              FailureKind.RESOURCE,
              "Another cycle holds the lease for " + pair);
        }
        try (PairLeases.Lease held = lease.get()) {
          pullPages(adapter);
        }
        return outcome().build();
      } catch (CycleFailure e) {
        logger.atWarning().withCause(e.getCause()).log("Ingestion of %s failed: %s", pair, e.getMessage());
        return outcome()
            .setStatus(e.status)
            .setFailureKind(e.kind)
            .setMessage(e.getMessage())
            .build();
      } catch (OutOfOrderDataException e) {
        logger.atWarning().log("Rejected data for %s: %s", pair, e.getMessage());
        return outcome()
            .setStatus(IngestionStatus.INGESTION_FAILED)
            .setFailureKind(FailureKind.PERMANENT)
            .setMessage(e.getMessage())
            .build();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return outcome()
            .setStatus(IngestionStatus.INGESTION_TIMEOUT)
            .setFailureKind(FailureKind.TRANSIENT)
            .setMessage("Interrupted")
            .build();
      }
    }

    private void pullPages(SourceAdapter adapter)
        throws CycleFailure, OutOfOrderDataException, InterruptedException {
      IngestionCursor cursor = withRetry("read cursor", () -> cursorStore.read(pair));
      while (pages < config.maxPagesPerCycle()) {
        CursorPosition since = cursor.position();
        FetchResult page = withRetry("fetch", () -> fetchOnce(adapter, since));
        pages++;
        fetched += page.observations().size();
        ImmutableList<Observation> accepted = accepted(page.observations());
        commit(accepted);

        CursorPosition next = page.nextPosition();
        boolean hasMore = page.hasMore();
        if (accepted.size() < page.observations().size()) {
          // The page ran past the as-of instant; resume after the last bar kept.
          next = accepted.isEmpty() ? since : CursorPosition.at(accepted.get(accepted.size() - 1).timestamp());
          hasMore = false;
        }
        if (!next.equals(since)) {
          cursor = advance(cursor, next);
        } else if (hasMore) {
          logger.atWarning().log("%s reported more pages without moving past %s", pair, since);
          return;
        }
        if (!hasMore) {
          return;
        }
      }
      logger.atInfo().log(
          "Stopping %s after %d pages; the next cycle continues from the cursor", pair, pages);
    }

    private FetchResult fetchOnce(SourceAdapter adapter, CursorPosition since)
        throws SourceException, TimeoutException, InterruptedException {
      attempts++;
      if (!rateLimiters.tryAcquire(adapter, remaining())) {
        throw new TimeoutException("No request permit for " + pair.source() + " before the deadline");
      }
      Duration budget = remaining();
      if (budget.isZero()) {
        throw new TimeoutException("Deadline reached before calling " + pair.source());
      }
      try {
        return timeLimiter.callWithTimeout(
            () -> adapter.fetch(pair.instrument(), since, asOf), budget.toMillis(), MILLISECONDS);
      } catch (ExecutionException e) {
        if (e.getCause() instanceof SourceException) {
          throw (SourceException) e.getCause();
        }
        if (e.getCause() instanceof InterruptedException) {
          throw (InterruptedException) e.getCause();
        }
        throw new TransientSourceException("Fetch from " + pair.source() + " failed", e.getCause());
      }
    }

    /** Checks ordering and ownership, and drops bars beyond the as-of instant. */
    private ImmutableList<Observation> accepted(ImmutableList<Observation> observations)
        throws CycleFailure, OutOfOrderDataException {
      Instant previous = null;
      for (Observation observation : observations) {
        if (!observation.instrument().equals(pair.instrument())
            || !observation.source().equals(pair.source())) {
          throw new CycleFailure(
              IngestionStatus.INGESTION_FAILED,
              FailureKind.PERMANENT,
              String.format("%s returned %s for the wrong pair", pair, observation.key()));
        }
        if (previous != null && !observation.timestamp().isAfter(previous)) {
          throw new OutOfOrderDataException(pair, previous, observation.timestamp());
        }
        previous = observation.timestamp();
      }
      ImmutableList<Observation> accepted =
          observations.stream().filter(o -> !o.timestamp().isAfter(asOf)).collect(toImmutableList());
      if (accepted.size() < observations.size()) {
        logger.atWarning().log(
            "Dropped %d observations after %s from %s", observations.size() - accepted.size(), asOf, pair);
      }
      return accepted;
    }

    private void commit(ImmutableList<Observation> observations)
        throws CycleFailure, InterruptedException {
      if (observations.isEmpty()) {
        return;
      }
      Instrument instrument = pair.instrument();
      TimeRange span =
          TimeRange.create(
              observations.get(0).timestamp(), observations.get(observations.size() - 1).timestamp());
      ImmutableSet<ObservationKey> existing =
          withRetry("read existing keys", () -> rawStore.existingKeys(instrument, pair.source(), span));
      // Corrections always go through; the raw store decides whether that revision is new.
      ImmutableList<Observation> fresh =
          observations.stream()
              .filter(o -> o.isCorrection() || !existing.contains(o.key()))
              .collect(toImmutableList());
      duplicates += observations.size() - fresh.size();
      if (fresh.isEmpty()) {
        return;
      }
      AppendResult result =
          withRetry("append", () -> rawStore.append(instrument, pair.source(), fresh));
      appended += result.appended();
      duplicates += result.duplicates();
    }

    private IngestionCursor advance(IngestionCursor cursor, CursorPosition next)
        throws CycleFailure, InterruptedException {
      if (!cursor.position().isAtOrBefore(next)) {
        throw new CycleFailure(
            IngestionStatus.INGESTION_FAILED,
            FailureKind.PERMANENT,
            String.format("%s moved the cursor backwards from %s to %s", pair, cursor.position(), next));
      }
      IngestionCursor updated = cursor.advanceTo(next);
      if (!withRetry("advance cursor", () -> cursorStore.compareAndSet(cursor, updated))) {
        throw new CycleFailure(
            IngestionStatus.INGESTION_FAILED,
            FailureKind.RESOURCE,
            "Cursor for " + pair + " was advanced by another writer");
      }
      return updated;
    }

    /** Runs {@code attempt} through the retry state machine. */
    private <T> T withRetry(String operation, Attempt<T> attempt)
        throws CycleFailure, InterruptedException {
      RetryPolicy policy = config.retryPolicy();
      RetryState state = RetryState.initial();
      while (true) {
        checkDeadline(operation);
        FailureKind kind;
        Exception failure;
        try {
          return attempt.run();
        } catch (PermanentSourceException e) {
          throw new CycleFailure(
              IngestionStatus.INGESTION_FAILED, FailureKind.PERMANENT, e.getMessage(), e);
        } catch (TimeoutException e) {
          throw new CycleFailure(
              IngestionStatus.INGESTION_TIMEOUT, FailureKind.TRANSIENT, operation + " timed out", e);
        } catch (SourceException e) {
          kind = FailureKind.TRANSIENT;
          failure = e;
        } catch (StorageException e) {
          kind = FailureKind.RESOURCE;
          failure = e;
        }

        state = policy.next(state, RetryEvent.TRANSIENT_FAILURE, ThreadLocalRandom.current().nextDouble());
        if (state.phase() == RetryPhase.EXHAUSTED) {
          throw new CycleFailure(
              IngestionStatus.INGESTION_FAILED,
              kind,
              String.format("%s gave up after %d attempts: %s", operation, state.attempt(), failure.getMessage()),
              failure);
        }
        if (state.delay().compareTo(remaining()) >= 0) {
          throw new CycleFailure(
              IngestionStatus.INGESTION_TIMEOUT,
              FailureKind.TRANSIENT,
              operation + " cannot back off past the deadline",
              failure);
        }
        logger.atFine().log(
            "%s for %s failed on attempt %d, retrying in %s: %s",
            operation, pair, state.attempt(), state.delay(), failure.getMessage());
        sleeper.sleep(state.delay());
        state = policy.next(state, RetryEvent.BACKOFF_ELAPSED, 0);
      }
    }

    private void checkDeadline(String operation) throws CycleFailure {
      if (remaining().isZero()) {
        throw new CycleFailure(
            IngestionStatus.INGESTION_TIMEOUT,
            FailureKind.TRANSIENT,
            String.format("Cycle deadline of %s reached before %s", config.cycleTimeout(), operation));
      }
    }

    private Duration remaining() {
      Duration left = config.cycleTimeout().minus(stopwatch.elapsed());
      return left.isNegative() ? Duration.ZERO : left;
    }

    private PairOutcome.Builder outcome() {
      return PairOutcome.builder(pair)
          .setFetched(fetched)
          .setAppended(appended)
          .setDuplicates(duplicates)
          .setPages(pages)
          .setAttempts(attempts)
          .setDuration(stopwatch.elapsed());
    }
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  @FunctionalInterface
  private interface Attempt<T> {
    T run() throws SourceException, StorageException, TimeoutException, InterruptedException;
  }

  private static final class CycleFailure extends Exception {
    private final IngestionStatus status;
    private final FailureKind kind;

    CycleFailure(IngestionStatus status, FailureKind kind, String message) {
      this(status, kind, message, null);
    }

    CycleFailure(IngestionStatus status, FailureKind kind, String message, Throwable cause) {
      super(message, cause);
      this.status = status;
      this.kind = kind;
    }
  }
}
