package com.verlumen.marketpipe.ingestion;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/** Serializes cycles of the same pair; different pairs never contend. */
@Singleton
final class PairLeases {
  private final ConcurrentMap<IngestionPair, ReentrantLock> locks = new ConcurrentHashMap<>();

  @Inject
  PairLeases() {}

  /** Waits up to {@code timeout} for the pair's lease. */
  Optional<Lease> tryAcquire(IngestionPair pair, Duration timeout) throws InterruptedException {
    ReentrantLock lock = locks.computeIfAbsent(pair, unused -> new ReentrantLock());
    if (!lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
      return Optional.empty();
    }
    return Optional.of(new Lease(lock));
  }

  static final class Lease implements AutoCloseable {
    private final ReentrantLock lock;

    private Lease(ReentrantLock lock) {
      this.lock = lock;
    }

    @Override
    public void close() {
      lock.unlock();
    }
  }
}
