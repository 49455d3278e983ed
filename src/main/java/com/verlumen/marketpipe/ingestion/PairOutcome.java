package com.verlumen.marketpipe.ingestion;

import com.google.auto.value.AutoValue;
import java.time.Duration;
import java.util.Optional;

/** Structured result of one ingestion cycle for one pair. */
@AutoValue
public abstract class PairOutcome {
  public static Builder builder(IngestionPair pair) {
    return new AutoValue_PairOutcome.Builder()
        .setPair(pair)
        .setStatus(IngestionStatus.SUCCEEDED)
        .setFetched(0)
        .setAppended(0)
        .setDuplicates(0)
        .setPages(0)
        .setAttempts(0)
        .setDuration(Duration.ZERO);
  }

  public abstract IngestionPair pair();

  public abstract IngestionStatus status();

  public abstract Optional<FailureKind> failureKind();

  /** Observations returned by the source, duplicates included. */
  public abstract int fetched();

  public abstract int appended();

  public abstract int duplicates();

  public abstract int pages();

  /** Source calls made, retries included. */
  public abstract int attempts();

  public abstract Duration duration();

  public abstract Optional<String> message();

  public boolean succeeded() {
    return status() == IngestionStatus.SUCCEEDED;
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPair(IngestionPair pair);

    public abstract Builder setStatus(IngestionStatus status);

    public abstract Builder setFailureKind(FailureKind failureKind);

    public abstract Builder setFetched(int fetched);

    public abstract Builder setAppended(int appended);

    public abstract Builder setDuplicates(int duplicates);

    public abstract Builder setPages(int pages);

    public abstract Builder setAttempts(int attempts);

    public abstract Builder setDuration(Duration duration);

    public abstract Builder setMessage(String message);

    public abstract PairOutcome build();
  }
}
