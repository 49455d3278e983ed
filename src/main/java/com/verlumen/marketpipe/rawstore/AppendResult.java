package com.verlumen.marketpipe.rawstore;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** Outcome of {@link RawStore#append}. */
@AutoValue
public abstract class AppendResult {
  public static AppendResult create(int appended, int duplicates, Optional<String> ingestionId) {
    return new AutoValue_AppendResult(appended, duplicates, ingestionId);
  }

  public static AppendResult allDuplicates(int duplicates) {
    return create(0, duplicates, Optional.empty());
  }

  public abstract int appended();

  /** Observations skipped because their key and revision were already stored. */
  public abstract int duplicates();

  /** Identifier of the committed batch; empty if nothing was written. */
  public abstract Optional<String> ingestionId();
}
