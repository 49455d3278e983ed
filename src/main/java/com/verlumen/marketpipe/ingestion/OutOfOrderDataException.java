package com.verlumen.marketpipe.ingestion;

import java.time.Instant;

/** A source returned a page whose timestamps are not strictly ascending. */
public final class OutOfOrderDataException extends Exception {
  OutOfOrderDataException(IngestionPair pair, Instant previous, Instant offending) {
    super(String.format("%s returned %s after %s", pair, offending, previous));
  }
}
