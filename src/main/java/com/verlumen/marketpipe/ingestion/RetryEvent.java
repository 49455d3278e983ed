package com.verlumen.marketpipe.ingestion;

/** Inputs to the {@link RetryPolicy} state machine. */
public enum RetryEvent {
  SUCCESS,
  TRANSIENT_FAILURE,
  BACKOFF_ELAPSED
}
