package com.verlumen.marketpipe.ingestion;

/** Why a pair's cycle did not succeed. */
public enum FailureKind {
  /** Network, timeout or throttling; retries were exhausted. */
  TRANSIENT,
  /** Bad symbol, rejected credentials or bad data. Not retried. */
  PERMANENT,
  /** Storage unavailable or lease contention. */
  RESOURCE
}
