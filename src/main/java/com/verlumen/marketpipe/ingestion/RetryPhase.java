package com.verlumen.marketpipe.ingestion;

public enum RetryPhase {
  ATTEMPTING,
  BACKOFF,
  EXHAUSTED,
  SUCCEEDED;

  public boolean isTerminal() {
    return this == EXHAUSTED || this == SUCCEEDED;
  }
}
