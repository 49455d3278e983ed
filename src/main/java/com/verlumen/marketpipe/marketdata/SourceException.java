package com.verlumen.marketpipe.marketdata;

/** Base class for failures reported by a {@link SourceAdapter}. */
public abstract class SourceException extends Exception {
  SourceException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract boolean isRetryable();
}
