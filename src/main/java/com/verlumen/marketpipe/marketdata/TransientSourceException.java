package com.verlumen.marketpipe.marketdata;

/** Network, timeout or throttling failure. Worth retrying. */
public final class TransientSourceException extends SourceException {
  public TransientSourceException(String message) {
    super(message, null);
  }

  public TransientSourceException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
