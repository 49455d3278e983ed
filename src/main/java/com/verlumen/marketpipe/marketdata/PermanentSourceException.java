package com.verlumen.marketpipe.marketdata;

/** Unknown symbol, authentication failure or malformed payload. Retrying will not help. */
public final class PermanentSourceException extends SourceException {
  public PermanentSourceException(String message) {
    super(message, null);
  }

  public PermanentSourceException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
