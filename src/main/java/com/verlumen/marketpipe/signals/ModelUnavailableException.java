package com.verlumen.marketpipe.signals;

/** The model could not be reached. A later cycle may succeed. */
public final class ModelUnavailableException extends Exception {
  public ModelUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
