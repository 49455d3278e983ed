package com.verlumen.marketpipe.signals;

/** The model rejected or could not score a specific record. */
public final class ModelInferenceException extends Exception {
  public ModelInferenceException(String message) {
    super(message);
  }

  public ModelInferenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
