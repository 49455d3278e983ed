package com.verlumen.marketpipe.storage;

/**
 * The backing store could not complete an operation. Callers treat this as a resource error:
 * retried within a cycle, reported if it persists.
 */
public class StorageException extends Exception {
  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
