package com.verlumen.marketpipe.ingestion;

import com.verlumen.marketpipe.storage.StorageException;

/** Durable home of ingestion cursors. Only the ingestion coordinator writes here. */
public interface CursorStore {
  /** The stored cursor, or {@link IngestionCursor#initial} if the pair was never ingested. */
  IngestionCursor read(IngestionPair pair) throws StorageException;

  /**
   * Replaces {@code expected} with {@code updated} if the stored version still equals
   * {@code expected.version()}.
   *
   * @return false if another writer advanced the cursor first
   */
  boolean compareAndSet(IngestionCursor expected, IngestionCursor updated) throws StorageException;
}
