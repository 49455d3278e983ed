package com.verlumen.marketpipe.ingestion;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.util.concurrent.Striped;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.inject.Inject;
import com.verlumen.marketpipe.marketdata.CursorPosition;
import com.verlumen.marketpipe.storage.BlobStore;
import com.verlumen.marketpipe.storage.StorageException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/** Stores one JSON object per pair at {@code cursors/<instrument>/<source>.json}. */
final class CursorStoreImpl implements CursorStore {
  private final BlobStore blobStore;
  private final Striped<Lock> locks = Striped.lock(64);

  @Inject
  CursorStoreImpl(BlobStore blobStore) {
    this.blobStore = blobStore;
  }

  @Override
  public IngestionCursor read(IngestionPair pair) throws StorageException {
    Optional<byte[]> stored = blobStore.get(key(pair));
    if (stored.isEmpty()) {
      return IngestionCursor.initial(pair);
    }
    JsonObject json =
        JsonParser.parseString(new String(stored.get(), StandardCharsets.UTF_8)).getAsJsonObject();
    CursorPosition position =
        CursorPosition.create(
            json.has("lastTimestamp")
                ? Optional.of(Instant.parse(json.get("lastTimestamp").getAsString()))
                : Optional.empty(),
            json.has("pageToken") ? Optional.of(json.get("pageToken").getAsString()) : Optional.empty());
    return IngestionCursor.create(pair, position, json.get("version").getAsLong());
  }

  @Override
  public boolean compareAndSet(IngestionCursor expected, IngestionCursor updated)
      throws StorageException {
    checkArgument(expected.pair().equals(updated.pair()), "Cursor pairs differ");
    checkArgument(
        updated.version() == expected.version() + 1,
        "Cursor version must advance by one: %s -> %s", expected.version(), updated.version());
    String key = key(expected.pair());
    Lock lock = locks.get(key);
    lock.lock();
    try {
      if (read(expected.pair()).version() != expected.version()) {
        return false;
      }
      blobStore.put(key, encode(updated));
      return true;
    } finally {
      lock.unlock();
    }
  }

  private static byte[] encode(IngestionCursor cursor) {
    JsonObject json = new JsonObject();
    json.addProperty("symbol", cursor.pair().instrument().symbol());
    json.addProperty("source", cursor.pair().source());
    json.addProperty("version", cursor.version());
    cursor.position().lastTimestamp().ifPresent(t -> json.addProperty("lastTimestamp", t.toString()));
    cursor.position().pageToken().ifPresent(token -> json.addProperty("pageToken", token));
    return json.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static String key(IngestionPair pair) {
    return "cursors/" + pair.instrument().storageKey() + "/" + pair.source() + ".json";
  }
}
