package com.verlumen.marketpipe.storage;

import com.google.auto.value.AutoValue;
import com.google.common.flogger.FluentLogger;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.nio.file.Path;
import java.util.Optional;

@AutoValue
public abstract class StorageModule extends AbstractModule {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Uses {@code dataDirectory} when present, otherwise keeps everything in memory. */
  public static StorageModule create(Optional<Path> dataDirectory) {
    return new AutoValue_StorageModule(dataDirectory);
  }

  abstract Optional<Path> dataDirectory();

  @Provides
  @Singleton
  BlobStore provideBlobStore() {
    if (dataDirectory().isPresent()) {
      logger.atInfo().log("Using local blob store rooted at %s", dataDirectory().get());
      return new LocalFileBlobStore(dataDirectory().get());
    }
    logger.atInfo().log("No data directory configured, using in-memory blob store");
    return new InMemoryBlobStore();
  }
}
