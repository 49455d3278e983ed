package com.verlumen.marketpipe.ingestion;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.util.concurrent.Executors;

@AutoValue
public abstract class IngestionModule extends AbstractModule {
  public static IngestionModule create(IngestionConfig config) {
    return new AutoValue_IngestionModule(config);
  }

  abstract IngestionConfig config();

  @Override
  protected void configure() {
    bind(IngestionConfig.class).toInstance(config());
    bind(CursorStore.class).to(CursorStoreImpl.class);
    bind(IngestionCoordinator.class).to(IngestionCoordinatorImpl.class);
    bind(Sleeper.class).toInstance(Sleeper.SYSTEM);
  }

  @Provides
  @Singleton
  TimeLimiter provideTimeLimiter() {
    return SimpleTimeLimiter.create(
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("source-fetch-%d").setDaemon(true).build()));
  }
}
