package com.verlumen.marketpipe.processed;

import com.google.inject.AbstractModule;

public final class ProcessedStoreModule extends AbstractModule {
  public static ProcessedStoreModule create() {
    return new ProcessedStoreModule();
  }

  private ProcessedStoreModule() {}

  @Override
  protected void configure() {
    bind(ProcessedStore.class).to(ProcessedStoreImpl.class);
  }
}
