package com.verlumen.marketpipe.rawstore;

import com.google.inject.AbstractModule;

public final class RawStoreModule extends AbstractModule {
  public static RawStoreModule create() {
    return new RawStoreModule();
  }

  private RawStoreModule() {}

  @Override
  protected void configure() {
    bind(RawStore.class).to(RawStoreImpl.class);
  }
}
