package com.verlumen.marketpipe.features;

import com.google.inject.AbstractModule;

public final class FeaturesModule extends AbstractModule {
  public static FeaturesModule create() {
    return new FeaturesModule();
  }

  private FeaturesModule() {}

  @Override
  protected void configure() {
    bind(FeatureEngine.class).to(FeatureEngineImpl.class);
  }
}
