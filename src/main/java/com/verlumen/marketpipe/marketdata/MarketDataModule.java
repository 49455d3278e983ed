package com.verlumen.marketpipe.marketdata;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.multibindings.MapBinder;

@AutoValue
public abstract class MarketDataModule extends AbstractModule {
  public static MarketDataModule create(MarketDataConfig config) {
    return new AutoValue_MarketDataModule(config);
  }

  abstract MarketDataConfig config();

  @Override
  protected void configure() {
    bind(MarketDataConfig.class).toInstance(config());

    MapBinder<String, SourceAdapter> adapters =
        MapBinder.newMapBinder(binder(), String.class, SourceAdapter.class);
    adapters.addBinding(BinanceKlineAdapter.SOURCE_NAME).to(BinanceKlineAdapter.class);
    adapters.addBinding(AlphaVantageDailyAdapter.SOURCE_NAME).to(AlphaVantageDailyAdapter.class);
    adapters.addBinding(DryRunSourceAdapter.SOURCE_NAME).to(DryRunSourceAdapter.class);
  }
}
