package com.verlumen.marketpipe.instruments;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.marketpipe.execution.RunMode;

@AutoValue
public abstract class InstrumentsModule extends AbstractModule {
  public static InstrumentsModule create(RunMode runMode, ImmutableList<String> instrumentSpecs) {
    return new AutoValue_InstrumentsModule(runMode, instrumentSpecs);
  }

  abstract RunMode runMode();

  abstract ImmutableList<String> instrumentSpecs();

  @Provides
  @Singleton
  ImmutableList<Instrument> provideInstruments() {
    if (RunMode.DRY.equals(runMode()) && instrumentSpecs().isEmpty()) {
      return ImmutableList.of(Instrument.crypto("DRY/RUN", "dryrun"));
    }

    return instrumentSpecs().stream().map(Instrument::parse).distinct().collect(toImmutableList());
  }
}
