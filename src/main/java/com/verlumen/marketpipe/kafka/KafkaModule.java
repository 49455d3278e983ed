package com.verlumen.marketpipe.kafka;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;

@AutoValue
public abstract class KafkaModule extends AbstractModule {
  public static KafkaModule create(String bootstrapServers) {
    return new AutoValue_KafkaModule(bootstrapServers);
  }

  abstract String bootstrapServers();

  @Override
  protected void configure() {
    bind(KafkaProperties.class).toInstance(KafkaProperties.create(bootstrapServers()));
    bind(KafkaProducerFactory.class).to(KafkaProducerFactoryImpl.class);
  }
}
