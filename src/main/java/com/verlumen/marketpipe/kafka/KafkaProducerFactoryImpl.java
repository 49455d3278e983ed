package com.verlumen.marketpipe.kafka;

import com.google.inject.Inject;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;

final class KafkaProducerFactoryImpl implements KafkaProducerFactory {
  private final KafkaProperties properties;

  @Inject
  KafkaProducerFactoryImpl(KafkaProperties properties) {
    this.properties = properties;
  }

  @Override
  public Producer<String, String> create() {
    return new KafkaProducer<>(properties.get());
  }
}
