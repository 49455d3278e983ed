package com.verlumen.marketpipe.kafka;

import org.apache.kafka.clients.producer.Producer;

public interface KafkaProducerFactory {
  Producer<String, String> create();
}
