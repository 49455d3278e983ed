package com.verlumen.marketpipe.kafka;

import java.util.Properties;
import java.util.function.Supplier;

public record KafkaProperties(
    String bootstrapServers,
    String keySerializer,
    String valueSerializer,
    String securityProtocol,
    String saslMechanism,
    String saslJaasConfig,
    String acks,
    int lingerMs,
    int retries)
    implements Supplier<Properties> {

  public static KafkaProperties create(String bootstrapServers) {
    return new KafkaProperties(
        bootstrapServers,
        KafkaDefaults.KEY_SERIALIZER,
        KafkaDefaults.VALUE_SERIALIZER,
        KafkaDefaults.SECURITY_PROTOCOL,
        "",
        "",
        KafkaDefaults.ACKS,
        KafkaDefaults.LINGER_MS,
        KafkaDefaults.RETRIES);
  }

  @Override
  public Properties get() {
    Properties kafkaProperties = new Properties();
    kafkaProperties.setProperty("acks", acks);
    kafkaProperties.setProperty("bootstrap.servers", bootstrapServers);
    kafkaProperties.setProperty("retries", Integer.toString(retries));
    kafkaProperties.setProperty("linger.ms", Integer.toString(lingerMs));
    kafkaProperties.setProperty("key.serializer", keySerializer);
    kafkaProperties.setProperty("value.serializer", valueSerializer);
    kafkaProperties.setProperty("security.protocol", securityProtocol);
    // SASL settings only apply to authenticated clusters.
    if (!saslMechanism.isEmpty()) {
      kafkaProperties.setProperty("sasl.mechanism", saslMechanism);
      kafkaProperties.setProperty("sasl.jaas.config", saslJaasConfig);
    }
    return kafkaProperties;
  }
}
