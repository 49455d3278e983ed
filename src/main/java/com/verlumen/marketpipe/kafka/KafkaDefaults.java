package com.verlumen.marketpipe.kafka;

/**
 * KafkaDefaults holds the default configuration values for Kafka.
 */
public final class KafkaDefaults {

    /** Kafka bootstrap servers */
    public static final String BOOTSTRAP_SERVERS = "localhost:9092";

    /** Topic that actionable signals are published to */
    public static final String SIGNAL_TOPIC = "marketpipe-signals";

    /** Kafka acknowledgment configuration */
    public static final String ACKS = "all";

    /** Number of retries */
    public static final int RETRIES = 5;

    /** Linger time in milliseconds */
    public static final int LINGER_MS = 50;

    /** Signals are small JSON documents keyed by instrument symbol */
    public static final String KEY_SERIALIZER = "org.apache.kafka.common.serialization.StringSerializer";

    public static final String VALUE_SERIALIZER = "org.apache.kafka.common.serialization.StringSerializer";

    /** Protocol used to communicate with brokers (e.g., PLAINTEXT, SASL_SSL) */
    public static final String SECURITY_PROTOCOL = "PLAINTEXT";

    private KafkaDefaults() {
        throw new UnsupportedOperationException("KafkaDefaults is a utility class and cannot be instantiated.");
    }
}
