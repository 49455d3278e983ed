package com.verlumen.marketpipe.signals;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import com.verlumen.marketpipe.kafka.KafkaProducerFactory;
import java.time.Duration;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;

/**
 * Kafka-based implementation of SignalPublisher that publishes signals as JSON to a specified topic.
 */
final class KafkaSignalPublisher implements SignalPublisher {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    private final Producer<String, String> kafkaProducer;
    private final String topic;

    @Inject
    KafkaSignalPublisher(KafkaProducerFactory kafkaProducerFactory, @Assisted String topic) {
        logger.atInfo().log("Initializing SignalPublisher for topic: %s", topic);
        this.kafkaProducer = kafkaProducerFactory.create();
        this.topic = topic;
    }

    @Override
    public void publish(Signal signal) {
        logger.atInfo().log("Publishing signal to topic %s. Decision=%s, Instrument=%s, Timestamp=%s",
            topic, signal.decision(), signal.instrument(), signal.timestamp());

        // Key by instrument so one instrument's signals stay ordered within a partition.
        ProducerRecord<String, String> record =
            new ProducerRecord<>(topic, signal.instrument().symbol(), SignalCodec.toJson(signal));

        try {
            kafkaProducer.send(record, (metadata, exception) -> {
                if (exception != null) {
                    logger.atSevere().withCause(exception)
                        .log("Failed to publish signal for %s to topic %s", signal.instrument(), topic);
                } else {
                    logger.atFine().log("Published signal: topic=%s, partition=%d, offset=%d",
                        metadata.topic(), metadata.partition(), metadata.offset());
                }
            });
        } catch (KafkaException e) {
            logger.atSevere().withCause(e).log("Failed to hand signal for %s to the producer", signal.instrument());
        }
    }

    @Override
    public void close() {
        logger.atInfo().log("Initiating Kafka producer shutdown");
        try {
            kafkaProducer.flush();
            kafkaProducer.close(Duration.ofSeconds(5));
            logger.atInfo().log("Kafka producer closed successfully");
        } catch (KafkaException e) {
            logger.atSevere().withCause(e).log("Error during Kafka producer shutdown");
        }
    }
}
