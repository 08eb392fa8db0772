package com.tapas.superstore.etl.consumer;

import com.tapas.superstore.etl.service.EtlOutcome;
import com.tapas.superstore.etl.service.SalesEtlPipeline;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.listener.BatchListenerFailedException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Consumes base64-encoded sales records. Every message of a poll is its own
 * pipeline invocation.
 */
@Component
public class SalesRecordConsumer {

    private static final Logger log =
            LoggerFactory.getLogger(SalesRecordConsumer.class);

    private final SalesEtlPipeline pipeline;

    public SalesRecordConsumer(SalesEtlPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @KafkaListener(
            topics = "${etl.kafka.topic:superstore-sales}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, String>> messages) {
        for (int i = 0; i < messages.size(); i++) {
            ConsumerRecord<String, String> message = messages.get(i);
            String messageId = messageId(message);

            EtlOutcome outcome = pipeline.process(messageId, message.value());

            if (!outcome.isAcknowledgeable()) {
                // the error handler commits the messages before i and redelivers from i
                throw new BatchListenerFailedException(
                        "Failed to process message " + messageId, outcome.failure(), i);
            }
            if (outcome.status() == EtlOutcome.Status.REJECTED) {
                log.warn("Dropped poison message {}: {}", messageId, outcome.reason());
            }
        }
    }

    static String messageId(ConsumerRecord<?, ?> message) {
        return message.topic() + "-" + message.partition() + "@" + message.offset();
    }
}
